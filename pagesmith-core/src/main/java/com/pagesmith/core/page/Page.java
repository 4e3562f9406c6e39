package com.pagesmith.core.page;

import com.pagesmith.core.exception.MetadataParseException;
import com.pagesmith.core.exception.PageWriteException;
import com.pagesmith.core.exception.SourceReadException;
import com.pagesmith.core.metadata.HeaderParser;
import com.pagesmith.core.model.AuthorIdentity;
import com.pagesmith.core.model.PageMetadata;
import com.pagesmith.core.renderer.BodyRenderer;
import com.pagesmith.core.template.Template;
import com.pagesmith.core.template.TemplateEngine;
import com.pagesmith.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A single page of the site: its source, normalized metadata, rendered body and
 * final HTML.
 *
 * <p>Building a page takes three calls:
 * <pre>{@code
 * SiteContext context = SiteContext.create(config);
 *
 * Page page = Page.load(Paths.get("content/hello.md"), context);  // read, split, normalize, render body
 * page.render(Map.of("site", config.site()));                      // apply the template
 * page.write();                                                    // <output_dir>/<url>
 * }</pre>
 *
 * <p>Metadata is reachable through typed getters for the guaranteed fields and
 * through {@link #field(String)} for any header key. Templates see the page as
 * {@code page}, e.g. {@code {{page.title}}} or {@code {{{page.content}}}}.
 *
 * <p>A page is confined to the thread that builds it.
 */
public class Page {

    private static final Logger log = LoggerFactory.getLogger(Page.class);

    /** Template variable holding the page itself. */
    public static final String PAGE_VARIABLE = "page";

    private final Path path;
    private final String filename;
    private final String original;
    private final PageMetadata meta;
    private final String content;
    private final SiteContext context;
    private final BodyRenderer renderer;
    private final List<Page> subpages = new ArrayList<>();
    private String html;

    private Page(Path path, String original, PageMetadata meta, String content,
                 SiteContext context, BodyRenderer renderer) {
        this.path = path;
        this.filename = path.getFileName().toString();
        this.original = original;
        this.meta = meta;
        this.content = content;
        this.context = context;
        this.renderer = renderer;
    }

    /**
     * Loads a page, choosing the body renderer from configuration or the file extension.
     *
     * @param path source file
     * @param context build context
     * @return loaded page with rendered body
     * @throws SourceReadException if the file cannot be read
     * @throws MetadataParseException if the header is malformed
     */
    public static Page load(Path path, SiteContext context) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(context, "context must not be null");
        BodyRenderer renderer = context.renderers().select(FileUtils.getExtension(path), context.config().renderer());
        return load(path, context, renderer);
    }

    /**
     * Loads a page.
     *
     * <p>Reads the file as UTF-8, splits off the header at the first {@code ---},
     * normalizes the header and renders the body.
     *
     * @param path source file
     * @param context build context
     * @param renderer body renderer, null for the plain renderer
     * @return loaded page with rendered body
     * @throws SourceReadException if the file cannot be read
     * @throws MetadataParseException if the header is malformed
     */
    public static Page load(Path path, SiteContext context, BodyRenderer renderer) {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(context, "context must not be null");
        BodyRenderer bodyRenderer = renderer != null ? renderer : context.renderers().fallback();

        String source;
        try {
            source = Files.readString(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new SourceReadException(path, e);
        }

        HeaderParser.SplitSource split = HeaderParser.split(source);
        Map<String, Object> header;
        try {
            header = HeaderParser.parse(split.header());
        } catch (MetadataParseException e) {
            throw new MetadataParseException(path + ": " + e.getMessage(), e);
        }
        PageMetadata meta = context.normalizer().normalize(header, path.getFileName().toString());

        log.info("Rendering {} with {}", meta.slug(), bodyRenderer.getId());
        String content = bodyRenderer.render(split.body());

        return new Page(path, split.body(), meta, content, context, bodyRenderer);
    }

    /**
     * Renders the page with its template and no extra variables.
     *
     * @return final HTML
     * @see #render(Map)
     */
    public String render() {
        return render(null);
    }

    /**
     * Renders the page with its template.
     *
     * <p>The template is the page {@code type}, or {@code default}. The caller's
     * variables are copied first and {@code page} is set last, so it always refers
     * to this page even if the caller passed a {@code page} entry.
     *
     * @param variables additional template variables, may be null
     * @return final HTML, also kept for {@link #write()}
     * @throws com.pagesmith.core.exception.TemplateNotFoundException if the template does not exist
     */
    public String render(Map<String, ?> variables) {
        String templateName = getType();
        Template template = context.templateEngine().getTemplate(templateName);

        Map<String, Object> scope = new LinkedHashMap<>();
        if (variables != null) {
            scope.putAll(variables);
        }
        scope.put(PAGE_VARIABLE, this);

        log.debug("Applying template '{}' to {}", templateName, meta.slug());
        html = template.render(scope);
        return html;
    }

    /**
     * Writes the rendered HTML to {@code <output_dir>/<url>}.
     *
     * <p>Missing directories are created. An existing file is replaced only once
     * the new content has been written completely.
     *
     * @return path of the written file
     * @throws IllegalStateException if the page has not been rendered
     * @throws PageWriteException if the file cannot be written
     */
    public Path write() {
        if (html == null) {
            throw new IllegalStateException("Page " + meta.slug() + " must be rendered before it is written");
        }

        Path target = getOutputPath();
        Path dir = target.getParent();
        try {
            FileUtils.ensureDirectory(dir);
        } catch (IOException e) {
            throw new PageWriteException(dir, "Failed to create output directory", e);
        }

        try {
            FileUtils.writeStringAtomically(target, html);
        } catch (IOException e) {
            throw new PageWriteException(target, "Failed to write page", e);
        }
        log.debug("Wrote {} ({} chars)", target, html.length());
        return target;
    }

    /**
     * Computes where {@link #write()} puts the page.
     *
     * @return absolute output file path
     * @throws PageWriteException if the URL points outside the output directory
     */
    public Path getOutputPath() {
        Path outputDir = context.config().outputPath().toAbsolutePath().normalize();
        String relative = meta.url().replaceFirst("^/+", "");
        Path target = outputDir.resolve(relative).normalize();
        if (relative.isEmpty() || !target.startsWith(outputDir) || target.equals(outputDir)) {
            throw new PageWriteException(target, "URL '" + meta.url() + "' does not name a file inside the output directory");
        }
        return target;
    }

    /**
     * Looks up a metadata field by header name.
     *
     * @param name field name, e.g. {@code title} or a custom header key
     * @return field value, or empty when the page has no such field
     */
    public Optional<Object> field(String name) {
        return meta.get(name);
    }

    /**
     * Adds a child page. Hierarchies are assembled by the caller.
     *
     * @param subpage child page
     */
    public void addSubpage(Page subpage) {
        subpages.add(Objects.requireNonNull(subpage, "subpage must not be null"));
    }

    public List<Page> getSubpages() {
        return Collections.unmodifiableList(subpages);
    }

    public Path getPath() {
        return path;
    }

    public String getFilename() {
        return filename;
    }

    /**
     * @return body text as read from the source, header removed
     */
    public String getOriginal() {
        return original;
    }

    public PageMetadata getMeta() {
        return meta;
    }

    /**
     * @return body rendered to HTML
     */
    public String getContent() {
        return content;
    }

    /**
     * @return final HTML, or null until {@link #render()} has been called
     */
    public String getHtml() {
        return html;
    }

    public BodyRenderer getRenderer() {
        return renderer;
    }

    public String getTitle() {
        return meta.title();
    }

    public String getSlug() {
        return meta.slug();
    }

    public AuthorIdentity getAuthor() {
        return meta.author();
    }

    public List<String> getCategory() {
        return meta.category();
    }

    public boolean isPublished() {
        return meta.published();
    }

    public LocalDateTime getDatetime() {
        return meta.datetime();
    }

    public List<String> getTags() {
        return meta.tags();
    }

    public String getUrl() {
        return meta.url();
    }

    /**
     * @return template name for this page
     */
    public String getType() {
        return meta.type().orElse(TemplateEngine.DEFAULT_TEMPLATE);
    }

    @Override
    public String toString() {
        return "Page[" + meta.slug() + "]";
    }
}
