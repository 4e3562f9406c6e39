package com.pagesmith.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Site configuration.
 *
 * <p>Loaded from {@code pagesmith.yaml} in the site root. Missing keys fall back
 * to their defaults.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * content_dir: content
 * template_dir: templates
 * output_dir: public
 * renderer: markdown
 *
 * site:
 *   title: "My Site"
 *   base_url: "https://example.org"
 * }</pre>
 *
 * @param contentDir directory holding page sources
 * @param templateDir directory holding {@code <type>.html} templates
 * @param outputDir directory receiving rendered pages
 * @param renderer body renderer id used for every page, null to choose by file extension
 * @param site free-form values exposed to templates as {@code site}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SiteConfig(
    @JsonProperty("content_dir") String contentDir,
    @JsonProperty("template_dir") String templateDir,
    @JsonProperty("output_dir") String outputDir,
    @JsonProperty("renderer") String renderer,
    @JsonProperty("site") Map<String, Object> site
) {

    public static final String DEFAULT_CONTENT_DIR = "content";
    public static final String DEFAULT_TEMPLATE_DIR = "templates";
    public static final String DEFAULT_OUTPUT_DIR = ".";

    /**
     * Compact constructor applying defaults.
     */
    public SiteConfig {
        contentDir = blankToDefault(contentDir, DEFAULT_CONTENT_DIR);
        templateDir = blankToDefault(templateDir, DEFAULT_TEMPLATE_DIR);
        outputDir = blankToDefault(outputDir, DEFAULT_OUTPUT_DIR);
        site = site == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(site));
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static SiteConfig defaults() {
        return new SiteConfig(null, null, null, null, null);
    }

    /**
     * Returns a copy writing to another output directory.
     *
     * @param outputDir new output directory
     * @return updated configuration
     */
    public SiteConfig withOutputDir(String outputDir) {
        return new SiteConfig(contentDir, templateDir, outputDir, renderer, site);
    }

    /**
     * Resolves the configured directories against a site root.
     *
     * @param root site root directory
     * @return configuration with absolute directories
     */
    public SiteConfig resolveAgainst(Path root) {
        return new SiteConfig(
            root.resolve(contentDir).toString(),
            root.resolve(templateDir).toString(),
            root.resolve(outputDir).toString(),
            renderer,
            site
        );
    }

    public Path contentPath() {
        return Path.of(contentDir);
    }

    public Path templatePath() {
        return Path.of(templateDir);
    }

    public Path outputPath() {
        return Path.of(outputDir);
    }

    private static String blankToDefault(String value, String defaultValue) {
        return value == null || value.isBlank() ? defaultValue : value;
    }
}
