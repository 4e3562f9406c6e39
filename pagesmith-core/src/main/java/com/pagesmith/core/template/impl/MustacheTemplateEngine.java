package com.pagesmith.core.template.impl;

import com.github.mustachejava.DefaultMustacheFactory;
import com.github.mustachejava.Mustache;
import com.github.mustachejava.MustacheException;
import com.github.mustachejava.MustacheFactory;
import com.github.mustachejava.MustacheNotFoundException;
import com.pagesmith.core.exception.PageException;
import com.pagesmith.core.exception.TemplateNotFoundException;
import com.pagesmith.core.template.Template;
import com.pagesmith.core.template.TemplateEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Template engine backed by Mustache templates on disk.
 *
 * <p>A template named {@code post} is read from {@code <templateDir>/post.html}.
 * Compiled templates are cached by the underlying factory, which is safe to use
 * from several threads.
 *
 * <p><b>Example template:</b>
 * <pre>{@code
 * <h1>{{page.title}}</h1>
 * <p class="byline">{{page.author}}</p>
 * {{{page.content}}}
 * }</pre>
 */
public class MustacheTemplateEngine implements TemplateEngine {

    private static final Logger log = LoggerFactory.getLogger(MustacheTemplateEngine.class);

    public static final String TEMPLATE_EXTENSION = ".html";

    private final Path templateDir;
    private final MustacheFactory factory;

    /**
     * @param templateDir directory holding {@code <name>.html} templates
     */
    public MustacheTemplateEngine(Path templateDir) {
        this.templateDir = Objects.requireNonNull(templateDir, "templateDir must not be null").toAbsolutePath().normalize();
        this.factory = new DefaultMustacheFactory(this.templateDir.toFile());
        log.debug("Template directory: {}", this.templateDir);
    }

    public Path getTemplateDir() {
        return templateDir;
    }

    @Override
    public Template getTemplate(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String fileName = name + TEMPLATE_EXTENSION;
        Path file = templateDir.resolve(fileName).normalize();
        if (!file.startsWith(templateDir) || !Files.isRegularFile(file)) {
            throw new TemplateNotFoundException(name, templateDir.toString());
        }

        try {
            Mustache mustache = factory.compile(fileName);
            return new MustacheTemplate(name, mustache);
        } catch (MustacheNotFoundException e) {
            throw new TemplateNotFoundException(name, templateDir.toString(), e);
        } catch (MustacheException e) {
            throw new PageException("Failed to compile template " + file + ": " + e.getMessage(), e);
        }
    }

    private record MustacheTemplate(String name, Mustache mustache) implements Template {

        @Override
        public String getName() {
            return name;
        }

        @Override
        public String render(Map<String, Object> variables) {
            try {
                StringWriter writer = new StringWriter();
                mustache.execute(writer, variables);
                return writer.toString();
            } catch (MustacheException e) {
                throw new PageException("Failed to render template " + name + ": " + e.getMessage(), e);
            }
        }
    }
}
