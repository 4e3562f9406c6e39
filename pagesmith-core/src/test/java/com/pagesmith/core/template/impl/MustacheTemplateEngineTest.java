package com.pagesmith.core.template.impl;

import com.pagesmith.core.exception.PageException;
import com.pagesmith.core.exception.TemplateNotFoundException;
import com.pagesmith.core.template.Template;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link MustacheTemplateEngine}.
 */
class MustacheTemplateEngineTest {

    @TempDir
    Path templateDir;

    private MustacheTemplateEngine engine;

    @BeforeEach
    void setUp() {
        engine = new MustacheTemplateEngine(templateDir);
    }

    @Test
    void getTemplate_withExistingFile_rendersVariables() throws IOException {
        Files.writeString(templateDir.resolve("default.html"), "<h1>{{title}}</h1>{{#tags}}<i>{{.}}</i>{{/tags}}");

        Template template = engine.getTemplate("default");

        assertThat(template.getName()).isEqualTo("default");
        assertThat(template.render(Map.of("title", "Hi & Bye", "tags", List.of("a", "b"))))
            .isEqualTo("<h1>Hi &amp; Bye</h1><i>a</i><i>b</i>");
    }

    @Test
    void getTemplate_withTripleMustache_doesNotEscape() throws IOException {
        Files.writeString(templateDir.resolve("raw.html"), "{{{body}}}");

        assertThat(engine.getTemplate("raw").render(Map.of("body", "<p>x</p>"))).isEqualTo("<p>x</p>");
    }

    @Test
    void getTemplate_withMissingFile_throwsTemplateNotFound() {
        assertThatThrownBy(() -> engine.getTemplate("post"))
            .isInstanceOf(TemplateNotFoundException.class)
            .hasMessageContaining("post")
            .satisfies(e -> assertThat(((TemplateNotFoundException) e).getTemplateName()).isEqualTo("post"));
    }

    @Test
    void getTemplate_withPathOutsideTemplateDir_throwsTemplateNotFound() {
        assertThatThrownBy(() -> engine.getTemplate("../outside"))
            .isInstanceOf(TemplateNotFoundException.class);
    }

    @Test
    void getTemplate_withSyntaxError_throwsPageException() throws IOException {
        Files.writeString(templateDir.resolve("broken.html"), "{{#open}} never closed");

        assertThatThrownBy(() -> engine.getTemplate("broken"))
            .isInstanceOf(PageException.class)
            .isNotInstanceOf(TemplateNotFoundException.class);
    }

    @Test
    void getTemplate_withPartial_resolvesRelativeToTemplateDir() throws IOException {
        Files.writeString(templateDir.resolve("header.html"), "<header>{{title}}</header>");
        Files.writeString(templateDir.resolve("page.html"), "{{> header}}<main/>");

        assertThat(engine.getTemplate("page").render(Map.of("title", "T")))
            .isEqualTo("<header>T</header><main/>");
    }
}
