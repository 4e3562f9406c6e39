package com.pagesmith.core.renderer;

import com.pagesmith.core.renderer.impl.MarkdownRenderer;
import com.pagesmith.core.renderer.impl.PlainRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link BodyRenderers}.
 */
class BodyRenderersTest {

    private final BodyRenderers renderers = new BodyRenderers(List.of(new PlainRenderer(), new MarkdownRenderer()));

    @Test
    void select_byExtension_returnsMatchingRenderer() {
        assertThat(renderers.select("md", null)).isInstanceOf(MarkdownRenderer.class);
        assertThat(renderers.select("MKD", null)).isInstanceOf(MarkdownRenderer.class);
        assertThat(renderers.select("txt", null)).isInstanceOf(PlainRenderer.class);
    }

    @Test
    void select_withUnknownExtension_fallsBackToPlain() {
        assertThat(renderers.select("rst", null).getId()).isEqualTo("plain");
        assertThat(renderers.select("", " ").getId()).isEqualTo("plain");
    }

    @Test
    void select_withForcedId_ignoresExtension() {
        assertThat(renderers.select("txt", "markdown")).isInstanceOf(MarkdownRenderer.class);
    }

    @Test
    void select_withUnknownForcedId_throwsException() {
        assertThatThrownBy(() -> renderers.select("md", "textile"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("textile");
    }

    @Test
    void constructor_withoutPlainRenderer_stillHasFallback() {
        BodyRenderers onlyMarkdown = new BodyRenderers(List.of(new MarkdownRenderer()));

        assertThat(onlyMarkdown.fallback()).isInstanceOf(PlainRenderer.class);
        assertThat(onlyMarkdown.byId("plain")).isEmpty();
    }

    @Test
    void constructor_withDuplicateId_keepsFirst() {
        BodyRenderer shadow = new PlainRenderer() {
            @Override
            public Set<String> getExtensions() {
                return Set.of("shadow");
            }
        };

        BodyRenderers registry = new BodyRenderers(List.of(new PlainRenderer(), shadow));

        assertThat(registry.all()).hasSize(1);
        assertThat(registry.byExtension("shadow")).isEmpty();
    }

    @Test
    void extensions_listsEveryClaimedExtension() {
        assertThat(renderers.extensions()).containsExactly("markdown", "md", "mkd", "text", "txt");
    }

    @Test
    void discover_findsRegisteredRenderers() {
        BodyRenderers discovered = BodyRenderers.discover();

        assertThat(discovered.all())
            .extracting(BodyRenderer::getId)
            .containsExactlyInAnyOrder("plain", "markdown")
            .doesNotHaveDuplicates();
    }
}
