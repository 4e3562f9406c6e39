package com.pagesmith.core.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PageMetadata}.
 */
class PageMetadataTest {

    private static final LocalDateTime DATETIME = LocalDateTime.of(2024, 5, 1, 9, 30);

    private static PageMetadata metadata(Map<String, Object> extra) {
        return new PageMetadata(
            "Hello World", "hello-world", AuthorIdentity.parse("Jane <jane@example.com>"),
            List.of("blog", "java"), true, DATETIME, List.of("a", "b"), "/blog/java/hello-world.html", extra);
    }

    @Test
    void get_withGuaranteedField_returnsValue() {
        PageMetadata meta = metadata(Map.of());

        assertThat(meta.get("title")).contains("Hello World");
        assertThat(meta.get("slug")).contains("hello-world");
        assertThat(meta.get("category")).contains(List.of("blog", "java"));
        assertThat(meta.get("published")).contains(true);
        assertThat(meta.get("datetime")).contains(DATETIME);
        assertThat(meta.get("url")).contains("/blog/java/hello-world.html");
    }

    @Test
    void get_withExtraField_returnsValue() {
        PageMetadata meta = metadata(Map.of("type", "post", "layout", "wide"));

        assertThat(meta.get("layout")).contains("wide");
        assertThat(meta.type()).contains("post");
    }

    @Test
    void get_withUnknownOrNullName_returnsEmpty() {
        PageMetadata meta = metadata(Map.of());

        assertThat(meta.get("nope")).isEmpty();
        assertThat(meta.get(null)).isEmpty();
        assertThat(meta.type()).isEmpty();
    }

    @Test
    void constructor_copiesCollections() {
        List<String> tags = new ArrayList<>(List.of("a"));
        Map<String, Object> extra = new HashMap<>(Map.of("type", "post"));

        PageMetadata meta = new PageMetadata("T", "t", AuthorIdentity.empty(), null, true, DATETIME, tags, "/t.html", extra);
        tags.add("b");
        extra.clear();

        assertThat(meta.tags()).containsExactly("a");
        assertThat(meta.category()).isEmpty();
        assertThat(meta.extra()).containsEntry("type", "post");
    }

    @Test
    void constructor_withEmptyTitle_throwsException() {
        assertThatThrownBy(() -> new PageMetadata("", "x", AuthorIdentity.empty(), List.of(), true, DATETIME, List.of(), "/x.html", Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("title must not be empty");
    }

    @Test
    void asRawMap_containsHeaderForm() {
        PageMetadata meta = metadata(Map.of("type", "post"));

        Map<String, Object> raw = meta.asRawMap();

        assertThat(raw)
            .containsEntry("title", "Hello World")
            .containsEntry("author", "Jane <jane@example.com>")
            .containsEntry("category", List.of("blog", "java"))
            .containsEntry("tags", List.of("a", "b"))
            .containsEntry("datetime", DATETIME)
            .containsEntry("type", "post");
    }

    @Test
    void asRawMap_withEmptyAuthor_omitsAuthor() {
        PageMetadata meta = new PageMetadata("T", "t", AuthorIdentity.empty(), List.of(), false, DATETIME, List.of(), "/t.html", Map.of());

        assertThat(meta.asRawMap()).doesNotContainKey("author").containsEntry("published", false);
    }
}
