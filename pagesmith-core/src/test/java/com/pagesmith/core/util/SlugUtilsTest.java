package com.pagesmith.core.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link SlugUtils}.
 */
class SlugUtilsTest {

    @Test
    void slugify_withWords_lowercasesAndDashes() {
        assertThat(SlugUtils.slugify("Hello World")).isEqualTo("hello-world");
    }

    @Test
    void slugify_withPunctuationRuns_collapsesToSingleDash() {
        assertThat(SlugUtils.slugify("C++ & Java: a -- story!")).isEqualTo("c-java-a-story");
    }

    @Test
    void slugify_withEdgeSeparators_trimsDashes() {
        assertThat(SlugUtils.slugify("  --Hi--  ")).isEqualTo("hi");
    }

    @Test
    void slugify_withAccents_stripsThem() {
        assertThat(SlugUtils.slugify("Crème Brûlée")).isEqualTo("creme-brulee");
    }

    @Test
    void slugify_withNullOrSymbolsOnly_returnsEmpty() {
        assertThat(SlugUtils.slugify(null)).isEmpty();
        assertThat(SlugUtils.slugify("!!!")).isEmpty();
    }

    @Test
    void slugify_isStableOnSlugs() {
        assertThat(SlugUtils.slugify("already-a-slug-42")).isEqualTo("already-a-slug-42");
    }

    @Test
    void isSlug_checksAlphabet() {
        assertThat(SlugUtils.isSlug("abc-123")).isTrue();
        assertThat(SlugUtils.isSlug("")).isTrue();
        assertThat(SlugUtils.isSlug("Abc")).isFalse();
        assertThat(SlugUtils.isSlug("a_b")).isFalse();
        assertThat(SlugUtils.isSlug(null)).isFalse();
    }
}
