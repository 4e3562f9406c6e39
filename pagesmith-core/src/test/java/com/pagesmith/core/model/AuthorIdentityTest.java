package com.pagesmith.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link AuthorIdentity}.
 */
class AuthorIdentityTest {

    @Test
    void parse_withNameAndEmail_splitsFields() {
        AuthorIdentity author = AuthorIdentity.parse("Jane Doe <jane@example.com>");

        assertThat(author.name()).isEqualTo("Jane Doe");
        assertThat(author.email()).isEqualTo("jane@example.com");
        assertThat(author.raw()).isEqualTo("Jane Doe <jane@example.com>");
        assertThat(author).hasToString("Jane Doe <jane@example.com>");
    }

    @Test
    void parse_withNameOnly_keepsWholeStringAsName() {
        AuthorIdentity author = AuthorIdentity.parse("Just A Name");

        assertThat(author.name()).isEqualTo("Just A Name");
        assertThat(author.getEmail()).isEmpty();
        assertThat(author).hasToString("Just A Name");
    }

    @Test
    void parse_withExtraWhitespace_trimsName() {
        AuthorIdentity author = AuthorIdentity.parse("  Jane Doe    <jane@example.com>");

        assertThat(author.name()).isEqualTo("Jane Doe");
        assertThat(author).hasToString("Jane Doe <jane@example.com>");
    }

    @Test
    void parse_withoutAtSign_treatsBracketsAsPartOfName() {
        AuthorIdentity author = AuthorIdentity.parse("Jane <not an address>");

        assertThat(author.name()).isEqualTo("Jane <not an address>");
        assertThat(author.email()).isNull();
    }

    @Test
    void parse_withEmailOnly_fallsBackToRawName() {
        AuthorIdentity author = AuthorIdentity.parse("<jane@example.com>");

        assertThat(author.name()).isEqualTo("<jane@example.com>");
        assertThat(author.email()).isNull();
        assertThat(author).hasToString("<jane@example.com>");
    }

    @Test
    void parse_withEmptyOrNull_returnsEmptyIdentity() {
        assertThat(AuthorIdentity.parse("")).isEqualTo(AuthorIdentity.empty());
        assertThat(AuthorIdentity.parse("   ")).isEqualTo(AuthorIdentity.empty());
        assertThat(AuthorIdentity.parse(null)).isEqualTo(AuthorIdentity.empty());
    }

    @Test
    void empty_hasNoNameOrEmail() {
        AuthorIdentity author = AuthorIdentity.empty();

        assertThat(author.isEmpty()).isTrue();
        assertThat(author.getName()).isEmpty();
        assertThat(author.getEmail()).isEmpty();
        assertThat(author).hasToString("");
    }

    @Test
    void toString_withNameButNoEmail_returnsName() {
        assertThat(new AuthorIdentity("raw value", "Jane", null)).hasToString("Jane");
    }

    @Test
    void toString_withoutName_returnsRaw() {
        assertThat(new AuthorIdentity("raw value", null, "jane@example.com")).hasToString("raw value");
    }

    @Test
    void constructor_withNullRaw_throwsException() {
        assertThatThrownBy(() -> new AuthorIdentity(null, "Jane", null))
            .isInstanceOf(NullPointerException.class)
            .hasMessageContaining("raw must not be null");
    }
}
