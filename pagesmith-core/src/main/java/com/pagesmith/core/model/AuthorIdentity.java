package com.pagesmith.core.model;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Author of a page, parsed from a free-form {@code "Name <email>"} string.
 *
 * <p>Parsing never fails. Input that does not end in an angle-bracketed address
 * is kept whole as the name:
 * <pre>{@code
 * AuthorIdentity.parse("Jane Doe <jane@example.com>"); // name "Jane Doe", email "jane@example.com"
 * AuthorIdentity.parse("Just A Name");                 // name "Just A Name", no email
 * AuthorIdentity.parse("<jane@example.com>");          // name "<jane@example.com>", no email
 * AuthorIdentity.parse("");                            // empty identity
 * }</pre>
 *
 * @param raw original author string, never null
 * @param name parsed name, null when {@code raw} is blank
 * @param email parsed email address, null when absent
 */
public record AuthorIdentity(
    String raw,
    String name,
    String email
) {

    private static final Pattern AUTHOR_PATTERN = Pattern.compile("^([^<>]*?)\\s*<([^<>]*@[^<>]*)>\\s*$");

    private static final AuthorIdentity EMPTY = new AuthorIdentity("", null, null);

    /**
     * Compact constructor with validation.
     */
    public AuthorIdentity {
        Objects.requireNonNull(raw, "raw must not be null");
    }

    /**
     * Returns the identity used when a page names no author.
     *
     * @return empty identity
     */
    public static AuthorIdentity empty() {
        return EMPTY;
    }

    /**
     * Parses an author string.
     *
     * @param raw author string, may be null
     * @return parsed identity, empty for null or blank input
     */
    public static AuthorIdentity parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return EMPTY;
        }

        Matcher matcher = AUTHOR_PATTERN.matcher(raw);
        if (matcher.matches() && !matcher.group(1).isBlank()) {
            return new AuthorIdentity(raw, matcher.group(1).trim(), matcher.group(2).trim());
        }
        return new AuthorIdentity(raw, raw.trim(), null);
    }

    /**
     * @return true when no author was given
     */
    public boolean isEmpty() {
        return raw.isBlank();
    }

    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public Optional<String> getEmail() {
        return Optional.ofNullable(email);
    }

    /**
     * Formats the identity as {@code name <email>}, {@code name}, or the raw string,
     * whichever is the first one available.
     */
    @Override
    public String toString() {
        if (name == null || name.isEmpty()) {
            return raw;
        }
        if (email == null || email.isEmpty()) {
            return name;
        }
        return name + " <" + email + ">";
    }
}
