package com.pagesmith.core.model;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized metadata of a single page.
 *
 * <p>Every guaranteed field is present and typed regardless of how complete the
 * source header was. Templates rely on this shape. Header keys that are not
 * guaranteed fields (for example {@code type}) are kept in {@link #extra()}.
 *
 * @param title page title, never empty
 * @param slug URL identifier
 * @param author page author, possibly empty
 * @param category category path segments, outermost first
 * @param published whether the page should be published
 * @param datetime publication timestamp
 * @param tags page tags
 * @param url page URL relative to the site root
 * @param extra remaining header entries in source order
 */
public record PageMetadata(
    String title,
    String slug,
    AuthorIdentity author,
    List<String> category,
    boolean published,
    LocalDateTime datetime,
    List<String> tags,
    String url,
    Map<String, Object> extra
) {

    public static final String TITLE = "title";
    public static final String SLUG = "slug";
    public static final String AUTHOR = "author";
    public static final String CATEGORY = "category";
    public static final String PUBLISHED = "published";
    public static final String DATETIME = "datetime";
    public static final String TAGS = "tags";
    public static final String URL = "url";

    /** Header keys consumed into guaranteed fields, aliases included. */
    public static final Set<String> RESERVED_KEYS =
        Set.of(TITLE, SLUG, AUTHOR, CATEGORY, PUBLISHED, DATETIME, "time", "date", TAGS, URL);

    /**
     * Compact constructor with validation.
     */
    public PageMetadata {
        Objects.requireNonNull(title, "title must not be null");
        Objects.requireNonNull(slug, "slug must not be null");
        Objects.requireNonNull(author, "author must not be null");
        Objects.requireNonNull(datetime, "datetime must not be null");
        Objects.requireNonNull(url, "url must not be null");
        if (title.isEmpty()) {
            throw new IllegalArgumentException("title must not be empty");
        }
        category = category == null ? List.of() : List.copyOf(category);
        tags = tags == null ? List.of() : List.copyOf(tags);
        extra = extra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    /**
     * Looks up a field by header name.
     *
     * <p>Guaranteed fields are checked first, then {@link #extra()}.
     *
     * @param name field name
     * @return field value, or empty if the page has no such field
     */
    public Optional<Object> get(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return switch (name) {
            case TITLE -> Optional.of(title);
            case SLUG -> Optional.of(slug);
            case AUTHOR -> Optional.of(author);
            case CATEGORY -> Optional.of(category);
            case PUBLISHED -> Optional.of(published);
            case DATETIME -> Optional.of(datetime);
            case TAGS -> Optional.of(tags);
            case URL -> Optional.of(url);
            default -> Optional.ofNullable(extra.get(name));
        };
    }

    /**
     * Returns the template type requested by the header.
     *
     * @return value of the {@code type} key, if it is a string
     */
    public Optional<String> type() {
        Object type = extra.get("type");
        return type instanceof String s && !s.isBlank() ? Optional.of(s) : Optional.empty();
    }

    /**
     * Converts this record back into a raw header map.
     *
     * <p>Normalizing the result with the same filename yields an equal record.
     * Category and tags stay lists so that segments containing a separator
     * survive the round trip.
     *
     * @return mutable map in header form
     */
    public Map<String, Object> asRawMap() {
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put(TITLE, title);
        raw.put(SLUG, slug);
        if (!author.isEmpty()) {
            raw.put(AUTHOR, author.raw());
        }
        raw.put(CATEGORY, category);
        raw.put(PUBLISHED, published);
        raw.put(DATETIME, datetime);
        raw.put(TAGS, tags);
        raw.put(URL, url);
        raw.putAll(extra);
        return raw;
    }
}
