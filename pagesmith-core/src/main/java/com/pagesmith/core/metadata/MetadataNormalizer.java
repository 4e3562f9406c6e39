package com.pagesmith.core.metadata;

import com.pagesmith.core.exception.MetadataParseException;
import com.pagesmith.core.model.AuthorIdentity;
import com.pagesmith.core.model.PageMetadata;
import com.pagesmith.core.util.SlugUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Turns a raw page header into a complete {@link PageMetadata}.
 *
 * <p>Fields missing from the header are filled in:
 * <ul>
 *   <li>{@code title} - file name without its last extension (whole file name if that is empty)</li>
 *   <li>{@code slug} - slugified title</li>
 *   <li>{@code author} - parsed from {@code "Name <email>"}, empty if absent</li>
 *   <li>{@code category} - split on {@code /}, empty if absent or null</li>
 *   <li>{@code published} - {@code true}</li>
 *   <li>{@code datetime} - {@code datetime}, overridden by {@code time}, overridden by {@code date};
 *       the current time of the injected clock when none is given</li>
 *   <li>{@code tags} - split on {@code ,} and trimmed, empty if absent</li>
 *   <li>{@code url} - {@code /<category>/.../<slug>.html}</li>
 * </ul>
 *
 * <p>Normalization is pure apart from reading the clock, and running it again on
 * {@link PageMetadata#asRawMap()} gives back an equal record. Instances are
 * immutable and may be shared between threads.
 */
public class MetadataNormalizer {

    private static final Logger log = LoggerFactory.getLogger(MetadataNormalizer.class);

    private static final List<String> DATETIME_KEYS = List.of(PageMetadata.DATETIME, "time", "date");

    private static final Pattern CATEGORY_SEPARATOR = Pattern.compile("/");
    private static final Pattern TAG_SEPARATOR = Pattern.compile(",");

    private static final List<DateTimeFormatter> DATETIME_FORMATS = List.of(
        DateTimeFormatter.ISO_LOCAL_DATE_TIME,
        DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm[:ss]", Locale.ROOT),
        DateTimeFormatter.ISO_OFFSET_DATE_TIME
    );

    private final Clock clock;

    /**
     * Creates a normalizer that stamps undated pages with the system clock.
     */
    public MetadataNormalizer() {
        this(Clock.systemDefaultZone());
    }

    /**
     * Creates a normalizer reading the current time from {@code clock}.
     *
     * @param clock clock for undated pages and for converting instants to local time
     */
    public MetadataNormalizer(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Normalizes a raw header.
     *
     * @param header parsed header entries, null when the page has no header
     * @param filename source file name, used to derive a missing title
     * @return complete metadata
     * @throws MetadataParseException if a field holds a value that cannot be interpreted
     */
    public PageMetadata normalize(Map<String, ?> header, String filename) {
        Objects.requireNonNull(filename, "filename must not be null");
        Map<String, ?> raw = header == null ? Map.of() : header;

        String title = normalizeTitle(raw.get(PageMetadata.TITLE), filename);
        String slug = normalizeSlug(raw.get(PageMetadata.SLUG), title);
        AuthorIdentity author = normalizeAuthor(raw.get(PageMetadata.AUTHOR));
        List<String> category = splitList(raw.get(PageMetadata.CATEGORY), CATEGORY_SEPARATOR);
        boolean published = normalizePublished(raw.get(PageMetadata.PUBLISHED), filename);
        LocalDateTime datetime = normalizeDatetime(raw, filename);
        List<String> tags = splitList(raw.get(PageMetadata.TAGS), TAG_SEPARATOR);
        log.debug("Tags for {}: {}", slug, tags);
        String url = normalizeUrl(raw.get(PageMetadata.URL), category, slug);

        Map<String, Object> extra = new LinkedHashMap<>();
        raw.forEach((key, value) -> {
            if (!PageMetadata.RESERVED_KEYS.contains(key)) {
                extra.put(key, value);
            }
        });

        return new PageMetadata(title, slug, author, category, published, datetime, tags, url, extra);
    }

    private String normalizeTitle(Object value, String filename) {
        if (value != null && !value.toString().isBlank()) {
            return value.toString();
        }

        int lastDot = filename.lastIndexOf('.');
        String title = lastDot < 0 ? "" : filename.substring(0, lastDot);
        if (title.isEmpty()) {
            title = filename;
        }
        log.warn("No title specified in {}. Using the file name as title: {}", filename, title);
        return title;
    }

    private String normalizeSlug(Object value, String title) {
        if (value == null || value.toString().isBlank()) {
            log.debug("No slug specified for '{}', generating it from the title", title);
            return SlugUtils.slugify(title);
        }

        String slug = value.toString();
        if (!slug.equals(SlugUtils.slugify(slug))) {
            log.warn("Slug '{}' should be lower case and match [a-z0-9-]*, e.g. '{}'", slug, SlugUtils.slugify(slug));
        }
        return slug;
    }

    private AuthorIdentity normalizeAuthor(Object value) {
        if (value instanceof String raw) {
            return AuthorIdentity.parse(raw);
        }
        return AuthorIdentity.empty();
    }

    private boolean normalizePublished(Object value, String filename) {
        if (value == null) {
            return true;
        }
        if (value instanceof Boolean published) {
            return published;
        }
        return switch (value.toString().trim().toLowerCase(Locale.ROOT)) {
            case "true", "yes", "on" -> true;
            case "false", "no", "off" -> false;
            default -> throw new MetadataParseException(
                "Field 'published' in " + filename + " must be a boolean, got: " + value);
        };
    }

    private LocalDateTime normalizeDatetime(Map<String, ?> raw, String filename) {
        Object value = null;
        String source = null;
        for (String key : DATETIME_KEYS) {
            Object candidate = raw.get(key);
            if (candidate != null) {
                value = candidate;
                source = key;
            }
        }

        if (value == null) {
            return LocalDateTime.now(clock);
        }
        LocalDateTime datetime = toLocalDateTime(value);
        if (datetime == null) {
            throw new MetadataParseException(
                "Field '" + source + "' in " + filename + " is not a recognised date or time: " + value);
        }
        return datetime;
    }

    private LocalDateTime toLocalDateTime(Object value) {
        if (value instanceof LocalDateTime localDateTime) {
            return localDateTime;
        }
        if (value instanceof LocalDate localDate) {
            return localDate.atStartOfDay();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.atZoneSameInstant(clock.getZone()).toLocalDateTime();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.withZoneSameInstant(clock.getZone()).toLocalDateTime();
        }
        if (value instanceof Instant instant) {
            return LocalDateTime.ofInstant(instant, clock.getZone());
        }
        if (value instanceof Date date) {
            return LocalDateTime.ofInstant(date.toInstant(), clock.getZone());
        }
        if (value instanceof String text) {
            return parseDatetime(text.trim());
        }
        return null;
    }

    private LocalDateTime parseDatetime(String text) {
        for (DateTimeFormatter format : DATETIME_FORMATS) {
            try {
                TemporalAccessor parsed = format.parse(text);
                if (parsed.isSupported(ChronoField.OFFSET_SECONDS)) {
                    return toLocalDateTime(OffsetDateTime.from(parsed));
                }
                return LocalDateTime.from(parsed);
            } catch (DateTimeParseException e) {
                log.trace("'{}' does not match {}", text, format);
            }
        }
        try {
            return LocalDate.parse(text).atStartOfDay();
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static List<String> splitList(Object value, Pattern separator) {
        if (value == null) {
            return List.of();
        }

        Collection<?> pieces;
        if (value instanceof Collection<?> collection) {
            pieces = collection;
        } else {
            pieces = List.of(separator.split(value.toString(), -1));
        }

        List<String> result = new ArrayList<>();
        for (Object piece : pieces) {
            if (piece == null) {
                continue;
            }
            String trimmed = piece.toString().trim();
            if (!trimmed.isEmpty()) {
                result.add(trimmed);
            }
        }
        return result;
    }

    private static String normalizeUrl(Object value, List<String> category, String slug) {
        if (value != null && !value.toString().isBlank()) {
            return value.toString();
        }

        StringBuilder url = new StringBuilder("/");
        for (String segment : category) {
            url.append(segment).append('/');
        }
        return url.append(slug).append(".html").toString();
    }
}
