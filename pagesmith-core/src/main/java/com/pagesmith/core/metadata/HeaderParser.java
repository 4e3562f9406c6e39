package com.pagesmith.core.metadata;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pagesmith.core.exception.MetadataParseException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Splits page sources into header and body and parses the header as YAML.
 *
 * <p>A source is split on the first literal {@code ---}; everything before it is
 * the header, everything after it is the body. Further {@code ---} sequences
 * stay in the body. Sources without the delimiter are all body.
 *
 * <pre>{@code
 * title: Hello
 * tags: intro, meta
 * ---
 * Body text...
 * }</pre>
 *
 * <p>A source opening with {@code ---} therefore has an empty header and the
 * rest of the text as body, even when a later line repeats the delimiter.
 */
public final class HeaderParser {

    public static final String DELIMITER = "---";

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final TypeReference<LinkedHashMap<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private HeaderParser() {
        // Utility class
    }

    /**
     * Source text split into header and body.
     *
     * @param header header text, null when the source has no delimiter
     * @param body body text
     */
    public record SplitSource(String header, String body) {

        public SplitSource {
            Objects.requireNonNull(body, "body must not be null");
        }

        public boolean hasHeader() {
            return header != null;
        }
    }

    /**
     * Splits source text on the first header delimiter.
     *
     * @param source full source text
     * @return header and body
     */
    public static SplitSource split(String source) {
        Objects.requireNonNull(source, "source must not be null");
        String text = source.startsWith("\uFEFF") ? source.substring(1) : source;

        int index = text.indexOf(DELIMITER);
        if (index < 0) {
            return new SplitSource(null, text);
        }
        return new SplitSource(text.substring(0, index), text.substring(index + DELIMITER.length()));
    }

    /**
     * Parses header text as a YAML mapping.
     *
     * @param header header text, may be null or blank
     * @return ordered key-value entries, empty for a missing or blank header
     * @throws MetadataParseException if the text is not valid YAML or not a mapping
     */
    public static Map<String, Object> parse(String header) {
        if (header == null || header.isBlank()) {
            return new LinkedHashMap<>();
        }

        JsonNode node;
        try {
            node = YAML_MAPPER.readTree(header);
        } catch (JsonProcessingException e) {
            throw new MetadataParseException("Header is not valid YAML: " + e.getOriginalMessage(), e);
        }

        if (node == null || node.isMissingNode() || node.isNull()) {
            return new LinkedHashMap<>();
        }
        if (!node.isObject()) {
            throw new MetadataParseException("Header must be a mapping of keys to values, found " + node.getNodeType());
        }
        return YAML_MAPPER.convertValue(node, MAP_TYPE);
    }
}
