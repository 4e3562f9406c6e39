package com.pagesmith.core.exception;

/**
 * Thrown when a metadata header is malformed: invalid YAML, a document that is
 * not a mapping, or a field value of an unusable type.
 */
public class MetadataParseException extends PageException {

    public MetadataParseException(String message) {
        super(message);
    }

    public MetadataParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
