package com.pagesmith.core.exception;

import java.nio.file.Path;

/**
 * Thrown when a source file is missing or cannot be read.
 */
public class SourceReadException extends PageException {

    private final transient Path path;

    public SourceReadException(Path path, Throwable cause) {
        super("Failed to read source file: " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
