package com.pagesmith.core.exception;

import java.nio.file.Path;

/**
 * Thrown when a rendered page cannot be written to its output location.
 */
public class PageWriteException extends PageException {

    private final transient Path target;

    public PageWriteException(Path target, String message) {
        super(message + ": " + target);
        this.target = target;
    }

    public PageWriteException(Path target, String message, Throwable cause) {
        super(message + ": " + target, cause);
        this.target = target;
    }

    public Path getTarget() {
        return target;
    }
}
