package com.pagesmith.core.exception;

/**
 * Base class for failures while building a single page.
 *
 * <p>Failures are local to one page. A driver building many pages catches this
 * type, reports it, and carries on with the remaining pages.
 */
public class PageException extends RuntimeException {

    public PageException(String message) {
        super(message);
    }

    public PageException(String message, Throwable cause) {
        super(message, cause);
    }
}
