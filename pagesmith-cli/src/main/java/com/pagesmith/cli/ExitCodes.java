package com.pagesmith.cli;

/**
 * Process exit codes returned by the commands.
 */
public final class ExitCodes {

    public static final int OK = 0;
    /** At least one page failed; the others were processed. */
    public static final int PAGE_FAILURES = 1;
    /** The run could not start, e.g. a missing content directory. */
    public static final int ERROR = 2;

    private ExitCodes() {
    }
}
