package com.sluice.cli;

/**
 * Process exit codes of the {@code sluice} command, following sysexits where one applies.
 */
public final class ExitCodes {

    /** The pipeline run succeeded. */
    public static final int OK = 0;
    /** The pipeline ran and its run status is FAILED. */
    public static final int PIPELINE_FAILED = 1;
    /** Bad command line. */
    public static final int USAGE = 64;
    /** Unexpected internal error. */
    public static final int CODE_ERROR = 70;
    /** Unreadable or malformed pipeline, configuration, or a structural failure of the run. */
    public static final int CONFIG = 78;

    private ExitCodes() {
    }
}
