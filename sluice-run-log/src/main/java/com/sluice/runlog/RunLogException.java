package com.sluice.runlog;

/**
 * Failure of a run log store: missing records, rejected writes or store I/O.
 */
public class RunLogException extends RuntimeException {

    public RunLogException(String message) {
        super(message);
    }

    public RunLogException(String message, Throwable cause) {
        super(message, cause);
    }
}
