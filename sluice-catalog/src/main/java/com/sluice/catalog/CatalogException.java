package com.sluice.catalog;

/**
 * A catalog precondition or I/O failure. These are configuration problems; the engine fails the run rather than
 * routing them as a step failure.
 */
public class CatalogException extends RuntimeException {

    public enum Reason {
        /** The node's compute data folder does not exist. */
        NO_COMPUTE_FOLDER,
        /** A get was attempted before anything was put in this run's catalog. */
        EMPTY_GET,
        IO
    }

    private final Reason reason;

    public CatalogException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public CatalogException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }
}
