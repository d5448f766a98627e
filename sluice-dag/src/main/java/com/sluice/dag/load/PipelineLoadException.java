package com.sluice.dag.load;

/** A pipeline, variables or configuration file could not be read or parsed. */
public class PipelineLoadException extends RuntimeException {

    public PipelineLoadException(String message) {
        super(message);
    }

    public PipelineLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
