package com.sluice.engine;

/**
 * The engine reached a state the compiled DAG rules out, or a prior run log does not match the DAG it is
 * replayed against. Fatal for the run.
 */
public class EngineInvariantException extends RuntimeException {

    public EngineInvariantException(String message) {
        super(message);
    }
}
