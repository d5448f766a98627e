package com.sluice.engine.rerun;

/**
 * What a re-run does at a node path.
 */
public enum Action {
    /** Reuse the prior run's successful step log; the node is not dispatched. */
    SKIP,
    /** Run the node afresh. */
    EXECUTE
}
