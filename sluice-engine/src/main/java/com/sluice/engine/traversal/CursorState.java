package com.sluice.engine.traversal;

/**
 * States of a {@link BranchCursor}.
 */
public enum CursorState {
    /** Positioned at a node that has not been dispatched yet. */
    READY,
    /** The node is executing (or being replayed). */
    DISPATCHED,
    /** The node's outcome is known. */
    RESOLVED,
    /** Moved along an edge; the next node is current. */
    ADVANCED,
    /** A success or fail node was reached; the cursor is finished. */
    BRANCH_TERMINAL;

    boolean canDispatch() {
        return this == READY || this == ADVANCED;
    }
}
