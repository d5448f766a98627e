package com.sluice.engine.traversal;

import com.sluice.dag.node.Dag;
import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;
import com.sluice.engine.EngineInvariantException;
import com.sluice.runlog.StepStatus;

import java.util.Objects;

/**
 * Position of one traversal within one DAG (the root, a parallel branch, a map item or an embedded dag).
 * Moves READY/ADVANCED -> DISPATCHED -> RESOLVED -> ADVANCED ... -> BRANCH_TERMINAL. A cursor may advance at
 * most as many times as its DAG has nodes.
 */
public final class BranchCursor {

    private final Dag dag;
    private final String branchPath;
    private Node current;
    private CursorState state;
    private StepStatus outcome;
    private StepStatus terminalStatus;
    private int dispatches;

    public BranchCursor(Dag dag, String branchPath) {
        this.dag = Objects.requireNonNull(dag, "dag");
        this.branchPath = branchPath;
        this.current = dag.getStartNode();
        this.state = CursorState.READY;
        if (current == null) {
            throw new EngineInvariantException("DAG " + describe() + " has no start node");
        }
    }

    /** Branch path this cursor runs under; null for the root DAG. */
    public String getBranchPath() {
        return branchPath;
    }

    public Dag getDag() {
        return dag;
    }

    public Node current() {
        return current;
    }

    public CursorState getState() {
        return state;
    }

    public StepStatus getOutcome() {
        return outcome;
    }

    public StepStatus getTerminalStatus() {
        return terminalStatus;
    }

    public void dispatch() {
        require(state.canDispatch(), "dispatch");
        if (++dispatches > dag.size()) {
            throw new EngineInvariantException("Traversal of " + describe() + " exceeded " + dag.size()
                    + " steps at '" + current.getName() + "'");
        }
        state = CursorState.DISPATCHED;
    }

    public void resolve(StepStatus status) {
        require(state == CursorState.DISPATCHED, "resolve");
        if (status == null || !status.isTerminal()) {
            throw new EngineInvariantException("Step '" + current.getName() + "' resolved without a terminal status: " + status);
        }
        outcome = status;
        state = CursorState.RESOLVED;
    }

    /**
     * After a resolved success or fail node: finishes the cursor with SUCCESS or FAILED.
     * After any other node: follows {@code next} on success, else {@code onFailure}, else the DAG's fail node.
     */
    public void advance() {
        require(state == CursorState.RESOLVED, "advance");
        if (current.isTerminal()) {
            terminalStatus = current.getKind() == NodeKind.SUCCESS ? StepStatus.SUCCESS : StepStatus.FAILED;
            state = CursorState.BRANCH_TERMINAL;
            return;
        }
        String target;
        if (outcome == StepStatus.SUCCESS) {
            target = current.getNext();
        } else if (current.getOnFailure() != null) {
            target = current.getOnFailure();
        } else {
            target = dag.getFailNode() != null ? dag.getFailNode().getName() : null;
        }
        Node next = dag.getNode(target);
        if (next == null) {
            throw new EngineInvariantException("Step '" + current.getName() + "' of " + describe()
                    + " leads to unknown step '" + target + "'");
        }
        current = next;
        outcome = null;
        state = CursorState.ADVANCED;
    }

    public boolean isFinished() {
        return state == CursorState.BRANCH_TERMINAL;
    }

    private void require(boolean ok, String transition) {
        if (!ok) {
            throw new EngineInvariantException("Cannot " + transition + " cursor of " + describe() + " in state " + state);
        }
    }

    private String describe() {
        return branchPath != null ? "branch " + branchPath : "root DAG";
    }
}
