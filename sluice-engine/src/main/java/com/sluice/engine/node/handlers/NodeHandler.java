package com.sluice.engine.node.handlers;

import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;
import com.sluice.engine.traversal.BranchScope;
import com.sluice.runlog.StepStatus;

import java.util.Set;

/**
 * Executes nodes of one or more kinds. A handler records the node's step log and returns its outcome; a node's
 * own failure is returned as FAILED, never thrown.
 */
public interface NodeHandler {

    Set<NodeKind> supportedKinds();

    /**
     * @param path  concrete node path
     * @param scope iteration values bound for the enclosing branch
     * @return SUCCESS or FAILED
     */
    StepStatus handle(Node node, String path, BranchScope scope, HandlerContext ctx);
}
