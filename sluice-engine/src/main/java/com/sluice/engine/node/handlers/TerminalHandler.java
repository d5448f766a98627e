package com.sluice.engine.node.handlers;

import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;
import com.sluice.engine.traversal.BranchScope;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepStatus;

import java.util.Set;

/**
 * Records reaching a {@code success} or {@code fail} node. The step itself always succeeds; the branch status
 * follows from which terminal was reached.
 */
public final class TerminalHandler implements NodeHandler {

    @Override
    public Set<NodeKind> supportedKinds() {
        return Set.of(NodeKind.SUCCESS, NodeKind.FAIL);
    }

    @Override
    public StepStatus handle(Node node, String path, BranchScope scope, HandlerContext ctx) {
        StepLog step = ctx.getStore().createStepLog(node.getName(), path, node.getKind().toValue());
        long now = ctx.now();
        step.markRunning(now);
        step.complete(StepStatus.SUCCESS, null, now);
        ctx.getStore().addStepLog(step, ctx.getRunId());
        return StepStatus.SUCCESS;
    }
}
