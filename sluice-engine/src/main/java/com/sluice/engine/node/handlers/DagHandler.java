package com.sluice.engine.node.handlers;

import com.sluice.dag.node.Dag;
import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;
import com.sluice.engine.traversal.BranchScope;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepStatus;

import java.util.Set;

/** Runs an embedded DAG as a single branch; its outcome is the node's outcome. */
public final class DagHandler implements NodeHandler {

    @Override
    public Set<NodeKind> supportedKinds() {
        return Set.of(NodeKind.DAG);
    }

    @Override
    public StepStatus handle(Node node, String path, BranchScope scope, HandlerContext ctx) {
        StepLog step = ctx.startComposite(node, path);
        Dag body = node.getBranch();
        StepStatus status = ctx.runBranch(body, scope.resolve(body.getInternalBranchName()), scope);
        return ctx.completeComposite(step, status, status == StepStatus.SUCCESS ? null : "embedded dag failed");
    }
}
