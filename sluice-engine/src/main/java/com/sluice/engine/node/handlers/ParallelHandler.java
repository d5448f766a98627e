package com.sluice.engine.node.handlers;

import com.sluice.dag.node.Dag;
import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;
import com.sluice.engine.traversal.BranchScope;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepStatus;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs every branch of a {@code parallel} node to its end. The node succeeds iff every branch does.
 */
public final class ParallelHandler implements NodeHandler {

    @Override
    public Set<NodeKind> supportedKinds() {
        return Set.of(NodeKind.PARALLEL);
    }

    @Override
    public StepStatus handle(Node node, String path, BranchScope scope, HandlerContext ctx) {
        StepLog step = ctx.startComposite(node, path);
        List<String> names = new ArrayList<>(node.getBranches().keySet());
        List<Supplier<StepStatus>> branches = new ArrayList<>();
        for (Dag body : node.getBranches().values()) {
            String branchPath = scope.resolve(body.getInternalBranchName());
            branches.add(() -> ctx.runBranch(body, branchPath, scope));
        }
        List<StepStatus> results = ctx.runAll(branches);
        List<String> failed = new ArrayList<>();
        for (int i = 0; i < results.size(); i++) {
            if (results.get(i) != StepStatus.SUCCESS) failed.add(names.get(i));
        }
        return failed.isEmpty()
                ? ctx.completeComposite(step, StepStatus.SUCCESS, null)
                : ctx.completeComposite(step, StepStatus.FAILED, "failed branches: " + failed);
    }
}
