package com.sluice.engine.node.handlers;

import com.sluice.dag.node.Dag;
import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;
import com.sluice.dag.node.NodePaths;
import com.sluice.engine.traversal.BranchScope;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Runs the branch of a {@code map} node once per item of the JSON-array parameter named by {@code iterateOn},
 * with the item bound as {@code iterateAs}. Each item's branch path ends in the item's value, so values must be
 * distinct and free of path separators. The node succeeds iff every item does.
 */
public final class MapHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(MapHandler.class);

    @Override
    public Set<NodeKind> supportedKinds() {
        return Set.of(NodeKind.MAP);
    }

    @Override
    public StepStatus handle(Node node, String path, BranchScope scope, HandlerContext ctx) {
        StepLog step = ctx.startComposite(node, path);
        Object raw = scope.bind(ctx.getStore().getParameters(ctx.getRunId())).get(node.getIterateOn());
        if (!(raw instanceof List<?> items)) {
            return fail(ctx, step, path, "parameter '" + node.getIterateOn() + "' is "
                    + (raw == null ? "not defined" : "not a JSON array"));
        }
        Set<String> segments = new HashSet<>();
        for (Object item : items) {
            String segment = NodePaths.segment(item);
            if (!NodePaths.isValidSegment(segment)) {
                return fail(ctx, step, path, "iteration value '" + segment + "' cannot be used in a step path");
            }
            if (!segments.add(segment)) {
                return fail(ctx, step, path, "iteration value '" + segment + "' occurs more than once");
            }
        }
        Dag body = node.getBranch();
        List<Supplier<StepStatus>> branches = new ArrayList<>();
        for (Object item : items) {
            BranchScope itemScope = scope.with(node.getIterateAs(), item);
            String branchPath = itemScope.resolve(body.getInternalBranchName());
            branches.add(() -> ctx.runBranch(body, branchPath, itemScope));
        }
        log.info("Map fan-out | runId={} | path={} | items={}", ctx.getRunId(), path, items.size());
        List<StepStatus> results = ctx.runAll(branches);
        long failed = results.stream().filter(s -> s != StepStatus.SUCCESS).count();
        return failed == 0
                ? ctx.completeComposite(step, StepStatus.SUCCESS, null)
                : ctx.completeComposite(step, StepStatus.FAILED, failed + " of " + items.size() + " items failed");
    }

    private static StepStatus fail(HandlerContext ctx, StepLog step, String path, String message) {
        log.warn("Map step failed | runId={} | path={} | message={}", ctx.getRunId(), path, message);
        return ctx.completeComposite(step, StepStatus.FAILED, message);
    }
}
