package com.sluice.engine.traversal;

import com.sluice.dag.node.Dag;
import com.sluice.dag.node.Node;
import com.sluice.engine.node.handlers.HandlerContext;
import com.sluice.engine.node.handlers.NodeHandlerRegistry;
import com.sluice.runlog.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Walks one DAG with a {@link BranchCursor} until it reaches a terminal node. Each node is either replayed
 * from the prior run (re-run SKIP) or dispatched to the handler of its kind; composite handlers call back into
 * {@link #run} for their branches.
 */
public final class GraphTraversal {

    private static final Logger log = LoggerFactory.getLogger(GraphTraversal.class);

    private final NodeHandlerRegistry handlers;

    public GraphTraversal(NodeHandlerRegistry handlers) {
        this.handlers = Objects.requireNonNull(handlers, "handlers");
    }

    /**
     * @param branchPath concrete path of the branch; null for the root DAG
     * @return SUCCESS when the success node was reached, FAILED when the fail node was
     */
    public StepStatus run(Dag dag, String branchPath, BranchScope scope, HandlerContext ctx) {
        BranchCursor cursor = new BranchCursor(dag, branchPath);
        while (!cursor.isFinished()) {
            Node node = cursor.current();
            String path = scope.resolve(node.getInternalName());
            cursor.dispatch();
            StepStatus outcome;
            if (ctx.isSkipped(path)) {
                outcome = ctx.replay(path);
            } else {
                long start = ctx.now();
                outcome = handlers.forKind(node.getKind()).handle(node, path, scope, ctx);
                ctx.getMetrics().record(node.getKind(), outcome, ctx.now() - start);
            }
            cursor.resolve(outcome);
            cursor.advance();
            if (!cursor.isFinished()) {
                log.debug("Advanced | runId={} | from={} | outcome={} | to={}",
                        ctx.getRunId(), path, outcome, cursor.current().getName());
            }
        }
        return cursor.getTerminalStatus();
    }
}
