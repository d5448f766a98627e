package com.sluice.engine.rerun;

import com.sluice.dag.node.Dag;
import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;
import com.sluice.dag.node.NodePaths;
import com.sluice.engine.EngineInvariantException;
import com.sluice.runlog.BranchLog;
import com.sluice.runlog.RunLog;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Decides, per node path, whether a re-run reuses the prior run's result or executes afresh.
 * <p>
 * Each DAG is walked along the route the prior run took, in declaration order of branches. Paths whose prior
 * step log is SUCCESS are skipped until the first path that was not; that path and everything reachable after
 * it in the same DAG execute. A composite node executes when any of its children does; inside it, every branch
 * is planned the same way on its own.
 */
public final class RerunPlanner {

    private static final Logger log = LoggerFactory.getLogger(RerunPlanner.class);

    /**
     * @throws EngineInvariantException when the prior run log records a path the DAG does not have
     */
    public RerunPlan plan(Dag dag, RunLog prior) {
        for (String path : prior.flatten().keySet()) {
            if (dag.locate(path) == null) {
                throw new EngineInvariantException("Run log " + prior.getRunId() + " records step '" + path
                        + "' which is not part of the DAG being re-run");
            }
        }
        Map<String, Action> actions = new LinkedHashMap<>();
        walk(dag, null, prior, actions);
        RerunPlan plan = new RerunPlan(prior, actions);
        log.info("Re-run planned | priorRunId={} | skip={} | execute={}",
                prior.getRunId(), plan.count(Action.SKIP), plan.count(Action.EXECUTE));
        return plan;
    }

    /**
     * Plans one DAG. Returns true when some path of it executes.
     */
    private boolean walk(Dag dag, String branchPath, RunLog prior, Map<String, Action> actions) {
        Set<String> visited = new HashSet<>();
        Node node = dag.getStartNode();
        while (node != null && visited.add(node.getName())) {
            String path = branchPath == null ? node.getName() : NodePaths.child(branchPath, node.getName());
            StepLog priorStep = prior.searchStep(path);
            boolean childExecutes = node.isComposite() && priorStep != null && planChildren(node, path, priorStep, prior, actions);
            if (priorStep == null || priorStep.getStatus() != StepStatus.SUCCESS || childExecutes) {
                actions.put(path, Action.EXECUTE);
                markReachable(dag, node, branchPath, actions);
                return true;
            }
            actions.put(path, Action.SKIP);
            if (node.isTerminal()) {
                return false;
            }
            node = dag.getNode(node.getNext());
        }
        return false;
    }

    private boolean planChildren(Node node, String path, StepLog priorStep, RunLog prior, Map<String, Action> actions) {
        boolean executes = false;
        if (node.getKind() == NodeKind.PARALLEL) {
            for (Map.Entry<String, Dag> branch : node.getBranches().entrySet()) {
                executes |= walk(branch.getValue(), NodePaths.child(path, branch.getKey()), prior, actions);
            }
        } else if (node.getKind() == NodeKind.DAG) {
            executes = walk(node.getBranch(), NodePaths.child(path, NodePaths.DAG_BRANCH), prior, actions);
        } else if (node.getKind() == NodeKind.MAP) {
            for (BranchLog branch : priorStep.getBranches().values()) {
                executes |= walk(node.getBranch(), branch.getInternalName(), prior, actions);
            }
        }
        return executes;
    }

    /** Marks every node reachable from {@code from} (inclusive) in this DAG, and their known children, EXECUTE. */
    private void markReachable(Dag dag, Node from, String branchPath, Map<String, Action> actions) {
        Deque<Node> queue = new ArrayDeque<>();
        Set<String> seen = new HashSet<>();
        queue.add(from);
        while (!queue.isEmpty()) {
            Node node = queue.poll();
            if (!seen.add(node.getName())) continue;
            String path = branchPath == null ? node.getName() : NodePaths.child(branchPath, node.getName());
            actions.putIfAbsent(path, Action.EXECUTE);
            if (node.getKind() == NodeKind.PARALLEL) {
                node.getBranches().forEach((name, body) ->
                        markReachable(body, body.getStartNode(), NodePaths.child(path, name), actions));
            } else if (node.getKind() == NodeKind.DAG) {
                markReachable(node.getBranch(), node.getBranch().getStartNode(),
                        NodePaths.child(path, NodePaths.DAG_BRANCH), actions);
            }
            for (String next : new String[]{node.getNext(), node.getOnFailure()}) {
                Node n = dag.getNode(next);
                if (n != null) queue.add(n);
            }
        }
    }
}
