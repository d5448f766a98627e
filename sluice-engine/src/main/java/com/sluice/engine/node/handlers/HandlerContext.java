package com.sluice.engine.node.handlers;

import com.sluice.dag.declaration.CatalogSettings;
import com.sluice.dag.node.Dag;
import com.sluice.dag.node.Node;
import com.sluice.engine.EngineInvariantException;
import com.sluice.engine.EngineServices;
import com.sluice.engine.NodeMetrics;
import com.sluice.engine.rerun.Action;
import com.sluice.engine.rerun.RerunPlan;
import com.sluice.engine.traversal.BranchScope;
import com.sluice.engine.traversal.GraphTraversal;
import com.sluice.runlog.BranchLog;
import com.sluice.runlog.RunLogStore;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Supplier;

/**
 * Shared state of one run for node handlers: services, run id, the branch executor (null in sequential mode),
 * metrics, the re-run plan (null for a fresh run) and the traversal used to run branches.
 */
public final class HandlerContext {

    private static final Logger log = LoggerFactory.getLogger(HandlerContext.class);

    private final EngineServices services;
    private final String runId;
    private final ExecutorService executor;
    private final NodeMetrics metrics;
    private final RerunPlan plan;
    private final GraphTraversal traversal;

    public HandlerContext(EngineServices services, String runId, ExecutorService executor, NodeMetrics metrics,
                          RerunPlan plan, GraphTraversal traversal) {
        this.services = services;
        this.runId = runId;
        this.executor = executor;
        this.metrics = metrics;
        this.plan = plan;
        this.traversal = traversal;
    }

    public EngineServices getServices() { return services; }
    public String getRunId() { return runId; }
    public RunLogStore getStore() { return services.getRunLogStore(); }
    public NodeMetrics getMetrics() { return metrics; }
    public RerunPlan getPlan() { return plan; }

    public long now() {
        return System.currentTimeMillis();
    }

    /** Compute data folder of a node: its catalog override or the run default, against the working directory. */
    public Path computeDataFolder(Node node) {
        CatalogSettings settings = node.getCatalog();
        String folder = settings != null && settings.getComputeDataFolder() != null
                ? settings.getComputeDataFolder()
                : services.getComputeDataFolder();
        return services.getWorkingDirectory().resolve(folder);
    }

    public boolean isSkipped(String path) {
        return plan != null && plan.actionFor(path) == Action.SKIP;
    }

    /** Copies the prior run's step log of a skipped path into this run, marked as replayed. */
    public StepStatus replay(String path) {
        StepLog prior = plan.priorStep(path);
        if (prior == null) {
            throw new EngineInvariantException("Skipped step '" + path + "' has no step log in run "
                    + plan.getPriorRun().getRunId());
        }
        getStore().addStepLog(prior.asMock(), runId);
        log.info("Step replayed | runId={} | path={} | priorRunId={} | status={}",
                runId, path, plan.getPriorRun().getRunId(), prior.getStatus());
        return prior.getStatus();
    }

    /** Records a PENDING step log for a composite node, then its RUNNING state. */
    StepLog startComposite(Node node, String path) {
        StepLog step = getStore().createStepLog(node.getName(), path, node.getKind().toValue());
        getStore().addStepLog(step, runId);
        step.markRunning(now());
        getStore().addStepLog(step, runId);
        return step;
    }

    StepStatus completeComposite(StepLog step, StepStatus status, String message) {
        step.complete(status, message, now());
        getStore().addStepLog(step, runId);
        return status;
    }

    /**
     * Records a branch log, runs the body DAG under it, then records the branch's terminal status. The store
     * moves a branch behind its siblings when it turns terminal, so a composite lists branches as they finished.
     */
    StepStatus runBranch(Dag body, String branchPath, BranchScope scope) {
        BranchLog branch = getStore().createBranchLog(branchPath);
        branch.setStatus(StepStatus.RUNNING);
        getStore().addBranchLog(branch, runId);
        StepStatus status = traversal.run(body, branchPath, scope, this);
        branch.setStatus(status);
        getStore().addBranchLog(branch, runId);
        log.info("Branch finished | runId={} | branch={} | status={}", runId, branchPath, status);
        return status;
    }

    /**
     * Runs branches concurrently when an executor is available and there is more than one, otherwise in order.
     * All branches run to their end; a fatal error of one is rethrown after the others were awaited.
     */
    List<StepStatus> runAll(List<Supplier<StepStatus>> branches) {
        List<StepStatus> results = new ArrayList<>(branches.size());
        if (executor == null || branches.size() < 2) {
            for (Supplier<StepStatus> branch : branches) {
                results.add(branch.get());
            }
            return results;
        }
        List<Future<StepStatus>> futures = new ArrayList<>(branches.size());
        for (Supplier<StepStatus> branch : branches) {
            futures.add(executor.submit(branch::get));
        }
        RuntimeException failure = null;
        for (Future<StepStatus> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new EngineInvariantException("Interrupted while waiting for branches of run " + runId);
            } catch (Exception e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                RuntimeException re = cause instanceof RuntimeException r ? r : new RuntimeException(cause);
                if (failure == null) {
                    failure = re;
                } else {
                    failure.addSuppressed(re);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return results;
    }
}
