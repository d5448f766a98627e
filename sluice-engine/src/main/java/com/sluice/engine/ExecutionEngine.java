package com.sluice.engine;

import com.sluice.dag.config.ExecutionMode;
import com.sluice.dag.load.LoadedPipeline;
import com.sluice.dag.node.Dag;
import com.sluice.engine.node.handlers.HandlerContext;
import com.sluice.engine.node.handlers.NodeHandlerRegistry;
import com.sluice.engine.rerun.RerunPlan;
import com.sluice.engine.rerun.RerunPlanner;
import com.sluice.engine.traversal.BranchScope;
import com.sluice.engine.traversal.GraphTraversal;
import com.sluice.runlog.RunLog;
import com.sluice.runlog.RunLogStore;
import com.sluice.runlog.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Single entry point to run a compiled DAG against a set of services, either fresh ({@link #execute}) or as a
 * re-run of a previous run ({@link #retry}).
 * <p>
 * Node failures end up in the run log and decide the run status. Structural problems (catalog preconditions,
 * invariant violations, store failures) mark the run log failed and are rethrown.
 */
public final class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final EngineServices services;
    private final GraphTraversal traversal;
    private final NodeMetrics metrics;
    private final RerunPlanner planner = new RerunPlanner();

    public ExecutionEngine(EngineServices services) {
        this(services, NodeHandlerRegistry.defaults());
    }

    public ExecutionEngine(EngineServices services, NodeHandlerRegistry handlers) {
        this.services = Objects.requireNonNull(services, "services");
        this.traversal = new GraphTraversal(handlers);
        this.metrics = new NodeMetrics(services.getMeterRegistry());
    }

    public RunResult execute(LoadedPipeline pipeline, RunRequest request) {
        return execute(pipeline.getDag(), pipeline.getDagHash(), request);
    }

    /**
     * Runs the DAG from its start node under a new run log.
     *
     * @param dagHash hash of the pipeline definition, recorded for later re-runs
     */
    public RunResult execute(Dag dag, String dagHash, RunRequest request) {
        Objects.requireNonNull(dag, "dag");
        Objects.requireNonNull(request, "request");
        RunLogStore store = services.getRunLogStore();
        String runId = request.getRunId();
        store.createRunLog(runId, dagHash, request.getTag());
        store.setParameters(runId, initialParameters(request));
        log.info("Run started | runId={} | mode={} | store={} | catalog={} | compute={}",
                runId, services.getMode(), store.type(), services.getCatalog().type(), services.getComputeBackend().type());
        return traverse(dag, runId, null);
    }

    public RunResult retry(LoadedPipeline pipeline, String previousRunId, RunRequest request, boolean force) {
        return retry(pipeline.getDag(), pipeline.getDagHash(), previousRunId, request, force);
    }

    /**
     * Re-runs a previous run: paths that succeeded before the first failure are replayed from its run log, the
     * rest execute. The new run inherits the previous run's parameters (new ones win) and catalog.
     *
     * @param force re-run even when the DAG hash differs from the previous run's
     * @throws EngineInvariantException    when the DAG changed and {@code force} is false, or the previous run log
     *                                     records paths the DAG does not have
     * @throws com.sluice.runlog.RunLogNotFoundException when the previous run is unknown
     */
    public RunResult retry(Dag dag, String dagHash, String previousRunId, RunRequest request, boolean force) {
        Objects.requireNonNull(dag, "dag");
        Objects.requireNonNull(request, "request");
        RunLogStore store = services.getRunLogStore();
        String runId = request.getRunId();
        if (runId.equals(previousRunId)) {
            throw new IllegalArgumentException("A re-run needs a new run id, got the previous one: " + runId);
        }
        RunLog prior = store.getRunLog(previousRunId);
        if (!Objects.equals(prior.getDagHash(), dagHash)) {
            if (!force) {
                throw new EngineInvariantException("DAG of run " + previousRunId + " has hash " + prior.getDagHash()
                        + " but the supplied DAG has " + dagHash + "; re-run with force to proceed");
            }
            log.warn("Re-run with changed DAG | previousRunId={} | priorHash={} | hash={}",
                    previousRunId, prior.getDagHash(), dagHash);
        }
        RerunPlan plan = planner.plan(dag, prior);

        store.createRunLog(runId, dagHash, request.getTag());
        RunLog fresh = store.getRunLog(runId);
        fresh.markRerunOf(previousRunId);
        store.putRunLog(fresh);
        Map<String, Object> parameters = new LinkedHashMap<>(prior.getParameters());
        parameters.putAll(initialParameters(request));
        store.setParameters(runId, parameters);
        try {
            services.getCatalog().syncBetweenRuns(previousRunId, runId);
        } catch (RuntimeException e) {
            store.failRunLog(runId, e.getMessage());
            throw e;
        }
        log.info("Re-run started | runId={} | previousRunId={} | plan={}", runId, previousRunId, plan);
        return traverse(dag, runId, plan);
    }

    public EngineServices getServices() {
        return services;
    }

    /** Environment parameters with the configured prefix, overridden by the request's. */
    private Map<String, Object> initialParameters(RunRequest request) {
        Map<String, Object> parameters = new LinkedHashMap<>(
                services.getEnvironment().withPrefix(services.getConfig().getParameterPrefix()));
        parameters.putAll(request.getParameters());
        return parameters;
    }

    private RunResult traverse(Dag dag, String runId, RerunPlan plan) {
        RunLogStore store = services.getRunLogStore();
        ExecutorService executor = services.getMode() == ExecutionMode.PARALLEL
                ? Executors.newCachedThreadPool()
                : null;
        try {
            HandlerContext ctx = new HandlerContext(services, runId, executor, metrics, plan, traversal);
            StepStatus status = traversal.run(dag, null, BranchScope.root(), ctx);
            store.updateRunLogStatus(runId, status);
            log.info("Run finished | runId={} | status={}", runId, status);
            return new RunResult(store.getRunLog(runId), plan);
        } catch (RuntimeException e) {
            log.error("Run aborted | runId={} | error={}", runId, e.getMessage(), e);
            store.failRunLog(runId, e.getClass().getSimpleName() + ": " + e.getMessage());
            throw e;
        } finally {
            if (executor != null) {
                executor.shutdown();
                try {
                    if (!executor.awaitTermination(5, TimeUnit.MINUTES)) {
                        executor.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    executor.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
        }
    }
}
