package com.sluice.engine.node.handlers;

import com.sluice.catalog.Catalog;
import com.sluice.catalog.CatalogException;
import com.sluice.compute.ExecutionOutcome;
import com.sluice.compute.TaskContext;
import com.sluice.compute.tracking.StepTracker;
import com.sluice.dag.declaration.CatalogSettings;
import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;
import com.sluice.engine.EngineServices;
import com.sluice.engine.traversal.BranchScope;
import com.sluice.runlog.AttemptLog;
import com.sluice.runlog.DataCatalog;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs {@code task} nodes on the compute backend and passes {@code as-is} nodes through. Around the execution,
 * catalog artifacts are fetched into and stored from the node's compute data folder; metrics, returned
 * parameters and the identities of the code the node runs with are recorded.
 */
public final class TaskHandler implements NodeHandler {

    private static final Logger log = LoggerFactory.getLogger(TaskHandler.class);

    @Override
    public Set<NodeKind> supportedKinds() {
        return Set.of(NodeKind.TASK, NodeKind.AS_IS);
    }

    @Override
    public StepStatus handle(Node node, String path, BranchScope scope, HandlerContext ctx) {
        EngineServices services = ctx.getServices();
        String runId = ctx.getRunId();
        StepLog step = ctx.getStore().createStepLog(node.getName(), path, node.getKind().toValue());
        ctx.getStore().addStepLog(step, runId);
        step.markRunning(ctx.now());
        services.getComputeBackend().codeIdentities(node, services.getWorkingDirectory()).forEach(step::addCodeIdentity);
        ctx.getStore().addStepLog(step, runId);

        Catalog catalog = services.getCatalog();
        CatalogSettings settings = node.getCatalog();
        boolean usesCatalog = settings != null && (!settings.getGet().isEmpty() || !settings.getPut().isEmpty());
        Path dataFolder = ctx.computeDataFolder(node);
        try {
            catalog.ensureComputeFolder(dataFolder);
            List<DataCatalog> fetched = new ArrayList<>();
            if (usesCatalog) {
                for (String pattern : settings.getGet()) {
                    fetched.addAll(catalog.get(pattern, runId, dataFolder, path));
                }
                step.addDataCatalog(fetched);
            }

            ExecutionOutcome outcome = node.getKind() == NodeKind.AS_IS
                    ? ExecutionOutcome.success(List.of(), null)
                    : execute(node, path, scope, ctx, step, dataFolder);

            if (outcome.isSuccess()) {
                if (!outcome.getReturnedParameters().isEmpty()) {
                    ctx.getStore().setParameters(runId, outcome.getReturnedParameters());
                }
                if (usesCatalog) {
                    for (String pattern : settings.getPut()) {
                        step.addDataCatalog(catalog.put(pattern, runId, dataFolder, path, fetched));
                    }
                }
            }
            step.complete(outcome.getStatus(), outcome.getMessage(), ctx.now());
            ctx.getStore().addStepLog(step, runId);
            log.info("Step finished | runId={} | path={} | kind={} | status={} | attempts={}",
                    runId, path, node.getKind().toValue(), outcome.getStatus(), outcome.getAttempts().size());
            return outcome.getStatus();
        } catch (CatalogException e) {
            log.error("Catalog failure | runId={} | path={} | reason={} | error={}", runId, path, e.getReason(), e.getMessage());
            step.complete(StepStatus.FAILED, e.getMessage(), ctx.now());
            ctx.getStore().addStepLog(step, runId);
            throw e;
        }
    }

    private ExecutionOutcome execute(Node node, String path, BranchScope scope, HandlerContext ctx, StepLog step,
                                     Path dataFolder) {
        EngineServices services = ctx.getServices();
        StepTracker tracker = new StepTracker(services.getTracker());
        TaskContext taskContext = TaskContext.builder(path)
                .parameters(scope.bind(ctx.getStore().getParameters(ctx.getRunId())))
                .workingDirectory(services.getWorkingDirectory())
                .computeDataFolder(dataFolder)
                .secrets(services.getSecrets())
                .tracker(tracker)
                .environment(services.getEnvironment())
                .parameterPrefix(services.getConfig().getParameterPrefix())
                .build();
        ExecutionOutcome outcome = services.getComputeBackend().execute(node, taskContext);
        for (AttemptLog attempt : outcome.getAttempts()) {
            step.addAttempt(attempt);
        }
        for (Map.Entry<String, Object> e : services.getEnvironment().withPrefix(services.getConfig().getTrackPrefix()).entrySet()) {
            step.putMetric(e.getKey(), e.getValue());
        }
        tracker.getMetrics().forEach(step::putMetric);
        return outcome;
    }
}
