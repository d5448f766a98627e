package com.sluice.engine;

import com.sluice.catalog.FileSystemCatalog;
import com.sluice.compute.ComputeBackend;
import com.sluice.compute.ExecutionOutcome;
import com.sluice.compute.LocalComputeBackend;
import com.sluice.compute.TaskContext;
import com.sluice.compute.TaskRegistry;
import com.sluice.dag.config.ExecutionMode;
import com.sluice.dag.node.Dag;
import com.sluice.dag.node.Node;
import com.sluice.engine.rerun.Action;
import com.sluice.runlog.CodeIdentity;
import com.sluice.runlog.RunLog;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RetryTest {

    private static final String PIPELINE = """
            {"startAt": "extract", "steps": {
              "extract": {"type": "task", "commandType": "java", "command": "extract", "next": "load"},
              "load": {"type": "task", "commandType": "java", "command": "load", "next": "success"},
              "success": {"type": "success"},
              "fail": {"type": "fail"}}}
            """;

    @TempDir
    Path workDir;

    private static final String PARALLEL = """
            {"startAt": "par", "steps": {
              "par": {"type": "parallel", "next": "after", "branches": {
                "left": {"startAt": "a", "steps": {
                  "a": {"type": "task", "commandType": "java", "command": "a", "next": "success"},
                  "success": {"type": "success"}, "fail": {"type": "fail"}}},
                "right": {"startAt": "b", "steps": {
                  "b": {"type": "task", "commandType": "java", "command": "b", "next": "success"},
                  "success": {"type": "success"}, "fail": {"type": "fail"}}}}},
              "after": {"type": "task", "commandType": "java", "command": "after", "next": "success"},
              "success": {"type": "success"},
              "fail": {"type": "fail"}}}
            """;

    private static final String MAP_THEN_DAG = """
            {"startAt": "fan", "steps": {
              "fan": {"type": "map", "iterateOn": "chunks", "iterateAs": "chunk", "next": "sub",
                      "branch": {"startAt": "score", "steps": {
                        "score": {"type": "task", "commandType": "java", "command": "score", "next": "success"},
                        "success": {"type": "success"}, "fail": {"type": "fail"}}}},
              "sub": {"type": "dag", "next": "success", "dag": {"startAt": "inner", "steps": {
                "inner": {"type": "task", "commandType": "java", "command": "inner", "next": "success"},
                "success": {"type": "success"}, "fail": {"type": "fail"}}}},
              "success": {"type": "success"},
              "fail": {"type": "fail"}}}
            """;

    private final List<String> calls = Collections.synchronizedList(new ArrayList<>());
    private final AtomicBoolean loadBroken = new AtomicBoolean();

    private ExecutionEngine engine() {
        TaskRegistry tasks = new TaskRegistry()
                .register("extract", ctx -> {
                    calls.add("extract");
                    return Map.of("rows", 10);
                })
                .register("load", ctx -> {
                    calls.add("load");
                    if (loadBroken.get()) throw new IllegalStateException("target unavailable");
                    return null;
                });
        return new ExecutionEngine(EngineTestSupport.services(tasks, workDir).build());
    }

    @Test
    void retry_ofSuccessfulRunReplaysEverything() {
        ExecutionEngine engine = engine();
        Dag dag = EngineTestSupport.compile(PIPELINE);
        String hash = EngineTestSupport.hash(PIPELINE);
        RunResult first = engine.execute(dag, hash, RunRequest.of("run-1"));
        calls.clear();

        RunResult again = engine.retry(dag, hash, "run-1", RunRequest.of("run-2"), false);

        assertTrue(again.isSuccess());
        assertEquals(0, again.plan().count(Action.EXECUTE));
        assertTrue(calls.isEmpty());
        RunLog runLog = again.runLog();
        assertEquals("run-1", runLog.getOriginalRunId());
        assertTrue(runLog.isUseCached());
        assertEquals(first.runLog().flatten().keySet(), runLog.flatten().keySet());
        runLog.flatten().values().forEach(step -> assertTrue(step.isMock()));
        assertEquals(first.runLog().searchStep("extract").getAttempts().size(),
                runLog.searchStep("extract").getAttempts().size());
        assertEquals(10, runLog.getParameters().get("rows"));
        assertEquals(first.runLog().flatten().keySet(),
                engine.getServices().getRunLogStore().getRunLog("run-1").flatten().keySet());
    }

    @Test
    void retry_resumesFromFirstFailedStep() {
        ExecutionEngine engine = engine();
        Dag dag = EngineTestSupport.compile(PIPELINE);
        String hash = EngineTestSupport.hash(PIPELINE);
        loadBroken.set(true);
        assertEquals(StepStatus.FAILED, engine.execute(dag, hash, RunRequest.of("run-1")).status());
        loadBroken.set(false);
        calls.clear();

        RunResult result = engine.retry(dag, hash, "run-1", new RunRequest("run-2", null, Map.of("mode", "full")), false);

        assertTrue(result.isSuccess());
        assertEquals(List.of("load"), calls);
        assertEquals(Action.SKIP, result.plan().actionFor("extract"));
        assertEquals(Action.EXECUTE, result.plan().actionFor("load"));
        StepLog extract = result.runLog().searchStep("extract");
        StepLog load = result.runLog().searchStep("load");
        assertTrue(extract.isMock());
        assertFalse(load.isMock());
        assertEquals(StepStatus.SUCCESS, load.getStatus());
        assertEquals(10, result.runLog().getParameters().get("rows"));
        assertEquals("full", result.runLog().getParameters().get("mode"));
    }

    @Test
    void retry_refusesChangedDagUnlessForced() {
        ExecutionEngine engine = engine();
        Dag dag = EngineTestSupport.compile(PIPELINE);
        engine.execute(dag, "old-hash", RunRequest.of("run-1"));

        EngineInvariantException e = assertThrows(EngineInvariantException.class,
                () -> engine.retry(dag, "new-hash", "run-1", RunRequest.of("run-2"), false));
        RunResult forced = engine.retry(dag, "new-hash", "run-1", RunRequest.of("run-3"), true);

        assertTrue(e.getMessage().contains("old-hash"));
        assertFalse(engine.getServices().getRunLogStore().exists("run-2"));
        assertTrue(forced.isSuccess());
        assertEquals("new-hash", forced.runLog().getDagHash());
    }

    @Test
    void retry_rejectsSameRunId() {
        ExecutionEngine engine = engine();
        Dag dag = EngineTestSupport.compile(PIPELINE);
        engine.execute(dag, "h", RunRequest.of("run-1"));

        assertThrows(IllegalArgumentException.class, () -> engine.retry(dag, "h", "run-1", RunRequest.of("run-1"), false));
    }

    @Test
    void retry_syncsPriorCatalogSoSkippedProducersStillFeedConsumers() throws Exception {
        String json = """
                {"startAt": "produce", "steps": {
                  "produce": {"type": "task", "commandType": "java", "command": "produce", "next": "consume",
                              "catalog": {"put": ["out.txt"]}},
                  "consume": {"type": "task", "commandType": "java", "command": "consume", "next": "success",
                              "catalog": {"get": ["out.txt"], "computeDataFolder": "inbox"}},
                  "success": {"type": "success"},
                  "fail": {"type": "fail"}}}
                """;
        Files.createDirectories(workDir.resolve("data"));
        Files.createDirectories(workDir.resolve("inbox"));
        TaskRegistry tasks = new TaskRegistry()
                .register("produce", ctx -> {
                    calls.add("produce");
                    Files.writeString(ctx.getComputeDataFolder().resolve("out.txt"), "payload");
                    return null;
                })
                .register("consume", ctx -> {
                    calls.add("consume");
                    if (loadBroken.get()) throw new IllegalStateException("not yet");
                    calls.add(Files.readString(ctx.getComputeDataFolder().resolve("out.txt")));
                    return null;
                });
        ExecutionEngine engine = new ExecutionEngine(EngineTestSupport.services(tasks, workDir)
                .catalog(new FileSystemCatalog(workDir.resolve(".catalog"))).build());
        Dag dag = EngineTestSupport.compile(json);
        loadBroken.set(true);
        engine.execute(dag, "h", RunRequest.of("run-1"));
        loadBroken.set(false);
        Files.delete(workDir.resolve("inbox/out.txt"));
        calls.clear();

        RunResult result = engine.retry(dag, "h", "run-1", RunRequest.of("run-2"), false);

        assertTrue(result.isSuccess());
        assertEquals(List.of("consume", "payload"), calls);
        assertTrue(Files.exists(workDir.resolve(".catalog/run-2/out.txt")));
    }

    /** Tasks recording their step path; the task at {@code brokenPath} fails while {@code loadBroken} is set. */
    private TaskRegistry composite(String brokenPath, String... names) {
        TaskRegistry tasks = new TaskRegistry();
        for (String name : names) {
            tasks.register(name, ctx -> {
                calls.add(ctx.getStepPath());
                if (loadBroken.get() && ctx.getStepPath().equals(brokenPath)) {
                    throw new IllegalStateException(brokenPath + " broke");
                }
                return null;
            });
        }
        return tasks;
    }

    @ParameterizedTest
    @EnumSource(ExecutionMode.class)
    void retry_reExecutesOnlyTheFailedParallelBranch(ExecutionMode mode) {
        ExecutionEngine engine = new ExecutionEngine(EngineTestSupport.services(
                composite("par.right.b", "a", "b", "after"), workDir).mode(mode).build());
        Dag dag = EngineTestSupport.compile(PARALLEL);
        loadBroken.set(true);
        RunResult failed = engine.execute(dag, "h", RunRequest.of("run-1"));
        loadBroken.set(false);
        calls.clear();

        RunResult result = engine.retry(dag, "h", "run-1", RunRequest.of("run-2"), false);

        assertEquals(StepStatus.FAILED, failed.status());
        assertTrue(result.isSuccess());
        assertEquals(List.of("par.right.b", "after"), calls);
        assertEquals(Action.EXECUTE, result.plan().actionFor("par"));
        assertEquals(Action.SKIP, result.plan().actionFor("par.left.a"));
        assertEquals(Action.EXECUTE, result.plan().actionFor("par.right.b"));
        RunLog runLog = result.runLog();
        assertFalse(runLog.searchStep("par").isMock());
        assertTrue(runLog.searchStep("par.left.a").isMock());
        assertTrue(runLog.searchStep("par.left.success").isMock());
        assertFalse(runLog.searchStep("par.right.b").isMock());
        assertEquals(StepStatus.SUCCESS, runLog.searchBranch("par.left").getStatus());
        assertEquals(StepStatus.SUCCESS, runLog.searchBranch("par.right").getStatus());
        assertEquals(StepStatus.FAILED, engine.getServices().getRunLogStore().getRunLog("run-1")
                .searchBranch("par.right").getStatus());

        calls.clear();
        RunResult again = engine.retry(dag, "h", "run-2", RunRequest.of("run-3"), false);

        assertTrue(again.isSuccess());
        assertEquals(0, again.plan().count(Action.EXECUTE));
        assertTrue(calls.isEmpty());
        again.runLog().flatten().values().forEach(step -> assertTrue(step.isMock(), step.getInternalName()));
    }

    @Test
    void retry_reExecutesFailedMapItemAndTheDagAfterIt() {
        ExecutionEngine engine = new ExecutionEngine(EngineTestSupport.services(
                composite("fan.y.score", "score", "inner"), workDir).build());
        Dag dag = EngineTestSupport.compile(MAP_THEN_DAG);
        loadBroken.set(true);
        engine.execute(dag, "h", new RunRequest("run-1", null, Map.of("chunks", List.of("x", "y"))));
        loadBroken.set(false);
        calls.clear();

        RunResult result = engine.retry(dag, "h", "run-1", RunRequest.of("run-2"), false);

        assertTrue(result.isSuccess());
        assertEquals(List.of("fan.y.score", "sub.dag.inner"), calls);
        RunLog runLog = result.runLog();
        assertTrue(runLog.searchStep("fan.x.score").isMock());
        assertFalse(runLog.searchStep("fan.y.score").isMock());
        assertFalse(runLog.searchStep("fan").isMock());
        assertFalse(runLog.searchStep("sub.dag.inner").isMock());
        assertEquals(StepStatus.SUCCESS, runLog.searchBranch("sub.dag").getStatus());
        assertEquals(List.of("x", "y"), runLog.getParameters().get("chunks"));

        calls.clear();
        RunResult again = engine.retry(dag, "h", "run-2", RunRequest.of("run-3"), false);

        assertTrue(again.isSuccess());
        assertEquals(0, again.plan().count(Action.EXECUTE));
        assertTrue(calls.isEmpty());
    }

    @Test
    void retry_keepsCodeIdentityOfReplayedStepsAndRecordsTheNewOneForExecutedSteps() {
        AtomicReference<String> commit = new AtomicReference<>("c0ffee1");
        LocalComputeBackend local = new LocalComputeBackend(new TaskRegistry()
                .register("extract", ctx -> Map.of("rows", 10))
                .register("load", ctx -> {
                    if (loadBroken.get()) throw new IllegalStateException("target unavailable");
                    return null;
                }));
        ComputeBackend backend = new ComputeBackend() {
            @Override
            public String type() {
                return local.type();
            }

            @Override
            public ExecutionOutcome execute(Node node, TaskContext context) {
                return local.execute(node, context);
            }

            @Override
            public List<CodeIdentity> codeIdentities(Node node, Path workingDirectory) {
                return List.of(new CodeIdentity(commit.get(), CodeIdentity.GIT, true, null));
            }
        };
        ExecutionEngine engine = new ExecutionEngine(EngineTestSupport.services(new TaskRegistry(), workDir)
                .computeBackend(backend).build());
        Dag dag = EngineTestSupport.compile(PIPELINE);
        loadBroken.set(true);
        engine.execute(dag, "h", RunRequest.of("run-1"));
        loadBroken.set(false);
        commit.set("d00dfee2");

        RunResult result = engine.retry(dag, "h", "run-1", RunRequest.of("run-2"), false);

        assertEquals("c0ffee1", result.runLog().searchStep("extract").getCodeIdentities().get(0).getIdentifier());
        assertEquals("d00dfee2", result.runLog().searchStep("load").getCodeIdentities().get(0).getIdentifier());
        assertTrue(result.runLog().searchStep("success").getCodeIdentities().isEmpty());
    }
}
