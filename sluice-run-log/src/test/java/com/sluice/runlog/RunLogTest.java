package com.sluice.runlog;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunLogTest {

    static RunLog sampleRunLog() {
        RunLog runLog = RunLog.create("run-1", "abc123", "nightly");
        runLog.putParameters(Map.of("chunks", List.of(1, 2)));

        StepLog prepare = StepLog.pending("prepare", "prepare", "task");
        prepare.markRunning(1000L);
        prepare.addAttempt(new AttemptLog(1, 1000L, 1500L, StepStatus.SUCCESS, null, 0));
        prepare.putMetric("rows", 42);
        prepare.putMetric("loss_2", 0.25);
        prepare.addDataCatalog(List.of(new DataCatalog("data.csv", "ff00", "run-1/data.csv", ".catalog",
                DataCatalog.Stage.PUT, "prepare")));
        prepare.addCodeIdentity(new CodeIdentity("9f1c2e7", CodeIdentity.GIT, false, "git@example.org:ml/etl.git"));
        prepare.addCodeIdentity(new CodeIdentity("sha256:4be1", CodeIdentity.DOCKER, true, "local docker host"));
        prepare.complete(StepStatus.SUCCESS, null, 1500L);
        runLog.putStep(prepare);

        StepLog fan = StepLog.pending("fan", "fan", "map");
        fan.markRunning(1600L);
        runLog.putStep(fan);
        runLog.putBranch(BranchLog.pending("fan.1"));
        StepLog train = StepLog.pending("train", "fan.1.train", "task");
        train.complete(StepStatus.FAILED, "exit code 2", 1700L);
        runLog.putStep(train);
        runLog.searchBranch("fan.1").setStatus(StepStatus.FAILED);
        return runLog;
    }

    @Test
    void searchStep_followsAlternatingStepAndBranchSegments() {
        RunLog runLog = sampleRunLog();

        assertEquals("prepare", runLog.searchStep("prepare").getName());
        assertEquals(StepStatus.FAILED, runLog.searchStep("fan.1.train").getStatus());
        assertEquals(StepStatus.FAILED, runLog.searchBranch("fan.1").getStatus());
        assertNull(runLog.searchStep("fan.1"));
        assertNull(runLog.searchStep("fan.2.train"));
        assertNull(runLog.searchBranch("prepare"));
        assertNull(runLog.searchStep(""));
    }

    @Test
    void putStep_requiresEnclosingBranch() {
        RunLog runLog = sampleRunLog();

        assertThrows(BranchLogNotFoundException.class,
                () -> runLog.putStep(StepLog.pending("train", "fan.9.train", "task")));
        assertThrows(StepLogNotFoundException.class, () -> runLog.putBranch(BranchLog.pending("ghost.a")));
    }

    @Test
    void flatten_listsNestedPathsDepthFirst() {
        assertEquals(List.of("prepare", "fan", "fan.1.train"), List.copyOf(sampleRunLog().flatten().keySet()));
    }

    @Test
    void stepLog_isImmutableOnceTerminal() {
        StepLog step = StepLog.pending("a", "a", "task");
        step.complete(StepStatus.SUCCESS, null, 10L);

        assertThrows(IllegalStateException.class, () -> step.complete(StepStatus.FAILED, "again", 11L));
        assertThrows(IllegalStateException.class, () -> step.putMetric("k", 1));
        assertThrows(IllegalStateException.class, () -> step.markRunning(12L));
        assertThrows(IllegalArgumentException.class,
                () -> StepLog.pending("b", "b", "task").complete(StepStatus.RUNNING, null, 1L));
        assertEquals(10L, step.getStartTimeMillis());
    }

    @Test
    void asMock_marksNestedStepLogs() {
        StepLog fan = sampleRunLog().searchStep("fan");

        StepLog mock = fan.asMock();

        assertTrue(mock.isMock());
        assertTrue(mock.getBranches().get("fan.1").getStep("fan.1.train").isMock());
    }

    @Test
    void json_roundTripIsLossless() {
        RunLog runLog = sampleRunLog();
        String json = RunLogJson.toJson(runLog);

        RunLog back = RunLogJson.fromJson(json);

        assertEquals(json, RunLogJson.toJson(back));
        assertEquals("abc123", back.getDagHash());
        assertEquals(List.of(1, 2), back.getParameters().get("chunks"));
        assertEquals(0.25, back.searchStep("prepare").getUserDefinedMetrics().get("loss_2"));
        assertEquals(500L, back.searchStep("prepare").getAttempts().get(0).getDurationMillis());
        assertEquals(runLog.searchStep("prepare").getDataCatalog(), back.searchStep("prepare").getDataCatalog());
        assertEquals(List.of(
                new CodeIdentity("9f1c2e7", "git", false, "git@example.org:ml/etl.git"),
                new CodeIdentity("sha256:4be1", "docker", true, "local docker host")),
                back.searchStep("prepare").getCodeIdentities());
    }

    @Test
    void codeIdentities_surviveReplayAndAreFrozenWithTheStep() {
        StepLog prepare = sampleRunLog().searchStep("prepare");

        assertEquals(prepare.getCodeIdentities(), prepare.asMock().getCodeIdentities());
        assertThrows(IllegalStateException.class,
                () -> prepare.addCodeIdentity(new CodeIdentity("abc", CodeIdentity.GIT, true, null)));
    }

    @Test
    void putBranch_listsFinishedBranchesInCompletionOrder() {
        StepLog par = StepLog.pending("par", "par", "parallel");
        par.markRunning(1L);
        par.putBranch(new BranchLog("par.a", StepStatus.RUNNING, null));
        par.putBranch(new BranchLog("par.b", StepStatus.RUNNING, null));
        par.putBranch(new BranchLog("par.c", StepStatus.RUNNING, null));

        par.putBranch(new BranchLog("par.b", StepStatus.SUCCESS, null));
        par.putBranch(new BranchLog("par.a", StepStatus.FAILED, null));
        par.putBranch(new BranchLog("par.c", StepStatus.SUCCESS, null));

        assertEquals(List.of("par.b", "par.a", "par.c"), List.copyOf(par.getBranches().keySet()));
        assertEquals(StepStatus.FAILED, par.getBranches().get("par.a").getStatus());
    }

    @Test
    void copy_isDetached() {
        RunLog runLog = sampleRunLog();
        RunLog copy = runLog.copy();

        copy.searchBranch("fan.1").setStatus(StepStatus.SUCCESS);

        assertEquals(StepStatus.FAILED, runLog.searchBranch("fan.1").getStatus());
        assertSame(StepStatus.RUNNING, copy.getStatus());
    }
}
