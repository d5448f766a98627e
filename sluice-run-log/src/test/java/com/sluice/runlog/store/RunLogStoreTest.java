package com.sluice.runlog.store;

import com.sluice.runlog.BranchLog;
import com.sluice.runlog.RunLog;
import com.sluice.runlog.RunLogException;
import com.sluice.runlog.RunLogJson;
import com.sluice.runlog.RunLogNotFoundException;
import com.sluice.runlog.RunLogStore;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepLogNotFoundException;
import com.sluice.runlog.StepStatus;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RunLogStoreTest {

    @TempDir
    Path tempDir;

    private List<RunLogStore> stores() {
        return List.of(new BufferedRunLogStore(), new FileSystemRunLogStore(tempDir.resolve("logs")));
    }

    @Test
    void createAndFetch() {
        for (RunLogStore store : stores()) {
            store.createRunLog("r1", "hash", "tag");

            RunLog runLog = store.getRunLog("r1");

            assertEquals(StepStatus.RUNNING, runLog.getStatus(), store.type());
            assertEquals("hash", runLog.getDagHash());
            assertThrows(RunLogException.class, () -> store.createRunLog("r1", "hash", null));
            assertThrows(RunLogNotFoundException.class, () -> store.getRunLog("missing"));
            assertFalse(store.exists("missing"));
        }
    }

    @Test
    void stepLogLifecycle() {
        for (RunLogStore store : stores()) {
            store.createRunLog("r1", "hash", null);
            StepLog step = store.createStepLog("a", "a", "task");
            store.addStepLog(step, "r1");
            step.complete(StepStatus.SUCCESS, null, 5L);
            store.addStepLog(step, "r1");

            assertEquals(StepStatus.SUCCESS, store.getStepLog("a", "r1").getStatus(), store.type());
            StepLog again = store.createStepLog("a", "a", "task");
            assertThrows(RunLogException.class, () -> store.addStepLog(again, "r1"));
            assertThrows(StepLogNotFoundException.class, () -> store.getStepLog("b", "r1"));
        }
    }

    @Test
    void readdingCompositeKeepsRecordedBranches() {
        for (RunLogStore store : stores()) {
            store.createRunLog("r1", "hash", null);
            StepLog par = store.createStepLog("par", "par", "parallel");
            par.markRunning(1L);
            store.addStepLog(par, "r1");
            BranchLog left = store.createBranchLog("par.left");
            store.addBranchLog(left, "r1");
            StepLog child = store.createStepLog("x", "par.left.x", "task");
            child.complete(StepStatus.SUCCESS, null, 2L);
            store.addStepLog(child, "r1");
            left.setStatus(StepStatus.SUCCESS);
            store.addBranchLog(left, "r1");
            par.complete(StepStatus.SUCCESS, null, 3L);
            store.addStepLog(par, "r1");

            RunLog runLog = store.getRunLog("r1");
            assertEquals(StepStatus.SUCCESS, runLog.searchBranch("par.left").getStatus(), store.type());
            assertEquals(StepStatus.SUCCESS, runLog.searchStep("par.left.x").getStatus());
            assertEquals(StepStatus.SUCCESS, runLog.searchStep("par").getStatus());
        }
    }

    @Test
    void parametersMergeAndStatusUpdate() {
        for (RunLogStore store : stores()) {
            store.createRunLog("r1", null, null);
            store.setParameters("r1", Map.of("a", 1, "b", "x"));
            store.setParameters("r1", Map.of("a", 2));
            store.updateRunLogStatus("r1", StepStatus.FAILED);

            assertEquals(Map.of("a", 2, "b", "x"), store.getParameters("r1"), store.type());
            assertEquals(StepStatus.FAILED, store.getRunLog("r1").getStatus());
        }
    }

    @Test
    void failRunLogRecordsTheReason() {
        for (RunLogStore store : stores()) {
            store.createRunLog("r1", null, null);

            store.failRunLog("r1", "catalog unavailable");

            RunLog runLog = store.getRunLog("r1");
            assertEquals(StepStatus.FAILED, runLog.getStatus(), store.type());
            assertEquals("catalog unavailable", runLog.getMessage());
        }
    }

    @Test
    void concurrentBranchWritesAreNotLost() throws Exception {
        for (RunLogStore store : stores()) {
            store.createRunLog("r1", null, null);
            StepLog par = store.createStepLog("par", "par", "parallel");
            par.markRunning(1L);
            store.addStepLog(par, "r1");
            ExecutorService pool = Executors.newFixedThreadPool(4);
            try {
                List<Future<?>> futures = new ArrayList<>();
                for (int i = 0; i < 8; i++) {
                    String branch = "par.b" + i;
                    futures.add(pool.submit(() -> {
                        store.addBranchLog(store.createBranchLog(branch), "r1");
                        store.addStepLog(store.createStepLog("x", branch + ".x", "task"), "r1");
                    }));
                }
                for (Future<?> f : futures) {
                    f.get(30, TimeUnit.SECONDS);
                }
            } finally {
                pool.shutdown();
            }

            assertEquals(9, store.getRunLog("r1").flatten().size(), store.type());
        }
    }

    @Test
    void fileSystemStoreWritesOneJsonFilePerRun() throws Exception {
        FileSystemRunLogStore store = new FileSystemRunLogStore(tempDir);
        store.createRunLog("r7", "h", null);

        Path file = tempDir.resolve("r7.json");

        assertTrue(Files.exists(file));
        assertEquals("r7", RunLogJson.fromJson(Files.readString(file)).getRunId());
    }
}
