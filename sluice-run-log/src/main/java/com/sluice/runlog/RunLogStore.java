package com.sluice.runlog;

import java.util.Map;

/**
 * Persistence of run logs. Every method that takes a run id reads the current record from the store;
 * returned objects are detached copies, so changes reach the store only through the add/put methods.
 * <p>
 * Adding a step or branch log keeps the children the store already holds for it: a composite step
 * re-added with a new status keeps the branch logs recorded meanwhile, and a branch log re-added with a
 * new status keeps its step logs.
 */
public interface RunLogStore {

    /** Store type name as used in configuration. */
    String type();

    /**
     * Creates and stores a RUNNING run log.
     *
     * @throws RunLogException when a run log with this id already exists
     */
    RunLog createRunLog(String runId, String dagHash, String tag);

    /**
     * @throws RunLogNotFoundException when no run log has this id
     */
    RunLog getRunLog(String runId);

    /** Stores a whole run log, replacing any record with the same id. */
    void putRunLog(RunLog runLog);

    default boolean exists(String runId) {
        try {
            getRunLog(runId);
            return true;
        } catch (RunLogNotFoundException e) {
            return false;
        }
    }

    void updateRunLogStatus(String runId, StepStatus status);

    /** Marks the run FAILED with the error that stopped it. */
    void failRunLog(String runId, String message);

    default Map<String, Object> getParameters(String runId) {
        return getRunLog(runId).getParameters();
    }

    /** Merges parameters into the run log; later values win. */
    void setParameters(String runId, Map<String, ?> parameters);

    default StepLog createStepLog(String name, String path, String stepType) {
        return StepLog.pending(name, path, stepType);
    }

    /**
     * @throws StepLogNotFoundException when nothing is recorded at the path
     */
    StepLog getStepLog(String path, String runId);

    /**
     * Records the step log at its node path.
     *
     * @throws RunLogException when the recorded step log at that path is already terminal
     */
    void addStepLog(StepLog stepLog, String runId);

    default BranchLog createBranchLog(String path) {
        return BranchLog.pending(path);
    }

    /**
     * @throws BranchLogNotFoundException when nothing is recorded at the path
     */
    BranchLog getBranchLog(String path, String runId);

    void addBranchLog(BranchLog branchLog, String runId);
}
