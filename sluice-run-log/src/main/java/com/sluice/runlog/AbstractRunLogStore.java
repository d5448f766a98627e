package com.sluice.runlog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Base for stores that keep a whole run log per record. Each operation is a read-modify-write cycle held under
 * one store-level lock, so concurrent branches writing distinct paths never lose each other's updates.
 */
public abstract class AbstractRunLogStore implements RunLogStore {

    private static final Logger log = LoggerFactory.getLogger(AbstractRunLogStore.class);

    private final ReentrantLock lock = new ReentrantLock();

    /** Stored run log, or null when the id is unknown. */
    protected abstract RunLog read(String runId);

    protected abstract void write(RunLog runLog);

    @Override
    public RunLog createRunLog(String runId, String dagHash, String tag) {
        lock.lock();
        try {
            if (read(runId) != null) {
                throw new RunLogException("Run log already exists: " + runId);
            }
            RunLog runLog = RunLog.create(runId, dagHash, tag);
            write(runLog);
            log.info("Run log created | store={} | runId={} | dagHash={}", type(), runId, dagHash);
            return runLog.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RunLog getRunLog(String runId) {
        lock.lock();
        try {
            return require(runId).copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void putRunLog(RunLog runLog) {
        lock.lock();
        try {
            write(runLog.copy());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void updateRunLogStatus(String runId, StepStatus status) {
        update(runId, runLog -> runLog.setStatus(status));
        log.info("Run log status | store={} | runId={} | status={}", type(), runId, status);
    }

    @Override
    public void failRunLog(String runId, String message) {
        update(runId, runLog -> runLog.fail(message));
        log.warn("Run log failed | store={} | runId={} | message={}", type(), runId, message);
    }

    @Override
    public void setParameters(String runId, Map<String, ?> parameters) {
        update(runId, runLog -> runLog.putParameters(parameters));
    }

    @Override
    public StepLog getStepLog(String path, String runId) {
        lock.lock();
        try {
            StepLog step = require(runId).searchStep(path);
            if (step == null) {
                throw new StepLogNotFoundException(runId, path);
            }
            return step.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addStepLog(StepLog stepLog, String runId) {
        update(runId, runLog -> {
            StepLog stored = runLog.searchStep(stepLog.getInternalName());
            if (stored != null && stored.isTerminal()) {
                throw new RunLogException("Step log " + stepLog.getInternalName() + " of run " + runId
                        + " is already " + stored.getStatus());
            }
            runLog.putStep(stored != null ? stepLog.keepingBranchesOf(stored) : stepLog.copy());
        });
        log.debug("Step log recorded | runId={} | path={} | status={}", runId, stepLog.getInternalName(), stepLog.getStatus());
    }

    @Override
    public BranchLog getBranchLog(String path, String runId) {
        lock.lock();
        try {
            BranchLog branch = require(runId).searchBranch(path);
            if (branch == null) {
                throw new BranchLogNotFoundException(runId, path);
            }
            return branch.copy();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addBranchLog(BranchLog branchLog, String runId) {
        update(runId, runLog -> {
            BranchLog stored = runLog.searchBranch(branchLog.getInternalName());
            runLog.putBranch(stored != null ? branchLog.keepingStepsOf(stored) : branchLog.copy());
        });
        log.debug("Branch log recorded | runId={} | path={} | status={}", runId, branchLog.getInternalName(), branchLog.getStatus());
    }

    private void update(String runId, Consumer<RunLog> change) {
        lock.lock();
        try {
            RunLog runLog = require(runId);
            change.accept(runLog);
            write(runLog);
        } finally {
            lock.unlock();
        }
    }

    private RunLog require(String runId) {
        RunLog runLog = read(runId);
        if (runLog == null) {
            throw new RunLogNotFoundException(runId);
        }
        return runLog;
    }
}
