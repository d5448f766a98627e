package com.sluice.engine;

import com.sluice.engine.rerun.RerunPlan;
import com.sluice.runlog.RunLog;
import com.sluice.runlog.StepStatus;

/**
 * Final state of a run: the stored run log and, for a re-run, the plan that was followed.
 */
public record RunResult(RunLog runLog, RerunPlan plan) {

    public String runId() {
        return runLog.getRunId();
    }

    public StepStatus status() {
        return runLog.getStatus();
    }

    public boolean isSuccess() {
        return runLog.getStatus() == StepStatus.SUCCESS;
    }
}
