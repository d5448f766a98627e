package com.sluice.runlog;

public class RunLogNotFoundException extends RunLogException {

    private final String runId;

    public RunLogNotFoundException(String runId) {
        super("Run log not found: " + runId);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
