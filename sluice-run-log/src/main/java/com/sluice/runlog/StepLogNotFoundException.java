package com.sluice.runlog;

public class StepLogNotFoundException extends RunLogException {

    private final String path;

    public StepLogNotFoundException(String runId, String path) {
        super("Step log not found: " + path + " (run " + runId + ")");
        this.path = path;
    }

    public String getPath() {
        return path;
    }
}
