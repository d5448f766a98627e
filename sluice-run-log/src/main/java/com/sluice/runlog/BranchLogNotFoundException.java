package com.sluice.runlog;

public class BranchLogNotFoundException extends RunLogException {

    public BranchLogNotFoundException(String runId, String path) {
        super("Branch log not found: " + path + " (run " + runId + ")");
    }
}
