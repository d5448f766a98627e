package com.sluice.runlog.store;

import com.sluice.runlog.AbstractRunLogStore;
import com.sluice.runlog.RunLog;

import java.util.HashMap;
import java.util.Map;

/**
 * In-memory run log store. Run logs live only as long as the process; suited to tests and one-off runs.
 */
public final class BufferedRunLogStore extends AbstractRunLogStore {

    public static final String TYPE = "buffered";

    private final Map<String, RunLog> runLogs = new HashMap<>();

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected RunLog read(String runId) {
        return runLogs.get(runId);
    }

    @Override
    protected void write(RunLog runLog) {
        runLogs.put(runLog.getRunId(), runLog);
    }
}
