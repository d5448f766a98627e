package com.sluice.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Per-run inputs: run id (generated when absent), optional tag and initial parameters.
 */
public final class RunRequest {

    private final String runId;
    private final String tag;
    private final Map<String, Object> parameters;

    public RunRequest(String runId, String tag, Map<String, Object> parameters) {
        this.runId = runId != null && !runId.isBlank() ? runId.trim() : UUID.randomUUID().toString();
        this.tag = tag;
        this.parameters = parameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(parameters))
                : Map.of();
    }

    public static RunRequest of(String runId) {
        return new RunRequest(runId, null, null);
    }

    public String getRunId() {
        return runId;
    }

    public String getTag() {
        return tag;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }
}
