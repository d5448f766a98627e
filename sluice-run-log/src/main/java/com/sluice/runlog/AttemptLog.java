package com.sluice.runlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One try of a step on the compute backend: timing, outcome and the exit diagnostic.
 */
@JsonIgnoreProperties(value = "durationMillis", allowGetters = true)
public final class AttemptLog {

    private final int attemptNumber;
    private final long startTimeMillis;
    private final long endTimeMillis;
    private final StepStatus status;
    private final String message;
    private final Integer exitCode;

    @JsonCreator
    public AttemptLog(
            @JsonProperty("attemptNumber") int attemptNumber,
            @JsonProperty("startTimeMillis") long startTimeMillis,
            @JsonProperty("endTimeMillis") long endTimeMillis,
            @JsonProperty("status") StepStatus status,
            @JsonProperty("message") String message,
            @JsonProperty("exitCode") Integer exitCode) {
        this.attemptNumber = attemptNumber;
        this.startTimeMillis = startTimeMillis;
        this.endTimeMillis = endTimeMillis;
        this.status = status != null ? status : StepStatus.FAILED;
        this.message = message;
        this.exitCode = exitCode;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public long getStartTimeMillis() {
        return startTimeMillis;
    }

    public long getEndTimeMillis() {
        return endTimeMillis;
    }

    public long getDurationMillis() {
        return Math.max(0, endTimeMillis - startTimeMillis);
    }

    public StepStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public Integer getExitCode() {
        return exitCode;
    }
}
