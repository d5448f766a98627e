package com.sluice.compute;

import com.sluice.runlog.AttemptLog;
import com.sluice.runlog.StepStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of running one node on a compute backend: SUCCESS or FAILED, the diagnostic of the last attempt, one
 * record per attempt, and the parameters a successful task returned.
 */
public final class ExecutionOutcome {

    private final StepStatus status;
    private final String message;
    private final Integer exitCode;
    private final List<AttemptLog> attempts;
    private final Map<String, Object> returnedParameters;

    private ExecutionOutcome(StepStatus status, String message, Integer exitCode, List<AttemptLog> attempts,
                             Map<String, Object> returnedParameters) {
        this.status = status;
        this.message = message;
        this.exitCode = exitCode;
        this.attempts = attempts != null ? List.copyOf(attempts) : List.of();
        this.returnedParameters = returnedParameters != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(returnedParameters))
                : Map.of();
    }

    public static ExecutionOutcome success(List<AttemptLog> attempts, Map<String, Object> returnedParameters) {
        return new ExecutionOutcome(StepStatus.SUCCESS, null, 0, attempts, returnedParameters);
    }

    public static ExecutionOutcome failed(String message, Integer exitCode, List<AttemptLog> attempts) {
        return new ExecutionOutcome(StepStatus.FAILED, message, exitCode, attempts, null);
    }

    public static ExecutionOutcome failed(String message) {
        return failed(message, null, null);
    }

    public StepStatus getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == StepStatus.SUCCESS;
    }

    public String getMessage() {
        return message;
    }

    public Integer getExitCode() {
        return exitCode;
    }

    public List<AttemptLog> getAttempts() {
        return attempts;
    }

    public Map<String, Object> getReturnedParameters() {
        return returnedParameters;
    }

    @Override
    public String toString() {
        return "ExecutionOutcome{" + status + (message != null ? ", " + message : "") + ", attempts=" + attempts.size() + "}";
    }
}
