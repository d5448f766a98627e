package com.sluice.runlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One branch of a composite node: a parallel branch, a map iteration or an embedded dag.
 * Step logs are keyed by their full node path, in the order they were first recorded.
 */
public final class BranchLog {

    private final String internalName;
    private StepStatus status;
    private final Map<String, StepLog> steps;

    @JsonCreator
    public BranchLog(
            @JsonProperty("internalName") String internalName,
            @JsonProperty("status") StepStatus status,
            @JsonProperty("steps") Map<String, StepLog> steps) {
        this.internalName = Objects.requireNonNull(internalName, "internalName");
        this.status = status != null ? status : StepStatus.PENDING;
        this.steps = steps != null ? new LinkedHashMap<>(steps) : new LinkedHashMap<>();
    }

    public static BranchLog pending(String path) {
        return new BranchLog(path, StepStatus.PENDING, null);
    }

    /** Branch path, e.g. {@code par.left} or {@code fan.3}. */
    public String getInternalName() {
        return internalName;
    }

    public StepStatus getStatus() {
        return status;
    }

    public void setStatus(StepStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public Map<String, StepLog> getSteps() {
        return Collections.unmodifiableMap(steps);
    }

    public StepLog getStep(String path) {
        return steps.get(path);
    }

    public void putStep(StepLog step) {
        steps.put(step.getInternalName(), step);
    }

    public BranchLog copy() {
        Map<String, StepLog> copies = new LinkedHashMap<>();
        steps.forEach((k, v) -> copies.put(k, v.copy()));
        return new BranchLog(internalName, status, copies);
    }

    /** Copy of this branch log whose step logs are the stored ones plus any new ones of this branch log. */
    BranchLog keepingStepsOf(BranchLog stored) {
        Map<String, StepLog> merged = new LinkedHashMap<>(stored.steps);
        steps.forEach(merged::putIfAbsent);
        return new BranchLog(internalName, status, merged);
    }

    BranchLog asMock() {
        Map<String, StepLog> copies = new LinkedHashMap<>();
        steps.forEach((k, v) -> copies.put(k, v.asMock()));
        return new BranchLog(internalName, status, copies);
    }
}
