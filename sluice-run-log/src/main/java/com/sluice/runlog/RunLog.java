package com.sluice.runlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * All execution records of one run. Root step logs are keyed by node name; nested step logs live in the
 * branch logs of their composite parent. Node paths alternate step and branch segments:
 * {@code step.branch.step.branch.step}.
 */
public final class RunLog {

    private final String runId;
    private String dagHash;
    private String originalRunId;
    private boolean useCached;
    private String tag;
    private StepStatus status;
    private String message;
    private final Map<String, Object> parameters;
    private final Map<String, StepLog> steps;

    @JsonCreator
    public RunLog(
            @JsonProperty("runId") String runId,
            @JsonProperty("dagHash") String dagHash,
            @JsonProperty("originalRunId") String originalRunId,
            @JsonProperty("useCached") boolean useCached,
            @JsonProperty("tag") String tag,
            @JsonProperty("status") StepStatus status,
            @JsonProperty("message") String message,
            @JsonProperty("parameters") Map<String, Object> parameters,
            @JsonProperty("steps") Map<String, StepLog> steps) {
        this.runId = Objects.requireNonNull(runId, "runId");
        this.dagHash = dagHash;
        this.originalRunId = originalRunId;
        this.useCached = useCached;
        this.tag = tag;
        this.status = status != null ? status : StepStatus.PENDING;
        this.message = message;
        this.parameters = parameters != null ? new LinkedHashMap<>(parameters) : new LinkedHashMap<>();
        this.steps = steps != null ? new LinkedHashMap<>(steps) : new LinkedHashMap<>();
    }

    public static RunLog create(String runId, String dagHash, String tag) {
        return new RunLog(runId, dagHash, null, false, tag, StepStatus.RUNNING, null, null, null);
    }

    public String getRunId() {
        return runId;
    }

    public String getDagHash() {
        return dagHash;
    }

    public void setDagHash(String dagHash) {
        this.dagHash = dagHash;
    }

    /** Run whose results a re-run reused; null for a fresh run. */
    public String getOriginalRunId() {
        return originalRunId;
    }

    public boolean isUseCached() {
        return useCached;
    }

    /** Marks this run as a re-run of {@code previousRunId}. */
    public void markRerunOf(String previousRunId) {
        this.originalRunId = previousRunId;
        this.useCached = true;
    }

    public String getTag() {
        return tag;
    }

    public StepStatus getStatus() {
        return status;
    }

    public void setStatus(StepStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    /** Why the run failed when it stopped on an error rather than at the fail step; null otherwise. */
    public String getMessage() {
        return message;
    }

    public void fail(String message) {
        this.status = StepStatus.FAILED;
        this.message = message;
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    /** Merges parameters; a later value for the same key wins. */
    public void putParameters(Map<String, ?> values) {
        parameters.putAll(values);
    }

    public Map<String, StepLog> getSteps() {
        return Collections.unmodifiableMap(steps);
    }

    /** Step log at a node path; null when none was recorded. */
    public StepLog searchStep(String path) {
        String[] parts = split(path);
        if (parts.length == 0 || parts.length % 2 == 0) return null;
        StepLog step = steps.get(parts[0]);
        for (int i = 1; step != null && i < parts.length; i += 2) {
            BranchLog branch = step.getBranches().get(join(parts, i));
            step = branch != null ? branch.getStep(join(parts, i + 1)) : null;
        }
        return step;
    }

    /** Branch log at a branch path; null when none was recorded. */
    public BranchLog searchBranch(String path) {
        String[] parts = split(path);
        if (parts.length == 0 || parts.length % 2 != 0) return null;
        StepLog parent = searchStep(join(parts, parts.length - 2));
        return parent != null ? parent.getBranches().get(path) : null;
    }

    /**
     * Records a step log at its path, replacing an earlier record of the same path.
     *
     * @throws BranchLogNotFoundException when the enclosing branch was not recorded first
     */
    public void putStep(StepLog step) {
        String path = step.getInternalName();
        String[] parts = split(path);
        if (parts.length == 1) {
            steps.put(path, step);
            return;
        }
        String branchPath = join(parts, parts.length - 2);
        BranchLog branch = searchBranch(branchPath);
        if (branch == null) {
            throw new BranchLogNotFoundException(runId, branchPath);
        }
        branch.putStep(step);
    }

    /**
     * Records a branch log under its composite step, replacing an earlier record of the same path.
     *
     * @throws StepLogNotFoundException when the composite step was not recorded first
     */
    public void putBranch(BranchLog branch) {
        String[] parts = split(branch.getInternalName());
        String parentPath = join(parts, parts.length - 2);
        StepLog parent = searchStep(parentPath);
        if (parent == null) {
            throw new StepLogNotFoundException(runId, parentPath);
        }
        parent.putBranch(branch);
    }

    /** Every step log keyed by node path, depth first in recording order. */
    public Map<String, StepLog> flatten() {
        Map<String, StepLog> flat = new LinkedHashMap<>();
        for (StepLog step : steps.values()) {
            collect(step, flat);
        }
        return flat;
    }

    private static void collect(StepLog step, Map<String, StepLog> flat) {
        flat.put(step.getInternalName(), step);
        for (BranchLog branch : step.getBranches().values()) {
            for (StepLog child : branch.getSteps().values()) {
                collect(child, flat);
            }
        }
    }

    public RunLog copy() {
        Map<String, StepLog> copies = new LinkedHashMap<>();
        steps.forEach((k, v) -> copies.put(k, v.copy()));
        return new RunLog(runId, dagHash, originalRunId, useCached, tag, status, message, parameters, copies);
    }

    private static String[] split(String path) {
        return path == null || path.isBlank() ? new String[0] : path.split("\\.");
    }

    /** First {@code index + 1} segments joined back into a path. */
    private static String join(String[] parts, int index) {
        return String.join(".", Arrays.copyOfRange(parts, 0, index + 1));
    }

    @Override
    public String toString() {
        return "RunLog{" + runId + ", status=" + status + ", steps=" + steps.size() + "}";
    }
}
