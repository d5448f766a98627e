package com.sluice.runlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Execution record of one node path. Created PENDING, may move to RUNNING, and transitions once to SUCCESS or
 * FAILED; every mutator rejects changes after that. A re-run records a new step log in the new run log.
 * Composite nodes carry their branch logs keyed by branch path, finished branches in the order they finished.
 */
public final class StepLog {

    private final String name;
    private final String internalName;
    private final String stepType;
    private StepStatus status;
    private String message;
    private final boolean mock;
    private long startTimeMillis;
    private long endTimeMillis;
    private final List<AttemptLog> attempts;
    private final Map<String, Object> userDefinedMetrics;
    private final List<DataCatalog> dataCatalog;
    private final List<CodeIdentity> codeIdentities;
    private final Map<String, BranchLog> branches;

    @JsonCreator
    public StepLog(
            @JsonProperty("name") String name,
            @JsonProperty("internalName") String internalName,
            @JsonProperty("stepType") String stepType,
            @JsonProperty("status") StepStatus status,
            @JsonProperty("message") String message,
            @JsonProperty("mock") boolean mock,
            @JsonProperty("startTimeMillis") long startTimeMillis,
            @JsonProperty("endTimeMillis") long endTimeMillis,
            @JsonProperty("attempts") List<AttemptLog> attempts,
            @JsonProperty("userDefinedMetrics") Map<String, Object> userDefinedMetrics,
            @JsonProperty("dataCatalog") List<DataCatalog> dataCatalog,
            @JsonProperty("codeIdentities") List<CodeIdentity> codeIdentities,
            @JsonProperty("branches") Map<String, BranchLog> branches) {
        this.name = Objects.requireNonNull(name, "name");
        this.internalName = internalName != null ? internalName : name;
        this.stepType = stepType;
        this.status = status != null ? status : StepStatus.PENDING;
        this.message = message;
        this.mock = mock;
        this.startTimeMillis = startTimeMillis;
        this.endTimeMillis = endTimeMillis;
        this.attempts = attempts != null ? new ArrayList<>(attempts) : new ArrayList<>();
        this.userDefinedMetrics = userDefinedMetrics != null ? new LinkedHashMap<>(userDefinedMetrics) : new LinkedHashMap<>();
        this.dataCatalog = dataCatalog != null ? new ArrayList<>(dataCatalog) : new ArrayList<>();
        this.codeIdentities = codeIdentities != null ? new ArrayList<>(codeIdentities) : new ArrayList<>();
        this.branches = branches != null ? new LinkedHashMap<>(branches) : new LinkedHashMap<>();
    }

    /** New PENDING step log for a node path. */
    public static StepLog pending(String name, String path, String stepType) {
        return new StepLog(name, path, stepType, StepStatus.PENDING, null, false, 0L, 0L,
                null, null, null, null, null);
    }

    /** Copy of a prior run's step log marked as replayed. */
    public StepLog asMock() {
        return new StepLog(name, internalName, stepType, status, message, true, startTimeMillis, endTimeMillis,
                attempts, userDefinedMetrics, dataCatalog, codeIdentities, copyBranches(true));
    }

    public String getName() {
        return name;
    }

    /** Concrete node path, e.g. {@code fan.3.train}. */
    public String getInternalName() {
        return internalName;
    }

    public String getStepType() {
        return stepType;
    }

    public StepStatus getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }

    public boolean isMock() {
        return mock;
    }

    public long getStartTimeMillis() {
        return startTimeMillis;
    }

    public long getEndTimeMillis() {
        return endTimeMillis;
    }

    public List<AttemptLog> getAttempts() {
        return Collections.unmodifiableList(attempts);
    }

    /** Metrics in emission order; key {@code k} for step 0, {@code k_<step>} otherwise. */
    public Map<String, Object> getUserDefinedMetrics() {
        return Collections.unmodifiableMap(userDefinedMetrics);
    }

    public List<DataCatalog> getDataCatalog() {
        return Collections.unmodifiableList(dataCatalog);
    }

    public List<CodeIdentity> getCodeIdentities() {
        return Collections.unmodifiableList(codeIdentities);
    }

    public Map<String, BranchLog> getBranches() {
        return Collections.unmodifiableMap(branches);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    public void markRunning(long nowMillis) {
        requireOpen();
        this.status = StepStatus.RUNNING;
        this.startTimeMillis = nowMillis;
    }

    public void addAttempt(AttemptLog attempt) {
        requireOpen();
        attempts.add(Objects.requireNonNull(attempt, "attempt"));
    }

    public void putMetric(String key, Object value) {
        requireOpen();
        userDefinedMetrics.put(key, value);
    }

    public void addDataCatalog(List<DataCatalog> entries) {
        requireOpen();
        dataCatalog.addAll(entries);
    }

    public void addCodeIdentity(CodeIdentity identity) {
        requireOpen();
        codeIdentities.add(Objects.requireNonNull(identity, "identity"));
    }

    /** Records a branch log. A branch turning terminal moves behind the ones recorded so far. */
    public void putBranch(BranchLog branch) {
        requireOpen();
        BranchLog previous = branches.get(branch.getInternalName());
        if (previous != null && !previous.getStatus().isTerminal() && branch.getStatus().isTerminal()) {
            branches.remove(branch.getInternalName());
        }
        branches.put(branch.getInternalName(), branch);
    }

    /**
     * Moves the step log to its terminal status.
     *
     * @throws IllegalArgumentException when {@code terminal} is not SUCCESS or FAILED
     * @throws IllegalStateException    when the step log is already terminal
     */
    public void complete(StepStatus terminal, String message, long nowMillis) {
        requireOpen();
        if (terminal == null || !terminal.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + terminal);
        }
        if (startTimeMillis == 0L) {
            startTimeMillis = nowMillis;
        }
        this.status = terminal;
        this.message = message;
        this.endTimeMillis = nowMillis;
    }

    /** Deep copy, used by stores so callers never share instances with stored state. */
    public StepLog copy() {
        return new StepLog(name, internalName, stepType, status, message, mock, startTimeMillis, endTimeMillis,
                attempts, userDefinedMetrics, dataCatalog, codeIdentities, copyBranches(mock));
    }

    /** Copy of this step log whose branch logs are the stored ones plus any new ones of this step log. */
    StepLog keepingBranchesOf(StepLog stored) {
        Map<String, BranchLog> merged = new LinkedHashMap<>(stored.branches);
        branches.forEach(merged::putIfAbsent);
        return new StepLog(name, internalName, stepType, status, message, mock, startTimeMillis, endTimeMillis,
                attempts, userDefinedMetrics, dataCatalog, codeIdentities, merged);
    }

    private Map<String, BranchLog> copyBranches(boolean asMock) {
        Map<String, BranchLog> copies = new LinkedHashMap<>();
        branches.forEach((k, v) -> copies.put(k, asMock ? v.asMock() : v.copy()));
        return copies;
    }

    private void requireOpen() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Step log " + internalName + " is already " + status);
        }
    }

    @Override
    public String toString() {
        return "StepLog{" + internalName + ", status=" + status + ", attempts=" + attempts.size() + "}";
    }
}
