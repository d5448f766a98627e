package com.sluice.engine.rerun;

import com.sluice.runlog.RunLog;
import com.sluice.runlog.StepLog;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Action per node path for a re-run, in planning order, with the prior run whose step logs skipped paths reuse.
 * Paths the plan does not name (for example new map items) execute.
 */
public final class RerunPlan {

    private final RunLog priorRun;
    private final Map<String, Action> actions;

    RerunPlan(RunLog priorRun, Map<String, Action> actions) {
        this.priorRun = Objects.requireNonNull(priorRun, "priorRun");
        this.actions = Collections.unmodifiableMap(new LinkedHashMap<>(actions));
    }

    public Action actionFor(String path) {
        return actions.getOrDefault(path, Action.EXECUTE);
    }

    public Map<String, Action> getActions() {
        return actions;
    }

    public RunLog getPriorRun() {
        return priorRun;
    }

    /** Prior step log a skipped path reuses. */
    public StepLog priorStep(String path) {
        return priorRun.searchStep(path);
    }

    public long count(Action action) {
        return actions.values().stream().filter(a -> a == action).count();
    }

    @Override
    public String toString() {
        return "RerunPlan{prior=" + priorRun.getRunId() + ", skip=" + count(Action.SKIP)
                + ", execute=" + count(Action.EXECUTE) + "}";
    }
}
