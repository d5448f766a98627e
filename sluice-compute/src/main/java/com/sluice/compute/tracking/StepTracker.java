package com.sluice.compute.tracking;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Tracker handed to one node execution. Records every metric for the node's step log, under {@code key} for
 * step 0 and {@code key_<step>} otherwise (a repeated key and step overwrites), and forwards to the run's tracker.
 */
public final class StepTracker implements ExperimentTracker {

    private final ExperimentTracker delegate;
    private final Map<String, Object> metrics = new LinkedHashMap<>();

    public StepTracker(ExperimentTracker delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    public static String metricKey(String key, int step) {
        return step == 0 ? key : key + "_" + step;
    }

    @Override
    public String type() {
        return delegate.type();
    }

    @Override
    public synchronized void logMetric(String key, Object value, int step) {
        metrics.put(metricKey(key, step), value);
        delegate.logMetric(key, value, step);
    }

    @Override
    public void logParameter(String key, Object value) {
        delegate.logParameter(key, value);
    }

    /** Metrics recorded so far, in first-emission order. */
    public synchronized Map<String, Object> getMetrics() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }
}
