package com.sluice.compute.tracking;

/**
 * Capability a running node uses to report metrics and parameters to an experiment tracking system.
 */
public interface ExperimentTracker {

    /** Tracker type name as used in configuration. */
    String type();

    /**
     * @param step 0 for a single value; a positive step for a series (epoch, iteration)
     */
    void logMetric(String key, Object value, int step);

    void logParameter(String key, Object value);
}
