package com.sluice.compute.tracking;

public final class DoNothingTracker implements ExperimentTracker {

    public static final String TYPE = "do-nothing";

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void logMetric(String key, Object value, int step) {
        // metrics still reach the step log through StepTracker
    }

    @Override
    public void logParameter(String key, Object value) {
        // not tracked
    }
}
