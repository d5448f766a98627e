package com.sluice.compute.tracking;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;

class StepTrackerTest {

    @Test
    void metricKeysFollowStepAndLaterEmissionOverwrites() {
        StepTracker tracker = new StepTracker(new DoNothingTracker());

        tracker.logMetric("loss", 0.9, 0);
        tracker.logMetric("loss", 0.5, 1);
        tracker.logMetric("loss", 0.4, 2);
        tracker.logMetric("loss", 0.45, 1);
        tracker.logMetric("accuracy", 0.8, 0);
        tracker.logMetric("loss", 0.3, 0);

        Map<String, Object> metrics = tracker.getMetrics();
        assertEquals(List.of("loss", "loss_1", "loss_2", "accuracy"), List.copyOf(metrics.keySet()));
        assertEquals(0.3, metrics.get("loss"));
        assertEquals(0.45, metrics.get("loss_1"));
    }

    @Test
    void micrometerTrackerPublishesNumericGauges() {
        SimpleMeterRegistry registry = new SimpleMeterRegistry();
        StepTracker tracker = new StepTracker(new MicrometerTracker(registry));

        tracker.logMetric("loss", 0.5, 3);
        tracker.logMetric("loss", 0.25, 3);
        tracker.logMetric("label", "cat", 0);

        assertEquals(0.25, registry.get(MicrometerTracker.METRIC_NAME).tag("key", "loss").tag("step", "3")
                .gauge().value());
        assertEquals(1, registry.find(MicrometerTracker.METRIC_NAME).gauges().size());
        assertEquals("cat", tracker.getMetrics().get("label"));
    }
}
