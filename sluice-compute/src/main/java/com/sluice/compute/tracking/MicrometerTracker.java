package com.sluice.compute.tracking;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracker publishing numeric metrics as gauges {@value #METRIC_NAME} tagged with the metric key and step.
 * Non-numeric values and parameters are kept in memory and logged.
 */
public final class MicrometerTracker implements ExperimentTracker {

    public static final String TYPE = "micrometer";
    public static final String METRIC_NAME = "sluice.user.metric";

    private static final Logger log = LoggerFactory.getLogger(MicrometerTracker.class);

    private final MeterRegistry registry;
    private final Map<String, AtomicLong> gauges = new ConcurrentHashMap<>();
    private final Map<String, Object> parameters = Collections.synchronizedMap(new LinkedHashMap<>());

    public MicrometerTracker(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public void logMetric(String key, Object value, int step) {
        if (!(value instanceof Number number)) {
            log.debug("Metric not numeric; not published | key={} | step={} | value={}", key, step, value);
            return;
        }
        AtomicLong bits = gauges.computeIfAbsent(key + "#" + step, k -> {
            AtomicLong holder = new AtomicLong();
            registry.gauge(METRIC_NAME, Tags.of("key", key, "step", String.valueOf(step)), holder,
                    h -> Double.longBitsToDouble(h.get()));
            return holder;
        });
        bits.set(Double.doubleToLongBits(number.doubleValue()));
    }

    @Override
    public void logParameter(String key, Object value) {
        parameters.put(key, value);
        log.info("Tracked parameter | key={} | value={}", key, value);
    }

    public Map<String, Object> getParameters() {
        synchronized (parameters) {
            return new LinkedHashMap<>(parameters);
        }
    }
}
