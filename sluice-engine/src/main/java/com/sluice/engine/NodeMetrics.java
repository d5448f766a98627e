package com.sluice.engine;

import com.sluice.dag.node.NodeKind;
import com.sluice.runlog.StepStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Objects;

/**
 * Node execution meters: counter {@value #EXECUTIONS} tagged by kind and status, timer {@value #DURATION}
 * tagged by kind.
 */
public final class NodeMetrics {

    public static final String EXECUTIONS = "sluice.node.executions";
    public static final String DURATION = "sluice.node.duration";

    private final MeterRegistry registry;

    public NodeMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public void record(NodeKind kind, StepStatus status, long durationMillis) {
        Counter.builder(EXECUTIONS)
                .tag("kind", kind.toValue())
                .tag("status", status.toValue())
                .register(registry)
                .increment();
        Timer.builder(DURATION)
                .tag("kind", kind.toValue())
                .register(registry)
                .record(Duration.ofMillis(Math.max(0, durationMillis)));
    }

    public MeterRegistry getRegistry() {
        return registry;
    }
}
