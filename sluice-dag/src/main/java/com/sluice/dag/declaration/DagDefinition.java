package com.sluice.dag.declaration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sluice.dag.node.DagCompileException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Declared DAG: start step, optional description and time budget, and its steps in declaration order.
 * Used for the root pipeline and for every branch of a composite step.
 */
public final class DagDefinition {

    public static final int DEFAULT_MAX_TIME_SECONDS = 86400;

    private final String description;
    private final String startAt;
    private final Integer maxTime;
    private final Map<String, StepDefinition> steps;

    @JsonCreator
    public DagDefinition(
            @JsonProperty("description") String description,
            @JsonProperty("startAt") String startAt,
            @JsonProperty("maxTime") Integer maxTime,
            @JsonProperty("steps") Map<String, StepDefinition> steps) {
        this.description = description;
        this.startAt = startAt;
        this.maxTime = maxTime;
        this.steps = steps != null ? Collections.unmodifiableMap(new LinkedHashMap<>(steps)) : Map.of();
    }

    public static Builder builder(String startAt) {
        return new Builder(startAt);
    }

    public String getDescription() {
        return description;
    }

    public String getStartAt() {
        return startAt;
    }

    /** Declared time budget in seconds; null when not declared. */
    public Integer getMaxTime() {
        return maxTime;
    }

    public Map<String, StepDefinition> getSteps() {
        return steps;
    }

    /**
     * Programmatic declaration. Rejects a repeated step name the way the JSON reader rejects a repeated key.
     */
    public static final class Builder {
        private final String startAt;
        private String description;
        private Integer maxTime;
        private final Map<String, StepDefinition> steps = new LinkedHashMap<>();

        private Builder(String startAt) {
            this.startAt = startAt;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder maxTime(Integer maxTime) {
            this.maxTime = maxTime;
            return this;
        }

        public Builder step(String name, StepDefinition step) {
            if (steps.containsKey(name)) {
                throw new DagCompileException(List.of("duplicate step name: " + name));
            }
            steps.put(name, step);
            return this;
        }

        public DagDefinition build() {
            return new DagDefinition(description, startAt, maxTime, steps);
        }
    }
}
