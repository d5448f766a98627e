package com.sluice.dag.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How composite nodes run their branches: one after another in declaration order (default)
 * or concurrently on a thread pool.
 */
public enum ExecutionMode {
    /** Branches and map items run on the calling thread, in declaration/iteration order. */
    SEQUENTIAL,
    /** Branches and map items are submitted to a thread pool and awaited. */
    PARALLEL;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static ExecutionMode fromValue(String value) {
        if (value == null || value.isBlank()) return SEQUENTIAL;
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            return SEQUENTIAL;
        }
    }

    public static ExecutionMode of(boolean parallel) {
        return parallel ? PARALLEL : SEQUENTIAL;
    }
}
