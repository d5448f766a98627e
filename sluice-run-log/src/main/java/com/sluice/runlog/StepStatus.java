package com.sluice.runlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a step, branch or run. PENDING and RUNNING are transient; SUCCESS and FAILED are terminal.
 */
public enum StepStatus {
    PENDING,
    RUNNING,
    SUCCESS,
    FAILED;

    @JsonValue
    public String toValue() {
        return name();
    }

    @JsonCreator
    public static StepStatus fromValue(String value) {
        if (value == null || value.isBlank()) return PENDING;
        return valueOf(value.trim().toUpperCase());
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
