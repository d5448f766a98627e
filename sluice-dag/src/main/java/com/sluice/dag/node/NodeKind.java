package com.sluice.dag.node;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a DAG node. JSON uses the lower-case, hyphenated form ({@code task}, {@code as-is}, ...);
 * unknown values deserialize as {@link #UNKNOWN} and are rejected by the compiler.
 */
public enum NodeKind {
    /** Runs a command on the compute backend. */
    TASK("task"),
    /** Placeholder step; always succeeds without calling the compute backend. */
    AS_IS("as-is"),
    /** Runs every named branch DAG, concurrently in parallel mode. */
    PARALLEL("parallel"),
    /** Replicates one branch DAG per item of a list parameter. */
    MAP("map"),
    /** Embedded sub-DAG, run as a single branch. */
    DAG("dag"),
    SUCCESS("success"),
    FAIL("fail"),
    /** Used when the declaration contains an unknown type string. */
    UNKNOWN("unknown");

    private final String value;

    NodeKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String toValue() {
        return value;
    }

    @JsonCreator
    public static NodeKind fromValue(String value) {
        if (value == null || value.isBlank()) return UNKNOWN;
        String normalized = value.trim().toLowerCase().replace('_', '-');
        for (NodeKind k : values()) {
            if (k != UNKNOWN && k.value.equals(normalized)) return k;
        }
        return UNKNOWN;
    }

    public boolean isTerminal() {
        return this == SUCCESS || this == FAIL;
    }

    public boolean isComposite() {
        return this == PARALLEL || this == MAP || this == DAG;
    }
}
