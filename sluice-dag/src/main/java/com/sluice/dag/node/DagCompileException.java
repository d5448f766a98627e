package com.sluice.dag.node;

import java.util.List;

/**
 * Malformed DAG declaration (cycle, missing terminal, duplicate or invalid name, missing neighbour, ...).
 * Raised before any step runs; carries every problem found, not just the first.
 */
public class DagCompileException extends RuntimeException {

    private final List<String> problems;

    public DagCompileException(List<String> problems) {
        super("Invalid DAG: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public DagCompileException(List<String> problems, Throwable cause) {
        super("Invalid DAG: " + String.join("; ", problems), cause);
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
