package com.sluice.dag.node;

import java.util.Objects;

/** Directed relation between two nodes of the same DAG. */
public record Edge(String from, String to, EdgeKind kind) {

    public Edge {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
        Objects.requireNonNull(kind, "kind");
    }
}
