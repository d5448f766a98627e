package com.sluice.dag.node;

public enum EdgeKind {
    NEXT,
    ON_FAILURE
}
