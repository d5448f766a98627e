package com.sluice.dag.node;

import com.sluice.dag.declaration.DagDefinition;

/** Resolves the {@code dagFile} reference of a dag step to its declaration. */
@FunctionalInterface
public interface DagFileResolver {

    DagDefinition resolve(String dagFile);
}
