package com.sluice.compute;

import com.sluice.dag.node.Node;
import com.sluice.runlog.CodeIdentity;

import java.nio.file.Path;
import java.util.List;

/**
 * Runs the command of a {@code task} node. A node's own failure is returned as a FAILED outcome, never thrown.
 */
public interface ComputeBackend {

    /** Backend type name as used in configuration. */
    String type();

    ExecutionOutcome execute(Node node, TaskContext context);

    /** Identities of the code the node runs with, recorded on its step log when it is dispatched. */
    List<CodeIdentity> codeIdentities(Node node, Path workingDirectory);
}
