package com.sluice.engine.node.handlers;

import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;
import com.sluice.engine.EngineInvariantException;
import com.sluice.engine.traversal.BranchScope;
import com.sluice.runlog.StepStatus;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Maps NodeKind to NodeHandler. Kinds without a handler fail the run.
 */
public final class NodeHandlerRegistry {

    private final Map<NodeKind, NodeHandler> handlers = new EnumMap<>(NodeKind.class);
    private final NodeHandler unsupported = new UnsupportedKindHandler();

    public NodeHandlerRegistry(List<NodeHandler> handlerList) {
        for (NodeHandler handler : handlerList) {
            for (NodeKind kind : handler.supportedKinds()) {
                handlers.put(kind, handler);
            }
        }
    }

    /** Registry with the handlers for every executable kind. */
    public static NodeHandlerRegistry defaults() {
        return new NodeHandlerRegistry(List.of(
                new TaskHandler(),
                new ParallelHandler(),
                new MapHandler(),
                new DagHandler(),
                new TerminalHandler()));
    }

    public NodeHandler forKind(NodeKind kind) {
        if (kind == null) {
            return unsupported;
        }
        return handlers.getOrDefault(kind, unsupported);
    }

    private static final class UnsupportedKindHandler implements NodeHandler {
        @Override
        public Set<NodeKind> supportedKinds() {
            return Set.of();
        }

        @Override
        public StepStatus handle(Node node, String path, BranchScope scope, HandlerContext ctx) {
            throw new EngineInvariantException("No handler for step '" + path + "' of kind " + node.getKind());
        }
    }
}
