package com.sluice.engine.traversal;

import com.sluice.dag.node.NodePaths;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Map iteration values bound for the branch being traversed. They resolve the placeholders of node paths,
 * outermost map first, and are visible as parameters inside the branch only (an inner binding of the same
 * name hides the outer one).
 */
public final class BranchScope {

    private static final BranchScope ROOT = new BranchScope(Map.of(), Map.of());

    /** Keyed by nesting depth and name, in nesting order. */
    private final Map<String, Object> pathValues;
    private final Map<String, Object> bindings;

    private BranchScope(Map<String, Object> pathValues, Map<String, Object> bindings) {
        this.pathValues = Collections.unmodifiableMap(pathValues);
        this.bindings = Collections.unmodifiableMap(bindings);
    }

    public static BranchScope root() {
        return ROOT;
    }

    public BranchScope with(String name, Object value) {
        Map<String, Object> values = new LinkedHashMap<>(pathValues);
        values.put(values.size() + ":" + name, value);
        Map<String, Object> bound = new LinkedHashMap<>(bindings);
        bound.put(name, value);
        return new BranchScope(values, bound);
    }

    /** Concrete path of a node or branch template in this scope. */
    public String resolve(String internalName) {
        return NodePaths.resolve(internalName, pathValues);
    }

    public Map<String, Object> getBindings() {
        return bindings;
    }

    /** Run parameters overlaid with this scope's iteration values. */
    public Map<String, Object> bind(Map<String, Object> runParameters) {
        Map<String, Object> bound = new LinkedHashMap<>(runParameters);
        bound.putAll(bindings);
        return bound;
    }
}
