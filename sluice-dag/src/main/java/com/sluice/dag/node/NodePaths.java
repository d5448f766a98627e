package com.sluice.dag.node;

import java.util.Map;

/**
 * Dotted node paths. Internal names are path templates: a map branch contributes the segment
 * {@value #MAP_PLACEHOLDER}, replaced by the iteration value when the step runs.
 */
public final class NodePaths {

    public static final String SEPARATOR = ".";
    public static final String MAP_PLACEHOLDER = "map_variable_placeholder";
    public static final String DAG_BRANCH = "dag";

    private NodePaths() {
    }

    public static String child(String parent, String name) {
        return parent == null || parent.isEmpty() ? name : parent + SEPARATOR + name;
    }

    /**
     * Resolves placeholders left to right with the bound iteration values (outermost map first).
     */
    public static String resolve(String internalName, Map<String, ?> mapVariables) {
        if (internalName == null || mapVariables == null || mapVariables.isEmpty()) {
            return internalName;
        }
        String resolved = internalName;
        for (Object value : mapVariables.values()) {
            int at = resolved.indexOf(MAP_PLACEHOLDER);
            if (at < 0) break;
            resolved = resolved.substring(0, at) + segment(value) + resolved.substring(at + MAP_PLACEHOLDER.length());
        }
        return resolved;
    }

    /** Path segment for an iteration value. */
    public static String segment(Object value) {
        return String.valueOf(value);
    }

    /** True when the value can be used as a single path segment. */
    public static boolean isValidSegment(String segment) {
        return segment != null && !segment.isBlank() && !segment.contains(SEPARATOR) && !segment.contains("%");
    }
}
