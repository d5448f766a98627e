package com.sluice.compute.env;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable copy of environment variables handed to node execution. Prefixed variables carry parameters
 * and metrics into a run without going through the tracker.
 */
public final class EnvironmentSnapshot {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Map<String, String> variables;

    private EnvironmentSnapshot(Map<String, String> variables) {
        this.variables = Collections.unmodifiableMap(new TreeMap<>(variables));
    }

    public static EnvironmentSnapshot of(Map<String, String> variables) {
        return new EnvironmentSnapshot(variables != null ? variables : Map.of());
    }

    public static EnvironmentSnapshot fromSystem() {
        return of(System.getenv());
    }

    public static EnvironmentSnapshot empty() {
        return of(Map.of());
    }

    public Map<String, String> asMap() {
        return variables;
    }

    public String get(String name) {
        return variables.get(name);
    }

    /**
     * Variables whose name starts with {@code prefix}, keyed by the rest of the name in lower case. Values that
     * parse as JSON are returned parsed ({@code 3} as a number, {@code [1,2]} as a list); others as strings.
     */
    public Map<String, Object> withPrefix(String prefix) {
        Map<String, Object> out = new LinkedHashMap<>();
        if (prefix == null || prefix.isEmpty()) return out;
        for (Map.Entry<String, String> e : variables.entrySet()) {
            String name = e.getKey();
            if (name.startsWith(prefix) && name.length() > prefix.length()) {
                out.put(name.substring(prefix.length()).toLowerCase(), parseValue(e.getValue()));
            }
        }
        return out;
    }

    static Object parseValue(String raw) {
        if (raw == null) return null;
        try {
            return MAPPER.readValue(raw, Object.class);
        } catch (JsonProcessingException e) {
            return raw;
        }
    }
}
