package com.sluice.dag.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Selection of one implementation for a {@link ServiceRole}: its type name (e.g. {@code file-system})
 * and free-form settings for that implementation.
 */
public final class ServiceConfig {

    private final String type;
    private final Map<String, Object> config;

    @JsonCreator
    public ServiceConfig(
            @JsonProperty("type") String type,
            @JsonProperty("config") Map<String, Object> config) {
        this.type = Objects.requireNonNull(type, "type");
        this.config = config != null ? Collections.unmodifiableMap(new LinkedHashMap<>(config)) : Map.of();
    }

    public static ServiceConfig of(String type) {
        return new ServiceConfig(type, null);
    }

    public static ServiceConfig of(String type, Map<String, Object> config) {
        return new ServiceConfig(type, config);
    }

    public String getType() {
        return type;
    }

    public Map<String, Object> getConfig() {
        return config;
    }

    /** String setting, or {@code defaultValue} when absent or blank. */
    public String getString(String key, String defaultValue) {
        Object v = config.get(key);
        if (v == null) return defaultValue;
        String s = String.valueOf(v);
        return s.isBlank() ? defaultValue : s;
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        Object v = config.get(key);
        if (v instanceof Boolean b) return b;
        if (v == null) return defaultValue;
        String s = String.valueOf(v).trim();
        return s.isEmpty() ? defaultValue : "true".equalsIgnoreCase(s) || "1".equals(s);
    }

    public boolean isType(String candidate) {
        return type.equalsIgnoreCase(candidate);
    }

    @Override
    public String toString() {
        return "ServiceConfig{type=" + type + ", config=" + config.keySet() + "}";
    }
}
