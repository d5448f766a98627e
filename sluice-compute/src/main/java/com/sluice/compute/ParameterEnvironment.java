package com.sluice.compute;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Exports bound parameters to a process environment as {@code <prefix><NAME>}: strings as-is, other values as JSON.
 */
final class ParameterEnvironment {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ParameterEnvironment() {
    }

    static Map<String, String> export(Map<String, Object> parameters, String prefix) {
        Map<String, String> env = new LinkedHashMap<>();
        parameters.forEach((name, value) -> env.put(prefix + name.toUpperCase(), render(value)));
        return env;
    }

    static String render(Object value) {
        if (value instanceof String s) return s;
        try {
            return MAPPER.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
