package com.sluice.dag;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.sluice.dag.config.PipelineConfiguration;
import com.sluice.dag.declaration.DagDefinition;
import com.sluice.dag.node.DagCompileException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;

/**
 * Serialization of pipeline files and DAG declarations, and the DAG hash used to detect a changed DAG on re-run.
 * Empty values are excluded when serializing. A repeated key in the JSON is reported as a compile problem.
 */
public final class DagConfig {

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION)
            .serializationInclusion(JsonInclude.Include.NON_EMPTY)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    /** Canonical form for hashing: sorted keys, no whitespace. */
    private static final ObjectMapper CANONICAL = JsonMapper.builder()
            .serializationInclusion(JsonInclude.Include.NON_EMPTY)
            .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .build();

    private DagConfig() {
    }

    /**
     * Deserializes a pipeline (or configuration) file.
     *
     * @throws DagCompileException when the JSON repeats a key
     * @throws UncheckedIOException on any other parse failure
     */
    public static PipelineConfiguration fromJson(String json) {
        try {
            return MAPPER.readValue(json, PipelineConfiguration.class);
        } catch (JsonProcessingException e) {
            throw duplicateOrUnchecked(e);
        }
    }

    public static DagDefinition dagFromJson(String json) {
        try {
            return MAPPER.readValue(json, DagDefinition.class);
        } catch (JsonProcessingException e) {
            throw duplicateOrUnchecked(e);
        }
    }

    public static String toJson(PipelineConfiguration config) {
        try {
            return MAPPER.writeValueAsString(config);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static String toJson(DagDefinition dag) {
        try {
            return MAPPER.writeValueAsString(dag);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    /**
     * SHA-256 (hex) of the canonical JSON of the declaration. Two declarations that differ only in key order hash equal.
     */
    public static String dagHash(DagDefinition dag) {
        try {
            byte[] canonical = CANONICAL.writeValueAsString(dag).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** The parser's duplicate-key error may arrive wrapped in a mapping exception; look through the causes. */
    private static RuntimeException duplicateOrUnchecked(JsonProcessingException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof JsonProcessingException jpe) {
                String message = jpe.getOriginalMessage();
                if (message != null && message.startsWith("Duplicate field")) {
                    return new DagCompileException(List.of("duplicate declaration key: " + message), e);
                }
            }
        }
        return new UncheckedIOException(e);
    }
}
