package com.sluice.runlog;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * JSON form of a run log, as written by the file-system and JDBC stores. Serializing, reading back and
 * serializing again yields the same text.
 */
public final class RunLogJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private RunLogJson() {
    }

    public static String toJson(RunLog runLog) {
        try {
            return MAPPER.writeValueAsString(runLog);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }

    public static RunLog fromJson(String json) {
        try {
            return MAPPER.readValue(json, RunLog.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(new IOException(e));
        }
    }
}
