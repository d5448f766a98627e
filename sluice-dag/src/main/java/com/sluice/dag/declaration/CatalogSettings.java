package com.sluice.dag.declaration;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Per-step catalog settings: glob patterns fetched before the step runs ({@code get}),
 * patterns stored after it succeeds ({@code put}) and an optional working area override.
 */
public final class CatalogSettings {

    private final List<String> get;
    private final List<String> put;
    private final String computeDataFolder;

    @JsonCreator
    public CatalogSettings(
            @JsonProperty("get") List<String> get,
            @JsonProperty("put") List<String> put,
            @JsonProperty("computeDataFolder") String computeDataFolder) {
        this.get = get != null ? List.copyOf(get) : List.of();
        this.put = put != null ? List.copyOf(put) : List.of();
        this.computeDataFolder = computeDataFolder;
    }

    public List<String> getGet() {
        return get;
    }

    public List<String> getPut() {
        return put;
    }

    /** Working area override for this step; null means the run default. */
    public String getComputeDataFolder() {
        return computeDataFolder;
    }
}
