package com.sluice.runlog;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Reference to one catalog artifact a step fetched ({@link Stage#GET}) or stored ({@link Stage#PUT}).
 */
public final class DataCatalog {

    public enum Stage {
        GET,
        PUT
    }

    private final String name;
    private final String dataHash;
    private final String catalogRelativePath;
    private final String catalogHandlerLocation;
    private final Stage stage;
    private final String producedBy;

    @JsonCreator
    public DataCatalog(
            @JsonProperty("name") String name,
            @JsonProperty("dataHash") String dataHash,
            @JsonProperty("catalogRelativePath") String catalogRelativePath,
            @JsonProperty("catalogHandlerLocation") String catalogHandlerLocation,
            @JsonProperty("stage") Stage stage,
            @JsonProperty("producedBy") String producedBy) {
        this.name = Objects.requireNonNull(name, "name");
        this.dataHash = dataHash;
        this.catalogRelativePath = catalogRelativePath;
        this.catalogHandlerLocation = catalogHandlerLocation;
        this.stage = stage;
        this.producedBy = producedBy;
    }

    /** Artifact name: its path relative to the compute data folder. */
    public String getName() {
        return name;
    }

    /** SHA-256 of the artifact bytes. */
    public String getDataHash() {
        return dataHash;
    }

    public String getCatalogRelativePath() {
        return catalogRelativePath;
    }

    public String getCatalogHandlerLocation() {
        return catalogHandlerLocation;
    }

    public Stage getStage() {
        return stage;
    }

    /** Node path of the step that stored the artifact; for GET, the step that fetched it. */
    public String getProducedBy() {
        return producedBy;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DataCatalog that)) return false;
        return name.equals(that.name) && Objects.equals(dataHash, that.dataHash)
                && Objects.equals(catalogRelativePath, that.catalogRelativePath) && stage == that.stage
                && Objects.equals(producedBy, that.producedBy);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, dataHash, catalogRelativePath, stage, producedBy);
    }

    @Override
    public String toString() {
        return "DataCatalog{" + name + ", stage=" + stage + ", producedBy=" + producedBy + "}";
    }
}
