package com.sluice.dag.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sluice.dag.declaration.DagDefinition;

/**
 * Root of a pipeline file: the DAG declaration plus optional service selections.
 * A configuration file has the same shape without {@code dag}.
 */
public final class PipelineConfiguration {

    private final DagDefinition dag;
    private final ServiceConfig runLogStore;
    private final ServiceConfig catalog;
    private final ServiceConfig secrets;
    private final ServiceConfig mode;
    private final ServiceConfig experimentTracker;

    @JsonCreator
    public PipelineConfiguration(
            @JsonProperty("dag") DagDefinition dag,
            @JsonProperty("runLogStore") ServiceConfig runLogStore,
            @JsonProperty("catalog") ServiceConfig catalog,
            @JsonProperty("secrets") ServiceConfig secrets,
            @JsonProperty("mode") ServiceConfig mode,
            @JsonProperty("experimentTracker") ServiceConfig experimentTracker) {
        this.dag = dag;
        this.runLogStore = runLogStore;
        this.catalog = catalog;
        this.secrets = secrets;
        this.mode = mode;
        this.experimentTracker = experimentTracker;
    }

    public static PipelineConfiguration of(DagDefinition dag) {
        return new PipelineConfiguration(dag, null, null, null, null, null);
    }

    public static PipelineConfiguration empty() {
        return new PipelineConfiguration(null, null, null, null, null, null);
    }

    public DagDefinition getDag() {
        return dag;
    }

    public ServiceConfig getRunLogStore() {
        return runLogStore;
    }

    public ServiceConfig getCatalog() {
        return catalog;
    }

    public ServiceConfig getSecrets() {
        return secrets;
    }

    public ServiceConfig getMode() {
        return mode;
    }

    public ServiceConfig getExperimentTracker() {
        return experimentTracker;
    }

    /** Service selection for the role; null when this file does not set it. */
    public ServiceConfig getService(ServiceRole role) {
        return switch (role) {
            case RUN_LOG_STORE -> runLogStore;
            case CATALOG -> catalog;
            case SECRETS -> secrets;
            case MODE -> mode;
            case EXPERIMENT_TRACKER -> experimentTracker;
        };
    }
}
