package com.sluice.dag.load;

import com.sluice.dag.config.PipelineConfiguration;
import com.sluice.dag.config.ServiceConfig;
import com.sluice.dag.config.ServiceRole;
import com.sluice.dag.node.Dag;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Result of loading a pipeline: the compiled DAG, its hash, and the pipeline and configuration files
 * for resolving service selections.
 */
public final class LoadedPipeline {

    private final Path pipelineFile;
    private final PipelineConfiguration pipeline;
    private final PipelineConfiguration configuration;
    private final Dag dag;
    private final String dagHash;

    public LoadedPipeline(Path pipelineFile, PipelineConfiguration pipeline, PipelineConfiguration configuration,
                          Dag dag, String dagHash) {
        this.pipelineFile = pipelineFile;
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.configuration = configuration != null ? configuration : PipelineConfiguration.empty();
        this.dag = Objects.requireNonNull(dag, "dag");
        this.dagHash = Objects.requireNonNull(dagHash, "dagHash");
    }

    public Path getPipelineFile() {
        return pipelineFile;
    }

    public PipelineConfiguration getPipeline() {
        return pipeline;
    }

    public PipelineConfiguration getConfiguration() {
        return configuration;
    }

    public Dag getDag() {
        return dag;
    }

    public String getDagHash() {
        return dagHash;
    }

    /**
     * Service selection with precedence: configuration file, then pipeline file, then {@code fallback}.
     */
    public ServiceConfig service(ServiceRole role, ServiceConfig fallback) {
        ServiceConfig fromConfiguration = configuration.getService(role);
        if (fromConfiguration != null) return fromConfiguration;
        ServiceConfig fromPipeline = pipeline.getService(role);
        return fromPipeline != null ? fromPipeline : fallback;
    }
}
