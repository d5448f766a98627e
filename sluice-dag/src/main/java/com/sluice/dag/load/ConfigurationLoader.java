package com.sluice.dag.load;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sluice.dag.DagConfig;
import com.sluice.dag.config.PipelineConfiguration;
import com.sluice.dag.declaration.DagDefinition;
import com.sluice.dag.node.Dag;
import com.sluice.dag.node.DagCompiler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Loads a pipeline file: reads the optional variables file, substitutes {@code ${name}} placeholders in the
 * pipeline text, parses it, compiles the DAG (dag steps may reference other pipeline files relative to the
 * pipeline file's folder) and reads the optional configuration file whose service selections win over the
 * pipeline's.
 */
public final class ConfigurationLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigurationLoader.class);

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> VARIABLES_TYPE = new TypeReference<>() {};

    /**
     * @param pipelineFile      pipeline JSON with a {@code dag} section; required
     * @param variablesFile     flat JSON object of placeholder values; may be null
     * @param configurationFile JSON with service selections only; may be null
     * @throws PipelineLoadException when a file cannot be read or parsed
     * @throws com.sluice.dag.node.DagCompileException when the DAG is malformed
     */
    public LoadedPipeline load(Path pipelineFile, Path variablesFile, Path configurationFile) {
        if (pipelineFile == null) {
            throw new PipelineLoadException("pipeline file is required");
        }
        Map<String, Object> variables = variablesFile != null ? readVariables(variablesFile) : Map.of();
        PipelineConfiguration pipeline = parse(pipelineFile, variables);
        if (pipeline.getDag() == null) {
            throw new PipelineLoadException("pipeline file has no dag section: " + pipelineFile);
        }
        PipelineConfiguration configuration = configurationFile != null
                ? parse(configurationFile, variables)
                : PipelineConfiguration.empty();

        Path baseDir = pipelineFile.toAbsolutePath().getParent();
        DagCompiler compiler = new DagCompiler(dagFile -> readDagFile(baseDir.resolve(dagFile), variables));
        Dag dag = compiler.compile(pipeline.getDag());
        String dagHash = DagConfig.dagHash(pipeline.getDag());
        log.info("Pipeline loaded | file={} | nodes={} | dagHash={} | configurationFile={}",
                pipelineFile, dag.size(), dagHash, configurationFile);
        return new LoadedPipeline(pipelineFile, pipeline, configuration, dag, dagHash);
    }

    Map<String, Object> readVariables(Path variablesFile) {
        try {
            Map<String, Object> variables = MAPPER.readValue(Files.readString(variablesFile), VARIABLES_TYPE);
            log.debug("Variables loaded | file={} | count={}", variablesFile, variables.size());
            return variables;
        } catch (IOException e) {
            throw new PipelineLoadException("Cannot read variables file " + variablesFile + ": " + e.getMessage(), e);
        }
    }

    private DagDefinition readDagFile(Path file, Map<String, Object> variables) {
        PipelineConfiguration included = parse(file, variables);
        if (included.getDag() == null) {
            throw new PipelineLoadException("dag file has no dag section: " + file);
        }
        return included.getDag();
    }

    private static PipelineConfiguration parse(Path file, Map<String, Object> variables) {
        String text;
        try {
            text = Files.readString(file);
        } catch (IOException e) {
            throw new PipelineLoadException("Cannot read " + file + ": " + e.getMessage(), e);
        }
        try {
            return DagConfig.fromJson(Variables.apply(text, variables));
        } catch (UncheckedIOException e) {
            throw new PipelineLoadException("Cannot parse " + file + ": " + e.getCause().getMessage(), e);
        }
    }
}
