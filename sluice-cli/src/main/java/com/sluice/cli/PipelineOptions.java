package com.sluice.cli;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sluice.dag.load.ConfigurationLoader;
import com.sluice.dag.load.LoadedPipeline;
import com.sluice.dag.load.PipelineLoadException;
import com.sluice.engine.RunRequest;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Options shared by {@code execute} and {@code retry}.
 */
public final class PipelineOptions {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final TypeReference<Map<String, Object>> PARAMETERS_TYPE = new TypeReference<>() {};

    @Option(names = {"-f", "--file"}, required = true, paramLabel = "<pipeline.json>",
            description = "Pipeline definition with a dag section and optional services")
    Path file;

    @Option(names = {"-c", "--config-file"}, paramLabel = "<config.json>",
            description = "Service selections that override the pipeline file")
    Path configFile;

    @Option(names = {"-v", "--var-file"}, paramLabel = "<variables.json>",
            description = "Values for ${name} placeholders in the pipeline and configuration files")
    Path varFile;

    @Option(names = {"-p", "--parameters-file"}, paramLabel = "<parameters.json>",
            description = "Initial run parameters as a JSON object")
    Path parametersFile;

    @Option(names = "--run-id", description = "Run id; generated when absent")
    String runId;

    @Option(names = "--tag", description = "Free-form tag stored in the run log")
    String tag;

    @Option(names = "--parallel", description = "Run parallel branches and map items concurrently")
    boolean parallel;

    LoadedPipeline load(Path workingDirectory) {
        return new ConfigurationLoader().load(
                workingDirectory.resolve(file),
                varFile != null ? workingDirectory.resolve(varFile) : null,
                configFile != null ? workingDirectory.resolve(configFile) : null);
    }

    RunRequest request(Path workingDirectory) {
        Map<String, Object> parameters = Map.of();
        if (parametersFile != null) {
            Path path = workingDirectory.resolve(parametersFile);
            try {
                parameters = MAPPER.readValue(Files.readString(path), PARAMETERS_TYPE);
            } catch (IOException e) {
                throw new PipelineLoadException("Cannot read parameters file " + path + ": " + e.getMessage(), e);
            }
        }
        return new RunRequest(runId, tag, parameters);
    }
}
