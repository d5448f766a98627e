package com.sluice.engine;

import com.sluice.catalog.DoNothingCatalog;
import com.sluice.catalog.FileSystemCatalog;
import com.sluice.compute.ContainerComputeBackend;
import com.sluice.compute.TaskRegistry;
import com.sluice.compute.env.EnvironmentSnapshot;
import com.sluice.compute.secrets.EnvSecretsProvider;
import com.sluice.compute.tracking.MicrometerTracker;
import com.sluice.config.SluiceConfig;
import com.sluice.dag.config.ExecutionMode;
import com.sluice.dag.load.ConfigurationLoader;
import com.sluice.dag.load.LoadedPipeline;
import com.sluice.dag.load.PipelineLoadException;
import com.sluice.runlog.store.BufferedRunLogStore;
import com.sluice.runlog.store.FileSystemRunLogStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ServiceFactoryTest {

    private static final String DAG = """
            "dag": {"startAt": "a", "steps": {
              "a": {"type": "as-is", "next": "success"},
              "success": {"type": "success"},
              "fail": {"type": "fail"}}}
            """;

    @TempDir
    Path workDir;

    private LoadedPipeline load(String services) throws Exception {
        Path file = workDir.resolve("pipeline.json");
        Files.writeString(file, "{" + DAG + (services.isEmpty() ? "" : "," + services) + "}");
        return new ConfigurationLoader().load(file, null, null);
    }

    private EngineServices create(LoadedPipeline pipeline, SluiceConfig config, boolean parallel) {
        return ServiceFactory.create(pipeline, config, new TaskRegistry(),
                EnvironmentSnapshot.of(Map.of("APP_TOKEN", "s3cret")), new SimpleMeterRegistry(), workDir, parallel);
    }

    @Test
    void create_defaultsComeFromEnvironmentConfig() throws Exception {
        EngineServices services = create(load(""), SluiceConfig.builder().build(), false);

        assertInstanceOf(BufferedRunLogStore.class, services.getRunLogStore());
        assertInstanceOf(FileSystemCatalog.class, services.getCatalog());
        assertEquals(workDir.resolve(".catalog"), ((FileSystemCatalog) services.getCatalog()).getCatalogLocation());
        assertEquals(ExecutionMode.SEQUENTIAL, services.getMode());
        assertEquals("data", services.getComputeDataFolder());
    }

    @Test
    void create_pipelineServicesOverrideDefaults() throws Exception {
        LoadedPipeline pipeline = load("""
                "runLogStore": {"type": "file-system", "config": {"logFolder": "logs"}},
                "catalog": {"type": "do-nothing"},
                "secrets": {"type": "env", "config": {"prefix": "APP_"}},
                "mode": {"type": "local-container", "config": {"dockerImage": "sluice/task:1", "enableParallel": true}},
                "experimentTracker": {"type": "micrometer"}
                """);

        EngineServices services = create(pipeline, SluiceConfig.builder().build(), false);

        assertInstanceOf(FileSystemRunLogStore.class, services.getRunLogStore());
        assertInstanceOf(DoNothingCatalog.class, services.getCatalog());
        assertInstanceOf(EnvSecretsProvider.class, services.getSecrets());
        assertEquals("s3cret", services.getSecrets().get("TOKEN"));
        assertInstanceOf(ContainerComputeBackend.class, services.getComputeBackend());
        assertInstanceOf(MicrometerTracker.class, services.getTracker());
        assertEquals(ExecutionMode.PARALLEL, services.getMode());
    }

    @Test
    void create_parallelFlagForcesParallelMode() throws Exception {
        EngineServices services = create(load(""), SluiceConfig.builder().build(), true);

        assertEquals(ExecutionMode.PARALLEL, services.getMode());
    }

    @Test
    void create_unknownTypeIsLoadError() throws Exception {
        LoadedPipeline pipeline = load("\"catalog\": {\"type\": \"s3\"}");

        PipelineLoadException e = assertThrows(PipelineLoadException.class,
                () -> create(pipeline, SluiceConfig.builder().build(), false));

        assertTrue(e.getMessage().contains("catalog type: s3"));
    }

    @Test
    void create_servicesRunAPipeline() throws Exception {
        LoadedPipeline pipeline = load("\"catalog\": {\"type\": \"do-nothing\"}");
        ExecutionEngine engine = new ExecutionEngine(create(pipeline, SluiceConfig.builder().build(), false));

        RunResult result = engine.execute(pipeline, RunRequest.of("run-1"));

        assertTrue(result.isSuccess());
        assertEquals(pipeline.getDagHash(), result.runLog().getDagHash());
    }
}
