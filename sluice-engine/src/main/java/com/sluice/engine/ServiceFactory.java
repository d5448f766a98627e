package com.sluice.engine;

import com.sluice.catalog.Catalog;
import com.sluice.catalog.DoNothingCatalog;
import com.sluice.catalog.FileSystemCatalog;
import com.sluice.compute.ComputeBackend;
import com.sluice.compute.ContainerComputeBackend;
import com.sluice.compute.LocalComputeBackend;
import com.sluice.compute.TaskRegistry;
import com.sluice.compute.env.EnvironmentSnapshot;
import com.sluice.compute.secrets.DoNothingSecretsProvider;
import com.sluice.compute.secrets.DotEnvSecretsProvider;
import com.sluice.compute.secrets.EnvSecretsProvider;
import com.sluice.compute.secrets.SecretsProvider;
import com.sluice.compute.tracking.DoNothingTracker;
import com.sluice.compute.tracking.ExperimentTracker;
import com.sluice.compute.tracking.MicrometerTracker;
import com.sluice.config.SluiceConfig;
import com.sluice.dag.config.ExecutionMode;
import com.sluice.dag.config.ServiceConfig;
import com.sluice.dag.config.ServiceRole;
import com.sluice.dag.load.LoadedPipeline;
import com.sluice.dag.load.PipelineLoadException;
import com.sluice.runlog.RunLogStore;
import com.sluice.runlog.schema.RunLogSchemaBootstrapper;
import com.sluice.runlog.store.BufferedRunLogStore;
import com.sluice.runlog.store.FileSystemRunLogStore;
import com.sluice.runlog.store.JdbcConnectionProvider;
import com.sluice.runlog.store.JdbcRunLogStore;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Builds {@link EngineServices} for a loaded pipeline. Each role is selected by its service type with precedence
 * configuration file, pipeline file, then the environment defaults of {@link SluiceConfig}.
 */
public final class ServiceFactory {

    private static final Logger log = LoggerFactory.getLogger(ServiceFactory.class);

    private ServiceFactory() {
    }

    /**
     * @param forceParallel run branches concurrently even when the mode service does not enable it
     * @throws PipelineLoadException when a role names an unknown type
     */
    public static EngineServices create(LoadedPipeline pipeline, SluiceConfig config, TaskRegistry tasks,
                                        EnvironmentSnapshot environment, MeterRegistry meterRegistry,
                                        Path workingDirectory, boolean forceParallel) {
        Objects.requireNonNull(pipeline, "pipeline");
        Objects.requireNonNull(config, "config");
        Path workDir = workingDirectory != null ? workingDirectory : Path.of("").toAbsolutePath();

        ServiceConfig storeConfig = pipeline.service(ServiceRole.RUN_LOG_STORE, ServiceConfig.of(config.getRunLogStore()));
        ServiceConfig catalogConfig = pipeline.service(ServiceRole.CATALOG, ServiceConfig.of(config.getCatalog()));
        ServiceConfig secretsConfig = pipeline.service(ServiceRole.SECRETS, ServiceConfig.of(DoNothingSecretsProvider.TYPE));
        ServiceConfig modeConfig = pipeline.service(ServiceRole.MODE, ServiceConfig.of(LocalComputeBackend.TYPE));
        ServiceConfig trackerConfig = pipeline.service(ServiceRole.EXPERIMENT_TRACKER, ServiceConfig.of(DoNothingTracker.TYPE));

        boolean parallel = forceParallel || modeConfig.getBoolean("enableParallel", config.isParallelEnabled());
        EngineServices services = EngineServices.builder()
                .runLogStore(runLogStore(storeConfig, config, workDir))
                .catalog(catalog(catalogConfig, config, workDir))
                .computeBackend(computeBackend(modeConfig, tasks))
                .secrets(secrets(secretsConfig, environment, workDir))
                .tracker(tracker(trackerConfig, meterRegistry))
                .environment(environment)
                .meterRegistry(meterRegistry)
                .workingDirectory(workDir)
                .computeDataFolder(catalogConfig.getString("computeDataFolder", config.getComputeDataFolder()))
                .mode(ExecutionMode.of(parallel))
                .config(config)
                .build();
        log.info("Services selected | runLogStore={} | catalog={} | secrets={} | mode={} | tracker={} | parallel={}",
                storeConfig.getType(), catalogConfig.getType(), secretsConfig.getType(), modeConfig.getType(),
                trackerConfig.getType(), parallel);
        return services;
    }

    static RunLogStore runLogStore(ServiceConfig service, SluiceConfig config, Path workDir) {
        return switch (service.getType().toLowerCase()) {
            case BufferedRunLogStore.TYPE -> new BufferedRunLogStore();
            case FileSystemRunLogStore.TYPE ->
                    new FileSystemRunLogStore(workDir.resolve(service.getString("logFolder", config.getRunLogDir())));
            case JdbcRunLogStore.TYPE -> new JdbcRunLogStore(new JdbcConnectionProvider(config), new RunLogSchemaBootstrapper());
            default -> throw unknown(ServiceRole.RUN_LOG_STORE, service);
        };
    }

    static Catalog catalog(ServiceConfig service, SluiceConfig config, Path workDir) {
        return switch (service.getType().toLowerCase()) {
            case FileSystemCatalog.TYPE ->
                    new FileSystemCatalog(workDir.resolve(service.getString("catalogLocation", config.getCatalogDir())));
            case DoNothingCatalog.TYPE -> new DoNothingCatalog();
            default -> throw unknown(ServiceRole.CATALOG, service);
        };
    }

    static ComputeBackend computeBackend(ServiceConfig service, TaskRegistry tasks) {
        return switch (service.getType().toLowerCase()) {
            case LocalComputeBackend.TYPE -> new LocalComputeBackend(tasks != null ? tasks : new TaskRegistry());
            case ContainerComputeBackend.TYPE -> new ContainerComputeBackend(service.getConfig());
            default -> throw unknown(ServiceRole.MODE, service);
        };
    }

    static SecretsProvider secrets(ServiceConfig service, EnvironmentSnapshot environment, Path workDir) {
        return switch (service.getType().toLowerCase()) {
            case DoNothingSecretsProvider.TYPE -> new DoNothingSecretsProvider();
            case EnvSecretsProvider.TYPE -> new EnvSecretsProvider(
                    environment != null ? environment : EnvironmentSnapshot.empty(), service.getString("prefix", ""));
            case DotEnvSecretsProvider.TYPE ->
                    new DotEnvSecretsProvider(workDir.resolve(service.getString("location", DotEnvSecretsProvider.DEFAULT_LOCATION)));
            default -> throw unknown(ServiceRole.SECRETS, service);
        };
    }

    static ExperimentTracker tracker(ServiceConfig service, MeterRegistry meterRegistry) {
        return switch (service.getType().toLowerCase()) {
            case DoNothingTracker.TYPE -> new DoNothingTracker();
            case MicrometerTracker.TYPE -> new MicrometerTracker(meterRegistry);
            default -> throw unknown(ServiceRole.EXPERIMENT_TRACKER, service);
        };
    }

    private static PipelineLoadException unknown(ServiceRole role, ServiceConfig service) {
        return new PipelineLoadException("Unknown " + role.name().toLowerCase().replace('_', '-') + " type: " + service.getType());
    }
}
