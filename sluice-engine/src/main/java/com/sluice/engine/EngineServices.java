package com.sluice.engine;

import com.sluice.catalog.Catalog;
import com.sluice.compute.ComputeBackend;
import com.sluice.compute.env.EnvironmentSnapshot;
import com.sluice.compute.secrets.SecretsProvider;
import com.sluice.compute.tracking.ExperimentTracker;
import com.sluice.config.SluiceConfig;
import com.sluice.dag.config.ExecutionMode;
import com.sluice.runlog.RunLogStore;
import io.micrometer.core.instrument.MeterRegistry;

import java.nio.file.Path;
import java.util.Objects;

/**
 * The services one engine runs against, selected from configuration by {@link ServiceFactory} or assembled
 * directly in tests.
 */
public final class EngineServices {

    private final RunLogStore runLogStore;
    private final Catalog catalog;
    private final ComputeBackend computeBackend;
    private final SecretsProvider secrets;
    private final ExperimentTracker tracker;
    private final EnvironmentSnapshot environment;
    private final MeterRegistry meterRegistry;
    private final Path workingDirectory;
    private final String computeDataFolder;
    private final ExecutionMode mode;
    private final SluiceConfig config;

    private EngineServices(Builder b) {
        this.runLogStore = Objects.requireNonNull(b.runLogStore, "runLogStore");
        this.catalog = Objects.requireNonNull(b.catalog, "catalog");
        this.computeBackend = Objects.requireNonNull(b.computeBackend, "computeBackend");
        this.secrets = Objects.requireNonNull(b.secrets, "secrets");
        this.tracker = Objects.requireNonNull(b.tracker, "tracker");
        this.environment = b.environment != null ? b.environment : EnvironmentSnapshot.empty();
        this.meterRegistry = Objects.requireNonNull(b.meterRegistry, "meterRegistry");
        this.workingDirectory = b.workingDirectory != null ? b.workingDirectory : Path.of("").toAbsolutePath();
        this.config = b.config != null ? b.config : SluiceConfig.builder().build();
        this.computeDataFolder = b.computeDataFolder != null ? b.computeDataFolder : config.getComputeDataFolder();
        this.mode = b.mode != null ? b.mode : ExecutionMode.SEQUENTIAL;
    }

    public static Builder builder() {
        return new Builder();
    }

    public RunLogStore getRunLogStore() {
        return runLogStore;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    public ComputeBackend getComputeBackend() {
        return computeBackend;
    }

    public SecretsProvider getSecrets() {
        return secrets;
    }

    public ExperimentTracker getTracker() {
        return tracker;
    }

    public EnvironmentSnapshot getEnvironment() {
        return environment;
    }

    public MeterRegistry getMeterRegistry() {
        return meterRegistry;
    }

    /** Directory commands run in; relative compute data folders resolve against it. */
    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    /** Default compute data folder, relative to the working directory unless absolute. */
    public String getComputeDataFolder() {
        return computeDataFolder;
    }

    public ExecutionMode getMode() {
        return mode;
    }

    public SluiceConfig getConfig() {
        return config;
    }

    public static final class Builder {
        private RunLogStore runLogStore;
        private Catalog catalog;
        private ComputeBackend computeBackend;
        private SecretsProvider secrets;
        private ExperimentTracker tracker;
        private EnvironmentSnapshot environment;
        private MeterRegistry meterRegistry;
        private Path workingDirectory;
        private String computeDataFolder;
        private ExecutionMode mode;
        private SluiceConfig config;

        private Builder() {
        }

        public Builder runLogStore(RunLogStore runLogStore) {
            this.runLogStore = runLogStore;
            return this;
        }

        public Builder catalog(Catalog catalog) {
            this.catalog = catalog;
            return this;
        }

        public Builder computeBackend(ComputeBackend computeBackend) {
            this.computeBackend = computeBackend;
            return this;
        }

        public Builder secrets(SecretsProvider secrets) {
            this.secrets = secrets;
            return this;
        }

        public Builder tracker(ExperimentTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder environment(EnvironmentSnapshot environment) {
            this.environment = environment;
            return this;
        }

        public Builder meterRegistry(MeterRegistry meterRegistry) {
            this.meterRegistry = meterRegistry;
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder computeDataFolder(String computeDataFolder) {
            this.computeDataFolder = computeDataFolder;
            return this;
        }

        public Builder mode(ExecutionMode mode) {
            this.mode = mode;
            return this;
        }

        public Builder config(SluiceConfig config) {
            this.config = config;
            return this;
        }

        public EngineServices build() {
            return new EngineServices(this);
        }
    }
}
