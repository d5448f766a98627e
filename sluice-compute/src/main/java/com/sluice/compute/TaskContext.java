package com.sluice.compute;

import com.sluice.compute.env.EnvironmentSnapshot;
import com.sluice.compute.secrets.SecretsProvider;
import com.sluice.compute.tracking.StepTracker;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What a node execution sees: its path, the parameters bound for it (run parameters plus map iteration values),
 * the directory it runs in, its compute data folder, secrets, a tracker, and the environment snapshot.
 */
public final class TaskContext {

    private final String stepPath;
    private final Map<String, Object> parameters;
    private final Path workingDirectory;
    private final Path computeDataFolder;
    private final SecretsProvider secrets;
    private final StepTracker tracker;
    private final EnvironmentSnapshot environment;
    private final String parameterPrefix;

    private TaskContext(Builder b) {
        this.stepPath = Objects.requireNonNull(b.stepPath, "stepPath");
        this.parameters = Collections.unmodifiableMap(new LinkedHashMap<>(b.parameters));
        this.workingDirectory = b.workingDirectory;
        this.computeDataFolder = b.computeDataFolder;
        this.secrets = Objects.requireNonNull(b.secrets, "secrets");
        this.tracker = Objects.requireNonNull(b.tracker, "tracker");
        this.environment = b.environment != null ? b.environment : EnvironmentSnapshot.empty();
        this.parameterPrefix = b.parameterPrefix;
    }

    public static Builder builder(String stepPath) {
        return new Builder(stepPath);
    }

    public String getStepPath() {
        return stepPath;
    }

    public Map<String, Object> getParameters() {
        return parameters;
    }

    public Object getParameter(String name) {
        return parameters.get(name);
    }

    public Path getWorkingDirectory() {
        return workingDirectory;
    }

    public Path getComputeDataFolder() {
        return computeDataFolder;
    }

    public SecretsProvider getSecrets() {
        return secrets;
    }

    public StepTracker getTracker() {
        return tracker;
    }

    public EnvironmentSnapshot getEnvironment() {
        return environment;
    }

    /** Prefix under which parameters are exported to process environments. */
    public String getParameterPrefix() {
        return parameterPrefix;
    }

    public static final class Builder {
        private final String stepPath;
        private Map<String, Object> parameters = Map.of();
        private Path workingDirectory;
        private Path computeDataFolder;
        private SecretsProvider secrets;
        private StepTracker tracker;
        private EnvironmentSnapshot environment;
        private String parameterPrefix = "SLUICE_PRM_";

        private Builder(String stepPath) {
            this.stepPath = stepPath;
        }

        public Builder parameters(Map<String, Object> parameters) {
            this.parameters = parameters != null ? parameters : Map.of();
            return this;
        }

        public Builder workingDirectory(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
            return this;
        }

        public Builder computeDataFolder(Path computeDataFolder) {
            this.computeDataFolder = computeDataFolder;
            return this;
        }

        public Builder secrets(SecretsProvider secrets) {
            this.secrets = secrets;
            return this;
        }

        public Builder tracker(StepTracker tracker) {
            this.tracker = tracker;
            return this;
        }

        public Builder environment(EnvironmentSnapshot environment) {
            this.environment = environment;
            return this;
        }

        public Builder parameterPrefix(String parameterPrefix) {
            this.parameterPrefix = parameterPrefix;
            return this;
        }

        public TaskContext build() {
            return new TaskContext(this);
        }
    }
}
