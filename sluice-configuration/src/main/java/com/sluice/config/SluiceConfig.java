package com.sluice.config;

import java.util.Map;
import java.util.Objects;

/**
 * Settings loaded from environment variables for a sluice run.
 * <p>
 * Folders: SLUICE_RUN_LOG_DIR, SLUICE_CATALOG_DIR, SLUICE_COMPUTE_DATA_FOLDER.
 * Execution: SLUICE_ENABLE_PARALLEL. Prefixes: SLUICE_TRACK_PREFIX (captured metrics),
 * SLUICE_PARAMETER_PREFIX (initial parameters). DB for the JDBC run log store:
 * SLUICE_DB_HOST, SLUICE_DB_PORT, SLUICE_DB_NAME, SLUICE_DB_USER, SLUICE_DB_PASSWORD.
 * <p>
 * These values are the lowest-precedence defaults; the pipeline file and the configuration file override them.
 */
public final class SluiceConfig {

    private static final String ENV_RUN_LOG_DIR = "SLUICE_RUN_LOG_DIR";
    private static final String ENV_RUN_LOG_STORE = "SLUICE_RUN_LOG_STORE";
    private static final String ENV_CATALOG_DIR = "SLUICE_CATALOG_DIR";
    private static final String ENV_CATALOG = "SLUICE_CATALOG";
    private static final String ENV_COMPUTE_DATA_FOLDER = "SLUICE_COMPUTE_DATA_FOLDER";
    private static final String ENV_ENABLE_PARALLEL = "SLUICE_ENABLE_PARALLEL";
    private static final String ENV_TRACK_PREFIX = "SLUICE_TRACK_PREFIX";
    private static final String ENV_PARAMETER_PREFIX = "SLUICE_PARAMETER_PREFIX";
    private static final String ENV_DB_HOST = "SLUICE_DB_HOST";
    private static final String ENV_DB_PORT = "SLUICE_DB_PORT";
    private static final String ENV_DB_NAME = "SLUICE_DB_NAME";
    private static final String ENV_DB_USER = "SLUICE_DB_USER";
    private static final String ENV_DB_PASSWORD = "SLUICE_DB_PASSWORD";

    public static final String DEFAULT_RUN_LOG_DIR = ".run_log_store";
    public static final String DEFAULT_RUN_LOG_STORE = "buffered";
    public static final String DEFAULT_CATALOG_DIR = ".catalog";
    public static final String DEFAULT_CATALOG = "file-system";
    public static final String DEFAULT_COMPUTE_DATA_FOLDER = "data";
    public static final String DEFAULT_TRACK_PREFIX = "SLUICE_TRACK_";
    public static final String DEFAULT_PARAMETER_PREFIX = "SLUICE_PRM_";
    private static final String DEFAULT_DB_HOST = "localhost";
    private static final int DEFAULT_DB_PORT = 5432;
    private static final String DEFAULT_DB_NAME = "sluice";
    private static final String DEFAULT_DB_USER = "sluice";

    private final String runLogDir;
    private final String runLogStore;
    private final String catalogDir;
    private final String catalog;
    private final String computeDataFolder;
    private final boolean parallelEnabled;
    private final String trackPrefix;
    private final String parameterPrefix;
    private final String dbHost;
    private final int dbPort;
    private final String dbName;
    private final String dbUser;
    private final String dbPassword;

    private SluiceConfig(Builder b) {
        this.runLogDir = b.runLogDir;
        this.runLogStore = b.runLogStore;
        this.catalogDir = b.catalogDir;
        this.catalog = b.catalog;
        this.computeDataFolder = b.computeDataFolder;
        this.parallelEnabled = b.parallelEnabled;
        this.trackPrefix = b.trackPrefix;
        this.parameterPrefix = b.parameterPrefix;
        this.dbHost = b.dbHost;
        this.dbPort = b.dbPort;
        this.dbName = b.dbName;
        this.dbUser = b.dbUser;
        this.dbPassword = b.dbPassword != null ? b.dbPassword : "";
    }

    /** Folder of the file-system run log store. Default {@value #DEFAULT_RUN_LOG_DIR}. */
    public String getRunLogDir() {
        return runLogDir;
    }

    /** Run log store type used when neither pipeline nor configuration file names one. Default {@value #DEFAULT_RUN_LOG_STORE}. */
    public String getRunLogStore() {
        return runLogStore;
    }

    /** Root folder of the file-system catalog. Default {@value #DEFAULT_CATALOG_DIR}. */
    public String getCatalogDir() {
        return catalogDir;
    }

    public String getCatalog() {
        return catalog;
    }

    /** Working area of a step when the node does not override it. Default {@value #DEFAULT_COMPUTE_DATA_FOLDER}. */
    public String getComputeDataFolder() {
        return computeDataFolder;
    }

    /** Whether parallel and map branches run on a thread pool. Default false (sequential, declaration order). */
    public boolean isParallelEnabled() {
        return parallelEnabled;
    }

    /** Environment variables with this prefix are captured into the step log as metrics. */
    public String getTrackPrefix() {
        return trackPrefix;
    }

    /** Environment variables with this prefix seed the run parameters. */
    public String getParameterPrefix() {
        return parameterPrefix;
    }

    public String getDbHost() {
        return dbHost;
    }

    public int getDbPort() {
        return dbPort;
    }

    public String getDbName() {
        return dbName;
    }

    public String getDbUser() {
        return dbUser;
    }

    public String getDbPassword() {
        return dbPassword;
    }

    public static SluiceConfig fromEnvironment() {
        return fromMap(System.getenv());
    }

    /** Same as {@link #fromEnvironment()} but reads from the given snapshot (tests, embedded use). */
    public static SluiceConfig fromMap(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .runLogDir(get(env, ENV_RUN_LOG_DIR, DEFAULT_RUN_LOG_DIR))
                .runLogStore(get(env, ENV_RUN_LOG_STORE, DEFAULT_RUN_LOG_STORE))
                .catalogDir(get(env, ENV_CATALOG_DIR, DEFAULT_CATALOG_DIR))
                .catalog(get(env, ENV_CATALOG, DEFAULT_CATALOG))
                .computeDataFolder(get(env, ENV_COMPUTE_DATA_FOLDER, DEFAULT_COMPUTE_DATA_FOLDER))
                .parallelEnabled(parseBoolean(env.get(ENV_ENABLE_PARALLEL), false))
                .trackPrefix(get(env, ENV_TRACK_PREFIX, DEFAULT_TRACK_PREFIX))
                .parameterPrefix(get(env, ENV_PARAMETER_PREFIX, DEFAULT_PARAMETER_PREFIX))
                .dbHost(get(env, ENV_DB_HOST, DEFAULT_DB_HOST))
                .dbPort(parseInt(env.get(ENV_DB_PORT), DEFAULT_DB_PORT))
                .dbName(get(env, ENV_DB_NAME, DEFAULT_DB_NAME))
                .dbUser(get(env, ENV_DB_USER, DEFAULT_DB_USER))
                .dbPassword(get(env, ENV_DB_PASSWORD, ""))
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static int parseInt(String value, int defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static String get(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    public static final class Builder {
        private String runLogDir = DEFAULT_RUN_LOG_DIR;
        private String runLogStore = DEFAULT_RUN_LOG_STORE;
        private String catalogDir = DEFAULT_CATALOG_DIR;
        private String catalog = DEFAULT_CATALOG;
        private String computeDataFolder = DEFAULT_COMPUTE_DATA_FOLDER;
        private boolean parallelEnabled;
        private String trackPrefix = DEFAULT_TRACK_PREFIX;
        private String parameterPrefix = DEFAULT_PARAMETER_PREFIX;
        private String dbHost = DEFAULT_DB_HOST;
        private int dbPort = DEFAULT_DB_PORT;
        private String dbName = DEFAULT_DB_NAME;
        private String dbUser = DEFAULT_DB_USER;
        private String dbPassword = "";

        public Builder runLogDir(String runLogDir) {
            this.runLogDir = runLogDir != null ? runLogDir : DEFAULT_RUN_LOG_DIR;
            return this;
        }

        public Builder runLogStore(String runLogStore) {
            this.runLogStore = runLogStore != null ? runLogStore : DEFAULT_RUN_LOG_STORE;
            return this;
        }

        public Builder catalogDir(String catalogDir) {
            this.catalogDir = catalogDir != null ? catalogDir : DEFAULT_CATALOG_DIR;
            return this;
        }

        public Builder catalog(String catalog) {
            this.catalog = catalog != null ? catalog : DEFAULT_CATALOG;
            return this;
        }

        public Builder computeDataFolder(String computeDataFolder) {
            this.computeDataFolder = computeDataFolder != null ? computeDataFolder : DEFAULT_COMPUTE_DATA_FOLDER;
            return this;
        }

        public Builder parallelEnabled(boolean parallelEnabled) {
            this.parallelEnabled = parallelEnabled;
            return this;
        }

        public Builder trackPrefix(String trackPrefix) {
            this.trackPrefix = trackPrefix != null ? trackPrefix : DEFAULT_TRACK_PREFIX;
            return this;
        }

        public Builder parameterPrefix(String parameterPrefix) {
            this.parameterPrefix = parameterPrefix != null ? parameterPrefix : DEFAULT_PARAMETER_PREFIX;
            return this;
        }

        public Builder dbHost(String dbHost) {
            this.dbHost = dbHost;
            return this;
        }

        public Builder dbPort(int dbPort) {
            this.dbPort = dbPort;
            return this;
        }

        public Builder dbName(String dbName) {
            this.dbName = dbName;
            return this;
        }

        public Builder dbUser(String dbUser) {
            this.dbUser = dbUser;
            return this;
        }

        public Builder dbPassword(String dbPassword) {
            this.dbPassword = dbPassword;
            return this;
        }

        public SluiceConfig build() {
            return new SluiceConfig(this);
        }
    }
}
