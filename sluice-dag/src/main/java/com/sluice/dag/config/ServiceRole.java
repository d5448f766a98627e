package com.sluice.dag.config;

/** Pluggable collaborators a pipeline can configure, each selected by a {@link ServiceConfig}. */
public enum ServiceRole {
    RUN_LOG_STORE,
    CATALOG,
    SECRETS,
    MODE,
    EXPERIMENT_TRACKER
}
