package com.sluice.engine;

import com.sluice.catalog.DoNothingCatalog;
import com.sluice.compute.LocalComputeBackend;
import com.sluice.compute.TaskRegistry;
import com.sluice.compute.secrets.DoNothingSecretsProvider;
import com.sluice.compute.tracking.DoNothingTracker;
import com.sluice.dag.DagConfig;
import com.sluice.dag.node.Dag;
import com.sluice.dag.node.DagCompiler;
import com.sluice.runlog.store.BufferedRunLogStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.nio.file.Path;

public final class EngineTestSupport {

    private EngineTestSupport() {
    }

    public static Dag compile(String dagJson) {
        return new DagCompiler().compile(DagConfig.dagFromJson(dagJson));
    }

    public static String hash(String dagJson) {
        return DagConfig.dagHash(DagConfig.dagFromJson(dagJson));
    }

    /** In-memory services without catalog or secrets, running java tasks from {@code tasks}. */
    public static EngineServices.Builder services(TaskRegistry tasks, Path workingDirectory) {
        return EngineServices.builder()
                .runLogStore(new BufferedRunLogStore())
                .catalog(new DoNothingCatalog())
                .computeBackend(new LocalComputeBackend(tasks))
                .secrets(new DoNothingSecretsProvider())
                .tracker(new DoNothingTracker())
                .meterRegistry(new SimpleMeterRegistry())
                .workingDirectory(workingDirectory);
    }
}
