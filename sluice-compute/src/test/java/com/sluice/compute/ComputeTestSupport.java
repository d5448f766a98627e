package com.sluice.compute;

import com.sluice.compute.secrets.DoNothingSecretsProvider;
import com.sluice.compute.tracking.DoNothingTracker;
import com.sluice.compute.tracking.StepTracker;
import com.sluice.dag.declaration.DagDefinition;
import com.sluice.dag.declaration.StepDefinition;
import com.sluice.dag.node.DagCompiler;
import com.sluice.dag.node.Node;
import com.sluice.dag.node.NodeKind;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

final class ComputeTestSupport {

    private ComputeTestSupport() {
    }

    /** Compiles a one-task pipeline and returns the task node. */
    static Node task(String command, String commandType, int retry, Map<String, Object> modeConfig) {
        DagDefinition def = DagDefinition.builder("t")
                .step("t", StepDefinition.builder(NodeKind.TASK)
                        .command(command).commandType(commandType).retry(retry).modeConfig(modeConfig)
                        .next("success").build())
                .step("success", StepDefinition.success())
                .step("fail", StepDefinition.fail())
                .build();
        return new DagCompiler().compile(def).getNode("t");
    }

    static TaskContext context(Path workingDirectory, Map<String, Object> parameters) {
        return TaskContext.builder("t")
                .parameters(parameters)
                .workingDirectory(workingDirectory)
                .computeDataFolder(workingDirectory != null ? workingDirectory.resolve("data") : null)
                .secrets(new DoNothingSecretsProvider())
                .tracker(new StepTracker(new DoNothingTracker()))
                .build();
    }

    /** Writes an executable {@code sh} script standing in for a command line tool. */
    static Path script(Path directory, String name, String body) throws IOException {
        Path script = directory.resolve(name);
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        if (!script.toFile().setExecutable(true)) {
            throw new IOException("Cannot make " + script + " executable");
        }
        return script;
    }
}
