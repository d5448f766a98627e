package com.sluice.compute;

import com.sluice.dag.node.Node;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Runs {@code java} tasks in-process from the {@link TaskRegistry} and {@code shell} tasks as {@code sh -c}
 * processes in the run's working directory, with the bound parameters exported to the environment.
 */
public final class LocalComputeBackend extends AbstractComputeBackend {

    public static final String TYPE = "local";
    public static final String SHELL = "shell";
    public static final String JAVA = "java";

    private final TaskRegistry tasks;

    public LocalComputeBackend(TaskRegistry tasks) {
        this(tasks, "git");
    }

    LocalComputeBackend(TaskRegistry tasks, String gitExecutable) {
        super(gitExecutable);
        this.tasks = Objects.requireNonNull(tasks, "tasks");
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected Attempt attempt(Node node, TaskContext context, int attemptNumber) throws Exception {
        if (JAVA.equals(node.getCommandType())) {
            Optional<TaskFunction> task = tasks.find(node.getCommand());
            if (task.isEmpty()) {
                return Attempt.failed("No java task registered as '" + node.getCommand() + "'", null);
            }
            Map<String, Object> returned = task.get().run(context);
            return Attempt.succeeded(returned);
        }
        ProcessRunner.Result result = ProcessRunner.run(List.of("sh", "-c", node.getCommand()),
                context.getWorkingDirectory(),
                ParameterEnvironment.export(context.getParameters(), context.getParameterPrefix()),
                context.getStepPath());
        return result.exitCode() == 0
                ? Attempt.succeeded(null)
                : Attempt.failed(result.diagnostic(), result.exitCode());
    }
}
