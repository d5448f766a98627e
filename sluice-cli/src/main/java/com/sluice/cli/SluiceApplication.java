package com.sluice.cli;

import com.sluice.catalog.CatalogException;
import com.sluice.compute.TaskRegistry;
import com.sluice.compute.env.EnvironmentSnapshot;
import com.sluice.config.SluiceConfig;
import com.sluice.dag.load.LoadedPipeline;
import com.sluice.dag.load.PipelineLoadException;
import com.sluice.dag.node.DagCompileException;
import com.sluice.engine.EngineInvariantException;
import com.sluice.engine.EngineServices;
import com.sluice.engine.RunResult;
import com.sluice.engine.ServiceFactory;
import com.sluice.runlog.RunLogException;
import com.sluice.runlog.StepLog;
import com.sluice.runlog.StepStatus;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point of the {@code sluice} command: {@code execute} runs a pipeline, {@code retry} re-runs a previous
 * run. Exit codes are listed in {@link ExitCodes}.
 * <p>
 * Java tasks are looked up in the {@link TaskRegistry} given to the constructor; {@link #main} starts with an
 * empty registry, so only shell tasks run from the plain command line.
 */
@Command(name = "sluice", mixinStandardHelpOptions = true, version = "sluice 0.1.0",
        subcommands = {ExecuteCommand.class, RetryCommand.class},
        exitCodeOnInvalidInput = ExitCodes.USAGE,
        exitCodeOnExecutionException = ExitCodes.CODE_ERROR,
        description = "Runs DAG pipelines and re-runs failed ones.")
public final class SluiceApplication implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(SluiceApplication.class);

    private final TaskRegistry tasks;
    private final EnvironmentSnapshot environment;
    private final Path workingDirectory;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    public SluiceApplication(TaskRegistry tasks, EnvironmentSnapshot environment, Path workingDirectory) {
        this.tasks = Objects.requireNonNull(tasks, "tasks");
        this.environment = Objects.requireNonNull(environment, "environment");
        this.workingDirectory = Objects.requireNonNull(workingDirectory, "workingDirectory");
    }

    public static void main(String[] args) {
        SluiceApplication app = new SluiceApplication(new TaskRegistry(), EnvironmentSnapshot.fromSystem(),
                Path.of("").toAbsolutePath());
        System.exit(app.commandLine().execute(args));
    }

    public CommandLine commandLine() {
        CommandLine cmd = new CommandLine(this);
        cmd.setExecutionExceptionHandler(SluiceApplication::handleExecutionException);
        return cmd;
    }

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing command: execute or retry");
    }

    Path getWorkingDirectory() {
        return workingDirectory;
    }

    EngineServices services(LoadedPipeline pipeline, boolean parallel) {
        SluiceConfig config = SluiceConfig.fromMap(environment.asMap());
        return ServiceFactory.create(pipeline, config, tasks, environment, new SimpleMeterRegistry(),
                workingDirectory, parallel);
    }

    /** Prints the run outcome and failed steps; returns the exit code for it. */
    int report(RunResult result) {
        PrintWriter out = spec.commandLine().getOut();
        out.printf("Run %s finished with status %s%n", result.runId(), result.status());
        if (result.plan() != null) {
            out.printf("Re-run of %s: %s%n", result.runLog().getOriginalRunId(), result.plan());
        }
        for (Map.Entry<String, StepLog> e : result.runLog().flatten().entrySet()) {
            StepLog step = e.getValue();
            if (step.getStatus() == StepStatus.FAILED) {
                out.printf("  failed step %s (%d attempts): %s%n", e.getKey(), step.getAttempts().size(), step.getMessage());
            }
        }
        out.flush();
        return result.isSuccess() ? ExitCodes.OK : ExitCodes.PIPELINE_FAILED;
    }

    private static int handleExecutionException(Exception ex, CommandLine cmd, CommandLine.ParseResult parseResult)
            throws Exception {
        if (ex instanceof DagCompileException
                || ex instanceof PipelineLoadException
                || ex instanceof CatalogException
                || ex instanceof EngineInvariantException
                || ex instanceof RunLogException) {
            log.error("Run aborted | command={} | error={}", cmd.getCommandName(), ex.getMessage());
            cmd.getErr().println("error: " + ex.getMessage());
            cmd.getErr().flush();
            return ExitCodes.CONFIG;
        }
        throw ex;
    }
}
