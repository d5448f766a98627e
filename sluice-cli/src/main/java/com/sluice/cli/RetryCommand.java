package com.sluice.cli;

import com.sluice.dag.load.LoadedPipeline;
import com.sluice.engine.ExecutionEngine;
import com.sluice.engine.RunResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(name = "retry", mixinStandardHelpOptions = true,
        description = "Re-run a previous run, reusing the steps that succeeded before its first failure.")
final class RetryCommand implements Callable<Integer> {

    @ParentCommand
    private SluiceApplication app;

    @Mixin
    private PipelineOptions options;

    @Parameters(index = "0", paramLabel = "<previousRunId>", description = "Run id to re-run")
    private String previousRunId;

    @Option(names = "--force", description = "Re-run even when the pipeline changed since the previous run")
    private boolean force;

    @Override
    public Integer call() {
        LoadedPipeline pipeline = options.load(app.getWorkingDirectory());
        ExecutionEngine engine = new ExecutionEngine(app.services(pipeline, options.parallel));
        RunResult result = engine.retry(pipeline, previousRunId, options.request(app.getWorkingDirectory()), force);
        return app.report(result);
    }
}
