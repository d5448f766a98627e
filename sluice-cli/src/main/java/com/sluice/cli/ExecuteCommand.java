package com.sluice.cli;

import com.sluice.dag.load.LoadedPipeline;
import com.sluice.engine.ExecutionEngine;
import com.sluice.engine.RunResult;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(name = "execute", mixinStandardHelpOptions = true,
        description = "Run a pipeline from its start step under a new run id.")
final class ExecuteCommand implements Callable<Integer> {

    @ParentCommand
    private SluiceApplication app;

    @Mixin
    private PipelineOptions options;

    @Override
    public Integer call() {
        LoadedPipeline pipeline = options.load(app.getWorkingDirectory());
        ExecutionEngine engine = new ExecutionEngine(app.services(pipeline, options.parallel));
        RunResult result = engine.execute(pipeline, options.request(app.getWorkingDirectory()));
        return app.report(result);
    }
}
