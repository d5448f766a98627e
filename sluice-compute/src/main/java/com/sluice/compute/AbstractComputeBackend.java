package com.sluice.compute;

import com.sluice.dag.node.Node;
import com.sluice.runlog.AttemptLog;
import com.sluice.runlog.CodeIdentity;
import com.sluice.runlog.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs a node up to its {@code retry} attempts, stopping at the first success. Every attempt is recorded.
 * Every node is identified by the git commit of the working directory, read once per directory.
 */
public abstract class AbstractComputeBackend implements ComputeBackend {

    private static final Logger log = LoggerFactory.getLogger(AbstractComputeBackend.class);

    private final String gitExecutable;
    private final Map<Path, Optional<CodeIdentity>> gitIdentities = new ConcurrentHashMap<>();

    protected AbstractComputeBackend(String gitExecutable) {
        this.gitExecutable = gitExecutable != null ? gitExecutable : "git";
    }

    /** Outcome of a single attempt. */
    protected record Attempt(boolean success, String message, Integer exitCode, Map<String, Object> returned) {

        public static Attempt succeeded(Map<String, Object> returned) {
            return new Attempt(true, null, 0, returned);
        }

        public static Attempt failed(String message, Integer exitCode) {
            return new Attempt(false, message, exitCode, null);
        }
    }

    /**
     * One try of the node. Exceptions fail the attempt.
     */
    protected abstract Attempt attempt(Node node, TaskContext context, int attemptNumber) throws Exception;

    @Override
    public final ExecutionOutcome execute(Node node, TaskContext context) {
        int maxAttempts = Math.max(1, node.getMaxAttempts());
        List<AttemptLog> attempts = new ArrayList<>();
        Attempt last = null;
        for (int n = 1; n <= maxAttempts; n++) {
            long start = System.currentTimeMillis();
            try {
                last = attempt(node, context, n);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                attempts.add(record(n, start, Attempt.failed("interrupted", null)));
                log.warn("Attempt interrupted | backend={} | step={} | attempt={}/{}", type(), context.getStepPath(), n, maxAttempts);
                return ExecutionOutcome.failed("interrupted", null, attempts);
            } catch (Exception e) {
                log.warn("Attempt raised | backend={} | step={} | attempt={}/{} | error={}",
                        type(), context.getStepPath(), n, maxAttempts, e.toString(), e);
                last = Attempt.failed(e.getClass().getSimpleName() + ": " + e.getMessage(), null);
            }
            attempts.add(record(n, start, last));
            if (last.success()) {
                if (n > 1) {
                    log.info("Step succeeded after retry | step={} | attempt={}/{}", context.getStepPath(), n, maxAttempts);
                }
                return ExecutionOutcome.success(attempts, last.returned());
            }
            if (n < maxAttempts) {
                log.warn("Attempt failed; retrying | step={} | attempt={}/{} | message={}",
                        context.getStepPath(), n, maxAttempts, last.message());
            }
        }
        log.error("Step failed | backend={} | step={} | attempts={} | message={}",
                type(), context.getStepPath(), maxAttempts, last.message());
        return ExecutionOutcome.failed(last.message(), last.exitCode(), attempts);
    }

    @Override
    public List<CodeIdentity> codeIdentities(Node node, Path workingDirectory) {
        List<CodeIdentity> identities = new ArrayList<>();
        if (workingDirectory != null) {
            gitIdentities.computeIfAbsent(workingDirectory.toAbsolutePath().normalize(),
                    dir -> GitCodeIdentity.resolve(gitExecutable, dir)).ifPresent(identities::add);
        }
        return identities;
    }

    private static AttemptLog record(int n, long start, Attempt attempt) {
        return new AttemptLog(n, start, System.currentTimeMillis(),
                attempt.success() ? StepStatus.SUCCESS : StepStatus.FAILED, attempt.message(), attempt.exitCode());
    }
}
