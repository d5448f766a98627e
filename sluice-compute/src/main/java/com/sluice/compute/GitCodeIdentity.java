package com.sluice.compute;

import com.sluice.runlog.CodeIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Reads the git commit checked out in a directory. The identity is dependable only when the checkout has no
 * uncommitted or untracked changes; the url is the {@code origin} remote, if any.
 */
final class GitCodeIdentity {

    private static final Logger log = LoggerFactory.getLogger(GitCodeIdentity.class);

    private GitCodeIdentity() {
    }

    static Optional<CodeIdentity> resolve(String git, Path directory) {
        try {
            ProcessRunner.Result head = ProcessRunner.capture(List.of(git, "rev-parse", "HEAD"), directory);
            if (head.exitCode() != 0 || head.tail().isEmpty()) {
                log.debug("No git checkout | directory={} | exitCode={}", directory, head.exitCode());
                return Optional.empty();
            }
            ProcessRunner.Result status = ProcessRunner.capture(List.of(git, "status", "--porcelain"), directory);
            boolean clean = status.exitCode() == 0 && status.tail().isEmpty();
            ProcessRunner.Result remote = ProcessRunner.capture(
                    List.of(git, "config", "--get", "remote.origin.url"), directory);
            String url = remote.exitCode() == 0 && !remote.tail().isEmpty() ? remote.tail().get(0).trim() : null;
            if (!clean) {
                log.warn("Git checkout has uncommitted changes | directory={} | commit={}", directory, head.tail().get(0).trim());
            }
            return Optional.of(new CodeIdentity(head.tail().get(0).trim(), CodeIdentity.GIT, clean, url));
        } catch (IOException e) {
            log.warn("Git code identity unavailable | directory={} | error={}", directory, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while reading git code identity | directory={}", directory);
            return Optional.empty();
        }
    }
}
