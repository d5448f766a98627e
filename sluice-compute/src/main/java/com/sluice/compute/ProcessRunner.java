package com.sluice.compute;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Runs an external process with stderr merged into stdout. Output lines are logged as they arrive and the
 * last lines are kept as the failure diagnostic.
 */
final class ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(ProcessRunner.class);
    static final int TAIL_LINES = 20;

    record Result(int exitCode, List<String> tail) {

        String diagnostic() {
            return "exit code " + exitCode + (tail.isEmpty() ? "" : "\n" + String.join("\n", tail));
        }
    }

    private ProcessRunner() {
    }

    static Result run(List<String> command, Path directory, Map<String, String> environment, String stepPath)
            throws IOException, InterruptedException {
        return run(command, directory, environment, stepPath, true);
    }

    /** Runs a short query command, logging its output at debug only. */
    static Result capture(List<String> command, Path directory) throws IOException, InterruptedException {
        return run(command, directory, Map.of(), String.join(" ", command), false);
    }

    private static Result run(List<String> command, Path directory, Map<String, String> environment, String stepPath,
                              boolean echo) throws IOException, InterruptedException {
        ProcessBuilder builder = new ProcessBuilder(command).redirectErrorStream(true);
        if (directory != null) {
            builder.directory(directory.toFile());
        }
        builder.environment().putAll(environment);
        log.debug("Starting process | step={} | command={}", stepPath, command);
        Process process = builder.start();
        Deque<String> tail = new ArrayDeque<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (echo) {
                    log.info("[{}] {}", stepPath, line);
                } else {
                    log.debug("[{}] {}", stepPath, line);
                }
                if (tail.size() == TAIL_LINES) {
                    tail.removeFirst();
                }
                tail.addLast(line);
            }
        } finally {
            if (process.isAlive() && Thread.currentThread().isInterrupted()) {
                process.destroyForcibly();
            }
        }
        int exitCode = process.waitFor();
        log.debug("Process finished | step={} | exitCode={}", stepPath, exitCode);
        return new Result(exitCode, List.copyOf(tail));
    }
}
