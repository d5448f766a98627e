package com.sluice.compute;

import com.sluice.dag.node.Node;
import com.sluice.runlog.CodeIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs {@code shell} tasks inside a container with {@code docker run}. The node's compute data folder is
 * mounted at {@code containerDataFolder}, so catalog get/put on the host see what the container wrote.
 * <p>
 * Settings (run mode config, overridden per node by {@code modeConfig}): {@code dockerImage} (required),
 * {@code docker} (executable, default {@code docker}), {@code containerDataFolder} (default {@code /app/data}),
 * {@code containerWorkingDirectory} (default {@code /app}), {@code git} (executable used for the code identity,
 * default {@code git}).
 * <p>
 * Besides the git commit, steps are identified by the id of their image on the local docker host.
 */
public final class ContainerComputeBackend extends AbstractComputeBackend {

    private static final Logger log = LoggerFactory.getLogger(ContainerComputeBackend.class);

    public static final String TYPE = "local-container";
    static final String DOCKER_HOST_URL = "local docker host";

    static final String IMAGE = "dockerImage";
    static final String EXECUTABLE = "docker";
    static final String CONTAINER_DATA_FOLDER = "containerDataFolder";
    static final String CONTAINER_WORKDIR = "containerWorkingDirectory";
    static final String GIT = "git";

    private final Map<String, Object> settings;

    public ContainerComputeBackend(Map<String, Object> settings) {
        super(settings != null ? setting(settings, GIT, null) : null);
        this.settings = settings != null ? new LinkedHashMap<>(settings) : Map.of();
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    protected Attempt attempt(Node node, TaskContext context, int attemptNumber) throws Exception {
        if (LocalComputeBackend.JAVA.equals(node.getCommandType())) {
            return Attempt.failed("java tasks run in-process and cannot run in a container; use a shell command", null);
        }
        Map<String, Object> effective = effectiveSettings(node);
        if (setting(effective, IMAGE, null) == null) {
            return Attempt.failed("No " + IMAGE + " configured for step " + context.getStepPath(), null);
        }
        ProcessRunner.Result result = ProcessRunner.run(buildCommand(node, context, effective),
                context.getWorkingDirectory(), Map.of(), context.getStepPath());
        return result.exitCode() == 0
                ? Attempt.succeeded(null)
                : Attempt.failed(result.diagnostic(), result.exitCode());
    }

    @Override
    public List<CodeIdentity> codeIdentities(Node node, Path workingDirectory) {
        List<CodeIdentity> identities = super.codeIdentities(node, workingDirectory);
        Map<String, Object> effective = effectiveSettings(node);
        String image = setting(effective, IMAGE, null);
        if (image != null) {
            imageId(setting(effective, EXECUTABLE, "docker"), image)
                    .ifPresent(id -> identities.add(new CodeIdentity(id, CodeIdentity.DOCKER, true, DOCKER_HOST_URL)));
        }
        return identities;
    }

    /** Id of a local image via {@code docker image inspect}; empty when the image is not on the host. */
    static Optional<String> imageId(String docker, String image) {
        try {
            ProcessRunner.Result result = ProcessRunner.capture(
                    List.of(docker, "image", "inspect", "--format", "{{.Id}}", image), null);
            if (result.exitCode() != 0 || result.tail().isEmpty()) {
                log.warn("Image not found on local docker host | image={} | exitCode={}", image, result.exitCode());
                return Optional.empty();
            }
            return Optional.of(result.tail().get(0).trim());
        } catch (IOException e) {
            log.warn("Image id unavailable | image={} | error={}", image, e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while inspecting image | image={}", image);
            return Optional.empty();
        }
    }

    Map<String, Object> effectiveSettings(Node node) {
        Map<String, Object> effective = new LinkedHashMap<>(settings);
        effective.putAll(node.getModeConfig());
        return effective;
    }

    /** The {@code docker run} command line for one attempt. */
    List<String> buildCommand(Node node, TaskContext context, Map<String, Object> effective) {
        List<String> cmd = new ArrayList<>();
        cmd.add(setting(effective, EXECUTABLE, "docker"));
        cmd.add("run");
        cmd.add("--rm");
        Path dataFolder = context.getComputeDataFolder();
        if (dataFolder != null) {
            cmd.add("-v");
            cmd.add(dataFolder.toAbsolutePath() + ":" + setting(effective, CONTAINER_DATA_FOLDER, "/app/data"));
        }
        cmd.add("-w");
        cmd.add(setting(effective, CONTAINER_WORKDIR, "/app"));
        ParameterEnvironment.export(context.getParameters(), context.getParameterPrefix()).forEach((k, v) -> {
            cmd.add("-e");
            cmd.add(k + "=" + v);
        });
        cmd.add(setting(effective, IMAGE, null));
        cmd.add("sh");
        cmd.add("-c");
        cmd.add(node.getCommand());
        return cmd;
    }

    private static String setting(Map<String, Object> effective, String key, String defaultValue) {
        Object v = effective.get(key);
        return v != null && !v.toString().isBlank() ? v.toString() : defaultValue;
    }
}
