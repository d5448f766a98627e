package com.sluice.compute;

import com.sluice.runlog.CodeIdentity;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static com.sluice.compute.ComputeTestSupport.context;
import static com.sluice.compute.ComputeTestSupport.script;
import static com.sluice.compute.ComputeTestSupport.task;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ContainerComputeBackendTest {

    @TempDir
    Path tempDir;

    @Test
    void buildCommand_mountsDataFolderAndPassesParameters() {
        ContainerComputeBackend backend = new ContainerComputeBackend(Map.of("dockerImage", "base:1"));
        var node = task("python train.py", "shell", 1, Map.of("dockerImage", "train:2"));
        Path work = Path.of("/work");

        List<String> cmd = backend.buildCommand(node, context(work, Map.of("lr", 0.1)), backend.effectiveSettings(node));

        assertEquals(List.of("docker", "run", "--rm",
                "-v", "/work/data:/app/data",
                "-w", "/app",
                "-e", "SLUICE_PRM_LR=0.1",
                "train:2", "sh", "-c", "python train.py"), cmd);
    }

    @Test
    void missingImageFailsTheStep() {
        ExecutionOutcome outcome = new ContainerComputeBackend(Map.of())
                .execute(task("echo", "shell", 1, null), context(Path.of("/work"), Map.of()));

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.getMessage().contains("No dockerImage configured"));
    }

    @Test
    void javaTasksAreRejected() {
        ExecutionOutcome outcome = new ContainerComputeBackend(Map.of("dockerImage", "x"))
                .execute(task("train", "java", 1, null), context(Path.of("/work"), Map.of()));

        assertFalse(outcome.isSuccess());
    }

    @Test
    void codeIdentities_recordCommitAndLocalImageId() throws Exception {
        Path git = script(tempDir, "git", "case \"$1\" in rev-parse) echo 9f1c2e7 ;; status) ;; *) exit 1 ;; esac");
        Path docker = script(tempDir, "docker",
                "[ \"$1 $2 $5\" = \"image inspect train:2\" ] && echo sha256:4be1c0de || exit 1");
        ContainerComputeBackend backend = new ContainerComputeBackend(
                Map.of("dockerImage", "base:1", "docker", docker.toString(), "git", git.toString()));

        List<CodeIdentity> ids = backend.codeIdentities(task("train", "shell", 1, Map.of("dockerImage", "train:2")), tempDir);

        assertEquals(List.of(
                new CodeIdentity("9f1c2e7", CodeIdentity.GIT, true, null),
                new CodeIdentity("sha256:4be1c0de", CodeIdentity.DOCKER, true, "local docker host")), ids);
    }

    @Test
    void codeIdentities_skipImageMissingFromDockerHost() throws Exception {
        Path git = script(tempDir, "git", "echo 'fatal: not a git repository' >&2; exit 128");
        Path docker = script(tempDir, "docker", "echo 'Error: No such image: train:2' >&2; exit 1");
        ContainerComputeBackend backend = new ContainerComputeBackend(
                Map.of("dockerImage", "train:2", "docker", docker.toString(), "git", git.toString()));

        assertTrue(backend.codeIdentities(task("train", "shell", 1, null), tempDir).isEmpty());
    }
}
