package com.sluice.runlog.store;

import com.sluice.runlog.AbstractRunLogStore;
import com.sluice.runlog.RunLog;
import com.sluice.runlog.RunLogException;
import com.sluice.runlog.RunLogJson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/**
 * Stores each run log as {@code <logFolder>/<runId>.json}. Writes go to a temporary file that replaces the
 * previous one, so a reader never sees a half-written run log.
 */
public final class FileSystemRunLogStore extends AbstractRunLogStore {

    public static final String TYPE = "file-system";

    private static final Logger log = LoggerFactory.getLogger(FileSystemRunLogStore.class);

    private final Path logFolder;

    public FileSystemRunLogStore(Path logFolder) {
        this.logFolder = Objects.requireNonNull(logFolder, "logFolder");
    }

    @Override
    public String type() {
        return TYPE;
    }

    public Path getLogFolder() {
        return logFolder;
    }

    Path fileOf(String runId) {
        return logFolder.resolve(runId + ".json");
    }

    @Override
    protected RunLog read(String runId) {
        Path file = fileOf(runId);
        if (!Files.exists(file)) {
            return null;
        }
        try {
            return RunLogJson.fromJson(Files.readString(file));
        } catch (IOException e) {
            throw new RunLogException("Cannot read run log " + file + ": " + e.getMessage(), e);
        }
    }

    @Override
    protected void write(RunLog runLog) {
        Path file = fileOf(runLog.getRunId());
        try {
            Files.createDirectories(logFolder);
            Path tmp = Files.createTempFile(logFolder, runLog.getRunId(), ".tmp");
            Files.writeString(tmp, RunLogJson.toJson(runLog));
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            log.debug("Run log written | file={} | status={}", file, runLog.getStatus());
        } catch (IOException e) {
            throw new RunLogException("Cannot write run log " + file + ": " + e.getMessage(), e);
        }
    }
}
