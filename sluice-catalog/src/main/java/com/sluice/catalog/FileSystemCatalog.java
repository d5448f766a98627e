package com.sluice.catalog;

import com.sluice.runlog.DataCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Catalog on the local filesystem. Artifacts of a run live under {@code <catalogLocation>/<runId>/} with the same
 * relative paths they had in the compute data folder.
 */
public final class FileSystemCatalog implements Catalog {

    public static final String TYPE = "file-system";

    private static final Logger log = LoggerFactory.getLogger(FileSystemCatalog.class);

    private final Path catalogLocation;

    public FileSystemCatalog(Path catalogLocation) {
        this.catalogLocation = Objects.requireNonNull(catalogLocation, "catalogLocation");
    }

    @Override
    public String type() {
        return TYPE;
    }

    public Path getCatalogLocation() {
        return catalogLocation;
    }

    @Override
    public List<DataCatalog> get(String pattern, String runId, Path computeDataFolder, String stepPath) {
        ensureComputeFolder(computeDataFolder);
        Path runCatalog = catalogLocation.resolve(runId);
        if (!Files.isDirectory(runCatalog)) {
            throw new CatalogException(CatalogException.Reason.EMPTY_GET,
                    "Nothing has been put in the catalog of run " + runId + " yet; cannot get '" + pattern
                            + "' for step " + stepPath);
        }
        List<DataCatalog> entries = new ArrayList<>();
        try {
            for (Path source : matching(runCatalog, pattern)) {
                String name = relativeName(runCatalog, source);
                Path target = computeDataFolder.resolve(name);
                copy(source, target);
                entries.add(entry(name, FileHashes.sha256(target), runId, DataCatalog.Stage.GET, stepPath));
            }
        } catch (IOException e) {
            throw new CatalogException(CatalogException.Reason.IO,
                    "Catalog get failed | pattern=" + pattern + " | run=" + runId + ": " + e.getMessage(), e);
        }
        log.info("Catalog get | runId={} | step={} | pattern={} | artifacts={}", runId, stepPath, pattern, entries.size());
        return entries;
    }

    @Override
    public List<DataCatalog> put(String pattern, String runId, Path computeDataFolder, String stepPath,
                                 List<DataCatalog> fetched) {
        ensureComputeFolder(computeDataFolder);
        Path runCatalog = catalogLocation.resolve(runId);
        List<DataCatalog> entries = new ArrayList<>();
        int skipped = 0;
        try {
            Files.createDirectories(runCatalog);
            for (Path source : matching(computeDataFolder, pattern)) {
                String name = relativeName(computeDataFolder, source);
                String hash = FileHashes.sha256(source);
                if (wasFetchedUnchanged(name, hash, fetched)) {
                    skipped++;
                    continue;
                }
                copy(source, runCatalog.resolve(name));
                entries.add(entry(name, hash, runId, DataCatalog.Stage.PUT, stepPath));
            }
        } catch (IOException e) {
            throw new CatalogException(CatalogException.Reason.IO,
                    "Catalog put failed | pattern=" + pattern + " | run=" + runId + ": " + e.getMessage(), e);
        }
        log.info("Catalog put | runId={} | step={} | pattern={} | artifacts={} | unchanged={}",
                runId, stepPath, pattern, entries.size(), skipped);
        return entries;
    }

    @Override
    public void syncBetweenRuns(String previousRunId, String runId) {
        Path from = catalogLocation.resolve(previousRunId);
        Path to = catalogLocation.resolve(runId);
        if (!Files.isDirectory(from)) {
            log.info("Catalog sync | no artifacts in previous run | previousRunId={}", previousRunId);
            return;
        }
        try {
            Files.createDirectories(to);
            List<Path> files = walkFiles(from);
            for (Path source : files) {
                copy(source, to.resolve(from.relativize(source)));
            }
            log.info("Catalog synced | previousRunId={} | runId={} | artifacts={}", previousRunId, runId, files.size());
        } catch (IOException e) {
            throw new CatalogException(CatalogException.Reason.IO,
                    "Catalog sync from " + previousRunId + " to " + runId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public void ensureComputeFolder(Path computeDataFolder) {
        if (computeDataFolder == null || !Files.isDirectory(computeDataFolder)) {
            throw new CatalogException(CatalogException.Reason.NO_COMPUTE_FOLDER,
                    "Compute data folder does not exist: " + computeDataFolder);
        }
    }

    /** Regular files under {@code root} whose relative path matches the glob, in path order. */
    static List<Path> matching(Path root, String pattern) throws IOException {
        PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
        List<Path> out = new ArrayList<>();
        for (Path file : walkFiles(root)) {
            if (matcher.matches(root.relativize(file))) {
                out.add(file);
            }
        }
        return out;
    }

    private static List<Path> walkFiles(Path root) throws IOException {
        try (Stream<Path> walk = Files.walk(root)) {
            return walk.filter(Files::isRegularFile).sorted().collect(Collectors.toList());
        }
    }

    private static boolean wasFetchedUnchanged(String name, String hash, List<DataCatalog> fetched) {
        if (fetched == null) return false;
        for (DataCatalog entry : fetched) {
            if (name.equals(entry.getName()) && hash.equals(entry.getDataHash())) return true;
        }
        return false;
    }

    private DataCatalog entry(String name, String hash, String runId, DataCatalog.Stage stage, String stepPath) {
        return new DataCatalog(name, hash, runId + "/" + name, catalogLocation.toString(), stage, stepPath);
    }

    private static String relativeName(Path root, Path file) {
        return root.relativize(file).toString().replace('\\', '/');
    }

    private static void copy(Path source, Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
}
