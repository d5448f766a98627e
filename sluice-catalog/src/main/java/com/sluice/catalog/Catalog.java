package com.sluice.catalog;

import com.sluice.runlog.DataCatalog;

import java.nio.file.Path;
import java.util.List;

/**
 * Store of named artifacts passed between steps that may run in isolated environments. Artifacts of a run are
 * addressed by their path relative to the compute data folder; patterns are globs over that path.
 */
public interface Catalog {

    /** Catalog type name as used in configuration. */
    String type();

    /**
     * Copies the artifacts of {@code runId} matching {@code pattern} into the compute data folder.
     *
     * @param stepPath node path of the fetching step, recorded on each entry
     * @throws CatalogException NO_COMPUTE_FOLDER when the folder is missing, EMPTY_GET when nothing was put yet
     */
    List<DataCatalog> get(String pattern, String runId, Path computeDataFolder, String stepPath);

    /**
     * Copies files of the compute data folder matching {@code pattern} into the catalog of {@code runId}. A file
     * listed in {@code fetched} with the same content hash is skipped.
     *
     * @param stepPath node path of the producing step
     * @throws CatalogException NO_COMPUTE_FOLDER when the folder is missing
     */
    List<DataCatalog> put(String pattern, String runId, Path computeDataFolder, String stepPath,
                          List<DataCatalog> fetched);

    /** Makes the artifacts of {@code previousRunId} available to {@code runId}. */
    void syncBetweenRuns(String previousRunId, String runId);

    /**
     * @throws CatalogException NO_COMPUTE_FOLDER when the folder is missing
     */
    void ensureComputeFolder(Path computeDataFolder);
}
