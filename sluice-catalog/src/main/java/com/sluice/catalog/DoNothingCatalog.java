package com.sluice.catalog;

import com.sluice.runlog.DataCatalog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;

/**
 * Catalog that stores nothing. Steps sharing a filesystem can pass data directly; no compute folder is required.
 */
public final class DoNothingCatalog implements Catalog {

    public static final String TYPE = "do-nothing";

    private static final Logger log = LoggerFactory.getLogger(DoNothingCatalog.class);

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<DataCatalog> get(String pattern, String runId, Path computeDataFolder, String stepPath) {
        log.debug("Catalog get ignored | type={} | pattern={} | step={}", TYPE, pattern, stepPath);
        return List.of();
    }

    @Override
    public List<DataCatalog> put(String pattern, String runId, Path computeDataFolder, String stepPath,
                                 List<DataCatalog> fetched) {
        log.debug("Catalog put ignored | type={} | pattern={} | step={}", TYPE, pattern, stepPath);
        return List.of();
    }

    @Override
    public void syncBetweenRuns(String previousRunId, String runId) {
        log.debug("Catalog sync ignored | type={} | previousRunId={} | runId={}", TYPE, previousRunId, runId);
    }

    @Override
    public void ensureComputeFolder(Path computeDataFolder) {
        // no working area needed
    }
}
