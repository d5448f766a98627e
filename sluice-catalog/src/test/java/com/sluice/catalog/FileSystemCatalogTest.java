package com.sluice.catalog;

import com.sluice.runlog.DataCatalog;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FileSystemCatalogTest {

    @TempDir
    Path tempDir;

    private FileSystemCatalog catalog;
    private Path producerData;
    private Path consumerData;

    @BeforeEach
    void setUp() throws Exception {
        catalog = new FileSystemCatalog(tempDir.resolve(".catalog"));
        producerData = Files.createDirectories(tempDir.resolve("producer/data"));
        consumerData = Files.createDirectories(tempDir.resolve("consumer/data"));
    }

    @Test
    void putThenGetReturnsSameBytes() throws Exception {
        byte[] bytes = {1, 2, 3, 0, 42};
        Files.write(producerData.resolve("data.csv"), bytes);

        List<DataCatalog> put = catalog.put("data.csv", "r1", producerData, "a", List.of());
        List<DataCatalog> got = catalog.get("data.csv", "r1", consumerData, "b");

        assertArrayEquals(bytes, Files.readAllBytes(consumerData.resolve("data.csv")));
        assertEquals(1, put.size());
        assertEquals("a", put.get(0).getProducedBy());
        assertEquals(DataCatalog.Stage.PUT, put.get(0).getStage());
        assertEquals("r1/data.csv", put.get(0).getCatalogRelativePath());
        assertEquals(put.get(0).getDataHash(), got.get(0).getDataHash());
        assertEquals(DataCatalog.Stage.GET, got.get(0).getStage());
    }

    @Test
    void globPatternsMatchRelativePaths() throws Exception {
        Files.createDirectories(producerData.resolve("models"));
        Files.writeString(producerData.resolve("models/m1.bin"), "m1");
        Files.writeString(producerData.resolve("models/m2.bin"), "m2");
        Files.writeString(producerData.resolve("notes.txt"), "n");

        List<DataCatalog> put = catalog.put("models/*.bin", "r1", producerData, "a", List.of());

        assertEquals(List.of("models/m1.bin", "models/m2.bin"), put.stream().map(DataCatalog::getName).toList());
    }

    @Test
    void getBeforeAnyPutIsEmptyGet() {
        CatalogException e = assertThrows(CatalogException.class,
                () -> catalog.get("data.csv", "fresh", consumerData, "first"));

        assertEquals(CatalogException.Reason.EMPTY_GET, e.getReason());
    }

    @Test
    void missingComputeFolderIsReported() {
        Path missing = tempDir.resolve("nowhere");

        CatalogException onPut = assertThrows(CatalogException.class,
                () -> catalog.put("*", "r1", missing, "a", List.of()));
        CatalogException onCheck = assertThrows(CatalogException.class, () -> catalog.ensureComputeFolder(missing));

        assertEquals(CatalogException.Reason.NO_COMPUTE_FOLDER, onPut.getReason());
        assertEquals(CatalogException.Reason.NO_COMPUTE_FOLDER, onCheck.getReason());
    }

    @Test
    void putSkipsFetchedFilesThatDidNotChange() throws Exception {
        Files.writeString(producerData.resolve("in.csv"), "x");
        catalog.put("in.csv", "r1", producerData, "a", List.of());
        List<DataCatalog> fetched = catalog.get("in.csv", "r1", consumerData, "b");
        Files.writeString(consumerData.resolve("out.csv"), "y");

        List<DataCatalog> put = catalog.put("*.csv", "r1", consumerData, "b", fetched);

        assertEquals(List.of("out.csv"), put.stream().map(DataCatalog::getName).toList());
    }

    @Test
    void syncBetweenRunsCopiesPreviousArtifacts() throws Exception {
        Files.writeString(producerData.resolve("data.csv"), "prior");
        catalog.put("data.csv", "old", producerData, "a", List.of());

        catalog.syncBetweenRuns("old", "new");
        catalog.get("data.csv", "new", consumerData, "b");

        assertEquals("prior", Files.readString(consumerData.resolve("data.csv")));
        assertTrue(Files.exists(tempDir.resolve(".catalog/new/data.csv")));
    }

    @Test
    void doNothingCatalogNeedsNoFolder() {
        DoNothingCatalog nothing = new DoNothingCatalog();

        nothing.ensureComputeFolder(tempDir.resolve("nowhere"));

        assertTrue(nothing.get("*", "r1", tempDir.resolve("nowhere"), "a").isEmpty());
    }
}
