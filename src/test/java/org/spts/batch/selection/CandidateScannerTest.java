package org.spts.batch.selection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

class CandidateScannerTest {

    @TempDir
    Path dataDir;

    private final CandidateScanner scanner = new CandidateScanner();

    @BeforeEach
    void setUp() throws IOException {
        for (String name : List.of("data00003.cxd", "data00001.cxd", "data00002.cxd", "data00002.cxi",
                "data01624.cxd", "_flatfield01624.cxd", "notes.txt")) {
            Files.writeString(dataDir.resolve(name), "x");
        }
        Files.createDirectory(dataDir.resolve("data00009.cxd")); // directories are not candidates
    }

    @Test
    void testScan_subtractsDoneAndSentinels() throws IOException {
        SortedSet<String> candidates = scanner.scan(dataDir, ".cxd", ".cxi", false);
        assertEquals(List.of("data00001.cxd", "data00003.cxd"), List.copyOf(candidates));
    }

    @Test
    void testScan_overwriteKeepsDoneFiles() throws IOException {
        SortedSet<String> candidates = scanner.scan(dataDir, ".cxd", ".cxi", true);
        assertEquals(List.of("data00001.cxd", "data00002.cxd", "data00003.cxd"), List.copyOf(candidates));
    }

    @Test
    void testScan_withoutDoneExtension() throws IOException {
        SortedSet<String> candidates = scanner.scan(dataDir, ".cxi", null, false);
        assertEquals(List.of("data00002.cxi"), List.copyOf(candidates));
    }

    @Test
    void testScan_convertedSentinelsRemovedInAnalysis() throws IOException {
        Files.writeString(dataDir.resolve("data01624.cxi"), "x");
        Files.writeString(dataDir.resolve("_flatfield01624.cxi"), "x");

        SortedSet<String> candidates = scanner.scan(dataDir, ".cxi", null, false);

        assertEquals(List.of("data00002.cxi"), List.copyOf(candidates));
        assertTrue(CandidateScanner.isCalibrationSentinel("data01624.cxi"));
        assertFalse(CandidateScanner.isCalibrationSentinel("data01625.cxi"));
    }

    @Test
    void testScan_missingDirectory() {
        assertThrows(IOException.class, () -> scanner.scan(dataDir.resolve("missing"), ".cxd", ".cxi", false));
    }
}
