package org.spts.batch.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileUtilsTest {

    @TempDir
    Path tempDir; // JUnit Jupiter annotation for creating a temporary directory

    @Test
    void testListFiles_regularFilesOnly() throws IOException {
        Files.createFile(tempDir.resolve("data00001.cxd"));
        Files.createFile(tempDir.resolve("data00001.cxi"));
        Files.createDirectory(tempDir.resolve("data00002.cxd"));

        List<Path> files = FileUtils.listFiles(tempDir, null);
        assertEquals(2, files.size());
        assertTrue(files.stream().allMatch(Files::isRegularFile));
    }

    @Test
    void testListFiles_withFilter() throws IOException {
        Files.createFile(tempDir.resolve("data00001.cxd"));
        Files.createFile(tempDir.resolve("data00002.cxd"));
        Files.createFile(tempDir.resolve("data00001.cxi"));

        assertEquals(2, FileUtils.listFiles(tempDir, "*.cxd").size(), "A bare filter is a glob.");
        assertEquals(1, FileUtils.listFiles(tempDir, "regex:data0000[1]\\.cx[di]").stream()
                .filter(p -> p.getFileName().toString().endsWith(".cxi")).count());
        assertTrue(FileUtils.listFiles(tempDir, "glob:*.h5").isEmpty());
    }

    @Test
    void testListFiles_missingDirectory() throws IOException {
        assertTrue(FileUtils.listFiles(tempDir.resolve("nonexistent"), null).isEmpty(),
                "Should return empty list for non-existent directory.");
    }

    @Test
    void testListFileNames() throws IOException {
        Files.createFile(tempDir.resolve("data00001.cxd"));
        Files.createFile(tempDir.resolve("data00001.cxi"));

        assertEquals(List.of("data00001.cxd"), FileUtils.listFileNames(tempDir, ".cxd"));
    }

    @Test
    void testStemAndReplaceExtension() {
        assertEquals("data00012", FileUtils.stem("data00012.cxd"));
        assertEquals("_flatfield01624", FileUtils.stem("_flatfield01624.cxd"));
        assertEquals(".hidden", FileUtils.stem(".hidden"));
        assertEquals("data00012.cxd", FileUtils.replaceExtension("data00012.cxi", ".cxd"));
    }

    @Test
    void testEnsureParentExists() throws IOException {
        Path target = tempDir.resolve("ana").resolve("conf").resolve("data00001_ana_w05.yaml");
        FileUtils.ensureParentExists(target);
        assertTrue(Files.isDirectory(target.getParent()));
        assertDoesNotThrow(() -> FileUtils.ensureParentExists(target));
    }
}
