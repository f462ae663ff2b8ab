package org.spts.batch.selection;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.spts.batch.logbook.FileClass;
import org.spts.batch.logbook.LogRecord;
import org.spts.batch.logbook.MetadataLog;
import org.spts.batch.logbook.RecordNotFoundException;
import org.spts.batch.model.BatchMode;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DependencyResolverTest {

    @TempDir
    Path dataDir;

    private MetadataLog log;

    @BeforeEach
    void setUp() throws IOException {
        log = MetadataLog.of(List.of(
                new LogRecord("data00001.cxd", "sample", 1000, "2", "", null),
                new LogRecord("data00002.cxd", "background", 50, "", "", null),
                new LogRecord("data00003.cxd", "sample", 800, "data00002.cxd", "", null),
                new LogRecord("data00004.cxd", "sample", 800, "see notes", "", null),
                new LogRecord("data00005.cxd", "sample", 800, "7", "", null),
                new LogRecord("data00006.cxd", "sample", null, "8", "", null),
                new LogRecord("data00007.cxd", "background", null, "", "", null),
                new LogRecord("data00008.cxd", "background", 30, "", "", null),
                new LogRecord("data00009.cxd", "sample", 800, "2", "bubbles - exclude", null),
                new LogRecord("data00010.cxd", "flatfield", 100, "", "", null)));
        Files.writeString(dataDir.resolve("data00002.cxd"), "bg");
        Files.writeString(dataDir.resolve("data00007.cxd"), "bg");
    }

    private DependencyResolver convertResolver() {
        return new DependencyResolver(log, BatchMode.CONVERT, dataDir, null, 0);
    }

    @Test
    void testResolve_backgroundFromFileNumber() {
        CandidateResolution resolution = convertResolver().resolve("data00001.cxd");

        assertTrue(resolution.isResolved());
        assertEquals("data00002.cxd", resolution.backgroundFile());
        assertEquals(50, resolution.backgroundFrameBudget());
        assertNull(resolution.frameCount());
    }

    @Test
    void testResolve_backgroundFromFileName() {
        CandidateResolution resolution = convertResolver().resolve("data00003.cxd");
        assertTrue(resolution.isResolved());
        assertEquals("data00002.cxd", resolution.backgroundFile());
    }

    @Test
    void testResolve_calibrationAndExcludedFilesAreDropped() {
        DependencyResolver resolver = convertResolver();

        CandidateResolution background = resolver.resolve("data00002.cxd");
        assertEquals(ResolutionStatus.DROPPED, background.status());
        assertEquals(FileClass.BACKGROUND, background.fileClass());
        assertEquals("classified as background", background.reason());

        assertEquals(FileClass.EXCLUDED, resolver.resolve("data00009.cxd").fileClass());
        assertEquals(FileClass.FLATFIELD, resolver.resolve("data00010.cxd").fileClass());
        assertEquals(ResolutionStatus.DROPPED, resolver.resolve("data00010.cxd").status());
    }

    @Test
    void testResolve_unknownFile() {
        CandidateResolution resolution = convertResolver().resolve("data00042.cxd");
        assertEquals(ResolutionStatus.UNRESOLVED, resolution.status());
        assertInstanceOf(RecordNotFoundException.class, resolution.error());
        assertNull(resolution.fileClass());
    }

    @Test
    void testResolve_invalidReference() {
        CandidateResolution resolution = convertResolver().resolve("data00004.cxd");
        assertInstanceOf(InvalidBackgroundReferenceException.class, resolution.error());
        assertTrue(resolution.reason().contains("see notes"));
    }

    @Test
    void testResolve_backgroundWithoutFrameCount() {
        CandidateResolution resolution = convertResolver().resolve("data00005.cxd");
        assertInstanceOf(IncompleteRecordException.class, resolution.error());
    }

    @Test
    void testResolve_backgroundFileMissingOnDisk() {
        CandidateResolution resolution = convertResolver().resolve("data00006.cxd");
        MissingBackgroundFileException e = assertInstanceOf(MissingBackgroundFileException.class, resolution.error());
        assertEquals(dataDir.resolve("data00008.cxd"), e.getBackgroundPath());
    }

    @Test
    void testResolve_backgroundOverride() {
        DependencyResolver resolver = new DependencyResolver(log, BatchMode.CONVERT, dataDir, "data00007.cxd", 100);

        CandidateResolution resolution = resolver.resolve("data00004.cxd");

        assertTrue(resolution.isResolved(), "The override replaces the unusable log book reference.");
        assertEquals("data00007.cxd", resolution.backgroundFile());
        assertEquals(100, resolution.backgroundFrameBudget());
    }

    @Test
    void testResolve_analysisUsesRawFrameCount() {
        DependencyResolver resolver = new DependencyResolver(log, BatchMode.ANALYZE, dataDir, null, 0);

        CandidateResolution resolution = resolver.resolve("data00001.cxi");

        assertTrue(resolution.isResolved());
        assertEquals(1000, resolution.frameCount());
        assertNull(resolution.backgroundFile());
        assertEquals(0, resolution.backgroundFrameBudget());
    }

    @Test
    void testResolve_analysisWithoutFrameCount() {
        DependencyResolver resolver = new DependencyResolver(log, BatchMode.ANALYZE, dataDir, null, 0);

        assertInstanceOf(IncompleteRecordException.class, resolver.resolve("data00006.cxi").error());
        assertEquals(ResolutionStatus.DROPPED, resolver.resolve("data00009.cxi").status());
    }
}
