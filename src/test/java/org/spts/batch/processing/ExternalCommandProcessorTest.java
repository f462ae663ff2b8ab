package org.spts.batch.processing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;
import org.spts.batch.model.BatchMode;
import org.spts.batch.model.Job;
import org.spts.batch.model.JobParameters;
import org.spts.batch.plugin.JobContext;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ExternalCommandProcessorTest {

    @TempDir
    Path dataDir;

    private Job conversionJob(JobParameters parameters) {
        return new Job(1, BatchMode.CONVERT, dataDir.resolve("data00001.cxd"), dataDir.resolve("data00002.cxd"), 50,
                dataDir.resolve("_flatfield01624.cxd"), null, dataDir.resolve("data00001.cxi"), null, parameters);
    }

    @Test
    void testBuildCommand_substitutesPlaceholders() {
        ExternalCommandProcessor processor = new ExternalCommandProcessor(List.of(
                "cxd_to_h5.py", "{input}", "-b", "{background}", "-bn", "{bgFrames}", "-f", "{flatfield}",
                "-fn", "{ffFrames}", "--crop={minX},{maxX},{minY},{maxY}", "-o", "{output}"));

        List<String> command = processor.buildCommand(conversionJob(JobParameters.defaults()));

        assertEquals(List.of("cxd_to_h5.py", dataDir.resolve("data00001.cxd").toString(),
                "-b", dataDir.resolve("data00002.cxd").toString(), "-bn", "50",
                "-f", dataDir.resolve("_flatfield01624.cxd").toString(), "-fn", "100",
                "--crop=0,2048,0,2048", "-o", dataDir.resolve("data00001.cxi").toString()), command);
    }

    @Test
    void testBuildCommand_dropsPlaceholdersWithoutValue() {
        ExternalCommandProcessor processor = new ExternalCommandProcessor(List.of("run_spts.py", "{config}", "{window}", "{input}"));

        List<String> command = processor.buildCommand(conversionJob(JobParameters.defaults()));

        assertEquals(List.of("run_spts.py", dataDir.resolve("data00001.cxd").toString()), command);
    }

    @Test
    void testBuildCommand_expandsFlags() {
        JobParameters parameters = new JobParameters(null, true, 0, 1024, 0, 1024, true, 50, 4, 10, 0.999, 100, true, false);
        ExternalCommandProcessor processor = new ExternalCommandProcessor(List.of("cxd_to_h5.py", "{flags}", "{input}"));

        List<String> command = processor.buildCommand(conversionJob(parameters));

        assertEquals(List.of("cxd_to_h5.py", "--percentile-filter", "--crop-raw", "--skip-raw",
                dataDir.resolve("data00001.cxd").toString()), command);
        assertTrue(ExternalCommandProcessor.flags(JobParameters.defaults()).isEmpty());
    }

    @Test
    void testConstructor_emptyTemplate() {
        assertThrows(IllegalArgumentException.class, () -> new ExternalCommandProcessor(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new ExternalCommandProcessor(null));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testProcess_runsCommand() throws Exception {
        ExternalCommandProcessor processor = new ExternalCommandProcessor(List.of("sh", "-c", "echo converted > \"$0\"", "{output}"));
        Job job = conversionJob(JobParameters.defaults());

        processor.process(job, new JobContext(1, 1, true));

        assertEquals("converted", Files.readString(job.outputPath()).trim());
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void testProcess_nonZeroExit() {
        ExternalCommandProcessor processor = new ExternalCommandProcessor(List.of("sh", "-c", "echo bad header; exit 3"));

        ExternalProcessException e = assertThrows(ExternalProcessException.class,
                () -> processor.process(conversionJob(JobParameters.defaults()), new JobContext(1, 1, false)));
        assertEquals(3, e.getExitCode());
        assertEquals(List.of("bad header"), e.getOutputTail());
    }
}
