package org.spts.batch.config;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.ParseException;
import org.junit.jupiter.api.Test;
import org.spts.batch.model.BatchMode;
import org.spts.batch.selection.OutputPathPlanner;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CommandLineOptionsTest {

    private static BatchRequest request(AppConfig config, String... args) throws Exception {
        CommandLine cmd = CommandLineOptions.parse(args);
        return CommandLineOptions.toRequest(cmd, config);
    }

    @Test
    void testToRequest_conversionOptions() throws Exception {
        BatchRequest request = request(AppConfig.defaults(), "convert", "-d", "/data/run3", "-l", "log.csv",
                "-sn", "12", "-en", "15", "-b", "data00099.cxd", "-bn", "80", "-f", "ff.cxd", "-m", "-p", "60",
                "-crop", "--max-x", "1024", "-ow", "-c", "4", "--job-timeout", "600", "--strict", "-v");

        assertEquals(BatchMode.CONVERT, request.mode());
        assertEquals(Path.of("/data/run3"), request.dataDir());
        assertEquals(Path.of("log.csv"), request.logFile());
        assertEquals(12, request.startNumber());
        assertEquals(15, request.endNumber());
        assertEquals("data00099.cxd", request.backgroundFile());
        assertEquals(80, request.bgFramesMax());
        assertEquals("ff.cxd", request.flatfield());
        assertTrue(request.parameters().percentileFilter());
        assertEquals(60, request.parameters().percentileNumber());
        assertTrue(request.parameters().cropRaw());
        assertEquals(1024, request.parameters().maxX());
        assertEquals(2048, request.parameters().maxY());
        assertTrue(request.parameters().overwrite());
        assertEquals(4, request.workers());
        assertEquals(Duration.ofSeconds(600), request.jobTimeout());
        assertTrue(request.strictResolution());
        assertTrue(request.verbose());
    }

    @Test
    void testToRequest_defaults() throws Exception {
        BatchRequest request = request(AppConfig.defaults(), "analyze", "-d", "data", "-l", "log.csv");

        assertEquals(BatchMode.ANALYZE, request.mode());
        assertNull(request.startNumber());
        assertNull(request.parameters().windowSize());
        assertEquals(BatchRequest.DEFAULT_BG_FRAMES_MAX, request.bgFramesMax());
        assertEquals(OutputPathPlanner.DEFAULT_SAVE_ROOT, request.saveRoot());
        assertNull(request.jobTimeout());
        assertFalse(request.strictResolution());
        assertTrue(request.workers() >= 1);
        assertTrue(request.command().isEmpty());
    }

    @Test
    void testToRequest_commandLineOverridesConfig() throws Exception {
        AppConfig config = new AppConfig(
                new DispatchConfig(2, 120L, true, List.of("java.lang.OutOfMemoryError"), null),
                new ConversionConfig(List.of("cxd_to_h5.py", "{input}"), 90, 60, 12, 0.99, 40, 6, "ff.cxd"),
                new AnalysisConfig(List.of("run_spts.py", "{config}"), "results", "spts.yaml", 7));

        BatchRequest analysis = request(config, "analyze", "-d", "data", "-l", "log.csv", "-wd", "5", "-c", "8");
        assertEquals(5, analysis.parameters().windowSize());
        assertEquals(8, analysis.workers());
        assertEquals(Duration.ofSeconds(120), analysis.jobTimeout());
        assertTrue(analysis.strictResolution());
        assertEquals(List.of("java.lang.OutOfMemoryError"), analysis.fatalExceptions());
        assertEquals(Path.of("results"), analysis.saveRoot());
        assertEquals(Path.of("spts.yaml"), analysis.analysisTemplate());
        assertEquals(List.of("run_spts.py", "{config}"), analysis.command());

        BatchRequest conversion = request(config, "convert", "-d", "data", "-l", "log.csv", "-rf", "0.95");
        assertEquals(7, conversion.parameters().windowSize());
        assertEquals(90, conversion.bgFramesMax());
        assertEquals(60, conversion.parameters().ffFramesMax());
        assertEquals(0.95, conversion.parameters().roiFraction());
        assertEquals(12, conversion.parameters().roiLowLimit());
        assertEquals("ff.cxd", conversion.flatfield());
        assertEquals(List.of("cxd_to_h5.py", "{input}"), conversion.command());
    }

    @Test
    void testToRequest_invalidValues() {
        assertThrows(BatchConfigurationException.class,
                () -> request(AppConfig.defaults(), "convert", "-d", "data", "-l", "log.csv", "-sn", "twelve"));
        assertThrows(BatchConfigurationException.class,
                () -> request(AppConfig.defaults(), "convert", "-d", "data", "-l", "log.csv", "-sn", "15", "-en", "12"));
        assertThrows(BatchConfigurationException.class,
                () -> request(AppConfig.defaults(), "convert", "-d", "data", "-l", "log.csv", "-c", "0"));
        assertThrows(BatchConfigurationException.class,
                () -> request(AppConfig.defaults(), "convert", "-d", "data", "-l", "log.csv", "--job-timeout", "0"));
        assertThrows(BatchConfigurationException.class,
                () -> request(AppConfig.defaults(), "convert", "-d", "data", "-l", "log.csv", "-rf", "most"));
    }

    @Test
    void testToRequest_missingModeOrPaths() {
        assertThrows(BatchConfigurationException.class, () -> request(AppConfig.defaults(), "-d", "data", "-l", "log.csv"));
        assertThrows(BatchConfigurationException.class, () -> request(AppConfig.defaults(), "merge", "-d", "data", "-l", "log.csv"));
        assertThrows(BatchConfigurationException.class, () -> request(AppConfig.defaults(), "convert", "-l", "log.csv"));
        assertThrows(BatchConfigurationException.class, () -> request(AppConfig.defaults(), "convert", "-d", "data"));
    }

    @Test
    void testParse_unknownOption() {
        assertThrows(ParseException.class, () -> CommandLineOptions.parse(new String[]{"convert", "--frobnicate"}));
    }

    @Test
    void testConfigPath() throws Exception {
        assertNull(CommandLineOptions.configPath(CommandLineOptions.parse(new String[]{"convert"})));
        assertEquals(Path.of("other.yaml"),
                CommandLineOptions.configPath(CommandLineOptions.parse(new String[]{"convert", "--config", "other.yaml"})));
    }
}
