package org.spts.batch.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.ConsoleHandler;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.logging.SimpleFormatter;

public final class ConfigManager {

    private static final Logger APP_LOGGER = Logger.getLogger(ConfigManager.class.getName());
    public static final Path DEFAULT_CONFIG_PATH = Path.of("conf", "spts-batch.yaml");

    static {
        System.setProperty("java.util.logging.SimpleFormatter.format", "[%1$tF %1$tT] [%4$-7s] %3$s - %5$s %6$s%n");
        ConsoleHandler handler = new ConsoleHandler();
        handler.setFormatter(new SimpleFormatter());
        handler.setLevel(Level.ALL);
        Logger rootLogger = Logger.getLogger("");
        for (Handler existing : rootLogger.getHandlers()) {
            if (existing instanceof ConsoleHandler) {
                rootLogger.removeHandler(existing);
            }
        }
        rootLogger.addHandler(handler);
        rootLogger.setLevel(Level.INFO);
    }

    private ConfigManager() {
    }

    /**
     * Reads the framework configuration.
     *
     * @param configPath the YAML file, null for {@link #DEFAULT_CONFIG_PATH}
     * @param required   whether a missing file is an error; a missing optional file yields the defaults
     */
    public static AppConfig load(final Path configPath, final boolean required) throws BatchConfigurationException {
        final Path path = configPath != null ? configPath : DEFAULT_CONFIG_PATH;
        if (!Files.isRegularFile(path)) {
            if (required) {
                throw new BatchConfigurationException("Config file not found: " + path);
            }
            APP_LOGGER.fine(() -> "No config file at " + path + ", using defaults.");
            return AppConfig.defaults();
        }
        try {
            ObjectMapper frameworkObjectMapper = new ObjectMapper(new YAMLFactory());
            frameworkObjectMapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
            AppConfig appConfig = frameworkObjectMapper.readValue(path.toFile(), AppConfig.class);
            APP_LOGGER.info("Config file found and loaded. Path: " + path);
            return appConfig != null ? appConfig : AppConfig.defaults();
        } catch (IOException e) {
            throw new BatchConfigurationException("Cannot read config file " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Lowers the root level to FINE. Called once on the main thread before any worker starts.
     */
    public static void setVerbose(final boolean verbose) {
        Logger.getLogger("").setLevel(verbose ? Level.FINE : Level.INFO);
    }
}
