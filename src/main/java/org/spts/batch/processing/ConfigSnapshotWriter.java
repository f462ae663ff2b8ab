package org.spts.batch.processing;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.spts.batch.model.Job;
import org.spts.batch.util.FileUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Writes the effective analysis configuration of a job: the analysis template with the job's input
 * file, frame count and window size filled in.
 */
public class ConfigSnapshotWriter {

    private static final Logger LOGGER = Logger.getLogger(ConfigSnapshotWriter.class.getName());

    public static final String GENERAL_SECTION = "general";
    public static final String ANALYSE_SECTION = "analyse";
    public static final String FILENAME_KEY = "filename";
    public static final String N_IMAGES_KEY = "n_images";
    public static final String WINDOW_SIZE_KEY = "window_size";

    private static final TypeReference<LinkedHashMap<String, Map<String, Object>>> TEMPLATE_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Map<String, Map<String, Object>> template;

    public ConfigSnapshotWriter(Map<String, Map<String, Object>> template) {
        this.template = template == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(template));
    }

    /**
     * Loads an analysis template; a null path yields an empty template.
     */
    public static ConfigSnapshotWriter fromTemplate(final Path templatePath) throws IOException {
        if (templatePath == null) {
            return new ConfigSnapshotWriter(Map.of());
        }
        if (!Files.isRegularFile(templatePath)) {
            throw new IOException("Config file not found: " + templatePath);
        }
        final Map<String, Map<String, Object>> loaded = new ObjectMapper(new YAMLFactory()).readValue(templatePath.toFile(), TEMPLATE_TYPE);
        LOGGER.info("Config file found and loaded: " + templatePath);
        return new ConfigSnapshotWriter(loaded);
    }

    /**
     * Window size configured in the template ({@code analyse.window_size}), or null.
     */
    public Integer templateWindowSize() {
        final Map<String, Object> analyse = template.get(ANALYSE_SECTION);
        final Object value = analyse != null ? analyse.get(WINDOW_SIZE_KEY) : null;
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value != null) {
            try {
                return Integer.valueOf(value.toString().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid analyse.window_size in analysis template: " + value, e);
            }
        }
        return null;
    }

    Map<String, Map<String, Object>> snapshotFor(final Job job) {
        final Map<String, Map<String, Object>> snapshot = new LinkedHashMap<>();
        template.forEach((section, values) -> snapshot.put(section, values == null ? new LinkedHashMap<>() : new LinkedHashMap<>(values)));

        final Map<String, Object> general = snapshot.computeIfAbsent(GENERAL_SECTION, key -> new LinkedHashMap<>());
        general.put(FILENAME_KEY, job.inputPath().toString());
        if (job.frameCount() != null) {
            general.put(N_IMAGES_KEY, job.frameCount());
        }
        if (job.parameters().windowSize() != null) {
            snapshot.computeIfAbsent(ANALYSE_SECTION, key -> new LinkedHashMap<>())
                    .put(WINDOW_SIZE_KEY, job.parameters().windowSize());
        }
        return snapshot;
    }

    public void write(final Job job) throws IOException {
        final Path target = job.configSnapshotPath();
        FileUtils.ensureParentExists(target);
        yamlMapper.writeValue(target.toFile(), snapshotFor(job));
        LOGGER.fine(() -> "Wrote configuration snapshot " + target);
    }
}
