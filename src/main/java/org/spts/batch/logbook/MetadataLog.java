package org.spts.batch.logbook;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Immutable view of the experiment log book, indexed by canonical file name.
 * Loaded once per batch and shared read-only between all workers.
 */
public final class MetadataLog {

    private static final Logger LOGGER = Logger.getLogger(MetadataLog.class.getName());

    public static final String COLUMN_FILE = "File";
    public static final String COLUMN_DESCRIPTION = "Description";
    public static final String COLUMN_FRAMES = "frames";
    /** The trailing space is part of the column name in the log book. */
    public static final String COLUMN_DARK_CORRECTION = "Dark Correction ";
    public static final String COLUMN_ANALYSIS = "data analysis";
    public static final String COLUMN_INJECTOR_DISTANCE = "Injector distance";

    static final List<String> REQUIRED_COLUMNS = List.of(COLUMN_FILE, COLUMN_DESCRIPTION, COLUMN_FRAMES,
            COLUMN_DARK_CORRECTION, COLUMN_ANALYSIS, COLUMN_INJECTOR_DISTANCE);

    // pandas writes integer columns with missing values as floats ("50.0")
    private static final Pattern INTEGER_LIKE = Pattern.compile("\\d+(\\.0*)?");

    private final Map<String, LogRecord> records;
    private final Path source;

    private MetadataLog(Map<String, LogRecord> records, Path source) {
        this.records = Collections.unmodifiableMap(records);
        this.source = source;
    }

    /**
     * Loads and validates a CSV log book.
     *
     * @throws MetadataLoadException if the file is missing, is not parseable CSV, lacks a required column,
     *                               has an invalid frame count or lists a file twice
     */
    public static MetadataLog load(final Path path) throws MetadataLoadException {
        if (path == null || !Files.isRegularFile(path)) {
            throw new MetadataLoadException("Log file not found: " + path);
        }
        final CsvMapper mapper = new CsvMapper();
        mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        mapper.enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE);
        final CsvSchema headerSchema = CsvSchema.emptySchema().withHeader();

        final Map<String, LogRecord> records = new LinkedHashMap<>();
        try (MappingIterator<Map<String, String>> rows = mapper.readerForMapOf(String.class)
                .with(headerSchema)
                .readValues(path.toFile())) {

            verifyColumns((CsvSchema) rows.getParserSchema(), path);

            while (rows.hasNextValue()) {
                final long line = rows.getCurrentLocation().getLineNr();
                final Map<String, String> row = rows.nextValue();
                final LogRecord record = toRecord(row, line, path);
                if (record == null) {
                    continue;
                }
                if (records.putIfAbsent(record.fileId(), record) != null) {
                    throw new MetadataLoadException(String.format("Duplicate entry for file %s in log book %s (line %d)",
                            record.fileId(), path, line));
                }
            }
        } catch (MetadataLoadException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            throw new MetadataLoadException("Log file not in CSV format at path " + path + ": " + e.getMessage(), e);
        }

        LOGGER.info(String.format("Logfile found and loaded. Path: %s (%d entries)", path, records.size()));
        return new MetadataLog(records, path);
    }

    /**
     * Builds a log from already-typed records, e.g. for an in-memory log book.
     */
    public static MetadataLog of(final Collection<LogRecord> records) {
        final Map<String, LogRecord> byId = new LinkedHashMap<>();
        for (LogRecord record : records) {
            if (byId.putIfAbsent(record.fileId(), record) != null) {
                throw new IllegalArgumentException("Duplicate log record for " + record.fileId());
            }
        }
        return new MetadataLog(byId, null);
    }

    private static void verifyColumns(final CsvSchema schema, final Path path) throws MetadataLoadException {
        final List<String> missing = new ArrayList<>();
        for (String column : REQUIRED_COLUMNS) {
            if (schema == null || schema.column(column) == null) {
                missing.add("'" + column + "'");
            }
        }
        if (!missing.isEmpty()) {
            throw new MetadataLoadException("Log book " + path + " is missing required columns: " + String.join(", ", missing));
        }
    }

    private static LogRecord toRecord(final Map<String, String> row, final long line, final Path path)
            throws MetadataLoadException {
        final String fileId = ExtensionNormalizer.normalize(trimToNull(row.get(COLUMN_FILE)));
        if (fileId == null) {
            LOGGER.fine(() -> String.format("Skipping log book line %d without a file name.", line));
            return null;
        }
        final String darkCorrection = ExtensionNormalizer.normalize(trimToNull(row.get(COLUMN_DARK_CORRECTION)));
        return new LogRecord(fileId,
                row.get(COLUMN_DESCRIPTION),
                parseFrameCount(row.get(COLUMN_FRAMES), fileId, line, path),
                darkCorrection,
                row.get(COLUMN_ANALYSIS),
                parseInjectorDistance(row.get(COLUMN_INJECTOR_DISTANCE), fileId));
    }

    static Integer parseFrameCount(final String raw, final String fileId, final long line, final Path path)
            throws MetadataLoadException {
        final String value = trimToNull(raw);
        if (value == null) {
            return null;
        }
        if (!INTEGER_LIKE.matcher(value).matches()) {
            throw new MetadataLoadException(String.format("Invalid frame count '%s' for %s in log book %s (line %d)",
                    value, fileId, path, line));
        }
        final String digits = value.contains(".") ? value.substring(0, value.indexOf('.')) : value;
        try {
            return Integer.valueOf(digits);
        } catch (NumberFormatException e) {
            throw new MetadataLoadException(String.format("Frame count '%s' for %s out of range (line %d)", value, fileId, line), e);
        }
    }

    private static Double parseInjectorDistance(final String raw, final String fileId) {
        final String value = trimToNull(raw);
        if (value == null) {
            return null;
        }
        try {
            return Double.valueOf(value);
        } catch (NumberFormatException e) {
            LOGGER.fine(() -> String.format("Ignoring non-numeric injector distance '%s' for %s", value, fileId));
            return null;
        }
    }

    private static String trimToNull(final String value) {
        if (value == null) {
            return null;
        }
        final String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    /**
     * Exact-match lookup.
     *
     * @throws RecordNotFoundException if the log has no row for {@code fileId}
     */
    public LogRecord lookup(final String fileId) throws RecordNotFoundException {
        final LogRecord record = records.get(fileId);
        if (record == null) {
            throw new RecordNotFoundException(fileId);
        }
        return record;
    }

    public Optional<LogRecord> find(final String fileId) {
        return Optional.ofNullable(records.get(fileId));
    }

    public boolean contains(final String fileId) {
        return records.containsKey(fileId);
    }

    public FileClass classify(final String fileId) throws RecordNotFoundException {
        return lookup(fileId).classify();
    }

    public int size() {
        return records.size();
    }

    public Path source() {
        return source;
    }
}
