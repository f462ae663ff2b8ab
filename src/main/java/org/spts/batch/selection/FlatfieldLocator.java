package org.spts.batch.selection;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.logging.Logger;

/**
 * Finds the flat-field capture used by conversion jobs.
 */
public final class FlatfieldLocator {

    private static final Logger LOGGER = Logger.getLogger(FlatfieldLocator.class.getName());

    public static final Path SHARED_FLATFIELD = Path.of("data", "consts", "data01624.cxd");
    public static final String DEDICATED_FLATFIELD_NAME = "_flatfield01624.cxd";
    public static final String NUMBERED_FLATFIELD_NAME = "data01624.cxd";

    private FlatfieldLocator() {
    }

    /**
     * @param requested flat-field given by the user; a bare file name is looked up in the data directory,
     *                  null searches the default locations
     */
    public static Path locate(final Path dataDir, final String requested) throws NoSuchFileException {
        if (requested != null && !requested.isBlank()) {
            final Path explicit = isBareName(requested) ? dataDir.resolve(requested.trim()) : Path.of(requested.trim());
            if (!Files.isRegularFile(explicit)) {
                throw new NoSuchFileException(explicit.toString(), null, "flat-field file not found");
            }
            LOGGER.info("Using flat-field " + explicit);
            return explicit;
        }
        final List<Path> searched = defaultLocations(dataDir);
        for (final Path candidate : searched) {
            if (Files.isRegularFile(candidate)) {
                LOGGER.info("Using flat-field " + candidate);
                return candidate;
            }
        }
        throw new NoSuchFileException(searched.toString(), null, "no flat-field file in the default locations");
    }

    static List<Path> defaultLocations(final Path dataDir) {
        return List.of(SHARED_FLATFIELD, dataDir.resolve(DEDICATED_FLATFIELD_NAME), dataDir.resolve(NUMBERED_FLATFIELD_NAME));
    }

    private static boolean isBareName(final String requested) {
        return requested.indexOf('/') < 0 && requested.indexOf('\\') < 0;
    }
}
