package org.spts.batch.processing;

import org.spts.batch.plugin.InputProbe;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.logging.Logger;

/**
 * Accepts readable regular files with at least one byte. Used for raw captures, whose format is opaque.
 */
public class NonEmptyFileProbe implements InputProbe {

    private static final Logger LOGGER = Logger.getLogger(NonEmptyFileProbe.class.getName());

    @Override
    public boolean isValid(final Path input) {
        if (!Files.isRegularFile(input) || !Files.isReadable(input)) {
            return false;
        }
        try {
            return Files.size(input) > 0;
        } catch (IOException e) {
            LOGGER.warning(String.format("Cannot read size of %s: %s", input, e.getMessage()));
            return false;
        }
    }
}
