package org.spts.batch.selection;

import org.spts.batch.logbook.ResolutionException;

import java.nio.file.Path;

public class MissingBackgroundFileException extends ResolutionException {

    private final Path backgroundPath;

    public MissingBackgroundFileException(String fileName, Path backgroundPath) {
        super(fileName, "Background file for " + fileName + " not found in folder: " + backgroundPath);
        this.backgroundPath = backgroundPath;
    }

    public Path getBackgroundPath() {
        return backgroundPath;
    }
}
