package org.spts.batch.util;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.Collections;
import java.util.List;
import java.util.logging.Logger;

public final class FileUtils {

    private static final Logger LOGGER = Logger.getLogger(FileUtils.class.getName());

    private FileUtils() {
    }

    /**
     * Lists regular files (non-recursive) whose file name matches the filter.
     * A filter without a syntax prefix is treated as a glob.
     */
    public static List<Path> listFiles(final Path sourceDir, final String fileFilter) throws IOException {
        if (!Files.isDirectory(sourceDir)) {
            LOGGER.warning(String.format("Dir not found: %s. Empty list.", sourceDir));
            return Collections.emptyList();
        }
        final PathMatcher fileMatcher = matcher(fileFilter);
        try (var stream = Files.list(sourceDir)) {
            return stream.filter(Files::isRegularFile).filter(p -> fileMatcher.matches(p.getFileName())).toList();
        }
    }

    /**
     * Lists the file names (not paths) of regular files carrying the given extension, e.g. {@code ".cxd"}.
     */
    public static List<String> listFileNames(final Path sourceDir, final String extension) throws IOException {
        return listFiles(sourceDir, "glob:*" + extension).stream()
                .map(p -> p.getFileName().toString())
                .toList();
    }

    static PathMatcher matcher(final String fileFilter) {
        if (fileFilter == null || fileFilter.isBlank()) {
            return path -> true;
        }
        final String syntaxAndPattern = fileFilter.contains(":") ? fileFilter : "glob:" + fileFilter;
        return FileSystems.getDefault().getPathMatcher(syntaxAndPattern);
    }

    /**
     * File name without its last extension: {@code data00012.cxd -> data00012}.
     */
    public static String stem(final String fileName) {
        final int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    /**
     * Replaces the last extension of a file name, e.g. {@code replaceExtension("a.cxi", ".cxd") -> "a.cxd"}.
     */
    public static String replaceExtension(final String fileName, final String newExtension) {
        return stem(fileName) + newExtension;
    }

    /**
     * Creates the parent directories of a file if they are missing.
     */
    public static void ensureParentExists(final Path file) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
