package org.spts.batch.logbook;

/**
 * Rewrites the misspelled capture extension found in hand-written log books to the canonical one.
 */
public final class ExtensionNormalizer {

    public static final String MISSPELLED_EXTENSION = ".cdx";
    public static final String CANONICAL_EXTENSION = ".cxd";

    private ExtensionNormalizer() {
    }

    /**
     * Returns {@code value} with a trailing {@value #MISSPELLED_EXTENSION} replaced by
     * {@value #CANONICAL_EXTENSION}. Null and other values are returned unchanged.
     */
    public static String normalize(final String value) {
        if (value != null && value.endsWith(MISSPELLED_EXTENSION)) {
            return value.substring(0, value.length() - MISSPELLED_EXTENSION.length()) + CANONICAL_EXTENSION;
        }
        return value;
    }
}
