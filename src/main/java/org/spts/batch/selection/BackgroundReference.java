package org.spts.batch.selection;

import org.spts.batch.model.BatchMode;

import java.util.regex.Pattern;

/**
 * Turns the log book's dark correction value into a background file name. The value is either a file
 * name ({@code data02330.cxd}) or a bare file number ({@code 2330}, or {@code 2330.0} when the sheet
 * stored it as a float).
 */
public final class BackgroundReference {

    private static final Pattern FILE_NUMBER = Pattern.compile("\\d+(\\.0*)?");

    private BackgroundReference() {
    }

    /**
     * @param reference the dark correction value of {@code fileName}'s log entry
     * @param fileName  the candidate the reference belongs to, used in error messages
     * @return the canonical background file name
     * @throws InvalidBackgroundReferenceException if the value is neither a capture file name nor a file number
     */
    public static String toFileName(final String reference, final String fileName) throws InvalidBackgroundReferenceException {
        final String value = reference == null ? "" : reference.trim();
        if (value.endsWith(BatchMode.RAW_EXTENSION) && value.length() > BatchMode.RAW_EXTENSION.length()) {
            return value;
        }
        if (!FILE_NUMBER.matcher(value).matches()) {
            throw new InvalidBackgroundReferenceException(fileName, value);
        }
        final String digits = value.contains(".") ? value.substring(0, value.indexOf('.')) : value;
        return FileNumbers.PREFIX + padDigits(digits) + BatchMode.RAW_EXTENSION;
    }

    private static String padDigits(final String digits) {
        if (digits.length() >= FileNumbers.WIDTH) {
            return digits;
        }
        return "0".repeat(FileNumbers.WIDTH - digits.length()) + digits;
    }
}
