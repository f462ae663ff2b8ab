package org.spts.batch.selection;

import java.util.OptionalInt;

/**
 * The file number is the 5 digit token following the {@code data} prefix, e.g. {@code data00012.cxd -> 12}.
 * Its position is fixed by the acquisition software, so it is read by offset.
 */
public final class FileNumbers {

    public static final String PREFIX = "data";
    public static final int OFFSET = PREFIX.length();
    public static final int WIDTH = 5;

    private FileNumbers() {
    }

    public static OptionalInt parse(final String fileName) {
        if (fileName == null || fileName.length() < OFFSET + WIDTH) {
            return OptionalInt.empty();
        }
        final String token = fileName.substring(OFFSET, OFFSET + WIDTH);
        for (int i = 0; i < token.length(); i++) {
            if (!Character.isDigit(token.charAt(i))) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.of(Integer.parseInt(token));
    }

    /**
     * Zero-pads a file number to {@value #WIDTH} digits; longer numbers are kept as they are.
     */
    public static String pad(final long number) {
        return String.format("%0" + WIDTH + "d", number);
    }

    /**
     * Inclusive range check; a null bound is open.
     */
    public static boolean inRange(final int number, final Integer start, final Integer end) {
        return (start == null || number >= start) && (end == null || number <= end);
    }
}
