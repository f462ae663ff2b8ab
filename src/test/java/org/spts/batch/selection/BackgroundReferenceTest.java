package org.spts.batch.selection;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BackgroundReferenceTest {

    @Test
    void testToFileName_fileNumber() throws Exception {
        assertEquals("data02330.cxd", BackgroundReference.toFileName("2330", "data02331.cxd"));
        assertEquals("data00002.cxd", BackgroundReference.toFileName("00002", "data00001.cxd"));
    }

    @Test
    void testToFileName_floatFormattedNumber() throws Exception {
        assertEquals("data02330.cxd", BackgroundReference.toFileName("2330.0", "data02331.cxd"));
    }

    @Test
    void testToFileName_fileNameKept() throws Exception {
        assertEquals("data02330.cxd", BackgroundReference.toFileName("data02330.cxd", "data02331.cxd"));
        assertEquals("dark_run3.cxd", BackgroundReference.toFileName(" dark_run3.cxd ", "data02331.cxd"));
    }

    @Test
    void testToFileName_invalid() {
        InvalidBackgroundReferenceException e = assertThrows(InvalidBackgroundReferenceException.class,
                () -> BackgroundReference.toFileName("see notes", "data02331.cxd"));
        assertEquals("data02331.cxd", e.getFileName());
        assertThrows(InvalidBackgroundReferenceException.class, () -> BackgroundReference.toFileName("", "data02331.cxd"));
        assertThrows(InvalidBackgroundReferenceException.class, () -> BackgroundReference.toFileName("2330.5", "data02331.cxd"));
        assertThrows(InvalidBackgroundReferenceException.class, () -> BackgroundReference.toFileName(null, "data02331.cxd"));
    }
}
