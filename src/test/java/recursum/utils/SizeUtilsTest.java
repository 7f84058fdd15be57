package recursum.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SizeUtilsTest {

    @Test
    void humanReadable_switchesUnitsAbove1024() {
        assertEquals("0 B", SizeUtils.humanReadable(0));
        assertEquals("512 B", SizeUtils.humanReadable(512));
        assertEquals("2.00 KiB", SizeUtils.humanReadable(2048));
        assertEquals("5.00 MiB", SizeUtils.humanReadable(5_242_880));
    }

    @Test
    void formatHMS_rollsOverMinutesAndHours() {
        assertEquals("0:00:00", SizeUtils.formatHMS(999));
        assertEquals("0:01:05", SizeUtils.formatHMS(65_000));
        assertEquals("2:00:01", SizeUtils.formatHMS(7_201_000));
    }
}
