package recursum.utils;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class StringUtilsTest {

    @Test
    void unescapeSeparator_translatesTabAndNulOnly() {
        assertEquals("\t", StringUtils.unescapeSeparator("\\t"));
        assertEquals("\0", StringUtils.unescapeSeparator("\\0"));
        assertEquals(",\\t", StringUtils.unescapeSeparator(",\\t"));
        assertEquals(" | ", StringUtils.unescapeSeparator(" | "));
        assertNull(StringUtils.unescapeSeparator(null));
    }

    @Test
    void getOrDefault_fallsBackOnNull() {
        assertEquals("x", StringUtils.getOrDefault(null, "x"));
        assertEquals("y", StringUtils.getOrDefault("y", "x"));
    }
}
