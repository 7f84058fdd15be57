package recursum.utils;

import java.util.*;

public class SizeUtils {
    private SizeUtils() {}

    /**
     * Converts a size in bytes to a human-readable string, using 1024 as the unit base.
     * Examples:  512     → "512 B"
     *            2048    → "2.00 KiB"
     *            5_242_880 → "5.00 MiB"
     */
    public static String humanReadable(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        int unit = 1024;
        String[] units = { "KiB", "MiB", "GiB", "TiB", "PiB", "EiB" };
        int exp = (int) (Math.log(bytes) / Math.log(unit));
        String prefix = units[exp - 1];
        double value = bytes / Math.pow(unit, exp);
        return String.format(Locale.ROOT, "%.2f %s", value, prefix);
    }

    public static String formatHMS(long ms) {
        long s = ms / 1000;
        return String.format("%d:%02d:%02d", s / 3600, (s % 3600) / 60, s % 60);
    }
}
