package recursum.utils;

public class StringUtils {
    private StringUtils() {}

    public static String getOrDefault(String value, String def) {
        return value != null ? value : def;
    }

    // "\t" and "\0" stand for tab and NUL; anything else is taken literally.
    public static String unescapeSeparator(String value) {
        if ("\\t".equals(value)) return "\t";
        if ("\\0".equals(value)) return "\0";
        return value;
    }
}
