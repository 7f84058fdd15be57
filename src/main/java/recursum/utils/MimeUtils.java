package recursum.utils;

import org.apache.tika.*;
import org.slf4j.*;

import java.io.*;
import java.nio.file.*;
import java.util.*;

public class MimeUtils {

    private static final Logger log = LoggerFactory.getLogger(MimeUtils.class);
    private static final String FALLBACK_TYPE = "application/octet-stream";

    private final Tika tika = new Tika();

    // extract the major mime type from a mime string
    public static String getMajorType(String mimeType) {
        if (mimeType == null || mimeType.isBlank()) return "";
        int slash = mimeType.indexOf('/');
        return slash > 0 ? mimeType.substring(0, slash) : mimeType;
    }

    public String detect(Path file) {
        try {
            String full = tika.detect(file);
            return full != null ? full.split(";")[0].trim() : FALLBACK_TYPE;
        } catch (IOException e) {
            log.warn("Unable to detect MIME type for {}: {}", file, e.getMessage());
            return FALLBACK_TYPE;
        }
    }

    // An empty filter accepts everything.
    public boolean accepts(Path file, Set<String> majorTypes) {
        if (majorTypes.isEmpty()) return true;
        return majorTypes.contains(getMajorType(detect(file)).toLowerCase(Locale.ROOT));
    }

}
