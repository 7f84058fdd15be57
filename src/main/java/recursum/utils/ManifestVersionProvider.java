package recursum.utils;

import picocli.CommandLine.*;

import java.io.*;
import java.util.jar.*;

// Reads the version shown by --version from the jar manifest written at package time.
public class ManifestVersionProvider implements IVersionProvider {
    static final String MANIFEST_PATH = "/META-INF/MANIFEST.MF";

    @Override
    public String[] getVersion() throws Exception {
        try (InputStream is = getClass().getResourceAsStream(MANIFEST_PATH)) {
            if (is == null) {
                return new String[] { "Version information not available" };
            }
            return describe(new Manifest(is));
        }
    }

    static String[] describe(Manifest manifest) {
        var attrs = manifest.getMainAttributes();
        String title = StringUtils.getOrDefault(attrs.getValue("Implementation-Title"), "recursum");
        String version = StringUtils.getOrDefault(attrs.getValue("Implementation-Version"), "unknown-version");
        String artifact = StringUtils.getOrDefault(attrs.getValue("Implementation-Vendor-Id"), "unknown-artifact");
        String timestamp = StringUtils.getOrDefault(attrs.getValue("Build-Timestamp"), "unknown-timestamp");

        return new String[] {
                String.format("%s (%s) version %s", title, artifact, version),
                String.format("Built on: %s", timestamp),
        };
    }

}
