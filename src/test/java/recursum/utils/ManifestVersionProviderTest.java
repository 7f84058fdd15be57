package recursum.utils;

import org.junit.jupiter.api.Test;

import java.util.jar.Attributes;
import java.util.jar.Manifest;

import static org.junit.jupiter.api.Assertions.*;

public class ManifestVersionProviderTest {

    @Test
    void describe_readsImplementationEntries() {
        Manifest manifest = new Manifest();
        Attributes attrs = manifest.getMainAttributes();
        attrs.put(Attributes.Name.MANIFEST_VERSION, "1.0");
        attrs.putValue("Implementation-Title", "recursum");
        attrs.putValue("Implementation-Version", "1.2.3");
        attrs.putValue("Implementation-Vendor-Id", "recursum:recursum");

        String[] lines = ManifestVersionProvider.describe(manifest);

        assertEquals("recursum (recursum:recursum) version 1.2.3", lines[0]);
        assertEquals("Built on: unknown-timestamp", lines[1]);
    }
}
