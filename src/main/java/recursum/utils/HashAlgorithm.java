package recursum.utils;

import java.security.*;
import java.util.*;

public enum HashAlgorithm {
    MD5("MD5"),
    SHA1("SHA-1"),
    SHA256("SHA-256"),
    SHA512("SHA-512");

    private final ThreadLocal<MessageDigest> threadDigest;

    HashAlgorithm(String jcaName) {
        this.threadDigest = ThreadLocal.withInitial(() -> {
            try {
                return MessageDigest.getInstance(jcaName);
            } catch (NoSuchAlgorithmException e) {
                throw new IllegalStateException(jcaName + " not available", e);
            }
        });
    }

    // One instance per thread, reset before use.
    MessageDigest digest() {
        MessageDigest md = threadDigest.get();
        md.reset();
        return md;
    }

    // Accepts "sha256", "SHA-256", "Sha256"...
    public static HashAlgorithm parse(String value) {
        String normalized = value.trim().toUpperCase(Locale.ROOT).replace("-", "");
        for (HashAlgorithm algorithm : values()) {
            if (algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown hash algorithm: " + value
                + " (expected one of md5, sha1, sha256, sha512)");
    }
}
