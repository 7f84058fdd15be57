package recursum.utils;

import recursum.models.*;

import java.io.*;
import java.nio.file.*;
import java.security.*;

public final class DigestUtils {

    private static final int BUFFER_SIZE = 16 * 1024; // 16 KB
    private static final char[] HEX_DIGITS = "0123456789abcdef".toCharArray();

    private DigestUtils() {}

    public static FileDigest hash(Path file, HashAlgorithm algorithm) throws IOException {
        try (InputStream in = Files.newInputStream(file)) {
            return hash(in, algorithm);
        }
    }

    public static FileDigest hash(InputStream in, HashAlgorithm algorithm) throws IOException {
        MessageDigest md = algorithm.digest();
        byte[] buffer = new byte[BUFFER_SIZE];
        long size = 0;
        int bytesRead;
        while ((bytesRead = in.read(buffer)) != -1) {
            md.update(buffer, 0, bytesRead);
            size += bytesRead;
        }
        return new FileDigest(toHex(md.digest()), size);
    }

    /**
     * Cuts a hex digest down to {@code maxLength} characters. A null limit, or one longer than
     * the digest, returns the digest unchanged.
     */
    public static String truncate(String hex, Integer maxLength) {
        if (maxLength == null || hex.length() <= maxLength) {
            return hex;
        }
        return hex.substring(0, maxLength);
    }

    static String toHex(byte[] bytes) {
        char[] chars = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int b = bytes[i] & 0xFF;
            chars[i * 2]     = HEX_DIGITS[b >>> 4];
            chars[i * 2 + 1] = HEX_DIGITS[b & 0x0F];
        }
        return new String(chars);
    }

}
