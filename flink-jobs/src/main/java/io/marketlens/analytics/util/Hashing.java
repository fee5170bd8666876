package io.marketlens.analytics.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Content hashing used for normalized identifiers and surrogate keys.
 *
 * <p>MD5 is fixed for identifier and key generation; stored rows carry MD5 keys.</p>
 */
public final class Hashing {
    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private Hashing() {}

    public static String md5Hex(String value) {
        return hex(digest("MD5", value));
    }

    /**
     * Hashes the pipe-joined parts, mapping null parts to the empty string.
     */
    public static String md5OfParts(String... parts) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < parts.length; i++) {
            if (i > 0) {
                sb.append('|');
            }
            if (parts[i] != null) {
                sb.append(parts[i]);
            }
        }
        return md5Hex(sb.toString());
    }

    private static byte[] digest(String algorithm, String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance(algorithm);
            return digest.digest((value == null ? "" : value).getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException(algorithm + " not available", ex);
        }
    }

    private static String hex(byte[] bytes) {
        char[] out = new char[bytes.length * 2];
        for (int i = 0; i < bytes.length; i++) {
            int v = bytes[i] & 0xFF;
            out[i * 2] = HEX[v >>> 4];
            out[i * 2 + 1] = HEX[v & 0x0F];
        }
        return new String(out);
    }
}
