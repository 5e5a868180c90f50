package com.github.dimitryivaniuta.querycache.cache.key;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Lowercase hex SHA-256 of the UTF-8 key. No salt: the same key must hash the same
 * on every node so a hash taken from a response header can be used for invalidation.
 */
public class Sha256CacheKeyHasher implements CacheKeyHasher {

    private static final String ALGORITHM = "SHA-256";

    @Override
    public String hash(String logicalKey) {
        if (logicalKey == null || logicalKey.isBlank()) {
            return "";
        }
        try {
            MessageDigest md = MessageDigest.getInstance(ALGORITHM);
            return toHex(md.digest(logicalKey.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("Unable to hash cache key", e);
        }
    }

    private static String toHex(byte[] b) {
        StringBuilder sb = new StringBuilder(b.length * 2);
        for (byte x : b) sb.append(String.format("%02x", x));
        return sb.toString();
    }
}
