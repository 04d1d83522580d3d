package com.whereq.helios.cache;

import com.whereq.helios.model.CacheLevel;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Key layout of cache entries in the shared state store: {@code cache:<tier>:<taskType>:<hash>}
 */
final class CacheKeys {

    private static final String ROOT = "cache:";

    private CacheKeys() {
    }

    static String tierPrefix(CacheLevel level) {
        return ROOT + level.getKeySegment() + ":";
    }

    static String taskTypePrefix(CacheLevel level, String taskType) {
        return tierPrefix(level) + URLEncoder.encode(taskType, StandardCharsets.UTF_8) + ":";
    }

    static String key(CacheLevel level, String taskType, String hash) {
        return taskTypePrefix(level, taskType) + hash;
    }

    /**
     * Trim and collapse whitespace so formatting differences do not defeat exact matching
     */
    static String normalize(String text) {
        return text == null ? "" : text.trim().replaceAll("\\s+", " ");
    }

    static String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(text.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
