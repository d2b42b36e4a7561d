package com.example.pawluxe_export.util;

import com.example.pawluxe_export.dto.RenderParams;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Derives the dedupe key of a render request from the fields that define its output: camera,
 * window and clip kind.
 */
public final class DedupeKeys {
    private static final int MAX_LENGTH = 255;

    private DedupeKeys() {}

    public static String derive(RenderParams params) {
        String key = params.cameraId().trim()
                + "|" + params.windowStart()
                + "|" + params.windowEnd()
                + "|" + params.kind().name().toLowerCase(Locale.ROOT);
        if (key.length() <= MAX_LENGTH) {
            return key;
        }
        return "sha256:" + sha256(key);
    }

    private static String sha256(String value) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(value.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
