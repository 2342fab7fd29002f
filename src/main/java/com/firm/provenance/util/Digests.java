package com.firm.provenance.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 helpers for node fingerprints and tree seals. */
public final class Digests {
    private Digests() {
        // Utility class
    }

    public static String sha256Hex(String content) {
        return HexFormat.of().formatHex(newSha256().digest(content.getBytes(StandardCharsets.UTF_8)));
    }

    public static MessageDigest newSha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
