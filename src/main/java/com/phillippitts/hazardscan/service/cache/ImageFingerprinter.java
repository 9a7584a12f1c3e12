package com.phillippitts.hazardscan.service.cache;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Deterministic content fingerprint: SHA-256 over the resize policy, the dimensions and the
 * image bytes. Identical pixels under the same policy always produce the same fingerprint.
 */
public class ImageFingerprinter {

    private final String resizePolicy;

    public ImageFingerprinter(String resizePolicy) {
        this.resizePolicy = Objects.requireNonNull(resizePolicy, "resizePolicy");
    }

    public String fingerprint(byte[] image, int width, int height) {
        Objects.requireNonNull(image, "image");
        MessageDigest digest;
        try {
            digest = MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
        digest.update(resizePolicy.getBytes(StandardCharsets.UTF_8));
        digest.update(ByteBuffer.allocate(8).putInt(width).putInt(height).array());
        digest.update(image);
        return HexFormat.of().formatHex(digest.digest());
    }

    public String resizePolicy() {
        return resizePolicy;
    }
}
