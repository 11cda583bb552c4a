package com.safetyrisk.common.cache;

import com.safetyrisk.common.config.EngineSettings;
import com.safetyrisk.common.model.IndicatorRecord;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collection;
import java.util.HexFormat;

/**
 * Content hash of an indicator table plus the settings it is evaluated under.
 *
 * <p>Records are hashed in input order: duplicate-period rejection keeps the first
 * record it sees, so two tables holding the same records in a different order may
 * legitimately evaluate differently.
 */
public record InputFingerprint(String value) {

    public InputFingerprint {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Fingerprint value is required");
        }
    }

    public static InputFingerprint of(Collection<IndicatorRecord> records, EngineSettings settings) {
        if (records == null || settings == null) {
            throw new IllegalArgumentException("Records and settings are required for a fingerprint");
        }
        MessageDigest digest = sha256();
        for (IndicatorRecord record : records) {
            digest.update(String.valueOf(record).getBytes(StandardCharsets.UTF_8));
            digest.update((byte) '\n');
        }
        digest.update(settings.toString().getBytes(StandardCharsets.UTF_8));
        return new InputFingerprint(HexFormat.of().formatHex(digest.digest()));
    }

    private static MessageDigest sha256() {
        try {
            return MessageDigest.getInstance("SHA-256");
        } catch (NoSuchAlgorithmException e) {
            // every JRE ships SHA-256
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public String toString() {
        return value.substring(0, 12);
    }
}
