package com.ryuqq.catalogsync.core.fingerprint;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * 정규 JSON의 SHA-256 해시 (소문자 16진수 64자).
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class SyncFingerprint {

    private static final Pattern HEX_SHA256 = Pattern.compile("^[0-9a-f]{64}$");

    private final String value;

    private SyncFingerprint(String value) {
        if (value == null || !HEX_SHA256.matcher(value).matches()) {
            throw new IllegalArgumentException("Fingerprint must be 64 lowercase hex characters: " + value);
        }
        this.value = value;
    }

    public static SyncFingerprint of(String value) {
        return new SyncFingerprint(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyncFingerprint that = (SyncFingerprint) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value);
    }

    @Override
    public String toString() {
        return "SyncFingerprint{" + value.substring(0, 12) + "..}";
    }
}
