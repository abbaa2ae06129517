package com.ryuqq.catalogsync.core.fingerprint;

import com.ryuqq.catalogsync.core.catalog.CatalogEntity;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 엔티티 지문 계산. 같은 엔티티는 항상 같은 지문을 가집니다.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
public final class FingerprintCalculator {

    private final CanonicalForm canonicalForm;

    public FingerprintCalculator(CanonicalForm canonicalForm) {
        if (canonicalForm == null) {
            throw new IllegalArgumentException("canonicalForm cannot be null");
        }
        this.canonicalForm = canonicalForm;
    }

    public SyncFingerprint fingerprint(CatalogEntity entity) {
        String json = canonicalForm.toJson(entity);
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(json.getBytes(StandardCharsets.UTF_8));
            return SyncFingerprint.of(HexFormat.of().formatHex(hash));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
