package com.ryuqq.catalogsync.core.fingerprint;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SyncFingerprint Value Object 테스트.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
class SyncFingerprintTest {

    @Test
    void of_ValidHex_CreatesFingerprint() {
        SyncFingerprint fingerprint = SyncFingerprint.of("0123456789abcdef".repeat(4));

        assertEquals("0123456789abcdef".repeat(4), fingerprint.getValue());
        assertEquals(SyncFingerprint.of("0123456789abcdef".repeat(4)), fingerprint);
    }

    @Test
    void of_UpperCaseHex_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> SyncFingerprint.of("A".repeat(64)));
    }

    @Test
    void of_WrongLength_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> SyncFingerprint.of("a".repeat(63)));
        assertThrows(IllegalArgumentException.class, () -> SyncFingerprint.of(null));
    }

    @Test
    void toString_IsAbbreviated() {
        assertEquals("SyncFingerprint{aaaaaaaaaaaa..}", SyncFingerprint.of("a".repeat(64)).toString());
    }
}
