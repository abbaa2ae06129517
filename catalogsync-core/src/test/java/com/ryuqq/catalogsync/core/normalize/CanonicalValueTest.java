package com.ryuqq.catalogsync.core.normalize;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

/**
 * CanonicalValue 테스트.
 *
 * @author Catalog Sync Team
 * @since 1.0.0
 */
class CanonicalValueTest {

    @Test
    void equality_UsesDisplayOnly() {
        CanonicalValue a = CanonicalValue.numeric("6.0", new BigDecimal("6"));
        CanonicalValue b = CanonicalValue.numeric("6.0", new BigDecimal("6.00"));

        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());
        assertEquals(0, a.compareTo(b));
    }

    @Test
    void compareTo_SameRank_FallsBackToDisplay() {
        CanonicalValue apple = CanonicalValue.text("Apple");
        CanonicalValue banana = CanonicalValue.text("Banana");

        assertTrue(apple.compareTo(banana) < 0);
        assertTrue(banana.compareTo(apple) > 0);
    }

    @Test
    void compareTo_LowerTierFirst() {
        CanonicalValue numeric = CanonicalValue.numeric("99.0", new BigDecimal("99"));
        CanonicalValue nonNumeric = CanonicalValue.nonNumeric("Adjustable");

        assertTrue(numeric.compareTo(nonNumeric) < 0);
    }

    @Test
    void constructor_BlankDisplay_ThrowsException() {
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> CanonicalValue.text(" ")
        );
        assertTrue(exception.getMessage().contains("display cannot be null"));
    }

    @Test
    void toString_ReturnsDisplay() {
        assertEquals("14K White Gold", CanonicalValue.ranked("14K White Gold", 0, 14, 0).toString());
    }
}
