package com.ryuqq.bilevel.core.key;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * GroupEntry / BilevelEntry 테스트.
 *
 * @author Bilevel Team
 * @since 1.0.0
 */
class EntryTest {

    @Test
    void groupEntry_NullPayload_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new GroupEntry<>(1, null));
        assertThrows(IllegalArgumentException.class, () -> new GroupEntry<>(null, "x"));
    }

    @Test
    void bilevelEntry_FullKey_CombinesKeys() {
        // Given
        BilevelEntry<String, Integer, String> entry = new BilevelEntry<>("A", 1, "x");

        // Then
        assertEquals(FullKey.of("A", 1), entry.fullKey());
        assertEquals("x", entry.payload());
    }

    @Test
    void bilevelEntry_NullComponent_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new BilevelEntry<>(null, 1, "x"));
        assertThrows(IllegalArgumentException.class, () -> new BilevelEntry<>("A", null, "x"));
        assertThrows(IllegalArgumentException.class, () -> new BilevelEntry<>("A", 1, null));
    }
}
