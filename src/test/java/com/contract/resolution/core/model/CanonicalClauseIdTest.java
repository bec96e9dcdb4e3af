package com.contract.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CanonicalClauseIdTest {

    @ParameterizedTest
    @DisplayName("Should reject non-canonical text")
    @ValueSource(strings = {"6a", "6 A", "1.6(b)", "[3]", "14.1 "})
    void testRejectsNonCanonical(String value) {
        assertThrows(IllegalArgumentException.class, () -> CanonicalClauseId.of(value));
    }

    @Test
    @DisplayName("Empty value should be the shared empty ID")
    void testEmpty() {
        assertSame(CanonicalClauseId.EMPTY, CanonicalClauseId.of(""));
        assertTrue(CanonicalClauseId.EMPTY.segments().isEmpty());
    }

    @Test
    @DisplayName("Should expose segments, parent and anchor")
    void testHierarchy() {
        CanonicalClauseId id = CanonicalClauseId.of("14.1.2");

        assertEquals(List.of("14", "1", "2"), id.segments());
        assertEquals(Optional.of(CanonicalClauseId.of("14.1")), id.parent());
        assertEquals(Optional.empty(), CanonicalClauseId.of("14").parent());
        assertEquals("clause-14.1.2", id.anchor());
    }

    @Test
    @DisplayName("Descendant check should respect segment boundaries")
    void testDescendant() {
        CanonicalClauseId fourteen = CanonicalClauseId.of("14");

        assertTrue(CanonicalClauseId.of("14.1").isSameOrDescendantOf(fourteen));
        assertTrue(fourteen.isSameOrDescendantOf(fourteen));
        assertFalse(CanonicalClauseId.of("140").isSameOrDescendantOf(fourteen));
        assertFalse(fourteen.isSameOrDescendantOf(CanonicalClauseId.EMPTY));
    }

    @Test
    @DisplayName("Equality should be by value")
    void testEquality() {
        assertEquals(CanonicalClauseId.of("6A.2B"), CanonicalClauseId.of("6A.2B"));
        assertEquals(CanonicalClauseId.of("6A.2B").hashCode(), CanonicalClauseId.of("6A.2B").hashCode());
        assertNotEquals(CanonicalClauseId.of("6A.2"), CanonicalClauseId.of("6A.2B"));
    }
}
