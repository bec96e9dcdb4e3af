package com.contract.resolution.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class DocumentOverrideTest {

    private static CanonicalClauseId id(String value) {
        return CanonicalClauseId.of(value);
    }

    private static DocumentOverride.Builder edge(OverrideType type) {
        return DocumentOverride.builder()
                .overridingDocumentId("pc")
                .overriddenDocumentId("gc")
                .overrideType(type);
    }

    @Nested
    @DisplayName("covers")
    class CoversTests {

        @Test
        @DisplayName("FULL should cover every clause")
        void testFull() {
            DocumentOverride full = edge(OverrideType.FULL).affectedClauses(id("1")).build();
            assertTrue(full.covers(id("99.9")));
            assertTrue(full.coversEverything());
        }

        @Test
        @DisplayName("PARTIAL with no clauses should cover every clause")
        void testPartialWithoutClauses() {
            DocumentOverride partial = edge(OverrideType.PARTIAL).build();
            assertTrue(partial.covers(id("3.2")));
            assertTrue(partial.coversEverything());
        }

        @Test
        @DisplayName("PARTIAL should cover listed clauses and their descendants")
        void testPartialDescendants() {
            DocumentOverride partial = edge(OverrideType.PARTIAL).affectedClauses(id("14")).build();
            assertTrue(partial.covers(id("14")));
            assertTrue(partial.covers(id("14.1")));
            assertTrue(partial.covers(id("14.1.2")));
            assertFalse(partial.covers(id("140")));
            assertFalse(partial.covers(id("1")));
            assertFalse(partial.coversEverything());
        }

        @Test
        @DisplayName("CLAUSE_SPECIFIC should cover exactly the listed clauses")
        void testClauseSpecific() {
            DocumentOverride specific = edge(OverrideType.CLAUSE_SPECIFIC).affectedClauses(id("14.1")).build();
            assertTrue(specific.covers(id("14.1")));
            assertFalse(specific.covers(id("14.1.1")));
            assertFalse(specific.covers(id("14")));
        }
    }

    @Test
    @DisplayName("Overrides on disjoint clauses should not overlap")
    void testOverlaps() {
        DocumentOverride a = edge(OverrideType.CLAUSE_SPECIFIC).affectedClauses(id("1")).build();
        DocumentOverride b = edge(OverrideType.CLAUSE_SPECIFIC).affectedClauses(id("2")).build();
        DocumentOverride parent = edge(OverrideType.PARTIAL).affectedClauses(id("2")).build();
        DocumentOverride child = edge(OverrideType.CLAUSE_SPECIFIC).affectedClauses(id("2.3")).build();

        assertFalse(a.overlaps(b));
        assertTrue(parent.overlaps(child));
        assertTrue(child.overlaps(parent));
        assertTrue(a.overlaps(edge(OverrideType.FULL).build()));
    }

    @Test
    @DisplayName("Should default scope, reason and origin")
    void testDefaults() {
        DocumentOverride override = edge(OverrideType.FULL).build();
        assertNotNull(override.id());
        assertEquals("", override.scope());
        assertEquals(OverrideOrigin.DECLARED, override.origin());
        assertTrue(override.affectedClauses().isEmpty());
        assertTrue(override.connects("pc", "gc"));
        assertFalse(override.connects("gc", "pc"));
        assertEquals("pc->gc|", override.edgeKey());
    }

    @Test
    @DisplayName("Should require both documents")
    void testRequiredFields() {
        assertThrows(NullPointerException.class,
                () -> DocumentOverride.builder().overridingDocumentId("a").build());
    }
}
