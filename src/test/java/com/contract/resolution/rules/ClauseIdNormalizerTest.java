package com.contract.resolution.rules;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ClauseIdVariantSet;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ClauseIdNormalizerTest {

    private ClauseIdNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new ClauseIdNormalizer();
    }

    @Nested
    @DisplayName("normalize")
    class NormalizeTests {

        @Test
        @DisplayName("Should collapse spaces and brackets of a sub-item")
        void testSubItemWithSpaces() {
            assertEquals("6A.2B", normalizer.normalize("6 A.2 (b)").value());
        }

        @ParameterizedTest
        @DisplayName("Should canonicalize raw clause numbers")
        @CsvSource({
                "14.1,14.1",
                "' 14.1 ',14.1",
                "1.6(b),1.6B",
                "[3],3",
                "6a,6A",
                "Clause 14.1,14.1",
                "Sub-Clause 4.2,4.2",
                "subclause 4.2,4.2",
                "clause clause 7,7"
        })
        void testCanonicalForms(String raw, String expected) {
            assertEquals(expected, normalizer.normalize(raw).value());
        }

        @Test
        @DisplayName("Should map null and blank input to the empty ID")
        void testNullAndBlank() {
            assertSame(CanonicalClauseId.EMPTY, normalizer.normalize(null));
            assertSame(CanonicalClauseId.EMPTY, normalizer.normalize(""));
            assertSame(CanonicalClauseId.EMPTY, normalizer.normalize(" \t "));
        }

        @ParameterizedTest
        @DisplayName("Normalizing a canonical ID again should not change it")
        @ValueSource(strings = {"6 A.2 (b)", "Clause 14.1", "sub-clause 3 (a)", "1.6(b)", "[2].1", "Clause Clause 9", "10.2a"})
        void testIdempotent(String raw) {
            CanonicalClauseId once = normalizer.normalize(raw);
            assertEquals(once, normalizer.normalize(once.value()));
        }

        @Test
        @DisplayName("Should expose the rules in application order")
        void testRuleNames() {
            assertEquals(List.of("remove-whitespace", "remove-brackets", "strip-clause-keyword"),
                    normalizer.ruleNames());
        }
    }

    @Nested
    @DisplayName("variants")
    class VariantTests {

        @Test
        @DisplayName("Letter-suffixed IDs should yield numeric, dotted and case variants")
        void testLetterSuffixVariants() {
            ClauseIdVariantSet variants = normalizer.variants("6A");

            assertEquals("6A", variants.canonical().value());
            assertEquals(Set.of("6a", "6", "6.A"), variants.alternates());
            assertTrue(variants.contains("6A"));
            assertTrue(variants.contains("6.A"));
            assertFalse(variants.contains("7"));
        }

        @Test
        @DisplayName("Only the last segment should lose its letters in the numeric variant")
        void testNumericOnlyKeepsLeadingSegments() {
            ClauseIdVariantSet variants = normalizer.variants("6 A.2 (b)");

            assertEquals(Set.of("6a.2b", "6A.2"), variants.alternates());
        }

        @Test
        @DisplayName("Purely numeric IDs should have no alternates")
        void testNumericIdHasNoAlternates() {
            assertTrue(normalizer.variants("14.1").alternates().isEmpty());
        }

        @Test
        @DisplayName("The canonical spelling should come first in all()")
        void testCanonicalFirst() {
            assertEquals("6A", normalizer.variants("6a").all().iterator().next());
        }

        @Test
        @DisplayName("Blank input should yield the empty variant set")
        void testEmptyVariants() {
            assertTrue(normalizer.variants("  ").isEmpty());
            assertTrue(normalizer.variants((String) null).all().isEmpty());
        }
    }

    @Nested
    @DisplayName("isWellFormed")
    class WellFormedTests {

        @ParameterizedTest
        @ValueSource(strings = {"14", "14.1", "6A.2", "6A.2 (b)", "1.6(b)", "20.1.3"})
        void testWellFormed(String raw) {
            assertTrue(normalizer.isWellFormed(raw));
        }

        @ParameterizedTest
        @ValueSource(strings = {"abc", "14..1", "6 A.2", "(b)", "1.", "Clause 4"})
        void testMalformed(String raw) {
            assertFalse(normalizer.isWellFormed(raw));
        }

        @Test
        void testNull() {
            assertFalse(normalizer.isWellFormed(null));
        }
    }
}
