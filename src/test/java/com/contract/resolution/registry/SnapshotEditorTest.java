package com.contract.resolution.registry;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ClauseReference;
import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentChunk;
import com.contract.resolution.core.model.DocumentGroup;
import com.contract.resolution.core.model.DocumentOverride;
import com.contract.resolution.core.model.OverrideType;
import com.contract.resolution.core.model.ReferenceType;
import com.contract.resolution.validation.ErrorCode;
import com.contract.resolution.validation.Severity;
import com.contract.resolution.validation.ValidationIssue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.contract.resolution.ContractFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("SnapshotEditor Tests")
class SnapshotEditorTest {

    private SnapshotEditor editor;
    private ContractSnapshot base;

    @BeforeEach
    void setUp() {
        editor = new SnapshotEditor();
        base = contract()
                .with(document("gc", DocumentGroup.C, 1, "General Conditions"))
                .with(document("pc", DocumentGroup.C, 2, "Particular Conditions"))
                .with(document("d1", DocumentGroup.D, 1))
                .with(document("d2", DocumentGroup.D, 2))
                .with(document("d3", DocumentGroup.D, 3))
                .with(chunk("gc-14.1", "gc", "14.1"))
                .with(chunk("d1-14.1", "d1", "14.1"))
                .snapshot();
    }

    private static ErrorCode blockingCode(RegistryResult result) {
        assertTrue(result.isRejected(), "expected a rejection");
        return result.blockingIssue().map(ValidationIssue::code).orElseThrow();
    }

    @Nested
    @DisplayName("addDocument")
    class AddDocumentTests {

        @Test
        @DisplayName("Should reject a duplicate document id")
        void testDuplicateId() {
            RegistryResult result = editor.addDocument(base, document("gc", DocumentGroup.A, 1));

            assertEquals(ErrorCode.DUPLICATE_DOCUMENT, blockingCode(result));
            assertSame(base, result.snapshot());
        }

        @Test
        @DisplayName("Should reject an occupied group and sequence slot")
        void testOccupiedSlot() {
            RegistryResult result = editor.addDocument(base, document("other", DocumentGroup.D, 2));

            assertEquals(ErrorCode.DUPLICATE_DOCUMENT, blockingCode(result));
            assertEquals(List.of("d2"), result.blockingIssue().orElseThrow().relatedIds());
        }

        @Test
        @DisplayName("Should accept with naming warnings and bump the version")
        void testNamingWarnings() {
            Document misfiled = Document.builder()
                    .id("d4").contractId(CONTRACT).group(DocumentGroup.D).sequence(4)
                    .name("Appendix 3 Rates").originalFilename("N3_rates.pdf").build();

            RegistryResult result = editor.addDocument(base, misfiled);

            assertTrue(result.isAccepted());
            assertEquals(base.getVersion() + 1, result.snapshot().getVersion());
            assertEquals(2, result.warnings().size());
            assertTrue(result.warnings().stream().allMatch(w -> w.code() == ErrorCode.NAMING_CONVENTION_VIOLATION));
        }

        @Test
        @DisplayName("Should refuse a document of another contract")
        void testContractMismatch() {
            Document foreign = Document.builder().contractId("other").group(DocumentGroup.A).sequence(1).build();
            assertThrows(IllegalArgumentException.class, () -> editor.addDocument(base, foreign));
        }
    }

    @Nested
    @DisplayName("addChunk")
    class AddChunkTests {

        @Test
        @DisplayName("Should derive the canonical clause ID")
        void testCanonicalDerivation() {
            RegistryResult result = editor.addChunk(base, chunk("pc-6", "pc", "6 A.2 (b)"));

            assertTrue(result.isAccepted());
            DocumentChunk stored = result.snapshot().findChunk("pc-6").orElseThrow();
            assertEquals("6A.2B", stored.getCanonicalId().value());
            assertTrue(result.warnings().isEmpty());
        }

        @Test
        @DisplayName("Should reject a chunk of an unknown document")
        void testUnknownDocument() {
            assertEquals(ErrorCode.UNRESOLVED_REFERENCE, blockingCode(editor.addChunk(base, chunk("x", "nope", "1"))));
        }

        @Test
        @DisplayName("Should reject a duplicate chunk id")
        void testDuplicateChunkId() {
            assertEquals(ErrorCode.DUPLICATE_CHUNK, blockingCode(editor.addChunk(base, chunk("gc-14.1", "gc", "2"))));
        }

        @Test
        @DisplayName("Should reject identical content for the same clause in the same document")
        void testIdenticalContent() {
            DocumentChunk copy = chunk("gc-14.1-copy", "gc", "Clause 14.1", "Text of clause 14.1 in gc");
            assertEquals(ErrorCode.DUPLICATE_CHUNK, blockingCode(editor.addChunk(base, copy)));
        }

        @Test
        @DisplayName("Should warn about low confidence, malformed numbers and duplicate clauses")
        void testWarnings() {
            DocumentChunk shaky = DocumentChunk.builder()
                    .id("gc-14.1-b").documentId("gc").contractId(CONTRACT)
                    .clauseNumber("14.1 ").content("Different wording").confidence(0.5).build();
            DocumentChunk malformed = chunk("gc-odd", "gc", "Clause 4");

            RegistryResult first = editor.addChunk(base, shaky);
            RegistryResult second = editor.addChunk(base, malformed);

            assertTrue(first.isAccepted());
            assertEquals(Set.of(ErrorCode.OCR_CONFIDENCE_LOW, ErrorCode.DUPLICATE_CLAUSE),
                    Set.copyOf(first.warnings().stream().map(ValidationIssue::code).toList()));
            assertTrue(second.isAccepted());
            assertEquals(ErrorCode.INVALID_CLAUSE_NUMBER, second.warnings().get(0).code());
            assertEquals(Severity.WARNING, second.warnings().get(0).severity());
        }

        @Test
        @DisplayName("Re-ingestion should supersede the old chunk without a duplicate warning")
        void testSupersession() {
            DocumentChunk replacement = DocumentChunk.builder()
                    .id("gc-14.1-v2").documentId("gc").contractId(CONTRACT)
                    .clauseNumber("14.1").content("Corrected text").supersedesChunkId("gc-14.1").build();

            RegistryResult result = editor.addChunk(base, replacement);

            assertTrue(result.isAccepted());
            assertTrue(result.warnings().isEmpty());
            assertTrue(result.snapshot().isSuperseded("gc-14.1"));
            assertEquals("gc-14.1-v2", result.snapshot().supersedingChunkOf("gc-14.1").orElseThrow());
            assertFalse(result.snapshot().liveChunks().stream().anyMatch(c -> c.getId().equals("gc-14.1")));
        }

        @Test
        @DisplayName("Should reject superseding a chunk twice or across documents")
        void testInvalidSupersession() {
            DocumentChunk v2 = DocumentChunk.builder().id("v2").documentId("gc").contractId(CONTRACT)
                    .clauseNumber("14.1").content("v2").supersedesChunkId("gc-14.1").build();
            ContractSnapshot next = editor.addChunk(base, v2).snapshot();

            DocumentChunk v3 = DocumentChunk.builder().id("v3").documentId("gc").contractId(CONTRACT)
                    .clauseNumber("14.1").content("v3").supersedesChunkId("gc-14.1").build();
            DocumentChunk crossDocument = DocumentChunk.builder().id("x").documentId("pc").contractId(CONTRACT)
                    .clauseNumber("14.1").content("x").supersedesChunkId("d1-14.1").build();

            assertEquals(ErrorCode.DUPLICATE_CHUNK, blockingCode(editor.addChunk(next, v3)));
            assertEquals(ErrorCode.UNRESOLVED_REFERENCE, blockingCode(editor.addChunk(next, crossDocument)));
        }
    }

    @Nested
    @DisplayName("addOverride")
    class AddOverrideTests {

        @Test
        @DisplayName("A -> B, B -> C, C -> A: the third insertion should fail with ADDENDUM_ORDER")
        void testCycle() {
            RegistryResult ab = editor.addOverride(base, override("ab", "d3", "d2", OverrideType.FULL));
            RegistryResult bc = editor.addOverride(ab.snapshot(), override("bc", "d2", "d1", OverrideType.FULL));
            RegistryResult ca = editor.addOverride(bc.snapshot(), override("ca", "d1", "d3", OverrideType.FULL));

            assertTrue(ab.isAccepted());
            assertTrue(bc.isAccepted());
            assertEquals(ErrorCode.ADDENDUM_ORDER, blockingCode(ca));
            assertEquals(List.of("d3", "d2", "d1"), ca.blockingIssue().orElseThrow().relatedIds());
            assertEquals(2, ca.snapshot().getOverrides().size());
        }

        @Test
        @DisplayName("Edges on disjoint clauses should not form a cycle")
        void testDisjointScopes() {
            RegistryResult first = editor.addOverride(base,
                    override("o1", "d1", "gc", OverrideType.CLAUSE_SPECIFIC, "14.1"));
            RegistryResult second = editor.addOverride(first.snapshot(),
                    override("o2", "gc", "d1", OverrideType.CLAUSE_SPECIFIC, "2.3"));

            assertTrue(second.isAccepted());
        }

        @Test
        @DisplayName("Should reject a self override")
        void testSelfOverride() {
            assertEquals(ErrorCode.ADDENDUM_ORDER,
                    blockingCode(editor.addOverride(base, override("self", "d1", "d1", OverrideType.FULL))));
        }

        @Test
        @DisplayName("Should reject unknown documents and empty clause-specific overrides")
        void testInvalidOverrides() {
            assertEquals(ErrorCode.UNRESOLVED_REFERENCE,
                    blockingCode(editor.addOverride(base, override("o", "d1", "ghost", OverrideType.FULL))));
            assertEquals(ErrorCode.INVALID_CLAUSE_NUMBER,
                    blockingCode(editor.addOverride(base, override("o", "d1", "gc", OverrideType.CLAUSE_SPECIFIC))));
        }

        @Test
        @DisplayName("Should default the scope and accept a repeated edge unchanged")
        void testScopeAndIdempotence() {
            RegistryResult first = editor.addOverride(base, override("o1", "pc", "gc", OverrideType.PARTIAL));
            RegistryResult again = editor.addOverride(first.snapshot(), override("o1", "pc", "gc", OverrideType.PARTIAL));

            DocumentOverride stored = first.snapshot().findOverride("o1").orElseThrow();
            assertEquals("C -> C", stored.scope());
            assertTrue(again.isAccepted());
            assertSame(first.snapshot(), again.snapshot());
        }

        @Test
        @DisplayName("Should reject an override id reused for a different edge")
        void testConflictingId() {
            ContractSnapshot next = editor.addOverride(base, override("o1", "d2", "d1", OverrideType.FULL)).snapshot();

            RegistryResult result = editor.addOverride(next, override("o1", "d1", "gc", OverrideType.FULL));

            assertEquals(ErrorCode.DUPLICATE_EDGE, blockingCode(result));
            assertEquals(List.of("d2", "d1"), result.blockingIssue().orElseThrow().relatedIds());
            assertSame(next, result.snapshot());
            assertEquals("d2", next.findOverride("o1").orElseThrow().overridingDocumentId());
        }
    }

    @Nested
    @DisplayName("addReference")
    class AddReferenceTests {

        @Test
        @DisplayName("Should warn when the target is unknown")
        void testUnknownTarget() {
            RegistryResult result = editor.addReference(base, reference("d1", "14.1", "99.9", ReferenceType.MENTIONS));

            assertTrue(result.isAccepted());
            assertEquals(ErrorCode.UNRESOLVED_REFERENCE, result.warnings().get(0).code());
            assertEquals(1, result.snapshot().unresolvedReferences().size());
        }

        @Test
        @DisplayName("Should accept a known target once")
        void testIdenticalEdge() {
            RegistryResult first = editor.addReference(base, reference("d1", "1", "14.1", ReferenceType.OVERRIDES));
            RegistryResult again = editor.addReference(first.snapshot(), reference("d1", "1", "14.1", ReferenceType.OVERRIDES));

            assertTrue(first.warnings().isEmpty());
            assertSame(first.snapshot(), again.snapshot());
            assertEquals(1, again.snapshot().getReferences().size());
        }

        @Test
        @DisplayName("Should reject a reference id reused for a different edge")
        void testConflictingId() {
            ContractSnapshot next = editor.addReference(base, referenceWithId("r1", "1", ReferenceType.MENTIONS)).snapshot();

            RegistryResult result = editor.addReference(next, referenceWithId("r1", "2", ReferenceType.OVERRIDES));

            assertEquals(ErrorCode.DUPLICATE_EDGE, blockingCode(result));
            assertSame(next, result.snapshot());
            assertEquals(ReferenceType.MENTIONS, next.getReferences().get(0).referenceType());
        }

        @Test
        @DisplayName("Should accept the same edge again under its id")
        void testRepeatedId() {
            ContractSnapshot next = editor.addReference(base, referenceWithId("r1", "1", ReferenceType.OVERRIDES)).snapshot();

            RegistryResult again = editor.addReference(next, referenceWithId("r1", "1", ReferenceType.OVERRIDES));

            assertTrue(again.isAccepted());
            assertSame(next, again.snapshot());
        }

        private ClauseReference referenceWithId(String id, String source, ReferenceType type) {
            return ClauseReference.builder()
                    .id(id)
                    .sourceDocumentId("d1")
                    .sourceClause(CanonicalClauseId.of(source))
                    .targetClause(CanonicalClauseId.of("14.1"))
                    .referenceType(type)
                    .build();
        }

        @Test
        @DisplayName("Should reject a reference from an unknown document")
        void testUnknownSource() {
            assertEquals(ErrorCode.UNRESOLVED_REFERENCE,
                    blockingCode(editor.addReference(base, reference("ghost", "1", "14.1", ReferenceType.MENTIONS))));
        }
    }

    @Nested
    @DisplayName("retractOverride")
    class RetractTests {

        @Test
        @DisplayName("Should remove the edge and report the clauses it covered")
        void testRetract() {
            ContractSnapshot withEdge = editor.addOverride(base,
                    override("o1", "d1", "gc", OverrideType.CLAUSE_SPECIFIC, "14.1")).snapshot();

            RegistryResult result = editor.retractOverride(withEdge, "o1");

            assertTrue(result.isAccepted());
            assertTrue(result.snapshot().getOverrides().isEmpty());
            assertEquals(Set.of(CanonicalClauseId.of("14.1")), result.affectedClauses());
            assertEquals(withEdge.getVersion() + 1, result.snapshot().getVersion());
        }

        @Test
        @DisplayName("Retracting a middle edge should report clauses held along the whole chain")
        void testRetractChainEdge() {
            ContractSnapshot chain = contract()
                    .with(document("gc", DocumentGroup.C, 1))
                    .with(document("x", DocumentGroup.N, 1))
                    .with(document("y", DocumentGroup.N, 2))
                    .with(document("w", DocumentGroup.N, 3))
                    .with(document("z", DocumentGroup.C, 2))
                    .with(chunk("x-5", "x", "5"))
                    .with(chunk("z-5", "z", "5"))
                    .with(chunk("gc-7", "gc", "7"))
                    .with(override("o1", "x", "y", OverrideType.FULL))
                    .with(override("o2", "y", "w", OverrideType.FULL))
                    .with(override("o3", "w", "z", OverrideType.FULL))
                    .snapshot();

            RegistryResult result = editor.retractOverride(chain, "o2");

            assertTrue(result.isAccepted());
            assertEquals(Set.of(CanonicalClauseId.of("5")), result.affectedClauses());
        }

        @Test
        @DisplayName("Should only report chain clauses the retracted edge covers")
        void testRetractChainScoped() {
            ContractSnapshot chain = contract()
                    .with(document("x", DocumentGroup.N, 1))
                    .with(document("y", DocumentGroup.N, 2))
                    .with(document("z", DocumentGroup.C, 1))
                    .with(chunk("x-5", "x", "5"))
                    .with(chunk("z-5", "z", "5"))
                    .with(chunk("z-8", "z", "8"))
                    .with(override("o1", "x", "y", OverrideType.CLAUSE_SPECIFIC, "5"))
                    .with(override("o2", "y", "z", OverrideType.FULL))
                    .snapshot();

            RegistryResult result = editor.retractOverride(chain, "o1");

            assertEquals(Set.of(CanonicalClauseId.of("5")), result.affectedClauses());
        }

        @Test
        @DisplayName("Should reject an unknown override id")
        void testUnknown() {
            assertEquals(ErrorCode.UNRESOLVED_REFERENCE, blockingCode(editor.retractOverride(base, "nope")));
        }
    }
}
