package com.contract.resolution.registry;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ClauseReference;
import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentChunk;
import com.contract.resolution.core.model.DocumentOverride;
import com.contract.resolution.core.model.OverrideType;
import com.contract.resolution.rules.ClauseIdNormalizer;
import com.contract.resolution.validation.ErrorCode;
import com.contract.resolution.validation.NamingConventions;
import com.contract.resolution.validation.Severity;
import com.contract.resolution.validation.ValidationIssue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Pure mutations over {@link ContractSnapshot}s.
 *
 * <p>Each operation validates its input against the given snapshot and either returns a
 * new snapshot or rejects the change, leaving the input snapshot untouched. The editor
 * holds no state of its own and may be shared between threads.</p>
 */
public class SnapshotEditor {
    private static final Logger log = LoggerFactory.getLogger(SnapshotEditor.class);

    private final ClauseIdNormalizer normalizer;
    private final RegistryOptions options;

    public SnapshotEditor() {
        this(new ClauseIdNormalizer(), RegistryOptions.defaults());
    }

    public SnapshotEditor(ClauseIdNormalizer normalizer, RegistryOptions options) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer is required");
        this.options = Objects.requireNonNull(options, "options is required");
    }

    public ClauseIdNormalizer getNormalizer() {
        return normalizer;
    }

    public RegistryOptions getOptions() {
        return options;
    }

    /**
     * Registers a document. Rejects a duplicate id or an occupied {@code (group, sequence)} slot.
     */
    public RegistryResult addDocument(ContractSnapshot snapshot, Document document) {
        requireSameContract(snapshot, document.getContractId());
        if (snapshot.findDocument(document.getId()).isPresent()) {
            return reject(snapshot, ValidationIssue.builder(ErrorCode.DUPLICATE_DOCUMENT, Severity.ERROR)
                    .message("Document " + document.getId() + " is already registered")
                    .documentId(document.getId())
                    .build());
        }
        for (Document existing : snapshot.getDocuments()) {
            if (existing.getGroup() == document.getGroup() && existing.getSequence() == document.getSequence()) {
                return reject(snapshot, ValidationIssue.builder(ErrorCode.DUPLICATE_DOCUMENT, Severity.ERROR)
                        .message("Slot " + document.getCode() + " is already taken by document " + existing.getId())
                        .documentId(document.getId())
                        .relatedIds(List.of(existing.getId()))
                        .build());
            }
        }

        List<ValidationIssue> warnings = options.isCheckNamingConventions()
                ? NamingConventions.check(document) : List.of();
        ContractSnapshot next = snapshot.withDocument(document);
        log.debug("Added document {} ({}) to contract {} at version {}",
                document.getId(), document.getCode(), snapshot.getContractId(), next.getVersion());
        return RegistryResult.accepted(next, warnings);
    }

    /**
     * Registers a chunk, deriving its canonical clause ID from the raw clause number.
     */
    public RegistryResult addChunk(ContractSnapshot snapshot, DocumentChunk chunk) {
        requireSameContract(snapshot, chunk.getContractId());
        Optional<Document> document = snapshot.findDocument(chunk.getDocumentId());
        if (document.isEmpty()) {
            return reject(snapshot, ValidationIssue.builder(ErrorCode.UNRESOLVED_REFERENCE, Severity.ERROR)
                    .message("Chunk " + chunk.getId() + " refers to unknown document " + chunk.getDocumentId())
                    .documentId(chunk.getDocumentId())
                    .chunkId(chunk.getId())
                    .build());
        }
        if (snapshot.findChunk(chunk.getId()).isPresent()) {
            return reject(snapshot, ValidationIssue.builder(ErrorCode.DUPLICATE_CHUNK, Severity.ERROR)
                    .message("Chunk " + chunk.getId() + " is already registered")
                    .documentId(chunk.getDocumentId())
                    .chunkId(chunk.getId())
                    .build());
        }

        CanonicalClauseId canonicalId = normalizer.normalize(chunk.getClauseNumber());
        DocumentChunk derived = canonicalId.equals(chunk.getCanonicalId())
                ? chunk
                : DocumentChunk.builder(chunk).canonicalId(canonicalId).build();

        for (DocumentChunk existing : snapshot.chunksOf(derived.getDocumentId())) {
            if (existing.getCanonicalId().equals(canonicalId)
                    && existing.getContentHash().equals(derived.getContentHash())) {
                return reject(snapshot, ValidationIssue.builder(ErrorCode.DUPLICATE_CHUNK, Severity.ERROR)
                        .message("Document " + derived.getDocumentId() + " already holds identical content for clause '"
                                + canonicalId + "' in chunk " + existing.getId())
                        .documentId(derived.getDocumentId())
                        .chunkId(derived.getId())
                        .clauseId(canonicalId.value())
                        .relatedIds(List.of(existing.getId()))
                        .build());
            }
        }

        if (derived.getSupersedesChunkId().isPresent()) {
            Optional<ValidationIssue> problem = checkSupersession(snapshot, derived);
            if (problem.isPresent()) {
                return reject(snapshot, problem.get());
            }
        }

        List<ValidationIssue> warnings = new ArrayList<>();
        if (derived.getConfidence() < options.getOcrConfidenceThreshold()) {
            warnings.add(ValidationIssue.builder(ErrorCode.OCR_CONFIDENCE_LOW, Severity.WARNING)
                    .message(String.format("Chunk confidence %.2f is below %.2f",
                            derived.getConfidence(), options.getOcrConfidenceThreshold()))
                    .documentId(derived.getDocumentId())
                    .chunkId(derived.getId())
                    .clauseId(canonicalId.value())
                    .build());
        }
        if (!derived.getClauseNumber().isBlank() && !normalizer.isWellFormed(derived.getClauseNumber())) {
            warnings.add(ValidationIssue.builder(ErrorCode.INVALID_CLAUSE_NUMBER, Severity.WARNING)
                    .message("Clause number '" + derived.getClauseNumber() + "' is not well formed")
                    .documentId(derived.getDocumentId())
                    .chunkId(derived.getId())
                    .clauseId(canonicalId.value())
                    .build());
        }
        if (!canonicalId.isEmpty()) {
            String replaced = derived.getSupersedesChunkId().orElse(null);
            List<String> clashing = snapshot.liveChunks().stream()
                    .filter(c -> c.getDocumentId().equals(derived.getDocumentId()))
                    .filter(c -> c.getCanonicalId().equals(canonicalId))
                    .map(DocumentChunk::getId)
                    .filter(id -> !id.equals(replaced))
                    .toList();
            if (!clashing.isEmpty()) {
                warnings.add(ValidationIssue.builder(ErrorCode.DUPLICATE_CLAUSE, Severity.WARNING)
                        .message("Document " + derived.getDocumentId() + " already holds clause '" + canonicalId + "'")
                        .documentId(derived.getDocumentId())
                        .chunkId(derived.getId())
                        .clauseId(canonicalId.value())
                        .relatedIds(clashing)
                        .build());
            }
        }

        ContractSnapshot next = snapshot.withChunk(derived);
        log.debug("Added chunk {} for clause '{}' to document {} (version {})",
                derived.getId(), canonicalId, derived.getDocumentId(), next.getVersion());
        return RegistryResult.accepted(next, warnings);
    }

    /**
     * Declares an override edge. Rejects edges that would close a cycle among overlapping scopes.
     */
    public RegistryResult addOverride(ContractSnapshot snapshot, DocumentOverride override) {
        Optional<Document> overriding = snapshot.findDocument(override.overridingDocumentId());
        Optional<Document> overridden = snapshot.findDocument(override.overriddenDocumentId());
        if (overriding.isEmpty() || overridden.isEmpty()) {
            String missing = overriding.isEmpty() ? override.overridingDocumentId() : override.overriddenDocumentId();
            return reject(snapshot, ValidationIssue.builder(ErrorCode.UNRESOLVED_REFERENCE, Severity.ERROR)
                    .message("Override " + override.id() + " refers to unknown document " + missing)
                    .documentId(missing)
                    .build());
        }
        if (override.overrideType() == OverrideType.CLAUSE_SPECIFIC && override.affectedClauses().isEmpty()) {
            return reject(snapshot, ValidationIssue.builder(ErrorCode.INVALID_CLAUSE_NUMBER, Severity.ERROR)
                    .message("Clause-specific override " + override.id() + " lists no clauses")
                    .documentId(override.overridingDocumentId())
                    .build());
        }

        DocumentOverride normalized = normalize(override, overriding.get(), overridden.get());
        for (DocumentOverride existing : snapshot.getOverrides()) {
            if (existing.id().equals(normalized.id())) {
                if (sameEdge(existing, normalized)) {
                    return RegistryResult.accepted(snapshot, List.of());
                }
                return reject(snapshot, ValidationIssue.builder(ErrorCode.DUPLICATE_EDGE, Severity.ERROR)
                        .message("Override id " + normalized.id() + " is already registered for "
                                + existing.overridingDocumentId() + " -> " + existing.overriddenDocumentId())
                        .documentId(normalized.overridingDocumentId())
                        .relatedIds(List.of(existing.overridingDocumentId(), existing.overriddenDocumentId()))
                        .build());
            }
            if (sameEdge(existing, normalized)) {
                log.debug("Override {} duplicates existing edge {}", normalized.id(), existing.id());
                return RegistryResult.accepted(snapshot, List.of());
            }
        }

        Optional<List<String>> cycle = OverrideGraph.findCycle(snapshot, normalized);
        if (cycle.isPresent()) {
            String message = normalized.overridingDocumentId().equals(normalized.overriddenDocumentId())
                    ? "Document " + normalized.overridingDocumentId() + " cannot override itself"
                    : "Override " + overriding.get().getCode() + " -> " + overridden.get().getCode()
                    + " would create a cycle through " + cycle.get();
            return reject(snapshot, ValidationIssue.builder(ErrorCode.ADDENDUM_ORDER, Severity.ERROR)
                    .message(message)
                    .documentId(normalized.overridingDocumentId())
                    .relatedIds(cycle.get())
                    .build());
        }

        ContractSnapshot next = snapshot.withOverride(normalized);
        log.debug("Added {} override {} ({} -> {}) at version {}", normalized.overrideType(), normalized.id(),
                overriding.get().getCode(), overridden.get().getCode(), next.getVersion());
        return RegistryResult.accepted(next, List.of());
    }

    /**
     * Records a clause reference. Identical edges are accepted without change; an id already
     * used by a different edge is rejected.
     */
    public RegistryResult addReference(ContractSnapshot snapshot, ClauseReference reference) {
        if (reference.sourceDocumentId() != null && snapshot.findDocument(reference.sourceDocumentId()).isEmpty()) {
            return reject(snapshot, ValidationIssue.builder(ErrorCode.UNRESOLVED_REFERENCE, Severity.ERROR)
                    .message("Reference " + reference.id() + " comes from unknown document " + reference.sourceDocumentId())
                    .documentId(reference.sourceDocumentId())
                    .build());
        }
        ClauseReference normalized = ClauseReference.builder()
                .id(reference.id())
                .sourceClause(normalizer.normalize(reference.sourceClause().value()))
                .targetClause(normalizer.normalize(reference.targetClause().value()))
                .referenceType(reference.referenceType())
                .sourceDocumentId(reference.sourceDocumentId())
                .sourceChunkId(reference.sourceChunkId())
                .referenceText(reference.referenceText())
                .confidence(reference.confidence())
                .build();

        for (ClauseReference existing : snapshot.getReferences()) {
            if (existing.edgeKey().equals(normalized.edgeKey())) {
                return RegistryResult.accepted(snapshot, List.of());
            }
            if (existing.id().equals(normalized.id())) {
                return reject(snapshot, ValidationIssue.builder(ErrorCode.DUPLICATE_EDGE, Severity.ERROR)
                        .message("Reference id " + normalized.id() + " is already registered for "
                                + existing.referenceType() + " " + existing.sourceClause() + " -> " + existing.targetClause())
                        .documentId(normalized.sourceDocumentId())
                        .chunkId(normalized.sourceChunkId())
                        .clauseId(normalized.sourceClause().value())
                        .build());
            }
        }

        List<ValidationIssue> warnings = new ArrayList<>();
        if (!snapshot.isKnownClause(normalized.targetClause())) {
            warnings.add(ValidationIssue.builder(ErrorCode.UNRESOLVED_REFERENCE, Severity.WARNING)
                    .message("Reference to " + normalized.targetClause() + " cannot be resolved")
                    .documentId(normalized.sourceDocumentId())
                    .chunkId(normalized.sourceChunkId())
                    .clauseId(normalized.targetClause().value())
                    .build());
        }
        return RegistryResult.accepted(snapshot.withReference(normalized), warnings);
    }

    /**
     * Removes an override and reports the clause IDs whose resolution it influenced: clauses it
     * covers that are held by any document on a chain running through the edge.
     */
    public RegistryResult retractOverride(ContractSnapshot snapshot, String overrideId) {
        Optional<DocumentOverride> found = snapshot.findOverride(overrideId);
        if (found.isEmpty()) {
            return reject(snapshot, ValidationIssue.error(ErrorCode.UNRESOLVED_REFERENCE,
                    "Override " + overrideId + " is not registered"));
        }
        DocumentOverride override = found.get();
        Set<String> onChain = OverrideGraph.chainThrough(snapshot, override);
        Set<CanonicalClauseId> affected = new LinkedHashSet<>();
        for (DocumentChunk chunk : snapshot.getChunks()) {
            if (onChain.contains(chunk.getDocumentId()) && chunk.hasClauseNumber()
                    && override.covers(chunk.getCanonicalId())) {
                affected.add(chunk.getCanonicalId());
            }
        }
        ContractSnapshot next = snapshot.withoutOverride(overrideId);
        log.debug("Retracted override {}; {} document(s) on its chains, {} clause(s) affected",
                overrideId, onChain.size(), affected.size());
        return RegistryResult.accepted(next, List.of(), affected);
    }

    private Optional<ValidationIssue> checkSupersession(ContractSnapshot snapshot, DocumentChunk chunk) {
        String oldId = chunk.getSupersedesChunkId().orElseThrow();
        Optional<DocumentChunk> old = snapshot.findChunk(oldId);
        if (old.isEmpty() || !old.get().getDocumentId().equals(chunk.getDocumentId())) {
            return Optional.of(ValidationIssue.builder(ErrorCode.UNRESOLVED_REFERENCE, Severity.ERROR)
                    .message("Chunk " + chunk.getId() + " supersedes unknown chunk " + oldId
                            + " in document " + chunk.getDocumentId())
                    .documentId(chunk.getDocumentId())
                    .chunkId(chunk.getId())
                    .build());
        }
        Optional<String> successor = snapshot.supersedingChunkOf(oldId);
        if (successor.isPresent()) {
            return Optional.of(ValidationIssue.builder(ErrorCode.DUPLICATE_CHUNK, Severity.ERROR)
                    .message("Chunk " + oldId + " was already superseded by " + successor.get())
                    .documentId(chunk.getDocumentId())
                    .chunkId(chunk.getId())
                    .relatedIds(List.of(successor.get()))
                    .build());
        }
        return Optional.empty();
    }

    private DocumentOverride normalize(DocumentOverride override, Document overriding, Document overridden) {
        Set<CanonicalClauseId> clauses = new LinkedHashSet<>();
        for (CanonicalClauseId clause : override.affectedClauses()) {
            CanonicalClauseId canonical = normalizer.normalize(clause.value());
            if (!canonical.isEmpty()) {
                clauses.add(canonical);
            }
        }
        String scope = override.scope().isBlank()
                ? overriding.getGroup().name() + " -> " + overridden.getGroup().name()
                : override.scope();
        return DocumentOverride.builder()
                .id(override.id())
                .overridingDocumentId(override.overridingDocumentId())
                .overriddenDocumentId(override.overriddenDocumentId())
                .overrideType(override.overrideType())
                .affectedClauses(clauses)
                .scope(scope)
                .reason(override.reason())
                .origin(override.origin())
                .build();
    }

    private static boolean sameEdge(DocumentOverride a, DocumentOverride b) {
        return a.edgeKey().equals(b.edgeKey())
                && a.overrideType() == b.overrideType()
                && a.affectedClauses().equals(b.affectedClauses());
    }

    private static void requireSameContract(ContractSnapshot snapshot, String contractId) {
        if (!snapshot.getContractId().equals(contractId)) {
            throw new IllegalArgumentException("Contract " + contractId + " does not match snapshot contract "
                    + snapshot.getContractId());
        }
    }

    private static RegistryResult reject(ContractSnapshot snapshot, ValidationIssue issue) {
        log.warn("Rejected change to contract {}: {} - {}", snapshot.getContractId(), issue.code(), issue.message());
        return RegistryResult.rejected(snapshot, issue);
    }
}
