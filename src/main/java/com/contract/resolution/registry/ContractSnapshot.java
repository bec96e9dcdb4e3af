package com.contract.resolution.registry;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ClauseReference;
import com.contract.resolution.core.model.Document;
import com.contract.resolution.core.model.DocumentChunk;
import com.contract.resolution.core.model.DocumentOverride;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Immutable view of everything registered for one contract at a given version.
 *
 * <p>Documents live in an arena: each document has a stable integer index in
 * insertion order, and override edges are kept as an adjacency list keyed by the
 * overriding document's index. Snapshots are only created by {@link SnapshotEditor};
 * every accepted mutation yields a new snapshot with a higher version.</p>
 */
public final class ContractSnapshot {

    private final String contractId;
    private final long version;
    private final List<Document> documents;
    private final Map<String, Integer> documentIndex;
    private final List<DocumentChunk> chunks;
    private final Map<String, DocumentChunk> chunksById;
    private final Map<String, String> supersededBy;
    private final List<DocumentChunk> liveChunks;
    private final List<DocumentOverride> overrides;
    private final List<List<DocumentOverride>> outgoing;
    private final List<ClauseReference> references;

    ContractSnapshot(String contractId, long version, List<Document> documents, List<DocumentChunk> chunks,
                     List<DocumentOverride> overrides, List<ClauseReference> references) {
        this.contractId = Objects.requireNonNull(contractId, "contractId is required");
        this.version = version;
        this.documents = List.copyOf(documents);
        this.chunks = List.copyOf(chunks);
        this.overrides = List.copyOf(overrides);
        this.references = List.copyOf(references);

        Map<String, Integer> index = new HashMap<>();
        for (int i = 0; i < this.documents.size(); i++) {
            index.put(this.documents.get(i).getId(), i);
        }
        this.documentIndex = Collections.unmodifiableMap(index);

        Map<String, DocumentChunk> byId = new LinkedHashMap<>();
        Map<String, String> superseded = new HashMap<>();
        for (DocumentChunk chunk : this.chunks) {
            byId.put(chunk.getId(), chunk);
            chunk.getSupersedesChunkId().ifPresent(old -> superseded.put(old, chunk.getId()));
        }
        this.chunksById = Collections.unmodifiableMap(byId);
        this.supersededBy = Collections.unmodifiableMap(superseded);
        this.liveChunks = this.chunks.stream().filter(c -> !superseded.containsKey(c.getId())).toList();

        List<List<DocumentOverride>> adjacency = new ArrayList<>(this.documents.size());
        for (int i = 0; i < this.documents.size(); i++) {
            adjacency.add(new ArrayList<>());
        }
        for (DocumentOverride override : this.overrides) {
            Integer from = index.get(override.overridingDocumentId());
            if (from != null) {
                adjacency.get(from).add(override);
            }
        }
        List<List<DocumentOverride>> frozen = new ArrayList<>(adjacency.size());
        for (List<DocumentOverride> edges : adjacency) {
            frozen.add(List.copyOf(edges));
        }
        this.outgoing = Collections.unmodifiableList(frozen);
    }

    /**
     * An empty snapshot at version 0.
     */
    public static ContractSnapshot empty(String contractId) {
        return new ContractSnapshot(contractId, 0L, List.of(), List.of(), List.of(), List.of());
    }

    public String getContractId() {
        return contractId;
    }

    public long getVersion() {
        return version;
    }

    // --- documents ---

    public List<Document> getDocuments() {
        return documents;
    }

    public int documentCount() {
        return documents.size();
    }

    public Optional<Document> findDocument(String documentId) {
        Integer index = documentIndex.get(documentId);
        return index == null ? Optional.empty() : Optional.of(documents.get(index));
    }

    public OptionalInt indexOf(String documentId) {
        Integer index = documentIndex.get(documentId);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public Document documentAt(int index) {
        return documents.get(index);
    }

    // --- chunks ---

    public List<DocumentChunk> getChunks() {
        return chunks;
    }

    public Optional<DocumentChunk> findChunk(String chunkId) {
        return Optional.ofNullable(chunksById.get(chunkId));
    }

    public List<DocumentChunk> chunksOf(String documentId) {
        return chunks.stream().filter(c -> c.getDocumentId().equals(documentId)).toList();
    }

    /**
     * True if a re-ingested chunk replaced this one.
     */
    public boolean isSuperseded(String chunkId) {
        return supersededBy.containsKey(chunkId);
    }

    public Optional<String> supersedingChunkOf(String chunkId) {
        return Optional.ofNullable(supersededBy.get(chunkId));
    }

    /**
     * Chunks not replaced by re-ingestion, in insertion order.
     */
    public List<DocumentChunk> liveChunks() {
        return liveChunks;
    }

    /**
     * Canonical IDs carried by live chunks.
     */
    public Set<CanonicalClauseId> clauseIds() {
        Set<CanonicalClauseId> ids = new LinkedHashSet<>();
        for (DocumentChunk chunk : liveChunks()) {
            if (chunk.hasClauseNumber()) {
                ids.add(chunk.getCanonicalId());
            }
        }
        return Collections.unmodifiableSet(ids);
    }

    /**
     * True if a live chunk carries the ID or one of its sub-clauses.
     */
    public boolean isKnownClause(CanonicalClauseId clauseId) {
        if (clauseId.isEmpty()) {
            return false;
        }
        for (DocumentChunk chunk : liveChunks()) {
            if (chunk.getCanonicalId().isSameOrDescendantOf(clauseId)) {
                return true;
            }
        }
        return false;
    }

    // --- overrides ---

    public List<DocumentOverride> getOverrides() {
        return overrides;
    }

    public Optional<DocumentOverride> findOverride(String overrideId) {
        return overrides.stream().filter(o -> o.id().equals(overrideId)).findFirst();
    }

    /**
     * Override edges leaving the document at the given arena index.
     */
    public List<DocumentOverride> outgoingOverrides(int documentIndex) {
        return outgoing.get(documentIndex);
    }

    /**
     * True if any override, in either direction, links the two documents.
     */
    public boolean hasOverrideBetween(String documentA, String documentB) {
        return overrides.stream().anyMatch(o -> o.connects(documentA, documentB) || o.connects(documentB, documentA));
    }

    // --- references ---

    public List<ClauseReference> getReferences() {
        return references;
    }

    /**
     * References whose target is not carried by any live chunk.
     */
    public List<ClauseReference> unresolvedReferences() {
        return references.stream().filter(r -> !isKnownClause(r.targetClause())).toList();
    }

    // --- derivation, used by SnapshotEditor ---

    ContractSnapshot withDocument(Document document) {
        List<Document> next = new ArrayList<>(documents);
        next.add(document);
        return new ContractSnapshot(contractId, version + 1, next, chunks, overrides, references);
    }

    ContractSnapshot withChunk(DocumentChunk chunk) {
        List<DocumentChunk> next = new ArrayList<>(chunks);
        next.add(chunk);
        return new ContractSnapshot(contractId, version + 1, documents, next, overrides, references);
    }

    ContractSnapshot withOverride(DocumentOverride override) {
        List<DocumentOverride> next = new ArrayList<>(overrides);
        next.add(override);
        return new ContractSnapshot(contractId, version + 1, documents, chunks, next, references);
    }

    ContractSnapshot withoutOverride(String overrideId) {
        List<DocumentOverride> next = new ArrayList<>(overrides);
        next.removeIf(o -> o.id().equals(overrideId));
        return new ContractSnapshot(contractId, version + 1, documents, chunks, next, references);
    }

    ContractSnapshot withReference(ClauseReference reference) {
        List<ClauseReference> next = new ArrayList<>(references);
        next.add(reference);
        return new ContractSnapshot(contractId, version + 1, documents, chunks, overrides, next);
    }

    @Override
    public String toString() {
        return "ContractSnapshot{" +
                "contractId='" + contractId + '\'' +
                ", version=" + version +
                ", documents=" + documents.size() +
                ", chunks=" + chunks.size() +
                ", overrides=" + overrides.size() +
                ", references=" + references.size() +
                '}';
    }
}
