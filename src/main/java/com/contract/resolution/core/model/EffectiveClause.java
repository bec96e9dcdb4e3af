package com.contract.resolution.core.model;

import java.util.List;
import java.util.Objects;

/**
 * The authoritative chunk for a clause ID and the chunks it superseded.
 *
 * @param canonicalId   the clause ID that was queried
 * @param matchedId     the canonical ID of the winning chunk; differs from
 *                      {@code canonicalId} only for fuzzy matches
 * @param winningChunkId id of the authoritative chunk
 * @param documentId    document holding the winning chunk
 * @param overriddenBy  superseded chunks ordered by group, sequence and chunk id
 * @param fuzzyMatch    true when the winner was found through a variant spelling
 */
public record EffectiveClause(
        CanonicalClauseId canonicalId,
        CanonicalClauseId matchedId,
        String winningChunkId,
        String documentId,
        List<SupersededChunk> overriddenBy,
        boolean fuzzyMatch
) {
    public EffectiveClause {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(matchedId, "matchedId is required");
        Objects.requireNonNull(winningChunkId, "winningChunkId is required");
        Objects.requireNonNull(documentId, "documentId is required");
        overriddenBy = overriddenBy != null ? List.copyOf(overriddenBy) : List.of();
    }

    /**
     * True if at least one other live chunk lost a contest to the winner.
     */
    public boolean isOverridden() {
        return overriddenBy.stream().anyMatch(s -> s.tier() != ResolutionTier.REINGESTED);
    }

    public List<String> overriddenChunkIds() {
        return overriddenBy.stream().map(SupersededChunk::chunkId).toList();
    }
}
