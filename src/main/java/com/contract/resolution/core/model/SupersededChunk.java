package com.contract.resolution.core.model;

import java.util.Objects;

/**
 * A chunk that lost to the winner, with the tier that decided the contest.
 */
public record SupersededChunk(
        String chunkId,
        String documentId,
        DocumentGroup group,
        int sequence,
        ResolutionTier tier
) {
    public SupersededChunk {
        Objects.requireNonNull(chunkId, "chunkId is required");
        Objects.requireNonNull(documentId, "documentId is required");
        Objects.requireNonNull(group, "group is required");
        Objects.requireNonNull(tier, "tier is required");
    }
}
