package com.contract.resolution.core.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Directed reference from one clause to another, as detected in prose.
 * Whether the target exists is a property of a snapshot, not of the edge.
 */
public record ClauseReference(
        String id,
        CanonicalClauseId sourceClause,
        CanonicalClauseId targetClause,
        ReferenceType referenceType,
        String sourceDocumentId,
        String sourceChunkId,
        String referenceText,
        double confidence
) {
    public ClauseReference {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(sourceClause, "sourceClause is required");
        Objects.requireNonNull(targetClause, "targetClause is required");
        Objects.requireNonNull(referenceType, "referenceType is required");
        if (targetClause.isEmpty()) {
            throw new IllegalArgumentException("targetClause must not be empty");
        }
        referenceText = referenceText != null ? referenceText : "";
    }

    /**
     * Key that identifies the same logical edge regardless of its id.
     */
    public String edgeKey() {
        return sourceClause + "|" + targetClause + "|" + referenceType + "|" + sourceDocumentId;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private CanonicalClauseId sourceClause = CanonicalClauseId.EMPTY;
        private CanonicalClauseId targetClause;
        private ReferenceType referenceType = ReferenceType.MENTIONS;
        private String sourceDocumentId;
        private String sourceChunkId;
        private String referenceText;
        private double confidence = 1.0;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder sourceClause(CanonicalClauseId sourceClause) {
            this.sourceClause = sourceClause;
            return this;
        }

        public Builder targetClause(CanonicalClauseId targetClause) {
            this.targetClause = targetClause;
            return this;
        }

        public Builder referenceType(ReferenceType referenceType) {
            this.referenceType = referenceType;
            return this;
        }

        public Builder sourceDocumentId(String sourceDocumentId) {
            this.sourceDocumentId = sourceDocumentId;
            return this;
        }

        public Builder sourceChunkId(String sourceChunkId) {
            this.sourceChunkId = sourceChunkId;
            return this;
        }

        public Builder referenceText(String referenceText) {
            this.referenceText = referenceText;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public ClauseReference build() {
            return new ClauseReference(id, sourceClause, targetClause, referenceType,
                    sourceDocumentId, sourceChunkId, referenceText, confidence);
        }
    }
}
