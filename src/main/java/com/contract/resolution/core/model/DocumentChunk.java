package com.contract.resolution.core.model;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * An immutable piece of document text tagged with its raw clause number.
 *
 * Re-ingesting a clause never edits a chunk: it creates a new chunk whose
 * {@link #getSupersedesChunkId()} names the chunk it replaces.
 */
public final class DocumentChunk {
    private final String id;
    private final String documentId;
    private final String contractId;
    private final String clauseNumber;
    private final CanonicalClauseId canonicalId;
    private final String content;
    private final String contentHash;
    private final double confidence;
    private final ContentType contentType;
    private final int pageNumber;
    private final int tokenCount;
    private final String supersedesChunkId;

    private DocumentChunk(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.documentId = builder.documentId;
        this.contractId = builder.contractId;
        this.clauseNumber = builder.clauseNumber != null ? builder.clauseNumber : "";
        this.canonicalId = builder.canonicalId != null ? builder.canonicalId : CanonicalClauseId.EMPTY;
        this.content = builder.content;
        this.contentHash = hash(builder.content);
        this.confidence = builder.confidence;
        this.contentType = builder.contentType != null ? builder.contentType : ContentType.TEXT;
        this.pageNumber = builder.pageNumber;
        this.tokenCount = builder.tokenCount;
        this.supersedesChunkId = builder.supersedesChunkId;
    }

    public String getId() {
        return id;
    }

    public String getDocumentId() {
        return documentId;
    }

    public String getContractId() {
        return contractId;
    }

    /**
     * Clause number exactly as extracted; may be empty for chunks without one.
     */
    public String getClauseNumber() {
        return clauseNumber;
    }

    /**
     * Canonical form of the clause number; empty until the registry derives it.
     */
    public CanonicalClauseId getCanonicalId() {
        return canonicalId;
    }

    public String getContent() {
        return content;
    }

    /**
     * Hex SHA-256 of the content.
     */
    public String getContentHash() {
        return contentHash;
    }

    public double getConfidence() {
        return confidence;
    }

    public ContentType getContentType() {
        return contentType;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public int getTokenCount() {
        return tokenCount;
    }

    public Optional<String> getSupersedesChunkId() {
        return Optional.ofNullable(supersedesChunkId);
    }

    public boolean hasClauseNumber() {
        return !canonicalId.isEmpty();
    }

    /**
     * First characters of the content, for diagnostics.
     */
    public String preview() {
        return content.length() <= 100 ? content : content.substring(0, 100);
    }

    private static String hash(String content) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DocumentChunk that = (DocumentChunk) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "DocumentChunk{" +
                "id='" + id + '\'' +
                ", documentId='" + documentId + '\'' +
                ", clauseNumber='" + clauseNumber + '\'' +
                ", canonicalId=" + canonicalId +
                ", confidence=" + confidence +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Copies every field of an existing chunk, including its id.
     */
    public static Builder builder(DocumentChunk chunk) {
        return new Builder()
                .id(chunk.id)
                .documentId(chunk.documentId)
                .contractId(chunk.contractId)
                .clauseNumber(chunk.clauseNumber)
                .canonicalId(chunk.canonicalId)
                .content(chunk.content)
                .confidence(chunk.confidence)
                .contentType(chunk.contentType)
                .pageNumber(chunk.pageNumber)
                .tokenCount(chunk.tokenCount)
                .supersedesChunkId(chunk.supersedesChunkId);
    }

    public static class Builder {
        private String id;
        private String documentId;
        private String contractId;
        private String clauseNumber;
        private CanonicalClauseId canonicalId;
        private String content;
        private double confidence = 1.0;
        private ContentType contentType;
        private int pageNumber;
        private int tokenCount;
        private String supersedesChunkId;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder documentId(String documentId) {
            this.documentId = documentId;
            return this;
        }

        public Builder contractId(String contractId) {
            this.contractId = contractId;
            return this;
        }

        public Builder clauseNumber(String clauseNumber) {
            this.clauseNumber = clauseNumber;
            return this;
        }

        public Builder canonicalId(CanonicalClauseId canonicalId) {
            this.canonicalId = canonicalId;
            return this;
        }

        public Builder content(String content) {
            this.content = content;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder contentType(ContentType contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder pageNumber(int pageNumber) {
            this.pageNumber = pageNumber;
            return this;
        }

        public Builder tokenCount(int tokenCount) {
            this.tokenCount = tokenCount;
            return this;
        }

        public Builder supersedesChunkId(String supersedesChunkId) {
            this.supersedesChunkId = supersedesChunkId;
            return this;
        }

        public DocumentChunk build() {
            Objects.requireNonNull(documentId, "documentId is required");
            Objects.requireNonNull(contractId, "contractId is required");
            Objects.requireNonNull(content, "content is required");
            if (confidence < 0.0 || confidence > 1.0) {
                throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
            }
            return new DocumentChunk(this);
        }
    }
}
