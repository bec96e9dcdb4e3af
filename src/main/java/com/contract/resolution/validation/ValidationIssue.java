package com.contract.resolution.validation;

import java.util.List;
import java.util.Objects;

/**
 * A single diagnostic. Domain failures are reported as values of this type rather than thrown.
 *
 * @param code       diagnostic code
 * @param severity   error or warning
 * @param message    human readable description
 * @param documentId document concerned, may be null
 * @param chunkId    chunk concerned, may be null
 * @param clauseId   canonical clause ID concerned, may be null
 * @param relatedIds other ids involved, such as tied chunks or a cycle path
 */
public record ValidationIssue(
        ErrorCode code,
        Severity severity,
        String message,
        String documentId,
        String chunkId,
        String clauseId,
        List<String> relatedIds
) {
    public ValidationIssue {
        Objects.requireNonNull(code, "code is required");
        Objects.requireNonNull(severity, "severity is required");
        Objects.requireNonNull(message, "message is required");
        relatedIds = relatedIds != null ? List.copyOf(relatedIds) : List.of();
    }

    public static ValidationIssue error(ErrorCode code, String message) {
        return builder(code, Severity.ERROR).message(message).build();
    }

    public static ValidationIssue warning(ErrorCode code, String message) {
        return builder(code, Severity.WARNING).message(message).build();
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    public static Builder builder(ErrorCode code, Severity severity) {
        return new Builder(code, severity);
    }

    public static class Builder {
        private final ErrorCode code;
        private final Severity severity;
        private String message;
        private String documentId;
        private String chunkId;
        private String clauseId;
        private List<String> relatedIds;

        private Builder(ErrorCode code, Severity severity) {
            this.code = code;
            this.severity = severity;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder documentId(String documentId) {
            this.documentId = documentId;
            return this;
        }

        public Builder chunkId(String chunkId) {
            this.chunkId = chunkId;
            return this;
        }

        public Builder clauseId(String clauseId) {
            this.clauseId = clauseId;
            return this;
        }

        public Builder relatedIds(List<String> relatedIds) {
            this.relatedIds = relatedIds;
            return this;
        }

        public ValidationIssue build() {
            return new ValidationIssue(code, severity,
                    message != null ? message : code.getDescription(),
                    documentId, chunkId, clauseId, relatedIds);
        }
    }
}
