package com.contract.resolution.validation;

/**
 * Counts reported alongside a contract validation.
 */
public record ValidationSummary(
        int totalDocuments,
        int totalChunks,
        int totalReferences,
        int unresolvedReferences,
        int lowConfidenceChunks
) {
}
