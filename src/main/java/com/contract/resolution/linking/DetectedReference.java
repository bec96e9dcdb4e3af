package com.contract.resolution.linking;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ReferenceType;

/**
 * A clause reference found in prose, before it is registered.
 */
public record DetectedReference(
        CanonicalClauseId targetClause,
        String referenceText,
        ReferenceType referenceType,
        ReferencePattern pattern,
        int startIndex,
        int endIndex,
        double confidence
) {
}
