package com.contract.resolution.resolver;

import com.contract.resolution.core.model.EffectiveClause;
import com.contract.resolution.validation.ValidationIssue;

import java.util.List;
import java.util.Optional;

/**
 * Result of resolving one clause ID: the effective clause, or the issue that prevented it.
 * Warnings are carried in both cases.
 */
public record ClauseResolutionResult(
        boolean success,
        EffectiveClause effectiveClause,
        ValidationIssue issue,
        List<ValidationIssue> warnings,
        long snapshotVersion
) {
    public ClauseResolutionResult {
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ClauseResolutionResult success(EffectiveClause clause, List<ValidationIssue> warnings,
                                                 long snapshotVersion) {
        return new ClauseResolutionResult(true, clause, null, warnings, snapshotVersion);
    }

    public static ClauseResolutionResult failure(ValidationIssue issue, List<ValidationIssue> warnings,
                                                 long snapshotVersion) {
        return new ClauseResolutionResult(false, null, issue, warnings, snapshotVersion);
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public Optional<EffectiveClause> getEffectiveClause() {
        return Optional.ofNullable(effectiveClause);
    }

    public Optional<ValidationIssue> getIssue() {
        return Optional.ofNullable(issue);
    }
}
