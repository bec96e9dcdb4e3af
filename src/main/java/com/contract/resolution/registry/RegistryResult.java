package com.contract.resolution.registry;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.validation.ValidationIssue;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Result of a registry mutation.
 *
 * An accepted mutation carries the new snapshot and any warnings. A rejected one carries the
 * unchanged snapshot and the blocking issue. Retractions also report the clause IDs whose
 * effective text may have changed.
 */
public record RegistryResult(
        boolean accepted,
        ContractSnapshot snapshot,
        List<ValidationIssue> issues,
        Set<CanonicalClauseId> affectedClauses
) {
    public RegistryResult {
        Objects.requireNonNull(snapshot, "snapshot is required");
        issues = issues != null ? List.copyOf(issues) : List.of();
        affectedClauses = affectedClauses != null ? Set.copyOf(affectedClauses) : Set.of();
    }

    public static RegistryResult accepted(ContractSnapshot snapshot, List<ValidationIssue> warnings) {
        return new RegistryResult(true, snapshot, warnings, Set.of());
    }

    public static RegistryResult accepted(ContractSnapshot snapshot, List<ValidationIssue> warnings,
                                          Set<CanonicalClauseId> affectedClauses) {
        return new RegistryResult(true, snapshot, warnings, affectedClauses);
    }

    public static RegistryResult rejected(ContractSnapshot unchanged, ValidationIssue issue) {
        return new RegistryResult(false, unchanged, List.of(issue), Set.of());
    }

    public boolean isAccepted() {
        return accepted;
    }

    public boolean isRejected() {
        return !accepted;
    }

    /**
     * The first error-level issue, present only for rejected mutations.
     */
    public Optional<ValidationIssue> blockingIssue() {
        return issues.stream().filter(ValidationIssue::isError).findFirst();
    }

    public List<ValidationIssue> warnings() {
        return issues.stream().filter(issue -> !issue.isError()).toList();
    }
}
