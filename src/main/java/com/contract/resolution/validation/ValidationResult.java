package com.contract.resolution.validation;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Outcome of validating a whole contract snapshot.
 */
public record ValidationResult(
        String contractId,
        long snapshotVersion,
        List<ValidationIssue> errors,
        List<ValidationIssue> warnings,
        ValidationSummary summary
) {
    public ValidationResult {
        Objects.requireNonNull(contractId, "contractId is required");
        Objects.requireNonNull(summary, "summary is required");
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public boolean isValid() {
        return errors.isEmpty();
    }

    /**
     * Issue counts per code, errors and warnings together, in code order.
     */
    public Map<ErrorCode, Long> countsByCode() {
        Map<ErrorCode, Long> counts = new TreeMap<>();
        counts.putAll(errors.stream().collect(Collectors.groupingBy(ValidationIssue::code, Collectors.counting())));
        warnings.stream()
                .collect(Collectors.groupingBy(ValidationIssue::code, Collectors.counting()))
                .forEach((code, count) -> counts.merge(code, count, Long::sum));
        return counts;
    }

    public List<ValidationIssue> issuesFor(ErrorCode code) {
        return Stream.concat(errors.stream(), warnings.stream())
                .filter(issue -> issue.code() == code)
                .toList();
    }
}
