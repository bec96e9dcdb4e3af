package com.contract.resolution.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Declared precedence of one document over another.
 *
 * <p>Coverage of a clause ID depends on the type:</p>
 * <ul>
 *   <li>{@link OverrideType#FULL}: every clause</li>
 *   <li>{@link OverrideType#PARTIAL}: every clause when no clauses are listed, otherwise the
 *       listed clauses and their sub-clauses</li>
 *   <li>{@link OverrideType#CLAUSE_SPECIFIC}: exactly the listed clauses</li>
 * </ul>
 */
public record DocumentOverride(
        String id,
        String overridingDocumentId,
        String overriddenDocumentId,
        OverrideType overrideType,
        Set<CanonicalClauseId> affectedClauses,
        String scope,
        String reason,
        OverrideOrigin origin
) {
    public DocumentOverride {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(overridingDocumentId, "overridingDocumentId is required");
        Objects.requireNonNull(overriddenDocumentId, "overriddenDocumentId is required");
        Objects.requireNonNull(overrideType, "overrideType is required");
        affectedClauses = affectedClauses != null
                ? Collections.unmodifiableSet(new LinkedHashSet<>(affectedClauses)) : Set.of();
        scope = scope != null ? scope : "";
        reason = reason != null ? reason : "";
        origin = origin != null ? origin : OverrideOrigin.DECLARED;
    }

    /**
     * Whether this override applies to the given clause.
     */
    public boolean covers(CanonicalClauseId clauseId) {
        return switch (overrideType) {
            case FULL -> true;
            case PARTIAL -> affectedClauses.isEmpty()
                    || affectedClauses.stream().anyMatch(clauseId::isSameOrDescendantOf);
            case CLAUSE_SPECIFIC -> affectedClauses.contains(clauseId);
        };
    }

    /**
     * Whether some clause is covered by both this override and {@code other}.
     */
    public boolean overlaps(DocumentOverride other) {
        if (coversEverything() || other.coversEverything()) {
            return true;
        }
        for (CanonicalClauseId mine : affectedClauses) {
            if (other.covers(mine)) {
                return true;
            }
        }
        for (CanonicalClauseId theirs : other.affectedClauses) {
            if (covers(theirs)) {
                return true;
            }
        }
        return false;
    }

    public boolean coversEverything() {
        return overrideType == OverrideType.FULL
                || (overrideType == OverrideType.PARTIAL && affectedClauses.isEmpty());
    }

    public boolean connects(String documentA, String documentB) {
        return overridingDocumentId.equals(documentA) && overriddenDocumentId.equals(documentB);
    }

    /**
     * Key identifying the same logical edge: both documents plus scope.
     */
    public String edgeKey() {
        return overridingDocumentId + "->" + overriddenDocumentId + "|" + scope;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private String overridingDocumentId;
        private String overriddenDocumentId;
        private OverrideType overrideType = OverrideType.FULL;
        private Set<CanonicalClauseId> affectedClauses;
        private String scope;
        private String reason;
        private OverrideOrigin origin = OverrideOrigin.DECLARED;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder overridingDocumentId(String overridingDocumentId) {
            this.overridingDocumentId = overridingDocumentId;
            return this;
        }

        public Builder overriddenDocumentId(String overriddenDocumentId) {
            this.overriddenDocumentId = overriddenDocumentId;
            return this;
        }

        public Builder overrideType(OverrideType overrideType) {
            this.overrideType = overrideType;
            return this;
        }

        public Builder affectedClauses(Set<CanonicalClauseId> affectedClauses) {
            this.affectedClauses = affectedClauses;
            return this;
        }

        public Builder affectedClauses(CanonicalClauseId... affectedClauses) {
            this.affectedClauses = new LinkedHashSet<>(java.util.Arrays.asList(affectedClauses));
            return this;
        }

        public Builder scope(String scope) {
            this.scope = scope;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder origin(OverrideOrigin origin) {
            this.origin = origin;
            return this;
        }

        public DocumentOverride build() {
            return new DocumentOverride(id, overridingDocumentId, overriddenDocumentId, overrideType,
                    affectedClauses, scope, reason, origin);
        }
    }
}
