package com.contract.resolution.core.model;

/**
 * The rule that decided a contest between two candidate chunks.
 * Declared in order of strength: earlier tiers are consulted first.
 */
public enum ResolutionTier {
    /** A clause-specific override listing the clause. */
    CLAUSE_SPECIFIC,

    /** A partial override covering the clause. */
    PARTIAL,

    /** A full document override. */
    FULL,

    /** An OVERRIDES or AMENDS reference targeting the clause. */
    REFERENCE_INTENT,

    /** Fixed group precedence A > B > D > C(particular) > C(general). */
    GROUP_PRECEDENCE,

    /** Higher sequence within the same group. */
    SEQUENCE,

    /** The chunk was replaced by a re-ingested chunk of the same document. */
    REINGESTED;

    /**
     * Tier a declared override of the given type decides at.
     */
    public static ResolutionTier of(OverrideType type) {
        return switch (type) {
            case CLAUSE_SPECIFIC -> CLAUSE_SPECIFIC;
            case PARTIAL -> PARTIAL;
            case FULL -> FULL;
        };
    }
}
