package com.contract.resolution.core.model;

/**
 * Scope kind of a document override. Declared from most general to most specific.
 */
public enum OverrideType {
    /** The overriding document shadows the whole overridden document. */
    FULL,

    /** Covers the listed clauses and their sub-clauses, or everything when none are listed. */
    PARTIAL,

    /** Covers exactly the listed clauses. */
    CLAUSE_SPECIFIC
}
