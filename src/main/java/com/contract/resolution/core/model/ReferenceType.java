package com.contract.resolution.core.model;

/**
 * Type of a directed clause-to-clause reference.
 */
public enum ReferenceType {
    MENTIONS,
    /** The source text replaces, deletes or otherwise overrides the target. */
    OVERRIDES,
    SUPPLEMENTS,
    CROSS_REFERENCE,
    DEFINES,
    /** The source text amends the target. */
    AMENDS;

    /**
     * True for types that express an intent to supersede the target clause.
     */
    public boolean expressesOverrideIntent() {
        return this == OVERRIDES || this == AMENDS;
    }
}
