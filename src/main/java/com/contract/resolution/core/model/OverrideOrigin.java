package com.contract.resolution.core.model;

/**
 * How an override edge came to exist.
 */
public enum OverrideOrigin {
    /** Declared explicitly by a user or an upstream extractor. */
    DECLARED,

    /** Derived from group precedence by the override inference. */
    INFERRED
}
