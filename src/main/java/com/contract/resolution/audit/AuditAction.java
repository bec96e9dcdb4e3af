package com.contract.resolution.audit;

/**
 * Types of auditable registry actions.
 */
public enum AuditAction {
    DOCUMENT_ADDED,
    CHUNK_ADDED,
    OVERRIDE_DECLARED,
    OVERRIDE_INFERRED,
    OVERRIDE_RETRACTED,
    REFERENCE_ADDED,
    MUTATION_REJECTED
}
