package com.contract.resolution.core.model;

/**
 * Processing status of a document as reported by the ingestion pipeline.
 */
public enum DocumentStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    /** Ingestion failed; chunks of such a document never take part in resolution. */
    ERROR
}
