package com.contract.resolution.validation;

/**
 * Diagnostic codes shared by the registry, the resolver and the contract validator.
 */
public enum ErrorCode {
    DUPLICATE_CLAUSE("Duplicate clause numbers found within same document"),
    DUPLICATE_CHUNK("Duplicate chunk content"),
    DUPLICATE_DOCUMENT("Document id or group/sequence already registered"),
    DUPLICATE_EDGE("Override or reference id already registered for a different edge"),
    UNRESOLVED_REFERENCE("Reference to a clause or document that does not exist"),
    ADDENDUM_ORDER("Override order or addendum date issue"),
    MISSING_PC_OVERRIDE("Precedence between conditions could not be established"),
    OCR_CONFIDENCE_LOW("Low OCR confidence or suspected OCR errors detected"),
    INVALID_CLAUSE_NUMBER("Clause number is malformed or matched only through a variant"),
    TABLE_EXTRACTION_FAILED("Table extraction issues in BOQ documents"),
    NAMING_CONVENTION_VIOLATION("Naming convention or classification issues");

    private final String description;

    ErrorCode(String description) {
        this.description = description;
    }

    public String getDescription() {
        return description;
    }
}
