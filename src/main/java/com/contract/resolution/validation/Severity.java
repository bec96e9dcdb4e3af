package com.contract.resolution.validation;

/**
 * Severity of a validation issue.
 */
public enum Severity {
    /** Blocks the operation or marks the contract invalid. */
    ERROR,

    /** Reported to the operator; does not block. */
    WARNING
}
