package com.contract.resolution.core.model;

import java.util.Locale;

/**
 * Distinguishes Particular from General Conditions inside group C.
 */
public enum ConditionsType {
    GENERAL,
    PARTICULAR,
    NONE;

    /**
     * Derives the conditions type from a document name, the way documents are titled
     * in practice ("Particular Conditions", "General Conditions of Contract").
     */
    public static ConditionsType fromName(String name) {
        if (name == null) {
            return NONE;
        }
        String lower = name.toLowerCase(Locale.ROOT);
        if (lower.contains("particular")) {
            return PARTICULAR;
        }
        if (lower.contains("general")) {
            return GENERAL;
        }
        return NONE;
    }
}
