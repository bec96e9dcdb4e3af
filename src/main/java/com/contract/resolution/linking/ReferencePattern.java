package com.contract.resolution.linking;

import java.util.regex.Pattern;

/**
 * Textual shapes of clause references, with the base confidence each one earns.
 * Declared in the order they are scanned.
 */
public enum ReferencePattern {
    /** {@code Clause 1.1}, {@code Sub-Clause 2.3}, {@code Article 22A.1}. */
    EXPLICIT(0.95, "(?:Sub-?Clause|Clause|Article)\\s*(\\d+[A-Za-z]?(?:\\.\\d+)*(?:\\s*\\([a-z]+\\))?)"),

    /** {@code as per 1.1}, {@code pursuant to Clause 5.1}. */
    IMPLICIT(0.85, "\\b(?:as per|under|per|pursuant to|in accordance with|refer to|see)\\s*(?:Sub-?Clause|Clause)?\\s*"
            + "(\\d+[A-Za-z]?(?:\\.\\d+)*)"),

    /** {@code (Clause 1.1)}, {@code [see 2.3]}. */
    PARENTHETICAL(0.80, "[(\\[]\\s*(?:Sub-?Clause|Clause|see)?\\s*(\\d+[A-Za-z]?(?:\\.\\d+)*)\\s*[)\\]]"),

    /** {@code Appendix 3}, {@code Annex B}, {@code Schedule 2}. */
    APPENDIX(0.90, "((?:Appendix|Annex|Schedule)\\s*[A-Z0-9]+)\\b");

    private final double baseConfidence;
    private final Pattern pattern;

    ReferencePattern(double baseConfidence, String regex) {
        this.baseConfidence = baseConfidence;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    public double getBaseConfidence() {
        return baseConfidence;
    }

    public Pattern getPattern() {
        return pattern;
    }
}
