package com.contract.resolution.rules;

import java.util.List;

/**
 * Built-in rules turning a raw clause number into its canonical spelling.
 */
public final class ClauseNumberRules {

    private ClauseNumberRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        return new NormalizationEngine(getDefaultRules());
    }

    public static List<NormalizationRule> getDefaultRules() {
        return List.of(
                // Covers trimming as well as inner spaces: "6 A.2 (b)" -> "6A.2(b)"
                NormalizationRule.of("remove-whitespace", "[\\s\\p{javaWhitespace}\\u00A0]+", "", 10),

                // Keeps the enclosed text: "1.6(b)" -> "1.6b"
                NormalizationRule.of("remove-brackets", "[()\\[\\]]", "", 20),

                // Repeated keyword prefixes are stripped in one pass so the result is stable
                NormalizationRule.of("strip-clause-keyword", "^((sub-?)?clause-?)+", "", 30)
        );
    }
}
