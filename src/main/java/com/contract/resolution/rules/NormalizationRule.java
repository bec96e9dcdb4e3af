package com.contract.resolution.rules;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One named rewrite step of clause-number normalization. Lower priorities run first.
 *
 * @param name        rule name, reported when the rule changes its input
 * @param pattern     case-insensitive pattern to rewrite
 * @param replacement replacement for every match
 * @param priority    position in the rule order
 */
public record NormalizationRule(String name, Pattern pattern, String replacement, int priority) {

    public NormalizationRule {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(pattern, "pattern is required");
        Objects.requireNonNull(replacement, "replacement is required");
    }

    /**
     * Compiles {@code regex} case-insensitively into a rule.
     */
    public static NormalizationRule of(String name, String regex, String replacement, int priority) {
        Objects.requireNonNull(regex, "pattern is required");
        return new NormalizationRule(name, Pattern.compile(regex, Pattern.CASE_INSENSITIVE), replacement, priority);
    }

    public String apply(String input) {
        return input == null ? null : pattern.matcher(input).replaceAll(replacement);
    }
}
