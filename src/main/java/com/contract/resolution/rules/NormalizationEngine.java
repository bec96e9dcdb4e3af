package com.contract.resolution.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Applies an immutable, ordered list of normalization rules to raw clause numbers.
 * Rules are applied in priority order (lower priority number = higher precedence),
 * then the result is upper-cased.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private final List<NormalizationRule> rules;

    public NormalizationEngine(List<NormalizationRule> rules) {
        List<NormalizationRule> sorted = new ArrayList<>(rules);
        sorted.sort(Comparator.comparingInt(NormalizationRule::priority));
        this.rules = List.copyOf(sorted);
    }

    /**
     * Gets all rules in application order.
     */
    public List<NormalizationRule> getRules() {
        return rules;
    }

    /**
     * Normalizes the given raw text. Null or blank input yields the empty string.
     */
    public String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }

        String result = raw;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (!before.equals(result)) {
                log.debug("Rule '{}' transformed '{}' -> '{}'", rule.name(), before, result);
            }
        }

        return result.toUpperCase(Locale.ROOT);
    }

    /**
     * Checks if two raw clause numbers normalize to the same value.
     */
    public boolean areEquivalent(String raw1, String raw2) {
        return normalize(raw1).equals(normalize(raw2));
    }
}
