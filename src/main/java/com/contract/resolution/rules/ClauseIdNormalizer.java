package com.contract.resolution.rules;

import com.contract.resolution.core.model.CanonicalClauseId;
import com.contract.resolution.core.model.ClauseIdVariantSet;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps raw clause-number text to a {@link CanonicalClauseId} and its variant spellings.
 * Stateless and thread-safe.
 */
public class ClauseIdNormalizer {

    private static final Pattern WELL_FORMED =
            Pattern.compile("^\\d+[A-Za-z]?(\\.\\d+[A-Za-z]?)*(\\s*\\([A-Za-z0-9]+\\))?$");
    private static final Pattern LETTER_SUFFIXED = Pattern.compile("^(\\d+(?:\\.\\d+)*)([A-Za-z])$");
    private static final Pattern TRAILING_LETTERS = Pattern.compile("[A-Za-z]+$");

    private final NormalizationEngine engine;

    public ClauseIdNormalizer() {
        this(ClauseNumberRules.createDefaultEngine());
    }

    public ClauseIdNormalizer(NormalizationEngine engine) {
        this.engine = engine;
    }

    /**
     * Canonicalizes a raw clause number. Total: null or blank input yields {@link CanonicalClauseId#EMPTY}.
     */
    public CanonicalClauseId normalize(String raw) {
        return CanonicalClauseId.of(engine.normalize(raw));
    }

    /**
     * Enumerates the alternate spellings under which a clause may have been stored.
     */
    public ClauseIdVariantSet variants(String raw) {
        CanonicalClauseId canonical = normalize(raw);
        if (canonical.isEmpty()) {
            return ClauseIdVariantSet.empty();
        }
        String value = canonical.value();
        Set<String> alternates = new LinkedHashSet<>();
        alternates.add(value.toLowerCase(Locale.ROOT));

        String numericOnly = numericOnly(value);
        if (!numericOnly.isEmpty() && !numericOnly.equals(value)) {
            alternates.add(numericOnly);
        }

        Matcher suffixed = LETTER_SUFFIXED.matcher(value);
        if (suffixed.matches()) {
            String number = suffixed.group(1);
            String letter = suffixed.group(2);
            alternates.add(number + "." + letter);
            alternates.add(number + letter.toLowerCase(Locale.ROOT));
            alternates.add(number + letter.toUpperCase(Locale.ROOT));
        }
        return ClauseIdVariantSet.of(canonical, alternates);
    }

    /**
     * Variant spellings of an already-canonical ID.
     */
    public ClauseIdVariantSet variants(CanonicalClauseId canonical) {
        return variants(canonical.value());
    }

    /**
     * Checks a raw number against the clause-number grammar, e.g. {@code 14.1}, {@code 6A.2 (b)}.
     */
    public boolean isWellFormed(String raw) {
        return raw != null && WELL_FORMED.matcher(raw.trim()).matches();
    }

    public List<String> ruleNames() {
        return engine.getRules().stream().map(NormalizationRule::name).toList();
    }

    // "6A" -> "6", "6A.2B" -> "6A.2"
    private static String numericOnly(String value) {
        int lastDot = value.lastIndexOf('.');
        String head = value.substring(0, lastDot + 1);
        String last = TRAILING_LETTERS.matcher(value.substring(lastDot + 1)).replaceFirst("");
        if (last.isEmpty()) {
            return "";
        }
        return head + last;
    }
}
