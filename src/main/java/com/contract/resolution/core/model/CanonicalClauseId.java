package com.contract.resolution.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Canonical identity of a clause number.
 *
 * The value is uppercase and contains no whitespace, parentheses or brackets.
 * Two IDs are equal iff their dotted segment sequences are equal, which for the
 * canonical form is plain string equality.
 *
 * Instances are normally produced by {@code ClauseIdNormalizer}; {@link #of(String)}
 * only accepts text that is already canonical.
 */
public final class CanonicalClauseId {

    public static final CanonicalClauseId EMPTY = new CanonicalClauseId("");

    private final String value;

    private CanonicalClauseId(String value) {
        this.value = value;
    }

    /**
     * Wraps an already-canonical value.
     *
     * @throws IllegalArgumentException if the value is not in canonical form
     */
    public static CanonicalClauseId of(String canonicalValue) {
        Objects.requireNonNull(canonicalValue, "canonicalValue is required");
        if (canonicalValue.isEmpty()) {
            return EMPTY;
        }
        if (!isCanonical(canonicalValue)) {
            throw new IllegalArgumentException("Not a canonical clause id: '" + canonicalValue + "'");
        }
        return new CanonicalClauseId(canonicalValue);
    }

    /**
     * Checks whether a string already satisfies the canonical form.
     */
    public static boolean isCanonical(String candidate) {
        if (candidate == null) {
            return false;
        }
        for (int i = 0; i < candidate.length(); i++) {
            char c = candidate.charAt(i);
            if (Character.isWhitespace(c) || c == '(' || c == ')' || c == '[' || c == ']') {
                return false;
            }
        }
        return candidate.equals(candidate.toUpperCase(Locale.ROOT));
    }

    public String value() {
        return value;
    }

    public boolean isEmpty() {
        return value.isEmpty();
    }

    /**
     * Dotted segments of this ID; the empty ID has no segments.
     */
    public List<String> segments() {
        if (value.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(value.split("\\.", -1));
    }

    /**
     * The enclosing clause ("14.1" for "14.1.2"), if any.
     */
    public Optional<CanonicalClauseId> parent() {
        int lastDot = value.lastIndexOf('.');
        if (lastDot <= 0) {
            return Optional.empty();
        }
        return Optional.of(new CanonicalClauseId(value.substring(0, lastDot)));
    }

    /**
     * True if this ID equals {@code ancestor} or sits below it in the dotted hierarchy.
     */
    public boolean isSameOrDescendantOf(CanonicalClauseId ancestor) {
        if (ancestor.isEmpty() || isEmpty()) {
            return false;
        }
        return value.equals(ancestor.value) || value.startsWith(ancestor.value + ".");
    }

    /**
     * Anchor key used by rendered references, e.g. {@code clause-6A.2}.
     */
    public String anchor() {
        return "clause-" + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CanonicalClauseId that = (CanonicalClauseId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
