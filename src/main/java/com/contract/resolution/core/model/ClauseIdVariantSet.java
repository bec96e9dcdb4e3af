package com.contract.resolution.core.model;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * A canonical clause ID together with the alternate spellings used for fuzzy lookup.
 * The canonical ID stays the primary key; alternates form a secondary index only.
 * Iteration order is stable: canonical first, then alternates in generation order.
 */
public final class ClauseIdVariantSet {

    private static final ClauseIdVariantSet EMPTY =
            new ClauseIdVariantSet(CanonicalClauseId.EMPTY, Set.of());

    private final CanonicalClauseId canonical;
    private final Set<String> alternates;

    private ClauseIdVariantSet(CanonicalClauseId canonical, Set<String> alternates) {
        this.canonical = canonical;
        this.alternates = alternates;
    }

    public static ClauseIdVariantSet empty() {
        return EMPTY;
    }

    /**
     * Creates a variant set. The canonical value is removed from the alternates if present.
     */
    public static ClauseIdVariantSet of(CanonicalClauseId canonical, Set<String> alternates) {
        Objects.requireNonNull(canonical, "canonical is required");
        if (canonical.isEmpty()) {
            return EMPTY;
        }
        Set<String> copy = new LinkedHashSet<>(alternates != null ? alternates : Set.of());
        copy.remove(canonical.value());
        copy.removeIf(String::isEmpty);
        return new ClauseIdVariantSet(canonical, Collections.unmodifiableSet(copy));
    }

    public CanonicalClauseId canonical() {
        return canonical;
    }

    /**
     * Alternate spellings, excluding the canonical value.
     */
    public Set<String> alternates() {
        return alternates;
    }

    /**
     * Every spelling, canonical first.
     */
    public Set<String> all() {
        if (canonical.isEmpty()) {
            return Set.of();
        }
        Set<String> all = new LinkedHashSet<>();
        all.add(canonical.value());
        all.addAll(alternates);
        return Collections.unmodifiableSet(all);
    }

    public boolean contains(String spelling) {
        if (spelling == null || canonical.isEmpty()) {
            return false;
        }
        return canonical.value().equals(spelling) || alternates.contains(spelling);
    }

    public boolean isEmpty() {
        return canonical.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClauseIdVariantSet that = (ClauseIdVariantSet) o;
        return canonical.equals(that.canonical) && alternates.equals(that.alternates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(canonical, alternates);
    }

    @Override
    public String toString() {
        return "ClauseIdVariantSet{" + all() + '}';
    }
}
