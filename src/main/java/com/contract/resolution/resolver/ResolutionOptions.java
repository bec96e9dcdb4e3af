package com.contract.resolution.resolver;

import com.contract.resolution.core.model.DocumentGroup;

import java.util.EnumSet;
import java.util.Set;

/**
 * Options for a single effective clause resolution.
 */
public class ResolutionOptions {

    private final boolean fuzzyMatching;
    private final boolean referenceIntent;
    private final Set<DocumentGroup> groups;

    private ResolutionOptions(Builder builder) {
        this.fuzzyMatching = builder.fuzzyMatching;
        this.referenceIntent = builder.referenceIntent;
        this.groups = builder.groups.isEmpty()
                ? Set.of()
                : Set.copyOf(builder.groups);
    }

    public static ResolutionOptions defaults() {
        return builder().build();
    }

    /**
     * Whether variant spellings are tried when no chunk carries the exact ID. Default true.
     */
    public boolean isFuzzyMatching() {
        return fuzzyMatching;
    }

    /**
     * Whether OVERRIDES/AMENDS references take part in contests. Default true.
     */
    public boolean isReferenceIntent() {
        return referenceIntent;
    }

    /**
     * Groups considered; empty means all groups.
     */
    public Set<DocumentGroup> getGroups() {
        return groups;
    }

    public boolean includes(DocumentGroup group) {
        return groups.isEmpty() || groups.contains(group);
    }

    /**
     * Key fragment distinguishing cached results computed with different options.
     */
    public String cacheKey() {
        return (fuzzyMatching ? "F" : "-") + (referenceIntent ? "R" : "-")
                + (groups.isEmpty() ? "*" : EnumSet.copyOf(groups).toString());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private boolean fuzzyMatching = true;
        private boolean referenceIntent = true;
        private Set<DocumentGroup> groups = Set.of();

        public Builder fuzzyMatching(boolean fuzzyMatching) {
            this.fuzzyMatching = fuzzyMatching;
            return this;
        }

        public Builder referenceIntent(boolean referenceIntent) {
            this.referenceIntent = referenceIntent;
            return this;
        }

        public Builder groups(Set<DocumentGroup> groups) {
            this.groups = groups != null ? groups : Set.of();
            return this;
        }

        public Builder groups(DocumentGroup... groups) {
            this.groups = Set.of(groups);
            return this;
        }

        public ResolutionOptions build() {
            return new ResolutionOptions(this);
        }
    }
}
