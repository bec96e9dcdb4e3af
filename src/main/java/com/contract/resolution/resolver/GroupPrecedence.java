package com.contract.resolution.resolver;

import com.contract.resolution.core.model.Document;

import java.util.OptionalInt;

/**
 * Fixed precedence between document groups: A &gt; B &gt; D &gt; C(particular) &gt; C(general).
 * Bills of Quantities (I) and Schedules (N) carry no rank.
 */
public final class GroupPrecedence {

    private GroupPrecedence() {
    }

    public static OptionalInt rank(Document document) {
        return switch (document.getGroup()) {
            case A -> OptionalInt.of(100);
            case B -> OptionalInt.of(90);
            case D -> OptionalInt.of(80);
            case C -> OptionalInt.of(document.isParticularConditions() ? 75 : 70);
            case I, N -> OptionalInt.empty();
        };
    }

    /**
     * Positive if {@code a} outranks {@code b}, negative if {@code b} outranks {@code a},
     * zero when they share a rank or either is unranked.
     */
    public static int compare(Document a, Document b) {
        OptionalInt ra = rank(a);
        OptionalInt rb = rank(b);
        if (ra.isEmpty() || rb.isEmpty()) {
            return 0;
        }
        return Integer.compare(ra.getAsInt(), rb.getAsInt());
    }
}
