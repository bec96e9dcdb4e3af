package com.contract.resolution.ordering;

import com.contract.resolution.core.model.CanonicalClauseId;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Natural order over clause IDs: {@code 2 < 2.1 < 2A < 10 < 10.1}.
 *
 * <p>IDs are compared segment by segment, a missing segment counting as {@code 0}.
 * Segments that start with an integer compare by that integer first, then by the
 * remaining text case-insensitively, and sort before segments that start with a letter.
 * Ties are broken by segment count and then by the raw string, so the order is total
 * and consistent with {@code equals}.</p>
 */
public final class ClauseIdComparator implements Comparator<CanonicalClauseId> {

    public static final ClauseIdComparator INSTANCE = new ClauseIdComparator();

    private ClauseIdComparator() {
    }

    @Override
    public int compare(CanonicalClauseId a, CanonicalClauseId b) {
        return compareRaw(a.value(), b.value());
    }

    /**
     * Same order applied to raw strings, for callers that hold canonical text only.
     */
    public static int compareRaw(String a, String b) {
        List<Segment> left = parse(a);
        List<Segment> right = parse(b);
        int length = Math.max(left.size(), right.size());
        for (int i = 0; i < length; i++) {
            Segment x = i < left.size() ? left.get(i) : Segment.ZERO;
            Segment y = i < right.size() ? right.get(i) : Segment.ZERO;
            int cmp = compareSegments(x, y);
            if (cmp != 0) {
                return cmp;
            }
        }
        int bySize = Integer.compare(left.size(), right.size());
        if (bySize != 0) {
            return bySize;
        }
        return a.compareTo(b);
    }

    static int compareSegments(Segment x, Segment y) {
        if (x instanceof Segment.Numeric nx && y instanceof Segment.Numeric ny) {
            return nx.value().compareTo(ny.value());
        }
        BigInteger lx = leadingInteger(x);
        BigInteger ly = leadingInteger(y);
        if (lx != null && ly != null) {
            int byNumber = lx.compareTo(ly);
            if (byNumber != 0) {
                return byNumber;
            }
            return String.CASE_INSENSITIVE_ORDER.compare(suffix(x), suffix(y));
        }
        if (lx != null) {
            return -1;
        }
        if (ly != null) {
            return 1;
        }
        return String.CASE_INSENSITIVE_ORDER.compare(suffix(x), suffix(y));
    }

    private static BigInteger leadingInteger(Segment segment) {
        if (segment instanceof Segment.Numeric numeric) {
            return numeric.value();
        }
        return ((Segment.Text) segment).leadingInteger();
    }

    private static String suffix(Segment segment) {
        if (segment instanceof Segment.Numeric) {
            return "";
        }
        return ((Segment.Text) segment).suffix();
    }

    private static List<Segment> parse(String value) {
        List<Segment> segments = new ArrayList<>();
        if (value.isEmpty()) {
            return segments;
        }
        for (String part : value.split("\\.", -1)) {
            segments.add(Segment.parse(part));
        }
        return segments;
    }
}
