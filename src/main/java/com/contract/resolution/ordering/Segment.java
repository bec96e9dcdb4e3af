package com.contract.resolution.ordering;

import java.math.BigInteger;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One dotted segment of a clause ID, parsed once into a numeric or text variant.
 */
public sealed interface Segment permits Segment.Numeric, Segment.Text {

    Segment ZERO = new Numeric(BigInteger.ZERO);

    /**
     * Parses a segment. All-digit segments are numeric, everything else is text.
     */
    static Segment parse(String raw) {
        Objects.requireNonNull(raw, "raw is required");
        if (!raw.isEmpty() && raw.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return new Numeric(new BigInteger(raw));
        }
        return new Text(raw);
    }

    /**
     * A segment made of digits only, e.g. {@code 14}.
     */
    record Numeric(BigInteger value) implements Segment {
        public Numeric {
            Objects.requireNonNull(value, "value is required");
        }
    }

    /**
     * Any other segment, e.g. {@code 6A} or {@code B}.
     */
    record Text(String value) implements Segment {
        private static final Pattern LEADING_INTEGER = Pattern.compile("^(\\d+)(.*)$", Pattern.DOTALL);

        public Text {
            Objects.requireNonNull(value, "value is required");
        }

        /**
         * The integer the text starts with, or null when it starts with a non-digit.
         */
        public BigInteger leadingInteger() {
            Matcher m = LEADING_INTEGER.matcher(value);
            return m.matches() ? new BigInteger(m.group(1)) : null;
        }

        /**
         * The text after the leading integer; the whole value when there is none.
         */
        public String suffix() {
            Matcher m = LEADING_INTEGER.matcher(value);
            return m.matches() ? m.group(2) : value;
        }
    }
}
