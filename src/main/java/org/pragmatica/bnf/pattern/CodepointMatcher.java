package org.pragmatica.bnf.pattern;

import com.google.errorprone.annotations.CanIgnoreReturnValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;

/**
 * Compiled predicate over a single code point: sorted, merged inclusive ranges plus a negation flag.
 */
public final class CodepointMatcher {
    private final int[] ranges;
    private final boolean negated;

    private CodepointMatcher(int[] ranges, boolean negated) {
        this.ranges = ranges;
        this.negated = negated;
    }

    public static CodepointMatcher single(int codePoint) {
        return builder().add(codePoint)
                        .build();
    }

    public static CodepointMatcher range(int from, int to) {
        return builder().addRange(from, to)
                        .build();
    }

    /**
     * Matches every code point.
     */
    public static CodepointMatcher any() {
        return new CodepointMatcher(new int[0], true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean matches(int codePoint) {
        return contains(codePoint) != negated;
    }

    public CodepointMatcher negate() {
        return new CodepointMatcher(ranges, !negated);
    }

    /**
     * Number of inclusive ranges after merging.
     */
    public int rangeCount() {
        return ranges.length / 2;
    }

    private boolean contains(int codePoint) {
        int low = 0;
        int high = ranges.length / 2 - 1;
        while (low <= high) {
            int mid = (low + high) >>> 1;
            if (codePoint < ranges[2 * mid]) {
                high = mid - 1;
            } else if (codePoint > ranges[2 * mid + 1]) {
                low = mid + 1;
            } else {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof CodepointMatcher matcher
               && negated == matcher.negated
               && Arrays.equals(ranges, matcher.ranges);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(ranges) * 31 + Boolean.hashCode(negated);
    }

    @Override
    public String toString() {
        var sb = new StringBuilder("[");
        if (negated) {
            sb.append('^');
        }
        for (int i = 0; i < ranges.length; i += 2) {
            appendCodePoint(sb, ranges[i]);
            if (ranges[i + 1] != ranges[i]) {
                sb.append('-');
                appendCodePoint(sb, ranges[i + 1]);
            }
        }
        return sb.append(']')
                 .toString();
    }

    private static void appendCodePoint(StringBuilder sb, int codePoint) {
        if (codePoint < 0x20 || codePoint == 0x7F) {
            sb.append(String.format("#x%02X", codePoint));
        } else if ("^-]#".indexOf(codePoint) >= 0) {
            sb.append('#')
              .appendCodePoint(codePoint);
        } else {
            sb.appendCodePoint(codePoint);
        }
    }

    public static final class Builder {
        private final List<int[]> entries = new ArrayList<>();
        private boolean negated;

        private Builder() {}

        @CanIgnoreReturnValue
        public Builder add(int codePoint) {
            return addRange(codePoint, codePoint);
        }

        @CanIgnoreReturnValue
        public Builder addRange(int from, int to) {
            if (from > to || from < 0 || to > Character.MAX_CODE_POINT) {
                throw new IllegalArgumentException("Invalid code point range " + from + ".." + to);
            }
            entries.add(new int[]{from, to});
            return this;
        }

        @CanIgnoreReturnValue
        public Builder negated(boolean negated) {
            this.negated = negated;
            return this;
        }

        public CodepointMatcher build() {
            var sorted = new ArrayList<>(entries);
            sorted.sort(Comparator.comparingInt(entry -> entry[0]));
            var merged = new ArrayList<int[]>();
            for (var entry : sorted) {
                if (!merged.isEmpty() && entry[0] <= merged.get(merged.size() - 1)[1] + 1) {
                    var last = merged.get(merged.size() - 1);
                    last[1] = Math.max(last[1], entry[1]);
                } else {
                    merged.add(new int[]{entry[0], entry[1]});
                }
            }
            var flat = new int[merged.size() * 2];
            for (int i = 0; i < merged.size(); i++) {
                flat[2 * i] = merged.get(i)[0];
                flat[2 * i + 1] = merged.get(i)[1];
            }
            return new CodepointMatcher(flat, negated);
        }
    }
}
