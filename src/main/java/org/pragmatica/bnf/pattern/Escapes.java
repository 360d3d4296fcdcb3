package org.pragmatica.bnf.pattern;

import java.util.Optional;

/**
 * Resolution of {@code #} escape sequences.
 *
 * <p>{@code #t #n #r ## #' #" #- #^ #]} map to single characters, {@code #xHH}, {@code #uHHHH} and
 * {@code #UHHHHHHHH} give the code point in hex. Nothing else is an escape.
 */
public final class Escapes {
    public static final char ESCAPE = '#';

    private Escapes() {}

    /**
     * A resolved escape: its code point and the number of source chars it spans, including {@code #}.
     */
    public record Escape(int codePoint, int length) {}

    /**
     * Decode the escape starting at {@code text[index]}, which must be {@code #}.
     */
    public static Optional<Escape> decode(CharSequence text, int index) {
        if (index + 1 >= text.length() || text.charAt(index) != ESCAPE) {
            return Optional.empty();
        }
        char c = text.charAt(index + 1);
        return switch (c) {
            case 't' -> Optional.of(new Escape('\t', 2));
            case 'n' -> Optional.of(new Escape('\n', 2));
            case 'r' -> Optional.of(new Escape('\r', 2));
            case '#', '\'', '"', '-', '^', ']' -> Optional.of(new Escape(c, 2));
            case 'x' -> decodeHex(text, index, 2);
            case 'u' -> decodeHex(text, index, 4);
            case 'U' -> decodeHex(text, index, 8);
            default -> Optional.empty();
        };
    }

    /**
     * Length of the escape-shaped text at {@code index}, used to report an invalid escape in full.
     */
    public static int extent(CharSequence text, int index) {
        if (index + 1 >= text.length()) {
            return text.length() - index;
        }
        int digits = switch (text.charAt(index + 1)) {
            case 'x' -> 2;
            case 'u' -> 4;
            case 'U' -> 8;
            default -> 0;
        };
        int end = index + 2;
        while (digits > 0 && end < text.length() && isHexDigit(text.charAt(end))) {
            end++;
            digits--;
        }
        return end - index;
    }

    private static Optional<Escape> decodeHex(CharSequence text, int index, int digits) {
        int start = index + 2;
        if (start + digits > text.length()) {
            return Optional.empty();
        }
        int value = 0;
        for (int i = start; i < start + digits; i++) {
            int digit = hexValue(text.charAt(i));
            if (digit < 0) {
                return Optional.empty();
            }
            value = value * 16 + digit;
            if (value > Character.MAX_CODE_POINT) {
                return Optional.empty();
            }
        }
        return Optional.of(new Escape(value, digits + 2));
    }

    private static boolean isHexDigit(char c) {
        return hexValue(c) >= 0;
    }

    // ASCII only; Character.digit would also take other Unicode digits
    private static int hexValue(char c) {
        if (c >= '0' && c <= '9') {
            return c - '0';
        }
        if (c >= 'a' && c <= 'f') {
            return c - 'a' + 10;
        }
        if (c >= 'A' && c <= 'F') {
            return c - 'A' + 10;
        }
        return -1;
    }
}
