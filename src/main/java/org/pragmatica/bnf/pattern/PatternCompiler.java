package org.pragmatica.bnf.pattern;

import org.pragmatica.bnf.error.GrammarError;
import org.pragmatica.bnf.error.GrammarException;
import org.pragmatica.bnf.tree.SourceSpan;

/**
 * Compiles the source text of string literals, character sets and bare escapes into code point matchers.
 *
 * <p>Instances are single-use: one per compiled pattern, carrying the pattern's grammar span and rule name
 * for error reporting.
 */
public final class PatternCompiler {
    private final String source;
    private final SourceSpan span;
    private final String rule;
    private int pos;

    private PatternCompiler(String source, SourceSpan span, String rule) {
        this.source = source;
        this.span = span;
        this.rule = rule;
    }

    /**
     * Compile a quoted literal ({@code '...'} or {@code "..."}) into its code point sequence.
     */
    public static String compileLiteral(String source, SourceSpan span, String rule) throws GrammarException {
        return new PatternCompiler(source, span, rule).literal();
    }

    /**
     * Compile a bracketed character set ({@code [...]}, {@code [^...]}).
     */
    public static CodepointMatcher compileCharacterSet(String source, SourceSpan span, String rule) throws GrammarException {
        return new PatternCompiler(source, span, rule).characterSet();
    }

    /**
     * Compile a bare escape such as {@code #n} or {@code #x41} into the code point it denotes.
     */
    public static int compileCharacter(String source, SourceSpan span, String rule) throws GrammarException {
        var compiler = new PatternCompiler(source, span, rule);
        int codePoint = compiler.escape();
        if (compiler.pos != source.length()) {
            throw compiler.syntax("Unexpected text after escape", compiler.pos, source.length());
        }
        return codePoint;
    }

    private String literal() throws GrammarException {
        pos = 1;
        int end = source.length() - 1;
        var text = new StringBuilder();
        while (pos < end) {
            text.appendCodePoint(unit());
        }
        if (text.length() == 0) {
            throw new GrammarException(new GrammarError.EmptyLiteral(span, rule));
        }
        return text.toString();
    }

    private CodepointMatcher characterSet() throws GrammarException {
        pos = 1;
        int end = source.length() - 1;
        var builder = CodepointMatcher.builder();
        if (pos < end && source.charAt(pos) == '^') {
            builder.negated(true);
            pos++;
        } else if (pos == end) {
            throw syntax("Empty character set", 0, source.length());
        }
        while (pos < end) {
            int entryStart = pos;
            int from = setUnit();
            if (pos < end && source.charAt(pos) == '-') {
                pos++;
                if (pos >= end) {
                    throw syntax("Dangling '-' in character set", pos - 1, pos);
                }
                int to = setUnit();
                if (from > to) {
                    throw syntax("Reversed range in character set", entryStart, pos);
                }
                builder.addRange(from, to);
            } else {
                builder.add(from);
            }
        }
        return builder.build();
    }

    private int setUnit() throws GrammarException {
        char c = source.charAt(pos);
        if (c == '^' || c == '-' || c == ']') {
            throw syntax("Unescaped '" + c + "' in character set", pos, pos + 1);
        }
        return unit();
    }

    private int unit() throws GrammarException {
        if (source.charAt(pos) == Escapes.ESCAPE) {
            return escape();
        }
        int codePoint = source.codePointAt(pos);
        pos += Character.charCount(codePoint);
        return codePoint;
    }

    private int escape() throws GrammarException {
        var escape = Escapes.decode(source, pos);
        if (escape.isEmpty()) {
            int length = Escapes.extent(source, pos);
            var text = source.substring(pos, pos + length);
            throw new GrammarException(new GrammarError.InvalidEscape(subSpan(pos, pos + length), rule, text));
        }
        pos += escape.get()
                     .length();
        return escape.get()
                     .codePoint();
    }

    private GrammarException syntax(String reason, int from, int to) {
        return new GrammarException(new GrammarError.Syntax(subSpan(from, to), rule, reason));
    }

    private SourceSpan subSpan(int from, int to) {
        var start = span.start()
                        .advance(source, 0, from);
        var end = start.advance(source, from, to);
        return SourceSpan.of(start, end);
    }
}
