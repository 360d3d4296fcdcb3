package org.pragmatica.bnf.error;

import com.google.common.collect.ImmutableList;
import org.pragmatica.bnf.tree.SourceSpan;

import java.util.List;

/**
 * Rust-style rendering of grammar, lexer and parser errors.
 *
 * <p>Example output:
 * <pre>
 * error[G0004]: Invalid escape sequence '#q' in rule 'name' at 1:11
 *   --> calc.bnf:1:11
 *    |
 *  1 | name :== '#q' ;
 *    |           ^^ invalid escape
 *    |
 * </pre>
 *
 * @param code    stable error code, such as {@code G0001}
 * @param message primary error message
 * @param span    offending text, underlined with carets
 * @param label   text printed after the carets
 * @param notes   trailing notes, help lines included
 */
public record Diagnostic(String code, String message, SourceSpan span, String label, List<String> notes) {

    public Diagnostic {
        notes = ImmutableList.copyOf(notes);
    }

    /**
     * Diagnostic for a grammar compilation error, labeled at the offending grammar text.
     */
    public static Diagnostic of(GrammarError error) {
        var span = error.span();
        var message = error.message();
        if (error instanceof GrammarError.Syntax) {
            return new Diagnostic("G0001", message, span, "syntax error", List.of());
        }
        if (error instanceof GrammarError.ConflictingKind conflict) {
            return new Diagnostic("G0002", message, span, "redefined here", List.of())
                .withHelp("a rule name keeps the kind of its first definition (" + conflict.existing().display() + ")");
        }
        if (error instanceof GrammarError.EmptyLiteral) {
            return new Diagnostic("G0003", message, span, "empty literal", List.of())
                .withHelp("use '?' to make an element optional");
        }
        if (error instanceof GrammarError.InvalidEscape) {
            return new Diagnostic("G0004", message, span, "invalid escape", List.of());
        }
        if (error instanceof GrammarError.RecursiveToken) {
            return new Diagnostic("G0005", message, span, "defined here", List.of())
                .withHelp("only production rules (::=) may be recursive");
        }
        if (error instanceof GrammarError.DuplicateVariantName) {
            return new Diagnostic("G0006", message, span, "duplicate name", List.of());
        }
        if (error instanceof GrammarError.UndefinedRule) {
            return new Diagnostic("G0007", message, span, "not defined", List.of());
        }
        return new Diagnostic("G0008", message, span, "invalid reference", List.of());
    }

    public static Diagnostic of(LexError error) {
        return new Diagnostic("L0001", error.message(), SourceSpan.at(error.location()), "no token matches here", List.of());
    }

    public static Diagnostic of(ParseError error) {
        var span = SourceSpan.at(error.location());
        var message = error.message();
        if (error instanceof ParseError.NoAlternativeMatched noMatch) {
            return new Diagnostic("P0001", message, span, "found " + noMatch.found(), List.of())
                .withHelp("expected " + String.join(" or ", noMatch.triedRules()));
        }
        if (error instanceof ParseError.NoProgress) {
            return new Diagnostic("P0002", message, span, "left recursion", List.of())
                .withHelp("rewrite the rule so every recursive path consumes input first");
        }
        if (error instanceof ParseError.TrailingInput trailing) {
            return new Diagnostic("P0003", message, span, "unexpected " + trailing.found(), List.of());
        }
        if (error instanceof ParseError.Lex lex) {
            return of(lex.error());
        }
        return new Diagnostic("P0004", message, span, "", List.of());
    }

    public Diagnostic withNote(String note) {
        return new Diagnostic(code, message, span, label, ImmutableList.<String>builder()
                                                                       .addAll(notes)
                                                                       .add(note)
                                                                       .build());
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Render against the text the span refers to.
     *
     * @param source   grammar text or parsed input
     * @param filename shown in the {@code -->} line, may be {@code null}
     */
    public String format(String source, String filename) {
        var lines = source.split("\n", -1);
        int first = span.start().line();
        int last = Math.min(span.end().line(), lines.length);
        var gutter = " ".repeat(String.valueOf(last).length());

        var sb = new StringBuilder();
        sb.append("error[").append(code).append("]: ").append(message).append('\n');
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(':');
        }
        sb.append(span.start()).append('\n');
        sb.append(gutter).append(" |\n");

        for (int line = first; line <= last; line++) {
            var content = lines[line - 1];
            int from = line == first ? span.start().column() : 1;
            int to = line == span.end().line() ? span.end().column() : content.codePointCount(0, content.length()) + 1;

            sb.append(String.format("%" + gutter.length() + "d", line)).append(" | ").append(content).append('\n');
            sb.append(gutter).append(" | ").append(" ".repeat(from - 1)).append("^".repeat(Math.max(1, to - from)));
            if (line == last && !label.isEmpty()) {
                sb.append(' ').append(label);
            }
            sb.append('\n');
        }

        sb.append(gutter).append(" |\n");
        for (var note : notes) {
            sb.append(gutter).append(" = ").append(note).append('\n');
        }
        return sb.toString();
    }

    /**
     * Single line {@code input:line:column: error: message}.
     */
    public String formatSimple() {
        return "input:" + span.start() + ": error: " + message;
    }
}
