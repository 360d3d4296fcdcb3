package org.pragmatica.bnf.grammar;

import org.pragmatica.bnf.tree.SourceSpan;

/**
 * Token types for the grammar lexer.
 */
public sealed interface GrammarToken {
    SourceSpan span();

    // Identifiers and patterns
    record Identifier(SourceSpan span, String name) implements GrammarToken {}

    record StringLiteral(SourceSpan span, String source) implements GrammarToken {}

    record CharSetLiteral(SourceSpan span, String source) implements GrammarToken {}

    record CharLiteral(SourceSpan span, String source) implements GrammarToken {}

    record Docstring(SourceSpan span, String text) implements GrammarToken {}

    // ::=
    record Produces(SourceSpan span) implements GrammarToken {}

    // :==
    record Matches(SourceSpan span) implements GrammarToken {}

    // ->
    record Arrow(SourceSpan span) implements GrammarToken {}

    // |
    record Pipe(SourceSpan span) implements GrammarToken {}

    // ;
    record Semicolon(SourceSpan span) implements GrammarToken {}

    // ?
    record Question(SourceSpan span) implements GrammarToken {}

    // *
    record Star(SourceSpan span) implements GrammarToken {}

    // +
    record Plus(SourceSpan span) implements GrammarToken {}

    // (
    record LParen(SourceSpan span) implements GrammarToken {}

    // )
    record RParen(SourceSpan span) implements GrammarToken {}

    // Special
    record Eof(SourceSpan span) implements GrammarToken {}

    record Error(SourceSpan span, String message) implements GrammarToken {}
}
