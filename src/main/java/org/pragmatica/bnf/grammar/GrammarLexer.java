package org.pragmatica.bnf.grammar;

import org.pragmatica.bnf.pattern.Escapes;
import org.pragmatica.bnf.tree.SourceLocation;
import org.pragmatica.bnf.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Lexer for the meta-grammar. Pattern tokens keep their raw source text; escapes are resolved later by the
 * pattern compiler.
 */
public final class GrammarLexer {
    private static final int MAX_INPUT_SIZE = 1_000_000;

    private final String input;
    private int pos;
    private SourceLocation location;

    private GrammarLexer(String input) {
        this.input = input;
        this.pos = 0;
        this.location = SourceLocation.START;
    }

    /**
     * Tokenize grammar text. Lexical problems, oversized input included, end the list with an
     * {@link GrammarToken.Error} token instead of {@link GrammarToken.Eof}.
     */
    public static List<GrammarToken> tokenize(String input) {
        if (input.length() > MAX_INPUT_SIZE) {
            return List.of(new GrammarToken.Error(SourceSpan.at(SourceLocation.START),
                                                  "Grammar input exceeds maximum size of " + MAX_INPUT_SIZE + " characters"));
        }
        return new GrammarLexer(input).tokenizeAll();
    }

    private List<GrammarToken> tokenizeAll() {
        var tokens = new ArrayList<GrammarToken>();
        while (!isAtEnd()) {
            var token = skipWhitespaceAndComments();
            if (token != null) {
                tokens.add(token);
                if (token instanceof GrammarToken.Error) {
                    return tokens;
                }
                continue;
            }
            if (!isAtEnd()) {
                var next = nextToken();
                tokens.add(next);
                if (next instanceof GrammarToken.Error) {
                    return tokens;
                }
            }
        }
        tokens.add(new GrammarToken.Eof(SourceSpan.at(location)));
        return tokens;
    }

    private GrammarToken nextToken() {
        var start = location;
        char c = peek();
        if (isIdentifierStart(c)) {
            return scanIdentifier(start);
        }
        if (c == '\'' || c == '"') {
            return scanDelimited(start, c, "string literal");
        }
        if (c == '[') {
            return scanDelimited(start, ']', "character set");
        }
        if (c == Escapes.ESCAPE) {
            return scanCharLiteral(start);
        }
        return scanOperator(start);
    }

    private GrammarToken scanIdentifier(SourceLocation start) {
        int begin = pos;
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        return new GrammarToken.Identifier(span(start), input.substring(begin, pos));
    }

    /**
     * Scan a quoted literal or a character set. {@code #} always takes the following character with it,
     * so escaped delimiters do not close the token.
     */
    private GrammarToken scanDelimited(SourceLocation start, char close, String what) {
        int begin = pos;
        advance();
        while (!isAtEnd() && peek() != close && peek() != '\n') {
            if (peek() == Escapes.ESCAPE && pos + 1 < input.length() && input.charAt(pos + 1) != '\n') {
                advance();
            }
            advance();
        }
        if (isAtEnd() || peek() != close) {
            return new GrammarToken.Error(span(start), "Unterminated " + what);
        }
        advance();
        var source = input.substring(begin, pos);
        return close == ']'
               ? new GrammarToken.CharSetLiteral(span(start), source)
               : new GrammarToken.StringLiteral(span(start), source);
    }

    private GrammarToken scanCharLiteral(SourceLocation start) {
        int begin = pos;
        int length = Escapes.extent(input, pos);
        for (int i = 0; i < length; i++) {
            advance();
        }
        return new GrammarToken.CharLiteral(span(start), input.substring(begin, pos));
    }

    private GrammarToken scanOperator(SourceLocation start) {
        if (lookingAt("::=")) {
            advanceBy(3);
            return new GrammarToken.Produces(span(start));
        }
        if (lookingAt(":==")) {
            advanceBy(3);
            return new GrammarToken.Matches(span(start));
        }
        if (lookingAt("->")) {
            advanceBy(2);
            return new GrammarToken.Arrow(span(start));
        }
        int c = input.codePointAt(pos);
        advance();
        return switch (c) {
            case '|' -> new GrammarToken.Pipe(span(start));
            case ';' -> new GrammarToken.Semicolon(span(start));
            case '?' -> new GrammarToken.Question(span(start));
            case '*' -> new GrammarToken.Star(span(start));
            case '+' -> new GrammarToken.Plus(span(start));
            case '(' -> new GrammarToken.LParen(span(start));
            case ')' -> new GrammarToken.RParen(span(start));
            default -> new GrammarToken.Error(span(start), "Unexpected character: " + Character.toString(c));
        };
    }

    /**
     * Skip blanks and comments. Returns a docstring token when one is found, an error token for an
     * unterminated comment, or null.
     */
    private GrammarToken skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n') {
                advance();
            } else if (CommentMatcher.startsAt(input, pos)) {
                var start = location;
                var comment = CommentMatcher.match(input, pos);
                if (comment.isEmpty()) {
                    advanceBy(input.length() - pos);
                    return new GrammarToken.Error(span(start), "Unterminated comment");
                }
                advanceBy(comment.get()
                                 .end() - pos);
                if (comment.get()
                           .doc()) {
                    return new GrammarToken.Docstring(span(start),
                                                      comment.get()
                                                             .docText());
                }
            } else {
                break;
            }
        }
        return null;
    }

    private boolean lookingAt(String text) {
        return input.startsWith(text, pos);
    }

    private boolean isAtEnd() {
        return pos >= input.length();
    }

    private char peek() {
        return input.charAt(pos);
    }

    private void advance() {
        int cp = input.codePointAt(pos);
        pos += Character.charCount(cp);
        location = location.advance(cp);
    }

    private void advanceBy(int chars) {
        int end = pos + chars;
        while (pos < end) {
            advance();
        }
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, location);
    }

    private boolean isIdentifierStart(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }

    private boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || (c >= '0' && c <= '9');
    }
}
