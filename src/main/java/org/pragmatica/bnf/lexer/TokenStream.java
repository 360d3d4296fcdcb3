package org.pragmatica.bnf.lexer;

import com.google.common.collect.ImmutableList;
import org.pragmatica.bnf.error.LexException;
import org.pragmatica.bnf.tree.SourceLocation;
import org.pragmatica.bnf.tree.Token;

import java.util.Optional;

/**
 * Pull-based token sequence. Whitespace is consumed silently; a lex error leaves the position unchanged so the
 * caller may {@link #skip()} and continue.
 */
public final class TokenStream {
    private final Tokenizer tokenizer;
    private final String input;
    private SourceLocation position = SourceLocation.START;

    TokenStream(Tokenizer tokenizer, String input) {
        this.tokenizer = tokenizer;
        this.input = input;
    }

    /**
     * Next token, or empty at end of input.
     */
    public Optional<Token> next() throws LexException {
        while (!isAtEnd()) {
            var lexeme = tokenizer.next(input, position);
            position = lexeme.end();
            if (lexeme instanceof Lexeme.Emit emit) {
                return Optional.of(emit.token());
            }
        }
        return Optional.empty();
    }

    /**
     * Skip one code point.
     */
    public void skip() {
        if (!isAtEnd()) {
            position = position.advance(input.codePointAt(position.offset()));
        }
    }

    public boolean isAtEnd() {
        return position.offset() >= input.length();
    }

    public SourceLocation position() {
        return position;
    }

    public String input() {
        return input;
    }

    /**
     * Drain the remaining tokens.
     */
    public ImmutableList<Token> toList() throws LexException {
        var tokens = ImmutableList.<Token>builder();
        for (var token = next(); token.isPresent(); token = next()) {
            tokens.add(token.get());
        }
        return tokens.build();
    }
}
