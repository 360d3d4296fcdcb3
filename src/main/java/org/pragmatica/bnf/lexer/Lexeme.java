package org.pragmatica.bnf.lexer;

import org.pragmatica.bnf.tree.SourceLocation;
import org.pragmatica.bnf.tree.SourceSpan;
import org.pragmatica.bnf.tree.Token;

/**
 * One tokenizer step: an emitted token or dropped whitespace.
 */
public sealed interface Lexeme {
    SourceSpan span();

    /**
     * Location right after the match, where the next step starts.
     */
    default SourceLocation end() {
        return span().end();
    }

    record Emit(Token token) implements Lexeme {
        @Override
        public SourceSpan span() {
            return token.span();
        }
    }

    record Drop(SourceSpan span) implements Lexeme {}
}
