package org.pragmatica.bnf.parser;

import org.pragmatica.bnf.tree.AstNode;

/**
 * Outcome of one production invocation, as kept in the packrat cache.
 */
public sealed interface ParseResult {
    Failure FAILURE = new Failure();

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Matched node and the cursor state right after it.
     */
    record Success(AstNode node, ParsingContext.Mark end) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }
    }

    /**
     * No alternative matched. Details live in the context's furthest-failure record.
     */
    record Failure() implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }
    }
}
