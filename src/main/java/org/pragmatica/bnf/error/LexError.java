package org.pragmatica.bnf.error;

import org.pragmatica.bnf.tree.SourceLocation;

import java.util.List;

/**
 * Tokenizer error. Recovery (skip one code point and retry) is up to the caller.
 */
public sealed interface LexError {
    SourceLocation location();

    String message();

    /**
     * No token rule and no whitespace matches at the location.
     */
    record UnrecognizedCharacter(SourceLocation location, String found, List<String> triedRules) implements LexError {
        public UnrecognizedCharacter {
            triedRules = List.copyOf(triedRules);
        }

        @Override
        public String message() {
            return "Unrecognized character '" + found + "' at " + location;
        }
    }
}
