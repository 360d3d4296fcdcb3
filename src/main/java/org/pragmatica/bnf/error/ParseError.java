package org.pragmatica.bnf.error;

import org.pragmatica.bnf.tree.SourceLocation;

import java.util.List;

/**
 * Parse error with location and context information. Terminates the parse call, no partial tree is kept.
 */
public sealed interface ParseError {
    SourceLocation location();

    String message();

    /**
     * Every alternative failed; reported at the furthest position reached with the rules tried there.
     */
    record NoAlternativeMatched(
    SourceLocation location,
    List<String> triedRules,
    String found) implements ParseError {
        public NoAlternativeMatched {
            triedRules = List.copyOf(triedRules);
        }

        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected " + String.join(" or ", triedRules);
        }
    }

    /**
     * A rule was re-entered at the position where it is already active (left recursion).
     */
    record NoProgress(
    SourceLocation location,
    String ruleName) implements ParseError {
        @Override
        public String message() {
            return "Rule '" + ruleName + "' recursed without consuming input at " + location;
        }
    }

    /**
     * The start rule matched but input remains.
     */
    record TrailingInput(
    SourceLocation location,
    String found) implements ParseError {
        @Override
        public String message() {
            return "Unexpected " + found + " at " + location + ", expected end of input";
        }
    }

    /**
     * The requested start symbol is not a production rule.
     */
    record UnknownRule(
    SourceLocation location,
    String ruleName) implements ParseError {
        @Override
        public String message() {
            return "Unknown production rule: " + ruleName;
        }
    }

    /**
     * Tokenizing failed while the parser pulled tokens.
     */
    record Lex(LexError error) implements ParseError {
        @Override
        public SourceLocation location() {
            return error.location();
        }

        @Override
        public String message() {
            return error.message();
        }
    }
}
