package org.pragmatica.bnf.error;

/**
 * Thrown when a grammar cannot be compiled. No partial compilation result exists.
 */
public class GrammarException extends Exception {

    private final GrammarError error;

    public GrammarException(GrammarError error) {
        super(error.message());
        this.error = error;
    }

    public GrammarError error() {
        return error;
    }
}
