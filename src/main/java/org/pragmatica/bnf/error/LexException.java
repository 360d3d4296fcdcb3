package org.pragmatica.bnf.error;

/**
 * Thrown by the tokenizer when no rule matches at the current location.
 */
public class LexException extends Exception {

    private final LexError error;

    public LexException(LexError error) {
        super(error.message());
        this.error = error;
    }

    public LexError error() {
        return error;
    }
}
