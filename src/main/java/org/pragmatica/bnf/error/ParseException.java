package org.pragmatica.bnf.error;

/**
 * Thrown when input does not parse against a compiled grammar.
 */
public class ParseException extends Exception {

    private final ParseError error;

    public ParseException(ParseError error) {
        super(error.message());
        this.error = error;
    }

    public ParseException(LexException cause) {
        super(cause.getMessage(), cause);
        this.error = new ParseError.Lex(cause.error());
    }

    public ParseError error() {
        return error;
    }
}
