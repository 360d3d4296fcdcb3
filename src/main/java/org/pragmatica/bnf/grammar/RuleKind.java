package org.pragmatica.bnf.grammar;

/**
 * Classification of a rule by its defining operator.
 */
public enum RuleKind {
    /** {@code name :== pattern ;} */
    TOKEN("token"),
    /** {@code _ :== pattern ;} */
    WHITESPACE("whitespace"),
    /** {@code name ::= alternatives ;} */
    PRODUCTION("production");

    private final String display;

    RuleKind(String display) {
        this.display = display;
    }

    public String display() {
        return display;
    }

    /**
     * Token and whitespace rules are patterns matched at the lexical level.
     */
    public boolean isLexical() {
        return this != PRODUCTION;
    }
}
