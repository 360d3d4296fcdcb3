package org.pragmatica.bnf.grammar;

/**
 * Repetition suffix of a singular.
 */
public enum Quantifier {
    ONE,
    MAYBE,
    ANY,
    MANY;

    public boolean isOptional() {
        return this == MAYBE || this == ANY;
    }

    public boolean isRepeated() {
        return this == ANY || this == MANY;
    }
}
