package org.pragmatica.bnf.grammar;

import org.pragmatica.bnf.pattern.CodepointMatcher;
import org.pragmatica.bnf.tree.SourceSpan;

import java.util.List;

/**
 * Rule body building blocks: alternation of concatenations of repeated singulars.
 */
public sealed interface Expression {

    /**
     * Source location of this expression in the grammar.
     */
    SourceSpan span();

    /**
     * Ordered alternatives: {@code a | b | c}
     */
    record Alternation(SourceSpan span, List<Alternative> alternatives) implements Expression {
        public Alternation {
            alternatives = List.copyOf(alternatives);
        }
    }

    /**
     * Sequence: {@code a b c}
     */
    record Concatenation(SourceSpan span, List<Repetition> elements) implements Expression {
        public Concatenation {
            elements = List.copyOf(elements);
        }
    }

    /**
     * A singular with its quantifier: {@code a}, {@code a?}, {@code a*}, {@code a+}
     */
    record Repetition(SourceSpan span, Singular inner, Quantifier quantifier) implements Expression {}

    /**
     * Atom of a concatenation.
     */
    sealed interface Singular extends Expression {}

    /**
     * Parenthesized alternation: {@code ( a | b )}
     */
    record Nested(SourceSpan span, Alternation alternation) implements Singular {}

    /**
     * Rule reference: {@code name}
     */
    record SymbolRef(SourceSpan span, String name) implements Singular {}

    /**
     * String literal or bare escape, resolved to its code points. {@code source} is the grammar text.
     */
    record Literal(SourceSpan span, String source, String text) implements Singular {}

    /**
     * Character set: {@code [a-z]}, {@code [^#n]}
     */
    record CharacterSet(SourceSpan span, String source, CodepointMatcher matcher) implements Singular {}
}
