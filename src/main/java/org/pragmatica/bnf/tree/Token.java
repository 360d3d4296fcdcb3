package org.pragmatica.bnf.tree;

/**
 * A token emitted by the tokenizer or matched directly by the parser.
 * Synthetic token rules lifted from production literals are named after their source text, e.g. {@code "if"}.
 */
public record Token(String rule, String text, SourceSpan span) implements Node {

    public int length() {
        return text.length();
    }

    @Override
    public String toString() {
        return rule + "('" + text + "')@" + span.start();
    }
}
