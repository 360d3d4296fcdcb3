package org.pragmatica.bnf.grammar;

import org.pragmatica.bnf.tree.SourceSpan;

import java.util.Optional;

/**
 * One alternative of an alternation, with its optional docstring and {@code -> name} suffix.
 * Names and docs are only meaningful on top-level alternatives of production rules.
 */
public record Alternative(
 Optional<String> doc,
 Optional<String> name,
 Expression.Concatenation body,
 SourceSpan span) {

    public static Alternative of(Expression.Concatenation body) {
        return new Alternative(Optional.empty(), Optional.empty(), body, body.span());
    }

    public Alternative withBody(Expression.Concatenation newBody) {
        return new Alternative(doc, name, newBody, span);
    }
}
