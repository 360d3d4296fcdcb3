package org.pragmatica.bnf.grammar;

import com.google.common.collect.ImmutableList;
import org.pragmatica.bnf.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * A merged grammar rule.
 *
 * @param name         rule name; synthetic token rules are named after their literal source text
 * @param kind         token, whitespace or production
 * @param alternatives alternatives of every definition, in source order
 * @param index        position of the first definition, used to break longest-match ties
 * @param doc          joined docstrings of all definitions
 * @param span         span of the first definition
 * @param synthetic    whether the rule was lifted from a literal inside a production
 */
public record Rule(
 String name,
 RuleKind kind,
 List<Alternative> alternatives,
 int index,
 Optional<String> doc,
 SourceSpan span,
 boolean synthetic) {

    public Rule {
        alternatives = ImmutableList.copyOf(alternatives);
    }

    public boolean isProduction() {
        return kind == RuleKind.PRODUCTION;
    }

    public boolean isToken() {
        return kind == RuleKind.TOKEN;
    }

    public boolean isWhitespace() {
        return kind == RuleKind.WHITESPACE;
    }

    /**
     * The rule body as a single alternation.
     */
    public Expression.Alternation body() {
        return new Expression.Alternation(span, alternatives);
    }

    /**
     * Every symbol reference in the body, depth-first in source order.
     */
    public List<Expression.SymbolRef> references() {
        var refs = ImmutableList.<Expression.SymbolRef>builder();
        collect(body(), refs);
        return refs.build();
    }

    private static void collect(Expression.Alternation alternation, ImmutableList.Builder<Expression.SymbolRef> refs) {
        for (var alternative : alternation.alternatives()) {
            for (var repetition : alternative.body()
                                             .elements()) {
                var inner = repetition.inner();
                if (inner instanceof Expression.SymbolRef ref) {
                    refs.add(ref);
                } else if (inner instanceof Expression.Nested nested) {
                    collect(nested.alternation(), refs);
                }
            }
        }
    }
}
