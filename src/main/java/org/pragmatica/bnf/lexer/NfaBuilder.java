package org.pragmatica.bnf.lexer;

import com.google.common.base.Preconditions;
import com.google.common.primitives.Ints;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.pragmatica.bnf.grammar.Alternative;
import org.pragmatica.bnf.grammar.Expression;
import org.pragmatica.bnf.grammar.Quantifier;
import org.pragmatica.bnf.grammar.Rule;
import org.pragmatica.bnf.pattern.CodepointMatcher;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thompson construction of lexical rule bodies. References to other lexical rules are inlined, which is safe
 * because recursion among them is rejected beforehand.
 */
final class NfaBuilder {
    private final Map<String, Rule> lexical;
    private final List<CodepointMatcher> edges = new ArrayList<>();
    private final List<Integer> next = new ArrayList<>();
    private final List<List<Integer>> epsilons = new ArrayList<>();
    private final List<Integer> accepts = new ArrayList<>();

    /**
     * Partial machine with one entry and one exit state.
     */
    record Machine(int start, int end) {}

    NfaBuilder(Map<String, Rule> lexical) {
        this.lexical = lexical;
    }

    int state() {
        edges.add(null);
        next.add(-1);
        epsilons.add(new ArrayList<>());
        accepts.add(Nfa.NO_SLOT);
        return edges.size() - 1;
    }

    void epsilon(int from, int to) {
        epsilons.get(from)
                .add(to);
    }

    void accept(int state, int slot) {
        accepts.set(state, slot);
    }

    @CanIgnoreReturnValue
    int transition(int from, CodepointMatcher matcher) {
        int to = state();
        edges.set(from, matcher);
        next.set(from, to);
        return to;
    }

    Machine rule(Rule rule) {
        return alternation(rule.alternatives());
    }

    private Machine alternation(List<Alternative> alternatives) {
        if (alternatives.size() == 1) {
            return concatenation(alternatives.get(0)
                                             .body());
        }
        int start = state();
        int end = state();
        for (var alternative : alternatives) {
            var machine = concatenation(alternative.body());
            epsilon(start, machine.start());
            epsilon(machine.end(), end);
        }
        return new Machine(start, end);
    }

    private Machine concatenation(Expression.Concatenation concatenation) {
        Machine result = null;
        for (var element : concatenation.elements()) {
            var machine = repetition(element);
            if (result == null) {
                result = machine;
            } else {
                epsilon(result.end(), machine.start());
                result = new Machine(result.start(), machine.end());
            }
        }
        Preconditions.checkState(result != null, "Empty concatenation");
        return result;
    }

    private Machine repetition(Expression.Repetition repetition) {
        var inner = singular(repetition.inner());
        if (repetition.quantifier() == Quantifier.ONE) {
            return inner;
        }
        int start = state();
        int end = state();
        epsilon(start, inner.start());
        epsilon(inner.end(), end);
        if (repetition.quantifier()
                      .isOptional()) {
            epsilon(start, end);
        }
        if (repetition.quantifier()
                      .isRepeated()) {
            epsilon(inner.end(), inner.start());
        }
        return new Machine(start, end);
    }

    private Machine singular(Expression.Singular singular) {
        if (singular instanceof Expression.Nested nested) {
            return alternation(nested.alternation()
                                     .alternatives());
        }
        if (singular instanceof Expression.SymbolRef ref) {
            var target = lexical.get(ref.name());
            Preconditions.checkState(target != null, "Unresolved lexical reference '%s'", ref.name());
            return rule(target);
        }
        if (singular instanceof Expression.CharacterSet set) {
            int start = state();
            return new Machine(start, transition(start, set.matcher()));
        }
        var literal = (Expression.Literal) singular;
        int start = state();
        int end = start;
        var text = literal.text();
        for (int i = 0; i < text.length(); ) {
            int cp = text.codePointAt(i);
            end = transition(end, CodepointMatcher.single(cp));
            i += Character.charCount(cp);
        }
        return new Machine(start, end);
    }

    Nfa build(int start) {
        var epsilonArrays = new int[epsilons.size()][];
        for (int i = 0; i < epsilonArrays.length; i++) {
            epsilonArrays[i] = Ints.toArray(epsilons.get(i));
        }
        return new Nfa(edges.toArray(new CodepointMatcher[0]),
                       Ints.toArray(next),
                       epsilonArrays,
                       Ints.toArray(accepts),
                       start);
    }
}
