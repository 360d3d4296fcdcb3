package org.pragmatica.bnf.lexer;

import org.pragmatica.bnf.grammar.Rule;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Longest-match automaton for a single lexical rule, used when parsing raw text without a token stream.
 */
public final class TokenMatcher {
    private static final int SLOT = 0;

    private final Rule rule;
    private final Nfa nfa;

    private TokenMatcher(Rule rule, Nfa nfa) {
        this.rule = rule;
        this.nfa = nfa;
    }

    static TokenMatcher compile(Rule rule, Map<String, Rule> lexical) {
        var builder = new NfaBuilder(lexical);
        var machine = builder.rule(rule);
        builder.accept(machine.end(), SLOT);
        return new TokenMatcher(rule, builder.build(machine.start()));
    }

    public Rule rule() {
        return rule;
    }

    /**
     * End offset of the longest non-empty match starting at {@code from}.
     */
    public OptionalInt match(CharSequence input, int from) {
        return nfa.longestMatch(input, from)
                  .map(match -> OptionalInt.of(match.end()))
                  .orElse(OptionalInt.empty());
    }
}
