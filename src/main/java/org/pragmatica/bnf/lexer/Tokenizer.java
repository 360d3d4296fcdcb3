package org.pragmatica.bnf.lexer;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.bnf.error.LexError;
import org.pragmatica.bnf.error.LexException;
import org.pragmatica.bnf.grammar.Rule;
import org.pragmatica.bnf.tree.SourceLocation;
import org.pragmatica.bnf.tree.SourceSpan;
import org.pragmatica.bnf.tree.Token;

import java.util.Optional;

/**
 * Longest-match tokenizer over the real tokens and the whitespace rule. Ties between rules matching the same
 * length go to the rule defined first.
 */
public final class Tokenizer {
    private final Nfa automaton;
    private final ImmutableList<Rule> slots;
    private final ImmutableMap<String, TokenMatcher> matchers;
    private final ImmutableList<String> alphabet;

    Tokenizer(Nfa automaton, ImmutableList<Rule> slots, ImmutableMap<String, TokenMatcher> matchers) {
        this.automaton = automaton;
        this.slots = slots;
        this.matchers = matchers;
        this.alphabet = slots.stream()
                             .filter(Rule::isToken)
                             .map(Rule::name)
                             .collect(ImmutableList.toImmutableList());
    }

    /**
     * Match one lexeme at {@code location}, which must be before the end of {@code input}.
     */
    public Lexeme next(String input, SourceLocation location) throws LexException {
        Preconditions.checkArgument(location.offset() < input.length(), "Location %s is at end of input", location);

        var match = automaton.longestMatch(input, location.offset());
        if (match.isEmpty()) {
            var found = new String(Character.toChars(input.codePointAt(location.offset())));
            throw new LexException(new LexError.UnrecognizedCharacter(location, found, alphabet));
        }

        var rule = slots.get(match.get()
                                  .slot());
        var end = location.advanceTo(input, match.get()
                                                 .end());
        var span = SourceSpan.of(location, end);
        if (rule.isWhitespace()) {
            return new Lexeme.Drop(span);
        }
        return new Lexeme.Emit(new Token(rule.name(), span.extract(input), span));
    }

    /**
     * Lazy token stream over {@code input}. Streams are not restartable; call again to start over.
     */
    public TokenStream tokenize(String input) {
        return new TokenStream(this, input);
    }

    /**
     * Names of the emitted token rules, in index order.
     */
    public ImmutableList<String> alphabet() {
        return alphabet;
    }

    /**
     * Standalone matcher for an emitted token rule or the whitespace rule.
     */
    public Optional<TokenMatcher> matcher(String ruleName) {
        return Optional.ofNullable(matchers.get(ruleName));
    }

    public Optional<TokenMatcher> whitespace() {
        return slots.stream()
                    .filter(Rule::isWhitespace)
                    .findFirst()
                    .flatMap(rule -> matcher(rule.name()));
    }
}
