package org.pragmatica.bnf.grammar;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * The immutable, index-ordered set of merged rules produced by {@link RuleRegistry#build()}.
 */
public final class RuleSet {
    private final ImmutableMap<String, Rule> rules;

    RuleSet(ImmutableMap<String, Rule> rules) {
        this.rules = rules;
    }

    /**
     * Get rule by name.
     */
    public Optional<Rule> rule(String name) {
        return Optional.ofNullable(rules.get(name));
    }

    public boolean contains(String name) {
        return rules.containsKey(name);
    }

    /**
     * All rules in definition index order.
     */
    public ImmutableList<Rule> rules() {
        return rules.values()
                    .asList();
    }

    public ImmutableList<Rule> productions() {
        return rules().stream()
                      .filter(Rule::isProduction)
                      .collect(ImmutableList.toImmutableList());
    }

    /**
     * Token rules, including synthetic ones, in index order.
     */
    public ImmutableList<Rule> tokens() {
        return rules().stream()
                      .filter(Rule::isToken)
                      .collect(ImmutableList.toImmutableList());
    }

    public Optional<Rule> whitespace() {
        return rule(GrammarParser.WHITESPACE_RULE);
    }

    /**
     * The default start rule: the production with the smallest index.
     */
    public Optional<Rule> startRule() {
        return rules().stream()
                      .filter(Rule::isProduction)
                      .findFirst();
    }

    public int size() {
        return rules.size();
    }

    @Override
    public String toString() {
        return "RuleSet" + rules.keySet();
    }
}
