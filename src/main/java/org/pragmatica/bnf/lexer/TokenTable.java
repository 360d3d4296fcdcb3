package org.pragmatica.bnf.lexer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.bnf.grammar.Rule;

import java.util.Optional;

/**
 * Lexical rules split by role.
 *
 * @param realTokens token rules that the tokenizer emits, in index order
 * @param fragments  token rules only inlined into other patterns, in index order
 * @param whitespace the whitespace rule, if defined
 * @param lexical    every token and whitespace rule by name, for inlining references
 */
public record TokenTable(
 ImmutableList<Rule> realTokens,
 ImmutableList<Rule> fragments,
 Optional<Rule> whitespace,
 ImmutableMap<String, Rule> lexical) {

    public boolean isFragment(String name) {
        return fragments.stream()
                        .anyMatch(rule -> rule.name()
                                              .equals(name));
    }
}
