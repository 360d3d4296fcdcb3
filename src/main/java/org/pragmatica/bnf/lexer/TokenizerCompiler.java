package org.pragmatica.bnf.lexer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.bnf.grammar.Rule;
import org.pragmatica.bnf.parser.ParserConfig;

import java.util.Comparator;
import java.util.List;
import java.util.logging.Logger;

/**
 * Builds the combined tokenizer automaton. Slots follow definition index order, so the lowest accepting slot
 * is the earliest-defined rule.
 */
public final class TokenizerCompiler {
    private static final Logger logger = Logger.getLogger(TokenizerCompiler.class.getName());

    private TokenizerCompiler() {}

    public static Tokenizer compile(TokenTable table) {
        return compile(table, ParserConfig.DEFAULT);
    }

    public static Tokenizer compile(TokenTable table, ParserConfig config) {
        var slots = ImmutableList.<Rule>builder()
                                 .addAll(table.realTokens())
                                 .addAll(table.whitespace()
                                              .stream()
                                              .toList())
                                 .build()
                                 .stream()
                                 .sorted(Comparator.comparingInt(Rule::index))
                                 .collect(ImmutableList.toImmutableList());

        var builder = new NfaBuilder(table.lexical());
        int start = builder.state();
        for (int slot = 0; slot < slots.size(); slot++) {
            var machine = builder.rule(slots.get(slot));
            builder.epsilon(start, machine.start());
            builder.accept(machine.end(), slot);
        }
        var automaton = builder.build(start);

        var tokenizer = new Tokenizer(automaton, slots, compileMatchers(slots, table, config));
        logger.fine(() -> "Compiled tokenizer: " + slots.size() + " rules, " + automaton.size() + " states");
        return tokenizer;
    }

    private static ImmutableMap<String, TokenMatcher> compileMatchers(List<Rule> slots,
                                                                      TokenTable table,
                                                                      ParserConfig config) {
        var stream = config.parallelCompilation()
                     ? slots.parallelStream()
                     : slots.stream();
        // Encounter order is kept by toList, so the map stays in index order
        var compiled = stream.map(rule -> TokenMatcher.compile(rule, table.lexical()))
                             .toList();
        var matchers = ImmutableMap.<String, TokenMatcher>builder();
        for (var matcher : compiled) {
            matchers.put(matcher.rule()
                                .name(), matcher);
        }
        return matchers.buildOrThrow();
    }
}
