package org.pragmatica.bnf.lexer;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.pragmatica.bnf.error.GrammarError;
import org.pragmatica.bnf.error.GrammarException;
import org.pragmatica.bnf.grammar.Rule;
import org.pragmatica.bnf.grammar.RuleSet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Splits token rules into real tokens and fragments.
 *
 * <p>A token rule is real when a production references it, directly or through another real token. Everything
 * else is a fragment: it can be inlined into other patterns but is never emitted. Lexical rules must not be
 * recursive, since they are inlined.
 */
public final class FragmentResolver {
    private static final Logger logger = Logger.getLogger(FragmentResolver.class.getName());

    private enum Mark {
        VISITING,
        DONE
    }

    private final Map<String, Rule> lexical;

    private FragmentResolver(Map<String, Rule> lexical) {
        this.lexical = lexical;
    }

    public static TokenTable resolve(RuleSet ruleSet) throws GrammarException {
        var lexical = ImmutableMap.<String, Rule>builder();
        for (var rule : ruleSet.rules()) {
            if (!rule.isProduction()) {
                lexical.put(rule.name(), rule);
            }
        }
        var resolver = new FragmentResolver(lexical.buildOrThrow());
        resolver.checkRecursion();
        return resolver.split(ruleSet);
    }

    private void checkRecursion() throws GrammarException {
        var marks = new HashMap<String, Mark>();
        for (var rule : lexical.values()) {
            if (!marks.containsKey(rule.name())) {
                visit(rule, marks, new ArrayList<>());
            }
        }
    }

    private void visit(Rule rule, Map<String, Mark> marks, List<String> path) throws GrammarException {
        marks.put(rule.name(), Mark.VISITING);
        path.add(rule.name());
        for (var ref : rule.references()) {
            var target = lexical.get(ref.name());
            if (target == null) {
                continue;
            }
            var mark = marks.get(target.name());
            if (mark == Mark.VISITING) {
                var cycle = new ArrayList<>(path.subList(path.indexOf(target.name()), path.size()));
                cycle.add(target.name());
                throw new GrammarException(new GrammarError.RecursiveToken(target.span(), target.name(), cycle));
            }
            if (mark == null) {
                visit(target, marks, path);
            }
        }
        path.remove(path.size() - 1);
        marks.put(rule.name(), Mark.DONE);
    }

    private TokenTable split(RuleSet ruleSet) {
        Set<String> reached = new HashSet<>();
        var queue = new ArrayDeque<Rule>();

        for (var production : ruleSet.productions()) {
            for (var ref : production.references()) {
                var target = lexical.get(ref.name());
                if (target != null && target.isToken() && reached.add(target.name())) {
                    queue.add(target);
                }
            }
        }
        while (!queue.isEmpty()) {
            for (var ref : queue.poll()
                                .references()) {
                var target = lexical.get(ref.name());
                if (target != null && target.isToken() && reached.add(target.name())) {
                    queue.add(target);
                }
            }
        }

        var real = ImmutableList.<Rule>builder();
        var fragments = ImmutableList.<Rule>builder();
        for (var rule : ruleSet.tokens()) {
            if (reached.contains(rule.name())) {
                real.add(rule);
            } else {
                fragments.add(rule);
            }
        }
        var table = new TokenTable(real.build(), fragments.build(), ruleSet.whitespace(), ImmutableMap.copyOf(lexical));
        logger.fine(() -> "Resolved " + table.realTokens().size() + " tokens and "
                          + table.fragments().size() + " fragments " + fragmentNames(table));
        return table;
    }

    private static List<String> fragmentNames(TokenTable table) {
        return table.fragments()
                    .stream()
                    .map(Rule::name)
                    .toList();
    }
}
