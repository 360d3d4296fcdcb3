package org.pragmatica.bnf.grammar;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.pragmatica.bnf.error.GrammarError;
import org.pragmatica.bnf.error.GrammarException;
import org.pragmatica.bnf.pattern.CodepointMatcher;
import org.pragmatica.bnf.tree.SourceSpan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Collects rule statements, merges definitions that share a name and allocates definition indices.
 *
 * <p>Indices are handed out in source order, one per newly seen rule name and one per newly seen literal or
 * character set inside a production. Such patterns are lifted into synthetic token rules named after their
 * source text, so {@code greeting ::= "hi" name ;} yields the rules {@code greeting}, {@code "hi"} and
 * {@code name} with indices 0, 1 and 2. Patterns denoting the same code points share one synthetic rule,
 * named after the first occurrence: {@code 'a'}, {@code "a"} and {@code '#x61'} all refer to {@code 'a'}.
 *
 * <p>A registry is single-use: {@link #build()} closes it.
 */
public final class RuleRegistry {
    private static final Logger logger = Logger.getLogger(RuleRegistry.class.getName());

    private final Map<String, Entry> entries = new LinkedHashMap<>();
    private final Map<String, String> literalNames = new HashMap<>();
    private final Map<CodepointMatcher, String> setNames = new HashMap<>();
    private int nextIndex;
    private boolean built;

    private RuleRegistry() {}

    public static RuleRegistry create() {
        return new RuleRegistry();
    }

    /**
     * Parse one or more rule statements and merge them into the registry.
     */
    @CanIgnoreReturnValue
    public RuleRegistry register(String ruleText) throws GrammarException {
        checkOpen();
        for (var definition : GrammarParser.parse(ruleText)) {
            add(definition);
        }
        return this;
    }

    /**
     * Merge a single parsed rule statement.
     */
    @CanIgnoreReturnValue
    public RuleRegistry add(RuleDefinition definition) throws GrammarException {
        checkOpen();
        var entry = entryFor(definition.name(), definition.kind(), definition.span(), false);
        definition.doc()
                  .ifPresent(entry.docs::add);

        if (definition.kind() == RuleKind.PRODUCTION) {
            for (var alternative : definition.alternatives()) {
                entry.alternatives.add(alternative.withBody(lift(alternative.body())));
            }
        } else {
            entry.alternatives.addAll(definition.alternatives());
        }
        return this;
    }

    /**
     * Close registration, validate references and return the immutable rule set.
     */
    public RuleSet build() throws GrammarException {
        checkOpen();
        built = true;

        var rules = ImmutableMap.<String, Rule>builder();
        for (var entry : entries.values()) {
            rules.put(entry.name, entry.toRule());
        }
        var ruleSet = new RuleSet(rules.buildOrThrow());

        for (var rule : ruleSet.rules()) {
            validateReferences(rule, ruleSet);
        }

        logger.fine(() -> "Registered " + ruleSet.size() + " rules ("
                          + ruleSet.productions().size() + " productions, "
                          + ruleSet.tokens().size() + " tokens)");
        return ruleSet;
    }

    private void checkOpen() {
        Preconditions.checkState(!built, "Rule registry is already finalized");
    }

    private Entry entryFor(String name, RuleKind kind, SourceSpan span, boolean synthetic) throws GrammarException {
        var existing = entries.get(name);
        if (existing == null) {
            var entry = new Entry(name, kind, nextIndex++, span, synthetic);
            entries.put(name, entry);
            return entry;
        }
        if (existing.kind != kind) {
            throw new GrammarException(new GrammarError.ConflictingKind(span, name, existing.kind, kind));
        }
        return existing;
    }

    // === Literal lifting ===

    private Expression.Concatenation lift(Expression.Concatenation concatenation) throws GrammarException {
        var elements = new ArrayList<Expression.Repetition>();
        for (var repetition : concatenation.elements()) {
            elements.add(new Expression.Repetition(repetition.span(), lift(repetition.inner()), repetition.quantifier()));
        }
        return new Expression.Concatenation(concatenation.span(), elements);
    }

    private Expression.Singular lift(Expression.Singular singular) throws GrammarException {
        if (singular instanceof Expression.Literal literal) {
            var name = literalNames.computeIfAbsent(literal.text(), text -> literal.source());
            return syntheticToken(literal, name);
        }
        if (singular instanceof Expression.CharacterSet set) {
            var name = setNames.computeIfAbsent(set.matcher(), matcher -> set.source());
            return syntheticToken(set, name);
        }
        if (singular instanceof Expression.Nested nested) {
            var alternatives = new ArrayList<Alternative>();
            for (var alternative : nested.alternation()
                                         .alternatives()) {
                alternatives.add(alternative.withBody(lift(alternative.body())));
            }
            return new Expression.Nested(nested.span(), new Expression.Alternation(nested.alternation()
                                                                                         .span(), alternatives));
        }
        return singular;
    }

    private Expression.SymbolRef syntheticToken(Expression.Singular pattern, String name) throws GrammarException {
        var entry = entryFor(name, RuleKind.TOKEN, pattern.span(), true);
        if (entry.alternatives.isEmpty()) {
            var body = new Expression.Concatenation(pattern.span(),
                                                    List.of(new Expression.Repetition(pattern.span(),
                                                                                      pattern,
                                                                                      Quantifier.ONE)));
            entry.alternatives.add(Alternative.of(body));
        }
        return new Expression.SymbolRef(pattern.span(), name);
    }

    // === Reference validation ===

    private static void validateReferences(Rule rule, RuleSet ruleSet) throws GrammarException {
        for (var ref : rule.references()) {
            var target = ruleSet.rule(ref.name());
            if (target.isEmpty()) {
                throw new GrammarException(new GrammarError.UndefinedRule(ref.span(), rule.name(), ref.name()));
            }
            var targetKind = target.get()
                                   .kind();
            if (rule.isProduction() && targetKind == RuleKind.WHITESPACE) {
                throw new GrammarException(new GrammarError.InvalidReference(ref.span(),
                                                                             rule.name(),
                                                                             ref.name(),
                                                                             "whitespace is skipped implicitly"));
            }
            if (!rule.isProduction() && targetKind == RuleKind.PRODUCTION) {
                throw new GrammarException(new GrammarError.InvalidReference(ref.span(),
                                                                             rule.name(),
                                                                             ref.name(),
                                                                             rule.kind()
                                                                                 .display()
                                                                             + " rules may only reference token rules"));
            }
        }
    }

    private static final class Entry {
        private final String name;
        private final RuleKind kind;
        private final int index;
        private final SourceSpan span;
        private final boolean synthetic;
        private final List<Alternative> alternatives = new ArrayList<>();
        private final List<String> docs = new ArrayList<>();

        private Entry(String name, RuleKind kind, int index, SourceSpan span, boolean synthetic) {
            this.name = name;
            this.kind = kind;
            this.index = index;
            this.span = span;
            this.synthetic = synthetic;
        }

        private Rule toRule() {
            var doc = docs.isEmpty()
                      ? Optional.<String>empty()
                      : Optional.of(String.join("\n", docs));
            return new Rule(name, kind, alternatives, index, doc, span, synthetic);
        }
    }
}
