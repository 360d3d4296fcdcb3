package org.pragmatica.bnf.parser;

import org.pragmatica.bnf.grammar.RuleSet;
import org.pragmatica.bnf.lexer.Tokenizer;

import java.util.Optional;
import java.util.logging.Logger;

/**
 * Builds the ordered-choice parser for the production rules of a rule set.
 */
public final class ParserCompiler {
    private static final Logger logger = Logger.getLogger(ParserCompiler.class.getName());

    private ParserCompiler() {}

    public static Parser compile(RuleSet rules, Tokenizer tokenizer) {
        return compile(rules, tokenizer, ParserConfig.DEFAULT);
    }

    public static Parser compile(RuleSet rules, Tokenizer tokenizer, ParserConfig config) {
        logger.fine(() -> "Compiled parser: " + rules.productions().size() + " productions, start rule "
                          + rules.startRule().map(rule -> rule.name()).orElse("<none>")
                          + (config.packratEnabled() ? ", packrat" : ""));
        return new ParserEngine(rules, tokenizer, config, Optional.empty());
    }
}
