package org.pragmatica.bnf;

import com.google.errorprone.annotations.CanIgnoreReturnValue;
import org.pragmatica.bnf.error.GrammarException;
import org.pragmatica.bnf.grammar.RuleRegistry;
import org.pragmatica.bnf.lexer.FragmentResolver;
import org.pragmatica.bnf.lexer.TokenizerCompiler;
import org.pragmatica.bnf.parser.ParserCompiler;
import org.pragmatica.bnf.parser.ParserConfig;
import org.pragmatica.bnf.parser.VariantTagger;

import java.util.logging.Logger;

/**
 * Entry point for compiling grammars.
 *
 * <p>Example usage:
 * <pre>{@code
 * var grammar = Bnf.compileGrammar("""
 *     greeting ::= "hi" name ;
 *     name :== [a-z]+ ;
 *     _ :== [ ]+ ;
 *     """);
 *
 * var node = grammar.parse("hi bob");
 * }</pre>
 */
public final class Bnf {
    private static final Logger logger = Logger.getLogger(Bnf.class.getName());

    private Bnf() {}

    /**
     * Compile grammar text with the default configuration.
     */
    public static CompiledGrammar compileGrammar(String grammarText) throws GrammarException {
        return compileGrammar(grammarText, ParserConfig.DEFAULT);
    }

    /**
     * Compile grammar text with custom configuration.
     */
    public static CompiledGrammar compileGrammar(String grammarText, ParserConfig config) throws GrammarException {
        var rules = RuleRegistry.create()
                                .register(grammarText)
                                .build();
        var tokenTable = FragmentResolver.resolve(rules);
        var tokenizer = TokenizerCompiler.compile(tokenTable, config);
        var parser = ParserCompiler.compile(rules, tokenizer, config);
        var nodeTypes = VariantTagger.tag(rules);

        logger.fine(() -> "Compiled grammar with " + rules.size() + " rules, alphabet " + tokenizer.alphabet());
        return new CompiledGrammar(tokenizer, parser.withVariants(nodeTypes), rules, nodeTypes);
    }

    /**
     * Create a builder for more complex configuration.
     */
    public static Builder builder(String grammarText) {
        return new Builder(grammarText);
    }

    public static final class Builder {
        private final String grammarText;
        private boolean packratEnabled = ParserConfig.DEFAULT.packratEnabled();
        private boolean parallelCompilation = ParserConfig.DEFAULT.parallelCompilation();

        private Builder(String grammarText) {
            this.grammarText = grammarText;
        }

        @CanIgnoreReturnValue
        public Builder packrat(boolean enabled) {
            this.packratEnabled = enabled;
            return this;
        }

        @CanIgnoreReturnValue
        public Builder parallelCompilation(boolean enabled) {
            this.parallelCompilation = enabled;
            return this;
        }

        public CompiledGrammar build() throws GrammarException {
            var config = new ParserConfig(packratEnabled, parallelCompilation);
            return compileGrammar(grammarText, config);
        }
    }
}
