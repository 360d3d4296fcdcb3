package org.pragmatica.bnf;

import org.pragmatica.bnf.error.ParseException;
import org.pragmatica.bnf.grammar.RuleSet;
import org.pragmatica.bnf.lexer.Tokenizer;
import org.pragmatica.bnf.parser.Parser;
import org.pragmatica.bnf.parser.VariantTable;
import org.pragmatica.bnf.tree.AstNode;

/**
 * Everything compiled from one grammar source. Immutable and safe to share between threads; each parse call
 * keeps its own state.
 */
public record CompiledGrammar(
 Tokenizer tokenizer,
 Parser parser,
 RuleSet rules,
 VariantTable nodeTypes) {

    /**
     * Parse text from the default start rule.
     */
    public AstNode parse(String input) throws ParseException {
        return parser.parse(input);
    }
}
