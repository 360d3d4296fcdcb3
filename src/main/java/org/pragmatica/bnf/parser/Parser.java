package org.pragmatica.bnf.parser;

import org.pragmatica.bnf.error.ParseException;
import org.pragmatica.bnf.lexer.TokenStream;
import org.pragmatica.bnf.tree.AstNode;
import org.pragmatica.bnf.tree.Token;

import java.util.List;

/**
 * Parser interface - parses input according to the production rules of a compiled grammar.
 */
public interface Parser {

    /**
     * Parse text starting from the default start rule.
     */
    AstNode parse(String input) throws ParseException;

    /**
     * Parse text starting from a specific production. Whitespace is skipped implicitly and every token rule
     * reference takes that rule's longest match at the cursor.
     */
    AstNode parse(String startRule, String input) throws ParseException;

    /**
     * Parse a token stream starting from a specific production. The stream is drained first.
     */
    AstNode parse(String startRule, TokenStream tokens) throws ParseException;

    /**
     * Parse already tokenized input starting from a specific production.
     */
    AstNode parse(String startRule, List<Token> tokens) throws ParseException;

    /**
     * Parse the longest prefix of text that the start production matches, without requiring end of input.
     */
    AstNode parsePrefix(String startRule, String input) throws ParseException;

    /**
     * A parser stamping nodes with the tags from {@code variants}.
     */
    Parser withVariants(VariantTable variants);
}
