package org.pragmatica.bnf.tree;

/**
 * Element of a parse tree: either a production node or a matched token.
 */
public sealed interface Node permits AstNode, Token {
    /**
     * The source span covered by this node.
     */
    SourceSpan span();

    /**
     * Name of the rule that produced this node.
     */
    String rule();
}
