package org.pragmatica.bnf.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Abstract syntax tree node produced by one production rule invocation.
 *
 * <p>{@code variant} is the tag of the top-level alternative that matched. Groups and repetitions
 * inside the alternative are flattened into {@code children} in source order.
 */
public record AstNode(
 String rule,
 String variant,
 List<Node> children,
 SourceSpan span) implements Node {

    public AstNode {
        children = ImmutableList.copyOf(children);
    }

    /**
     * Direct token children, in order.
     */
    public List<Token> tokens() {
        return children.stream()
                       .filter(Token.class::isInstance)
                       .map(Token.class::cast)
                       .toList();
    }

    /**
     * Direct production children, in order.
     */
    public List<AstNode> nodes() {
        return children.stream()
                       .filter(AstNode.class::isInstance)
                       .map(AstNode.class::cast)
                       .toList();
    }

    /**
     * Concatenated text of every token under this node.
     */
    public String text() {
        var sb = new StringBuilder();
        appendText(this, sb);
        return sb.toString();
    }

    private static void appendText(Node node, StringBuilder sb) {
        if (node instanceof Token token) {
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(token.text());
        } else if (node instanceof AstNode ast) {
            for (var child : ast.children()) {
                appendText(child, sb);
            }
        }
    }
}
