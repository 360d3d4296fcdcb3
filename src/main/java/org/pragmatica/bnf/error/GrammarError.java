package org.pragmatica.bnf.error;

import org.pragmatica.bnf.grammar.RuleKind;
import org.pragmatica.bnf.tree.SourceSpan;

import java.util.List;

/**
 * Compile-time grammar error. Every variant is fatal to the compilation that raised it.
 */
public sealed interface GrammarError {
    /**
     * Best-effort span of the offending grammar text.
     */
    SourceSpan span();

    /**
     * Name of the offending rule, empty when the error precedes the rule name.
     */
    String rule();

    String message();

    /**
     * Malformed rule syntax: missing terminator, unmatched parenthesis, bad set entry and the like.
     */
    record Syntax(SourceSpan span, String rule, String reason) implements GrammarError {
        @Override
        public String message() {
            return withRule(rule, reason) + " at " + span.start();
        }
    }

    /**
     * A symbol redefined with a different kind.
     */
    record ConflictingKind(SourceSpan span, String rule, RuleKind existing, RuleKind redefined) implements GrammarError {
        @Override
        public String message() {
            return "Rule '" + rule + "' is already defined as " + existing.display()
                   + " and cannot be redefined as " + redefined.display() + " at " + span.start();
        }
    }

    /**
     * A string literal without characters.
     */
    record EmptyLiteral(SourceSpan span, String rule) implements GrammarError {
        @Override
        public String message() {
            return withRule(rule, "Empty string literal") + " at " + span.start();
        }
    }

    /**
     * Unknown or malformed escape sequence.
     */
    record InvalidEscape(SourceSpan span, String rule, String escape) implements GrammarError {
        @Override
        public String message() {
            return withRule(rule, "Invalid escape sequence '" + escape + "'") + " at " + span.start();
        }
    }

    /**
     * A token rule that reaches itself through symbol references.
     */
    record RecursiveToken(SourceSpan span, String rule, List<String> cycle) implements GrammarError {
        public RecursiveToken {
            cycle = List.copyOf(cycle);
        }

        @Override
        public String message() {
            return "Token rule '" + rule + "' is recursive: " + String.join(" -> ", cycle);
        }
    }

    /**
     * Two top-level alternatives of one production share a variant tag.
     */
    record DuplicateVariantName(SourceSpan span, String rule, String variant) implements GrammarError {
        @Override
        public String message() {
            return "Duplicate variant name '" + variant + "' in rule '" + rule + "' at " + span.start();
        }
    }

    /**
     * Reference to a symbol that is never defined.
     */
    record UndefinedRule(SourceSpan span, String rule, String reference) implements GrammarError {
        @Override
        public String message() {
            return "Undefined rule reference '" + reference + "' in rule '" + rule + "' at " + span.start();
        }
    }

    /**
     * Reference that is defined but not allowed from the referencing rule's kind.
     */
    record InvalidReference(SourceSpan span, String rule, String reference, String reason) implements GrammarError {
        @Override
        public String message() {
            return "Rule '" + rule + "' cannot reference '" + reference + "': " + reason + " at " + span.start();
        }
    }

    private static String withRule(String rule, String text) {
        return rule.isEmpty()
               ? text
               : text + " in rule '" + rule + "'";
    }
}
