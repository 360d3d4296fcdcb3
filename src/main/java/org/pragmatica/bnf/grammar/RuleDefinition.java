package org.pragmatica.bnf.grammar;

import org.pragmatica.bnf.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * One textual rule statement as read from the grammar source, before merging.
 */
public record RuleDefinition(
 String name,
 RuleKind kind,
 List<Alternative> alternatives,
 Optional<String> doc,
 SourceSpan span) {
    public RuleDefinition {
        alternatives = List.copyOf(alternatives);
    }
}
