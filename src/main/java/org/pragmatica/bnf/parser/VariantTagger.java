package org.pragmatica.bnf.parser;

import com.google.common.collect.ImmutableMap;
import org.pragmatica.bnf.error.GrammarError;
import org.pragmatica.bnf.error.GrammarException;
import org.pragmatica.bnf.grammar.RuleSet;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.logging.Logger;

/**
 * Assigns a variant tag to each top-level alternative of each production and attaches docstrings.
 */
public final class VariantTagger {
    private static final Logger logger = Logger.getLogger(VariantTagger.class.getName());

    private VariantTagger() {}

    public static VariantTable tag(RuleSet ruleSet) throws GrammarException {
        var nodeTypes = ImmutableMap.<String, NodeType>builder();
        int generatedCount = 0;

        for (var rule : ruleSet.productions()) {
            var seen = new HashSet<String>();
            var variants = new ArrayList<NodeType.Variant>();
            var alternatives = rule.alternatives();

            for (int position = 0; position < alternatives.size(); position++) {
                var alternative = alternatives.get(position);
                var generated = alternative.name()
                                           .isEmpty();
                var tag = alternative.name()
                                     .orElse(rule.name() + "_" + position);
                if (!seen.add(tag)) {
                    throw new GrammarException(new GrammarError.DuplicateVariantName(alternative.span(), rule.name(), tag));
                }
                if (generated) {
                    generatedCount++;
                }
                variants.add(new NodeType.Variant(tag, alternative.doc(), position, generated));
            }
            nodeTypes.put(rule.name(), new NodeType(rule.name(), rule.doc(), variants));
        }

        var table = new VariantTable(nodeTypes.buildOrThrow());
        int generated = generatedCount;
        logger.fine(() -> "Tagged " + table.nodeTypes().size() + " node types, " + generated + " generated tags");
        return table;
    }
}
