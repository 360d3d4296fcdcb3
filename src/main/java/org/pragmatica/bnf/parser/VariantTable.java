package org.pragmatica.bnf.parser;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * Node types of every production rule, in index order.
 */
public final class VariantTable {
    private final ImmutableMap<String, NodeType> nodeTypes;

    VariantTable(ImmutableMap<String, NodeType> nodeTypes) {
        this.nodeTypes = nodeTypes;
    }

    public Optional<NodeType> nodeType(String rule) {
        return Optional.ofNullable(nodeTypes.get(rule));
    }

    public ImmutableList<NodeType> nodeTypes() {
        return nodeTypes.values()
                        .asList();
    }

    /**
     * Tag of the alternative at {@code position} of {@code rule}.
     */
    public String tag(String rule, int position) {
        var nodeType = nodeTypes.get(rule);
        Preconditions.checkArgument(nodeType != null, "Not a production rule: %s", rule);
        return nodeType.variants()
                       .get(position)
                       .tag();
    }
}
