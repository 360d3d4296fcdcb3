package org.pragmatica.bnf.parser;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * Tagged-union description of the nodes one production rule builds.
 *
 * @param rule     production rule name
 * @param doc      rule docstring
 * @param variants one variant per top-level alternative, in alternative order
 */
public record NodeType(String rule, Optional<String> doc, List<Variant> variants) {

    public NodeType {
        variants = ImmutableList.copyOf(variants);
    }

    /**
     * One top-level alternative.
     *
     * @param tag       explicit {@code -> name} or the generated {@code <rule>_<position>}
     * @param doc       alternative docstring
     * @param position  0-based index in the merged alternative list
     * @param generated whether the tag was generated
     */
    public record Variant(String tag, Optional<String> doc, int position, boolean generated) {}

    public Optional<Variant> variant(String tag) {
        return variants.stream()
                       .filter(variant -> variant.tag()
                                                 .equals(tag))
                       .findFirst();
    }
}
