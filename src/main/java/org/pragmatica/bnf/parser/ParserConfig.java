package org.pragmatica.bnf.parser;

/**
 * Compilation and parsing options.
 *
 * @param packratEnabled      memoize production results by rule and position
 * @param parallelCompilation compile per-rule token matchers concurrently
 */
public record ParserConfig(
    boolean packratEnabled,
    boolean parallelCompilation
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        true,
        false
    );
}
