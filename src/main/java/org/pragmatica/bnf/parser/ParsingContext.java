package org.pragmatica.bnf.parser;

import org.pragmatica.bnf.tree.SourceLocation;
import org.pragmatica.bnf.tree.Token;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mutable parsing state over either raw text or a token list.
 *
 * <p>The position is a char offset in text mode and a token index in token mode. {@code lastEnd} is the end of
 * the last consumed token, which excludes whitespace skipped after it.
 */
public final class ParsingContext {
    private final String input;
    private final List<Token> tokens;
    private final Map<Long, ParseResult> packratCache;
    private final Map<String, Integer> ruleIds;
    private final Set<Long> activeRules;

    private int pos;
    private SourceLocation location;
    private SourceLocation lastEnd;

    private int furthestPos;
    private SourceLocation furthestLocation;
    private final Set<String> furthestExpected;

    /**
     * Saved cursor state for backtracking.
     */
    public record Mark(int pos, SourceLocation location, SourceLocation lastEnd) {}

    private ParsingContext(String input, List<Token> tokens, ParserConfig config) {
        this.input = input;
        this.tokens = tokens;
        this.packratCache = config.packratEnabled() ? new HashMap<>() : null;
        this.ruleIds = new HashMap<>();
        this.activeRules = new HashSet<>();
        this.pos = 0;
        this.location = tokens == null || tokens.isEmpty()
                        ? SourceLocation.START
                        : tokens.get(0)
                                .span()
                                .start();
        this.lastEnd = SourceLocation.START;
        this.furthestPos = -1;
        this.furthestLocation = location;
        this.furthestExpected = new LinkedHashSet<>();
    }

    public static ParsingContext forText(String input, ParserConfig config) {
        return new ParsingContext(input, null, config);
    }

    public static ParsingContext forTokens(List<Token> tokens, ParserConfig config) {
        return new ParsingContext(null, tokens, config);
    }

    public boolean isTextMode() {
        return input != null;
    }

    // === Position Management ===

    public int pos() {
        return pos;
    }

    public SourceLocation location() {
        return location;
    }

    public SourceLocation lastEnd() {
        return lastEnd;
    }

    public Mark mark() {
        return new Mark(pos, location, lastEnd);
    }

    public void reset(Mark mark) {
        this.pos = mark.pos();
        this.location = mark.location();
        this.lastEnd = mark.lastEnd();
    }

    public boolean isAtEnd() {
        return isTextMode()
               ? pos >= input.length()
               : pos >= tokens.size();
    }

    // === Text Mode ===

    public String input() {
        return input;
    }

    /**
     * Consume text up to {@code end} as part of a token.
     */
    public void consumeText(int end) {
        skipText(end);
        lastEnd = location;
    }

    /**
     * Move past text that belongs to no token.
     */
    public void skipText(int end) {
        location = location.advanceTo(input, end);
        pos = end;
    }

    // === Token Mode ===

    public Optional<Token> currentToken() {
        return pos < tokens.size()
               ? Optional.of(tokens.get(pos))
               : Optional.empty();
    }

    public void consumeToken() {
        lastEnd = tokens.get(pos)
                        .span()
                        .end();
        pos++;
        location = pos < tokens.size()
                   ? tokens.get(pos)
                           .span()
                           .start()
                   : lastEnd;
    }

    // === Error Tracking ===

    public void updateFurthest(String expected) {
        if (pos > furthestPos) {
            furthestPos = pos;
            furthestLocation = location;
            furthestExpected.clear();
            furthestExpected.add(expected);
        } else if (pos == furthestPos) {
            furthestExpected.add(expected);
        }
    }

    public SourceLocation furthestLocation() {
        return furthestLocation;
    }

    public List<String> furthestExpected() {
        return new ArrayList<>(furthestExpected);
    }

    /**
     * Description of the input at the furthest failure.
     */
    public String furthestFound() {
        return describe(Math.max(furthestPos, 0));
    }

    /**
     * Description of the input at the cursor.
     */
    public String found() {
        return describe(pos);
    }

    private String describe(int at) {
        if (isTextMode()) {
            return at < input.length()
                   ? "'" + new String(Character.toChars(input.codePointAt(at))) + "'"
                   : "end of input";
        }
        return at < tokens.size()
               ? "'" + tokens.get(at)
                             .text() + "'"
               : "end of input";
    }

    // === Recursion Guard ===

    /**
     * Mark {@code ruleName} active at the current position. Returns false when it already is.
     */
    public boolean enter(String ruleName) {
        return activeRules.add(key(ruleName, pos));
    }

    public void exit(String ruleName, int position) {
        activeRules.remove(key(ruleName, position));
    }

    // === Packrat Cache ===

    public Optional<ParseResult> cachedAt(String ruleName, int position) {
        if (packratCache == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(packratCache.get(key(ruleName, position)));
    }

    public void cacheAt(String ruleName, int position, ParseResult result) {
        if (packratCache != null) {
            packratCache.put(key(ruleName, position), result);
        }
    }

    private long key(String ruleName, int position) {
        int ruleId = ruleIds.computeIfAbsent(ruleName, k -> ruleIds.size());
        return ((long) ruleId << 32) | (position & 0xFFFFFFFFL);
    }
}
