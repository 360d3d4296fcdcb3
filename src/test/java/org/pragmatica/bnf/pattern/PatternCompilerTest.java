package org.pragmatica.bnf.pattern;

import org.junit.jupiter.api.Test;
import org.pragmatica.bnf.error.GrammarError;
import org.pragmatica.bnf.error.GrammarException;
import org.pragmatica.bnf.tree.SourceLocation;
import org.pragmatica.bnf.tree.SourceSpan;

import static org.junit.jupiter.api.Assertions.*;

class PatternCompilerTest {

    private static final SourceSpan SPAN = SourceSpan.at(SourceLocation.START);

    // === Escapes ===

    @Test
    void compileCharacter_hexEscape_resolvesCodePoint() throws GrammarException {
        assertEquals('A', PatternCompiler.compileCharacter("#x41", SPAN, "r"));
    }

    @Test
    void compileCharacter_doubledEscape_resolvesToEscapeCharacter() throws GrammarException {
        assertEquals('#', PatternCompiler.compileCharacter("##", SPAN, "r"));
    }

    @Test
    void compileCharacter_newlineEscape_resolvesToLineFeed() throws GrammarException {
        assertEquals('\n', PatternCompiler.compileCharacter("#n", SPAN, "r"));
    }

    @Test
    void compileCharacter_unicodeEscapes_resolveFullRange() throws GrammarException {
        assertEquals(0xE9, PatternCompiler.compileCharacter("#u00e9", SPAN, "r"));
        assertEquals(0x1F600, PatternCompiler.compileCharacter("#U0001F600", SPAN, "r"));
    }

    @Test
    void compileCharacter_unknownEscape_failsWithInvalidEscape() {
        var e = assertThrows(GrammarException.class, () -> PatternCompiler.compileCharacter("#q", SPAN, "r"));

        var error = assertInstanceOf(GrammarError.InvalidEscape.class, e.error());
        assertEquals("#q", error.escape());
        assertEquals("r", error.rule());
    }

    @Test
    void compileCharacter_tooFewHexDigits_failsWithInvalidEscape() {
        var e = assertThrows(GrammarException.class, () -> PatternCompiler.compileCharacter("#x4", SPAN, "r"));

        assertEquals("#x4", assertInstanceOf(GrammarError.InvalidEscape.class, e.error()).escape());
    }

    @Test
    void compileCharacter_beyondUnicodeRange_failsWithInvalidEscape() {
        var e = assertThrows(GrammarException.class,
                             () -> PatternCompiler.compileCharacter("#U00110000", SPAN, "r"));

        assertInstanceOf(GrammarError.InvalidEscape.class, e.error());
    }

    // === String literals ===

    @Test
    void compileLiteral_withEscapes_resolvesEveryUnit() throws GrammarException {
        assertEquals("ab\n", PatternCompiler.compileLiteral("'ab#n'", SPAN, "r"));
        assertEquals("say \"hi\"", PatternCompiler.compileLiteral("\"say #\"hi#\"\"", SPAN, "r"));
    }

    @Test
    void compileLiteral_setMetacharacters_standForThemselves() throws GrammarException {
        assertEquals("a-^]", PatternCompiler.compileLiteral("\"a-^]\"", SPAN, "r"));
    }

    @Test
    void compileLiteral_empty_failsWithEmptyLiteral() {
        var e = assertThrows(GrammarException.class, () -> PatternCompiler.compileLiteral("''", SPAN, "r"));

        assertInstanceOf(GrammarError.EmptyLiteral.class, e.error());
    }

    @Test
    void compileLiteral_invalidEscape_reportsEscapeLocation() {
        var e = assertThrows(GrammarException.class, () -> PatternCompiler.compileLiteral("'ab#z'", SPAN, "r"));

        var error = assertInstanceOf(GrammarError.InvalidEscape.class, e.error());
        assertEquals(4, error.span().start().column());
    }

    @Test
    void compileCharacter_nonAsciiHexDigits_rejected() {
        // Arabic-Indic four and one
        var e = assertThrows(GrammarException.class,
                             () -> PatternCompiler.compileCharacter("#x\u0664\u0661", SPAN, "r"));

        var error = assertInstanceOf(GrammarError.InvalidEscape.class, e.error());
        assertEquals("#x", error.escape());
    }

    @Test
    void compileCharacter_mixedCaseHexDigits_accepted() throws GrammarException {
        assertEquals(0xAB, PatternCompiler.compileCharacter("#xaB", SPAN, "r"));
    }

    // === Character sets ===

    @Test
    void compileCharacterSet_range_matchesMembersOnly() throws GrammarException {
        var matcher = PatternCompiler.compileCharacterSet("[a-z]", SPAN, "r");

        assertTrue(matcher.matches('m'));
        assertFalse(matcher.matches('A'));
    }

    @Test
    void compileCharacterSet_negated_matchesComplement() throws GrammarException {
        var matcher = PatternCompiler.compileCharacterSet("[^#n]", SPAN, "r");

        assertTrue(matcher.matches('a'));
        assertFalse(matcher.matches('\n'));
    }

    @Test
    void compileCharacterSet_negatedEmpty_matchesAnyCodePoint() throws GrammarException {
        var matcher = PatternCompiler.compileCharacterSet("[^]", SPAN, "r");

        assertTrue(matcher.matches('x'));
        assertTrue(matcher.matches(0x1F600));
    }

    @Test
    void compileCharacterSet_escapedMetacharacters_areMembers() throws GrammarException {
        var matcher = PatternCompiler.compileCharacterSet("[#-#]#^##]", SPAN, "r");

        assertTrue(matcher.matches('-'));
        assertTrue(matcher.matches(']'));
        assertTrue(matcher.matches('^'));
        assertTrue(matcher.matches('#'));
        assertFalse(matcher.matches('a'));
    }

    @Test
    void compileCharacterSet_empty_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> PatternCompiler.compileCharacterSet("[]", SPAN, "r"));

        assertInstanceOf(GrammarError.Syntax.class, e.error());
    }

    @Test
    void compileCharacterSet_reversedRange_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> PatternCompiler.compileCharacterSet("[z-a]", SPAN, "r"));

        var error = assertInstanceOf(GrammarError.Syntax.class, e.error());
        assertTrue(error.reason().contains("Reversed range"));
    }

    @Test
    void compileCharacterSet_danglingDash_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> PatternCompiler.compileCharacterSet("[a-]", SPAN, "r"));

        var error = assertInstanceOf(GrammarError.Syntax.class, e.error());
        assertTrue(error.reason().contains("Dangling"));
    }

    @Test
    void compileCharacterSet_unescapedDash_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> PatternCompiler.compileCharacterSet("[-a]", SPAN, "r"));

        assertInstanceOf(GrammarError.Syntax.class, e.error());
    }
}
