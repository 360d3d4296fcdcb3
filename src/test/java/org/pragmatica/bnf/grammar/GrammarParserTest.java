package org.pragmatica.bnf.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.bnf.error.GrammarError;
import org.pragmatica.bnf.error.GrammarException;

import static org.junit.jupiter.api.Assertions.*;

class GrammarParserTest {

    @Test
    void parse_production_createsLiteralAndReference() throws GrammarException {
        var rules = GrammarParser.parse("greeting ::= \"hi\" name ;");

        assertEquals(1, rules.size());
        var rule = rules.get(0);
        assertEquals("greeting", rule.name());
        assertEquals(RuleKind.PRODUCTION, rule.kind());

        var elements = rule.alternatives().get(0).body().elements();
        assertEquals(2, elements.size());
        var literal = assertInstanceOf(Expression.Literal.class, elements.get(0).inner());
        assertEquals("hi", literal.text());
        assertEquals("\"hi\"", literal.source());
        assertEquals("name", assertInstanceOf(Expression.SymbolRef.class, elements.get(1).inner()).name());
    }

    @Test
    void parse_whitespaceRule_classifiedAsWhitespace() throws GrammarException {
        var rule = GrammarParser.parse("_ :== [ #t]+ ;").get(0);

        assertEquals(RuleKind.WHITESPACE, rule.kind());
        var repetition = rule.alternatives().get(0).body().elements().get(0);
        assertEquals(Quantifier.MANY, repetition.quantifier());
        var set = assertInstanceOf(Expression.CharacterSet.class, repetition.inner());
        assertTrue(set.matcher().matches('\t'));
    }

    @Test
    void parse_docstringsAndNames_attachToRuleAndAlternatives() throws GrammarException {
        var rule = GrammarParser.parse("""
            /** An expression. */
            expr ::= /** Sum */ term "+" expr -> sum
                   | term ;
            """).get(0);

        assertEquals("An expression.", rule.doc().orElseThrow());
        var sum = rule.alternatives().get(0);
        assertEquals("Sum", sum.doc().orElseThrow());
        assertEquals("sum", sum.name().orElseThrow());
        var plain = rule.alternatives().get(1);
        assertTrue(plain.doc().isEmpty());
        assertTrue(plain.name().isEmpty());
    }

    @Test
    void parse_emptyComment_isNotDocstring() throws GrammarException {
        var rule = GrammarParser.parse("/**/ x ::= \"a\" ;").get(0);

        assertTrue(rule.doc().isEmpty());
    }

    @Test
    void parse_nestedGroupAndQuantifiers_buildsTree() throws GrammarException {
        var rule = GrammarParser.parse("list ::= \"[\" (item (\",\" item)*)? \"]\" ;").get(0);

        var elements = rule.alternatives().get(0).body().elements();
        assertEquals(3, elements.size());
        assertEquals(Quantifier.MAYBE, elements.get(1).quantifier());
        var group = assertInstanceOf(Expression.Nested.class, elements.get(1).inner());
        var inner = group.alternation().alternatives().get(0).body().elements();
        assertEquals(Quantifier.ANY, inner.get(1).quantifier());
    }

    @Test
    void parse_bareEscape_createsSingleCharacterLiteral() throws GrammarException {
        var rule = GrammarParser.parse("eol :== #r? #n ;").get(0);

        var elements = rule.alternatives().get(0).body().elements();
        assertEquals("\r", assertInstanceOf(Expression.Literal.class, elements.get(0).inner()).text());
        assertEquals("\n", assertInstanceOf(Expression.Literal.class, elements.get(1).inner()).text());
    }

    @Test
    void parse_multipleRules_keepSourceOrder() throws GrammarException {
        var rules = GrammarParser.parse("""
            a ::= b ;
            /* plain comment */
            b :== "x" ;
            a ::= "y" ;
            """);

        assertEquals(3, rules.size());
        assertEquals("a", rules.get(0).name());
        assertEquals("b", rules.get(1).name());
        assertEquals("a", rules.get(2).name());
    }

    // === Errors ===

    @Test
    void parse_missingSemicolon_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("a ::= \"x\" b ::= \"y\" ;"));

        var error = assertInstanceOf(GrammarError.Syntax.class, e.error());
        assertEquals("a", error.rule());
        assertTrue(error.reason().contains("';'"));
    }

    @Test
    void parse_missingSemicolonAtEnd_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("a ::= \"x\""));

        assertInstanceOf(GrammarError.Syntax.class, e.error());
    }

    @Test
    void parse_whitespaceAsProduction_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("_ ::= \" \" ;"));

        assertInstanceOf(GrammarError.Syntax.class, e.error());
    }

    @Test
    void parse_alternativeNameOnTokenRule_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("t :== \"a\" -> named ;"));

        assertInstanceOf(GrammarError.Syntax.class, e.error());
    }

    @Test
    void parse_alternativeNameInsideGroup_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("x ::= (\"a\" -> n) ;"));

        assertInstanceOf(GrammarError.Syntax.class, e.error());
    }

    @Test
    void parse_unmatchedParenthesis_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("x ::= (\"a\" ;"));

        var error = assertInstanceOf(GrammarError.Syntax.class, e.error());
        assertTrue(error.reason().contains("Unmatched '('"));
    }

    @Test
    void parse_repeatedQuantifier_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("x ::= \"a\"*? ;"));

        var error = assertInstanceOf(GrammarError.Syntax.class, e.error());
        assertTrue(error.reason().contains("Repeated quantifier"));
    }

    @Test
    void parse_emptyAlternative_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("x ::= \"a\" | ;"));

        assertInstanceOf(GrammarError.Syntax.class, e.error());
    }

    @Test
    void parse_unterminatedComment_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("x ::= \"a\" ; /* open"));

        var error = assertInstanceOf(GrammarError.Syntax.class, e.error());
        assertTrue(error.reason().contains("Unterminated comment"));
    }

    @Test
    void parse_unterminatedLiteral_failsWithSyntax() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("x ::= \"abc ;\n"));

        assertInstanceOf(GrammarError.Syntax.class, e.error());
    }

    @Test
    void parse_emptyLiteral_failsWithEmptyLiteral() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("x ::= '' ;"));

        var error = assertInstanceOf(GrammarError.EmptyLiteral.class, e.error());
        assertEquals("x", error.rule());
    }

    @Test
    void parse_invalidEscape_failsWithInvalidEscape() {
        var e = assertThrows(GrammarException.class, () -> GrammarParser.parse("x ::= \"#q\" ;"));

        assertEquals("#q", assertInstanceOf(GrammarError.InvalidEscape.class, e.error()).escape());
    }
}
