package org.pragmatica.bnf.grammar;

import org.junit.jupiter.api.Test;
import org.pragmatica.bnf.error.GrammarError;
import org.pragmatica.bnf.error.GrammarException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.*;

class RuleRegistryTest {

    private static RuleSet build(String grammar) throws GrammarException {
        return RuleRegistry.create()
                           .register(grammar)
                           .build();
    }

    @Test
    void build_duplicateDefinitions_mergedAtFirstIndex() throws GrammarException {
        var rules = build("""
            expr ::= "a" ;
            num :== [0-9]+ ;
            expr ::= num ;
            """);

        var expr = rules.rule("expr").orElseThrow();
        assertEquals(0, expr.index());
        assertEquals(2, expr.alternatives().size());
        assertEquals(1, rules.rule("\"a\"").orElseThrow().index());
        assertEquals(2, rules.rule("num").orElseThrow().index());
    }

    @Test
    void build_duplicateDefinitions_joinDocstrings() throws GrammarException {
        var rules = build("""
            /** one */ x ::= "a" ;
            /** two */ x ::= "b" ;
            """);

        assertEquals("one\ntwo", rules.rule("x").orElseThrow().doc().orElseThrow());
    }

    @Test
    void build_productionLiterals_liftedIntoSyntheticTokens() throws GrammarException {
        var rules = build("""
            x ::= "a" [0-9] "a" ;
            y ::= "a" ;
            """);

        assertThat(rules.rules()).extracting(Rule::name)
                                 .containsExactly("x", "\"a\"", "[0-9]", "y");
        var literal = rules.rule("\"a\"").orElseThrow();
        assertTrue(literal.synthetic());
        assertEquals(RuleKind.TOKEN, literal.kind());

        var refs = rules.rule("x").orElseThrow().references();
        assertThat(refs).extracting(Expression.SymbolRef::name)
                        .containsExactly("\"a\"", "[0-9]", "\"a\"");
    }

    @Test
    void build_equivalentPatterns_shareFirstSyntheticToken() throws GrammarException {
        var rules = build("""
            x ::= 'a' [a-c] ;
            y ::= "a" '#x61' [abc] ;
            """);

        assertThat(rules.rules()).extracting(Rule::name)
                                 .containsExactly("x", "'a'", "[a-c]", "y");
        assertThat(rules.rule("y").orElseThrow().references()).extracting(Expression.SymbolRef::name)
                                                              .containsExactly("'a'", "'a'", "[a-c]");
    }

    @Test
    void build_tokenRuleLiterals_stayInline() throws GrammarException {
        var rules = build("""
            p ::= kw ;
            kw :== "if" ;
            """);

        assertEquals(2, rules.size());
        assertTrue(rules.rule("\"if\"").isEmpty());
    }

    @Test
    void build_literalsInsideGroups_areLifted() throws GrammarException {
        var rules = build("p ::= (\"a\" | \"b\")* ;");

        assertTrue(rules.rule("\"a\"").isPresent());
        assertTrue(rules.rule("\"b\"").isPresent());
    }

    @Test
    void build_startRule_isFirstProduction() throws GrammarException {
        var rules = build("""
            t :== "x" ;
            first ::= t ;
            second ::= t ;
            """);

        assertEquals("first", rules.startRule().orElseThrow().name());
        assertThat(rules.productions()).extracting(Rule::name).containsExactly("first", "second");
        assertThat(rules.tokens()).extracting(Rule::name).containsExactly("t");
    }

    @Test
    void register_calledRepeatedly_continuesIndices() throws GrammarException {
        var rules = RuleRegistry.create()
                                .register("a ::= b ;")
                                .register("b :== \"x\" ;")
                                .build();

        assertEquals(0, rules.rule("a").orElseThrow().index());
        assertEquals(1, rules.rule("b").orElseThrow().index());
    }

    // === Errors ===

    @Test
    void register_conflictingKind_fails() {
        var e = assertThrows(GrammarException.class, () -> build("""
            a :== "x" ;
            a ::= "y" ;
            """));

        var error = assertInstanceOf(GrammarError.ConflictingKind.class, e.error());
        assertEquals("a", error.rule());
        assertEquals(RuleKind.TOKEN, error.existing());
        assertEquals(RuleKind.PRODUCTION, error.redefined());
    }

    @Test
    void build_undefinedReference_fails() {
        var e = assertThrows(GrammarException.class, () -> build("x ::= y ;"));

        var error = assertInstanceOf(GrammarError.UndefinedRule.class, e.error());
        assertEquals("y", error.reference());
        assertEquals("x", error.rule());
    }

    @Test
    void build_productionReferencingWhitespace_fails() {
        var e = assertThrows(GrammarException.class, () -> build("""
            x ::= "a" _ ;
            _ :== [ ]+ ;
            """));

        assertInstanceOf(GrammarError.InvalidReference.class, e.error());
    }

    @Test
    void build_tokenReferencingProduction_fails() {
        var e = assertThrows(GrammarException.class, () -> build("""
            t :== x ;
            x ::= "a" ;
            """));

        var error = assertInstanceOf(GrammarError.InvalidReference.class, e.error());
        assertEquals("t", error.rule());
        assertEquals("x", error.reference());
    }

    @Test
    void register_afterBuild_isRejected() throws GrammarException {
        var registry = RuleRegistry.create().register("x ::= \"a\" ;");
        registry.build();

        assertThatThrownBy(() -> registry.register("y ::= \"b\" ;"))
            .isInstanceOf(IllegalStateException.class);
    }
}
