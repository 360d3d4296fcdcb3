package org.pragmatica.bnf.lexer;

import org.junit.jupiter.api.Test;
import org.pragmatica.bnf.error.GrammarError;
import org.pragmatica.bnf.error.GrammarException;
import org.pragmatica.bnf.grammar.Rule;
import org.pragmatica.bnf.grammar.RuleRegistry;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class FragmentResolverTest {

    private static TokenTable resolve(String grammar) throws GrammarException {
        return FragmentResolver.resolve(RuleRegistry.create()
                                                    .register(grammar)
                                                    .build());
    }

    @Test
    void resolve_tokenReferencedFromProduction_isReal() throws GrammarException {
        var table = resolve("""
            value ::= number ;
            number :== [0-9]+ ;
            letter :== [a-z] ;
            """);

        assertThat(table.realTokens()).extracting(Rule::name).containsExactly("number");
        assertThat(table.fragments()).extracting(Rule::name).containsExactly("letter");
    }

    @Test
    void resolve_tokensReachedThroughRealTokens_areReal() throws GrammarException {
        var table = resolve("""
            digit :== [0-9] ;
            number :== digit+ ;
            value ::= number ;
            """);

        assertThat(table.realTokens()).extracting(Rule::name).containsExactly("digit", "number");
        assertTrue(table.fragments().isEmpty());
    }

    @Test
    void resolve_tokensOnlyUsedByFragmentsOrWhitespace_areFragments() throws GrammarException {
        var table = resolve("""
            space :== [ ] ;
            _ :== space+ ;
            a :== [a] ;
            b :== a a ;
            value ::= word ;
            word :== [c-z]+ ;
            """);

        assertThat(table.realTokens()).extracting(Rule::name).containsExactly("word");
        assertThat(table.fragments()).extracting(Rule::name).containsExactly("space", "a", "b");
        assertTrue(table.isFragment("space"));
        assertTrue(table.whitespace().isPresent());
    }

    @Test
    void resolve_mutuallyRecursiveTokens_fail() {
        var e = assertThrows(GrammarException.class, () -> resolve("""
            p ::= a ;
            a :== "x" b ;
            b :== "y" a? ;
            """));

        var error = assertInstanceOf(GrammarError.RecursiveToken.class, e.error());
        assertEquals("a", error.rule());
        assertEquals(List.of("a", "b", "a"), error.cycle());
    }

    @Test
    void resolve_selfRecursiveToken_fails() {
        var e = assertThrows(GrammarException.class, () -> resolve("""
            p ::= nest ;
            nest :== "(" nest? ")" ;
            """));

        assertEquals(List.of("nest", "nest"),
                     assertInstanceOf(GrammarError.RecursiveToken.class, e.error()).cycle());
    }

    @Test
    void resolve_recursiveWhitespace_fails() {
        var e = assertThrows(GrammarException.class, () -> resolve("""
            p ::= w ;
            w :== [a-z]+ ;
            _ :== " " _? ;
            """));

        assertInstanceOf(GrammarError.RecursiveToken.class, e.error());
    }
}
