package org.pragmatica.bnf.error;

import org.junit.jupiter.api.Test;
import org.pragmatica.bnf.Bnf;
import org.pragmatica.bnf.tree.SourceLocation;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    @Test
    void format_grammarError_pointsAtOffendingText() {
        var source = "x ::= \"a\" ;\ny ::= '' ;";
        var e = assertThrows(GrammarException.class, () -> Bnf.compileGrammar(source));

        var formatted = Diagnostic.of(e.error()).format(source, "test.bnf");

        assertThat(formatted).startsWith("error[G0003]: Empty string literal in rule 'y' at 2:7");
        assertThat(formatted).contains("--> test.bnf:2:7");
        assertThat(formatted).contains("2 | y ::= '' ;");
        assertThat(formatted).contains("^^ empty literal");
    }

    @Test
    void format_parseError_includesExpectedRules() throws Exception {
        var grammar = Bnf.compileGrammar("""
            pair ::= key "=" key ;
            key :== [a-z]+ ;
            """);
        var e = assertThrows(ParseException.class, () -> grammar.parse("a?"));

        var formatted = Diagnostic.of(e.error()).format("a?", null);

        assertThat(formatted).startsWith("error[P0001]");
        assertThat(formatted).contains("found '?'");
        assertThat(formatted).contains("= help: expected \"=\"");
    }

    @Test
    void of_lexErrorInsideParseError_usesLexCode() {
        var error = new ParseError.Lex(new LexError.UnrecognizedCharacter(SourceLocation.START, "?", List.of("key")));

        var diagnostic = Diagnostic.of(error);

        assertEquals("L0001", diagnostic.code());
    }

    @Test
    void formatSimple_singleLine() {
        var e = assertThrows(GrammarException.class, () -> Bnf.compileGrammar("x ::= y ;"));

        var simple = Diagnostic.of(e.error()).formatSimple();

        assertEquals("input:1:7: error: Undefined rule reference 'y' in rule 'x' at 1:7", simple);
    }
}
