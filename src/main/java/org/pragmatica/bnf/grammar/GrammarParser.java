package org.pragmatica.bnf.grammar;

import org.pragmatica.bnf.error.GrammarError;
import org.pragmatica.bnf.error.GrammarException;
import org.pragmatica.bnf.pattern.PatternCompiler;
import org.pragmatica.bnf.tree.SourceLocation;
import org.pragmatica.bnf.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Bootstrap parser for the meta-grammar. Converts grammar text into rule statements, compiling literal and
 * character set patterns on the way.
 *
 * <pre>
 * rule          ::= docstring? IDENT ( "::=" | ":==" ) alternation ";" ;
 * alternation   ::= alternative ( "|" alternative )* ;
 * alternative   ::= docstring? concatenation ( "->" IDENT )? ;
 * concatenation ::= repetition+ ;
 * repetition    ::= singular ( "?" | "*" | "+" )? ;
 * singular      ::= "(" alternation ")" | IDENT | STRING | CHARSET | CHAR ;
 * </pre>
 */
public final class GrammarParser {
    public static final String WHITESPACE_RULE = "_";

    private final List<GrammarToken> tokens;
    private int pos;
    private SourceLocation lastEnd;
    private String currentRule;

    private GrammarParser(List<GrammarToken> tokens) {
        this.tokens = tokens;
        this.pos = 0;
        this.lastEnd = SourceLocation.START;
        this.currentRule = "";
    }

    /**
     * Parse grammar text into rule statements, in source order.
     */
    public static List<RuleDefinition> parse(String grammarText) throws GrammarException {
        return new GrammarParser(GrammarLexer.tokenize(grammarText)).parseGrammar();
    }

    private List<RuleDefinition> parseGrammar() throws GrammarException {
        var rules = new ArrayList<RuleDefinition>();
        while (!(peek() instanceof GrammarToken.Eof)) {
            rules.add(parseRule());
        }
        return rules;
    }

    private RuleDefinition parseRule() throws GrammarException {
        currentRule = "";
        var doc = collectDocs();
        var start = peek().span()
                          .start();

        if (!(peek() instanceof GrammarToken.Identifier id)) {
            throw unexpected("rule name");
        }
        advance();
        currentRule = id.name();

        RuleKind kind;
        if (peek() instanceof GrammarToken.Produces) {
            if (WHITESPACE_RULE.equals(id.name())) {
                throw syntax(peek().span(), "Whitespace rule '_' must be defined with ':=='");
            }
            kind = RuleKind.PRODUCTION;
        } else if (peek() instanceof GrammarToken.Matches) {
            kind = WHITESPACE_RULE.equals(id.name())
                   ? RuleKind.WHITESPACE
                   : RuleKind.TOKEN;
        } else {
            throw unexpected("'::=' or ':=='");
        }
        advance();

        var alternation = parseAlternation(true, kind);

        if (!(peek() instanceof GrammarToken.Semicolon)) {
            if (peek() instanceof GrammarToken.RParen) {
                throw syntax(peek().span(), "Unmatched ')'");
            }
            throw unexpected("';'");
        }
        advance();

        return new RuleDefinition(id.name(), kind, alternation.alternatives(), doc, SourceSpan.of(start, lastEnd));
    }

    private Expression.Alternation parseAlternation(boolean topLevel, RuleKind kind) throws GrammarException {
        // Docstrings ahead belong to the first alternative, so they are not skipped here
        var start = tokens.get(pos)
                          .span()
                          .start();
        var alternatives = new ArrayList<Alternative>();
        alternatives.add(parseAlternative(topLevel, kind));
        while (peek() instanceof GrammarToken.Pipe) {
            advance();
            alternatives.add(parseAlternative(topLevel, kind));
        }
        return new Expression.Alternation(SourceSpan.of(start, lastEnd), alternatives);
    }

    private Alternative parseAlternative(boolean topLevel, RuleKind kind) throws GrammarException {
        var doc = topLevel
                  ? collectDocs()
                  : Optional.<String>empty();
        var start = peek().span()
                          .start();
        var body = parseConcatenation();

        Optional<String> name = Optional.empty();
        if (peek() instanceof GrammarToken.Arrow arrow) {
            if (!topLevel || kind.isLexical()) {
                throw syntax(arrow.span(),
                             "Alternative names are only allowed on top-level alternatives of production rules");
            }
            advance();
            if (!(peek() instanceof GrammarToken.Identifier alterName)) {
                throw unexpected("alternative name");
            }
            advance();
            name = Optional.of(alterName.name());
        }
        return new Alternative(doc, name, body, SourceSpan.of(start, lastEnd));
    }

    private Expression.Concatenation parseConcatenation() throws GrammarException {
        var start = peek().span()
                          .start();
        var elements = new ArrayList<Expression.Repetition>();
        while (isSingularStart()) {
            elements.add(parseRepetition());
        }
        if (elements.isEmpty()) {
            throw unexpected("expression");
        }
        return new Expression.Concatenation(SourceSpan.of(start, lastEnd), elements);
    }

    private boolean isSingularStart() {
        var token = peek();
        if (token instanceof GrammarToken.Identifier) {
            // An identifier followed by a definition operator starts the next rule: the ';' is missing
            return !isRuleDefinitionStart();
        }
        return token instanceof GrammarToken.LParen
               || token instanceof GrammarToken.StringLiteral
               || token instanceof GrammarToken.CharSetLiteral
               || token instanceof GrammarToken.CharLiteral;
    }

    private boolean isRuleDefinitionStart() {
        var next = tokenAfter(pos + 1);
        return next instanceof GrammarToken.Produces || next instanceof GrammarToken.Matches;
    }

    private Expression.Repetition parseRepetition() throws GrammarException {
        var start = peek().span()
                          .start();
        var inner = parseSingular();
        var quantifier = Quantifier.ONE;
        if (peek() instanceof GrammarToken.Question) {
            quantifier = Quantifier.MAYBE;
        } else if (peek() instanceof GrammarToken.Star) {
            quantifier = Quantifier.ANY;
        } else if (peek() instanceof GrammarToken.Plus) {
            quantifier = Quantifier.MANY;
        }
        if (quantifier != Quantifier.ONE) {
            advance();
            if (isQuantifier(peek())) {
                throw syntax(peek().span(), "Repeated quantifier");
            }
        }
        return new Expression.Repetition(SourceSpan.of(start, lastEnd), inner, quantifier);
    }

    private boolean isQuantifier(GrammarToken token) {
        return token instanceof GrammarToken.Question
               || token instanceof GrammarToken.Star
               || token instanceof GrammarToken.Plus;
    }

    private Expression.Singular parseSingular() throws GrammarException {
        var token = peek();

        if (token instanceof GrammarToken.Identifier id) {
            advance();
            return new Expression.SymbolRef(id.span(), id.name());
        }

        if (token instanceof GrammarToken.StringLiteral str) {
            advance();
            var text = PatternCompiler.compileLiteral(str.source(), str.span(), currentRule);
            return new Expression.Literal(str.span(), str.source(), text);
        }

        if (token instanceof GrammarToken.CharSetLiteral set) {
            advance();
            var matcher = PatternCompiler.compileCharacterSet(set.source(), set.span(), currentRule);
            return new Expression.CharacterSet(set.span(), set.source(), matcher);
        }

        if (token instanceof GrammarToken.CharLiteral chr) {
            advance();
            int codePoint = PatternCompiler.compileCharacter(chr.source(), chr.span(), currentRule);
            return new Expression.Literal(chr.span(), chr.source(), Character.toString(codePoint));
        }

        if (token instanceof GrammarToken.LParen open) {
            advance();
            var inner = parseAlternation(false, RuleKind.PRODUCTION);
            if (!(peek() instanceof GrammarToken.RParen)) {
                throw syntax(open.span(), "Unmatched '('");
            }
            advance();
            return new Expression.Nested(SourceSpan.of(open.span()
                                                           .start(), lastEnd), inner);
        }

        throw unexpected("expression");
    }

    // === Token access ===

    private Optional<String> collectDocs() {
        var docs = new ArrayList<String>();
        while (tokens.get(pos) instanceof GrammarToken.Docstring doc) {
            if (!doc.text()
                    .isEmpty()) {
                docs.add(doc.text());
            }
            pos++;
        }
        return docs.isEmpty()
               ? Optional.empty()
               : Optional.of(String.join("\n", docs));
    }

    /**
     * Current token; docstrings outside rule and alternative heads read as plain comments.
     */
    private GrammarToken peek() {
        while (tokens.get(pos) instanceof GrammarToken.Docstring) {
            pos++;
        }
        return tokens.get(pos);
    }

    private GrammarToken tokenAfter(int index) {
        int i = index;
        while (i < tokens.size() && tokens.get(i) instanceof GrammarToken.Docstring) {
            i++;
        }
        return i < tokens.size()
               ? tokens.get(i)
               : tokens.get(tokens.size() - 1);
    }

    private void advance() {
        var token = peek();
        if (!(token instanceof GrammarToken.Eof) && !(token instanceof GrammarToken.Error)) {
            lastEnd = token.span()
                           .end();
            pos++;
        }
    }

    private GrammarException unexpected(String expected) {
        var token = peek();
        if (token instanceof GrammarToken.Error error) {
            return syntax(error.span(), error.message());
        }
        return syntax(token.span(), "Expected " + expected + ", found " + tokenDescription(token));
    }

    private GrammarException syntax(SourceSpan span, String reason) {
        return new GrammarException(new GrammarError.Syntax(span, currentRule, reason));
    }

    private String tokenDescription(GrammarToken token) {
        if (token instanceof GrammarToken.Identifier id) {
            return "identifier '" + id.name() + "'";
        }
        if (token instanceof GrammarToken.StringLiteral s) {
            return "string literal " + s.source();
        }
        if (token instanceof GrammarToken.CharSetLiteral c) {
            return "character set " + c.source();
        }
        if (token instanceof GrammarToken.CharLiteral c) {
            return "character " + c.source();
        }
        if (token instanceof GrammarToken.Produces) return "'::='";
        if (token instanceof GrammarToken.Matches) return "':=='";
        if (token instanceof GrammarToken.Arrow) return "'->'";
        if (token instanceof GrammarToken.Pipe) return "'|'";
        if (token instanceof GrammarToken.Semicolon) return "';'";
        if (token instanceof GrammarToken.Question) return "'?'";
        if (token instanceof GrammarToken.Star) return "'*'";
        if (token instanceof GrammarToken.Plus) return "'+'";
        if (token instanceof GrammarToken.LParen) return "'('";
        if (token instanceof GrammarToken.RParen) return "')'";
        if (token instanceof GrammarToken.Eof) return "end of input";
        return "error";
    }
}
