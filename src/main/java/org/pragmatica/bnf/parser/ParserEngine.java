package org.pragmatica.bnf.parser;

import com.google.common.base.Preconditions;
import org.pragmatica.bnf.error.LexException;
import org.pragmatica.bnf.error.ParseError;
import org.pragmatica.bnf.error.ParseException;
import org.pragmatica.bnf.grammar.Expression;
import org.pragmatica.bnf.grammar.Rule;
import org.pragmatica.bnf.grammar.RuleSet;
import org.pragmatica.bnf.lexer.TokenStream;
import org.pragmatica.bnf.lexer.Tokenizer;
import org.pragmatica.bnf.tree.AstNode;
import org.pragmatica.bnf.tree.Node;
import org.pragmatica.bnf.tree.SourceLocation;
import org.pragmatica.bnf.tree.SourceSpan;
import org.pragmatica.bnf.tree.Token;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Ordered-choice engine - interprets production rules to parse text or tokens.
 *
 * <p>Alternatives are tried in order and the first whose body matches wins. Repetitions are greedy and never
 * give back iterations. Re-entering a rule at the position where it is already active aborts the parse.
 */
public final class ParserEngine implements Parser {
    private final RuleSet rules;
    private final Tokenizer tokenizer;
    private final ParserConfig config;
    private final Optional<VariantTable> variants;

    ParserEngine(RuleSet rules, Tokenizer tokenizer, ParserConfig config, Optional<VariantTable> variants) {
        this.rules = rules;
        this.tokenizer = tokenizer;
        this.config = config;
        this.variants = variants;
    }

    @Override
    public Parser withVariants(VariantTable variants) {
        return new ParserEngine(rules, tokenizer, config, Optional.of(variants));
    }

    @Override
    public AstNode parse(String input) throws ParseException {
        var startRule = rules.startRule();
        if (startRule.isEmpty()) {
            throw new ParseException(new ParseError.UnknownRule(SourceLocation.START, "<start>"));
        }
        return parse(startRule.get()
                              .name(), input);
    }

    @Override
    public AstNode parse(String startRule, String input) throws ParseException {
        return run(startRule, ParsingContext.forText(input, config), true);
    }

    @Override
    public AstNode parsePrefix(String startRule, String input) throws ParseException {
        return run(startRule, ParsingContext.forText(input, config), false);
    }

    @Override
    public AstNode parse(String startRule, TokenStream tokens) throws ParseException {
        try {
            return parse(startRule, tokens.toList());
        } catch (LexException e) {
            throw new ParseException(e);
        }
    }

    @Override
    public AstNode parse(String startRule, List<Token> tokens) throws ParseException {
        return run(startRule, ParsingContext.forTokens(tokens, config), true);
    }

    private AstNode run(String startRule, ParsingContext ctx, boolean requireEnd) throws ParseException {
        var rule = rules.rule(startRule)
                        .filter(Rule::isProduction)
                        .orElseThrow(() -> new ParseException(new ParseError.UnknownRule(SourceLocation.START,
                                                                                         startRule)));
        skipWhitespace(ctx);

        ParseResult result;
        try {
            result = parseRule(ctx, rule);
        } catch (NoProgressException e) {
            throw new ParseException(e.error);
        }

        if (result instanceof ParseResult.Success success) {
            if (requireEnd && !ctx.isAtEnd()) {
                throw new ParseException(new ParseError.TrailingInput(ctx.location(), ctx.found()));
            }
            return success.node();
        }
        throw new ParseException(new ParseError.NoAlternativeMatched(ctx.furthestLocation(),
                                                                     ctx.furthestExpected(),
                                                                     ctx.furthestFound()));
    }

    // === Rule Parsing ===

    private ParseResult parseRule(ParsingContext ctx, Rule rule) {
        int startPos = ctx.pos();
        var cached = ctx.cachedAt(rule.name(), startPos);
        if (cached.isPresent()) {
            if (cached.get() instanceof ParseResult.Success success) {
                ctx.reset(success.end());
            }
            return cached.get();
        }

        if (!ctx.enter(rule.name())) {
            throw new NoProgressException(new ParseError.NoProgress(ctx.location(), rule.name()));
        }
        try {
            var start = ctx.mark();
            var alternatives = rule.alternatives();
            for (int position = 0; position < alternatives.size(); position++) {
                var children = new ArrayList<Node>();
                if (parseConcatenation(ctx, alternatives.get(position)
                                                        .body(), children)) {
                    var end = ctx.pos() == startPos
                              ? start.location()
                              : ctx.lastEnd();
                    var node = new AstNode(rule.name(),
                                           variantTag(rule, position),
                                           children,
                                           SourceSpan.of(start.location(), end));
                    var success = new ParseResult.Success(node, ctx.mark());
                    ctx.cacheAt(rule.name(), startPos, success);
                    return success;
                }
                ctx.reset(start);
            }
            ctx.cacheAt(rule.name(), startPos, ParseResult.FAILURE);
            return ParseResult.FAILURE;
        } finally {
            ctx.exit(rule.name(), startPos);
        }
    }

    private String variantTag(Rule rule, int position) {
        return variants.map(table -> table.tag(rule.name(), position))
                       .orElse("");
    }

    // === Expression Parsing ===

    private boolean parseConcatenation(ParsingContext ctx, Expression.Concatenation concatenation, List<Node> children) {
        for (var element : concatenation.elements()) {
            if (!parseRepetition(ctx, element, children)) {
                return false;
            }
        }
        return true;
    }

    private boolean parseRepetition(ParsingContext ctx, Expression.Repetition repetition, List<Node> children) {
        var quantifier = repetition.quantifier();
        if (!quantifier.isRepeated()) {
            var mark = ctx.mark();
            var matched = new ArrayList<Node>();
            if (parseSingular(ctx, repetition.inner(), matched)) {
                children.addAll(matched);
                return true;
            }
            ctx.reset(mark);
            return quantifier.isOptional();
        }

        int count = 0;
        while (true) {
            var mark = ctx.mark();
            var matched = new ArrayList<Node>();
            if (!parseSingular(ctx, repetition.inner(), matched)) {
                ctx.reset(mark);
                break;
            }
            children.addAll(matched);
            count++;
            if (ctx.pos() == mark.pos()) {
                // An iteration that consumed nothing would repeat forever
                break;
            }
        }
        return count > 0 || quantifier.isOptional();
    }

    private boolean parseSingular(ParsingContext ctx, Expression.Singular singular, List<Node> children) {
        if (singular instanceof Expression.SymbolRef ref) {
            var rule = rules.rule(ref.name())
                            .orElseThrow(() -> new IllegalStateException("Unresolved rule reference: " + ref.name()));
            if (rule.isProduction()) {
                var result = parseRule(ctx, rule);
                if (result instanceof ParseResult.Success success) {
                    children.add(success.node());
                    return true;
                }
                return false;
            }
            return matchToken(ctx, rule, children);
        }
        if (singular instanceof Expression.Nested nested) {
            for (var alternative : nested.alternation()
                                         .alternatives()) {
                var mark = ctx.mark();
                var matched = new ArrayList<Node>();
                if (parseConcatenation(ctx, alternative.body(), matched)) {
                    children.addAll(matched);
                    return true;
                }
                ctx.reset(mark);
            }
            return false;
        }
        throw new IllegalStateException("Pattern not lifted into a token rule: " + singular);
    }

    // === Terminal Parsers ===

    private boolean matchToken(ParsingContext ctx, Rule rule, List<Node> children) {
        if (ctx.isTextMode()) {
            return matchText(ctx, rule, children);
        }
        var token = ctx.currentToken();
        if (token.isEmpty() || !token.get()
                                     .rule()
                                     .equals(rule.name())) {
            ctx.updateFurthest(rule.name());
            return false;
        }
        children.add(token.get());
        ctx.consumeToken();
        return true;
    }

    private boolean matchText(ParsingContext ctx, Rule rule, List<Node> children) {
        var matcher = tokenizer.matcher(rule.name());
        Preconditions.checkState(matcher.isPresent(), "No matcher for token rule %s", rule.name());

        var end = matcher.get()
                         .match(ctx.input(), ctx.pos());
        if (end.isEmpty()) {
            ctx.updateFurthest(rule.name());
            return false;
        }
        var start = ctx.location();
        var text = ctx.input()
                      .substring(ctx.pos(), end.getAsInt());
        ctx.consumeText(end.getAsInt());
        children.add(new Token(rule.name(), text, SourceSpan.of(start, ctx.location())));
        skipWhitespace(ctx);
        return true;
    }

    private void skipWhitespace(ParsingContext ctx) {
        if (!ctx.isTextMode()) {
            return;
        }
        var whitespace = tokenizer.whitespace();
        if (whitespace.isEmpty()) {
            return;
        }
        while (!ctx.isAtEnd()) {
            var end = whitespace.get()
                                .match(ctx.input(), ctx.pos());
            if (end.isEmpty()) {
                return;
            }
            ctx.skipText(end.getAsInt());
        }
    }

    /**
     * Unwinds the whole parse when left recursion is detected.
     */
    private static final class NoProgressException extends RuntimeException {
        private final ParseError.NoProgress error;

        private NoProgressException(ParseError.NoProgress error) {
            super(error.message(), null, false, false);
            this.error = error;
        }
    }
}
