package org.alani.peg.parser;

import org.alani.peg.error.ParseError;
import org.alani.peg.error.ParseException;
import org.alani.peg.grammar.Expression;
import org.alani.peg.grammar.Grammar;
import org.alani.peg.grammar.Rule;
import org.alani.peg.tree.CstNode;
import org.alani.peg.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * PEG parsing engine - interprets Grammar to parse input text.
 *
 * <p>Only rule applications produce nodes. Implicit whitespace, as described by the
 * {@code %whitespace} directive, is skipped before each rule and between the elements
 * of sequences and repetitions, except inside token boundaries and before predicates.
 */
public final class PegEngine implements Parser {

    private final Grammar grammar;
    private final ParserConfig config;
    private final Map<String, Rule> rules;

    private PegEngine(Grammar grammar, ParserConfig config) {
        this.grammar = grammar;
        this.config = config;
        this.rules = grammar.ruleMap();
    }

    /**
     * Create an engine for an already validated grammar.
     */
    public static PegEngine create(Grammar grammar, ParserConfig config) {
        return new PegEngine(grammar, config);
    }

    @Override
    public List<CstNode> parse(String input) throws ParseException {
        var startRule = grammar.startRule();
        if (startRule.isEmpty()) {
            throw new ParseException(new ParseError.SemanticError(
                SourceLocation.START,
                "No start rule defined in grammar"
            ));
        }
        return parse(input, startRule.get().name());
    }

    @Override
    public List<CstNode> parse(String input, String startRule) throws ParseException {
        if (input.length() > config.maxInputLength()) {
            throw new ParseException(new ParseError.InputTooLarge(input.length(), config.maxInputLength()));
        }
        var rule = rules.get(startRule);
        if (rule == null) {
            throw new ParseException(new ParseError.SemanticError(
                SourceLocation.START,
                "Unknown rule: " + startRule
            ));
        }

        var ctx = ParsingContext.create(input, grammar, config);
        var result = parseRule(ctx, rule);

        var overflow = ctx.nestingOverflow();
        if (overflow.isPresent()) {
            throw new ParseException(new ParseError.NestingTooDeep(overflow.get(), config.maxDepth()));
        }
        if (result instanceof ParseResult.Failure failure) {
            throw new ParseException(furthestError(ctx, failure.location(), failure.expected()));
        }

        skipWhitespace(ctx);

        // Check if we consumed all input
        if (!ctx.isAtEnd()) {
            if (ctx.furthestPos() > ctx.pos()) {
                throw new ParseException(furthestError(ctx, ctx.location(), "end of input"));
            }
            throw new ParseException(new ParseError.UnexpectedInput(
                ctx.location(),
                String.valueOf(ctx.peek()),
                "end of input"
            ));
        }

        return ((ParseResult.Success) result).nodes();
    }

    @Override
    public CstNode parseCst(String input) throws ParseException {
        var nodes = parse(input);
        if (nodes.size() != 1) {
            throw new ParseException(new ParseError.SemanticError(
                SourceLocation.START,
                "Start rule produced " + nodes.size() + " nodes instead of a single root"
            ));
        }
        return nodes.get(0);
    }

    /**
     * Report the furthest position any alternative reached, which is where the input
     * actually stopped making sense.
     */
    private ParseError furthestError(ParsingContext ctx, SourceLocation fallbackLocation, String fallbackExpected) {
        var useFurthest = !ctx.furthestExpected().isEmpty()
            && ctx.furthestPos() >= fallbackLocation.offset();
        var location = useFurthest ? ctx.furthestLocation() : fallbackLocation;
        var expected = useFurthest ? ctx.furthestExpected() : fallbackExpected;
        if (location.offset() >= ctx.input().length()) {
            return new ParseError.UnexpectedEof(location, expected);
        }
        return new ParseError.UnexpectedInput(
            location,
            String.valueOf(ctx.input().charAt(location.offset())),
            expected
        );
    }

    // === Rule Parsing ===

    private ParseResult parseRule(ParsingContext ctx, Rule rule) {
        if (!ctx.enterRule()) {
            return ParseResult.Failure.at(ctx.location(), rule.name());
        }
        try {
            return parseRuleBody(ctx, rule);
        } finally {
            ctx.exitRule();
        }
    }

    private ParseResult parseRuleBody(ParsingContext ctx, Rule rule) {
        var startPos = ctx.pos();
        var startLoc = ctx.location();
        // Results inside a token boundary depend on the boundary, so only cache outside it
        var cacheable = !ctx.inTokenBoundary();

        if (cacheable) {
            var cached = ctx.getCachedAt(rule.name(), startPos);
            if (cached.isPresent()) {
                var result = cached.get();
                if (result instanceof ParseResult.Success success) {
                    ctx.restoreLocation(success.endLocation());
                }
                return result;
            }
        }

        skipWhitespace(ctx);
        var nodeStart = ctx.location();

        var result = parseExpression(ctx, rule.expression());

        if (result instanceof ParseResult.Success success) {
            var nodes = rule.isInline()
                ? success.nodes()
                : List.of(CstNode.of(
                    ctx.spanFrom(nodeStart),
                    rule.name(),
                    ctx.substring(nodeStart.offset(), ctx.pos()),
                    success.nodes()
                ));
            result = ParseResult.Success.of(nodes, ctx.location());
        } else {
            ctx.restoreLocation(startLoc);
        }

        if (cacheable) {
            ctx.cacheAt(rule.name(), startPos, result);
        }
        return result;
    }

    // === Expression Parsing ===

    private ParseResult parseExpression(ParsingContext ctx, Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return parseLiteral(ctx, lit);
        }
        if (expr instanceof Expression.CharClass cc) {
            return parseCharClass(ctx, cc);
        }
        if (expr instanceof Expression.Any) {
            return parseAny(ctx);
        }
        if (expr instanceof Expression.Reference ref) {
            return parseReference(ctx, ref);
        }
        if (expr instanceof Expression.Sequence seq) {
            return parseSequence(ctx, seq);
        }
        if (expr instanceof Expression.Choice choice) {
            return parseChoice(ctx, choice);
        }
        if (expr instanceof Expression.ZeroOrMore zom) {
            return parseRepeated(ctx, zom.expression(), 0, Integer.MAX_VALUE);
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return parseRepeated(ctx, oom.expression(), 1, Integer.MAX_VALUE);
        }
        if (expr instanceof Expression.Optional opt) {
            return parseRepeated(ctx, opt.expression(), 0, 1);
        }
        if (expr instanceof Expression.Repetition rep) {
            return parseRepeated(ctx, rep.expression(), rep.min(), rep.max().orElse(Integer.MAX_VALUE));
        }
        if (expr instanceof Expression.And and) {
            return parseAnd(ctx, and);
        }
        if (expr instanceof Expression.Not not) {
            return parseNot(ctx, not);
        }
        if (expr instanceof Expression.TokenBoundary tb) {
            return parseTokenBoundary(ctx, tb);
        }
        if (expr instanceof Expression.Ignore ign) {
            return parseIgnore(ctx, ign);
        }
        if (expr instanceof Expression.Group grp) {
            return parseExpression(ctx, grp.expression());
        }
        throw new IllegalStateException("Unsupported expression: " + expr);
    }

    // === Terminal Parsers ===

    private ParseResult parseLiteral(ParsingContext ctx, Expression.Literal lit) {
        var text = lit.text();
        var expected = "'" + text + "'";
        if (ctx.remaining() < text.length()) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        for (int i = 0; i < text.length(); i++) {
            if (!sameChar(text.charAt(i), ctx.peek(i), lit.caseInsensitive())) {
                ctx.updateFurthest(expected);
                return ParseResult.Failure.at(ctx.location(), expected);
            }
        }

        // Consume the matched text
        for (int i = 0; i < text.length(); i++) {
            ctx.advance();
        }
        return ParseResult.Success.empty(ctx.location());
    }

    private static boolean sameChar(char expected, char actual, boolean caseInsensitive) {
        return caseInsensitive
            ? Character.toLowerCase(expected) == Character.toLowerCase(actual)
            : expected == actual;
    }

    private ParseResult parseCharClass(ParsingContext ctx, Expression.CharClass cc) {
        var expected = "[" + (cc.negated() ? "^" : "") + cc.pattern() + "]";
        if (ctx.isAtEnd()) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        boolean matches = matchesCharClass(ctx.peek(), cc.pattern(), cc.caseInsensitive());
        if (cc.negated()) {
            matches = !matches;
        }

        if (!matches) {
            ctx.updateFurthest(expected);
            return ParseResult.Failure.at(ctx.location(), expected);
        }

        ctx.advance();
        return ParseResult.Success.empty(ctx.location());
    }

    private boolean matchesCharClass(char c, String pattern, boolean caseInsensitive) {
        char testChar = caseInsensitive ? Character.toLowerCase(c) : c;
        int i = 0;
        while (i < pattern.length()) {
            char start = pattern.charAt(i);
            if (start == '\\' && i + 1 < pattern.length()) {
                char escaped = pattern.charAt(i + 1);
                int consumed = 2;
                char expected;
                if (escaped == 'x' && i + 4 <= pattern.length() && isHex(pattern, i + 2, 2)) {
                    expected = (char) Integer.parseInt(pattern.substring(i + 2, i + 4), 16);
                    consumed = 4;
                } else if (escaped == 'u' && i + 6 <= pattern.length() && isHex(pattern, i + 2, 4)) {
                    expected = (char) Integer.parseInt(pattern.substring(i + 2, i + 6), 16);
                    consumed = 6;
                } else {
                    expected = switch (escaped) {
                        case 'n' -> '\n';
                        case 'r' -> '\r';
                        case 't' -> '\t';
                        default -> escaped;
                    };
                }
                if (caseInsensitive) {
                    expected = Character.toLowerCase(expected);
                }
                if (testChar == expected) {
                    return true;
                }
                i += consumed;
                continue;
            }

            // Check for range
            if (i + 2 < pattern.length() && pattern.charAt(i + 1) == '-') {
                char end = pattern.charAt(i + 2);
                if (caseInsensitive) {
                    start = Character.toLowerCase(start);
                    end = Character.toLowerCase(end);
                }
                if (testChar >= start && testChar <= end) {
                    return true;
                }
                i += 3;
            } else {
                if (caseInsensitive) {
                    start = Character.toLowerCase(start);
                }
                if (testChar == start) {
                    return true;
                }
                i++;
            }
        }
        return false;
    }

    private static boolean isHex(String text, int from, int digits) {
        for (int i = from; i < from + digits; i++) {
            if (Character.digit(text.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }

    private ParseResult parseAny(ParsingContext ctx) {
        if (ctx.isAtEnd()) {
            ctx.updateFurthest("any character");
            return ParseResult.Failure.at(ctx.location(), "any character");
        }
        ctx.advance();
        return ParseResult.Success.empty(ctx.location());
    }

    // === Combinator Parsers ===

    private ParseResult parseReference(ParsingContext ctx, Expression.Reference ref) {
        var rule = rules.get(ref.ruleName());
        if (rule == null) {
            return ParseResult.Failure.at(ctx.location(), "rule '" + ref.ruleName() + "'");
        }
        return parseRule(ctx, rule);
    }

    private ParseResult parseSequence(ParsingContext ctx, Expression.Sequence seq) {
        var startLoc = ctx.location();
        var nodes = new ArrayList<CstNode>();

        for (var element : seq.elements()) {
            // Skip whitespace between elements, but NOT before predicates
            if (!isPredicate(element)) {
                skipWhitespace(ctx);
            }
            var result = parseExpression(ctx, element);
            if (result instanceof ParseResult.Success success) {
                nodes.addAll(success.nodes());
            } else {
                ctx.restoreLocation(startLoc);
                return result;
            }
        }

        return ParseResult.Success.of(nodes, ctx.location());
    }

    private ParseResult parseChoice(ParsingContext ctx, Expression.Choice choice) {
        var startLoc = ctx.location();
        ParseResult lastFailure = null;

        for (var alt : choice.alternatives()) {
            var result = parseExpression(ctx, alt);
            if (result.isSuccess()) {
                return result;
            }
            lastFailure = result;
            ctx.restoreLocation(startLoc);
        }

        return lastFailure != null
            ? lastFailure
            : ParseResult.Failure.at(ctx.location(), "one of alternatives");
    }

    /**
     * Shared loop for {@code *}, {@code +}, {@code ?} and {@code {n,m}}.
     */
    private ParseResult parseRepeated(ParsingContext ctx, Expression expr, int min, int max) {
        var startLoc = ctx.location();
        var nodes = new ArrayList<CstNode>();
        int count = 0;
        ParseResult lastFailure = null;

        while (count < max) {
            var beforeLoc = ctx.location();
            if (count > 0) {
                skipWhitespace(ctx);
            }

            var result = parseExpression(ctx, expr);
            if (result instanceof ParseResult.Success success) {
                nodes.addAll(success.nodes());
                count++;
            } else {
                lastFailure = result;
                ctx.restoreLocation(beforeLoc);
                break;
            }

            if (ctx.pos() == beforeLoc.offset()) {
                break;
            }
        }

        if (count < min) {
            ctx.restoreLocation(startLoc);
            return lastFailure != null
                ? lastFailure
                : ParseResult.Failure.at(startLoc, "at least " + min + " repetitions");
        }
        return ParseResult.Success.of(nodes, ctx.location());
    }

    private boolean isPredicate(Expression expr) {
        if (expr instanceof Expression.And || expr instanceof Expression.Not) {
            return true;
        }
        return expr instanceof Expression.Group grp && isPredicate(grp.expression());
    }

    // === Predicate Parsers ===

    private ParseResult parseAnd(ParsingContext ctx, Expression.And and) {
        var startLoc = ctx.location();
        var result = parsePredicateOperand(ctx, and.expression());
        // Always restore - predicates don't consume
        ctx.restoreLocation(startLoc);

        if (result.isSuccess()) {
            return ParseResult.Success.empty(startLoc);
        }
        return result;
    }

    private ParseResult parseNot(ParsingContext ctx, Expression.Not not) {
        var startLoc = ctx.location();
        var result = parsePredicateOperand(ctx, not.expression());
        // Always restore - predicates don't consume
        ctx.restoreLocation(startLoc);

        if (result.isSuccess()) {
            return ParseResult.Failure.at(startLoc, "not " + describeExpression(not.expression()));
        }
        return ParseResult.Success.empty(startLoc);
    }

    private ParseResult parsePredicateOperand(ParsingContext ctx, Expression expr) {
        ctx.enterPredicate();
        try {
            return parseExpression(ctx, expr);
        } finally {
            ctx.exitPredicate();
        }
    }

    // === Special Parsers ===

    private ParseResult parseTokenBoundary(ParsingContext ctx, Expression.TokenBoundary tb) {
        // Disable whitespace skipping inside token boundary
        ctx.enterTokenBoundary();
        try {
            return parseExpression(ctx, tb.expression());
        } finally {
            ctx.exitTokenBoundary();
        }
    }

    private ParseResult parseIgnore(ParsingContext ctx, Expression.Ignore ign) {
        var result = parseExpression(ctx, ign.expression());
        if (result.isFailure()) {
            return result;
        }
        return ParseResult.Success.empty(ctx.location());
    }

    // === Helpers ===

    private void skipWhitespace(ParsingContext ctx) {
        // Don't skip whitespace inside token boundaries or during whitespace parsing
        if (grammar.whitespace().isEmpty() || ctx.isSkippingWhitespace() || ctx.inTokenBoundary()) {
            return;
        }

        ctx.enterWhitespaceSkip();
        try {
            // Match one element at a time so a partial comment never swallows real input
            var innerExpr = extractInnerExpression(grammar.whitespace().get());

            while (!ctx.isAtEnd()) {
                var startPos = ctx.pos();
                var result = parseExpression(ctx, innerExpr);
                if (result.isFailure() || ctx.pos() == startPos) {
                    break;
                }
            }
        } finally {
            ctx.exitWhitespaceSkip();
        }
    }

    /**
     * Extract inner expression from repetition operators (ZeroOrMore, OneOrMore).
     */
    private Expression extractInnerExpression(Expression expr) {
        if (expr instanceof Expression.ZeroOrMore zom) {
            return zom.expression();
        }
        if (expr instanceof Expression.OneOrMore oom) {
            return oom.expression();
        }
        if (expr instanceof Expression.Optional opt) {
            return opt.expression();
        }
        return expr;
    }

    private String describeExpression(Expression expr) {
        if (expr instanceof Expression.Literal lit) {
            return "'" + lit.text() + "'";
        }
        if (expr instanceof Expression.CharClass cc) {
            return "[" + cc.pattern() + "]";
        }
        if (expr instanceof Expression.Any) {
            return ".";
        }
        if (expr instanceof Expression.Reference ref) {
            return ref.ruleName();
        }
        return "expression";
    }
}
