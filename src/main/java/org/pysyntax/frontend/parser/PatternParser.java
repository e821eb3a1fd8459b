package org.pysyntax.frontend.parser;

import org.pysyntax.api.ParseException;
import org.pysyntax.frontend.lexer.Token;
import org.pysyntax.frontend.lexer.TokenType;
import org.pysyntax.frontend.parser.ast.BinaryOperator;
import org.pysyntax.frontend.parser.ast.ConstantValue;
import org.pysyntax.frontend.parser.ast.ExprContext;
import org.pysyntax.frontend.parser.ast.Expression;
import org.pysyntax.frontend.parser.ast.Pattern;
import org.pysyntax.frontend.parser.ast.UnaryOperator;

import java.util.ArrayList;
import java.util.List;

/**
 * Parses the patterns of {@code case} clauses.
 */
public class PatternParser {

    private static final String WILDCARD = "_";

    private final ParsingContext ctx;
    private final ExpressionParser expressions;

    public PatternParser(ParsingContext ctx, ExpressionParser expressions) {
        this.ctx = ctx;
        this.expressions = expressions;
    }

    /**
     * Parses the pattern after {@code case}: a single pattern or an open sequence {@code a, *rest}.
     */
    public Pattern patterns() throws ParseException {
        Token start = ctx.peek();
        Pattern first = maybeStarPattern();
        if (!ctx.check(TokenType.COMMA)) {
            if (first instanceof Pattern.MatchStar) {
                throw ctx.error(first, "can't use starred pattern here");
            }
            return first;
        }
        List<Pattern> elements = new ArrayList<>();
        elements.add(first);
        while (ctx.match(TokenType.COMMA)) {
            if (ctx.check(TokenType.IF) || ctx.check(TokenType.COLON)) {
                break;
            }
            elements.add(maybeStarPattern());
        }
        return new Pattern.MatchSequence(elements, ctx.rangeFrom(start));
    }

    private Pattern maybeStarPattern() throws ParseException {
        if (ctx.check(TokenType.STAR)) {
            Token star = ctx.advance();
            Token name = expressions.consumeName("expected name after '*' in pattern");
            String bound = WILDCARD.equals(name.text()) ? null : name.text();
            return new Pattern.MatchStar(bound, ctx.rangeFrom(star));
        }
        return pattern();
    }

    /**
     * Parses an or-pattern with an optional {@code as} binding.
     */
    public Pattern pattern() throws ParseException {
        Pattern pattern = orPattern();
        if (ctx.match(TokenType.AS)) {
            Token name = expressions.consumeName("expected name after 'as'");
            if (WILDCARD.equals(name.text())) {
                throw ctx.error(name, "cannot use '_' as a target");
            }
            return new Pattern.MatchAs(pattern, name.text(), ctx.rangeFrom(pattern));
        }
        return pattern;
    }

    private Pattern orPattern() throws ParseException {
        Pattern first = closedPattern();
        if (!ctx.check(TokenType.PIPE)) {
            return first;
        }
        List<Pattern> alternatives = new ArrayList<>();
        alternatives.add(first);
        while (ctx.match(TokenType.PIPE)) {
            alternatives.add(closedPattern());
        }
        return new Pattern.MatchOr(alternatives, ctx.rangeFrom(first));
    }

    private Pattern closedPattern() throws ParseException {
        Token token = ctx.peek();
        switch (token.type()) {
            case NONE:
                ctx.advance();
                return new Pattern.MatchSingleton(ConstantValue.NONE, ctx.rangeFrom(token));
            case TRUE:
                ctx.advance();
                return new Pattern.MatchSingleton(ConstantValue.TRUE, ctx.rangeFrom(token));
            case FALSE:
                ctx.advance();
                return new Pattern.MatchSingleton(ConstantValue.FALSE, ctx.rangeFrom(token));
            case NUMBER, MINUS:
                return new Pattern.MatchValue(signedNumber(), ctx.rangeFrom(token));
            case STRING:
                return new Pattern.MatchValue(expressions.strings(), ctx.rangeFrom(token));
            case FSTRING:
                throw ctx.error("patterns may only match literals and attribute lookups");
            case NAME:
                return namePattern();
            case LEFT_PAREN:
                return groupOrSequence();
            case LEFT_BRACKET:
                return sequence();
            case LEFT_BRACE:
                return mapping();
            default:
                throw ctx.error("expected pattern", "pattern");
        }
    }

    /**
     * Parses a signed real number, optionally followed by {@code + imaginary} or {@code - imaginary}.
     */
    private Expression signedNumber() throws ParseException {
        Token start = ctx.peek();
        Expression real = signedReal();
        if (ctx.check(TokenType.PLUS) || ctx.check(TokenType.MINUS)) {
            BinaryOperator op = ctx.advance().type() == TokenType.PLUS ? BinaryOperator.ADD : BinaryOperator.SUB;
            Token imagToken = ctx.consume(TokenType.NUMBER, "expected imaginary number in complex literal pattern");
            Expression imag = number(imagToken);
            if (!(((Expression.Constant) imag).value() instanceof ConstantValue.Complex)) {
                throw ctx.error(imagToken, "imaginary number required in complex literal");
            }
            return new Expression.BinOp(real, op, imag, ctx.rangeFrom(start));
        }
        return real;
    }

    private Expression signedReal() throws ParseException {
        if (ctx.check(TokenType.MINUS)) {
            Token minus = ctx.advance();
            Expression operand = number(ctx.consume(TokenType.NUMBER, "expected number after '-' in pattern"));
            return new Expression.UnaryOp(UnaryOperator.USUB, operand, ctx.rangeFrom(minus));
        }
        return number(ctx.advance());
    }

    private Expression number(Token token) {
        return expressions.numberLiteral(token);
    }

    private Pattern namePattern() throws ParseException {
        Token first = ctx.advance();
        if (!ctx.check(TokenType.DOT) && !ctx.check(TokenType.LEFT_PAREN)) {
            if (WILDCARD.equals(first.text())) {
                return new Pattern.MatchAs(null, null, ctx.rangeFrom(first));
            }
            return new Pattern.MatchAs(null, first.text(), ctx.rangeFrom(first));
        }
        Expression value = new Expression.Name(first.text(), ExprContext.LOAD, ctx.rangeFrom(first));
        while (ctx.match(TokenType.DOT)) {
            Token attr = expressions.consumeName("expected attribute name after '.'");
            value = new Expression.Attribute(value, attr.text(), ExprContext.LOAD, ctx.rangeFrom(first));
        }
        if (ctx.match(TokenType.LEFT_PAREN)) {
            return classPattern(first, value);
        }
        return new Pattern.MatchValue(value, ctx.rangeFrom(first));
    }

    private Pattern classPattern(Token start, Expression cls) throws ParseException {
        List<Pattern> patterns = new ArrayList<>();
        List<String> kwdAttrs = new ArrayList<>();
        List<Pattern> kwdPatterns = new ArrayList<>();
        while (!ctx.check(TokenType.RIGHT_PAREN)) {
            if (ctx.check(TokenType.NAME) && ctx.checkAt(1, TokenType.EQUAL)) {
                Token attr = ctx.advance();
                ctx.advance();
                if (kwdAttrs.contains(attr.text())) {
                    throw ctx.error(attr, "attribute name repeated in class pattern: " + attr.text());
                }
                kwdAttrs.add(attr.text());
                kwdPatterns.add(pattern());
            } else {
                Pattern positional = pattern();
                if (!kwdAttrs.isEmpty()) {
                    throw ctx.error(positional, "positional patterns follow keyword patterns");
                }
                patterns.add(positional);
            }
            if (!ctx.match(TokenType.COMMA)) {
                break;
            }
        }
        ctx.consume(TokenType.RIGHT_PAREN, "expected ')' to close the class pattern");
        return new Pattern.MatchClass(cls, patterns, kwdAttrs, kwdPatterns, ctx.rangeFrom(start));
    }

    private Pattern groupOrSequence() throws ParseException {
        Token open = ctx.advance();
        if (ctx.match(TokenType.RIGHT_PAREN)) {
            return new Pattern.MatchSequence(List.of(), ctx.rangeFrom(open));
        }
        Pattern first = maybeStarPattern();
        if (ctx.match(TokenType.RIGHT_PAREN)) {
            if (first instanceof Pattern.MatchStar) {
                return new Pattern.MatchSequence(List.of(first), ctx.rangeFrom(open));
            }
            return first;
        }
        List<Pattern> elements = new ArrayList<>();
        elements.add(first);
        while (ctx.match(TokenType.COMMA)) {
            if (ctx.check(TokenType.RIGHT_PAREN)) {
                break;
            }
            elements.add(maybeStarPattern());
        }
        ctx.consume(TokenType.RIGHT_PAREN, "expected ')' to close the sequence pattern");
        return new Pattern.MatchSequence(elements, ctx.rangeFrom(open));
    }

    private Pattern sequence() throws ParseException {
        Token open = ctx.advance();
        List<Pattern> elements = new ArrayList<>();
        while (!ctx.check(TokenType.RIGHT_BRACKET)) {
            elements.add(maybeStarPattern());
            if (!ctx.match(TokenType.COMMA)) {
                break;
            }
        }
        ctx.consume(TokenType.RIGHT_BRACKET, "expected ']' to close the sequence pattern");
        long stars = elements.stream().filter(p -> p instanceof Pattern.MatchStar).count();
        if (stars > 1) {
            throw ctx.error(open, "multiple starred names in sequence pattern");
        }
        return new Pattern.MatchSequence(elements, ctx.rangeFrom(open));
    }

    private Pattern mapping() throws ParseException {
        Token open = ctx.advance();
        List<Expression> keys = new ArrayList<>();
        List<Pattern> values = new ArrayList<>();
        String rest = null;
        while (!ctx.check(TokenType.RIGHT_BRACE)) {
            if (ctx.match(TokenType.DOUBLE_STAR)) {
                Token name = expressions.consumeName("expected name after '**' in mapping pattern");
                rest = name.text();
                ctx.match(TokenType.COMMA);
                break;
            }
            keys.add(mappingKey());
            ctx.consume(TokenType.COLON, "expected ':' after mapping pattern key");
            values.add(pattern());
            if (!ctx.match(TokenType.COMMA)) {
                break;
            }
        }
        ctx.consume(TokenType.RIGHT_BRACE, "expected '}' to close the mapping pattern");
        return new Pattern.MatchMapping(keys, values, rest, ctx.rangeFrom(open));
    }

    private Expression mappingKey() throws ParseException {
        Token token = ctx.peek();
        switch (token.type()) {
            case NONE:
                ctx.advance();
                return new Expression.Constant(ConstantValue.NONE, null, ctx.rangeFrom(token));
            case TRUE:
                ctx.advance();
                return new Expression.Constant(ConstantValue.TRUE, null, ctx.rangeFrom(token));
            case FALSE:
                ctx.advance();
                return new Expression.Constant(ConstantValue.FALSE, null, ctx.rangeFrom(token));
            case NUMBER, MINUS:
                return signedNumber();
            case STRING:
                return expressions.strings();
            case NAME: {
                Token first = ctx.advance();
                Expression value = new Expression.Name(first.text(), ExprContext.LOAD, ctx.rangeFrom(first));
                if (!ctx.check(TokenType.DOT)) {
                    throw ctx.error(first, "mapping pattern keys may only match literals and attribute lookups");
                }
                while (ctx.match(TokenType.DOT)) {
                    Token attr = expressions.consumeName("expected attribute name after '.'");
                    value = new Expression.Attribute(value, attr.text(), ExprContext.LOAD, ctx.rangeFrom(first));
                }
                return value;
            }
            default:
                throw ctx.error("mapping pattern keys may only match literals and attribute lookups", "pattern key");
        }
    }
}
