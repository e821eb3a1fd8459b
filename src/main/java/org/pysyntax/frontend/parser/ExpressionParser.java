package org.pysyntax.frontend.parser;

import org.pysyntax.api.ParseException;
import org.pysyntax.frontend.lexer.FStringLiteral;
import org.pysyntax.frontend.lexer.FStringPart;
import org.pysyntax.frontend.lexer.ImaginaryLiteral;
import org.pysyntax.frontend.lexer.StringLiteral;
import org.pysyntax.frontend.lexer.Token;
import org.pysyntax.frontend.lexer.TokenType;
import org.pysyntax.frontend.parser.ast.Arg;
import org.pysyntax.frontend.parser.ast.Arguments;
import org.pysyntax.frontend.parser.ast.BinaryOperator;
import org.pysyntax.frontend.parser.ast.BoolOperator;
import org.pysyntax.frontend.parser.ast.CompareOperator;
import org.pysyntax.frontend.parser.ast.Comprehension;
import org.pysyntax.frontend.parser.ast.ConstantValue;
import org.pysyntax.frontend.parser.ast.ExprContext;
import org.pysyntax.frontend.parser.ast.Expression;
import org.pysyntax.frontend.parser.ast.Expression.Constant;
import org.pysyntax.frontend.parser.ast.Expression.Name;
import org.pysyntax.frontend.parser.ast.Expression.Starred;
import org.pysyntax.frontend.parser.ast.Expression.TupleExpr;
import org.pysyntax.frontend.parser.ast.Keyword;
import org.pysyntax.frontend.parser.ast.SourceRange;
import org.pysyntax.frontend.parser.ast.TypeParam;
import org.pysyntax.frontend.parser.ast.UnaryOperator;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses expressions by recursive descent, one method per precedence level.
 * <p>
 * From loosest to tightest binding: conditional and lambda, {@code or}, {@code and}, {@code not},
 * comparisons, {@code |}, {@code ^}, {@code &}, shifts, {@code + -}, {@code * / // % @}, unary
 * {@code + - ~}, {@code **}, {@code await}, then calls, attributes and subscripts on an atom.
 */
public class ExpressionParser {

    @FunctionalInterface
    private interface Rule {
        Expression parse() throws ParseException;
    }

    /**
     * The positional and keyword arguments between the parentheses of a call or class definition.
     *
     * @param args Positional arguments, including {@code *iterable} as {@link Starred}.
     * @param keywords Keyword arguments, including {@code **mapping} with a null name.
     */
    public record CallArguments(List<Expression> args, List<Keyword> keywords) {
    }

    private static final Map<TokenType, BinaryOperator> BIT_OR = operators(TokenType.PIPE, BinaryOperator.BIT_OR);
    private static final Map<TokenType, BinaryOperator> BIT_XOR = operators(TokenType.CARET, BinaryOperator.BIT_XOR);
    private static final Map<TokenType, BinaryOperator> BIT_AND = operators(TokenType.AMPERSAND, BinaryOperator.BIT_AND);
    private static final Map<TokenType, BinaryOperator> SHIFT = operators(
            TokenType.LEFT_SHIFT, BinaryOperator.LSHIFT,
            TokenType.RIGHT_SHIFT, BinaryOperator.RSHIFT);
    private static final Map<TokenType, BinaryOperator> SUM = operators(
            TokenType.PLUS, BinaryOperator.ADD,
            TokenType.MINUS, BinaryOperator.SUB);
    private static final Map<TokenType, BinaryOperator> TERM = operators(
            TokenType.STAR, BinaryOperator.MULT,
            TokenType.SLASH, BinaryOperator.DIV,
            TokenType.DOUBLE_SLASH, BinaryOperator.FLOOR_DIV,
            TokenType.PERCENT, BinaryOperator.MOD,
            TokenType.AT, BinaryOperator.MAT_MULT);

    private final ParsingContext ctx;

    public ExpressionParser(ParsingContext ctx) {
        this.ctx = ctx;
    }

    private static Map<TokenType, BinaryOperator> operators(Object... pairs) {
        Map<TokenType, BinaryOperator> map = new EnumMap<>(TokenType.class);
        for (int i = 0; i < pairs.length; i += 2) {
            map.put((TokenType) pairs[i], (BinaryOperator) pairs[i + 1]);
        }
        return map;
    }

    // region Expression lists

    /**
     * Parses a comma-separated list of possibly starred expressions. A list with a comma becomes an
     * unparenthesized tuple.
     */
    public Expression starExpressions() throws ParseException {
        return expressionList(this::starExpression);
    }

    /**
     * Like {@link #starExpressions()}, but elements may be walrus assignments. Used for match subjects
     * and f-string fields.
     */
    public Expression starNamedExpressions() throws ParseException {
        return expressionList(this::starNamedExpression);
    }

    private Expression expressionList(Rule element) throws ParseException {
        Token start = ctx.peek();
        Expression first = element.parse();
        if (!ctx.check(TokenType.COMMA)) {
            if (first instanceof Starred) {
                throw ctx.error(first, "can't use starred expression here");
            }
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (ctx.match(TokenType.COMMA)) {
            if (!startsExpression()) {
                break;
            }
            elements.add(element.parse());
        }
        return new TupleExpr(elements, ExprContext.LOAD, ctx.rangeFrom(start));
    }

    /**
     * Parses the right-hand side of an assignment, which may be a yield expression.
     */
    public Expression yieldOrStarExpressions() throws ParseException {
        return ctx.check(TokenType.YIELD) ? yieldExpression() : starExpressions();
    }

    private Expression starExpression() throws ParseException {
        if (ctx.check(TokenType.STAR)) {
            Token star = ctx.advance();
            Expression value = bitwiseOr();
            return new Starred(value, ExprContext.LOAD, ctx.rangeFrom(star));
        }
        return expression();
    }

    private Expression starNamedExpression() throws ParseException {
        if (ctx.check(TokenType.STAR)) {
            Token star = ctx.advance();
            Expression value = bitwiseOr();
            return new Starred(value, ExprContext.LOAD, ctx.rangeFrom(star));
        }
        return namedExpression();
    }

    /**
     * Parses a target list of a {@code for} loop or comprehension. Elements are parsed at the
     * bitwise-or level so that the following {@code in} is not taken as a comparison.
     * The result is still in load context.
     */
    public Expression targetList() throws ParseException {
        Token start = ctx.peek();
        Expression first = target();
        if (!ctx.check(TokenType.COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (ctx.match(TokenType.COMMA)) {
            if (!startsExpression()) {
                break;
            }
            elements.add(target());
        }
        return new TupleExpr(elements, ExprContext.LOAD, ctx.rangeFrom(start));
    }

    /**
     * Parses one target: a possibly starred bitwise-or expression.
     */
    public Expression target() throws ParseException {
        if (ctx.check(TokenType.STAR)) {
            Token star = ctx.advance();
            Expression value = bitwiseOr();
            return new Starred(value, ExprContext.LOAD, ctx.rangeFrom(star));
        }
        return bitwiseOr();
    }

    /**
     * @return True if the current token can begin an expression.
     */
    public boolean startsExpression() {
        switch (ctx.peek().type()) {
            case NAME, NUMBER, STRING, FSTRING, NONE, TRUE, FALSE, ELLIPSIS,
                    LEFT_PAREN, LEFT_BRACKET, LEFT_BRACE,
                    MINUS, PLUS, TILDE, NOT, LAMBDA, AWAIT, STAR:
                return true;
            default:
                return false;
        }
    }

    // endregion

    // region Precedence levels

    /**
     * Parses an expression that may be a walrus assignment {@code name := value}.
     */
    public Expression namedExpression() throws ParseException {
        if (ctx.check(TokenType.NAME) && ctx.checkAt(1, TokenType.COLON_EQUAL)) {
            Token nameToken = ctx.advance();
            ctx.advance();
            Name target = new Name(nameToken.text(), ExprContext.STORE, ctx.rangeFrom(nameToken));
            Expression value = expression();
            return new Expression.NamedExpr(target, value, ctx.rangeFrom(nameToken));
        }
        Expression e = expression();
        if (ctx.check(TokenType.COLON_EQUAL)) {
            throw ctx.error(e, "cannot use assignment expressions with " + Targets.describe(e));
        }
        return e;
    }

    /**
     * Parses a full expression without tuples: a conditional expression, lambda, or anything tighter.
     */
    public Expression expression() throws ParseException {
        if (ctx.check(TokenType.LAMBDA)) {
            return lambda();
        }
        Expression body = disjunction();
        if (ctx.match(TokenType.IF)) {
            Expression test = disjunction();
            ctx.consume(TokenType.ELSE, "expected 'else' after 'if' expression");
            Expression orElse = expression();
            return new Expression.IfExp(test, body, orElse, ctx.rangeFrom(body));
        }
        return body;
    }

    private Expression lambda() throws ParseException {
        Token start = ctx.advance();
        Arguments args = ctx.check(TokenType.COLON) ? Arguments.EMPTY : parameters(TokenType.COLON, false);
        ctx.consume(TokenType.COLON, "expected ':'");
        Expression body = expression();
        return new Expression.Lambda(args, body, ctx.rangeFrom(start));
    }

    /**
     * Parses an expression of the {@code or} level or tighter. Comprehension iterables and guards use this level.
     */
    public Expression disjunction() throws ParseException {
        Expression first = conjunction();
        if (!ctx.check(TokenType.OR)) {
            return first;
        }
        List<Expression> values = new ArrayList<>();
        values.add(first);
        while (ctx.match(TokenType.OR)) {
            values.add(conjunction());
        }
        return new Expression.BoolOp(BoolOperator.OR, values, ctx.rangeFrom(first));
    }

    private Expression conjunction() throws ParseException {
        Expression first = inversion();
        if (!ctx.check(TokenType.AND)) {
            return first;
        }
        List<Expression> values = new ArrayList<>();
        values.add(first);
        while (ctx.match(TokenType.AND)) {
            values.add(inversion());
        }
        return new Expression.BoolOp(BoolOperator.AND, values, ctx.rangeFrom(first));
    }

    private Expression inversion() throws ParseException {
        if (ctx.check(TokenType.NOT)) {
            Token not = ctx.advance();
            Expression operand = inversion();
            return new Expression.UnaryOp(UnaryOperator.NOT, operand, ctx.rangeFrom(not));
        }
        return comparison();
    }

    private Expression comparison() throws ParseException {
        Expression left = bitwiseOr();
        List<CompareOperator> ops = new ArrayList<>();
        List<Expression> comparators = new ArrayList<>();
        while (true) {
            CompareOperator op = compareOperator();
            if (op == null) {
                break;
            }
            ops.add(op);
            comparators.add(bitwiseOr());
        }
        if (ops.isEmpty()) {
            return left;
        }
        return new Expression.Compare(left, ops, comparators, ctx.rangeFrom(left));
    }

    private CompareOperator compareOperator() {
        switch (ctx.peek().type()) {
            case EQUAL_EQUAL: ctx.advance(); return CompareOperator.EQ;
            case NOT_EQUAL: ctx.advance(); return CompareOperator.NOT_EQ;
            case LESS: ctx.advance(); return CompareOperator.LT;
            case LESS_EQUAL: ctx.advance(); return CompareOperator.LT_E;
            case GREATER: ctx.advance(); return CompareOperator.GT;
            case GREATER_EQUAL: ctx.advance(); return CompareOperator.GT_E;
            case IN: ctx.advance(); return CompareOperator.IN;
            case IS:
                ctx.advance();
                return ctx.match(TokenType.NOT) ? CompareOperator.IS_NOT : CompareOperator.IS;
            case NOT:
                if (ctx.checkAt(1, TokenType.IN)) {
                    ctx.advance();
                    ctx.advance();
                    return CompareOperator.NOT_IN;
                }
                return null;
            default:
                return null;
        }
    }

    /**
     * Parses an expression of the {@code |} level or tighter. Targets and pattern values use this level.
     */
    public Expression bitwiseOr() throws ParseException {
        return leftAssociative(this::bitwiseXor, BIT_OR);
    }

    private Expression bitwiseXor() throws ParseException {
        return leftAssociative(this::bitwiseAnd, BIT_XOR);
    }

    private Expression bitwiseAnd() throws ParseException {
        return leftAssociative(this::shift, BIT_AND);
    }

    private Expression shift() throws ParseException {
        return leftAssociative(this::sum, SHIFT);
    }

    private Expression sum() throws ParseException {
        return leftAssociative(this::term, SUM);
    }

    private Expression term() throws ParseException {
        return leftAssociative(this::factor, TERM);
    }

    private Expression leftAssociative(Rule operand, Map<TokenType, BinaryOperator> operators) throws ParseException {
        Expression left = operand.parse();
        while (operators.containsKey(ctx.peek().type())) {
            BinaryOperator op = operators.get(ctx.advance().type());
            Expression right = operand.parse();
            left = new Expression.BinOp(left, op, right, ctx.rangeFrom(left));
        }
        return left;
    }

    private Expression factor() throws ParseException {
        UnaryOperator op;
        switch (ctx.peek().type()) {
            case PLUS: op = UnaryOperator.UADD; break;
            case MINUS: op = UnaryOperator.USUB; break;
            case TILDE: op = UnaryOperator.INVERT; break;
            default: return power();
        }
        Token start = ctx.advance();
        Expression operand = factor();
        return new Expression.UnaryOp(op, operand, ctx.rangeFrom(start));
    }

    private Expression power() throws ParseException {
        Expression base = awaitPrimary();
        if (ctx.match(TokenType.DOUBLE_STAR)) {
            // The exponent binds through unary operators and associates to the right: 2 ** -3 ** 2.
            Expression exponent = factor();
            return new Expression.BinOp(base, BinaryOperator.POW, exponent, ctx.rangeFrom(base));
        }
        return base;
    }

    private Expression awaitPrimary() throws ParseException {
        if (ctx.check(TokenType.AWAIT)) {
            Token start = ctx.advance();
            Expression value = primary();
            return new Expression.Await(value, ctx.rangeFrom(start));
        }
        return primary();
    }

    private Expression primary() throws ParseException {
        Expression e = atom();
        while (true) {
            if (ctx.match(TokenType.DOT)) {
                Token name = consumeName("expected attribute name after '.'");
                e = new Expression.Attribute(e, name.text(), ExprContext.LOAD, ctx.rangeFrom(e));
            } else if (ctx.match(TokenType.LEFT_PAREN)) {
                CallArguments arguments = callArguments();
                ctx.consume(TokenType.RIGHT_PAREN, "expected ')' to close the call");
                e = new Expression.Call(e, arguments.args(), arguments.keywords(), ctx.rangeFrom(e));
            } else if (ctx.match(TokenType.LEFT_BRACKET)) {
                Expression slice = slices();
                ctx.consume(TokenType.RIGHT_BRACKET, "expected ']' to close the subscript");
                e = new Expression.Subscript(e, slice, ExprContext.LOAD, ctx.rangeFrom(e));
            } else {
                return e;
            }
        }
    }

    // endregion

    // region Atoms

    private Expression atom() throws ParseException {
        Token token = ctx.peek();
        switch (token.type()) {
            case NAME:
                ctx.advance();
                return new Name(token.text(), ExprContext.LOAD, ctx.rangeFrom(token));
            case TRUE:
                ctx.advance();
                return new Constant(ConstantValue.TRUE, null, ctx.rangeFrom(token));
            case FALSE:
                ctx.advance();
                return new Constant(ConstantValue.FALSE, null, ctx.rangeFrom(token));
            case NONE:
                ctx.advance();
                return new Constant(ConstantValue.NONE, null, ctx.rangeFrom(token));
            case ELLIPSIS:
                ctx.advance();
                return new Constant(ConstantValue.ELLIPSIS, null, ctx.rangeFrom(token));
            case NUMBER:
                ctx.advance();
                return new Constant(numberValue(token), null, ctx.rangeFrom(token));
            case STRING, FSTRING:
                return strings();
            case LEFT_PAREN:
                return parenthesized();
            case LEFT_BRACKET:
                return listDisplay();
            case LEFT_BRACE:
                return braceDisplay();
            default:
                if (token.type().isKeyword()) {
                    throw ctx.error("invalid syntax: unexpected keyword '" + token.text() + "'", "expression");
                }
                throw ctx.error("expected expression", "expression");
        }
    }

    /**
     * Builds the constant for an already consumed NUMBER token.
     */
    public Expression numberLiteral(Token token) {
        return new Constant(numberValue(token), null, ctx.rangeFrom(token));
    }

    private static ConstantValue numberValue(Token token) {
        Object value = token.value();
        if (value instanceof BigInteger integer) {
            return new ConstantValue.Int(integer);
        }
        if (value instanceof ImaginaryLiteral imaginary) {
            return new ConstantValue.Complex(0.0, imaginary.imag());
        }
        return new ConstantValue.Float((Double) value);
    }

    private Expression parenthesized() throws ParseException {
        Token open = ctx.advance();
        if (ctx.match(TokenType.RIGHT_PAREN)) {
            return new TupleExpr(List.of(), ExprContext.LOAD, ctx.rangeFrom(open));
        }
        if (ctx.check(TokenType.YIELD)) {
            Expression yieldExpr = yieldExpression();
            ctx.consume(TokenType.RIGHT_PAREN, "expected ')'");
            return yieldExpr;
        }
        Expression first = starNamedExpression();
        if (startsComprehension()) {
            List<Comprehension> generators = comprehensionClauses();
            ctx.consume(TokenType.RIGHT_PAREN, "expected ')' after generator expression");
            return new Expression.GeneratorExp(first, generators, ctx.rangeFrom(open));
        }
        if (ctx.match(TokenType.RIGHT_PAREN)) {
            if (first instanceof Starred) {
                throw ctx.error(first, "cannot use starred expression here");
            }
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (ctx.match(TokenType.COMMA)) {
            if (ctx.check(TokenType.RIGHT_PAREN)) {
                break;
            }
            elements.add(starNamedExpression());
        }
        ctx.consume(TokenType.RIGHT_PAREN, "expected ')'");
        return new TupleExpr(elements, ExprContext.LOAD, ctx.rangeFrom(open));
    }

    private Expression listDisplay() throws ParseException {
        Token open = ctx.advance();
        if (ctx.match(TokenType.RIGHT_BRACKET)) {
            return new Expression.ListExpr(List.of(), ExprContext.LOAD, ctx.rangeFrom(open));
        }
        Expression first = starNamedExpression();
        if (startsComprehension()) {
            List<Comprehension> generators = comprehensionClauses();
            ctx.consume(TokenType.RIGHT_BRACKET, "expected ']' after list comprehension");
            return new Expression.ListComp(first, generators, ctx.rangeFrom(open));
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (ctx.match(TokenType.COMMA)) {
            if (ctx.check(TokenType.RIGHT_BRACKET)) {
                break;
            }
            elements.add(starNamedExpression());
        }
        ctx.consume(TokenType.RIGHT_BRACKET, "expected ']'");
        return new Expression.ListExpr(elements, ExprContext.LOAD, ctx.rangeFrom(open));
    }

    private Expression braceDisplay() throws ParseException {
        Token open = ctx.advance();
        if (ctx.match(TokenType.RIGHT_BRACE)) {
            return new Expression.DictExpr(List.of(), List.of(), ctx.rangeFrom(open));
        }
        List<Expression> keys = new ArrayList<>();
        List<Expression> values = new ArrayList<>();
        if (ctx.match(TokenType.DOUBLE_STAR)) {
            keys.add(null);
            values.add(bitwiseOr());
            if (startsComprehension()) {
                throw ctx.error("dict unpacking cannot be used in dict comprehension");
            }
            return dictRest(open, keys, values);
        }
        Expression first = starNamedExpression();
        if (ctx.match(TokenType.COLON)) {
            Expression value = expression();
            if (startsComprehension()) {
                List<Comprehension> generators = comprehensionClauses();
                ctx.consume(TokenType.RIGHT_BRACE, "expected '}' after dict comprehension");
                return new Expression.DictComp(first, value, generators, ctx.rangeFrom(open));
            }
            keys.add(first);
            values.add(value);
            return dictRest(open, keys, values);
        }
        if (startsComprehension()) {
            List<Comprehension> generators = comprehensionClauses();
            ctx.consume(TokenType.RIGHT_BRACE, "expected '}' after set comprehension");
            return new Expression.SetComp(first, generators, ctx.rangeFrom(open));
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (ctx.match(TokenType.COMMA)) {
            if (ctx.check(TokenType.RIGHT_BRACE)) {
                break;
            }
            elements.add(starNamedExpression());
        }
        ctx.consume(TokenType.RIGHT_BRACE, "expected '}'");
        return new Expression.SetExpr(elements, ctx.rangeFrom(open));
    }

    private Expression dictRest(Token open, List<Expression> keys, List<Expression> values) throws ParseException {
        while (ctx.match(TokenType.COMMA)) {
            if (ctx.check(TokenType.RIGHT_BRACE)) {
                break;
            }
            if (ctx.match(TokenType.DOUBLE_STAR)) {
                keys.add(null);
                values.add(bitwiseOr());
                continue;
            }
            keys.add(expression());
            ctx.consume(TokenType.COLON, "expected ':' after dict key");
            values.add(expression());
        }
        ctx.consume(TokenType.RIGHT_BRACE, "expected '}'");
        return new Expression.DictExpr(keys, values, ctx.rangeFrom(open));
    }

    private boolean startsComprehension() {
        return ctx.check(TokenType.FOR) || (ctx.check(TokenType.ASYNC) && ctx.checkAt(1, TokenType.FOR));
    }

    private List<Comprehension> comprehensionClauses() throws ParseException {
        Targets targets = new Targets(ctx);
        List<Comprehension> generators = new ArrayList<>();
        while (startsComprehension()) {
            boolean isAsync = ctx.match(TokenType.ASYNC);
            ctx.advance();
            Expression target = targets.store(targetList());
            ctx.consume(TokenType.IN, "expected 'in' after comprehension target");
            Expression iter = disjunction();
            List<Expression> ifs = new ArrayList<>();
            while (ctx.match(TokenType.IF)) {
                ifs.add(disjunction());
            }
            generators.add(new Comprehension(target, iter, ifs, isAsync));
        }
        return generators;
    }

    /**
     * Parses {@code yield}, {@code yield value} or {@code yield from value}. The current token must be YIELD.
     */
    public Expression yieldExpression() throws ParseException {
        Token start = ctx.advance();
        if (ctx.match(TokenType.FROM)) {
            Expression value = expression();
            return new Expression.YieldFrom(value, ctx.rangeFrom(start));
        }
        Expression value = startsExpression() ? starExpressions() : null;
        return new Expression.Yield(value, ctx.rangeFrom(start));
    }

    // endregion

    // region Calls and subscripts

    /**
     * Parses call arguments after the opening parenthesis, stopping before the closing one.
     */
    public CallArguments callArguments() throws ParseException {
        List<Expression> args = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        boolean seenKeyword = false;
        boolean seenKeywordUnpacking = false;
        while (!ctx.check(TokenType.RIGHT_PAREN)) {
            Token start = ctx.peek();
            if (ctx.match(TokenType.STAR)) {
                if (seenKeywordUnpacking) {
                    throw ctx.error("iterable argument unpacking follows keyword argument unpacking");
                }
                Expression value = expression();
                args.add(new Starred(value, ExprContext.LOAD, ctx.rangeFrom(start)));
            } else if (ctx.match(TokenType.DOUBLE_STAR)) {
                Expression value = expression();
                keywords.add(new Keyword(null, value, ctx.rangeFrom(start)));
                seenKeywordUnpacking = true;
            } else if (ctx.check(TokenType.NAME) && ctx.checkAt(1, TokenType.EQUAL)) {
                ctx.advance();
                ctx.advance();
                Expression value = expression();
                keywords.add(new Keyword(start.text(), value, ctx.rangeFrom(start)));
                seenKeyword = true;
            } else {
                Expression value = namedExpression();
                if (startsComprehension()) {
                    List<Comprehension> generators = comprehensionClauses();
                    value = new Expression.GeneratorExp(value, generators, ctx.rangeFrom(value));
                    if (!args.isEmpty() || !keywords.isEmpty() || (ctx.check(TokenType.COMMA) && !ctx.checkAt(1, TokenType.RIGHT_PAREN))) {
                        throw ctx.error(value, "Generator expression must be parenthesized");
                    }
                }
                if (ctx.check(TokenType.EQUAL)) {
                    throw ctx.error(value, "expression cannot contain assignment, perhaps you meant \"==\"?");
                }
                if (seenKeywordUnpacking) {
                    throw ctx.error(value, "positional argument follows keyword argument unpacking");
                }
                if (seenKeyword) {
                    throw ctx.error(value, "positional argument follows keyword argument");
                }
                args.add(value);
            }
            if (!ctx.match(TokenType.COMMA)) {
                break;
            }
        }
        return new CallArguments(args, keywords);
    }

    private Expression slices() throws ParseException {
        Token start = ctx.peek();
        Expression first = slice();
        if (!ctx.check(TokenType.COMMA)) {
            return first;
        }
        List<Expression> elements = new ArrayList<>();
        elements.add(first);
        while (ctx.match(TokenType.COMMA)) {
            if (ctx.check(TokenType.RIGHT_BRACKET)) {
                break;
            }
            elements.add(slice());
        }
        return new TupleExpr(elements, ExprContext.LOAD, ctx.rangeFrom(start));
    }

    private Expression slice() throws ParseException {
        Token start = ctx.peek();
        if (ctx.match(TokenType.STAR)) {
            Expression value = bitwiseOr();
            return new Starred(value, ExprContext.LOAD, ctx.rangeFrom(start));
        }
        Expression lower = null;
        if (!ctx.check(TokenType.COLON)) {
            lower = namedExpression();
            if (!ctx.check(TokenType.COLON)) {
                return lower;
            }
        }
        ctx.advance();
        Expression upper = startsSliceBound() ? expression() : null;
        Expression step = null;
        if (ctx.match(TokenType.COLON)) {
            step = startsSliceBound() ? expression() : null;
        }
        return new Expression.Slice(lower, upper, step, ctx.rangeFrom(start));
    }

    private boolean startsSliceBound() {
        return !ctx.check(TokenType.COLON) && !ctx.check(TokenType.COMMA) && !ctx.check(TokenType.RIGHT_BRACKET);
    }

    // endregion

    // region Parameters

    /**
     * Parses a parameter list up to (not including) the closing token.
     *
     * @param closing RIGHT_PAREN for {@code def}, COLON for {@code lambda}.
     * @param annotations True if parameters may carry annotations.
     * @return The parameters.
     */
    public Arguments parameters(TokenType closing, boolean annotations) throws ParseException {
        List<Arg> posonly = new ArrayList<>();
        List<Arg> args = new ArrayList<>();
        List<Expression> defaults = new ArrayList<>();
        List<Arg> kwonly = new ArrayList<>();
        List<Expression> kwDefaults = new ArrayList<>();
        Arg vararg = null;
        Arg kwarg = null;
        boolean seenSlash = false;
        boolean seenStar = false;
        Token bareStar = null;
        Set<String> names = new HashSet<>();

        while (!ctx.check(closing)) {
            Token start = ctx.peek();
            if (kwarg != null) {
                throw ctx.error("arguments cannot follow var-keyword argument");
            }
            if (ctx.match(TokenType.SLASH)) {
                if (seenSlash) {
                    throw ctx.error("/ may appear only once");
                }
                if (seenStar) {
                    throw ctx.error("/ must be ahead of *");
                }
                if (args.isEmpty()) {
                    throw ctx.error("at least one argument must precede /");
                }
                seenSlash = true;
                posonly.addAll(args);
                args.clear();
            } else if (ctx.match(TokenType.STAR)) {
                if (seenStar) {
                    throw ctx.error("* argument may appear only once");
                }
                seenStar = true;
                if (ctx.check(TokenType.COMMA) || ctx.check(closing)) {
                    bareStar = start;
                } else {
                    vararg = parameter(annotations, true, names);
                }
            } else if (ctx.match(TokenType.DOUBLE_STAR)) {
                kwarg = parameter(annotations, false, names);
                if (ctx.check(TokenType.EQUAL)) {
                    throw ctx.error("var-keyword argument cannot have default value");
                }
            } else {
                Arg arg = parameter(annotations, false, names);
                Expression defaultValue = ctx.match(TokenType.EQUAL) ? expression() : null;
                if (seenStar) {
                    kwonly.add(arg);
                    kwDefaults.add(defaultValue);
                } else {
                    args.add(arg);
                    if (defaultValue != null) {
                        defaults.add(defaultValue);
                    } else if (!defaults.isEmpty()) {
                        throw ctx.error(start, "parameter without a default follows parameter with a default");
                    }
                }
            }
            if (!ctx.match(TokenType.COMMA)) {
                break;
            }
        }
        if (bareStar != null && kwonly.isEmpty()) {
            throw ctx.error(bareStar, "named arguments must follow bare *");
        }
        return new Arguments(posonly, args, vararg, kwonly, kwDefaults, kwarg, defaults);
    }

    private Arg parameter(boolean annotations, boolean starred, Set<String> names) throws ParseException {
        Token name = consumeName("expected parameter name");
        if (!names.add(name.text())) {
            throw ctx.error("duplicate argument '" + name.text() + "' in function definition");
        }
        Expression annotation = null;
        if (annotations && ctx.match(TokenType.COLON)) {
            annotation = starred && ctx.check(TokenType.STAR) ? starExpression() : expression();
        }
        return new Arg(name.text(), annotation, ctx.rangeFrom(name));
    }

    /**
     * Parses PEP 695 type parameters. The current token must be LEFT_BRACKET.
     */
    public List<TypeParam> typeParams() throws ParseException {
        ctx.consume(TokenType.LEFT_BRACKET, "expected '['");
        List<TypeParam> params = new ArrayList<>();
        while (!ctx.check(TokenType.RIGHT_BRACKET)) {
            Token start = ctx.peek();
            if (ctx.match(TokenType.STAR)) {
                Token name = consumeName("expected type parameter name");
                Expression defaultValue = ctx.match(TokenType.EQUAL) ? starExpression() : null;
                params.add(new TypeParam.TypeVarTuple(name.text(), defaultValue, ctx.rangeFrom(start)));
            } else if (ctx.match(TokenType.DOUBLE_STAR)) {
                Token name = consumeName("expected type parameter name");
                Expression defaultValue = ctx.match(TokenType.EQUAL) ? expression() : null;
                params.add(new TypeParam.ParamSpec(name.text(), defaultValue, ctx.rangeFrom(start)));
            } else {
                Token name = consumeName("expected type parameter name");
                Expression bound = ctx.match(TokenType.COLON) ? expression() : null;
                Expression defaultValue = ctx.match(TokenType.EQUAL) ? expression() : null;
                params.add(new TypeParam.TypeVar(name.text(), bound, defaultValue, ctx.rangeFrom(start)));
            }
            if (!ctx.match(TokenType.COMMA)) {
                break;
            }
        }
        ctx.consume(TokenType.RIGHT_BRACKET, "expected ']' to close the type parameter list");
        if (params.isEmpty()) {
            throw ctx.error(ctx.previous(), "type parameter list cannot be empty");
        }
        return params;
    }

    // endregion

    // region Strings

    /**
     * Parses one or more adjacent string literals into a single constant or f-string.
     */
    public Expression strings() throws ParseException {
        Token first = ctx.peek();
        List<Token> parts = new ArrayList<>();
        while (ctx.check(TokenType.STRING) || ctx.check(TokenType.FSTRING)) {
            parts.add(ctx.advance());
        }
        SourceRange range = ctx.rangeFrom(first);

        boolean anyBytes = false;
        boolean anyText = false;
        boolean anyFormatted = false;
        for (Token part : parts) {
            if (part.type() == TokenType.FSTRING) {
                anyFormatted = true;
                anyText = true;
            } else if (((StringLiteral) part.value()).bytes()) {
                anyBytes = true;
            } else {
                anyText = true;
            }
        }
        if (anyBytes && anyText) {
            throw ctx.error(first, "cannot mix bytes and nonbytes literals");
        }

        if (anyBytes) {
            StringBuilder sb = new StringBuilder();
            for (Token part : parts) {
                sb.append(((StringLiteral) part.value()).value());
            }
            byte[] bytes = sb.toString().getBytes(StandardCharsets.ISO_8859_1);
            return new Constant(new ConstantValue.Bytes(bytes), null, range);
        }
        if (!anyFormatted) {
            StringBuilder sb = new StringBuilder();
            for (Token part : parts) {
                sb.append(((StringLiteral) part.value()).value());
            }
            String kind = ((StringLiteral) first.value()).unicodePrefix() ? "u" : null;
            return new Constant(new ConstantValue.Str(sb.toString()), kind, range);
        }

        List<Expression> values = new ArrayList<>();
        StringBuilder pending = new StringBuilder();
        for (Token part : parts) {
            if (part.type() == TokenType.STRING) {
                pending.append(((StringLiteral) part.value()).value());
            } else {
                appendParts(((FStringLiteral) part.value()).parts(), values, pending, range);
            }
        }
        flush(values, pending, range);
        return new Expression.JoinedStr(values, range);
    }

    private void appendParts(List<FStringPart> parts, List<Expression> values, StringBuilder pending, SourceRange range)
            throws ParseException {
        for (FStringPart part : parts) {
            if (part instanceof FStringPart.Text text) {
                pending.append(text.value());
                continue;
            }
            FStringPart.Field field = (FStringPart.Field) part;
            if (field.debugText() != null) {
                pending.append(field.debugText());
            }
            flush(values, pending, range);
            values.add(formattedValue(field, range));
        }
    }

    private Expression formattedValue(FStringPart.Field field, SourceRange range) throws ParseException {
        Expression value = new Parser(field.tokens(), ctx.source()).parseReplacementField();
        int conversion = field.conversion();
        if (field.debugText() != null && conversion == Expression.FormattedValue.NO_CONVERSION
                && field.formatSpec() == null) {
            conversion = 'r';
        }
        Expression formatSpec = null;
        if (field.formatSpec() != null) {
            List<Expression> specValues = new ArrayList<>();
            StringBuilder pending = new StringBuilder();
            appendParts(field.formatSpec(), specValues, pending, range);
            flush(specValues, pending, range);
            formatSpec = new Expression.JoinedStr(specValues, range);
        }
        return new Expression.FormattedValue(value, conversion, formatSpec, range);
    }

    private static void flush(List<Expression> values, StringBuilder pending, SourceRange range) {
        if (pending.length() > 0) {
            values.add(new Constant(new ConstantValue.Str(pending.toString()), null, range));
            pending.setLength(0);
        }
    }

    // endregion

    /**
     * Consumes a NAME token. Hard keywords in name position get a dedicated message.
     */
    public Token consumeName(String message) throws ParseException {
        if (ctx.check(TokenType.NAME)) {
            return ctx.advance();
        }
        Token found = ctx.peek();
        if (found.type().isKeyword()) {
            throw ctx.error("invalid syntax: '" + found.text() + "' is a keyword", "name")
                    .withSuggestion("'" + found.text() + "' is a reserved keyword and cannot be used as an identifier");
        }
        throw ctx.error(message, "name");
    }
}
