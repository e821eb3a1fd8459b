package org.pysyntax.frontend.parser;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pysyntax.api.ParseException;
import org.pysyntax.api.ParseMode;
import org.pysyntax.api.SyntaxException;
import org.pysyntax.frontend.lexer.Tokenizer;
import org.pysyntax.frontend.parser.ast.Arguments;
import org.pysyntax.frontend.parser.ast.BinaryOperator;
import org.pysyntax.frontend.parser.ast.CompareOperator;
import org.pysyntax.frontend.parser.ast.ConstantValue;
import org.pysyntax.frontend.parser.ast.ExprContext;
import org.pysyntax.frontend.parser.ast.Expression;
import org.pysyntax.frontend.parser.ast.Module;
import org.pysyntax.junit.extensions.logging.LogWatchExtension;
import org.pysyntax.util.AstDump;

import java.math.BigInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the expression grammar. Each test parses a single expression in
 * {@link ParseMode#EVAL} mode and inspects the resulting tree.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class ExpressionParserTest {

    private static Expression parseExpression(String source) throws SyntaxException {
        Module module = new Parser(new Tokenizer(source).tokenize(), source).parse(ParseMode.EVAL);
        return ((Module.Eval) module).body();
    }

    private static String dump(String source) throws SyntaxException {
        return AstDump.dump(parseExpression(source));
    }

    /**
     * Multiplication binds tighter than addition.
     */
    @Test
    void testMultiplicationBindsTighterThanAddition() throws Exception {
        // Act
        String tree = dump("1 + 2 * 3");

        // Assert
        assertThat(tree).isEqualTo("BinOp(left=Constant(value=1, kind=None), op=ADD, "
                + "right=BinOp(left=Constant(value=2, kind=None), op=MULT, right=Constant(value=3, kind=None)))");
    }

    /**
     * Exponentiation associates to the right, so {@code 2 ** 3 ** 2} is {@code 2 ** (3 ** 2)}.
     */
    @Test
    void testPowerIsRightAssociative() throws Exception {
        // Act
        Expression e = parseExpression("2 ** 3 ** 2");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.BinOp.class, outer -> {
            assertThat(outer.op()).isEqualTo(BinaryOperator.POW);
            assertThat(outer.left()).isInstanceOf(Expression.Constant.class);
            assertThat(outer.right()).isInstanceOfSatisfying(Expression.BinOp.class, inner -> {
                assertThat(inner.op()).isEqualTo(BinaryOperator.POW);
                assertThat(AstDump.dump(inner.left())).isEqualTo("Constant(value=3, kind=None)");
                assertThat(AstDump.dump(inner.right())).isEqualTo("Constant(value=2, kind=None)");
            });
        });
    }

    @Test
    void testSubtractionIsLeftAssociative() throws Exception {
        // Act
        String tree = dump("a - b - c");

        // Assert
        assertThat(tree).isEqualTo("BinOp(left=BinOp(left=Name(id='a', ctx=LOAD), op=SUB, right=Name(id='b', ctx=LOAD)), "
                + "op=SUB, right=Name(id='c', ctx=LOAD))");
    }

    /**
     * Unary minus binds looser than the power operator on its right.
     */
    @Test
    void testUnaryMinusAndPower() throws Exception {
        // Act
        Expression e = parseExpression("-x ** 2");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.UnaryOp.class,
                unary -> assertThat(unary.operand()).isInstanceOf(Expression.BinOp.class));
    }

    @Test
    void testBooleanOperatorsNest() throws Exception {
        // Act
        String tree = dump("not a and b or c");

        // Assert
        assertThat(tree).isEqualTo("BoolOp(op=OR, values=[BoolOp(op=AND, values=[UnaryOp(op=NOT, operand=Name(id='a', ctx=LOAD)), "
                + "Name(id='b', ctx=LOAD)]), Name(id='c', ctx=LOAD)])");
    }

    /**
     * A chain of comparisons is a single Compare node, including the two-word operators.
     */
    @Test
    void testComparisonChain() throws Exception {
        // Act
        Expression e = parseExpression("a < b <= c not in d is not e");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.Compare.class, compare -> {
            assertThat(compare.ops()).containsExactly(
                    CompareOperator.LT, CompareOperator.LT_E, CompareOperator.NOT_IN, CompareOperator.IS_NOT);
            assertThat(compare.comparators()).hasSize(4);
        });
    }

    @Test
    void testConditionalExpression() throws Exception {
        // Act
        Expression e = parseExpression("x if c else y if d else z");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.IfExp.class,
                ifExp -> assertThat(ifExp.orElse()).isInstanceOf(Expression.IfExp.class));
    }

    @Test
    void testLambdaParameters() throws Exception {
        // Act
        Expression e = parseExpression("lambda x, *a, k=1, **kw: x");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.Lambda.class, lambda -> {
            Arguments args = lambda.args();
            assertThat(args.args()).extracting(arg -> arg.name()).containsExactly("x");
            assertThat(args.vararg().name()).isEqualTo("a");
            assertThat(args.kwonlyArgs()).extracting(arg -> arg.name()).containsExactly("k");
            assertThat(args.kwDefaults()).hasSize(1);
            assertThat(args.kwarg().name()).isEqualTo("kw");
        });
    }

    @Test
    void testWalrusTargetIsStored() throws Exception {
        // Act
        Expression e = parseExpression("(y := 5)");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.NamedExpr.class, named ->
                assertThat(named.target()).isInstanceOfSatisfying(Expression.Name.class,
                        name -> assertThat(name.ctx()).isEqualTo(ExprContext.STORE)));
    }

    /**
     * Verifies the split of call arguments into positional arguments, including {@code *iterable},
     * and keywords, including {@code **mapping} with a null name.
     */
    @Test
    void testCallArguments() throws Exception {
        // Act
        Expression e = parseExpression("f(a, *b, c=1, **d)");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.Call.class, call -> {
            assertThat(call.args()).hasSize(2);
            assertThat(call.args().get(1)).isInstanceOf(Expression.Starred.class);
            assertThat(call.keywords()).extracting(k -> k.arg()).containsExactly("c", null);
        });
    }

    @Test
    void testBareGeneratorArgument() throws Exception {
        // Act
        Expression e = parseExpression("sum(x * x for x in xs if x)");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.Call.class, call -> {
            assertThat(call.args()).singleElement().isInstanceOf(Expression.GeneratorExp.class);
            Expression.GeneratorExp gen = (Expression.GeneratorExp) call.args().get(0);
            assertThat(gen.generators()).singleElement().satisfies(c -> assertThat(c.ifs()).hasSize(1));
        });
    }

    @Test
    void testSubscriptWithSlices() throws Exception {
        // Act
        String tree = dump("a[1:2, ::3]");

        // Assert
        assertThat(tree).isEqualTo("Subscript(value=Name(id='a', ctx=LOAD), slice=TupleExpr(elts=["
                + "Slice(lower=Constant(value=1, kind=None), upper=Constant(value=2, kind=None), step=None), "
                + "Slice(lower=None, upper=None, step=Constant(value=3, kind=None))], ctx=LOAD), ctx=LOAD)");
    }

    @Test
    void testDictComprehensionTargetsAreStored() throws Exception {
        // Act
        Expression e = parseExpression("{k: v for k, v in d.items()}");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.DictComp.class, comp ->
                assertThat(comp.generators().get(0).target()).isInstanceOfSatisfying(Expression.TupleExpr.class,
                        tuple -> assertThat(tuple.ctx()).isEqualTo(ExprContext.STORE)));
    }

    /**
     * Braces produce a dict when empty or when entries have keys, and a set otherwise.
     */
    @Test
    void testBraceDisplays() throws Exception {
        assertThat(parseExpression("{}")).isInstanceOf(Expression.DictExpr.class);
        assertThat(parseExpression("{1, 2}")).isInstanceOf(Expression.SetExpr.class);
        assertThat(parseExpression("{**a, 'b': 1}")).isInstanceOfSatisfying(Expression.DictExpr.class,
                dict -> assertThat(dict.keys()).hasSize(2).first().isNull());
    }

    @Test
    void testTupleDisplays() throws Exception {
        assertThat(parseExpression("()")).isInstanceOfSatisfying(Expression.TupleExpr.class,
                t -> assertThat(t.elts()).isEmpty());
        assertThat(parseExpression("(1,)")).isInstanceOfSatisfying(Expression.TupleExpr.class,
                t -> assertThat(t.elts()).hasSize(1));
        assertThat(parseExpression("1, 2")).isInstanceOfSatisfying(Expression.TupleExpr.class,
                t -> assertThat(t.elts()).hasSize(2));
        assertThat(parseExpression("(1)")).isInstanceOf(Expression.Constant.class);
    }

    /**
     * Adjacent string literals are concatenated into a single constant.
     */
    @Test
    void testImplicitStringConcatenation() throws Exception {
        // Act
        Expression e = parseExpression("'a' \"b\" '''c'''");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.Constant.class,
                c -> assertThat(c.value()).isEqualTo(new ConstantValue.Str("abc")));
    }

    @Test
    void testFStringBecomesJoinedStr() throws Exception {
        // Act
        String tree = dump("f'x{y!r:>4}z'");

        // Assert
        assertThat(tree).isEqualTo("JoinedStr(values=[Constant(value='x', kind=None), "
                + "FormattedValue(value=Name(id='y', ctx=LOAD), conversion=114, "
                + "formatSpec=JoinedStr(values=[Constant(value='>4', kind=None)])), Constant(value='z', kind=None)])");
    }

    /**
     * A self-documenting field contributes its text as a literal and defaults to the repr conversion.
     */
    @Test
    void testFStringDebugFieldUsesRepr() throws Exception {
        // Act
        Expression e = parseExpression("f'{x=}'");

        // Assert
        assertThat(e).isInstanceOfSatisfying(Expression.JoinedStr.class, joined -> {
            assertThat(joined.values()).hasSize(2);
            assertThat(AstDump.dump(joined.values().get(0))).isEqualTo("Constant(value='x=', kind=None)");
            assertThat(joined.values().get(1)).isInstanceOfSatisfying(Expression.FormattedValue.class,
                    value -> assertThat(value.conversion()).isEqualTo('r'));
        });
    }

    @Test
    void testNumberConstants() throws Exception {
        assertThat(((Expression.Constant) parseExpression("1_000_000_000_000_000_000_000_000_000_000")).value())
                .isEqualTo(new ConstantValue.Int(BigInteger.TEN.pow(30)));
        assertThat(((Expression.Constant) parseExpression("2.5")).value()).isEqualTo(new ConstantValue.Float(2.5));
        assertThat(((Expression.Constant) parseExpression("3j")).value()).isEqualTo(new ConstantValue.Complex(0, 3));
        assertThat(((Expression.Constant) parseExpression("b'ab'")).value()).isEqualTo(
                new ConstantValue.Bytes(new byte[] {'a', 'b'}));
    }

    @Test
    void testAwaitAndAttributeChain() throws Exception {
        // Act
        String tree = dump("await a.b(c)[0]");

        // Assert
        assertThat(tree).startsWith("Await(value=Subscript(value=Call(func=Attribute(value=Name(id='a'");
    }

    @Test
    void testMixingBytesAndTextIsRejected() {
        assertThatThrownBy(() -> parseExpression("b'a' 'b'"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("cannot mix bytes and nonbytes literals");
    }

    @Test
    void testGeneratorMustBeParenthesizedWithOtherArguments() {
        assertThatThrownBy(() -> parseExpression("f(x for x in y, 1)"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("Generator expression must be parenthesized");
    }

    @Test
    void testPositionalAfterKeywordIsRejected() {
        assertThatThrownBy(() -> parseExpression("f(a=1, b)"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("positional argument follows keyword argument");
    }

    @Test
    void testKeywordInExpressionPosition() {
        assertThatThrownBy(() -> parseExpression("1 + class"))
                .isInstanceOf(ParseException.class)
                .hasMessageContaining("unexpected keyword 'class'");
    }

    @Test
    void testTrailingInputInEvalMode() {
        assertThatThrownBy(() -> parseExpression("1 2"))
                .isInstanceOf(ParseException.class);
    }
}
