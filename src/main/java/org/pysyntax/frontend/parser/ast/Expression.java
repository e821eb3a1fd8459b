package org.pysyntax.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * An expression node. Nodes that can be assignment or deletion targets carry an {@link ExprContext}.
 */
public sealed interface Expression extends AstNode {

    /**
     * {@code a and b and c} or {@code a or b}. Chains of the same operator are flattened.
     *
     * @param op The operator.
     * @param values Two or more operands.
     * @param range The source range.
     */
    record BoolOp(BoolOperator op, List<Expression> values, SourceRange range) implements Expression {
        public BoolOp {
            Objects.requireNonNull(op, "op");
            values = AstLists.copy(values);
            if (values.size() < 2) {
                throw new IllegalArgumentException("BoolOp needs at least two values");
            }
            range = AstLists.range(range);
        }
    }

    /** The walrus {@code target := value}. */
    record NamedExpr(Expression target, Expression value, SourceRange range) implements Expression {
        public NamedExpr {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
            range = AstLists.range(range);
        }
    }

    record BinOp(Expression left, BinaryOperator op, Expression right, SourceRange range) implements Expression {
        public BinOp {
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(right, "right");
            range = AstLists.range(range);
        }
    }

    record UnaryOp(UnaryOperator op, Expression operand, SourceRange range) implements Expression {
        public UnaryOp {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
            range = AstLists.range(range);
        }
    }

    record Lambda(Arguments args, Expression body, SourceRange range) implements Expression {
        public Lambda {
            args = args == null ? Arguments.EMPTY : args;
            Objects.requireNonNull(body, "body");
            range = AstLists.range(range);
        }
    }

    /** {@code body if test else orElse}. */
    record IfExp(Expression test, Expression body, Expression orElse, SourceRange range) implements Expression {
        public IfExp {
            Objects.requireNonNull(test, "test");
            Objects.requireNonNull(body, "body");
            Objects.requireNonNull(orElse, "orElse");
            range = AstLists.range(range);
        }
    }

    /**
     * A dict display.
     *
     * @param keys The keys; a null key marks a {@code **mapping} entry whose value is the mapping.
     * @param values The values.
     * @param range The source range.
     */
    record DictExpr(List<Expression> keys, List<Expression> values, SourceRange range) implements Expression {
        public DictExpr {
            keys = AstLists.copyNullable(keys);
            values = AstLists.copy(values);
            if (keys.size() != values.size()) {
                throw new IllegalArgumentException("Dict keys and values differ in length");
            }
            range = AstLists.range(range);
        }
    }

    record SetExpr(List<Expression> elts, SourceRange range) implements Expression {
        public SetExpr {
            elts = AstLists.copy(elts);
            range = AstLists.range(range);
        }
    }

    record ListComp(Expression elt, List<Comprehension> generators, SourceRange range) implements Expression {
        public ListComp {
            Objects.requireNonNull(elt, "elt");
            generators = AstLists.copy(generators);
            range = AstLists.range(range);
        }
    }

    record SetComp(Expression elt, List<Comprehension> generators, SourceRange range) implements Expression {
        public SetComp {
            Objects.requireNonNull(elt, "elt");
            generators = AstLists.copy(generators);
            range = AstLists.range(range);
        }
    }

    record DictComp(Expression key, Expression value, List<Comprehension> generators, SourceRange range)
            implements Expression {
        public DictComp {
            Objects.requireNonNull(key, "key");
            Objects.requireNonNull(value, "value");
            generators = AstLists.copy(generators);
            range = AstLists.range(range);
        }
    }

    record GeneratorExp(Expression elt, List<Comprehension> generators, SourceRange range) implements Expression {
        public GeneratorExp {
            Objects.requireNonNull(elt, "elt");
            generators = AstLists.copy(generators);
            range = AstLists.range(range);
        }
    }

    record Await(Expression value, SourceRange range) implements Expression {
        public Await {
            Objects.requireNonNull(value, "value");
            range = AstLists.range(range);
        }
    }

    /** {@code yield} with an optional value. */
    record Yield(Expression value, SourceRange range) implements Expression {
        public Yield {
            range = AstLists.range(range);
        }
    }

    record YieldFrom(Expression value, SourceRange range) implements Expression {
        public YieldFrom {
            Objects.requireNonNull(value, "value");
            range = AstLists.range(range);
        }
    }

    /**
     * A comparison chain {@code a < b <= c}.
     *
     * @param left The first operand.
     * @param ops The operators, one per comparator.
     * @param comparators The remaining operands.
     * @param range The source range.
     */
    record Compare(Expression left, List<CompareOperator> ops, List<Expression> comparators, SourceRange range)
            implements Expression {
        public Compare {
            Objects.requireNonNull(left, "left");
            ops = AstLists.copy(ops);
            comparators = AstLists.copy(comparators);
            if (ops.isEmpty() || ops.size() != comparators.size()) {
                throw new IllegalArgumentException("Compare needs one comparator per operator");
            }
            range = AstLists.range(range);
        }
    }

    record Call(Expression func, List<Expression> args, List<Keyword> keywords, SourceRange range)
            implements Expression {
        public Call {
            Objects.requireNonNull(func, "func");
            args = AstLists.copy(args);
            keywords = AstLists.copy(keywords);
            range = AstLists.range(range);
        }
    }

    /**
     * A replacement field inside an f-string.
     *
     * @param value The interpolated expression.
     * @param conversion {@link #NO_CONVERSION}, or the code point of {@code s}, {@code r} or {@code a}.
     * @param formatSpec The format spec as a {@link JoinedStr}, or null.
     * @param range The source range.
     */
    record FormattedValue(Expression value, int conversion, Expression formatSpec, SourceRange range)
            implements Expression {

        public static final int NO_CONVERSION = -1;

        public FormattedValue {
            Objects.requireNonNull(value, "value");
            if (conversion != NO_CONVERSION && conversion != 's' && conversion != 'r' && conversion != 'a') {
                throw new IllegalArgumentException("Invalid conversion code " + conversion);
            }
            range = AstLists.range(range);
        }
    }

    /** An f-string: a sequence of string {@link Constant}s and {@link FormattedValue}s. */
    record JoinedStr(List<Expression> values, SourceRange range) implements Expression {
        public JoinedStr {
            values = AstLists.copy(values);
            range = AstLists.range(range);
        }
    }

    /**
     * A literal.
     *
     * @param value The value.
     * @param kind {@code "u"} for strings written with a {@code u} prefix, otherwise null.
     * @param range The source range.
     */
    record Constant(ConstantValue value, String kind, SourceRange range) implements Expression {
        public Constant {
            Objects.requireNonNull(value, "value");
            range = AstLists.range(range);
        }

        public Constant(ConstantValue value) {
            this(value, null, SourceRange.NONE);
        }
    }

    record Attribute(Expression value, String attr, ExprContext ctx, SourceRange range) implements Expression {
        public Attribute {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(attr, "attr");
            ctx = ctx == null ? ExprContext.LOAD : ctx;
            range = AstLists.range(range);
        }
    }

    record Subscript(Expression value, Expression slice, ExprContext ctx, SourceRange range) implements Expression {
        public Subscript {
            Objects.requireNonNull(value, "value");
            Objects.requireNonNull(slice, "slice");
            ctx = ctx == null ? ExprContext.LOAD : ctx;
            range = AstLists.range(range);
        }
    }

    record Starred(Expression value, ExprContext ctx, SourceRange range) implements Expression {
        public Starred {
            Objects.requireNonNull(value, "value");
            ctx = ctx == null ? ExprContext.LOAD : ctx;
            range = AstLists.range(range);
        }
    }

    record Name(String id, ExprContext ctx, SourceRange range) implements Expression {
        public Name {
            Objects.requireNonNull(id, "id");
            ctx = ctx == null ? ExprContext.LOAD : ctx;
            range = AstLists.range(range);
        }

        public Name(String id) {
            this(id, ExprContext.LOAD, SourceRange.NONE);
        }
    }

    record ListExpr(List<Expression> elts, ExprContext ctx, SourceRange range) implements Expression {
        public ListExpr {
            elts = AstLists.copy(elts);
            ctx = ctx == null ? ExprContext.LOAD : ctx;
            range = AstLists.range(range);
        }
    }

    record TupleExpr(List<Expression> elts, ExprContext ctx, SourceRange range) implements Expression {
        public TupleExpr {
            elts = AstLists.copy(elts);
            ctx = ctx == null ? ExprContext.LOAD : ctx;
            range = AstLists.range(range);
        }
    }

    /** {@code lower:upper:step} inside a subscript. Each part may be null. */
    record Slice(Expression lower, Expression upper, Expression step, SourceRange range) implements Expression {
        public Slice {
            range = AstLists.range(range);
        }
    }
}
