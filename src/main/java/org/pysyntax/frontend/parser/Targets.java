package org.pysyntax.frontend.parser;

import org.pysyntax.api.ParseException;
import org.pysyntax.frontend.parser.ast.ConstantValue;
import org.pysyntax.frontend.parser.ast.ExprContext;
import org.pysyntax.frontend.parser.ast.Expression;
import org.pysyntax.frontend.parser.ast.Expression.Attribute;
import org.pysyntax.frontend.parser.ast.Expression.ListExpr;
import org.pysyntax.frontend.parser.ast.Expression.Name;
import org.pysyntax.frontend.parser.ast.Expression.Starred;
import org.pysyntax.frontend.parser.ast.Expression.Subscript;
import org.pysyntax.frontend.parser.ast.Expression.TupleExpr;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites expressions parsed in load context into assignment or deletion targets.
 */
final class Targets {

    private final ParsingContext context;

    Targets(ParsingContext context) {
        this.context = context;
    }

    /**
     * Converts a target of {@code =}, {@code for}, {@code with ... as} or a comprehension to store context.
     */
    Expression store(Expression target) throws ParseException {
        return convert(target, ExprContext.STORE, true);
    }

    Expression delete(Expression target) throws ParseException {
        return convert(target, ExprContext.DEL, true);
    }

    /**
     * Converts the single target of an augmented or annotated assignment.
     */
    Expression single(Expression target, boolean annotated) throws ParseException {
        if (target instanceof Name || target instanceof Attribute || target instanceof Subscript) {
            return convert(target, ExprContext.STORE, false);
        }
        if (annotated && (target instanceof TupleExpr || target instanceof ListExpr)) {
            String kind = target instanceof TupleExpr ? "tuple" : "list";
            throw context.error(target, "only single target (not " + kind + ") can be annotated");
        }
        String statement = annotated ? "annotated assignment" : "augmented assignment";
        throw context.error(target, "'" + describe(target) + "' is an illegal expression for " + statement);
    }

    private Expression convert(Expression e, ExprContext ctx, boolean allowNested) throws ParseException {
        if (e instanceof Name name) {
            return new Name(name.id(), ctx, name.range());
        }
        if (e instanceof Attribute attribute) {
            return new Attribute(attribute.value(), attribute.attr(), ctx, attribute.range());
        }
        if (e instanceof Subscript subscript) {
            return new Subscript(subscript.value(), subscript.slice(), ctx, subscript.range());
        }
        if (allowNested && e instanceof Starred starred) {
            if (ctx == ExprContext.DEL) {
                throw context.error(e, "cannot delete starred");
            }
            return new Starred(convert(starred.value(), ctx, true), ctx, starred.range());
        }
        if (allowNested && e instanceof TupleExpr tuple) {
            return new TupleExpr(convertAll(tuple.elts(), ctx), ctx, tuple.range());
        }
        if (allowNested && e instanceof ListExpr list) {
            return new ListExpr(convertAll(list.elts(), ctx), ctx, list.range());
        }
        String verb = ctx == ExprContext.DEL ? "delete" : "assign to";
        throw context.error(e, "cannot " + verb + " " + describe(e));
    }

    private List<Expression> convertAll(List<Expression> elements, ExprContext ctx) throws ParseException {
        List<Expression> converted = new ArrayList<>(elements.size());
        int starred = 0;
        for (Expression element : elements) {
            if (element instanceof Starred && ++starred > 1) {
                throw context.error(element, "multiple starred expressions in assignment");
            }
            converted.add(convert(element, ctx, true));
        }
        return converted;
    }

    /**
     * Names the kind of an expression the way error messages refer to it.
     */
    static String describe(Expression e) {
        if (e instanceof Expression.Call) {
            return "function call";
        }
        if (e instanceof Expression.Constant constant) {
            ConstantValue value = constant.value();
            if (value instanceof ConstantValue.None) {
                return "None";
            }
            if (value instanceof ConstantValue.Bool bool) {
                return bool.value() ? "True" : "False";
            }
            if (value instanceof ConstantValue.Ellipsis) {
                return "ellipsis";
            }
            return "literal";
        }
        if (e instanceof Expression.Compare) {
            return "comparison";
        }
        if (e instanceof Expression.Lambda) {
            return "lambda";
        }
        if (e instanceof Expression.IfExp) {
            return "conditional expression";
        }
        if (e instanceof Expression.NamedExpr) {
            return "named expression";
        }
        if (e instanceof Expression.Await) {
            return "await expression";
        }
        if (e instanceof Expression.Yield || e instanceof Expression.YieldFrom) {
            return "yield expression";
        }
        if (e instanceof Expression.ListComp) {
            return "list comprehension";
        }
        if (e instanceof Expression.SetComp) {
            return "set comprehension";
        }
        if (e instanceof Expression.DictComp) {
            return "dict comprehension";
        }
        if (e instanceof Expression.GeneratorExp) {
            return "generator expression";
        }
        if (e instanceof Expression.DictExpr) {
            return "dict literal";
        }
        if (e instanceof Expression.SetExpr) {
            return "set display";
        }
        if (e instanceof Expression.JoinedStr || e instanceof Expression.FormattedValue) {
            return "f-string expression";
        }
        if (e instanceof TupleExpr) {
            return "tuple";
        }
        if (e instanceof ListExpr) {
            return "list";
        }
        if (e instanceof Starred) {
            return "starred";
        }
        return "expression";
    }
}
