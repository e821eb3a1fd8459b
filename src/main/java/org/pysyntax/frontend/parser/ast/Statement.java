package org.pysyntax.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A statement node. Every variant is an immutable record whose last component is its {@link SourceRange}.
 */
public sealed interface Statement extends AstNode {

    /**
     * A {@code def} statement.
     *
     * @param name The function name.
     * @param args The parameter list.
     * @param body The function body, never empty when parsed.
     * @param decorators The decorator expressions, outermost first.
     * @param returns The return annotation, or null.
     * @param typeParams PEP 695 type parameters.
     * @param range The source range, starting at the first decorator if any.
     */
    record FunctionDef(
            String name,
            Arguments args,
            List<Statement> body,
            List<Expression> decorators,
            Expression returns,
            List<TypeParam> typeParams,
            SourceRange range
    ) implements Statement {
        public FunctionDef {
            Objects.requireNonNull(name, "name");
            args = args == null ? Arguments.EMPTY : args;
            body = AstLists.copy(body);
            decorators = AstLists.copy(decorators);
            typeParams = AstLists.copy(typeParams);
            range = AstLists.range(range);
        }
    }

    /** An {@code async def} statement. Same shape as {@link FunctionDef}. */
    record AsyncFunctionDef(
            String name,
            Arguments args,
            List<Statement> body,
            List<Expression> decorators,
            Expression returns,
            List<TypeParam> typeParams,
            SourceRange range
    ) implements Statement {
        public AsyncFunctionDef {
            Objects.requireNonNull(name, "name");
            args = args == null ? Arguments.EMPTY : args;
            body = AstLists.copy(body);
            decorators = AstLists.copy(decorators);
            typeParams = AstLists.copy(typeParams);
            range = AstLists.range(range);
        }
    }

    /**
     * A {@code class} statement.
     *
     * @param name The class name.
     * @param bases Positional base expressions.
     * @param keywords Keyword arguments such as {@code metaclass=M}.
     * @param body The class body.
     * @param decorators The decorator expressions.
     * @param typeParams PEP 695 type parameters.
     * @param range The source range.
     */
    record ClassDef(
            String name,
            List<Expression> bases,
            List<Keyword> keywords,
            List<Statement> body,
            List<Expression> decorators,
            List<TypeParam> typeParams,
            SourceRange range
    ) implements Statement {
        public ClassDef {
            Objects.requireNonNull(name, "name");
            bases = AstLists.copy(bases);
            keywords = AstLists.copy(keywords);
            body = AstLists.copy(body);
            decorators = AstLists.copy(decorators);
            typeParams = AstLists.copy(typeParams);
            range = AstLists.range(range);
        }
    }

    /** {@code return} with an optional value. */
    record Return(Expression value, SourceRange range) implements Statement {
        public Return {
            range = AstLists.range(range);
        }
    }

    record Delete(List<Expression> targets, SourceRange range) implements Statement {
        public Delete {
            targets = AstLists.copy(targets);
            range = AstLists.range(range);
        }
    }

    /**
     * A plain assignment. Chained assignments {@code a = b = 1} have several targets.
     *
     * @param targets The targets in source order, all in store context.
     * @param value The assigned value.
     * @param range The source range.
     */
    record Assign(List<Expression> targets, Expression value, SourceRange range) implements Statement {
        public Assign {
            targets = AstLists.copy(targets);
            Objects.requireNonNull(value, "value");
            if (targets.isEmpty()) {
                throw new IllegalArgumentException("Assign needs at least one target");
            }
            range = AstLists.range(range);
        }
    }

    record AugAssign(Expression target, BinaryOperator op, Expression value, SourceRange range) implements Statement {
        public AugAssign {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(value, "value");
            range = AstLists.range(range);
        }
    }

    /**
     * An annotated assignment {@code x: int = 1}.
     *
     * @param target The target.
     * @param annotation The annotation.
     * @param value The value, or null.
     * @param simple True when the target is a bare, unparenthesized name.
     * @param range The source range.
     */
    record AnnAssign(Expression target, Expression annotation, Expression value, boolean simple, SourceRange range)
            implements Statement {
        public AnnAssign {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(annotation, "annotation");
            range = AstLists.range(range);
        }
    }

    record For(Expression target, Expression iter, List<Statement> body, List<Statement> orElse, SourceRange range)
            implements Statement {
        public For {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(iter, "iter");
            body = AstLists.copy(body);
            orElse = AstLists.copy(orElse);
            range = AstLists.range(range);
        }
    }

    record AsyncFor(Expression target, Expression iter, List<Statement> body, List<Statement> orElse, SourceRange range)
            implements Statement {
        public AsyncFor {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(iter, "iter");
            body = AstLists.copy(body);
            orElse = AstLists.copy(orElse);
            range = AstLists.range(range);
        }
    }

    record While(Expression test, List<Statement> body, List<Statement> orElse, SourceRange range)
            implements Statement {
        public While {
            Objects.requireNonNull(test, "test");
            body = AstLists.copy(body);
            orElse = AstLists.copy(orElse);
            range = AstLists.range(range);
        }
    }

    /**
     * An {@code if} statement. An {@code elif} is a single nested {@code If} in {@code orElse}.
     *
     * @param test The condition.
     * @param body The statements run when the condition holds.
     * @param orElse The {@code else} statements, or the nested {@code elif}.
     * @param range The source range.
     */
    record If(Expression test, List<Statement> body, List<Statement> orElse, SourceRange range)
            implements Statement {
        public If {
            Objects.requireNonNull(test, "test");
            body = AstLists.copy(body);
            orElse = AstLists.copy(orElse);
            range = AstLists.range(range);
        }
    }

    record With(List<WithItem> items, List<Statement> body, SourceRange range) implements Statement {
        public With {
            items = AstLists.copy(items);
            body = AstLists.copy(body);
            range = AstLists.range(range);
        }
    }

    record AsyncWith(List<WithItem> items, List<Statement> body, SourceRange range) implements Statement {
        public AsyncWith {
            items = AstLists.copy(items);
            body = AstLists.copy(body);
            range = AstLists.range(range);
        }
    }

    /**
     * A {@code match} statement.
     *
     * @param subject The matched expression.
     * @param cases The case clauses, at least one.
     * @param range The source range.
     */
    record Match(Expression subject, List<MatchCase> cases, SourceRange range) implements Statement {
        public Match {
            Objects.requireNonNull(subject, "subject");
            cases = AstLists.copy(cases);
            range = AstLists.range(range);
        }
    }

    /** {@code raise [exc [from cause]]}. */
    record Raise(Expression exc, Expression cause, SourceRange range) implements Statement {
        public Raise {
            if (cause != null && exc == null) {
                throw new IllegalArgumentException("raise ... from needs an exception");
            }
            range = AstLists.range(range);
        }
    }

    record Try(
            List<Statement> body,
            List<ExceptHandler> handlers,
            List<Statement> orElse,
            List<Statement> finalBody,
            SourceRange range
    ) implements Statement {
        public Try {
            body = AstLists.copy(body);
            handlers = AstLists.copy(handlers);
            orElse = AstLists.copy(orElse);
            finalBody = AstLists.copy(finalBody);
            range = AstLists.range(range);
        }
    }

    /** A {@code try} statement whose handlers are {@code except*} clauses. */
    record TryStar(
            List<Statement> body,
            List<ExceptHandler> handlers,
            List<Statement> orElse,
            List<Statement> finalBody,
            SourceRange range
    ) implements Statement {
        public TryStar {
            body = AstLists.copy(body);
            handlers = AstLists.copy(handlers);
            orElse = AstLists.copy(orElse);
            finalBody = AstLists.copy(finalBody);
            range = AstLists.range(range);
        }
    }

    record Assert(Expression test, Expression msg, SourceRange range) implements Statement {
        public Assert {
            Objects.requireNonNull(test, "test");
            range = AstLists.range(range);
        }
    }

    record Import(List<Alias> names, SourceRange range) implements Statement {
        public Import {
            names = AstLists.copy(names);
            range = AstLists.range(range);
        }
    }

    /**
     * {@code from module import names}.
     *
     * @param module The dotted module name, or null for {@code from . import x}.
     * @param names The imported names.
     * @param level The number of leading dots.
     * @param range The source range.
     */
    record ImportFrom(String module, List<Alias> names, int level, SourceRange range) implements Statement {
        public ImportFrom {
            names = AstLists.copy(names);
            if (level < 0) {
                throw new IllegalArgumentException("Negative import level " + level);
            }
            range = AstLists.range(range);
        }
    }

    record Global(List<String> names, SourceRange range) implements Statement {
        public Global {
            names = AstLists.copy(names);
            range = AstLists.range(range);
        }
    }

    record Nonlocal(List<String> names, SourceRange range) implements Statement {
        public Nonlocal {
            names = AstLists.copy(names);
            range = AstLists.range(range);
        }
    }

    /** An expression used as a statement. */
    record Expr(Expression value, SourceRange range) implements Statement {
        public Expr {
            Objects.requireNonNull(value, "value");
            range = AstLists.range(range);
        }
    }

    record Pass(SourceRange range) implements Statement {
        public Pass {
            range = AstLists.range(range);
        }
    }

    record Break(SourceRange range) implements Statement {
        public Break {
            range = AstLists.range(range);
        }
    }

    record Continue(SourceRange range) implements Statement {
        public Continue {
            range = AstLists.range(range);
        }
    }

    /**
     * {@code type Name[params] = value}.
     *
     * @param name The alias name, a {@link Expression.Name} in store context.
     * @param typeParams The type parameters.
     * @param value The aliased type expression.
     * @param range The source range.
     */
    record TypeAlias(Expression name, List<TypeParam> typeParams, Expression value, SourceRange range)
            implements Statement {
        public TypeAlias {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(value, "value");
            typeParams = AstLists.copy(typeParams);
            range = AstLists.range(range);
        }
    }

    /**
     * Empty lines inserted by tools that rewrite a tree. The parser never produces it.
     *
     * @param count The number of empty lines.
     * @param range The source range.
     */
    record Blank(int count, SourceRange range) implements Statement {
        public Blank {
            if (count < 0) {
                throw new IllegalArgumentException("Negative blank line count " + count);
            }
            range = AstLists.range(range);
        }
    }
}
