package org.pysyntax.frontend.parser.ast;

import java.util.Objects;

/**
 * A type parameter of a generic function, class or type alias, e.g. {@code [T: int, *Ts, **P]}.
 */
public sealed interface TypeParam extends AstNode {

    String name();

    /** The default value after {@code =}, or null. */
    Expression defaultValue();

    /**
     * A plain type variable.
     * @param name The name.
     * @param bound The bound or constraint tuple after {@code :}, or null.
     * @param defaultValue The default, or null.
     * @param range The source range.
     */
    record TypeVar(String name, Expression bound, Expression defaultValue, SourceRange range) implements TypeParam {
        public TypeVar {
            Objects.requireNonNull(name, "name");
            range = AstLists.range(range);
        }
    }

    /** A {@code **P} parameter specification. */
    record ParamSpec(String name, Expression defaultValue, SourceRange range) implements TypeParam {
        public ParamSpec {
            Objects.requireNonNull(name, "name");
            range = AstLists.range(range);
        }
    }

    /** A {@code *Ts} variadic type variable. */
    record TypeVarTuple(String name, Expression defaultValue, SourceRange range) implements TypeParam {
        public TypeVarTuple {
            Objects.requireNonNull(name, "name");
            range = AstLists.range(range);
        }
    }
}
