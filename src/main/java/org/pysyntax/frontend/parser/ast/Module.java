package org.pysyntax.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * The root of a parsed tree. Which variant is produced depends on the parse mode.
 */
public sealed interface Module {

    /**
     * A regular source file.
     * @param body The top-level statements.
     */
    record Program(List<Statement> body) implements Module {
        public Program {
            body = AstLists.copy(body);
        }
    }

    /**
     * One unit typed at an interactive prompt.
     * @param body The statements of the unit.
     */
    record Interactive(List<Statement> body) implements Module {
        public Interactive {
            body = AstLists.copy(body);
        }
    }

    /**
     * A single expression, as accepted by {@code eval()}.
     * @param body The expression.
     */
    record Eval(Expression body) implements Module {
        public Eval {
            Objects.requireNonNull(body, "body");
        }
    }

    /**
     * A signature type comment such as {@code (int, str) -> bool}.
     * @param argTypes The argument types.
     * @param returns The return type.
     */
    record FunctionType(List<Expression> argTypes, Expression returns) implements Module {
        public FunctionType {
            argTypes = AstLists.copy(argTypes);
            Objects.requireNonNull(returns, "returns");
        }
    }
}
