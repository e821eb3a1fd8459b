package org.pysyntax.backend.codegen;

import org.pysyntax.frontend.parser.ast.Alias;
import org.pysyntax.frontend.parser.ast.Arguments;
import org.pysyntax.frontend.parser.ast.ExceptHandler;
import org.pysyntax.frontend.parser.ast.Expression;
import org.pysyntax.frontend.parser.ast.MatchCase;
import org.pysyntax.frontend.parser.ast.Module;
import org.pysyntax.frontend.parser.ast.Statement;
import org.pysyntax.frontend.parser.ast.TypeParam;
import org.pysyntax.frontend.parser.ast.WithItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.StringJoiner;

/**
 * The CodeGenerator renders a syntax tree back to Python source text.
 * <p>
 * Output is normalized rather than a copy of the original layout: indentation follows the configured
 * width, strings use the configured quote, parentheses appear only where precedence requires them and
 * definitions are separated by blank lines. Parsing the output again yields a tree equal to the input
 * apart from source positions.
 * <p>
 * A CodeGenerator is immutable and may be shared between threads.
 */
public class CodeGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(CodeGenerator.class);

    private final CodeGenConfig config;
    private final ExpressionWriter expressions;

    /**
     * Creates a generator with {@link CodeGenConfig#DEFAULT}.
     */
    public CodeGenerator() {
        this(CodeGenConfig.DEFAULT);
    }

    public CodeGenerator(CodeGenConfig config) {
        this.config = config;
        this.expressions = new ExpressionWriter(config.quoteStyle());
    }

    /**
     * Renders a module.
     *
     * @param module The tree to render.
     * @return The source text, ending with a newline unless the module is empty.
     * @throws IllegalArgumentException if the tree contains a node in a position Python does not allow.
     */
    public String generate(Module module) {
        CodeWriter out = new CodeWriter(config.indentWidth());
        if (module instanceof Module.Program program) {
            statements(program.body(), out);
        } else if (module instanceof Module.Interactive interactive) {
            statements(interactive.body(), out);
        } else if (module instanceof Module.Eval eval) {
            out.line(expressions.expr(eval.body(), Precedence.TUPLE));
        } else if (module instanceof Module.FunctionType functionType) {
            StringJoiner argTypes = new StringJoiner(", ", "(", ")");
            for (Expression argType : functionType.argTypes()) {
                argTypes.add(expressions.expr(argType, Precedence.TEST));
            }
            out.line(argTypes + " -> " + expressions.expr(functionType.returns(), Precedence.TEST));
        }
        return out.toString();
    }

    /**
     * Renders a single expression as it would appear on the right of an assignment.
     */
    public String generate(Expression expression) {
        return expressions.expr(expression, Precedence.TUPLE);
    }

    // region Statements

    private void statements(List<Statement> body, CodeWriter out) {
        Statement previous = null;
        for (Statement statement : body) {
            if (previous != null && !(statement instanceof Statement.Blank) && !(previous instanceof Statement.Blank)
                    && (isDefinition(statement) || isDefinition(previous))) {
                out.blankLines(out.level() == 0 ? 2 : 1);
            }
            statement(statement, out);
            previous = statement;
        }
    }

    private static boolean isDefinition(Statement statement) {
        return statement instanceof Statement.FunctionDef || statement instanceof Statement.AsyncFunctionDef
                || statement instanceof Statement.ClassDef;
    }

    private void body(List<Statement> body, CodeWriter out) {
        out.indent();
        // blank markers alone do not form a block
        if (body.stream().allMatch(statement -> statement instanceof Statement.Blank)) {
            out.line("pass");
        }
        statements(body, out);
        out.dedent();
    }

    private void statement(Statement s, CodeWriter out) {
        if (s instanceof Statement.FunctionDef def) {
            functionDef(def.decorators(), false, def.name(), def.typeParams(), def.args(), def.returns(), out);
            body(def.body(), out);
        } else if (s instanceof Statement.AsyncFunctionDef def) {
            functionDef(def.decorators(), true, def.name(), def.typeParams(), def.args(), def.returns(), out);
            body(def.body(), out);
        } else if (s instanceof Statement.ClassDef cls) {
            decorators(cls.decorators(), out);
            List<String> arguments = expressions.classArguments(cls.bases(), cls.keywords());
            String bases = arguments.isEmpty() ? "" : "(" + String.join(", ", arguments) + ")";
            out.line("class " + cls.name() + expressions.typeParams(cls.typeParams()) + bases + ":");
            body(cls.body(), out);
        } else if (s instanceof Statement.Return ret) {
            if (ret.value() == null) {
                out.line("return");
            } else {
                valueLine("return ", ret.value(), out);
            }
        } else if (s instanceof Statement.Delete delete) {
            out.line("del " + joined(delete.targets(), Precedence.TEST));
        } else if (s instanceof Statement.Assign assign) {
            StringBuilder prefix = new StringBuilder();
            for (Expression target : assign.targets()) {
                prefix.append(expressions.expr(target, Precedence.TUPLE)).append(" = ");
            }
            valueLine(prefix.toString(), assign.value(), out);
        } else if (s instanceof Statement.AugAssign aug) {
            valueLine(expressions.expr(aug.target(), Precedence.TUPLE) + " " + aug.op().symbol() + "= ",
                    aug.value(), out);
        } else if (s instanceof Statement.AnnAssign ann) {
            String target = expressions.expr(ann.target(), Precedence.ATOM);
            if (!ann.simple() && ann.target() instanceof Expression.Name) {
                target = "(" + target + ")";
            }
            String head = target + ": " + expressions.expr(ann.annotation(), Precedence.TEST);
            if (ann.value() == null) {
                out.line(head);
            } else {
                valueLine(head + " = ", ann.value(), out);
            }
        } else if (s instanceof Statement.For loop) {
            forLoop("for ", loop.target(), loop.iter(), loop.body(), loop.orElse(), out);
        } else if (s instanceof Statement.AsyncFor loop) {
            forLoop("async for ", loop.target(), loop.iter(), loop.body(), loop.orElse(), out);
        } else if (s instanceof Statement.While loop) {
            out.line("while " + expressions.expr(loop.test(), Precedence.TEST) + ":");
            body(loop.body(), out);
            elseClause(loop.orElse(), out);
        } else if (s instanceof Statement.If branch) {
            ifChain(branch, "if", out);
        } else if (s instanceof Statement.With with) {
            out.line("with " + withItems(with.items()) + ":");
            body(with.body(), out);
        } else if (s instanceof Statement.AsyncWith with) {
            out.line("async with " + withItems(with.items()) + ":");
            body(with.body(), out);
        } else if (s instanceof Statement.Match match) {
            matchStatement(match, out);
        } else if (s instanceof Statement.Raise raise) {
            StringBuilder sb = new StringBuilder("raise");
            if (raise.exc() != null) {
                sb.append(' ').append(expressions.expr(raise.exc(), Precedence.TEST));
            }
            if (raise.cause() != null) {
                sb.append(" from ").append(expressions.expr(raise.cause(), Precedence.TEST));
            }
            out.line(sb.toString());
        } else if (s instanceof Statement.Try tryStatement) {
            tryStatement(tryStatement.body(), tryStatement.handlers(), tryStatement.orElse(),
                    tryStatement.finalBody(), "except", out);
        } else if (s instanceof Statement.TryStar tryStar) {
            tryStatement(tryStar.body(), tryStar.handlers(), tryStar.orElse(), tryStar.finalBody(), "except*", out);
        } else if (s instanceof Statement.Assert assertion) {
            String text = "assert " + expressions.expr(assertion.test(), Precedence.TEST);
            if (assertion.msg() != null) {
                text += ", " + expressions.expr(assertion.msg(), Precedence.TEST);
            }
            out.line(text);
        } else if (s instanceof Statement.Import importStatement) {
            out.line("import " + aliases(importStatement.names()));
        } else if (s instanceof Statement.ImportFrom from) {
            String module = ".".repeat(from.level()) + (from.module() == null ? "" : from.module());
            out.line("from " + module + " import " + aliases(from.names()));
        } else if (s instanceof Statement.Global global) {
            out.line("global " + String.join(", ", global.names()));
        } else if (s instanceof Statement.Nonlocal nonlocal) {
            out.line("nonlocal " + String.join(", ", nonlocal.names()));
        } else if (s instanceof Statement.Expr expr) {
            valueLine("", expr.value(), out);
        } else if (s instanceof Statement.Pass) {
            out.line("pass");
        } else if (s instanceof Statement.Break) {
            out.line("break");
        } else if (s instanceof Statement.Continue) {
            out.line("continue");
        } else if (s instanceof Statement.TypeAlias alias) {
            out.line("type " + expressions.expr(alias.name(), Precedence.ATOM)
                    + expressions.typeParams(alias.typeParams())
                    + " = " + expressions.expr(alias.value(), Precedence.TEST));
        } else if (s instanceof Statement.Blank blank) {
            out.blankLines(blank.count());
        } else {
            throw new IllegalArgumentException("Unsupported statement: " + s.getClass().getSimpleName());
        }
    }

    private void decorators(List<Expression> decorators, CodeWriter out) {
        for (Expression decorator : decorators) {
            out.line("@" + expressions.expr(decorator, Precedence.TEST));
        }
    }

    private void functionDef(List<Expression> decorators, boolean isAsync, String name,
                             List<TypeParam> typeParams,
                             Arguments args, Expression returns, CodeWriter out) {
        decorators(decorators, out);
        StringBuilder header = new StringBuilder(isAsync ? "async def " : "def ")
                .append(name)
                .append(expressions.typeParams(typeParams))
                .append('(').append(expressions.arguments(args)).append(')');
        if (returns != null) {
            header.append(" -> ").append(expressions.expr(returns, Precedence.TEST));
        }
        out.line(header.append(':').toString());
    }

    private void forLoop(String keyword, Expression target, Expression iter, List<Statement> body,
                         List<Statement> orElse, CodeWriter out) {
        out.line(keyword + expressions.expr(target, Precedence.TUPLE) + " in "
                + expressions.expr(iter, Precedence.TUPLE) + ":");
        body(body, out);
        elseClause(orElse, out);
    }

    private void elseClause(List<Statement> orElse, CodeWriter out) {
        if (!orElse.isEmpty()) {
            out.line("else:");
            body(orElse, out);
        }
    }

    /**
     * Emits an if statement, folding an else branch that holds nothing but another if into {@code elif}.
     */
    private void ifChain(Statement.If branch, String keyword, CodeWriter out) {
        out.line(keyword + " " + expressions.expr(branch.test(), Precedence.TEST) + ":");
        body(branch.body(), out);
        List<Statement> orElse = branch.orElse();
        if (orElse.size() == 1 && orElse.get(0) instanceof Statement.If nested) {
            ifChain(nested, "elif", out);
        } else {
            elseClause(orElse, out);
        }
    }

    private String withItems(List<WithItem> items) {
        StringJoiner joiner = new StringJoiner(", ");
        for (WithItem item : items) {
            String text = expressions.expr(item.contextExpr(), Precedence.TEST);
            if (item.optionalVars() != null) {
                text += " as " + expressions.expr(item.optionalVars(), Precedence.TEST);
            }
            joiner.add(text);
        }
        return joiner.toString();
    }

    private void matchStatement(Statement.Match match, CodeWriter out) {
        out.line("match " + expressions.expr(match.subject(), Precedence.TUPLE) + ":");
        out.indent();
        for (MatchCase matchCase : match.cases()) {
            String header = "case " + expressions.pattern(matchCase.pattern());
            if (matchCase.guard() != null) {
                header += " if " + expressions.expr(matchCase.guard(), Precedence.TEST);
            }
            out.line(header + ":");
            body(matchCase.body(), out);
        }
        out.dedent();
    }

    private void tryStatement(List<Statement> body, List<ExceptHandler> handlers, List<Statement> orElse,
                              List<Statement> finalBody, String exceptKeyword, CodeWriter out) {
        out.line("try:");
        body(body, out);
        for (ExceptHandler handler : handlers) {
            StringBuilder header = new StringBuilder(exceptKeyword);
            if (handler.type() != null) {
                header.append(' ').append(expressions.expr(handler.type(), Precedence.TEST));
                if (handler.name() != null) {
                    header.append(" as ").append(handler.name());
                }
            }
            out.line(header.append(':').toString());
            body(handler.body(), out);
        }
        elseClause(orElse, out);
        if (!finalBody.isEmpty()) {
            out.line("finally:");
            body(finalBody, out);
        }
    }

    private static String aliases(List<Alias> names) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Alias alias : names) {
            joiner.add(alias.asname() == null ? alias.name() : alias.name() + " as " + alias.asname());
        }
        return joiner.toString();
    }

    private String joined(List<Expression> values, Precedence precedence) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Expression value : values) {
            joiner.add(expressions.expr(value, precedence));
        }
        return joiner.toString();
    }

    // endregion

    // region Line length

    /**
     * Emits {@code prefix + value}. When the line is too long and the value is a call or a display,
     * its elements are written one per line inside the brackets.
     */
    private void valueLine(String prefix, Expression value, CodeWriter out) {
        String text = prefix + expressions.expr(value, Precedence.TUPLE);
        int length = out.prefix().length() + text.length();
        if (length <= config.maxLineLength()) {
            out.line(text);
            return;
        }
        Exploded exploded = explode(value);
        if (exploded == null) {
            LOG.debug("Line of {} characters exceeds the limit of {} and cannot be split: {}",
                    length, config.maxLineLength(), text);
            out.line(text);
            return;
        }
        out.line(prefix + exploded.opener());
        out.indent();
        List<String> elements = exploded.elements();
        for (int i = 0; i < elements.size(); i++) {
            boolean last = i == elements.size() - 1;
            out.line(elements.get(i) + (!last || config.trailingCommas() ? "," : ""));
        }
        out.dedent();
        out.line(exploded.closer());
    }

    private record Exploded(String opener, List<String> elements, String closer) {
    }

    private Exploded explode(Expression value) {
        if (value instanceof Expression.Call call) {
            if (ExpressionWriter.isBareGeneratorCall(call)) {
                return null;
            }
            List<String> arguments = expressions.callArguments(call);
            if (arguments.isEmpty()) {
                return null;
            }
            return new Exploded(expressions.expr(call.func(), Precedence.ATOM) + "(", arguments, ")");
        }
        if (value instanceof Expression.ListExpr list && !list.elts().isEmpty()) {
            return new Exploded("[", expressions.displayElements(list.elts()), "]");
        }
        if (value instanceof Expression.SetExpr set && !set.elts().isEmpty()) {
            return new Exploded("{", expressions.displayElements(set.elts()), "}");
        }
        if (value instanceof Expression.DictExpr dict && !dict.keys().isEmpty()) {
            return new Exploded("{", expressions.dictEntries(dict), "}");
        }
        return null;
    }

    // endregion
}
