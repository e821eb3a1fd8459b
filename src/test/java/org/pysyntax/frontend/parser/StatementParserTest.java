package org.pysyntax.frontend.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pysyntax.api.ParseMode;
import org.pysyntax.api.SyntaxException;
import org.pysyntax.frontend.lexer.Tokenizer;
import org.pysyntax.frontend.parser.ast.Alias;
import org.pysyntax.frontend.parser.ast.Arg;
import org.pysyntax.frontend.parser.ast.Arguments;
import org.pysyntax.frontend.parser.ast.BinaryOperator;
import org.pysyntax.frontend.parser.ast.ExprContext;
import org.pysyntax.frontend.parser.ast.Expression;
import org.pysyntax.frontend.parser.ast.Module;
import org.pysyntax.frontend.parser.ast.SourceRange;
import org.pysyntax.frontend.parser.ast.Statement;
import org.pysyntax.frontend.parser.ast.TypeParam;
import org.pysyntax.junit.extensions.logging.LogWatchExtension;
import org.pysyntax.util.AstDump;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Contains unit tests for statement parsing: simple statements, compound statements and the
 * soft keywords that are only keywords in statement position.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class StatementParserTest {

    private static List<Statement> parse(String source) throws SyntaxException {
        Module module = new Parser(new Tokenizer(source).tokenize(), source).parse();
        return ((Module.Program) module).body();
    }

    private static Statement parseSingle(String source) throws SyntaxException {
        List<Statement> body = parse(source);
        assertThat(body).hasSize(1);
        return body.get(0);
    }

    @Test
    @DisplayName("'match' used as a variable is an ordinary assignment")
    void testMatchAsIdentifier() throws Exception {
        // Act
        Statement statement = parseSingle("match = 5\n");

        // Assert
        assertThat(statement).isInstanceOfSatisfying(Statement.Assign.class, assign -> {
            assertThat(assign.targets()).singleElement().isInstanceOfSatisfying(Expression.Name.class, name -> {
                assertThat(name.id()).isEqualTo("match");
                assertThat(name.ctx()).isEqualTo(ExprContext.STORE);
            });
        });
    }

    @Test
    @DisplayName("A match statement needs a subject, a colon and an indented case block")
    void testMatchStatementIsRecognized() throws Exception {
        // Act
        List<Statement> body = parse("match(x)\nmatch x:\n    case 1:\n        pass\n");

        // Assert
        assertThat(body.get(0)).isInstanceOf(Statement.Expr.class);
        assertThat(body.get(1)).isInstanceOfSatisfying(Statement.Match.class,
                match -> assertThat(match.cases()).hasSize(1));
    }

    /**
     * Verifies the complete parameter grammar: positional parameters with a default, a var-positional
     * parameter, a keyword-only parameter and a var-keyword parameter.
     */
    @Test
    void testFunctionParameters() throws Exception {
        // Act
        Statement statement = parseSingle("def f(a, b=1, *args, c, **kw): return a");

        // Assert
        assertThat(statement).isInstanceOfSatisfying(Statement.FunctionDef.class, def -> {
            Arguments args = def.args();
            assertThat(args.posonlyArgs()).isEmpty();
            assertThat(args.args()).extracting(Arg::name).containsExactly("a", "b");
            assertThat(AstDump.dump(args.defaults())).isEqualTo("[Constant(value=1, kind=None)]");
            assertThat(args.vararg().name()).isEqualTo("args");
            assertThat(args.kwonlyArgs()).extracting(Arg::name).containsExactly("c");
            assertThat(args.kwDefaults()).containsExactly((Expression) null);
            assertThat(args.kwarg().name()).isEqualTo("kw");
            assertThat(def.body()).singleElement().isInstanceOf(Statement.Return.class);
        });
    }

    @Test
    void testPositionalOnlyAndAnnotations() throws Exception {
        // Act
        Statement statement = parseSingle("def f(a: int, /, b, *, c: str = 'x') -> bool:\n    pass\n");

        // Assert
        assertThat(statement).isInstanceOfSatisfying(Statement.FunctionDef.class, def -> {
            assertThat(def.args().posonlyArgs()).extracting(Arg::name).containsExactly("a");
            assertThat(def.args().posonlyArgs().get(0).annotation()).isNotNull();
            assertThat(def.args().args()).extracting(Arg::name).containsExactly("b");
            assertThat(def.args().vararg()).isNull();
            assertThat(def.args().kwonlyArgs()).extracting(Arg::name).containsExactly("c");
            assertThat(def.args().kwDefaults().get(0)).isNotNull();
            assertThat(def.returns()).isInstanceOf(Expression.Name.class);
        });
    }

    /**
     * An elif branch is an If nested in the else branch of the preceding If.
     */
    @Test
    void testElifChain() throws Exception {
        // Arrange
        String source = String.join("\n",
                "if a:",
                "    x = 1",
                "elif b:",
                "    x = 2",
                "else:",
                "    x = 3",
                "");

        // Act
        Statement statement = parseSingle(source);

        // Assert
        assertThat(statement).isInstanceOfSatisfying(Statement.If.class, outer -> {
            assertThat(outer.body()).hasSize(1);
            assertThat(outer.orElse()).singleElement().isInstanceOfSatisfying(Statement.If.class,
                    inner -> assertThat(inner.orElse()).hasSize(1));
        });
    }

    @Test
    void testLoopsWithElse() throws Exception {
        // Act
        List<Statement> body = parse("for i, j in pairs:\n    pass\nelse:\n    done()\nwhile x:\n    break\n");

        // Assert
        assertThat(body.get(0)).isInstanceOfSatisfying(Statement.For.class, loop -> {
            assertThat(loop.target()).isInstanceOfSatisfying(Expression.TupleExpr.class,
                    target -> assertThat(target.ctx()).isEqualTo(ExprContext.STORE));
            assertThat(loop.orElse()).hasSize(1);
        });
        assertThat(body.get(1)).isInstanceOfSatisfying(Statement.While.class,
                loop -> assertThat(loop.body()).singleElement().isInstanceOf(Statement.Break.class));
    }

    @Test
    void testAssignmentForms() throws Exception {
        // Act
        List<Statement> body = parse("a = b = 1\nx: int = 1\n(y): str\nz += 2\n");

        // Assert
        assertThat(body.get(0)).isInstanceOfSatisfying(Statement.Assign.class,
                assign -> assertThat(assign.targets()).hasSize(2));
        assertThat(body.get(1)).isInstanceOfSatisfying(Statement.AnnAssign.class, ann -> {
            assertThat(ann.simple()).isTrue();
            assertThat(ann.value()).isNotNull();
        });
        assertThat(body.get(2)).isInstanceOfSatisfying(Statement.AnnAssign.class, ann -> {
            assertThat(ann.simple()).isFalse();
            assertThat(ann.value()).isNull();
        });
        assertThat(body.get(3)).isInstanceOfSatisfying(Statement.AugAssign.class,
                aug -> assertThat(aug.op()).isEqualTo(BinaryOperator.ADD));
    }

    @Test
    void testStarredAssignmentTarget() throws Exception {
        // Act
        Statement statement = parseSingle("first, *rest = items");

        // Assert
        assertThat(AstDump.dump(statement)).isEqualTo("Assign(targets=[TupleExpr(elts=[Name(id='first', ctx=STORE), "
                + "Starred(value=Name(id='rest', ctx=STORE), ctx=STORE)], ctx=STORE)], value=Name(id='items', ctx=LOAD))");
    }

    /**
     * Verifies the module name, relative level and aliases of the different import forms.
     */
    @Test
    void testImports() throws Exception {
        // Act
        List<Statement> body = parse(String.join("\n",
                "import a.b as c, d",
                "from ..pkg import (x as y, z,)",
                "from . import *",
                "from ...up import w",
                ""));

        // Assert
        assertThat(body.get(0)).isInstanceOfSatisfying(Statement.Import.class,
                i -> assertThat(i.names()).extracting(Alias::name, Alias::asname)
                        .containsExactly(tuple("a.b", "c"), tuple("d", null)));
        assertThat(body.get(1)).isInstanceOfSatisfying(Statement.ImportFrom.class, from -> {
            assertThat(from.module()).isEqualTo("pkg");
            assertThat(from.level()).isEqualTo(2);
            assertThat(from.names()).extracting(Alias::name).containsExactly("x", "z");
        });
        assertThat(body.get(2)).isInstanceOfSatisfying(Statement.ImportFrom.class, from -> {
            assertThat(from.module()).isNull();
            assertThat(from.level()).isEqualTo(1);
            assertThat(from.names()).extracting(Alias::name).containsExactly("*");
        });
        assertThat(body.get(3)).isInstanceOfSatisfying(Statement.ImportFrom.class,
                from -> assertThat(from.level()).isEqualTo(3));
    }

    @Test
    void testTryStatement() throws Exception {
        // Arrange
        String source = String.join("\n",
                "try:",
                "    run()",
                "except (A, B) as e:",
                "    pass",
                "except C:",
                "    pass",
                "except:",
                "    raise",
                "else:",
                "    ok()",
                "finally:",
                "    close()",
                "");

        // Act
        Statement statement = parseSingle(source);

        // Assert
        assertThat(statement).isInstanceOfSatisfying(Statement.Try.class, t -> {
            assertThat(t.handlers()).extracting(h -> h.name()).containsExactly("e", null, null);
            assertThat(t.handlers().get(2).type()).isNull();
            assertThat(t.orElse()).hasSize(1);
            assertThat(t.finalBody()).hasSize(1);
        });
    }

    @Test
    void testExceptStarBuildsTryStar() throws Exception {
        // Act
        Statement statement = parseSingle("try:\n    run()\nexcept* ValueError:\n    pass\n");

        // Assert
        assertThat(statement).isInstanceOfSatisfying(Statement.TryStar.class,
                t -> assertThat(t.handlers()).hasSize(1));
    }

    /**
     * A parenthesized list of with-items is distinguished from a parenthesized context expression.
     */
    @Test
    void testWithItems() throws Exception {
        // Act
        List<Statement> body = parse(String.join("\n",
                "with open(a) as f, lock:",
                "    pass",
                "with (open(a) as f, open(b) as g,):",
                "    pass",
                "with (yield):",
                "    pass",
                ""));

        // Assert
        assertThat(body.get(0)).isInstanceOfSatisfying(Statement.With.class, with -> {
            assertThat(with.items()).hasSize(2);
            assertThat(with.items().get(0).optionalVars()).isInstanceOfSatisfying(Expression.Name.class,
                    name -> assertThat(name.ctx()).isEqualTo(ExprContext.STORE));
            assertThat(with.items().get(1).optionalVars()).isNull();
        });
        assertThat(body.get(1)).isInstanceOfSatisfying(Statement.With.class,
                with -> assertThat(with.items()).hasSize(2));
        assertThat(body.get(2)).isInstanceOfSatisfying(Statement.With.class,
                with -> assertThat(with.items().get(0).contextExpr()).isInstanceOf(Expression.Yield.class));
    }

    @Test
    void testDecoratedClass() throws Exception {
        // Act
        Statement statement = parseSingle("@register\n@options(1)\nclass C(Base, metaclass=Meta):\n    x = 1\n");

        // Assert
        assertThat(statement).isInstanceOfSatisfying(Statement.ClassDef.class, cls -> {
            assertThat(cls.name()).isEqualTo("C");
            assertThat(cls.decorators()).hasSize(2);
            assertThat(cls.bases()).hasSize(1);
            assertThat(cls.keywords()).extracting(k -> k.arg()).containsExactly("metaclass");
            assertThat(cls.range().line()).isEqualTo(1);
        });
    }

    @Test
    void testAsyncStatements() throws Exception {
        // Arrange
        String source = String.join("\n",
                "async def main():",
                "    async with session as s:",
                "        async for item in s:",
                "            await item",
                "");

        // Act
        Statement statement = parseSingle(source);

        // Assert
        assertThat(statement).isInstanceOfSatisfying(Statement.AsyncFunctionDef.class, def ->
                assertThat(def.body()).singleElement().isInstanceOfSatisfying(Statement.AsyncWith.class, with ->
                        assertThat(with.body()).singleElement().isInstanceOfSatisfying(Statement.AsyncFor.class,
                                loop -> assertThat(loop.body()).singleElement().isInstanceOf(Statement.Expr.class))));
    }

    @Test
    @DisplayName("'type' starts an alias only when followed by a name")
    void testTypeAlias() throws Exception {
        // Act
        List<Statement> body = parse("type Pair[T, *Ts, **P] = tuple[T, T]\ntype = 5\ntype(x)\n");

        // Assert
        assertThat(body.get(0)).isInstanceOfSatisfying(Statement.TypeAlias.class, alias -> {
            assertThat(alias.typeParams()).hasSize(3);
            assertThat(alias.typeParams().get(0)).isInstanceOf(TypeParam.TypeVar.class);
            assertThat(alias.typeParams().get(1)).isInstanceOf(TypeParam.TypeVarTuple.class);
            assertThat(alias.typeParams().get(2)).isInstanceOf(TypeParam.ParamSpec.class);
        });
        assertThat(body.get(1)).isInstanceOf(Statement.Assign.class);
        assertThat(body.get(2)).isInstanceOf(Statement.Expr.class);
    }

    @Test
    void testSimpleStatementsOnOneLine() throws Exception {
        // Act
        List<Statement> body = parse("a = 1; b = 2;\nif a: b; c\n");

        // Assert
        assertThat(body).hasSize(3);
        assertThat(body.get(2)).isInstanceOfSatisfying(Statement.If.class,
                branch -> assertThat(branch.body()).hasSize(2));
    }

    @Test
    void testOtherSimpleStatements() throws Exception {
        // Act
        List<Statement> body = parse(String.join("\n",
                "global a, b",
                "nonlocal c",
                "del x, y[0]",
                "assert x, 'message'",
                "raise Error() from cause",
                "return",
                "pass",
                ""));

        // Assert
        assertThat(body).extracting(s -> s.getClass().getSimpleName()).containsExactly(
                "Global", "Nonlocal", "Delete", "Assert", "Raise", "Return", "Pass");
        assertThat(((Statement.Global) body.get(0)).names()).containsExactly("a", "b");
        assertThat(((Statement.Delete) body.get(2)).targets()).allSatisfy(target ->
                assertThat(AstDump.dump(target)).contains("ctx=DEL"));
        assertThat(((Statement.Raise) body.get(4)).cause()).isNotNull();
    }

    @Test
    void testStatementRanges() throws Exception {
        // Act
        List<Statement> body = parse("x = 1\nif y:\n    z = 2\n");

        // Assert
        assertThat(body.get(0).range()).isEqualTo(new SourceRange(1, 1, 1, 6));
        assertThat(body.get(1).range().line()).isEqualTo(2);
        assertThat(body.get(1).range().endLine()).isEqualTo(3);
    }

    @Test
    void testEmptySourceGivesEmptyModule() throws Exception {
        assertThat(parse("")).isEmpty();
        assertThat(parse("# only a comment\n\n")).isEmpty();
    }

    @Test
    void testInteractiveMode() throws Exception {
        // Act
        Module module = new Parser(new Tokenizer("x = 1\n").tokenize()).parse(ParseMode.INTERACTIVE);

        // Assert
        assertThat(module).isInstanceOfSatisfying(Module.Interactive.class,
                interactive -> assertThat(interactive.body()).hasSize(1));
    }

    /**
     * A signature type comment keeps its argument types in order and drops the star markers.
     */
    @Test
    void testFunctionTypeMode() throws Exception {
        // Act
        Module module = new Parser(new Tokenizer("(int, *str, **dict) -> bool").tokenize()).parse(ParseMode.FUNC_TYPE);

        // Assert
        assertThat(module).isInstanceOfSatisfying(Module.FunctionType.class, type -> {
            assertThat(type.argTypes()).extracting(t -> ((Expression.Name) t).id()).containsExactly("int", "str", "dict");
            assertThat(AstDump.dump(type.returns())).isEqualTo("Name(id='bool', ctx=LOAD)");
        });
    }
}
