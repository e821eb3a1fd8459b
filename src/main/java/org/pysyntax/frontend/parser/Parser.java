package org.pysyntax.frontend.parser;

import org.pysyntax.api.ParseException;
import org.pysyntax.api.ParseMode;
import org.pysyntax.frontend.lexer.Token;
import org.pysyntax.frontend.lexer.TokenType;
import org.pysyntax.frontend.parser.ast.Alias;
import org.pysyntax.frontend.parser.ast.Arguments;
import org.pysyntax.frontend.parser.ast.AstNode;
import org.pysyntax.frontend.parser.ast.BinaryOperator;
import org.pysyntax.frontend.parser.ast.ExceptHandler;
import org.pysyntax.frontend.parser.ast.ExprContext;
import org.pysyntax.frontend.parser.ast.Expression;
import org.pysyntax.frontend.parser.ast.Keyword;
import org.pysyntax.frontend.parser.ast.MatchCase;
import org.pysyntax.frontend.parser.ast.Module;
import org.pysyntax.frontend.parser.ast.Pattern;
import org.pysyntax.frontend.parser.ast.SourceRange;
import org.pysyntax.frontend.parser.ast.Statement;
import org.pysyntax.frontend.parser.ast.TypeParam;
import org.pysyntax.frontend.parser.ast.WithItem;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * The Parser is responsible for converting a list of tokens into a syntax tree.
 * It parses statements itself and delegates expressions to an {@link ExpressionParser}
 * and {@code case} patterns to a {@link PatternParser}, both of which share this parser's token cursor.
 * <p>
 * A Parser is single-use and not thread-safe. Parsing stops at the first syntax error.
 */
public class Parser implements ParsingContext {

    private static final Map<TokenType, BinaryOperator> AUGMENTED = new EnumMap<>(TokenType.class);

    static {
        AUGMENTED.put(TokenType.PLUS_EQUAL, BinaryOperator.ADD);
        AUGMENTED.put(TokenType.MINUS_EQUAL, BinaryOperator.SUB);
        AUGMENTED.put(TokenType.STAR_EQUAL, BinaryOperator.MULT);
        AUGMENTED.put(TokenType.AT_EQUAL, BinaryOperator.MAT_MULT);
        AUGMENTED.put(TokenType.SLASH_EQUAL, BinaryOperator.DIV);
        AUGMENTED.put(TokenType.PERCENT_EQUAL, BinaryOperator.MOD);
        AUGMENTED.put(TokenType.DOUBLE_STAR_EQUAL, BinaryOperator.POW);
        AUGMENTED.put(TokenType.LEFT_SHIFT_EQUAL, BinaryOperator.LSHIFT);
        AUGMENTED.put(TokenType.RIGHT_SHIFT_EQUAL, BinaryOperator.RSHIFT);
        AUGMENTED.put(TokenType.PIPE_EQUAL, BinaryOperator.BIT_OR);
        AUGMENTED.put(TokenType.CARET_EQUAL, BinaryOperator.BIT_XOR);
        AUGMENTED.put(TokenType.AMPERSAND_EQUAL, BinaryOperator.BIT_AND);
        AUGMENTED.put(TokenType.DOUBLE_SLASH_EQUAL, BinaryOperator.FLOOR_DIV);
    }

    private final List<Token> tokens;
    private final String source;
    private final ExpressionParser expressions;
    private final PatternParser patterns;
    private final Targets targets;
    private int current = 0;

    /**
     * Creates a new Parser.
     * @param tokens The tokens to parse, ending with END_OF_FILE.
     */
    public Parser(List<Token> tokens) {
        this(tokens, null);
    }

    /**
     * Creates a new Parser that can quote the source in its error suggestions.
     * @param tokens The tokens to parse, ending with END_OF_FILE.
     * @param source The text the tokens were produced from, or null.
     */
    public Parser(List<Token> tokens, String source) {
        if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != TokenType.END_OF_FILE) {
            throw new IllegalArgumentException("Token list must end with END_OF_FILE");
        }
        this.tokens = tokens;
        this.source = source;
        this.expressions = new ExpressionParser(this);
        this.patterns = new PatternParser(this, expressions);
        this.targets = new Targets(this);
    }

    /**
     * Parses the tokens as a module of statements.
     * @return The program.
     * @throws ParseException on the first syntax error.
     */
    public Module parse() throws ParseException {
        return parse(ParseMode.EXEC);
    }

    /**
     * Parses the tokens with the given start symbol.
     * @param mode Which kind of input to expect.
     * @return The root of the tree.
     * @throws ParseException on the first syntax error, or when the input nests deeper than the
     *         parser's stack allows.
     */
    public Module parse(ParseMode mode) throws ParseException {
        try {
            switch (mode) {
                case INTERACTIVE:
                    return new Module.Interactive(statementsToEnd());
                case EVAL:
                    return evalInput();
                case FUNC_TYPE:
                    return functionTypeInput();
                default:
                    return new Module.Program(statementsToEnd());
            }
        } catch (StackOverflowError e) {
            // unary chains and bare lambdas have no bracket limit
            throw error(peek(), "too many nested expressions");
        }
    }

    private List<Statement> statementsToEnd() throws ParseException {
        List<Statement> body = new ArrayList<>();
        while (!isAtEnd()) {
            body.addAll(statement());
        }
        return body;
    }

    private Module evalInput() throws ParseException {
        match(TokenType.INDENT);
        Expression body = expressions.starExpressions();
        skipTrailingLayout();
        if (!isAtEnd()) {
            throw error("invalid syntax", "end of input");
        }
        return new Module.Eval(body);
    }

    private Module functionTypeInput() throws ParseException {
        match(TokenType.INDENT);
        consume(TokenType.LEFT_PAREN, "expected '(' to start the argument types");
        List<Expression> argTypes = new ArrayList<>();
        while (!check(TokenType.RIGHT_PAREN)) {
            // the star markers of variadic parameters are not kept in the tree
            match(TokenType.STAR, TokenType.DOUBLE_STAR);
            argTypes.add(expressions.expression());
            if (!match(TokenType.COMMA)) {
                break;
            }
        }
        consume(TokenType.RIGHT_PAREN, "expected ')' after the argument types");
        consume(TokenType.ARROW, "expected '->' before the return type");
        Expression returns = expressions.expression();
        skipTrailingLayout();
        if (!isAtEnd()) {
            throw error("invalid syntax", "end of input");
        }
        return new Module.FunctionType(argTypes, returns);
    }

    private void skipTrailingLayout() {
        while (match(TokenType.NEWLINE, TokenType.DEDENT)) {
            // layout tokens after a lone expression carry no meaning
        }
    }

    /**
     * Parses the expression of an f-string replacement field. The tokens of this parser must be exactly
     * the field's expression.
     */
    Expression parseReplacementField() throws ParseException {
        if (isAtEnd()) {
            throw error(peek(), "f-string: valid expression required before '}'");
        }
        Expression value = check(TokenType.YIELD) ? expressions.yieldExpression() : expressions.starNamedExpressions();
        if (!isAtEnd()) {
            throw error("f-string: expecting '}'", "'}'");
        }
        return value;
    }

    // region Statements

    /**
     * Parses one statement line. Simple statements separated by semicolons yield several statements.
     */
    private List<Statement> statement() throws ParseException {
        Token token = peek();
        switch (token.type()) {
            case INDENT:
                throw error(peek(1), "unexpected indent").withSuggestion("remove the extra indentation");
            case IF:
                return List.of(ifStatement());
            case WHILE:
                return List.of(whileStatement());
            case FOR:
                return List.of(forStatement(advance(), false));
            case TRY:
                return List.of(tryStatement());
            case WITH:
                return List.of(withStatement(advance(), false));
            case DEF:
                return List.of(functionDef(List.of(), token, false));
            case CLASS:
                return List.of(classDef(List.of(), token));
            case AT:
                return List.of(decorated());
            case ASYNC:
                return List.of(asyncStatement());
            case NAME:
                if (token.text().equals("match") && isMatchStatement()) {
                    return List.of(matchStatement());
                }
                return simpleStatements();
            default:
                return simpleStatements();
        }
    }

    private List<Statement> simpleStatements() throws ParseException {
        List<Statement> result = new ArrayList<>();
        result.add(simpleStatement());
        while (match(TokenType.SEMICOLON)) {
            if (check(TokenType.NEWLINE) || isAtEnd()) {
                break;
            }
            result.add(simpleStatement());
        }
        if (match(TokenType.NEWLINE) || isAtEnd()) {
            return result;
        }
        Statement last = result.get(result.size() - 1);
        if (last instanceof Statement.Expr expr && expr.value() instanceof Expression.Name name
                && name.id().equals("print") && expressions.startsExpression()) {
            throw error("Missing parentheses in call to 'print'. Did you mean print(...)?", "newline")
                    .withSuggestion("call print as a function: print(...)");
        }
        throw error("invalid syntax", "newline", "';'");
    }

    private Statement simpleStatement() throws ParseException {
        Token start = peek();
        switch (start.type()) {
            case PASS:
                advance();
                return new Statement.Pass(rangeFrom(start));
            case BREAK:
                advance();
                return new Statement.Break(rangeFrom(start));
            case CONTINUE:
                advance();
                return new Statement.Continue(rangeFrom(start));
            case RETURN: {
                advance();
                Expression value = expressions.startsExpression() ? expressions.starExpressions() : null;
                return new Statement.Return(value, rangeFrom(start));
            }
            case RAISE: {
                advance();
                Expression exc = expressions.startsExpression() ? expressions.expression() : null;
                Expression cause = exc != null && match(TokenType.FROM) ? expressions.expression() : null;
                return new Statement.Raise(exc, cause, rangeFrom(start));
            }
            case GLOBAL:
                advance();
                return new Statement.Global(nameList(), rangeFrom(start));
            case NONLOCAL:
                advance();
                return new Statement.Nonlocal(nameList(), rangeFrom(start));
            case DEL:
                return deleteStatement();
            case ASSERT: {
                advance();
                Expression test = expressions.expression();
                Expression msg = match(TokenType.COMMA) ? expressions.expression() : null;
                return new Statement.Assert(test, msg, rangeFrom(start));
            }
            case IMPORT:
                return importStatement();
            case FROM:
                return fromImport();
            default:
                if (start.isName("type") && checkAt(1, TokenType.NAME)
                        && (checkAt(2, TokenType.EQUAL) || checkAt(2, TokenType.LEFT_BRACKET))) {
                    return typeAlias();
                }
                return expressionStatement();
        }
    }

    private Statement expressionStatement() throws ParseException {
        Token start = peek();
        Expression first = expressions.yieldOrStarExpressions();

        if (check(TokenType.EQUAL)) {
            List<Expression> assignTargets = new ArrayList<>();
            assignTargets.add(targets.store(first));
            Expression value = null;
            while (match(TokenType.EQUAL)) {
                value = expressions.yieldOrStarExpressions();
                if (check(TokenType.EQUAL)) {
                    assignTargets.add(targets.store(value));
                }
            }
            return new Statement.Assign(assignTargets, value, rangeFrom(start));
        }

        if (match(TokenType.COLON)) {
            Expression target = targets.single(first, true);
            Expression annotation = expressions.expression();
            Expression value = match(TokenType.EQUAL) ? expressions.yieldOrStarExpressions() : null;
            boolean simple = first instanceof Expression.Name && start.type() != TokenType.LEFT_PAREN;
            return new Statement.AnnAssign(target, annotation, value, simple, rangeFrom(start));
        }

        BinaryOperator op = AUGMENTED.get(peek().type());
        if (op != null) {
            advance();
            Expression target = targets.single(first, false);
            Expression value = expressions.yieldOrStarExpressions();
            return new Statement.AugAssign(target, op, value, rangeFrom(start));
        }

        return new Statement.Expr(first, rangeFrom(start));
    }

    private Statement deleteStatement() throws ParseException {
        Token start = advance();
        List<Expression> deleted = new ArrayList<>();
        do {
            if (!expressions.startsExpression()) {
                break;
            }
            deleted.add(targets.delete(expressions.target()));
        } while (match(TokenType.COMMA));
        if (deleted.isEmpty()) {
            throw error("expected expression after 'del'", "expression");
        }
        return new Statement.Delete(deleted, rangeFrom(start));
    }

    private List<String> nameList() throws ParseException {
        List<String> names = new ArrayList<>();
        do {
            names.add(expressions.consumeName("expected name").text());
        } while (match(TokenType.COMMA));
        return names;
    }

    private Statement importStatement() throws ParseException {
        Token start = advance();
        List<Alias> names = new ArrayList<>();
        do {
            Token aliasStart = peek();
            String name = dottedName();
            String asname = match(TokenType.AS) ? expressions.consumeName("expected name after 'as'").text() : null;
            names.add(new Alias(name, asname, rangeFrom(aliasStart)));
        } while (match(TokenType.COMMA));
        return new Statement.Import(names, rangeFrom(start));
    }

    private Statement fromImport() throws ParseException {
        Token start = advance();
        int level = 0;
        while (check(TokenType.DOT) || check(TokenType.ELLIPSIS)) {
            level += advance().type() == TokenType.DOT ? 1 : 3;
        }
        String module = null;
        if (check(TokenType.NAME)) {
            module = dottedName();
        } else if (level == 0) {
            expressions.consumeName("expected module name after 'from'");
        }
        consume(TokenType.IMPORT, "expected 'import'");

        List<Alias> names = new ArrayList<>();
        if (check(TokenType.STAR)) {
            Token star = advance();
            names.add(new Alias("*", null, rangeFrom(star)));
        } else if (match(TokenType.LEFT_PAREN)) {
            while (!check(TokenType.RIGHT_PAREN)) {
                names.add(importAlias());
                if (!match(TokenType.COMMA)) {
                    break;
                }
            }
            consume(TokenType.RIGHT_PAREN, "expected ')' after imported names");
            if (names.isEmpty()) {
                throw error(previous(), "expected at least one name to import");
            }
        } else {
            names.add(importAlias());
            while (match(TokenType.COMMA)) {
                if (check(TokenType.NEWLINE) || check(TokenType.SEMICOLON)) {
                    throw error(previous(), "trailing comma not allowed without surrounding parentheses");
                }
                names.add(importAlias());
            }
        }
        return new Statement.ImportFrom(module, names, level, rangeFrom(start));
    }

    private Alias importAlias() throws ParseException {
        Token name = expressions.consumeName("expected name to import");
        String asname = match(TokenType.AS) ? expressions.consumeName("expected name after 'as'").text() : null;
        return new Alias(name.text(), asname, rangeFrom(name));
    }

    private String dottedName() throws ParseException {
        StringBuilder name = new StringBuilder(expressions.consumeName("expected module name").text());
        while (match(TokenType.DOT)) {
            name.append('.').append(expressions.consumeName("expected name after '.'").text());
        }
        return name.toString();
    }

    private Statement typeAlias() throws ParseException {
        Token start = advance();
        Token nameToken = advance();
        Expression name = new Expression.Name(nameToken.text(), ExprContext.STORE, rangeFrom(nameToken));
        List<TypeParam> typeParams = check(TokenType.LEFT_BRACKET) ? expressions.typeParams() : List.of();
        consume(TokenType.EQUAL, "expected '=' in type alias");
        Expression value = expressions.expression();
        return new Statement.TypeAlias(name, typeParams, value, rangeFrom(start));
    }

    // endregion

    // region Compound statements

    private Statement ifStatement() throws ParseException {
        Token start = advance();
        Expression test = expressions.namedExpression();
        colon("'" + start.text() + "' statement");
        List<Statement> body = block("'" + start.text() + "' statement", start);
        List<Statement> orElse = List.of();
        if (check(TokenType.ELIF)) {
            orElse = List.of(ifStatement());
        } else if (check(TokenType.ELSE)) {
            orElse = elseBlock();
        }
        return new Statement.If(test, body, orElse, rangeFrom(start));
    }

    private List<Statement> elseBlock() throws ParseException {
        Token elseToken = advance();
        if (check(TokenType.IF)) {
            throw error("expected ':'", "':'").withSuggestion("use 'elif' instead of 'else if'");
        }
        colon("'else' clause");
        return block("'else' statement", elseToken);
    }

    private Statement whileStatement() throws ParseException {
        Token start = advance();
        Expression test = expressions.namedExpression();
        colon("'while' statement");
        List<Statement> body = block("'while' statement", start);
        List<Statement> orElse = check(TokenType.ELSE) ? elseBlock() : List.of();
        return new Statement.While(test, body, orElse, rangeFrom(start));
    }

    /**
     * Parses a {@code for} loop. The FOR token is current; {@code start} is the first token of the statement.
     */
    private Statement forStatement(Token start, boolean isAsync) throws ParseException {
        Token forToken = isAsync ? consume(TokenType.FOR, "expected 'for'") : start;
        Expression target = targets.store(expressions.targetList());
        consume(TokenType.IN, "expected 'in' after 'for' target");
        Expression iter = expressions.starExpressions();
        colon("'for' statement");
        List<Statement> body = block("'for' statement", forToken);
        List<Statement> orElse = check(TokenType.ELSE) ? elseBlock() : List.of();
        SourceRange range = rangeFrom(start);
        return isAsync
                ? new Statement.AsyncFor(target, iter, body, orElse, range)
                : new Statement.For(target, iter, body, orElse, range);
    }

    private Statement withStatement(Token start, boolean isAsync) throws ParseException {
        Token withToken = isAsync ? consume(TokenType.WITH, "expected 'with'") : start;
        List<WithItem> items = withItems();
        colon("'with' statement");
        List<Statement> body = block("'with' statement", withToken);
        SourceRange range = rangeFrom(start);
        return isAsync
                ? new Statement.AsyncWith(items, body, range)
                : new Statement.With(items, body, range);
    }

    private List<WithItem> withItems() throws ParseException {
        if (check(TokenType.LEFT_PAREN)) {
            int mark = mark();
            try {
                advance();
                List<WithItem> items = new ArrayList<>();
                while (!check(TokenType.RIGHT_PAREN)) {
                    items.add(withItem());
                    if (!match(TokenType.COMMA)) {
                        break;
                    }
                }
                consume(TokenType.RIGHT_PAREN, "expected ')'");
                if (!items.isEmpty() && check(TokenType.COLON)) {
                    return items;
                }
            } catch (ParseException e) {
                // Not a parenthesized item list: the parenthesis belongs to the first context expression.
                reset(mark);
                return plainWithItems();
            }
            reset(mark);
        }
        return plainWithItems();
    }

    private List<WithItem> plainWithItems() throws ParseException {
        List<WithItem> items = new ArrayList<>();
        do {
            items.add(withItem());
        } while (match(TokenType.COMMA));
        return items;
    }

    private WithItem withItem() throws ParseException {
        Expression contextExpr = expressions.expression();
        Expression vars = match(TokenType.AS) ? targets.store(expressions.target()) : null;
        return new WithItem(contextExpr, vars);
    }

    private Statement tryStatement() throws ParseException {
        Token start = advance();
        colon("'try' statement");
        List<Statement> body = block("'try' statement", start);

        List<ExceptHandler> handlers = new ArrayList<>();
        boolean anyStar = false;
        boolean anyPlain = false;
        while (check(TokenType.EXCEPT)) {
            Token exceptToken = advance();
            boolean star = match(TokenType.STAR);
            Expression type = null;
            String name = null;
            if (!check(TokenType.COLON)) {
                type = expressions.expression();
                if (check(TokenType.COMMA)) {
                    throw error(type, "multiple exception types must be parenthesized");
                }
                if (match(TokenType.AS)) {
                    name = expressions.consumeName("expected name after 'as'").text();
                }
            } else if (star) {
                throw error("expected one or more exception types", "expression");
            }
            anyStar |= star;
            anyPlain |= !star;
            if (anyStar && anyPlain) {
                throw error(exceptToken, "cannot have both 'except' and 'except*' on the same 'try'");
            }
            colon("'except' clause");
            List<Statement> handlerBody = block("'except' statement", exceptToken);
            handlers.add(new ExceptHandler(type, name, handlerBody, rangeFrom(exceptToken)));
        }
        List<Statement> orElse = List.of();
        if (!handlers.isEmpty() && check(TokenType.ELSE)) {
            orElse = elseBlock();
        }
        List<Statement> finalBody = List.of();
        if (check(TokenType.FINALLY)) {
            Token finallyToken = advance();
            colon("'finally' clause");
            finalBody = block("'finally' statement", finallyToken);
        }
        if (handlers.isEmpty() && finalBody.isEmpty()) {
            throw error("expected 'except' or 'finally' block", "'except'", "'finally'");
        }
        SourceRange range = rangeFrom(start);
        return anyStar
                ? new Statement.TryStar(body, handlers, orElse, finalBody, range)
                : new Statement.Try(body, handlers, orElse, finalBody, range);
    }

    private Statement decorated() throws ParseException {
        Token start = peek();
        List<Expression> decorators = new ArrayList<>();
        while (match(TokenType.AT)) {
            decorators.add(expressions.namedExpression());
            consume(TokenType.NEWLINE, "expected newline after decorator");
        }
        if (check(TokenType.DEF)) {
            return functionDef(decorators, start, false);
        }
        if (check(TokenType.ASYNC) && checkAt(1, TokenType.DEF)) {
            advance();
            return functionDef(decorators, start, true);
        }
        if (check(TokenType.CLASS)) {
            return classDef(decorators, start);
        }
        throw error("expected 'def' or 'class' after decorator", "'def'", "'class'");
    }

    private Statement asyncStatement() throws ParseException {
        Token start = advance();
        if (check(TokenType.DEF)) {
            return functionDef(List.of(), start, true);
        }
        if (check(TokenType.FOR)) {
            return forStatement(start, true);
        }
        if (check(TokenType.WITH)) {
            return withStatement(start, true);
        }
        throw error("expected 'def', 'for' or 'with' after 'async'", "'def'", "'for'", "'with'");
    }

    /**
     * Parses a function definition. The DEF token is current.
     */
    private Statement functionDef(List<Expression> decorators, Token start, boolean isAsync) throws ParseException {
        Token defToken = advance();
        String name = expressions.consumeName("expected function name after 'def'").text();
        List<TypeParam> typeParams = check(TokenType.LEFT_BRACKET) ? expressions.typeParams() : List.of();
        consume(TokenType.LEFT_PAREN, "expected '(' after function name");
        Arguments args = check(TokenType.RIGHT_PAREN)
                ? Arguments.EMPTY
                : expressions.parameters(TokenType.RIGHT_PAREN, true);
        consume(TokenType.RIGHT_PAREN, "expected ')' after parameters");
        Expression returns = match(TokenType.ARROW) ? expressions.expression() : null;
        colon("function definition");
        List<Statement> body = block("function definition", defToken);
        SourceRange range = rangeFrom(start);
        return isAsync
                ? new Statement.AsyncFunctionDef(name, args, body, decorators, returns, typeParams, range)
                : new Statement.FunctionDef(name, args, body, decorators, returns, typeParams, range);
    }

    private Statement classDef(List<Expression> decorators, Token start) throws ParseException {
        Token classToken = advance();
        String name = expressions.consumeName("expected class name after 'class'").text();
        List<TypeParam> typeParams = check(TokenType.LEFT_BRACKET) ? expressions.typeParams() : List.of();
        List<Expression> bases = List.of();
        List<Keyword> keywords = List.of();
        if (match(TokenType.LEFT_PAREN)) {
            ExpressionParser.CallArguments arguments = expressions.callArguments();
            consume(TokenType.RIGHT_PAREN, "expected ')' after base classes");
            bases = arguments.args();
            keywords = arguments.keywords();
        }
        colon("class definition");
        List<Statement> body = block("class definition", classToken);
        return new Statement.ClassDef(name, bases, keywords, body, decorators, typeParams, rangeFrom(start));
    }

    /**
     * Decides whether a line starting with the soft keyword {@code match} is a match statement:
     * a subject, {@code :}, a line break, an indent and a {@code case} clause must follow.
     */
    private boolean isMatchStatement() {
        int mark = mark();
        try {
            advance();
            if (!expressions.startsExpression()) {
                return false;
            }
            expressions.starNamedExpressions();
            return check(TokenType.COLON) && checkAt(1, TokenType.NEWLINE)
                    && checkAt(2, TokenType.INDENT) && peek(3).isName("case");
        } catch (ParseException e) {
            // The line is an ordinary statement that uses "match" as a name.
            return false;
        } finally {
            reset(mark);
        }
    }

    private Statement matchStatement() throws ParseException {
        Token start = advance();
        Expression subject = expressions.starNamedExpressions();
        consume(TokenType.COLON, "expected ':'");
        consume(TokenType.NEWLINE, "expected newline after match subject");
        consume(TokenType.INDENT, "expected an indented block of 'case' clauses");
        List<MatchCase> cases = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            Token caseToken = peek();
            if (!caseToken.isName("case")) {
                throw error("expected 'case' block", "'case'");
            }
            advance();
            Pattern pattern = patterns.patterns();
            Expression guard = match(TokenType.IF) ? expressions.namedExpression() : null;
            colon("'case' clause");
            List<Statement> body = block("'case' statement", caseToken);
            cases.add(new MatchCase(pattern, guard, body));
        }
        consume(TokenType.DEDENT, "expected end of match block");
        return new Statement.Match(subject, cases, rangeFrom(start));
    }

    /**
     * Consumes the colon that ends a compound statement header.
     */
    private void colon(String construct) throws ParseException {
        if (match(TokenType.COLON)) {
            return;
        }
        if (check(TokenType.EQUAL)) {
            throw error("invalid syntax. Maybe you meant '==' or ':=' instead of '='?", "':'")
                    .withSuggestion("use '==' to compare values; '=' assigns");
        }
        ParseException e = error("expected ':'", "':'");
        if (e.getSuggestion() != null) {
            throw e;
        }
        Token last = lastSignificant();
        String fixed = SyntaxHints.fixedLine(source, last.endLine(), last.endColumn(), ":");
        String suggestion = fixed != null
                ? "did you mean '" + fixed + "'?"
                : "add ':' at the end of the " + construct + " header";
        throw e.withSuggestion(suggestion);
    }

    /**
     * Parses the body after a header colon: an indented block, or simple statements on the same line.
     */
    private List<Statement> block(String description, Token header) throws ParseException {
        if (!match(TokenType.NEWLINE)) {
            return simpleStatements();
        }
        if (!check(TokenType.INDENT)) {
            throw error(peek(), "expected an indented block after " + description + " on line " + header.line());
        }
        advance();
        List<Statement> body = new ArrayList<>();
        while (!check(TokenType.DEDENT) && !isAtEnd()) {
            body.addAll(statement());
        }
        consume(TokenType.DEDENT, "expected end of block");
        return body;
    }

    // endregion

    // region Token cursor

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        return peek().type() == type;
    }

    @Override
    public boolean checkAt(int offset, TokenType type) {
        return peek(offset).type() == type;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) {
            current++;
        }
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        return peek().type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return tokens.get(current);
    }

    @Override
    public Token peek(int offset) {
        return tokens.get(Math.min(current + offset, tokens.size() - 1));
    }

    @Override
    public Token previous() {
        return tokens.get(Math.max(current - 1, 0));
    }

    @Override
    public Token consume(TokenType type, String errorMessage) throws ParseException {
        if (check(type)) {
            return advance();
        }
        throw error(errorMessage, type.describe());
    }

    @Override
    public int mark() {
        return current;
    }

    @Override
    public void reset(int mark) {
        current = mark;
    }

    @Override
    public String source() {
        return source;
    }

    @Override
    public ParseException error(String message, String... expected) {
        Token found = peek();
        List<String> expectedList = List.of(expected);

        Token neverClosed = SyntaxHints.unclosedBracket(tokens, tokens.size());
        if (neverClosed != null && isBefore(neverClosed, found)
                && (isLayout(found.type()) || found.line() > neverClosed.line())) {
            String closer = SyntaxHints.closerOf(neverClosed).display();
            return new ParseException("'" + neverClosed.text() + "' was never closed", expectedList, found,
                    neverClosed.line(), neverClosed.column(),
                    "add the matching '" + closer + "' for the '" + neverClosed.text() + "' opened at line "
                            + neverClosed.line() + ", column " + neverClosed.column());
        }
        if (SyntaxHints.isCloser(found.type())) {
            Token opener = SyntaxHints.unclosedBracket(tokens, current);
            if (opener == null) {
                return new ParseException("unmatched '" + found.text() + "'", expectedList, found,
                        found.line(), found.column(), null);
            }
            if (SyntaxHints.closerOf(opener) != found.type()) {
                return new ParseException("closing parenthesis '" + found.text()
                        + "' does not match opening parenthesis '" + opener.text() + "'",
                        expectedList, found, found.line(), found.column(), null);
            }
        }

        if (isLayout(found.type()) && current > 0) {
            // A token is missing at the end of a line: point just after the last real token.
            Token last = lastSignificant();
            return new ParseException(message, expectedList, found, last.endLine(), last.endColumn(), null);
        }
        return new ParseException(message, expectedList, found, found.line(), found.column(), null);
    }

    @Override
    public ParseException error(Token token, String message) {
        return new ParseException(message, List.of(), token, token.line(), token.column(), null);
    }

    @Override
    public ParseException error(AstNode node, String message) {
        return new ParseException(message, List.of(), null, node.line(), node.column(), null);
    }

    @Override
    public SourceRange rangeFrom(Token start) {
        Token end = lastSignificant();
        if (isBefore(end, start) && !sameStart(end, start)) {
            return new SourceRange(start.line(), start.column(), start.endLine(), start.endColumn());
        }
        return new SourceRange(start.line(), start.column(), end.endLine(), end.endColumn());
    }

    @Override
    public SourceRange rangeFrom(AstNode start) {
        if (start.line() == 0) {
            return SourceRange.NONE;
        }
        Token end = lastSignificant();
        if (end.endLine() < start.line() || (end.endLine() == start.line() && end.endColumn() < start.column())) {
            return start.range();
        }
        return new SourceRange(start.line(), start.column(), end.endLine(), end.endColumn());
    }

    private Token lastSignificant() {
        for (int i = current - 1; i >= 0; i--) {
            Token token = tokens.get(i);
            if (!isLayout(token.type())) {
                return token;
            }
        }
        return tokens.get(0);
    }

    private static boolean isLayout(TokenType type) {
        return type == TokenType.NEWLINE || type == TokenType.INDENT
                || type == TokenType.DEDENT || type == TokenType.END_OF_FILE;
    }

    private static boolean isBefore(Token a, Token b) {
        return a.line() < b.line() || (a.line() == b.line() && a.column() < b.column());
    }

    private static boolean sameStart(Token a, Token b) {
        return a.line() == b.line() && a.column() == b.column();
    }

    // endregion
}
