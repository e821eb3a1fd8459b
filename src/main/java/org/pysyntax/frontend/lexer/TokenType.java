package org.pysyntax.frontend.lexer;

import java.util.HashMap;
import java.util.Map;

/**
 * Defines the different types of tokens that the {@link Tokenizer} can recognize.
 * <p>
 * Soft keywords ({@code match}, {@code case}, {@code type}, {@code _}) are not listed here; they are
 * {@link #NAME} tokens and only the parser gives them meaning.
 */
public enum TokenType {
    // Literals and names.
    /** An identifier or soft keyword. */
    NAME("name"),
    /** A numeric literal; the value is a BigInteger, a Double or an {@link ImaginaryLiteral}. */
    NUMBER("number"),
    /** A string or bytes literal; the value is a {@link StringLiteral}. */
    STRING("string"),
    /** An f-string literal; the value is an {@link FStringLiteral}. */
    FSTRING("f-string"),

    // Hard keywords.
    FALSE("False"),
    NONE("None"),
    TRUE("True"),
    AND("and"),
    AS("as"),
    ASSERT("assert"),
    ASYNC("async"),
    AWAIT("await"),
    BREAK("break"),
    CLASS("class"),
    CONTINUE("continue"),
    DEF("def"),
    DEL("del"),
    ELIF("elif"),
    ELSE("else"),
    EXCEPT("except"),
    FINALLY("finally"),
    FOR("for"),
    FROM("from"),
    GLOBAL("global"),
    IF("if"),
    IMPORT("import"),
    IN("in"),
    IS("is"),
    LAMBDA("lambda"),
    NONLOCAL("nonlocal"),
    NOT("not"),
    OR("or"),
    PASS("pass"),
    RAISE("raise"),
    RETURN("return"),
    TRY("try"),
    WHILE("while"),
    WITH("with"),
    YIELD("yield"),

    // Brackets.
    LEFT_PAREN("("),
    RIGHT_PAREN(")"),
    LEFT_BRACKET("["),
    RIGHT_BRACKET("]"),
    LEFT_BRACE("{"),
    RIGHT_BRACE("}"),

    // Delimiters.
    COLON(":"),
    COMMA(","),
    SEMICOLON(";"),
    DOT("."),
    ELLIPSIS("..."),
    ARROW("->"),
    COLON_EQUAL(":="),
    EQUAL("="),

    // Operators.
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    DOUBLE_STAR("**"),
    SLASH("/"),
    DOUBLE_SLASH("//"),
    PERCENT("%"),
    AT("@"),
    PIPE("|"),
    AMPERSAND("&"),
    CARET("^"),
    TILDE("~"),
    LEFT_SHIFT("<<"),
    RIGHT_SHIFT(">>"),
    LESS("<"),
    GREATER(">"),
    LESS_EQUAL("<="),
    GREATER_EQUAL(">="),
    EQUAL_EQUAL("=="),
    NOT_EQUAL("!="),

    // Augmented assignment.
    PLUS_EQUAL("+="),
    MINUS_EQUAL("-="),
    STAR_EQUAL("*="),
    DOUBLE_STAR_EQUAL("**="),
    SLASH_EQUAL("/="),
    DOUBLE_SLASH_EQUAL("//="),
    PERCENT_EQUAL("%="),
    AT_EQUAL("@="),
    PIPE_EQUAL("|="),
    AMPERSAND_EQUAL("&="),
    CARET_EQUAL("^="),
    LEFT_SHIFT_EQUAL("<<="),
    RIGHT_SHIFT_EQUAL(">>="),

    // Layout.
    /** The end of a logical line. */
    NEWLINE("newline"),
    /** An increase of the indentation level. */
    INDENT("indent"),
    /** A decrease of the indentation level, one per closed block. */
    DEDENT("dedent"),
    /** Represents the end of the source. */
    END_OF_FILE("end of input");

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();
    private static final Map<String, TokenType> OPERATORS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.ordinal() >= FALSE.ordinal() && type.ordinal() <= YIELD.ordinal()) {
                KEYWORDS.put(type.display, type);
            } else if (type.ordinal() >= LEFT_PAREN.ordinal() && type.ordinal() <= RIGHT_SHIFT_EQUAL.ordinal()) {
                OPERATORS.put(type.display, type);
            }
        }
    }

    private final String display;

    TokenType(String display) {
        this.display = display;
    }

    /**
     * Returns how the token type is shown in error messages: the literal text for keywords and
     * operators, a description for everything else.
     * @return The display text.
     */
    public String display() {
        return display;
    }

    /**
     * @return True if this is a hard keyword.
     */
    public boolean isKeyword() {
        return KEYWORDS.get(display) == this;
    }

    /**
     * Looks up a hard keyword.
     * @param text The identifier text.
     * @return The keyword type, or null if the text is not a hard keyword.
     */
    public static TokenType keyword(String text) {
        return KEYWORDS.get(text);
    }

    /**
     * Looks up an operator or delimiter by its exact text.
     * @param text The operator text.
     * @return The type, or null.
     */
    public static TokenType operator(String text) {
        return OPERATORS.get(text);
    }

    /**
     * Describes the token type for an "expected ..." message, quoting literal tokens.
     * @return The description.
     */
    public String describe() {
        if (ordinal() >= FALSE.ordinal() && ordinal() <= RIGHT_SHIFT_EQUAL.ordinal()) {
            return "'" + display + "'";
        }
        return display;
    }
}
