package org.pysyntax.frontend.parser;

import org.pysyntax.api.ParseException;
import org.pysyntax.frontend.lexer.Token;
import org.pysyntax.frontend.lexer.TokenType;
import org.pysyntax.frontend.parser.ast.AstNode;
import org.pysyntax.frontend.parser.ast.SourceRange;

/**
 * The token cursor shared by the statement, expression and pattern parsers.
 * It gives them access to the token stream without coupling them to the {@link Parser} itself.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks the type of a token ahead of the current one.
     * @param offset 0 for the current token, 1 for the next one, and so on.
     * @param type The token type to check.
     * @return true if that token exists and has the given type.
     */
    boolean checkAt(int offset, TokenType type);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token.
     */
    Token peek();

    /**
     * Returns a token ahead of the current one, or the final END_OF_FILE token if the offset runs past the end.
     * @param offset The lookahead distance.
     * @return The token.
     */
    Token peek(int offset);

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it is of the expected type, or fails.
     * @param type The expected token type.
     * @param errorMessage The error message to report if the token type does not match.
     * @return The consumed token.
     * @throws ParseException if the current token has a different type.
     */
    Token consume(TokenType type, String errorMessage) throws ParseException;

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if the current token is END_OF_FILE.
     */
    boolean isAtEnd();

    /**
     * Remembers the current position for speculative parsing.
     * @return A mark to pass to {@link #reset(int)}.
     */
    int mark();

    /**
     * Rewinds to a position returned by {@link #mark()}.
     * @param mark The mark.
     */
    void reset(int mark);

    /**
     * Creates an error located at the current token.
     * @param message The error message.
     * @param expected Descriptions of the tokens that would have been accepted.
     * @return The exception, to be thrown by the caller.
     */
    ParseException error(String message, String... expected);

    /**
     * Creates an error located at the given token.
     * @param token The offending token.
     * @param message The error message.
     * @return The exception, to be thrown by the caller.
     */
    ParseException error(Token token, String message);

    /**
     * Creates an error located at the given node.
     * @param node The offending node.
     * @param message The error message.
     * @return The exception, to be thrown by the caller.
     */
    ParseException error(AstNode node, String message);

    /**
     * @param start The first token of a construct.
     * @return The range from that token to the end of the previous token.
     */
    SourceRange rangeFrom(Token start);

    /**
     * @param start The first node of a construct.
     * @return The range from that node to the end of the previous token.
     */
    SourceRange rangeFrom(AstNode start);

    /**
     * @return The source text the tokens came from, or null if it is unknown.
     */
    String source();
}
