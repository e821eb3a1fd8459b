package org.pysyntax.frontend.lexer;

import org.pysyntax.api.TokenizeException;
import org.pysyntax.api.TokenizeException.Kind;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * The Tokenizer converts Python source text into a list of tokens, including the
 * NEWLINE, INDENT and DEDENT tokens that encode the block structure.
 * <p>
 * A Tokenizer is single-use and not thread-safe. Tokenizing stops at the first lexical error.
 */
public class Tokenizer {

    private static final int TAB_SIZE = 8;
    private static final int MAX_NESTING = 200;
    private static final Set<String> STRING_PREFIXES = Set.of("r", "u", "b", "br", "rb", "f", "fr", "rf");

    private final String source;
    private final boolean nested;
    private final List<Token> tokens = new ArrayList<>();
    private final List<Integer> indents = new ArrayList<>();
    private int start = 0;
    private int current = 0;
    private int line;
    private int column;
    private int startLine;
    private int startColumn;
    private int depth = 0;
    private boolean atLineStart;

    /**
     * Creates a new Tokenizer.
     * @param source The complete source text. Any line ending convention is accepted.
     */
    public Tokenizer(String source) {
        this(normalize(source), 1, 1, false);
    }

    /**
     * Creates a tokenizer for the expression part of an f-string replacement field. Such a tokenizer
     * treats line breaks as plain whitespace and reports positions relative to the enclosing source.
     */
    private Tokenizer(String source, int line, int column, boolean nested) {
        this.source = source;
        this.line = line;
        this.column = column;
        this.nested = nested;
        this.atLineStart = !nested;
        indents.add(0);
    }

    /**
     * Performs the tokenization of the entire source.
     * @return The tokens, always ending with END_OF_FILE.
     * @throws TokenizeException if the text contains a lexical error.
     */
    public List<Token> tokenize() throws TokenizeException {
        while (true) {
            if (atLineStart) {
                readIndentation();
            }
            if (isAtEnd()) {
                break;
            }
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        finish();
        return List.copyOf(tokens);
    }

    private static String normalize(String source) {
        String text = source.replace("\r\n", "\n").replace('\r', '\n');
        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text;
    }

    private void readIndentation() throws TokenizeException {
        int lineStart = current;
        int width = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            advance();
        }
        if (!isAtEnd() && peek() == '#') {
            skipComment();
        }
        if (isAtEnd()) {
            return;
        }
        if (peek() == '\n') {
            // Blank or comment-only line.
            advance();
            return;
        }
        atLineStart = false;

        int top = indents.get(indents.size() - 1);
        if (width > top) {
            indents.add(width);
            tokens.add(new Token(TokenType.INDENT, source.substring(lineStart, current), null, line, 1, line, column));
            return;
        }
        while (width < top) {
            indents.remove(indents.size() - 1);
            top = indents.get(indents.size() - 1);
            if (width > top) {
                throw new TokenizeException(Kind.INDENTATION_MISMATCH,
                        "unindent does not match any outer indentation level", line, column);
            }
            tokens.add(new Token(TokenType.DEDENT, "", null, line, column, line, column));
        }
    }

    private void scanToken() throws TokenizeException {
        char c = advance();
        switch (c) {
            case ' ', '\t', '\f':
                break;
            case '\n':
                newline();
                break;
            case '#':
                skipComment();
                break;
            case '\\':
                if (!isAtEnd() && peek() == '\n') {
                    // Explicit line joining.
                    advance();
                } else {
                    throw new TokenizeException(Kind.INVALID_CHARACTER,
                            "unexpected character after line continuation character", startLine, startColumn);
                }
                break;
            case '\'', '"':
                string("", c);
                break;
            default:
                if (isDigit(c) || (c == '.' && isDigit(peek()))) {
                    number(c);
                } else if (isIdentifierStart(c)) {
                    identifier();
                } else {
                    operator(c);
                }
                break;
        }
    }

    private void newline() {
        if (nested || depth > 0) {
            // Implicit line joining inside brackets.
            return;
        }
        tokens.add(new Token(TokenType.NEWLINE, "\n", null, startLine, startColumn, startLine, startColumn + 1));
        atLineStart = true;
    }

    private void skipComment() {
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private void finish() {
        if (!nested) {
            if (!tokens.isEmpty() && tokens.get(tokens.size() - 1).type() != TokenType.NEWLINE) {
                tokens.add(new Token(TokenType.NEWLINE, "", null, line, column, line, column));
            }
            while (indents.size() > 1) {
                indents.remove(indents.size() - 1);
                tokens.add(new Token(TokenType.DEDENT, "", null, line, column, line, column));
            }
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, line, column));
    }

    private void operator(char c) throws TokenizeException {
        for (int length = 3; length >= 1; length--) {
            if (start + length > source.length()) {
                continue;
            }
            TokenType type = TokenType.operator(source.substring(start, start + length));
            if (type == null) {
                continue;
            }
            for (int i = 1; i < length; i++) {
                advance();
            }
            switch (type) {
                case LEFT_PAREN, LEFT_BRACKET, LEFT_BRACE -> {
                    if (depth >= MAX_NESTING) {
                        throw new TokenizeException(Kind.TOO_DEEPLY_NESTED, "too many nested parentheses",
                                startLine, startColumn);
                    }
                    depth++;
                }
                case RIGHT_PAREN, RIGHT_BRACKET, RIGHT_BRACE -> depth = Math.max(0, depth - 1);
                default -> {
                }
            }
            addToken(type, null);
            return;
        }
        throw new TokenizeException(Kind.INVALID_CHARACTER,
                String.format("invalid character '%c' (U+%04X)", c, (int) c), startLine, startColumn);
    }

    private void identifier() throws TokenizeException {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        String text = source.substring(start, current);
        String prefix = text.toLowerCase(Locale.ROOT);
        if (!isAtEnd() && (peek() == '\'' || peek() == '"') && STRING_PREFIXES.contains(prefix)) {
            string(prefix, advance());
            return;
        }
        TokenType keyword = TokenType.keyword(text);
        addToken(keyword != null ? keyword : TokenType.NAME, null);
    }

    // region Numbers

    private void number(char first) throws TokenizeException {
        if (first == '0' && !isAtEnd() && "xXoObB".indexOf(peek()) >= 0) {
            char marker = Character.toLowerCase(advance());
            int radix = marker == 'x' ? 16 : marker == 'o' ? 8 : 2;
            if (peek() == '_') {
                advance();
            }
            if (readDigits(radix) == 0) {
                throw invalidNumber("invalid " + radixName(radix) + " literal");
            }
            checkNumberEnd(radix);
            String digits = source.substring(start + 2, current).replace("_", "");
            addToken(TokenType.NUMBER, new BigInteger(digits, radix));
            return;
        }

        boolean isFloat = false;
        if (first == '.') {
            isFloat = true;
            readDigits(10);
        } else {
            readDigits(10);
            if (peek() == '.') {
                advance();
                isFloat = true;
                if (isDigit(peek())) {
                    readDigits(10);
                }
            }
        }
        if (peek() == 'e' || peek() == 'E') {
            char next = peekAt(1);
            if (isDigit(next) || ((next == '+' || next == '-') && isDigit(peekAt(2)))) {
                advance();
                if (next == '+' || next == '-') {
                    advance();
                }
                readDigits(10);
                isFloat = true;
            } else {
                throw invalidNumber("invalid decimal literal");
            }
        }
        if (peek() == 'j' || peek() == 'J') {
            advance();
            checkNumberEnd(10);
            String text = source.substring(start, current - 1).replace("_", "");
            addToken(TokenType.NUMBER, new ImaginaryLiteral(Double.parseDouble(text)));
            return;
        }
        checkNumberEnd(10);

        String text = source.substring(start, current).replace("_", "");
        if (isFloat) {
            addToken(TokenType.NUMBER, Double.parseDouble(text));
            return;
        }
        if (text.length() > 1 && text.charAt(0) == '0' && text.chars().anyMatch(ch -> ch != '0')) {
            throw invalidNumber("leading zeros in decimal integer literals are not permitted; use an 0o prefix for octal integers");
        }
        addToken(TokenType.NUMBER, new BigInteger(text));
    }

    /**
     * Reads digits of the given radix, allowing single underscores between digits.
     * @return The number of digits read.
     */
    private int readDigits(int radix) throws TokenizeException {
        int count = 0;
        while (!isAtEnd()) {
            char c = peek();
            if (c == '_') {
                if (!isDigitOf(peekAt(1), radix)) {
                    throw invalidNumber("invalid " + radixName(radix) + " literal");
                }
                advance();
                continue;
            }
            if (!isDigitOf(c, radix)) {
                break;
            }
            advance();
            count++;
        }
        return count;
    }

    private void checkNumberEnd(int radix) throws TokenizeException {
        if (isAtEnd()) {
            return;
        }
        char c = peek();
        if (isDigit(c)) {
            throw invalidNumber(String.format("invalid digit '%c' in %s literal", c, radixName(radix)));
        }
        if (isIdentifierPart(c)) {
            throw invalidNumber("invalid " + radixName(radix) + " literal");
        }
    }

    private TokenizeException invalidNumber(String message) {
        return new TokenizeException(Kind.INVALID_NUMBER, message, startLine, startColumn);
    }

    private static String radixName(int radix) {
        switch (radix) {
            case 16: return "hexadecimal";
            case 8: return "octal";
            case 2: return "binary";
            default: return "decimal";
        }
    }

    private static boolean isDigitOf(char c, int radix) {
        if (radix == 16) {
            return c < 128 && Character.digit(c, 16) >= 0;
        }
        return c >= '0' && c < '0' + radix;
    }

    // endregion

    // region Strings

    private void string(String prefix, char quote) throws TokenizeException {
        boolean raw = prefix.indexOf('r') >= 0;
        boolean bytes = prefix.indexOf('b') >= 0;
        boolean triple = false;
        if (peekAt(0) == quote && peekAt(1) == quote) {
            advance();
            advance();
            triple = true;
        }
        if (prefix.indexOf('f') >= 0) {
            List<FStringPart> parts = readFStringParts(quote, triple, raw, false);
            consumeClosingQuote(triple);
            addToken(TokenType.FSTRING, new FStringLiteral(parts));
            return;
        }

        int contentStart = current;
        skipStringBody(quote, triple);
        String body = source.substring(contentStart, current);
        consumeClosingQuote(triple);

        if (bytes) {
            for (int i = 0; i < body.length(); i++) {
                if (body.charAt(i) > 127) {
                    throw new TokenizeException(Kind.INVALID_CHARACTER,
                            "bytes can only contain ASCII literal characters", startLine, startColumn);
                }
            }
        }
        String value = raw ? body : decodeEscapes(body, bytes);
        addToken(TokenType.STRING, new StringLiteral(value, bytes, prefix.indexOf('u') >= 0));
    }

    /**
     * Advances to the closing quote of a plain string literal, leaving it unconsumed.
     */
    private void skipStringBody(char quote, boolean triple) throws TokenizeException {
        while (true) {
            if (isAtEnd()) {
                throw unterminated(triple);
            }
            char c = peek();
            if (c == '\\') {
                advance();
                if (!isAtEnd()) {
                    advance();
                }
                continue;
            }
            if (c == '\n' && !triple) {
                throw unterminated(false);
            }
            if (isClosingQuote(quote, triple)) {
                return;
            }
            advance();
        }
    }

    private boolean isClosingQuote(char quote, boolean triple) {
        return peekAt(0) == quote && (!triple || (peekAt(1) == quote && peekAt(2) == quote));
    }

    private void consumeClosingQuote(boolean triple) {
        advance();
        if (triple) {
            advance();
            advance();
        }
    }

    private TokenizeException unterminated(boolean triple) {
        String message = triple ? "unterminated triple-quoted string literal" : "unterminated string literal";
        return new TokenizeException(Kind.UNTERMINATED_LITERAL, message, startLine, startColumn);
    }

    private String decodeEscapes(String body, boolean bytes) throws TokenizeException {
        StringBuilder sb = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i++);
            if (c != '\\' || i >= body.length()) {
                sb.append(c);
                continue;
            }
            char n = body.charAt(i++);
            switch (n) {
                case '\n':
                    break;
                case '\\', '\'', '"':
                    sb.append(n);
                    break;
                case 'a': sb.append('\u0007'); break;
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case 'n': sb.append('\n'); break;
                case 'r': sb.append('\r'); break;
                case 't': sb.append('\t'); break;
                case 'v': sb.append('\u000B'); break;
                case '0', '1', '2', '3', '4', '5', '6', '7': {
                    int value = n - '0';
                    for (int k = 0; k < 2 && i < body.length() && isDigitOf(body.charAt(i), 8); k++) {
                        value = value * 8 + (body.charAt(i++) - '0');
                    }
                    sb.appendCodePoint(bytes ? value & 0xFF : value);
                    break;
                }
                case 'x':
                    sb.appendCodePoint(readHexEscape(body, i, 2, "\\xXX"));
                    i += 2;
                    break;
                case 'u':
                case 'U': {
                    if (bytes) {
                        sb.append('\\').append(n);
                        break;
                    }
                    int length = n == 'u' ? 4 : 8;
                    int codePoint = readHexEscape(body, i, length, n == 'u' ? "\\uXXXX" : "\\UXXXXXXXX");
                    if (!Character.isValidCodePoint(codePoint)) {
                        throw new TokenizeException(Kind.INVALID_CHARACTER,
                                "illegal Unicode character in \\U escape", startLine, startColumn);
                    }
                    sb.appendCodePoint(codePoint);
                    i += length;
                    break;
                }
                case 'N': {
                    int close = body.indexOf('}', i);
                    if (bytes || i >= body.length() || body.charAt(i) != '{' || close < 0) {
                        if (bytes) {
                            sb.append('\\').append(n);
                            break;
                        }
                        throw new TokenizeException(Kind.INVALID_CHARACTER,
                                "malformed \\N character escape", startLine, startColumn);
                    }
                    String name = body.substring(i + 1, close);
                    try {
                        sb.appendCodePoint(Character.codePointOf(name));
                    } catch (IllegalArgumentException e) {
                        throw new TokenizeException(Kind.INVALID_CHARACTER,
                                "unknown Unicode character name '" + name + "'", startLine, startColumn);
                    }
                    i = close + 1;
                    break;
                }
                default:
                    // Unknown escapes are kept verbatim.
                    sb.append('\\').append(n);
                    break;
            }
        }
        return sb.toString();
    }

    private int readHexEscape(String body, int from, int length, String form) throws TokenizeException {
        if (from + length > body.length()) {
            throw new TokenizeException(Kind.INVALID_CHARACTER, "truncated " + form + " escape", startLine, startColumn);
        }
        int value = 0;
        for (int k = from; k < from + length; k++) {
            char h = body.charAt(k);
            if (!isDigitOf(h, 16)) {
                throw new TokenizeException(Kind.INVALID_CHARACTER, "truncated " + form + " escape", startLine, startColumn);
            }
            value = value * 16 + Character.digit(h, 16);
        }
        return value;
    }

    // endregion

    // region F-strings

    /**
     * Reads literal text and replacement fields up to the closing quote, or up to the closing brace
     * of the enclosing field when reading a format spec. The terminator is not consumed.
     */
    private List<FStringPart> readFStringParts(char quote, boolean triple, boolean raw, boolean inSpec)
            throws TokenizeException {
        List<FStringPart> parts = new ArrayList<>();
        StringBuilder text = new StringBuilder();
        while (true) {
            if (isAtEnd()) {
                throw inSpec ? expectingBrace() : unterminated(triple);
            }
            char c = peek();
            if (isClosingQuote(quote, triple)) {
                if (inSpec) {
                    throw expectingBrace();
                }
                break;
            }
            if (c == '\n' && !triple) {
                throw unterminated(false);
            }
            if (c == '\\') {
                text.append(advance());
                if (!isAtEnd() && peek() != '{' && peek() != '}') {
                    text.append(advance());
                }
                continue;
            }
            if (c == '{') {
                if (peekAt(1) == '{') {
                    advance();
                    advance();
                    text.append('{');
                    continue;
                }
                flushText(parts, text, raw);
                parts.add(readField(quote, triple));
                continue;
            }
            if (c == '}') {
                if (inSpec) {
                    break;
                }
                if (peekAt(1) == '}') {
                    advance();
                    advance();
                    text.append('}');
                    continue;
                }
                throw new TokenizeException(Kind.INVALID_CHARACTER,
                        "f-string: single '}' is not allowed", line, column);
            }
            text.append(advance());
        }
        flushText(parts, text, raw);
        return parts;
    }

    private void flushText(List<FStringPart> parts, StringBuilder text, boolean raw) throws TokenizeException {
        if (text.length() == 0) {
            return;
        }
        String value = raw ? text.toString() : decodeEscapes(text.toString(), false);
        parts.add(new FStringPart.Text(value));
        text.setLength(0);
    }

    private FStringPart.Field readField(char quote, boolean triple) throws TokenizeException {
        int fieldLine = line;
        int fieldColumn = column;
        advance();
        int exprStart = current;
        int exprLine = line;
        int exprColumn = column;
        int nesting = 0;
        while (true) {
            if (isAtEnd()) {
                throw expectingBrace();
            }
            char c = peek();
            if (c == '\'' || c == '"') {
                skipNestedString();
                continue;
            }
            if (c == '#') {
                throw new TokenizeException(Kind.INVALID_CHARACTER,
                        "f-string expression part cannot include '#'", line, column);
            }
            if (c == '(' || c == '[' || c == '{') {
                nesting++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (nesting == 0) {
                    break;
                }
                nesting--;
            } else if (nesting == 0) {
                char prev = current > exprStart ? source.charAt(current - 1) : ' ';
                if (c == '=' && peekAt(1) != '=' && "=!<>".indexOf(prev) < 0) {
                    break;
                }
                if (c == '!' && peekAt(1) != '=') {
                    break;
                }
                if (c == ':') {
                    break;
                }
            }
            advance();
        }
        String expressionText = source.substring(exprStart, current);

        String debugText = null;
        if (peek() == '=') {
            advance();
            while (!isAtEnd() && (peek() == ' ' || peek() == '\t' || peek() == '\n')) {
                advance();
            }
            debugText = source.substring(exprStart, current);
        }
        int conversion = -1;
        if (peek() == '!') {
            advance();
            char conv = isAtEnd() ? '\0' : advance();
            if (conv != 's' && conv != 'r' && conv != 'a') {
                throw new TokenizeException(Kind.INVALID_CHARACTER,
                        "f-string: invalid conversion character: expected 's', 'r', or 'a'", line, column);
            }
            conversion = conv;
        }
        List<FStringPart> formatSpec = null;
        if (peek() == ':') {
            advance();
            formatSpec = readFStringParts(quote, triple, false, true);
        }
        if (isAtEnd() || peek() != '}') {
            throw expectingBrace();
        }
        advance();

        List<Token> fieldTokens = new Tokenizer(expressionText, exprLine, exprColumn, true).tokenize();
        return new FStringPart.Field(fieldTokens, expressionText, debugText, conversion, formatSpec,
                fieldLine, fieldColumn);
    }

    /**
     * Skips a string literal inside a replacement field, including any prefix letters already consumed.
     */
    private void skipNestedString() throws TokenizeException {
        int prefixStart = current;
        while (prefixStart > 0 && Character.isLetter(source.charAt(prefixStart - 1))) {
            prefixStart--;
        }
        String prefix = source.substring(prefixStart, current).toLowerCase(Locale.ROOT);
        char quote = advance();
        boolean triple = false;
        if (peekAt(0) == quote && peekAt(1) == quote) {
            advance();
            advance();
            triple = true;
        }
        if (STRING_PREFIXES.contains(prefix) && prefix.indexOf('f') >= 0) {
            readFStringParts(quote, triple, prefix.indexOf('r') >= 0, false);
        } else {
            skipStringBody(quote, triple);
        }
        consumeClosingQuote(triple);
    }

    private TokenizeException expectingBrace() {
        return new TokenizeException(Kind.UNTERMINATED_LITERAL, "f-string: expecting '}'", startLine, startColumn);
    }

    // endregion

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, startLine, startColumn, line, column));
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        return peekAt(0);
    }

    private char peekAt(int offset) {
        int index = current + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isIdentifierStart(char c) {
        return c == '_' || Character.isUnicodeIdentifierStart(c);
    }

    private static boolean isIdentifierPart(char c) {
        return c == '_' || (Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c));
    }
}
