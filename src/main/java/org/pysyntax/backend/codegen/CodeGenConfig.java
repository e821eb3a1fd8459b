package org.pysyntax.backend.codegen;

import com.typesafe.config.Config;

import java.util.Locale;

/**
 * Formatting options of the {@link CodeGenerator}.
 *
 * @param indentWidth Spaces per indentation level.
 * @param trailingCommas Whether exploded calls and displays end their last element with a comma.
 * @param maxLineLength Advisory line length above which calls and displays are exploded one element per line.
 * @param quoteStyle The quote used for string literals.
 */
public record CodeGenConfig(int indentWidth, boolean trailingCommas, int maxLineLength, QuoteStyle quoteStyle) {

    /** Four-space indents, trailing commas, 88 columns, double quotes. */
    public static final CodeGenConfig DEFAULT = new CodeGenConfig(4, true, 88, QuoteStyle.DOUBLE);

    private static final String INDENT_WIDTH_KEY = "indent-width";
    private static final String TRAILING_COMMAS_KEY = "trailing-commas";
    private static final String MAX_LINE_LENGTH_KEY = "max-line-length";
    private static final String QUOTE_STYLE_KEY = "quote-style";

    /**
     * The quote character of generated string literals.
     */
    public enum QuoteStyle {
        SINGLE('\''),
        DOUBLE('"');

        private final char quote;

        QuoteStyle(char quote) {
            this.quote = quote;
        }

        public char quote() {
            return quote;
        }

        /**
         * @return The other quote style.
         */
        public QuoteStyle other() {
            return this == SINGLE ? DOUBLE : SINGLE;
        }
    }

    public CodeGenConfig {
        if (indentWidth < 1) {
            throw new IllegalArgumentException("indentWidth must be positive, was " + indentWidth);
        }
        if (maxLineLength < 1) {
            throw new IllegalArgumentException("maxLineLength must be positive, was " + maxLineLength);
        }
        if (quoteStyle == null) {
            throw new IllegalArgumentException("quoteStyle must not be null");
        }
    }

    /**
     * Reads the options from a configuration block such as {@code pysyntax.codegen}.
     * Missing keys keep the values of {@link #DEFAULT}.
     *
     * @param config The block holding {@code indent-width}, {@code trailing-commas},
     *               {@code max-line-length} and {@code quote-style}.
     * @return The options.
     * @throws IllegalArgumentException if a value is out of range or the quote style is unknown.
     */
    public static CodeGenConfig fromConfig(Config config) {
        int indentWidth = config.hasPath(INDENT_WIDTH_KEY) ? config.getInt(INDENT_WIDTH_KEY) : DEFAULT.indentWidth();
        boolean trailingCommas = config.hasPath(TRAILING_COMMAS_KEY)
                ? config.getBoolean(TRAILING_COMMAS_KEY)
                : DEFAULT.trailingCommas();
        int maxLineLength = config.hasPath(MAX_LINE_LENGTH_KEY)
                ? config.getInt(MAX_LINE_LENGTH_KEY)
                : DEFAULT.maxLineLength();
        QuoteStyle quoteStyle = DEFAULT.quoteStyle();
        if (config.hasPath(QUOTE_STYLE_KEY)) {
            String name = config.getString(QUOTE_STYLE_KEY).trim();
            try {
                quoteStyle = QuoteStyle.valueOf(name.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown quote-style '" + name + "', expected 'single' or 'double'", e);
            }
        }
        return new CodeGenConfig(indentWidth, trailingCommas, maxLineLength, quoteStyle);
    }
}
