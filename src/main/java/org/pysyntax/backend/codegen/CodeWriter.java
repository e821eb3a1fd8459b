package org.pysyntax.backend.codegen;

/**
 * Accumulates generated lines at the current indentation level.
 */
final class CodeWriter {

    private final StringBuilder out = new StringBuilder();
    private final String indentUnit;
    private int level = 0;

    CodeWriter(int indentWidth) {
        this.indentUnit = " ".repeat(indentWidth);
    }

    void line(String text) {
        out.append(prefix()).append(text).append('\n');
    }

    void blankLines(int count) {
        out.append("\n".repeat(Math.max(count, 0)));
    }

    void indent() {
        level++;
    }

    void dedent() {
        if (level == 0) {
            throw new IllegalStateException("dedent below level 0");
        }
        level--;
    }

    int level() {
        return level;
    }

    /**
     * @return The whitespace that starts a line at the current level.
     */
    String prefix() {
        return indentUnit.repeat(level);
    }

    @Override
    public String toString() {
        return out.toString();
    }
}
