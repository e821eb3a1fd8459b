package org.pysyntax.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pysyntax.api.PythonSyntax;
import org.pysyntax.api.SyntaxException;
import org.pysyntax.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

/**
 * Contains unit tests for turning syntax errors into rendered diagnostics.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class DiagnosticTest {

    private static SyntaxException errorOf(String source) {
        return catchThrowableOfType(() -> new PythonSyntax().parse(source), SyntaxException.class);
    }

    @Test
    void testFormatShowsCaretAndHelp() {
        // Arrange
        String source = "if x > 3\n    print(x)\n";
        Diagnostic diagnostic = Diagnostic.of(errorOf(source));

        // Act
        String formatted = diagnostic.format(source);

        // Assert
        assertThat(formatted).isEqualTo(String.join("\n",
                "[ERROR] 1:9: expected ':'",
                "    if x > 3",
                "            ^",
                "help: did you mean 'if x > 3:'?"));
    }

    @Test
    void testTokenizeErrorNamesItsKind() {
        Diagnostic diagnostic = Diagnostic.of(errorOf("x = 'open\n"), "broken.py");

        assertThat(diagnostic.type()).isEqualTo(Diagnostic.Type.ERROR);
        assertThat(diagnostic.message()).isEqualTo("unterminated string literal (unterminated literal)");
        assertThat(diagnostic.toString()).isEqualTo("[ERROR] broken.py:1:5: unterminated string literal (unterminated literal)");
    }

    /**
     * The generic message is completed with the description of the token that was found.
     */
    @Test
    void testGenericParseErrorNamesFoundToken() {
        Diagnostic diagnostic = Diagnostic.of(errorOf("x = 1 2\n"));

        assertThat(diagnostic.message()).isEqualTo("invalid syntax, found number");
        assertThat(diagnostic.suggestion()).isNull();
    }

    @Test
    void testFormatKeepsTabsBeforeCaret() {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.WARNING, "odd", null, 1, 3, null);

        assertThat(diagnostic.format("\tx y\n")).isEqualTo("[WARNING] 1:3: odd\n    \tx y\n    \t ^");
    }

    @Test
    void testFormatWithoutSource() {
        Diagnostic diagnostic = new Diagnostic(Diagnostic.Type.INFO, "note", "a.py", 2, 1, "check this");

        assertThat(diagnostic.format(null)).isEqualTo("[INFO] a.py:2:1: note\nhelp: check this");
    }
}
