package org.pysyntax.api;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.pysyntax.backend.codegen.CodeGenConfig;
import org.pysyntax.frontend.parser.ast.Module;
import org.pysyntax.junit.extensions.logging.AllowLog;
import org.pysyntax.junit.extensions.logging.LogLevel;
import org.pysyntax.junit.extensions.logging.LogWatchExtension;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Verifies that generated source parses back to the tree it was generated from, for the Python
 * programs under {@code src/test/resources/python}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
@AllowLog(level = LogLevel.DEBUG, loggerPattern = ".*CodeGenerator")
public class RoundTripTest {

    private ISyntaxService syntax;

    @BeforeEach
    void setUp() {
        syntax = new PythonSyntax();
    }

    private static String fixture(String name) throws IOException {
        try (InputStream in = RoundTripTest.class.getResourceAsStream("/python/" + name)) {
            assertThat(in).as("fixture %s", name).isNotNull();
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * The regenerated text parses to a tree with the same dump, and generating again gives the same text.
     */
    @ParameterizedTest
    @ValueSource(strings = {
            "basics.py",
            "functions.py",
            "classes.py",
            "control_flow.py",
            "match_statements.py",
            "fstrings.py",
            "async_code.py",
            "type_params.py"
    })
    void testFixtureRoundTrip(String name) throws Exception {
        // Arrange
        String source = fixture(name);
        Module original = syntax.parse(source);

        // Act
        String generated = syntax.generate(original);
        Module reparsed = syntax.parse(generated);

        // Assert
        assertThat(syntax.dump(reparsed)).isEqualTo(syntax.dump(original));
        assertThat(syntax.generate(reparsed)).isEqualTo(generated);
    }

    /**
     * Formatting options change the text but never the tree.
     */
    @ParameterizedTest
    @ValueSource(strings = {"basics.py", "fstrings.py", "match_statements.py"})
    void testRoundTripWithAlternativeFormatting(String name) throws Exception {
        // Arrange
        CodeGenConfig config = new CodeGenConfig(2, false, 40, CodeGenConfig.QuoteStyle.SINGLE);
        Module original = syntax.parse(fixture(name));

        // Act
        String generated = syntax.generate(original, config);

        // Assert
        assertThat(syntax.dump(syntax.parse(generated))).isEqualTo(syntax.dump(original));
    }

    @Test
    void testSnippetRoundTrips() throws Exception {
        String[] snippets = {
                "x = -1 ** 2\n",
                "print(*args, sep='', **kw)\n",
                "lambda: (yield)\n",
                "x = [i for i in range(10) if i % 2 if i > 3]\n",
                "a[1:2, ::3, ...] = b\n",
                "x = 1 if a else 2 if b else 3\n",
                "assert (x, y)\n",
                "del (a, b), [c]\n",
                "f(x for x in y)\n",
                "x = not -a < b is not c\n",
        };
        for (String snippet : snippets) {
            Module original = syntax.parse(snippet);
            Module reparsed = syntax.parse(syntax.generate(original));
            assertThat(syntax.dump(reparsed)).as(snippet).isEqualTo(syntax.dump(original));
        }
    }

    @Test
    void testInteractiveAndEvalRoundTrip() throws Exception {
        Module interactive = syntax.parse("x = 1; y = 2\n", ParseMode.INTERACTIVE);
        Module eval = syntax.parse("{k: v for k, v in items}", ParseMode.EVAL);

        assertThat(syntax.dump(syntax.parse(syntax.generate(interactive), ParseMode.INTERACTIVE)))
                .isEqualTo(syntax.dump(interactive));
        assertThat(syntax.dump(syntax.parse(syntax.generate(eval), ParseMode.EVAL)))
                .isEqualTo(syntax.dump(eval));
    }
}
