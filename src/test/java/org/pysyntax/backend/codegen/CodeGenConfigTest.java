package org.pysyntax.backend.codegen;

import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.pysyntax.backend.codegen.CodeGenConfig.QuoteStyle;
import org.pysyntax.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for reading and validating {@link CodeGenConfig}.
 */
@Tag("unit")
@ExtendWith(LogWatchExtension.class)
public class CodeGenConfigTest {

    @Test
    void testFromConfigReadsAllKeys() {
        // Arrange
        var config = ConfigFactory.parseString("""
                indent-width = 2
                trailing-commas = false
                max-line-length = 120
                quote-style = single
                """);

        // Act
        CodeGenConfig result = CodeGenConfig.fromConfig(config);

        // Assert
        assertThat(result).isEqualTo(new CodeGenConfig(2, false, 120, QuoteStyle.SINGLE));
    }

    @Test
    void testMissingKeysKeepDefaults() {
        CodeGenConfig result = CodeGenConfig.fromConfig(ConfigFactory.parseString("max-line-length = 100"));

        assertThat(result.indentWidth()).isEqualTo(CodeGenConfig.DEFAULT.indentWidth());
        assertThat(result.trailingCommas()).isEqualTo(CodeGenConfig.DEFAULT.trailingCommas());
        assertThat(result.quoteStyle()).isEqualTo(QuoteStyle.DOUBLE);
        assertThat(result.maxLineLength()).isEqualTo(100);
    }

    @Test
    void testUnknownQuoteStyleIsRejected() {
        var config = ConfigFactory.parseString("quote-style = backtick");

        assertThatThrownBy(() -> CodeGenConfig.fromConfig(config))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown quote-style 'backtick'");
    }

    @Test
    void testInvalidValuesAreRejected() {
        assertThatThrownBy(() -> new CodeGenConfig(0, true, 88, QuoteStyle.DOUBLE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("indentWidth");
        assertThatThrownBy(() -> new CodeGenConfig(4, true, 0, QuoteStyle.DOUBLE))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxLineLength");
        assertThatThrownBy(() -> new CodeGenConfig(4, true, 88, null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testQuoteStyleOther() {
        assertThat(QuoteStyle.SINGLE.other()).isEqualTo(QuoteStyle.DOUBLE);
        assertThat(QuoteStyle.DOUBLE.other().quote()).isEqualTo('\'');
    }
}
