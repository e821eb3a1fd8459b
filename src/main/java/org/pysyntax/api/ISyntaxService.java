package org.pysyntax.api;

import org.pysyntax.backend.codegen.CodeGenConfig;
import org.pysyntax.frontend.lexer.Token;
import org.pysyntax.frontend.parser.ast.Module;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface for reading and writing Python source.
 */
public interface ISyntaxService {

    /**
     * Splits source text into tokens, including the NEWLINE, INDENT and DEDENT layout tokens.
     *
     * @param source The source text.
     * @return The tokens, ending with END_OF_FILE.
     * @throws TokenizeException if the text cannot be tokenized.
     */
    List<Token> tokenize(String source) throws TokenizeException;

    /**
     * Parses a module of statements.
     *
     * @param source The source text.
     * @return A {@code Module.Program}.
     * @throws SyntaxException if the text is not valid Python.
     */
    Module parse(String source) throws SyntaxException;

    /**
     * Parses source text with the given start symbol.
     *
     * @param source The source text.
     * @param mode Which kind of input to expect.
     * @return The module matching the mode.
     * @throws SyntaxException if the text is not valid Python.
     */
    Module parse(String source, ParseMode mode) throws SyntaxException;

    /**
     * Renders a tree with the service's formatting options.
     *
     * @param module The tree.
     * @return Python source text.
     */
    String generate(Module module);

    /**
     * Renders a tree with explicit formatting options.
     *
     * @param module The tree.
     * @param config The formatting options.
     * @return Python source text.
     */
    String generate(Module module, CodeGenConfig config);

    /**
     * Renders a tree as an indentation-free structural dump without source positions.
     *
     * @param module The tree.
     * @return The dump, suitable for comparing trees.
     */
    String dump(Module module);

    /**
     * Parses a UTF-8 source file as a module of statements.
     *
     * @param file The path of the file.
     * @return A {@code Module.Program}.
     * @throws SyntaxException if the file is not valid Python.
     * @throws IOException if the file cannot be read.
     */
    default Module parse(Path file) throws SyntaxException, IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8));
    }
}
