package org.pysyntax.api;

import com.typesafe.config.Config;
import org.pysyntax.backend.codegen.CodeGenConfig;
import org.pysyntax.backend.codegen.CodeGenerator;
import org.pysyntax.frontend.lexer.Token;
import org.pysyntax.frontend.lexer.Tokenizer;
import org.pysyntax.frontend.parser.Parser;
import org.pysyntax.frontend.parser.ast.Module;
import org.pysyntax.util.AstDump;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * The main implementation of {@link ISyntaxService}. It wires the tokenizer, parser and code generator
 * together. Every call creates its own tokenizer and parser, so one instance may serve many threads.
 */
public class PythonSyntax implements ISyntaxService {

    private static final Logger LOG = LoggerFactory.getLogger(PythonSyntax.class);
    private static final String CODEGEN_CONFIG_PATH = "pysyntax.codegen";

    private final CodeGenerator generator;

    public PythonSyntax() {
        this(CodeGenConfig.DEFAULT);
    }

    /**
     * @param config The formatting options used by {@link #generate(Module)}.
     */
    public PythonSyntax(CodeGenConfig config) {
        this.generator = new CodeGenerator(Objects.requireNonNull(config, "config"));
    }

    /**
     * Creates a service whose formatting options come from the {@code pysyntax.codegen} block of
     * the given configuration, or the defaults if the block is absent.
     *
     * @param config A configuration such as the one returned by {@code ConfigLoader.load()}.
     * @return The service.
     */
    public static PythonSyntax fromConfig(Config config) {
        if (!config.hasPath(CODEGEN_CONFIG_PATH)) {
            LOG.debug("No '{}' block in configuration, using default formatting", CODEGEN_CONFIG_PATH);
            return new PythonSyntax();
        }
        return new PythonSyntax(CodeGenConfig.fromConfig(config.getConfig(CODEGEN_CONFIG_PATH)));
    }

    @Override
    public List<Token> tokenize(String source) throws TokenizeException {
        Objects.requireNonNull(source, "source");
        return new Tokenizer(source).tokenize();
    }

    @Override
    public Module parse(String source) throws SyntaxException {
        return parse(source, ParseMode.EXEC);
    }

    @Override
    public Module parse(String source, ParseMode mode) throws SyntaxException {
        Objects.requireNonNull(mode, "mode");
        long start = System.nanoTime();

        // Phase 1: Tokenizing
        List<Token> tokens = tokenize(source);

        // Phase 2: Parsing
        Module module = new Parser(tokens, source).parse(mode);

        if (LOG.isDebugEnabled()) {
            LOG.debug("Parsed {} characters ({} tokens) in {} mode in {} us",
                    source.length(), tokens.size(), mode, (System.nanoTime() - start) / 1_000);
        }
        return module;
    }

    @Override
    public String generate(Module module) {
        return generator.generate(Objects.requireNonNull(module, "module"));
    }

    @Override
    public String generate(Module module, CodeGenConfig config) {
        return new CodeGenerator(config).generate(Objects.requireNonNull(module, "module"));
    }

    @Override
    public String dump(Module module) {
        return AstDump.dump(module);
    }
}
