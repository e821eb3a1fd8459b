package org.pysyntax.frontend.parser.ast;

/**
 * The base interface for all nodes in the syntax tree.
 * <p>
 * Every node is an immutable record that remembers where in the source it came from.
 * Nodes built by hand (for example by a formatter) use {@link SourceRange#NONE}.
 */
public interface AstNode {

    /**
     * Returns the source range this node was parsed from.
     * @return The range, never null.
     */
    SourceRange range();

    default int line() {
        return range().line();
    }

    default int column() {
        return range().column();
    }

    default int endLine() {
        return range().endLine();
    }

    default int endColumn() {
        return range().endColumn();
    }
}
