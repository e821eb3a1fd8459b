package org.pysyntax.frontend.parser.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * List helpers used by the compact constructors of the node records.
 */
final class AstLists {

    private AstLists() {
    }

    /**
     * Returns an unmodifiable copy, treating null as the empty list. Null elements are rejected.
     */
    static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Returns an unmodifiable copy that may contain null elements.
     */
    static <T> List<T> copyNullable(List<T> list) {
        if (list == null) {
            return List.of();
        }
        return Collections.unmodifiableList(new ArrayList<>(list));
    }

    static SourceRange range(SourceRange range) {
        return range == null ? SourceRange.NONE : range;
    }
}
