package org.pysyntax.frontend.parser.ast;

import java.util.List;
import java.util.Objects;

/**
 * A pattern of a {@code case} clause.
 */
public sealed interface Pattern extends AstNode {

    /** A literal or dotted-name value compared with {@code ==}. */
    record MatchValue(Expression value, SourceRange range) implements Pattern {
        public MatchValue {
            Objects.requireNonNull(value, "value");
            range = AstLists.range(range);
        }
    }

    /** {@code None}, {@code True} or {@code False}, compared by identity. */
    record MatchSingleton(ConstantValue value, SourceRange range) implements Pattern {
        public MatchSingleton {
            if (!(value instanceof ConstantValue.None) && !(value instanceof ConstantValue.Bool)) {
                throw new IllegalArgumentException("Singleton pattern must be None, True or False: " + value);
            }
            range = AstLists.range(range);
        }
    }

    record MatchSequence(List<Pattern> patterns, SourceRange range) implements Pattern {
        public MatchSequence {
            patterns = AstLists.copy(patterns);
            range = AstLists.range(range);
        }
    }

    /**
     * {@code {key: pattern, **rest}}.
     *
     * @param keys The literal or value keys.
     * @param patterns The value patterns, one per key.
     * @param rest The name bound by {@code **rest}, or null.
     * @param range The source range.
     */
    record MatchMapping(List<Expression> keys, List<Pattern> patterns, String rest, SourceRange range)
            implements Pattern {
        public MatchMapping {
            keys = AstLists.copy(keys);
            patterns = AstLists.copy(patterns);
            if (keys.size() != patterns.size()) {
                throw new IllegalArgumentException("Mapping pattern keys and patterns differ in length");
            }
            range = AstLists.range(range);
        }
    }

    /**
     * {@code Cls(p1, p2, attr=p3)}.
     *
     * @param cls The class expression, a name or dotted name.
     * @param patterns The positional sub-patterns.
     * @param kwdAttrs The keyword attribute names.
     * @param kwdPatterns The keyword sub-patterns, one per attribute.
     * @param range The source range.
     */
    record MatchClass(
            Expression cls,
            List<Pattern> patterns,
            List<String> kwdAttrs,
            List<Pattern> kwdPatterns,
            SourceRange range
    ) implements Pattern {
        public MatchClass {
            Objects.requireNonNull(cls, "cls");
            patterns = AstLists.copy(patterns);
            kwdAttrs = AstLists.copy(kwdAttrs);
            kwdPatterns = AstLists.copy(kwdPatterns);
            if (kwdAttrs.size() != kwdPatterns.size()) {
                throw new IllegalArgumentException("Class pattern keywords and patterns differ in length");
            }
            range = AstLists.range(range);
        }
    }

    /** {@code *name} inside a sequence pattern; a null name is {@code *_}. */
    record MatchStar(String name, SourceRange range) implements Pattern {
        public MatchStar {
            range = AstLists.range(range);
        }
    }

    /**
     * A capture ({@code name}), a binding ({@code pattern as name}), or the wildcard {@code _}
     * (both components null).
     *
     * @param pattern The inner pattern, or null.
     * @param name The bound name, or null.
     * @param range The source range.
     */
    record MatchAs(Pattern pattern, String name, SourceRange range) implements Pattern {
        public MatchAs {
            if (pattern != null && name == null) {
                throw new IllegalArgumentException("An 'as' pattern needs a name");
            }
            range = AstLists.range(range);
        }
    }

    record MatchOr(List<Pattern> patterns, SourceRange range) implements Pattern {
        public MatchOr {
            patterns = AstLists.copy(patterns);
            if (patterns.size() < 2) {
                throw new IllegalArgumentException("An or-pattern needs at least two alternatives");
            }
            range = AstLists.range(range);
        }
    }
}
