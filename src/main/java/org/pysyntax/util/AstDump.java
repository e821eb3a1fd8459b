package org.pysyntax.util;

import org.pysyntax.frontend.parser.ast.ConstantValue;
import org.pysyntax.frontend.parser.ast.SourceRange;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.List;
import java.util.StringJoiner;

/**
 * Utility class for dumping syntax trees as text, in the spirit of Python's {@code ast.dump}.
 * <p>
 * Two trees are structurally equal exactly when their dumps without positions are equal, which is
 * how round trips through the code generator are checked.
 */
public final class AstDump {

    private static final String RANGE_COMPONENT = "range";

    private AstDump() {}

    /**
     * Dumps a node without source positions.
     * @param node A module, statement, expression, pattern or helper node. May be null.
     * @return The single-line dump.
     */
    public static String dump(Object node) {
        return dump(node, false);
    }

    /**
     * Dumps a node.
     * @param node The node to dump. May be null.
     * @param includePositions Whether to append the source range of each positioned node.
     * @return The single-line dump.
     */
    public static String dump(Object node, boolean includePositions) {
        StringBuilder sb = new StringBuilder();
        append(sb, node, includePositions);
        return sb.toString();
    }

    private static void append(StringBuilder sb, Object value, boolean includePositions) {
        if (value == null) {
            sb.append("None");
        } else if (value instanceof ConstantValue constant) {
            appendConstant(sb, constant);
        } else if (value instanceof String text) {
            appendString(sb, text);
        } else if (value instanceof List<?> list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                append(sb, list.get(i), includePositions);
            }
            sb.append(']');
        } else if (value instanceof Enum<?> constant) {
            sb.append(constant.name());
        } else if (value instanceof SourceRange range) {
            sb.append(range);
        } else if (value.getClass().isRecord()) {
            appendRecord(sb, (Record) value, includePositions);
        } else {
            sb.append(value);
        }
    }

    private static void appendRecord(StringBuilder sb, Record node, boolean includePositions) {
        sb.append(node.getClass().getSimpleName()).append('(');
        StringJoiner fields = new StringJoiner(", ");
        SourceRange range = null;
        for (RecordComponent component : node.getClass().getRecordComponents()) {
            Object value = read(component, node);
            if (RANGE_COMPONENT.equals(component.getName()) && value instanceof SourceRange r) {
                range = r;
                continue;
            }
            StringBuilder field = new StringBuilder(component.getName()).append('=');
            append(field, value, includePositions);
            fields.add(field);
        }
        sb.append(fields).append(')');
        if (includePositions && range != null) {
            sb.append('@').append(range);
        }
    }

    private static Object read(RecordComponent component, Record node) {
        try {
            return component.getAccessor().invoke(node);
        } catch (IllegalAccessException | InvocationTargetException e) {
            throw new IllegalStateException("Cannot read " + node.getClass().getSimpleName() + "."
                    + component.getName(), e);
        }
    }

    private static void appendConstant(StringBuilder sb, ConstantValue constant) {
        if (constant instanceof ConstantValue.None) {
            sb.append("None");
        } else if (constant instanceof ConstantValue.Bool bool) {
            sb.append(bool.value() ? "True" : "False");
        } else if (constant instanceof ConstantValue.Int i) {
            sb.append(i.value());
        } else if (constant instanceof ConstantValue.Float f) {
            sb.append(f.value());
        } else if (constant instanceof ConstantValue.Complex c) {
            sb.append(c.real() == 0.0 ? "" : c.real() + "+").append(c.imag()).append('j');
        } else if (constant instanceof ConstantValue.Str s) {
            appendString(sb, s.value());
        } else if (constant instanceof ConstantValue.Bytes b) {
            sb.append("b'");
            for (byte value : b.value()) {
                int c = value & 0xff;
                if (c == '\'' || c == '\\') {
                    sb.append('\\').append((char) c);
                } else if (c >= 0x20 && c < 0x7f) {
                    sb.append((char) c);
                } else {
                    sb.append(String.format("\\x%02x", c));
                }
            }
            sb.append('\'');
        } else {
            sb.append("Ellipsis");
        }
    }

    private static void appendString(StringBuilder sb, String text) {
        sb.append('\'');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\'' -> sb.append("\\'");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\x%02x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        sb.append('\'');
    }
}
