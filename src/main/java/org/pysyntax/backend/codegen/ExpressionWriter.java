package org.pysyntax.backend.codegen;

import org.pysyntax.backend.codegen.CodeGenConfig.QuoteStyle;
import org.pysyntax.frontend.parser.ast.Arg;
import org.pysyntax.frontend.parser.ast.Arguments;
import org.pysyntax.frontend.parser.ast.BinaryOperator;
import org.pysyntax.frontend.parser.ast.BoolOperator;
import org.pysyntax.frontend.parser.ast.Comprehension;
import org.pysyntax.frontend.parser.ast.ConstantValue;
import org.pysyntax.frontend.parser.ast.Expression;
import org.pysyntax.frontend.parser.ast.Keyword;
import org.pysyntax.frontend.parser.ast.Pattern;
import org.pysyntax.frontend.parser.ast.TypeParam;
import org.pysyntax.frontend.parser.ast.UnaryOperator;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.StringJoiner;

/**
 * Renders expressions, patterns, parameter lists and literals as single-line Python text with the
 * fewest parentheses that preserve the tree.
 */
final class ExpressionWriter {

    private static final String INFINITY = "1e309";

    private final QuoteStyle quoteStyle;

    ExpressionWriter(QuoteStyle quoteStyle) {
        this.quoteStyle = quoteStyle;
    }

    /**
     * Renders an expression in a position that requires at least the given binding strength.
     */
    String expr(Expression e, Precedence required) {
        String text = render(e);
        if (e instanceof Expression.NamedExpr || precedenceOf(e).isBelow(required)) {
            return "(" + text + ")";
        }
        return text;
    }

    // region Precedence

    static Precedence precedenceOf(Expression e) {
        if (e instanceof Expression.BoolOp boolOp) {
            return boolOp.op() == BoolOperator.AND ? Precedence.AND : Precedence.OR;
        }
        if (e instanceof Expression.NamedExpr) {
            return Precedence.NAMED_EXPR;
        }
        if (e instanceof Expression.BinOp binOp) {
            return precedenceOf(binOp.op());
        }
        if (e instanceof Expression.UnaryOp unaryOp) {
            return unaryOp.op() == UnaryOperator.NOT ? Precedence.NOT : Precedence.FACTOR;
        }
        if (e instanceof Expression.Lambda || e instanceof Expression.IfExp) {
            return Precedence.TEST;
        }
        if (e instanceof Expression.Await) {
            return Precedence.AWAIT;
        }
        if (e instanceof Expression.Yield || e instanceof Expression.YieldFrom) {
            return Precedence.YIELD;
        }
        if (e instanceof Expression.Compare) {
            return Precedence.CMP;
        }
        if (e instanceof Expression.TupleExpr tuple) {
            return tuple.elts().isEmpty() ? Precedence.ATOM : Precedence.TUPLE;
        }
        if (e instanceof Expression.Constant constant && isNegative(constant.value())) {
            return Precedence.FACTOR;
        }
        return Precedence.ATOM;
    }

    private static Precedence precedenceOf(BinaryOperator op) {
        switch (op) {
            case BIT_OR: return Precedence.BOR;
            case BIT_XOR: return Precedence.BXOR;
            case BIT_AND: return Precedence.BAND;
            case LSHIFT, RSHIFT: return Precedence.SHIFT;
            case ADD, SUB: return Precedence.ARITH;
            case POW: return Precedence.POWER;
            default: return Precedence.TERM;
        }
    }

    private static boolean isNegative(ConstantValue value) {
        if (value instanceof ConstantValue.Int i) {
            return i.value().signum() < 0;
        }
        if (value instanceof ConstantValue.Float f) {
            return f.value() < 0 || (f.value() == 0.0 && 1.0 / f.value() < 0);
        }
        return false;
    }

    // endregion

    /**
     * Writes a left-nested run of operators of one binding strength, such as {@code a + b - c + d},
     * walking the left spine in a loop so that long sums do not exhaust the stack.
     */
    private String binOpChain(Expression.BinOp last, Precedence level) {
        Deque<Expression.BinOp> chain = new ArrayDeque<>();
        Expression head = last;
        while (head instanceof Expression.BinOp link
                && link.op() != BinaryOperator.POW && precedenceOf(link.op()) == level) {
            chain.push(link);
            head = link.left();
        }
        StringBuilder sb = new StringBuilder(expr(head, level));
        for (Expression.BinOp link : chain) {
            sb.append(' ').append(link.op().symbol()).append(' ').append(expr(link.right(), level.next()));
        }
        return sb.toString();
    }

    private String render(Expression e) {
        if (e instanceof Expression.BoolOp boolOp) {
            Precedence operand = precedenceOf(boolOp).next();
            StringJoiner joiner = new StringJoiner(" " + boolOp.op().symbol() + " ");
            for (Expression value : boolOp.values()) {
                joiner.add(expr(value, operand));
            }
            return joiner.toString();
        }
        if (e instanceof Expression.NamedExpr named) {
            return expr(named.target(), Precedence.ATOM) + " := " + expr(named.value(), Precedence.TEST);
        }
        if (e instanceof Expression.BinOp binOp) {
            Precedence level = precedenceOf(binOp.op());
            if (binOp.op() == BinaryOperator.POW) {
                return expr(binOp.left(), level.next()) + " ** " + expr(binOp.right(), Precedence.FACTOR);
            }
            return binOpChain(binOp, level);
        }
        if (e instanceof Expression.UnaryOp unaryOp) {
            if (unaryOp.op() == UnaryOperator.NOT) {
                return "not " + expr(unaryOp.operand(), Precedence.NOT);
            }
            return unaryOp.op().symbol() + expr(unaryOp.operand(), Precedence.FACTOR);
        }
        if (e instanceof Expression.Lambda lambda) {
            String params = arguments(lambda.args());
            return (params.isEmpty() ? "lambda" : "lambda " + params) + ": " + expr(lambda.body(), Precedence.TEST);
        }
        if (e instanceof Expression.IfExp ifExp) {
            return expr(ifExp.body(), Precedence.TEST.next()) + " if " + expr(ifExp.test(), Precedence.TEST.next())
                    + " else " + expr(ifExp.orElse(), Precedence.TEST);
        }
        if (e instanceof Expression.DictExpr dict) {
            return "{" + String.join(", ", dictEntries(dict)) + "}";
        }
        if (e instanceof Expression.SetExpr set) {
            if (set.elts().isEmpty()) {
                return "{*()}";
            }
            return "{" + elements(set.elts()) + "}";
        }
        if (e instanceof Expression.ListComp comp) {
            return "[" + expr(comp.elt(), Precedence.TEST) + generators(comp.generators()) + "]";
        }
        if (e instanceof Expression.SetComp comp) {
            return "{" + expr(comp.elt(), Precedence.TEST) + generators(comp.generators()) + "}";
        }
        if (e instanceof Expression.DictComp comp) {
            return "{" + expr(comp.key(), Precedence.TEST) + ": " + expr(comp.value(), Precedence.TEST)
                    + generators(comp.generators()) + "}";
        }
        if (e instanceof Expression.GeneratorExp gen) {
            return "(" + generatorBody(gen) + ")";
        }
        if (e instanceof Expression.Await await) {
            return "await " + expr(await.value(), Precedence.ATOM);
        }
        if (e instanceof Expression.Yield yieldExpr) {
            return yieldExpr.value() == null ? "yield" : "yield " + expr(yieldExpr.value(), Precedence.TUPLE);
        }
        if (e instanceof Expression.YieldFrom yieldFrom) {
            return "yield from " + expr(yieldFrom.value(), Precedence.TEST);
        }
        if (e instanceof Expression.Compare compare) {
            StringBuilder sb = new StringBuilder(expr(compare.left(), Precedence.CMP.next()));
            for (int i = 0; i < compare.ops().size(); i++) {
                sb.append(' ').append(compare.ops().get(i).symbol()).append(' ')
                        .append(expr(compare.comparators().get(i), Precedence.CMP.next()));
            }
            return sb.toString();
        }
        if (e instanceof Expression.Call call) {
            return expr(call.func(), Precedence.ATOM) + "(" + String.join(", ", callArguments(call)) + ")";
        }
        if (e instanceof Expression.FormattedValue formatted) {
            return "f" + quoteStyle.quote() + field(formatted) + quoteStyle.quote();
        }
        if (e instanceof Expression.JoinedStr joined) {
            char q = quoteStyle.quote();
            return "f" + q + fStringBody(joined.values()) + q;
        }
        if (e instanceof Expression.Constant constant) {
            return constant(constant.value(), constant.kind());
        }
        if (e instanceof Expression.Attribute attribute) {
            String value = expr(attribute.value(), Precedence.ATOM);
            if (attribute.value() instanceof Expression.Constant c && c.value() instanceof ConstantValue.Int) {
                value = "(" + value + ")";
            }
            return value + "." + attribute.attr();
        }
        if (e instanceof Expression.Subscript subscript) {
            return expr(subscript.value(), Precedence.ATOM) + "[" + subscriptSlice(subscript.slice()) + "]";
        }
        if (e instanceof Expression.Starred starred) {
            return "*" + expr(starred.value(), Precedence.BOR);
        }
        if (e instanceof Expression.Name name) {
            return name.id();
        }
        if (e instanceof Expression.ListExpr list) {
            return "[" + elements(list.elts()) + "]";
        }
        if (e instanceof Expression.TupleExpr tuple) {
            if (tuple.elts().isEmpty()) {
                return "()";
            }
            String elements = elements(tuple.elts());
            return tuple.elts().size() == 1 ? elements + "," : elements;
        }
        if (e instanceof Expression.Slice slice) {
            return slice(slice);
        }
        throw new IllegalArgumentException("Unsupported expression: " + e.getClass().getSimpleName());
    }

    private String elements(List<Expression> elements) {
        StringJoiner joiner = new StringJoiner(", ");
        for (Expression element : elements) {
            joiner.add(expr(element, Precedence.TEST));
        }
        return joiner.toString();
    }

    /**
     * Renders the entries of a dict display, {@code **mapping} for entries without a key.
     */
    List<String> dictEntries(Expression.DictExpr dict) {
        List<String> entries = new ArrayList<>();
        for (int i = 0; i < dict.keys().size(); i++) {
            Expression key = dict.keys().get(i);
            Expression value = dict.values().get(i);
            entries.add(key == null
                    ? "**" + expr(value, Precedence.BOR)
                    : expr(key, Precedence.TEST) + ": " + expr(value, Precedence.TEST));
        }
        return entries;
    }

    /**
     * Renders each element of a list, set or tuple display.
     */
    List<String> displayElements(List<Expression> elements) {
        List<String> rendered = new ArrayList<>();
        for (Expression element : elements) {
            rendered.add(expr(element, Precedence.TEST));
        }
        return rendered;
    }

    /**
     * Renders the arguments of a call. A lone generator expression loses its own parentheses.
     */
    List<String> callArguments(Expression.Call call) {
        List<String> rendered = new ArrayList<>();
        if (isBareGeneratorCall(call)) {
            rendered.add(generatorBody((Expression.GeneratorExp) call.args().get(0)));
            return rendered;
        }
        for (Expression arg : call.args()) {
            rendered.add(expr(arg, Precedence.TEST));
        }
        for (Keyword keyword : call.keywords()) {
            rendered.add(keyword(keyword));
        }
        return rendered;
    }

    /**
     * Renders the bases and keywords of a class definition.
     */
    List<String> classArguments(List<Expression> bases, List<Keyword> keywords) {
        List<String> rendered = new ArrayList<>();
        for (Expression base : bases) {
            rendered.add(expr(base, Precedence.TEST));
        }
        for (Keyword keyword : keywords) {
            rendered.add(keyword(keyword));
        }
        return rendered;
    }

    static boolean isBareGeneratorCall(Expression.Call call) {
        return call.args().size() == 1 && call.keywords().isEmpty()
                && call.args().get(0) instanceof Expression.GeneratorExp;
    }

    private String keyword(Keyword keyword) {
        if (keyword.arg() == null) {
            return "**" + expr(keyword.value(), Precedence.BOR);
        }
        return keyword.arg() + "=" + expr(keyword.value(), Precedence.TEST);
    }

    private String generatorBody(Expression.GeneratorExp gen) {
        return expr(gen.elt(), Precedence.TEST) + generators(gen.generators());
    }

    private String generators(List<Comprehension> generators) {
        StringBuilder sb = new StringBuilder();
        for (Comprehension generator : generators) {
            sb.append(generator.isAsync() ? " async for " : " for ")
                    .append(expr(generator.target(), Precedence.TUPLE))
                    .append(" in ")
                    .append(expr(generator.iter(), Precedence.TEST.next()));
            for (Expression condition : generator.ifs()) {
                sb.append(" if ").append(expr(condition, Precedence.TEST.next()));
            }
        }
        return sb.toString();
    }

    private String subscriptSlice(Expression slice) {
        if (slice instanceof Expression.TupleExpr tuple && !tuple.elts().isEmpty()) {
            StringJoiner joiner = new StringJoiner(", ");
            for (Expression element : tuple.elts()) {
                joiner.add(element instanceof Expression.Slice s ? slice(s) : expr(element, Precedence.TEST));
            }
            return tuple.elts().size() == 1 ? joiner + "," : joiner.toString();
        }
        if (slice instanceof Expression.Slice s) {
            return slice(s);
        }
        return expr(slice, Precedence.TEST);
    }

    private String slice(Expression.Slice slice) {
        StringBuilder sb = new StringBuilder();
        if (slice.lower() != null) {
            sb.append(expr(slice.lower(), Precedence.TEST));
        }
        sb.append(':');
        if (slice.upper() != null) {
            sb.append(expr(slice.upper(), Precedence.TEST));
        }
        if (slice.step() != null) {
            sb.append(':').append(expr(slice.step(), Precedence.TEST));
        }
        return sb.toString();
    }

    // region Parameters

    /**
     * Renders a parameter list without the surrounding parentheses.
     */
    String arguments(Arguments arguments) {
        List<String> parts = new ArrayList<>();
        List<Arg> positional = new ArrayList<>(arguments.posonlyArgs());
        positional.addAll(arguments.args());
        int firstDefault = positional.size() - arguments.defaults().size();
        for (int i = 0; i < positional.size(); i++) {
            Arg arg = positional.get(i);
            Expression defaultValue = i >= firstDefault ? arguments.defaults().get(i - firstDefault) : null;
            parts.add(parameter(arg, defaultValue));
            if (i == arguments.posonlyArgs().size() - 1) {
                parts.add("/");
            }
        }
        if (arguments.vararg() != null) {
            parts.add("*" + parameter(arguments.vararg(), null));
        } else if (!arguments.kwonlyArgs().isEmpty()) {
            parts.add("*");
        }
        for (int i = 0; i < arguments.kwonlyArgs().size(); i++) {
            parts.add(parameter(arguments.kwonlyArgs().get(i), arguments.kwDefaults().get(i)));
        }
        if (arguments.kwarg() != null) {
            parts.add("**" + parameter(arguments.kwarg(), null));
        }
        return String.join(", ", parts);
    }

    private String parameter(Arg arg, Expression defaultValue) {
        String text = arg.name();
        if (arg.annotation() != null) {
            text += ": " + expr(arg.annotation(), Precedence.TEST);
        }
        if (defaultValue != null) {
            text += (arg.annotation() != null ? " = " : "=") + expr(defaultValue, Precedence.TEST);
        }
        return text;
    }

    /**
     * Renders {@code [T, *Ts, **P]}, or an empty string when there are no type parameters.
     */
    String typeParams(List<TypeParam> typeParams) {
        if (typeParams.isEmpty()) {
            return "";
        }
        StringJoiner joiner = new StringJoiner(", ", "[", "]");
        for (TypeParam param : typeParams) {
            String text;
            if (param instanceof TypeParam.TypeVar typeVar) {
                text = typeVar.name();
                if (typeVar.bound() != null) {
                    text += ": " + expr(typeVar.bound(), Precedence.TEST);
                }
            } else if (param instanceof TypeParam.ParamSpec) {
                text = "**" + param.name();
            } else {
                text = "*" + param.name();
            }
            if (param.defaultValue() != null) {
                text += " = " + expr(param.defaultValue(), Precedence.TEST);
            }
            joiner.add(text);
        }
        return joiner.toString();
    }

    // endregion

    // region Patterns

    String pattern(Pattern pattern) {
        if (pattern instanceof Pattern.MatchValue value) {
            return expr(value.value(), Precedence.BOR);
        }
        if (pattern instanceof Pattern.MatchSingleton singleton) {
            return constant(singleton.value(), null);
        }
        if (pattern instanceof Pattern.MatchSequence sequence) {
            StringJoiner joiner = new StringJoiner(", ", "[", "]");
            for (Pattern element : sequence.patterns()) {
                joiner.add(pattern(element));
            }
            return joiner.toString();
        }
        if (pattern instanceof Pattern.MatchMapping mapping) {
            StringJoiner joiner = new StringJoiner(", ", "{", "}");
            for (int i = 0; i < mapping.keys().size(); i++) {
                joiner.add(expr(mapping.keys().get(i), Precedence.BOR) + ": " + pattern(mapping.patterns().get(i)));
            }
            if (mapping.rest() != null) {
                joiner.add("**" + mapping.rest());
            }
            return joiner.toString();
        }
        if (pattern instanceof Pattern.MatchClass cls) {
            StringJoiner joiner = new StringJoiner(", ", expr(cls.cls(), Precedence.ATOM) + "(", ")");
            for (Pattern positional : cls.patterns()) {
                joiner.add(pattern(positional));
            }
            for (int i = 0; i < cls.kwdAttrs().size(); i++) {
                joiner.add(cls.kwdAttrs().get(i) + "=" + pattern(cls.kwdPatterns().get(i)));
            }
            return joiner.toString();
        }
        if (pattern instanceof Pattern.MatchStar star) {
            return "*" + (star.name() == null ? "_" : star.name());
        }
        if (pattern instanceof Pattern.MatchAs as) {
            if (as.pattern() == null) {
                return as.name() == null ? "_" : as.name();
            }
            String inner = pattern(as.pattern());
            if (as.pattern() instanceof Pattern.MatchAs) {
                inner = "(" + inner + ")";
            }
            return inner + " as " + as.name();
        }
        if (pattern instanceof Pattern.MatchOr or) {
            StringJoiner joiner = new StringJoiner(" | ");
            for (Pattern alternative : or.patterns()) {
                String text = pattern(alternative);
                boolean needsParens = alternative instanceof Pattern.MatchOr
                        || (alternative instanceof Pattern.MatchAs as && as.pattern() != null);
                joiner.add(needsParens ? "(" + text + ")" : text);
            }
            return joiner.toString();
        }
        throw new IllegalArgumentException("Unsupported pattern: " + pattern.getClass().getSimpleName());
    }

    // endregion

    // region Literals

    String constant(ConstantValue value, String kind) {
        if (value instanceof ConstantValue.None) {
            return "None";
        }
        if (value instanceof ConstantValue.Bool bool) {
            return bool.value() ? "True" : "False";
        }
        if (value instanceof ConstantValue.Ellipsis) {
            return "...";
        }
        if (value instanceof ConstantValue.Int i) {
            BigInteger number = i.value();
            return number.toString();
        }
        if (value instanceof ConstantValue.Float f) {
            return floatText(f.value());
        }
        if (value instanceof ConstantValue.Complex c) {
            String imag = floatText(c.imag()) + "j";
            if (c.real() == 0.0 && 1.0 / c.real() > 0) {
                return imag;
            }
            return "(" + floatText(c.real()) + " + " + imag + ")";
        }
        if (value instanceof ConstantValue.Str s) {
            return ("u".equals(kind) ? "u" : "") + quote(s.value());
        }
        if (value instanceof ConstantValue.Bytes b) {
            return "b" + quoteBytes(b.value());
        }
        throw new IllegalArgumentException("Unsupported constant: " + value);
    }

    private static String floatText(double value) {
        if (Double.isNaN(value)) {
            return "(" + INFINITY + " - " + INFINITY + ")";
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? INFINITY : "-" + INFINITY;
        }
        return Double.toString(value);
    }

    String quote(String value) {
        char q = quoteStyle.quote();
        StringBuilder sb = new StringBuilder().append(q);
        appendEscaped(sb, value, q, false);
        return sb.append(q).toString();
    }

    private String quoteBytes(byte[] value) {
        char q = quoteStyle.quote();
        StringBuilder sb = new StringBuilder().append(q);
        for (byte b : value) {
            int c = b & 0xff;
            switch (c) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c == q) {
                        sb.append('\\').append(q);
                    } else if (c < 0x20 || c > 0x7e) {
                        sb.append(String.format("\\x%02x", c));
                    } else {
                        sb.append((char) c);
                    }
                }
            }
        }
        return sb.append(q).toString();
    }

    private static void appendEscaped(StringBuilder sb, String value, char q, boolean doubleBraces) {
        for (int i = 0; i < value.length(); ) {
            int cp = value.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                case '{', '}' -> {
                    sb.appendCodePoint(cp);
                    if (doubleBraces) {
                        sb.appendCodePoint(cp);
                    }
                }
                default -> {
                    if (cp == q) {
                        sb.append('\\').append(q);
                    } else if (isPrintable(cp)) {
                        sb.appendCodePoint(cp);
                    } else if (cp <= 0xff) {
                        sb.append(String.format("\\x%02x", cp));
                    } else if (cp <= 0xffff) {
                        sb.append(String.format("\\u%04x", cp));
                    } else {
                        sb.append(String.format("\\U%08x", cp));
                    }
                }
            }
        }
    }

    private static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        switch (Character.getType(cp)) {
            case Character.CONTROL, Character.FORMAT, Character.UNASSIGNED, Character.SURROGATE,
                    Character.PRIVATE_USE, Character.LINE_SEPARATOR, Character.PARAGRAPH_SEPARATOR,
                    Character.SPACE_SEPARATOR:
                return false;
            default:
                return true;
        }
    }

    // endregion

    // region F-strings

    private String fStringBody(List<Expression> values) {
        StringBuilder sb = new StringBuilder();
        for (Expression value : values) {
            if (value instanceof Expression.Constant constant && constant.value() instanceof ConstantValue.Str s) {
                appendEscaped(sb, s.value(), quoteStyle.quote(), true);
            } else if (value instanceof Expression.FormattedValue formatted) {
                sb.append(field(formatted));
            } else {
                throw new IllegalArgumentException("Unexpected f-string part: " + value.getClass().getSimpleName());
            }
        }
        return sb.toString();
    }

    private String field(Expression.FormattedValue formatted) {
        Expression value = formatted.value();
        String text = fieldWriter().expr(value, Precedence.TEST);
        if (value instanceof Expression.Lambda) {
            text = "(" + text + ")";
        }
        StringBuilder sb = new StringBuilder("{");
        if (text.startsWith("{")) {
            sb.append(' ');
        }
        sb.append(text);
        if (formatted.conversion() != Expression.FormattedValue.NO_CONVERSION) {
            sb.append('!').append((char) formatted.conversion());
        }
        if (formatted.formatSpec() instanceof Expression.JoinedStr spec) {
            sb.append(':').append(fStringBody(spec.values()));
        }
        return sb.append('}').toString();
    }

    /**
     * Strings nested in a replacement field use the other quote so that the field does not end the literal.
     */
    private ExpressionWriter fieldWriter() {
        return new ExpressionWriter(quoteStyle.other());
    }

    // endregion
}
