package io.github.simbo1905.mcnp.input;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// A leaf of the syntax tree: one value with the token it was read from and the padding after it.
///
/// While the value is unchanged (reals within [Tolerance#DEFAULT]) the original token is written
/// back verbatim. Once it changes, the layout of the original token is reverse engineered into a
/// [ValueFormat] and the new value is rendered in that style.
///
/// Values flagged as negatable identifiers or negatable reals store their magnitude; the sign is
/// kept separately in [#isNegative()] and put back on output.
public final class ValueNode implements SyntaxNodeBase {

    private static final Logger LOG = Logger.getLogger(ValueNode.class.getName());

    static final Pattern SCIENTIFIC = Pattern.compile(
            "[+\\-]?(?<significand>\\d+\\.*\\d*)(?:(?<e>[eE])[+\\-]?|[+\\-])(?<exponent>\\d+)");

    /// Text written for a jump placeholder.
    public static final String JUMP_TOKEN = "J";

    private final String token;
    private final boolean jump;
    private ValueType type;
    private Object value;
    private final Object originalValue;
    private PaddingNode padding;
    private boolean neverPad;
    private ValueFormat formatter;
    private boolean reversed;
    private boolean negatableIdentifier;
    private boolean negatableReal;
    private Boolean negative;

    public ValueNode(String token, ValueType type) {
        this(token, type, null, false);
    }

    public ValueNode(String token, ValueType type, PaddingNode padding) {
        this(token, type, padding, false);
    }

    /// @param token the original text, or null for a value made from scratch
    /// @throws IllegalArgumentException if the token is not a number of the given type
    public ValueNode(String token, ValueType type, PaddingNode padding, boolean neverPad) {
        this(token, type, padding, neverPad, false);
    }

    private ValueNode(String token, ValueType type, PaddingNode padding, boolean neverPad, boolean jump) {
        this.type = Objects.requireNonNull(type, "type");
        this.token = token;
        this.jump = jump;
        this.padding = padding;
        this.neverPad = neverPad;
        this.formatter = ValueFormat.defaults(type);
        if (token == null || jump) {
            this.value = null;
        } else {
            this.value = parse(token, type);
        }
        this.originalValue = value;
    }

    private ValueNode(ValueNode other, PaddingNode padding) {
        this.token = other.token;
        this.jump = other.jump;
        this.type = other.type;
        this.value = other.value;
        this.originalValue = other.originalValue;
        this.padding = padding;
        this.neverPad = other.neverPad;
        this.formatter = other.formatter.copy();
        this.reversed = other.reversed;
        this.negatableIdentifier = other.negatableIdentifier;
        this.negatableReal = other.negatableReal;
        this.negative = other.negative;
    }

    /// A jump placeholder: a real with no value, written as `J`.
    public static ValueNode jump() {
        return new ValueNode(JUMP_TOKEN, ValueType.REAL, null, false, true);
    }

    private static Object parse(String token, ValueType type) {
        switch (type) {
            case REAL:
                return FortranNumbers.parseReal(token).orElseThrow(
                        () -> new IllegalArgumentException("Not a real number: " + token));
            case INTEGER:
                return FortranNumbers.parseInteger(token).orElseThrow(
                        () -> new IllegalArgumentException("Not an integer: " + token));
            default:
                return token;
        }
    }

    public String token() {
        return token;
    }

    public boolean isJump() {
        return jump;
    }

    public ValueType type() {
        return type;
    }

    /// The current value: a `Long`, `Double`, `String` or null.
    public Object value() {
        return value;
    }

    public boolean hasValue() {
        return value != null;
    }

    /// The current numeric value as a double.
    /// @throws IllegalStateException if the value is null or text
    public double doubleValue() {
        if (!(value instanceof Number number)) {
            throw new IllegalStateException("Not a numeric value: " + value);
        }
        return number.doubleValue();
    }

    public long longValue() {
        if (!(value instanceof Number number)) {
            throw new IllegalStateException("Not a numeric value: " + value);
        }
        return number.longValue();
    }

    public String textValue() {
        return value == null ? null : value.toString();
    }

    /// Updates the value. Integers accept any integral number, reals any number, text any string.
    /// For negatable values only the magnitude is stored.
    /// @throws IllegalArgumentException if the value does not fit the type
    public void setValue(Object newValue) {
        Object coerced = coerce(newValue);
        if (coerced != null && isNegatable()) {
            coerced = magnitude(coerced, false);
        }
        if (coerced != null && value == null && !neverPad && padding == null) {
            padding = new PaddingNode(" ");
        }
        value = coerced;
    }

    private Object coerce(Object newValue) {
        if (newValue == null) {
            return null;
        }
        switch (type) {
            case INTEGER:
                if (newValue instanceof Long || newValue instanceof Integer || newValue instanceof Short) {
                    return ((Number) newValue).longValue();
                }
                if (newValue instanceof Number number) {
                    final double d = number.doubleValue();
                    if (d == Math.rint(d) && !Double.isInfinite(d)) {
                        return (long) d;
                    }
                }
                throw new IllegalArgumentException("Not an integer value: " + newValue);
            case REAL:
                if (newValue instanceof Number number) {
                    return number.doubleValue();
                }
                throw new IllegalArgumentException("Not a real value: " + newValue);
            default:
                if (newValue instanceof String) {
                    return newValue;
                }
                throw new IllegalArgumentException("Not a text value: " + newValue);
        }
    }

    public PaddingNode padding() {
        return padding;
    }

    public void setPadding(PaddingNode padding) {
        this.padding = padding;
    }

    /// Whether an ending space is never added when this value is laid out in a list.
    public boolean neverPad() {
        return neverPad;
    }

    public void setNeverPad(boolean neverPad) {
        this.neverPad = neverPad;
    }

    public ValueFormat formatter() {
        return formatter;
    }

    /// A signed integer whose sign carries a separate flag, e.g. a surface number in a geometry.
    /// Turning this on converts the value to an integer; `1.0` is accepted, `1.5` is not.
    /// @throws IllegalArgumentException if the original token is not integral
    public void setNegatableIdentifier(boolean flag) {
        if (flag) {
            convertToInteger();
            if (value != null) {
                final long v = (Long) value;
                negative = v < 0;
                value = Math.abs(v);
            } else {
                negative = null;
            }
        }
        negatableIdentifier = flag;
    }

    public boolean isNegatableIdentifier() {
        return negatableIdentifier;
    }

    /// A real whose sign carries a separate flag, e.g. a cell density given as mass or atom density.
    public void setNegatableReal(boolean flag) {
        if (flag) {
            if (value != null) {
                final double v = doubleValue();
                negative = v < 0;
                value = Math.abs(v);
            } else {
                negative = null;
            }
        }
        negatableReal = flag;
    }

    public boolean isNegatableReal() {
        return negatableReal;
    }

    private boolean isNegatable() {
        return negatableIdentifier || negatableReal;
    }

    /// The sign flag of a negatable value; null for values that are not negatable.
    public Boolean isNegative() {
        return isNegatable() ? negative : null;
    }

    public void setNegative(boolean flag) {
        if (isNegatable()) {
            negative = flag;
        }
    }

    void convertToInteger() {
        if (!type.isNumeric()) {
            throw new IllegalStateException("ValueNode must be numeric to convert to an integer");
        }
        if (value instanceof Number number) {
            final double d = number.doubleValue();
            if (d != Math.rint(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Not an integer: " + (token == null ? value : token));
            }
            value = (long) d;
        }
        type = ValueType.INTEGER;
        formatter = ValueFormat.defaults(ValueType.INTEGER);
    }

    /// The value with the sign flag applied, as written.
    public Object printValue() {
        if (Boolean.TRUE.equals(negative) && isNegatable() && value instanceof Number) {
            return magnitude(value, true);
        }
        return value;
    }

    private static Object magnitude(Object number, boolean negate) {
        if (number instanceof Long l) {
            final long abs = Math.abs(l);
            return negate ? -abs : abs;
        }
        final double abs = Math.abs((Double) number);
        return negate ? -abs : abs;
    }

    /// Whether the value differs from the one parsed from the token.
    public boolean valueChanged() {
        if (value == null && originalValue == null) {
            return false;
        }
        if (value == null || originalValue == null) {
            return true;
        }
        if (type.isNumeric() && originalValue instanceof Number og) {
            return !Tolerance.DEFAULT.isClose(((Number) printValue()).doubleValue(), og.doubleValue());
        }
        return !value.equals(originalValue);
    }

    private void reverseEngineer() {
        if (reversed || token == null) {
            return;
        }
        reversed = true;
        formatter.valueLength = token.length();
        if (padding != null && padding.size() > 0 && padding.isSpace(0)) {
            formatter.valueLength += padding.fragments().get(0).format().length();
        }
        if (type.isNumeric()) {
            final String noZeroPad = stripLeading(token, "0+-");
            final int length = token.length();
            int delta = length - noZeroPad.length();
            if (token.startsWith("+") || token.startsWith("-")) {
                delta--;
                formatter.sign = token.startsWith("+") ? '+' : ' ';
            }
            if (delta > 0) {
                formatter.zeroPadding = length;
            }
            if (type == ValueType.REAL) {
                reverseEngineerReal();
            }
        }
        LOG.finest(() -> StructuredLog.ev("value_format", "token", token, "format", formatter));
    }

    private void reverseEngineerReal() {
        final var m = SCIENTIFIC.matcher(token);
        final String significand;
        if (m.lookingAt()) {
            formatter.scientific = true;
            significand = m.group("significand");
            formatter.divider = m.group("e") == null ? "" : m.group("e");
            formatter.zeroPadding += 4;
            final String exponent = m.group("exponent");
            if (!exponent.equals(stripLeading(exponent, "0"))) {
                formatter.exponentLength = exponent.length();
                formatter.exponentZeroPad = exponent.length();
            }
        } else {
            formatter.scientific = false;
            significand = token;
        }
        final String[] parts = significand.split("\\.", -1);
        if (parts.length == 2) {
            formatter.precision = parts[1].length();
        } else {
            formatter.precision = ValueFormat.DEFAULT_PRECISION;
            formatter.asInt = true;
        }
    }

    private static String stripLeading(String text, String chars) {
        int i = 0;
        while (i < text.length() && chars.indexOf(text.charAt(i)) >= 0) {
            i++;
        }
        return text.substring(i);
    }

    private boolean canRealBeInteger() {
        if (type != ValueType.REAL || !formatter.asInt) {
            return false;
        }
        final double v = doubleValue();
        return Tolerance.DEFAULT.isClose(Math.rint(v), v);
    }

    @Override
    public String name() {
        return "";
    }

    @Override
    public String format() {
        if (!valueChanged()) {
            final String text = token == null ? "" : token;
            return padding == null ? text : text + padding.format();
        }
        if (value == null) {
            return "";
        }
        reverseEngineer();
        final String temp = renderValue();
        String padStr = "";
        String extraPad = "";
        if (padding != null && padding.size() > 0) {
            if (padding.isSpace(0)) {
                final boolean savingSpace = padding.size() > 1 && (padding.isSpace(1) || padding.isNewline(1));
                if (temp.length() >= formatter.valueLength && !savingSpace) {
                    padStr = " ";
                }
                extraPad = joinFrom(1);
            } else {
                extraPad = joinFrom(0);
            }
        }
        final String buffer = leftJustify(temp, formatter.valueLength) + padStr;
        if (buffer.length() > formatter.valueLength && token != null) {
            InputWarnings.warn(new InputWarning(InputWarning.Kind.LINE_EXPANSION,
                    "The value has expanded, and may change formatting. The original value was "
                            + token + ", new value is " + temp + ".",
                    token, temp));
        }
        StructuredLog.finestSampled(LOG, "value_reformatted", 1, "token", token, "text", temp);
        return buffer + extraPad;
    }

    private String renderValue() {
        final Object print = printValue();
        if (type == ValueType.INTEGER || canRealBeInteger()) {
            final long v = print instanceof Long l ? l : Math.round(((Number) print).doubleValue());
            return NumberFormat.integer(v, formatter.sign, formatter.zeroPadding);
        }
        if (type == ValueType.REAL) {
            final double v = ((Number) print).doubleValue();
            if (!reversed) {
                return NumberFormat.general(v, formatter.precision, formatter.sign, formatter.zeroPadding);
            }
            if (formatter.scientific) {
                return scientific(v);
            }
            if (formatter.asInt) {
                return NumberFormat.general(v, formatter.sign, formatter.zeroPadding);
            }
            return NumberFormat.fixed(v, formatter.precision, formatter.sign, formatter.zeroPadding);
        }
        return String.valueOf(print);
    }

    private String scientific(double v) {
        String temp = NumberFormat.scientific(v, formatter.precision, formatter.sign, formatter.zeroPadding);
        temp = temp.replace("e", formatter.divider);
        final var m = SCIENTIFIC.matcher(temp);
        if (!m.find()) {
            return temp;
        }
        final long exponent = Long.parseLong(m.group("exponent"));
        final String newExponent = leftJustify(
                NumberFormat.integer(exponent, '-', formatter.exponentZeroPad), formatter.exponentLength);
        return temp.substring(0, m.start("exponent")) + newExponent + temp.substring(m.end("exponent"));
    }

    private String joinFrom(int start) {
        final var sb = new StringBuilder();
        final var fragments = padding.fragments();
        for (int i = start; i < fragments.size(); i++) {
            sb.append(fragments.get(i).format());
        }
        return sb.toString();
    }

    private static String leftJustify(String text, int width) {
        if (text.length() >= width) {
            return text;
        }
        return text + " ".repeat(width - text.length());
    }

    /// Compares values: reals within tolerance, other types exactly; a type mismatch is never equal.
    /// @param other a ValueNode, Number or String
    /// @throws IllegalArgumentException for any other kind of object
    public boolean valueEquals(Object other) {
        final Object otherValue;
        final ValueType otherType;
        if (other instanceof ValueNode node) {
            otherValue = node.value;
            otherType = node.type;
        } else if (other instanceof Long || other instanceof Integer) {
            otherValue = ((Number) other).longValue();
            otherType = ValueType.INTEGER;
        } else if (other instanceof Double || other instanceof Float) {
            otherValue = ((Number) other).doubleValue();
            otherType = ValueType.REAL;
        } else if (other instanceof String) {
            otherValue = other;
            otherType = ValueType.TEXT;
        } else {
            throw new IllegalArgumentException("ValueNode can't be equal to " + (other == null ? "null" : other.getClass()) + " type. " + other + " given.");
        }
        if (type != otherType) {
            return false;
        }
        if (type == ValueType.REAL && value != null && otherValue != null) {
            return Tolerance.DEFAULT.isClose((Double) value, (Double) otherValue);
        }
        return Objects.equals(value, otherValue);
    }

    @Override
    public List<CommentNode> comments() {
        return padding == null ? List.of() : padding.comments();
    }

    @Override
    public List<SyntaxNodeBase> flatten() {
        return List.of(this);
    }

    @Override
    public int size() {
        return 1;
    }

    @Override
    public List<PaddingNode.Fragment> trailingComment() {
        return padding == null ? List.of() : padding.trailingComment();
    }

    @Override
    public void deleteTrailingComment() {
        if (padding != null) {
            padding.deleteTrailingComment();
        }
    }

    @Override
    public void grabBeginningComment(List<PaddingNode.Fragment> extra) {
        // a value has no leading padding to hold the comment
    }

    @Override
    public ValueNode copyWith(NodeCopier copier) {
        return new ValueNode(this, copier.copy(padding));
    }

    @Override
    public String toString() {
        return "(Value, " + value + ", padding: " + padding + ")";
    }
}
