package io.github.simbo1905.mcnp.input;

/// How a value was laid out in the input, recovered from its original token so a changed value
/// can be written back in the same style.
public final class ValueFormat {

    /// Default significant digits for reals that had no original token.
    public static final int DEFAULT_PRECISION = 5;

    int valueLength;
    int precision = DEFAULT_PRECISION;
    int zeroPadding;
    char sign = '-';
    String divider = "e";
    int exponentLength;
    int exponentZeroPad;
    boolean asInt;
    boolean scientific = true;

    private ValueFormat() {}

    static ValueFormat defaults(ValueType type) {
        final var format = new ValueFormat();
        if (type != ValueType.REAL) {
            format.scientific = false;
        }
        return format;
    }

    ValueFormat copy() {
        final var copy = new ValueFormat();
        copy.valueLength = valueLength;
        copy.precision = precision;
        copy.zeroPadding = zeroPadding;
        copy.sign = sign;
        copy.divider = divider;
        copy.exponentLength = exponentLength;
        copy.exponentZeroPad = exponentZeroPad;
        copy.asInt = asInt;
        copy.scientific = scientific;
        return copy;
    }

    /// Columns the value and its first trailing space took.
    public int valueLength() {
        return valueLength;
    }

    public int precision() {
        return precision;
    }

    /// Total width to zero pad to, sign included; zero when the value was not zero padded.
    public int zeroPadding() {
        return zeroPadding;
    }

    /// `'-'`, `'+'` or `' '`.
    public char sign() {
        return sign;
    }

    /// Text between significand and exponent, empty for the `1.2+3` form.
    public String divider() {
        return divider;
    }

    public int exponentLength() {
        return exponentLength;
    }

    public int exponentZeroPad() {
        return exponentZeroPad;
    }

    /// A real written without a decimal point.
    public boolean asInt() {
        return asInt;
    }

    public boolean scientific() {
        return scientific;
    }

    @Override
    public String toString() {
        return "ValueFormat[valueLength=" + valueLength + ", precision=" + precision + ", zeroPadding=" + zeroPadding
                + ", sign='" + sign + "', divider='" + divider + "', exponentLength=" + exponentLength
                + ", exponentZeroPad=" + exponentZeroPad + ", asInt=" + asInt + ", scientific=" + scientific + "]";
    }
}
