package io.github.simbo1905.mcnp.input;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/// Renders numbers the way values are laid out on output: a sign policy, zero padding after the
/// sign up to a total width, and fixed, scientific or general notation.
///
/// Sign policies are `'-'` (only negatives carry a sign), `'+'` (always signed) and `' '`
/// (a space stands in for the plus sign). Rounding is half-even on the exact binary value.
public final class NumberFormat {

    private NumberFormat() {}

    public static String integer(long value, char sign, int width) {
        final boolean negative = value < 0;
        final String digits = negative ? Long.toString(value).substring(1) : Long.toString(value);
        return pad(signOf(negative, sign), digits, width);
    }

    /// Fixed notation with `precision` digits after the point.
    public static String fixed(double value, int precision, char sign, int width) {
        if (!Double.isFinite(value)) {
            return pad(signOf(isNegative(value), sign), nonFinite(value), width);
        }
        final String body = new BigDecimal(Math.abs(value)).setScale(precision, RoundingMode.HALF_EVEN).toPlainString();
        return pad(signOf(isNegative(value), sign), body, width);
    }

    /// Scientific notation `d.ddde+XX` with `precision` digits after the point and at least two exponent digits.
    public static String scientific(double value, int precision, char sign, int width) {
        if (!Double.isFinite(value)) {
            return pad(signOf(isNegative(value), sign), nonFinite(value), width);
        }
        final double abs = Math.abs(value);
        final String body;
        if (abs == 0.0) {
            body = mantissaZero(precision) + "e+00";
        } else {
            final BigDecimal rounded = new BigDecimal(abs).round(new MathContext(precision + 1, RoundingMode.HALF_EVEN));
            final int exponent = rounded.precision() - rounded.scale() - 1;
            final String mantissa = rounded.movePointLeft(exponent).setScale(precision, RoundingMode.HALF_EVEN).toPlainString();
            body = mantissa + exponentText(exponent);
        }
        return pad(signOf(isNegative(value), sign), body, width);
    }

    /// General notation with `precision` significant digits, trailing zeros removed.
    public static String general(double value, int precision, char sign, int width) {
        if (!Double.isFinite(value)) {
            return pad(signOf(isNegative(value), sign), nonFinite(value), width);
        }
        final int p = precision == 0 ? 1 : precision;
        final double abs = Math.abs(value);
        final String body;
        if (abs == 0.0) {
            body = "0";
        } else {
            final BigDecimal rounded = new BigDecimal(abs).round(new MathContext(p, RoundingMode.HALF_EVEN));
            final int exponent = rounded.precision() - rounded.scale() - 1;
            if (exponent >= -4 && exponent < p) {
                body = stripZeros(rounded.setScale(Math.max(p - 1 - exponent, 0), RoundingMode.HALF_EVEN).toPlainString());
            } else {
                final String mantissa = rounded.movePointLeft(exponent).setScale(p - 1, RoundingMode.HALF_EVEN).toPlainString();
                body = stripZeros(mantissa) + exponentText(exponent);
            }
        }
        return pad(signOf(isNegative(value), sign), body, width);
    }

    /// General notation with the default six significant digits.
    public static String general(double value, char sign, int width) {
        return general(value, 6, sign, width);
    }

    /// Shortest text that reads back as the same double, in the layout of a plain numeric literal:
    /// `2.0`, `0.001`, `1.5e-05`, `1e+16`.
    public static String shortest(double value) {
        if (!Double.isFinite(value)) {
            return nonFinite(value);
        }
        if (value == 0.0) {
            return isNegative(value) ? "-0.0" : "0.0";
        }
        final String prefix = value < 0 ? "-" : "";
        final BigDecimal exact = new BigDecimal(Double.toString(Math.abs(value))).stripTrailingZeros();
        final int exponent = exact.precision() - exact.scale() - 1;
        if (exponent >= -4 && exponent < 16) {
            String plain = exact.toPlainString();
            if (!plain.contains(".")) {
                plain += ".0";
            }
            return prefix + plain;
        }
        final String mantissa = exact.movePointLeft(exponent).toPlainString();
        return prefix + mantissa + exponentText(exponent);
    }

    private static String mantissaZero(int precision) {
        return precision == 0 ? "0" : "0." + "0".repeat(precision);
    }

    private static String exponentText(int exponent) {
        final String digits = Integer.toString(Math.abs(exponent));
        return "e" + (exponent < 0 ? "-" : "+") + (digits.length() < 2 ? "0" + digits : digits);
    }

    private static String stripZeros(String text) {
        if (!text.contains(".")) {
            return text;
        }
        String out = text;
        while (out.endsWith("0")) {
            out = out.substring(0, out.length() - 1);
        }
        if (out.endsWith(".")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }

    private static boolean isNegative(double value) {
        return value < 0 || (value == 0.0 && 1.0 / value < 0);
    }

    private static String nonFinite(double value) {
        return Double.isNaN(value) ? "nan" : "inf";
    }

    private static String signOf(boolean negative, char policy) {
        if (negative) {
            return "-";
        }
        return switch (policy) {
            case '+' -> "+";
            case ' ' -> " ";
            default -> "";
        };
    }

    private static String pad(String sign, String body, int width) {
        final int missing = width - sign.length() - body.length();
        if (missing <= 0) {
            return sign + body;
        }
        return sign + "0".repeat(missing) + body;
    }
}
