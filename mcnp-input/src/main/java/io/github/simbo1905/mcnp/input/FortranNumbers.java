package io.github.simbo1905.mcnp.input;

import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.regex.Pattern;

/// Fallible number conversions for the Fortran style literals used in inputs.
///
/// A real may drop the exponent letter: `1.2+3`, `1.2-3` and `1.2E+3` are the same number.
/// Each method returns an empty optional instead of throwing, so callers can try conversions in order.
public final class FortranNumbers {

    private static final Pattern REAL = Pattern.compile(
            "(?<mantissa>[+-]?(?:\\d+\\.?\\d*|\\.\\d+))(?:(?<e>[eE])(?<signed>[+-]?\\d+)|(?<bare>[+-]\\d+))?");

    private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");

    private FortranNumbers() {}

    public static OptionalDouble parseReal(String text) {
        if (text == null) {
            return OptionalDouble.empty();
        }
        final var m = REAL.matcher(text.trim());
        if (!m.matches()) {
            return OptionalDouble.empty();
        }
        String normal = m.group("mantissa");
        if (m.group("signed") != null) {
            normal += "e" + m.group("signed");
        } else if (m.group("bare") != null) {
            normal += "e" + m.group("bare");
        }
        return OptionalDouble.of(Double.parseDouble(normal));
    }

    /// Parses an integer. A real literal with a zero fraction such as `4.0` or `4.` is accepted.
    public static OptionalLong parseInteger(String text) {
        if (text == null) {
            return OptionalLong.empty();
        }
        final String trimmed = text.trim();
        if (INTEGER.matcher(trimmed).matches()) {
            try {
                return OptionalLong.of(Long.parseLong(trimmed.startsWith("+") ? trimmed.substring(1) : trimmed));
            } catch (NumberFormatException overflow) {
                return OptionalLong.empty();
            }
        }
        final int dot = trimmed.indexOf('.');
        if (dot > 0 && INTEGER.matcher(trimmed.substring(0, dot)).matches()) {
            final String fraction = trimmed.substring(dot + 1);
            if (fraction.chars().allMatch(c -> c == '0')) {
                return parseInteger(trimmed.substring(0, dot));
            }
        }
        return OptionalLong.empty();
    }

    public static boolean isReal(String text) {
        return parseReal(text).isPresent();
    }
}
