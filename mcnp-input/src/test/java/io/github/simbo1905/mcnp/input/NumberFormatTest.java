package io.github.simbo1905.mcnp.input;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NumberFormatTest extends InputTestBase {

    @Test
    void integersPadAfterTheSign() {
        assertThat(NumberFormat.integer(5, '-', 3)).isEqualTo("005");
        assertThat(NumberFormat.integer(-5, '-', 3)).isEqualTo("-05");
        assertThat(NumberFormat.integer(5, '+', 0)).isEqualTo("+5");
        assertThat(NumberFormat.integer(5, ' ', 0)).isEqualTo(" 5");
    }

    @Test
    void fixedRoundsHalfEvenOnTheBinaryValue() {
        assertThat(NumberFormat.fixed(1.25, 1, '-', 0)).isEqualTo("1.2");
        assertThat(NumberFormat.fixed(-0.5, 2, '-', 0)).isEqualTo("-0.50");
    }

    @Test
    void generalSwitchesToExponentForLargeValues() {
        assertThat(NumberFormat.general(0.0001234, 3, '-', 0)).isEqualTo("0.000123");
        assertThat(NumberFormat.general(1234567.0, '-', 0)).isEqualTo("1.23457e+06");
        assertThat(NumberFormat.general(2.0, '-', 0)).isEqualTo("2");
    }

    @Test
    void scientificOfZero() {
        assertThat(NumberFormat.scientific(0.0, 2, '+', 0)).isEqualTo("+0.00e+00");
        assertThat(NumberFormat.scientific(250.0, 1, '-', 0)).isEqualTo("2.5e+02");
    }

    @Test
    void shortestText() {
        assertThat(NumberFormat.shortest(2.0)).isEqualTo("2.0");
        assertThat(NumberFormat.shortest(0.001)).isEqualTo("0.001");
        assertThat(NumberFormat.shortest(1.5e-5)).isEqualTo("1.5e-05");
    }

    @Test
    void fortranRealsMayDropTheExponentLetter() {
        assertThat(FortranNumbers.parseReal("1.2+3")).hasValue(1200.0);
        assertThat(FortranNumbers.parseReal("1.2E+3")).hasValue(1200.0);
        assertThat(FortranNumbers.parseReal("1.5-3").getAsDouble()).isCloseTo(0.0015, org.assertj.core.data.Offset.offset(1e-15));
        assertThat(FortranNumbers.parseReal("abc")).isEmpty();
    }

    @Test
    void integersAcceptZeroFractions() {
        assertThat(FortranNumbers.parseInteger("4.0")).hasValue(4L);
        assertThat(FortranNumbers.parseInteger("+7")).hasValue(7L);
        assertThat(FortranNumbers.parseInteger("4.5")).isEmpty();
        assertThat(FortranNumbers.parseInteger("99999999999999999999")).isEmpty();
    }

    @Test
    void toleranceIsRelativeOrAbsolute() {
        assertThat(Tolerance.DEFAULT.isClose(1.0, 1.0 + 1e-12)).isTrue();
        assertThat(Tolerance.DEFAULT.isClose(1.0, 1.001)).isFalse();
        assertThat(Tolerance.DEFAULT.isClose(0.0, 1e-300)).isFalse();
        assertThat(new Tolerance(0.0, 0.1).isClose(1.0, 1.05)).isTrue();
        assertThat(Tolerance.DEFAULT.isClose(Double.NaN, Double.NaN)).isFalse();
        assertThatThrownBy(() -> new Tolerance(-1.0, 0.0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void versionsDecideLineLength() {
        assertThat(McnpVersion.parse("6.2").lineLength()).isEqualTo(128);
        assertThat(McnpVersion.parse("6.3.1").lineLength()).isEqualTo(128);
        assertThat(McnpVersion.parse("5.1.60").lineLength()).isEqualTo(80);
        assertThatThrownBy(() -> McnpVersion.parse("4.2").lineLength())
                .isInstanceOf(UnsupportedFeatureException.class);
        assertThatThrownBy(() -> McnpVersion.parse("six")).isInstanceOf(IllegalArgumentException.class);
    }
}
