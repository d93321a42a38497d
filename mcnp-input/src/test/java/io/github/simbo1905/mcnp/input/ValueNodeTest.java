package io.github.simbo1905.mcnp.input;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ValueNodeTest extends InputTestBase {

    @Test
    void unchangedValueKeepsItsToken() {
        final var node = new ValueNode("1.50", ValueType.REAL, new PaddingNode(" "));
        node.setValue(1.5 + 1e-12);
        assertThat(node.valueChanged()).isFalse();
        assertThat(node.format()).isEqualTo("1.50 ");
    }

    @Test
    void changedFixedValueKeepsPrecisionAndWidth() {
        final var node = new ValueNode("1.50", ValueType.REAL, new PaddingNode(" "));
        node.setValue(2.5);
        assertThat(node.format()).isEqualTo("2.50 ");
    }

    @Test
    void changedScientificValueKeepsExponentStyle() {
        final var node = new ValueNode("1.0e+02", ValueType.REAL);
        node.setValue(250.0);
        assertThat(node.format()).isEqualTo("2.5e+02");
    }

    @Test
    void negativeTokenLeavesRoomForTheSign() {
        final var node = new ValueNode("-1", ValueType.INTEGER, new PaddingNode(" "));
        node.setValue(2L);
        assertThat(node.format()).isEqualTo(" 2 ");
    }

    @Test
    void widerValueWarnsAboutExpansion() {
        final var node = new ValueNode("1", ValueType.INTEGER, new PaddingNode(" "));
        node.setValue(1000L);
        final var captured = InputWarnings.capture(() -> node.format());
        assertThat(captured.value()).isEqualTo("1000 ");
        assertThat(captured.warnings()).extracting(InputWarning::kind)
                .containsExactly(InputWarning.Kind.LINE_EXPANSION);
    }

    @Test
    void negatableIdentifierStoresMagnitude() {
        final var node = new ValueNode("-3", ValueType.INTEGER);
        node.setNegatableIdentifier(true);
        assertThat(node.longValue()).isEqualTo(3L);
        assertThat(node.isNegative()).isTrue();
        assertThat(node.printValue()).isEqualTo(-3L);
        assertThat(node.format()).isEqualTo("-3");
    }

    @Test
    void integralRealBecomesIdentifier() {
        final var node = new ValueNode("4.0", ValueType.REAL);
        node.setNegatableIdentifier(true);
        assertThat(node.type()).isEqualTo(ValueType.INTEGER);
        assertThat(node.longValue()).isEqualTo(4L);

        final var fraction = new ValueNode("4.5", ValueType.REAL);
        assertThatThrownBy(() -> fraction.setNegatableIdentifier(true))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void jumpHasNoValue() {
        final var jump = ValueNode.jump();
        assertThat(jump.isJump()).isTrue();
        assertThat(jump.hasValue()).isFalse();
        assertThat(jump.format()).isEqualTo("J");
    }

    @Test
    void valueEqualsUsesTolerance() {
        final var node = new ValueNode("1.0", ValueType.REAL);
        assertThat(node.valueEquals(1.0 + 1e-12)).isTrue();
        assertThat(node.valueEquals(1.001)).isFalse();
        assertThat(node.valueEquals(1L)).isFalse();
        assertThatThrownBy(() -> node.valueEquals(new Object())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void badTokenIsRejected() {
        assertThatThrownBy(() -> new ValueNode("abc", ValueType.REAL)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ValueNode("1.5", ValueType.INTEGER)).isInstanceOf(IllegalArgumentException.class);
    }
}
