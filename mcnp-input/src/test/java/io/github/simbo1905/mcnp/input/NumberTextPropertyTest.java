package io.github.simbo1905.mcnp.input;

import net.jqwik.api.Assume;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;

import static org.assertj.core.api.Assertions.assertThat;

/// Number text written by the formatter reads back as the same number.
class NumberTextPropertyTest extends InputLoggingConfig {

    @Property(tries = 500)
    void shortestTextReadsBack(@ForAll double value) {
        Assume.that(Double.isFinite(value));
        final String text = NumberFormat.shortest(value);
        assertThat(FortranNumbers.parseReal(text)).hasValue(value);
    }

    @Property(tries = 300)
    void integerTokensFormatUnchanged(@ForAll long value) {
        final String token = Long.toString(value);
        final var node = new ValueNode(token, ValueType.INTEGER, new PaddingNode(" "));
        node.setValue(value);
        assertThat(node.format()).isEqualTo(token + " ");
    }

    @Property(tries = 300)
    void changedIntegersStayReadable(@ForAll int original, @ForAll int updated) {
        final var node = new ValueNode(Integer.toString(original), ValueType.INTEGER);
        node.setValue((long) updated);
        final String text = node.format().strip();
        assertThat(FortranNumbers.parseInteger(text)).hasValue(updated);
    }
}
