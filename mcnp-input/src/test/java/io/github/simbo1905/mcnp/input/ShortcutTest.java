package io.github.simbo1905.mcnp.input;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ShortcutTest extends InputTestBase {

    private ParsedRecord data(String text) {
        return parse(BlockType.DATA, text);
    }

    private static ListNode list(ParsedRecord record) {
        return record.tree().get("data", ListNode.class);
    }

    private static List<Double> numbers(ListNode list) {
        final var ret = new ArrayList<Double>();
        for (ValueNode value : list.values()) {
            ret.add(value.hasValue() ? value.doubleValue() : null);
        }
        return ret;
    }

    @Test
    void repeatCopiesTheValueBeforeIt() {
        assertThat(numbers(list(data("vol 1 2 3 4R")))).containsExactly(1.0, 2.0, 3.0, 3.0, 3.0, 3.0, 3.0);
    }

    @Test
    void interpolateFillsTheGapEvenly() {
        assertThat(numbers(list(data("vol 1 3I 5")))).containsExactly(1.0, 2.0, 3.0, 4.0, 5.0);
    }

    @Test
    void multiplyScalesTheValueBeforeIt() {
        assertThat(numbers(list(data("vol 1.5 2M")))).containsExactly(1.5, 3.0);
    }

    @Test
    void jumpsHaveNoValue() {
        final ListNode list = list(data("vol 1 1 2J 0"));
        assertThat(numbers(list)).containsExactly(1.0, 1.0, null, null, 0.0);
        assertThat(list.shortcuts()).singleElement()
                .satisfies(shortcut -> assertThat(shortcut.type()).isEqualTo(Shortcut.JUMP));
    }

    @Test
    void unchangedValuesKeepTheirShorthand() {
        final ParsedRecord record = data("vol 1 2 3 4R");
        final ListNode list = list(record);
        list.updateWithNewValues(list.values());
        assertThat(record.tree().format()).isEqualTo("vol 1 2 3 4R");
    }

    @Test
    void repeatTakesInAMatchingNewValue() {
        final ParsedRecord record = data("vol 1 2 3 4R");
        final ListNode list = list(record);
        final var values = new ArrayList<>(list.values());
        values.add(new ValueNode("3", ValueType.REAL));
        list.updateWithNewValues(values);
        assertThat(record.tree().format()).isEqualTo("vol 1 2 3 5R");
    }

    @Test
    void freshValuesGainJumpsForMissingRuns() {
        final var list = new ListNode("data");
        list.updateWithNewValues(List.of(
                new ValueNode("1", ValueType.REAL),
                new ValueNode("1", ValueType.REAL),
                ValueNode.jump(),
                ValueNode.jump(),
                new ValueNode("0", ValueType.REAL)));
        assertThat(list.format()).isEqualTo("1 1 2J 0");
    }

    @Test
    void trailingNewJumpIsDropped() {
        final var list = new ListNode("data");
        list.updateWithNewValues(List.of(new ValueNode("1", ValueType.REAL), ValueNode.jump()));
        assertThat(list.nodes()).hasSize(1);
        assertThat(list.format()).isEqualTo("1");
    }

    @ParameterizedTest
    @ValueSource(strings = {"vol 1 2I 4 2I 10", "vol 1 3I 5 3R"})
    void shortcutAfterAnInterpolateKeepsItsSpacing(String text) {
        final ParsedRecord record = data(text);
        assertThat(record.tree().format()).isEqualTo(text);
        final ListNode list = list(record);
        list.updateWithNewValues(list.values());
        assertThat(record.tree().format()).isEqualTo(text);
    }

    @Test
    void editInsideAnInterpolateSpellsOutTheRest() {
        final ParsedRecord record = data("vol 1 9I 11");
        final ListNode list = list(record);
        final List<ValueNode> values = list.values();
        values.get(5).setValue(100.0);
        list.updateWithNewValues(values);
        final String written = record.tree().format();
        assertThat(written).startsWith("vol 1 3I 5");
        assertThat(numbers(list(data(written))))
                .containsExactly(1.0, 2.0, 3.0, 4.0, 5.0, 100.0, 7.0, 8.0, 9.0, 10.0, 11.0);
    }

    @Test
    void editedMultiplyProductChangesTheFactor() {
        final ParsedRecord record = data("vol 2 3M 1");
        final ListNode list = list(record);
        final List<ValueNode> values = list.values();
        values.get(1).setValue(8.0);
        list.updateWithNewValues(values);
        final String written = record.tree().format();
        assertThat(written).contains("4M");
        assertThat(numbers(list(data(written)))).containsExactly(2.0, 8.0, 1.0);
    }

    @Test
    void splitJumpOfOneIsWrittenWithoutACount() {
        final ParsedRecord record = data("vol 1 3J 5");
        final ListNode list = list(record);
        final List<ValueNode> values = list.values();
        values.get(2).setValue(7.0);
        list.updateWithNewValues(values);
        assertThat(record.tree().format()).isEqualTo("vol 1 J 7 J 5");
    }

    @Test
    void explicitCountOfOneIsKept() {
        final ParsedRecord record = data("vol 1 1J 5");
        final ListNode list = list(record);
        list.updateWithNewValues(list.values());
        assertThat(record.tree().format()).isEqualTo("vol 1 1J 5");
    }

    @Test
    void shortcutThatBecomesLastHasNoTrailingSpace() {
        final ParsedRecord record = data("vol 1 3J 5");
        final ListNode list = list(record);
        final List<ValueNode> values = list.values();
        values.get(2).setValue(7.0);
        list.updateWithNewValues(values);
        assertThat(record.tree().format()).isEqualTo("vol 1 J 7 J 5");

        final var shorter = new ArrayList<>(list.values());
        shorter.remove(shorter.size() - 1);
        list.updateWithNewValues(shorter);
        assertThat(record.tree().format()).isEqualTo("vol 1 J 7 J");
    }

    @Test
    void repeatWithNothingBeforeItIsAnError() {
        assertThatThrownBy(() -> data("vol 2R")).isInstanceOf(ParsingException.class);
    }

    @Test
    void punctuatedListsCannotBeRebuilt() {
        final ListNode bins = data("f4:n 1 2 (3 4) T").tree().get("tally", ListNode.class);
        assertThatThrownBy(() -> bins.updateWithNewValues(bins.values()))
                .isInstanceOf(IllegalStateException.class);
    }
}
