package io.github.simbo1905.mcnp.input;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordParserTest extends InputTestBase {

    static Stream<Arguments> records() {
        return Stream.of(
                Arguments.of(BlockType.CELL, "1 0 -1 2 imp:n=1", RecordKind.CELL),
                Arguments.of(BlockType.CELL, "10 1 -2.7 -1 2 #(3 : 4) imp:n=1 $ cell", RecordKind.CELL),
                Arguments.of(BlockType.CELL, "2 0 -1\n     imp:n=0", RecordKind.CELL),
                Arguments.of(BlockType.CELL, "c leading note\n3 0 -3 #2", RecordKind.CELL),
                Arguments.of(BlockType.CELL, "c only a comment\nc and another", RecordKind.COMMENT),
                Arguments.of(BlockType.SURFACE, "1 so 5.0", RecordKind.SURFACE),
                Arguments.of(BlockType.SURFACE, "*3 2 c/z 0 0 1.5", RecordKind.SURFACE),
                Arguments.of(BlockType.DATA, "imp:n 1 1 0", RecordKind.DATA),
                Arguments.of(BlockType.DATA, "vol 1 2 3 4R", RecordKind.DATA),
                Arguments.of(BlockType.DATA, "vol 1 2I 4 2I 10", RecordKind.DATA),
                Arguments.of(BlockType.DATA, "vol 1 3I 5 3R", RecordKind.DATA),
                Arguments.of(BlockType.DATA, "m1 1001.80c 2 8016.80c 1 nlib=80c", RecordKind.MATERIAL),
                Arguments.of(BlockType.DATA, "mt1 lwtr.10t", RecordKind.THERMAL),
                Arguments.of(BlockType.DATA, "f4:n 1 2 (3 4) T", RecordKind.TALLY),
                Arguments.of(BlockType.DATA, "sdef pos=0 0 0 erg=d1 par=n", RecordKind.PARAM_ONLY));
    }

    @ParameterizedTest
    @MethodSource("records")
    void unchangedRecordsFormatToTheirText(BlockType block, String text, RecordKind kind) {
        final ParsedRecord record = parse(block, text);
        assertThat(record.kind()).isEqualTo(kind);
        assertThat(record.tree().format()).isEqualTo(text);
    }

    @Test
    void cellExposesItsParts() {
        final SyntaxNode tree = parse(BlockType.CELL, "10 1 -2.7 -1 2 imp:n=1").tree();
        assertThat(tree.get("cell_num", ValueNode.class).longValue()).isEqualTo(10L);
        final SyntaxNode material = tree.get("material", SyntaxNode.class);
        assertThat(material.get("mat_number", ValueNode.class).longValue()).isEqualTo(1L);
        assertThat(material.get("density", ValueNode.class).doubleValue()).isEqualTo(-2.7);
        assertThat(tree.get("parameters", ParametersNode.class).contains("IMP:N")).isTrue();
    }

    @Test
    void changedCellNumberKeepsTheRestOfTheLine() {
        final ParsedRecord record = parse(BlockType.CELL, "1 0 -1 2 imp:n=1 $ keep me");
        record.tree().get("cell_num", ValueNode.class).setValue(7L);
        assertThat(record.tree().format()).isEqualTo("7 0 -1 2 imp:n=1 $ keep me");
    }

    @Test
    void duplicateParameterIsRejected() {
        assertThatThrownBy(() -> parse(BlockType.CELL, "1 0 -1 imp:n=1 imp:n=2"))
                .isInstanceOf(RedundantParameterException.class)
                .hasMessageContaining("imp:n");
    }

    @Test
    void likeButIsUnsupported() {
        assertThatThrownBy(() -> parse(BlockType.CELL, "2 like 1 but imp:n=0"))
                .isInstanceOf(UnsupportedFeatureException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {"1 0 -1 )", "x 0 -1"})
    void syntaxErrorsAreReportedWithTheRecord(String text) {
        assertThatThrownBy(() -> parse(BlockType.CELL, text))
                .isInstanceOfSatisfying(ParsingException.class, e -> {
                    assertThat(e.problems()).isNotEmpty();
                    assertThat(e.record().text()).isEqualTo(text);
                })
                .hasMessageContaining("Error parsing the cell block input.")
                .hasMessageContaining(text);
    }

    @Test
    void readDirectiveNamesItsFile() {
        final ParsedRecord record = parser.parse(InputRecord.of(BlockType.CELL, "read file=cells.i noecho"));
        assertThat(record.kind()).isEqualTo(RecordKind.READ);
        assertThat(ReadGrammar.fileName(record.tree())).isEqualTo("cells.i");
        assertThat(record.tree().format()).isEqualTo("read file=cells.i noecho");
    }

    @Test
    void longLinesAreWrappedOnOutput() {
        final var version = McnpVersion.parse("5.1.60");
        final String text = "vol" + " 1.0".repeat(30);
        final var captured = InputWarnings.capture(() -> parse(BlockType.DATA, text).format(version));
        assertThat(captured.value()).hasSizeGreaterThan(1);
        assertThat(captured.value()).allSatisfy(line -> assertThat(line.length()).isLessThanOrEqualTo(80));
        assertThat(captured.value().get(1)).startsWith("     1.0");
        assertThat(captured.warnings()).extracting(InputWarning::kind).containsExactly(InputWarning.Kind.LINE_WRAPPED);
    }
}
