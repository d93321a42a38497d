package io.github.simbo1905.mcnp.input;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputDeckTest extends InputTestBase {

    private static final String DECK = String.join("\n",
            "MESSAGE: datapath=/data",
            "",
            "Simple sphere",
            "c the only cell with material",
            "1 1 -2.7 -1 imp:n=1 $ inside",
            "2 0 1 imp:n=0",
            "",
            "1 so 5.0",
            "",
            "m1 1001.80c 2 8016.80c 1",
            "mt1 lwtr.10t",
            "vol 1 1R",
            "nps 1000",
            "");

    private static final InputOptions OPTIONS = new InputOptions(McnpVersion.DEFAULT, false, true);

    @Test
    void unchangedDeckWritesBackVerbatim() {
        final InputDeck deck = new InputDeckReader(OPTIONS).read("sphere.i", DECK);
        assertThat(deck.messageBlock()).isPresent();
        assertThat(deck.title().text()).isEqualTo("Simple sphere");
        assertThat(deck.cells()).hasSize(2);
        assertThat(deck.surfaces()).hasSize(1);
        assertThat(deck.records(BlockType.DATA)).extracting(ParsedRecord::kind).containsExactly(
                RecordKind.MATERIAL, RecordKind.THERMAL, RecordKind.DATA, RecordKind.DATA);
        assertThat(deck.warnings()).isEmpty();
        assertThat(new InputDeckWriter(McnpVersion.DEFAULT).toText(deck)).isEqualTo(DECK);
    }

    @Test
    void editedValueIsWrittenInPlace() {
        final InputDeck deck = new InputDeckReader(OPTIONS).read("sphere.i", DECK);
        final SyntaxNode sphere = deck.surfaces().get(0).tree();
        sphere.get("data", ListNode.class).values().get(0).setValue(7.5);
        final String text = new InputDeckWriter(McnpVersion.DEFAULT).toText(deck);
        assertThat(text).contains("\n1 so 7.5\n");
    }

    @Test
    void malformedRecordStopsTheRead() {
        final String bad = "t\n1 0 -1 )\n\n1 so 5\n\nnps 1\n";
        assertThatThrownBy(() -> new InputDeckReader(OPTIONS).read("bad.i", bad))
                .isInstanceOf(ParsingException.class);
    }

    @Test
    void checkModeKeepsMalformedRecordsAsText() {
        final String bad = "t\n1 0 -1 )\n2 0 1\n\n1 so 5\n\nnps 1\n";
        final InputDeck deck = new InputDeckReader(OPTIONS.withCheckInput(true)).read("bad.i", bad);
        assertThat(deck.cells()).hasSize(2);
        assertThat(deck.cells().get(0).isRaw()).isTrue();
        assertThat(deck.cells().get(1).isRaw()).isFalse();
        assertThat(deck.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.kind()).isEqualTo(InputWarning.Kind.DOWNGRADED_ERROR);
            assertThat(warning.original()).isEqualTo("1 0 -1 )");
        });
        assertThat(new InputDeckWriter(McnpVersion.DEFAULT).toText(deck)).isEqualTo(bad);
    }

    @Test
    void unsupportedFeaturesStopTheReadEvenInCheckMode() {
        final String like = "t\n2 like 1 but imp:n=0\n\n1 so 5\n\nnps 1\n";
        assertThatThrownBy(() -> new InputDeckReader(OPTIONS.withCheckInput(true)).read("like.i", like))
                .isInstanceOf(UnsupportedFeatureException.class);
    }

    @Test
    void readsAndWritesFiles(@TempDir Path dir) throws IOException {
        final Path in = dir.resolve("in.i");
        Files.writeString(in, DECK);
        final InputDeck deck = new InputDeckReader(OPTIONS).read(in);
        final Path out = dir.resolve("out.i");
        new InputDeckWriter(McnpVersion.DEFAULT).write(deck, out);
        assertThat(Files.readString(out)).isEqualTo(DECK);

        final var writer = new StringWriter();
        new InputDeckWriter(McnpVersion.DEFAULT).write(deck, writer);
        assertThat(writer.toString()).isEqualTo(DECK);
    }

    @Test
    void missingFileIsAnIoError(@TempDir Path dir) {
        assertThatThrownBy(() -> new InputDeckReader(OPTIONS).read(dir.resolve("absent.i")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void titleAndMessageAreCutToTheLineLength() {
        final var version = McnpVersion.parse("6.1");
        assertThat(new Title("x".repeat(100)).format(version)).hasSize(79);
        assertThat(new Message(java.util.List.of("y".repeat(100))).format(version))
                .containsExactly("MESSAGE: " + "y".repeat(70), "");
    }
}
