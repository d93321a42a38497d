package io.github.simbo1905.mcnp.input;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BlockReaderTest extends InputTestBase {

    private static final InputOptions OPTIONS = new InputOptions(McnpVersion.DEFAULT, false, true);

    private static List<InputRecord> drain(BlockReader reader) {
        final var records = new ArrayList<InputRecord>();
        reader.forEachRemaining(records::add);
        return records;
    }

    private static BlockReader reader(String text, InputOptions options) throws IOException {
        return new BlockReader(InputFile.ofText("test.i", text), options);
    }

    @Test
    void readsMessageTitleAndBlocks() throws IOException {
        final String text = String.join("\n",
                "MESSAGE: datapath=/x",
                "  more",
                "",
                "Title line",
                "1 0 -1 imp:n=1",
                "2 0 1 &",
                "     imp:n=0",
                "c trailing comment",
                "",
                "1 so 5.0",
                "",
                "nps 100",
                "");
        final BlockReader reader = reader(text, OPTIONS);
        assertThat(reader.message()).hasValueSatisfying(message ->
                assertThat(message.lines()).containsExactly("datapath=/x", "  more"));
        assertThat(reader.title().text()).isEqualTo("Title line");

        final List<InputRecord> records = drain(reader);
        assertThat(records).extracting(InputRecord::blockType).containsExactly(
                BlockType.CELL, BlockType.CELL, BlockType.SURFACE, BlockType.DATA);
        assertThat(records.get(0).lines()).containsExactly("1 0 -1 imp:n=1");
        assertThat(records.get(0).lineNumber()).isEqualTo(5);
        assertThat(records.get(1).lines()).containsExactly("2 0 1 &", "     imp:n=0", "c trailing comment");
        assertThat(records.get(1).lineNumber()).isEqualTo(6);
        assertThat(records.get(3).text()).isEqualTo("nps 100");
    }

    @Test
    void missingTitleIsEmpty() throws IOException {
        final BlockReader reader = reader("", OPTIONS);
        assertThat(reader.message()).isEmpty();
        assertThat(reader.title().text()).isEmpty();
        assertThat(reader.hasNext()).isFalse();
    }

    @Test
    void ampersandContinuesAtAnyColumn() throws IOException {
        final List<InputRecord> records = drain(reader("t\n1 0 -1 &\nimp:n=1\n2 0 1\n", OPTIONS));
        assertThat(records).extracting(InputRecord::text).containsExactly("1 0 -1 &\nimp:n=1", "2 0 1");
    }

    @Test
    void contentAfterTheDataBlockIsIgnoredOnce() throws IOException {
        final String text = "t\n1 0 -1\n\n1 so 5\n\nnps 1\n\njunk\nmore junk\n";
        final var captured = InputWarnings.capture(() -> {
            try {
                return drain(reader(text, OPTIONS));
            } catch (IOException e) {
                throw new java.io.UncheckedIOException(e);
            }
        });
        assertThat(captured.value()).extracting(InputRecord::text).containsExactly("1 0 -1", "1 so 5", "nps 1");
        assertThat(captured.warnings()).extracting(InputWarning::kind).containsExactly(InputWarning.Kind.EXTRA_BLOCK);
    }

    @Test
    void overlongLinesAreCutUnlessACommentStartsInside() throws IOException {
        final var options = OPTIONS.withVersion(McnpVersion.parse("5.1.60"));
        final String cut = "1 0 -1" + " ".repeat(80) + "2";
        final String kept = "2 0 -2 $ " + "x".repeat(100);
        final var captured = InputWarnings.capture(() -> {
            try {
                return drain(reader("t\n" + cut + "\n" + kept + "\n", options));
            } catch (IOException e) {
                throw new java.io.UncheckedIOException(e);
            }
        });
        assertThat(captured.value()).extracting(InputRecord::text).containsExactly("1 0 -1", kept);
        assertThat(captured.warnings()).singleElement().satisfies(warning -> {
            assertThat(warning.kind()).isEqualTo(InputWarning.Kind.LINE_OVERRUN);
            assertThat(warning.original()).isEqualTo(cut);
        });
    }

    @Test
    void verticalFormatIsUnsupported() throws IOException {
        final BlockReader reader = reader("t\n1 0 -1\n\n1 so 5\n\n#    imp:n\n     1 1\n", OPTIONS);
        assertThat(reader.next().text()).isEqualTo("1 0 -1");
        assertThat(reader.next().text()).isEqualTo("1 so 5");
        assertThatThrownBy(reader::next)
                .isInstanceOf(UnsupportedFeatureException.class)
                .hasMessageContaining("Vertical Input format");
    }

    @Test
    void readSplicesTheNamedFileAfterTheCurrentOne(@TempDir Path dir) throws IOException {
        Files.writeString(dir.resolve("cells.i"), "2 0 -2\n3 0 -3\n");
        final Path main = dir.resolve("main.i");
        Files.writeString(main, "title\n1 0 -1\nread file=cells.i\n\n1 so 5\n\nnps 1\n");

        final List<InputRecord> records = drain(new BlockReader(InputFile.of(main), OPTIONS));
        assertThat(records).extracting(InputRecord::text)
                .containsExactly("1 0 -1", "1 so 5", "nps 1", "2 0 -2", "3 0 -3");
        assertThat(records.get(3).blockType()).isEqualTo(BlockType.CELL);
        assertThat(records.get(3).source()).endsWith("cells.i");
        assertThat(records.get(4).lineNumber()).isEqualTo(2);
    }

    @Test
    void fileThatReadsItselfIsRejected(@TempDir Path dir) throws IOException {
        final Path main = dir.resolve("main.i");
        Files.writeString(main, "title\n1 0 -1\nread file=main.i\n");
        final BlockReader reader = new BlockReader(InputFile.of(main), OPTIONS);
        assertThat(reader.next().text()).isEqualTo("1 0 -1");
        assertThatThrownBy(reader::next)
                .isInstanceOf(MalformedInputException.class)
                .hasMessageContaining("includes itself");
    }

    @Test
    void missingIncludedFileFailsWithItsName(@TempDir Path dir) throws IOException {
        final Path main = dir.resolve("main.i");
        Files.writeString(main, "title\nread file=absent.i\n");
        final BlockReader reader = new BlockReader(InputFile.of(main), OPTIONS);
        assertThatThrownBy(reader::hasNext)
                .isInstanceOf(java.io.UncheckedIOException.class)
                .hasMessageContaining("absent.i");
    }

    @Test
    void tabsExpandAndNonAsciiIsReplaced() throws IOException {
        final List<InputRecord> records = drain(reader("t\n1\t0 -1 $ café\n", OPTIONS));
        assertThat(records.get(0).text()).isEqualTo("1       0 -1 $ caf");
    }
}
