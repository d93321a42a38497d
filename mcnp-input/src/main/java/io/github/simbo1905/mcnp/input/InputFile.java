package io.github.simbo1905.mcnp.input;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A source of input lines: a file on disk or text held in memory, and the file that included
/// it, if any.
public final class InputFile {

    private final String name;
    private final Path path;
    private final String text;
    private final InputFile parent;

    private InputFile(String name, Path path, String text, InputFile parent) {
        this.name = Objects.requireNonNull(name, "name");
        this.path = path;
        this.text = text;
        this.parent = parent;
    }

    public static InputFile of(Path path) {
        Objects.requireNonNull(path, "path");
        return new InputFile(path.toString(), path, null, null);
    }

    /// Text that did not come from a file. Included files resolve against the working directory.
    public static InputFile ofText(String name, String text) {
        return new InputFile(name, null, Objects.requireNonNull(text, "text"), null);
    }

    /// The file a `READ` in this file names, resolved against this file's directory.
    public InputFile include(String fileName) {
        final Path base = path == null ? null : path.toAbsolutePath().getParent();
        final Path resolved = base == null ? Path.of(fileName) : base.resolve(fileName);
        return new InputFile(resolved.toString(), resolved, null, this);
    }

    public String name() {
        return name;
    }

    /// The path on disk, or null for in-memory text.
    public Path path() {
        return path;
    }

    /// The including file, or null for the top level file.
    public InputFile parent() {
        return parent;
    }

    /// Whether this file, or one that included it, is `other`.
    boolean includedFrom(Path other) {
        for (InputFile file = this; file != null; file = file.parent) {
            if (file.path != null && other != null
                    && file.path.toAbsolutePath().normalize().equals(other.toAbsolutePath().normalize())) {
                return true;
            }
        }
        return false;
    }

    /// The lines with tabs expanded and, when asked, every character above the ASCII range
    /// replaced by a space.
    public List<String> readLines(boolean replaceNonAscii) throws IOException {
        final String content = text != null ? text : new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        final String[] raw = content.split("\r?\n", -1);
        final int count = content.endsWith("\n") ? raw.length - 1 : raw.length;
        final var lines = new ArrayList<String>(count);
        for (int i = 0; i < count; i++) {
            String line = expandTabs(raw[i], InputConstants.TAB_SIZE);
            if (replaceNonAscii) {
                line = replaceNonAscii(line);
            }
            lines.add(line);
        }
        return lines;
    }

    static String expandTabs(String line, int tabSize) {
        if (line.indexOf('\t') < 0) {
            return line;
        }
        final var sb = new StringBuilder(line.length() + tabSize);
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            if (c == '\t') {
                final int pad = tabSize - sb.length() % tabSize;
                sb.append(" ".repeat(pad));
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    static String replaceNonAscii(String line) {
        final var sb = new StringBuilder(line.length());
        for (int i = 0; i < line.length(); i++) {
            final char c = line.charAt(i);
            sb.append(c > InputConstants.ASCII_CEILING ? ' ' : c);
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return name;
    }
}
