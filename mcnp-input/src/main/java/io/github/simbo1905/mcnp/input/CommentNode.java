package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/// A comment: either one or more `c` comment lines, or a single `$` comment.
public final class CommentNode implements SyntaxNodeBase, PaddingNode.Fragment {

    private static final Pattern MATCHER = Pattern.compile(
            "(?<delim>(\\s{0," + (InputConstants.CONTINUE_INDENT - 1) + "}c\\s?)|(\\$\\s?))(?<contents>.*)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /// One comment line split into its delimiter (`c `, `$ `) and the free text after it.
    public record Line(String delimiter, String contents) {
        public Line {
            Objects.requireNonNull(delimiter, "delimiter");
            Objects.requireNonNull(contents, "contents");
        }

        String format() {
            return delimiter + contents;
        }
    }

    private final boolean dollar;
    private final List<Line> lines = new ArrayList<>();

    /// Whether a whole line is a `c` comment line: the first non-blank character sits in the first
    /// five columns, is a `c` and is followed by whitespace or the end of the line.
    public static boolean isCommentLine(String line) {
        return commentStart(line, 0) >= 0;
    }

    /// Index of the `c` that opens a comment line starting at `lineStart`, or -1.
    static int commentStart(String text, int lineStart) {
        int i = lineStart;
        while (i < text.length() && text.charAt(i) == ' ') {
            i++;
        }
        if (i - lineStart >= InputConstants.CONTINUE_INDENT || i >= text.length()) {
            return -1;
        }
        final char c = text.charAt(i);
        if (c != 'c' && c != 'C') {
            return -1;
        }
        if (i + 1 < text.length() && !Character.isWhitespace(text.charAt(i + 1))) {
            return -1;
        }
        return i;
    }

    public CommentNode(String token) {
        Objects.requireNonNull(token, "token");
        final Line line = split(token);
        this.dollar = line.delimiter().contains("$");
        lines.add(line);
    }

    private CommentNode(boolean dollar, List<Line> lines) {
        this.dollar = dollar;
        this.lines.addAll(lines);
    }

    private static Line split(String token) {
        final var m = MATCHER.matcher(token);
        if (m.matches()) {
            return new Line(m.group("delim"), m.group("contents"));
        }
        return new Line(token, "");
    }

    /// Adds another `c` line to this comment.
    /// @throws IllegalArgumentException when either this or the new line is a `$` comment
    public void append(String token) {
        final Line line = split(token);
        if (dollar || line.delimiter().contains("$")) {
            throw new IllegalArgumentException("Cannot append multiple comments to a dollar comment. " + token + " given.");
        }
        lines.add(line);
    }

    public boolean isDollar() {
        return dollar;
    }

    /// The comment text without delimiters, one line per comment line.
    public String contents() {
        return lines.stream().map(Line::contents).collect(Collectors.joining("\n"));
    }

    public List<Line> lines() {
        return List.copyOf(lines);
    }

    @Override
    public String name() {
        return "comment";
    }

    @Override
    public String format() {
        final var sb = new StringBuilder();
        for (Line line : lines) {
            sb.append(line.format());
        }
        return sb.toString();
    }

    @Override
    public List<CommentNode> comments() {
        return List.of(this);
    }

    @Override
    public List<SyntaxNodeBase> flatten() {
        return List.of(this);
    }

    @Override
    public int size() {
        return lines.size();
    }

    @Override
    public List<PaddingNode.Fragment> trailingComment() {
        return List.of();
    }

    @Override
    public void deleteTrailingComment() {
        // a comment holds no trailing comment of its own
    }

    @Override
    public void grabBeginningComment(List<PaddingNode.Fragment> extra) {
        // comments do not absorb other comments
    }

    @Override
    public CommentNode copyWith(NodeCopier copier) {
        return new CommentNode(dollar, lines);
    }


    @Override
    public String toString() {
        return "COMMENT: " + format();
    }
}
