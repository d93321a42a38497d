package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// A run of layout between meaningful tokens: whitespace, newlines and comments, in input order.
///
/// Newlines are kept as separate `"\n"` fragments so layout can be reasoned about line by line.
public final class PaddingNode implements SyntaxNodeBase {

    /// One piece of padding: layout text or a comment.
    public sealed interface Fragment permits Text, CommentNode {
        String format();
    }

    /// Whitespace or other non-comment layout text such as `&`, `(` or `=`.
    public record Text(String text) implements Fragment {
        public Text {
            Objects.requireNonNull(text, "text");
        }

        @Override
        public String format() {
            return text;
        }

        public boolean isNewline() {
            return "\n".equals(text);
        }
    }

    private static final Text NEWLINE = new Text("\n");

    private final List<Fragment> nodes = new ArrayList<>();

    public PaddingNode() {}

    public PaddingNode(String token) {
        this(token, false);
    }

    public PaddingNode(String token, boolean isComment) {
        if (token != null) {
            append(token, isComment);
        }
    }

    public void append(String value) {
        append(value, false);
    }

    /// Appends text, splitting it on newlines, or a new comment when `isComment` is set.
    public void append(String value, boolean isComment) {
        Objects.requireNonNull(value, "value");
        if (isComment) {
            nodes.add(new CommentNode(value));
            return;
        }
        final String[] parts = value.split("\n", -1);
        if (parts.length == 1) {
            nodes.add(new Text(value));
            return;
        }
        for (int i = 0; i < parts.length - 1; i++) {
            if (!parts[i].isEmpty()) {
                nodes.add(new Text(parts[i]));
            }
            nodes.add(NEWLINE);
        }
        if (!parts[parts.length - 1].isEmpty()) {
            nodes.add(new Text(parts[parts.length - 1]));
        }
    }

    public void append(Fragment fragment) {
        if (fragment instanceof Text text) {
            append(text.text());
        } else {
            nodes.add(fragment);
        }
    }

    /// Appends every fragment of `other`.
    public void appendAll(PaddingNode other) {
        nodes.addAll(other.nodes);
    }

    public List<Fragment> fragments() {
        return nodes;
    }

    /// All of the padding as one string.
    public String value() {
        return format();
    }

    /// True when fragment `i` is whitespace other than a lone newline.
    /// @throws IndexOutOfBoundsException if there is no fragment `i`
    public boolean isSpace(int i) {
        final Fragment fragment = nodes.get(i);
        if (!(fragment instanceof Text text)) {
            return false;
        }
        return text.text().isBlank() && !text.isNewline();
    }

    public boolean isNewline(int i) {
        return nodes.get(i) instanceof Text text && text.isNewline();
    }

    /// Whether any fragment is syntactically significant whitespace.
    public boolean hasSpace() {
        for (int i = 0; i < nodes.size(); i++) {
            if (isSpace(i)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String name() {
        return "padding";
    }

    @Override
    public String format() {
        final var sb = new StringBuilder();
        for (Fragment fragment : nodes) {
            sb.append(fragment.format());
        }
        return sb.toString();
    }

    @Override
    public List<CommentNode> comments() {
        final var ret = new ArrayList<CommentNode>();
        for (Fragment fragment : nodes) {
            if (fragment instanceof CommentNode comment) {
                ret.add(comment);
            }
        }
        return ret;
    }

    @Override
    public List<SyntaxNodeBase> flatten() {
        return List.of(this);
    }

    @Override
    public int size() {
        return nodes.size();
    }

    /// Removes the fragments from index `from` on and returns them as a padding node of their own.
    /// @throws IndexOutOfBoundsException if `from` is past the end
    public PaddingNode cut(int from) {
        final var tail = nodes.subList(from, nodes.size());
        final var ret = new PaddingNode();
        ret.nodes.addAll(tail);
        tail.clear();
        return ret;
    }

    private int firstLineComment() {
        for (int i = 0; i < nodes.size(); i++) {
            if (nodes.get(i) instanceof CommentNode comment && !comment.isDollar()) {
                return i;
            }
        }
        return -1;
    }

    @Override
    public List<Fragment> trailingComment() {
        final int i = firstLineComment();
        if (i < 0) {
            return List.of();
        }
        return List.copyOf(nodes.subList(i, nodes.size()));
    }

    @Override
    public void deleteTrailingComment() {
        final int i = firstLineComment();
        if (i >= 0) {
            nodes.subList(i, nodes.size()).clear();
        }
    }

    @Override
    public void grabBeginningComment(List<Fragment> extra) {
        if (extra == null || extra.isEmpty()) {
            return;
        }
        final var head = new ArrayList<>(extra);
        if (!(head.get(head.size() - 1) instanceof Text text && text.isNewline())) {
            head.add(NEWLINE);
        }
        nodes.addAll(0, head);
    }

    /// Whether the last comment here is a `$` comment that would turn whatever follows on the
    /// same line into comment text.
    public boolean hasGraveyardComment() {
        int last = -1;
        for (int i = nodes.size() - 1; i >= 0; i--) {
            if (nodes.get(i) instanceof CommentNode) {
                last = i;
                break;
            }
        }
        if (last < 0) {
            return false;
        }
        if (last == nodes.size() - 1) {
            return !nodes.get(last).format().endsWith("\n");
        }
        for (int i = last + 1; i < nodes.size(); i++) {
            if (isNewline(i)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public PaddingNode copyWith(NodeCopier copier) {
        final var copy = new PaddingNode();
        for (Fragment fragment : nodes) {
            copy.nodes.add(fragment instanceof CommentNode comment ? copier.copy(comment) : fragment);
        }
        return copy;
    }


    @Override
    public String toString() {
        return "(Padding, " + nodes + ")";
    }
}
