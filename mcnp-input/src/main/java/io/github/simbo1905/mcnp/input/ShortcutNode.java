package io.github.simbo1905.mcnp.input;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// A shorthand such as `3R`, `2J`, `4I` or `2M` together with the values it expands to.
///
/// The members are the values the shortcut stands for. For a repeat, multiply or interpolate the
/// first member is the explicit value written before the shortcut, unless that value belongs to
/// the shortcut before this one, in which case the start is borrowed from it (`1 2R 3R`).
public final class ShortcutNode extends ListNode {

    private static final Logger LOG = Logger.getLogger(ShortcutNode.class.getName());

    private static final Pattern COUNT = Pattern.compile("^(\\d*)(.*)$");
    private static final Pattern FACTOR = Pattern.compile("^(.*?)([mM])$");

    private final Shortcut type;
    private final String originalToken;
    private final String letters;
    private final ValueNode numNode;
    private final boolean synthetic;
    private final List<ValueNode> members = new ArrayList<>();
    private ValueNode startNode;
    private ShortcutNode borrowedFrom;
    private PaddingNode endPadding;
    private PaddingNode interpolatePadding;
    private ValueType dataType;
    // interpolation grid, in log10 space for a log interpolate
    private double begin;
    private double spacing;
    private long firstStep;
    private long lastStep;
    private boolean capacityBorrowed;

    private ShortcutNode(Shortcut type, String originalToken, ValueNode numNode, boolean synthetic) {
        super("shortcut");
        this.type = Objects.requireNonNull(type, "type");
        this.originalToken = originalToken;
        this.numNode = numNode;
        this.synthetic = synthetic;
        this.letters = lettersOf(type, originalToken);
    }

    private static String lettersOf(Shortcut type, String token) {
        if (token == null) {
            return type.letter().toUpperCase(Locale.ROOT);
        }
        if (type == Shortcut.MULTIPLY) {
            return token.substring(token.length() - 1);
        }
        final var m = COUNT.matcher(token);
        return m.matches() ? m.group(2) : type.letter().toUpperCase(Locale.ROOT);
    }

    private static String countOf(String token) {
        final var m = COUNT.matcher(token);
        return m.matches() && !m.group(1).isEmpty() ? m.group(1) : null;
    }

    private static int count(String digits) {
        return digits == null ? 1 : Integer.parseInt(digits);
    }

    /// `nJ`: n values left at their defaults.
    public static ShortcutNode jump(String word) {
        final String digits = countOf(word);
        final var node = new ShortcutNode(Shortcut.JUMP, word, countNode(digits), false);
        for (int i = 0; i < count(digits); i++) {
            node.members.add(ValueNode.jump());
        }
        node.dataType = ValueType.REAL;
        return node;
    }

    /// `x nR`: the start value followed by n more copies of it.
    /// @param start the value before the shortcut, or the shortcut whose last value is repeated
    /// @throws IllegalArgumentException if there is no value to repeat
    public static ShortcutNode repeat(String word, SyntaxNodeBase start) {
        final String digits = countOf(word);
        final var node = new ShortcutNode(Shortcut.REPEAT, word, countNode(digits), false);
        final ValueNode last = node.takeStart(start, "Repeat");
        for (int i = 0; i < count(digits); i++) {
            node.members.add(detachedCopy(last));
        }
        StructuredLog.finest(LOG, "shortcut_expanded", "type", Shortcut.REPEAT, "word", word, "members", node.members.size());
        return node;
    }

    /// `x fM`: the start value followed by the start value times f.
    /// @throws IllegalArgumentException if there is no value to multiply
    public static ShortcutNode multiply(String word, SyntaxNodeBase start) {
        final var m = FACTOR.matcher(word);
        if (!m.matches() || FortranNumbers.parseReal(m.group(1)).isEmpty()) {
            throw new IllegalArgumentException("Not a multiply shortcut: " + word);
        }
        final double factor = FortranNumbers.parseReal(m.group(1)).getAsDouble();
        final var node = new ShortcutNode(Shortcut.MULTIPLY, word, new ValueNode(m.group(1), ValueType.REAL, null, true), false);
        final ValueNode last = node.takeStart(start, "Multiply");
        if (!last.type().isNumeric()) {
            throw new IllegalArgumentException("Multiply requires a numeric value. " + last.value() + " given.");
        }
        final ValueNode product = detachedCopy(last);
        if (last.type() == ValueType.INTEGER && factor == Math.rint(factor)) {
            product.setValue(last.longValue() * (long) factor);
        } else {
            if (product.type() == ValueType.INTEGER) {
                throw new IllegalArgumentException("Multiply of an integer requires an integral factor. " + word + " given.");
            }
            product.setValue(last.doubleValue() * factor);
        }
        node.members.add(product);
        return node;
    }

    /// `a nI b` or `a nILOG b`: n values evenly spaced between a and b, then b itself.
    /// @param middle the layout between the shortcut word and the end value
    /// @param integers truncate the interior values to integers
    /// @throws IllegalArgumentException if the bounds are missing or not usable
    public static ShortcutNode interpolate(String word, SyntaxNodeBase start, PaddingNode middle, ValueNode end, boolean integers) {
        final Shortcut type = Shortcut.ofWord(word);
        if (type == null || !type.isInterpolate()) {
            throw new IllegalArgumentException("Not an interpolate shortcut: " + word);
        }
        Objects.requireNonNull(end, "Interpolate requires an end value");
        final String digits = countOf(word);
        final var node = new ShortcutNode(type, word, countNode(digits), false);
        final ValueNode first = node.takeStart(start, "Interpolate");
        if (!first.type().isNumeric() || !end.type().isNumeric() || !end.hasValue()) {
            throw new IllegalArgumentException("Interpolate requires numeric bounds.");
        }
        final boolean log = type == Shortcut.LOG_INTERPOLATE;
        if (log && (first.doubleValue() <= 0.0 || end.doubleValue() <= 0.0)) {
            throw new IllegalArgumentException("Log interpolate requires positive bounds. "
                    + first.value() + " and " + end.value() + " given.");
        }
        final int steps = count(digits);
        node.begin = log ? Math.log10(first.doubleValue()) : first.doubleValue();
        final double stop = log ? Math.log10(end.doubleValue()) : end.doubleValue();
        node.spacing = (stop - node.begin) / (steps + 1);
        node.dataType = integers ? ValueType.INTEGER : ValueType.REAL;
        for (int i = 1; i <= steps; i++) {
            final double v = node.gridValue(i);
            node.members.add(integers
                    ? new ValueNode(Long.toString((long) v), ValueType.INTEGER)
                    : new ValueNode(NumberFormat.shortest(v), ValueType.REAL));
        }
        node.members.add(end);
        node.interpolatePadding = middle;
        node.firstStep = node.startBorrowed() ? 1 : 0;
        node.lastStep = steps + 1L;
        StructuredLog.finest(LOG, "shortcut_expanded", "type", type, "word", word, "members", node.members.size());
        return node;
    }

    /// A new shortcut with no source text, used when values are rebuilt.
    static ShortcutNode synthetic(Shortcut type) {
        final var node = new ShortcutNode(type, null, countNode(null), true);
        node.dataType = ValueType.REAL;
        return node;
    }

    /// An empty shortcut of the same kind and spelling, for members cut off from this one.
    ShortcutNode splitOff() {
        final var node = new ShortcutNode(type, originalToken, countNode(null), false);
        node.dataType = dataType;
        return node;
    }

    private static ValueNode countNode(String digits) {
        return new ValueNode(digits, ValueType.INTEGER, null, true);
    }

    private static ValueNode detachedCopy(ValueNode node) {
        final ValueNode copy = new NodeCopier().copy(node);
        copy.setPadding(null);
        return copy;
    }

    private ValueNode takeStart(SyntaxNodeBase start, String what) {
        final ValueNode value;
        if (start instanceof ShortcutNode previous) {
            if (previous.members.isEmpty() || previous.type == Shortcut.JUMP) {
                throw new IllegalArgumentException(what + " cannot follow a jump.");
            }
            borrowedFrom = previous;
            value = previous.members.get(previous.members.size() - 1);
        } else if (start instanceof ValueNode node) {
            startNode = node;
            members.add(node);
            value = node;
        } else {
            throw new IllegalArgumentException(what + " requires a value before it.");
        }
        if (!value.hasValue()) {
            throw new IllegalArgumentException(what + " cannot follow a jump.");
        }
        dataType = value.type();
        return value;
    }

    public Shortcut type() {
        return type;
    }

    /// The values this shortcut stands for, in order.
    public List<ValueNode> members() {
        return Collections.unmodifiableList(members);
    }

    /// Whether the first value comes from the preceding shortcut rather than being written out.
    public boolean startBorrowed() {
        return borrowedFrom != null;
    }

    public PaddingNode endPadding() {
        return endPadding;
    }

    public void setEndPadding(PaddingNode endPadding) {
        this.endPadding = endPadding;
    }

    /// Whether the written shorthand already ends in whitespace: its own trailing padding, or for
    /// an interpolate the padding of its end value.
    boolean endsInPadding() {
        if (endPadding != null) {
            return endPadding.size() > 0;
        }
        if (type.isInterpolate() && !members.isEmpty()) {
            final PaddingNode padding = last().padding();
            return padding != null && padding.size() > 0;
        }
        return false;
    }

    /// The source spelling, such as `3r` or `2ilog`; null when made while rebuilding values.
    public String originalToken() {
        return originalToken;
    }

    boolean isSynthetic() {
        return synthetic;
    }

    private double gridValue(long step) {
        final double x = begin + step * spacing;
        return type == Shortcut.LOG_INTERPOLATE ? Math.pow(10.0, x) : x;
    }

    private long gridStep(double v) {
        if (spacing == 0.0) {
            return 0L;
        }
        final double x = type == Shortcut.LOG_INTERPOLATE ? Math.log10(v) : v;
        return Math.round((x - begin) / spacing);
    }

    private boolean onGrid(ValueNode value, long step) {
        if (!value.type().isNumeric() || !value.hasValue()) {
            return false;
        }
        final double v = value.doubleValue();
        if (type == Shortcut.LOG_INTERPOLATE && v <= 0.0) {
            return false;
        }
        final double expected = gridValue(step);
        if (Tolerance.DEFAULT.isClose(v, expected)) {
            return true;
        }
        if (type == Shortcut.INTERPOLATE && Math.abs(v - expected) <= 1e-9 * Math.abs(spacing)) {
            return true;
        }
        return dataType == ValueType.INTEGER && v == (double) (long) expected;
    }

    /// Empties the members so that [#absorb] can refill them from a rebuilt value list.
    void beginReconcile() {
        members.clear();
        borrowedFrom = null;
        capacityBorrowed = false;
    }

    /// Takes `value` at one end of this shortcut when it fits the shortcut's rule.
    /// @param forward append at the end, otherwise insert at the front
    /// @param before the shortcut owning the value just before, when `value` is the first taken
    boolean absorb(ValueNode value, boolean forward, ShortcutNode before) {
        final boolean empty = members.isEmpty();
        final boolean fits;
        switch (type) {
            case JUMP:
                fits = !value.hasValue();
                break;
            case REPEAT:
                fits = value.hasValue() && (empty || sameValue(forward ? last() : members.get(0), value));
                break;
            case MULTIPLY:
                if (empty) {
                    capacityBorrowed = before != null;
                }
                fits = value.hasValue() && value.type().isNumeric()
                        && members.size() < (capacityBorrowed ? 1 : 2)
                        && (forward || value.doubleValue() != 0.0);
                break;
            default:
                fits = absorbOnGrid(value, forward, empty);
                break;
        }
        if (!fits) {
            return false;
        }
        if (forward) {
            members.add(value);
        } else {
            members.add(0, value);
        }
        return true;
    }

    private boolean absorbOnGrid(ValueNode value, boolean forward, boolean empty) {
        if (!value.hasValue() || !value.type().isNumeric()) {
            return false;
        }
        if (type == Shortcut.LOG_INTERPOLATE && value.doubleValue() <= 0.0) {
            return false;
        }
        final long step;
        if (empty) {
            step = gridStep(value.doubleValue());
        } else {
            step = forward ? lastStep + 1 : firstStep - 1;
        }
        if (!onGrid(value, step)) {
            return false;
        }
        if (empty) {
            firstStep = step;
            lastStep = step;
        } else if (forward) {
            lastStep = step;
        } else {
            firstStep = step;
        }
        return true;
    }

    private static boolean sameValue(ValueNode a, ValueNode b) {
        if (!a.hasValue() || !b.hasValue()) {
            return false;
        }
        if (a.type().isNumeric() && b.type().isNumeric()) {
            return Tolerance.DEFAULT.isClose(a.doubleValue(), b.doubleValue());
        }
        return a.value().equals(b.value());
    }

    private ValueNode last() {
        return members.get(members.size() - 1);
    }

    /// Settles whether the start is borrowed from `previous` and reports whether this shortcut
    /// still holds enough values to be written as a shortcut.
    boolean finishReconcile(ShortcutNode previous) {
        borrowedFrom = null;
        if (members.isEmpty()) {
            return false;
        }
        final ValueNode first = members.get(0);
        final ValueNode prevLast = previous == null || previous.members.isEmpty() ? null : previous.last();
        final boolean explicitStart = first == startNode;
        switch (type) {
            case JUMP:
                return true;
            case REPEAT:
                if (!explicitStart && prevLast != null && sameValue(prevLast, first)) {
                    borrowedFrom = previous;
                    return true;
                }
                return members.size() >= 2;
            case MULTIPLY:
                if (members.size() == 1) {
                    if (prevLast != null && prevLast.hasValue() && prevLast.type().isNumeric()
                            && prevLast.doubleValue() != 0.0) {
                        borrowedFrom = previous;
                        return true;
                    }
                    return false;
                }
                return first.doubleValue() != 0.0;
            default:
                if (!explicitStart && prevLast != null && onGrid(prevLast, firstStep - 1) && members.size() >= 2) {
                    borrowedFrom = previous;
                    return true;
                }
                return members.size() >= 3;
        }
    }

    /// Whether the current member values still follow this shortcut's rule, so that writing the
    /// shorthand reproduces them.
    public boolean isConsistent() {
        if (members.isEmpty()) {
            return false;
        }
        switch (type) {
            case JUMP:
                return members.stream().noneMatch(ValueNode::hasValue);
            case REPEAT:
                final ValueNode reference = borrowedFrom == null ? members.get(0) : borrowedFrom.last();
                return members.stream().allMatch(m -> sameValue(reference, m));
            case MULTIPLY:
                return members.size() == (borrowedFrom == null ? 2 : 1) && last().hasValue();
            default:
                for (int i = 0; i < members.size(); i++) {
                    if (!onGrid(members.get(i), firstStep + i)) {
                        return false;
                    }
                }
                return last().hasValue();
        }
    }

    @Override
    public String format() {
        final var sb = new StringBuilder();
        if (type != Shortcut.JUMP && borrowedFrom == null) {
            final ValueNode first = members.get(0);
            if (first.padding() == null && !first.neverPad()) {
                first.setPadding(new PaddingNode(" "));
            }
            sb.append(first.format());
        }
        sb.append(formatSuffix());
        return sb.toString();
    }

    /// The shorthand without its explicit start value: count, letters, any interpolation end
    /// and the trailing padding.
    public String formatSuffix() {
        final var sb = new StringBuilder();
        switch (type) {
            case JUMP:
                sb.append(countText(members.size())).append(letters);
                break;
            case REPEAT:
                sb.append(countText(borrowedFrom == null ? members.size() - 1 : members.size())).append(letters);
                break;
            case MULTIPLY:
                numNode.setValue(factor());
                sb.append(numNode.format()).append(letters);
                break;
            default:
                sb.append(countText(borrowedFrom == null ? members.size() - 2 : members.size() - 1)).append(letters);
                sb.append(interpolatePadding == null ? " " : interpolatePadding.format());
                sb.append(last().format());
                break;
        }
        if (endPadding != null) {
            sb.append(endPadding.format());
        }
        return sb.toString();
    }

    private double factor() {
        final ValueNode base = borrowedFrom == null ? members.get(0) : borrowedFrom.last();
        final double b = base.doubleValue();
        return b == 0.0 ? 0.0 : last().doubleValue() / b;
    }

    private String countText(int count) {
        if (count == 1 && (originalToken == null || !originalToken.contains("1"))) {
            return "";
        }
        numNode.setValue((long) count);
        return numNode.format();
    }

    @Override
    public List<SyntaxNodeBase> nodes() {
        return Collections.unmodifiableList(new ArrayList<SyntaxNodeBase>(members));
    }

    @Override
    public List<ShortcutNode> shortcuts() {
        return List.of();
    }

    @Override
    public void append(SyntaxNodeBase node, boolean fromParsing) {
        throw new UnsupportedOperationException("A shortcut's values follow from its rule");
    }

    @Override
    public boolean remove(SyntaxNodeBase node) {
        throw new UnsupportedOperationException("A shortcut's values follow from its rule");
    }

    @Override
    public List<SyntaxNodeBase> items() {
        return new ArrayList<>(members);
    }

    @Override
    public List<ValueNode> values() {
        return new ArrayList<>(members);
    }

    @Override
    public void updateWithNewValues(List<ValueNode> newValues) {
        throw new UnsupportedOperationException("Rebuild the list holding this shortcut instead");
    }

    @Override
    public List<CommentNode> comments() {
        final var ret = new ArrayList<CommentNode>();
        for (SyntaxNodeBase node : flatten()) {
            ret.addAll(node.comments());
        }
        return ret;
    }

    /// The written parts: the explicit start, the interpolation end and the trailing padding.
    @Override
    public List<SyntaxNodeBase> flatten() {
        final var ret = new ArrayList<SyntaxNodeBase>();
        if (type != Shortcut.JUMP && borrowedFrom == null && !members.isEmpty()) {
            ret.add(members.get(0));
        }
        if (type.isInterpolate() && !members.isEmpty()) {
            ret.add(last());
        }
        if (endPadding != null) {
            ret.add(endPadding);
        }
        return ret;
    }

    @Override
    public int size() {
        return members.size();
    }

    @Override
    public List<PaddingNode.Fragment> trailingComment() {
        if (endPadding != null) {
            return endPadding.trailingComment();
        }
        if (type.isInterpolate() && !members.isEmpty()) {
            return last().trailingComment();
        }
        return List.of();
    }

    @Override
    public void deleteTrailingComment() {
        if (endPadding != null) {
            endPadding.deleteTrailingComment();
        } else if (type.isInterpolate() && !members.isEmpty()) {
            last().deleteTrailingComment();
        }
    }

    @Override
    public void grabBeginningComment(List<PaddingNode.Fragment> extra) {
        // the shorthand has no leading padding
    }

    @Override
    public ShortcutNode copyWith(NodeCopier copier) {
        final var copy = new ShortcutNode(type, originalToken, copier.copy(numNode), synthetic);
        for (ValueNode member : members) {
            copy.members.add(copier.copy(member));
        }
        copy.startNode = copier.copy(startNode);
        copy.borrowedFrom = copier.copy(borrowedFrom);
        copy.endPadding = copier.copy(endPadding);
        copy.interpolatePadding = copier.copy(interpolatePadding);
        copy.dataType = dataType;
        copy.begin = begin;
        copy.spacing = spacing;
        copy.firstStep = firstStep;
        copy.lastStep = lastStep;
        copy.capacityBorrowed = capacityBorrowed;
        return copy;
    }

    @Override
    public String toString() {
        return "(shortcut: " + type + ", " + originalToken + ", " + members + ")";
    }
}
