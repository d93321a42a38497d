package io.github.simbo1905.mcnp.input;

import java.util.List;

/// A node of the format preserving syntax tree of one record.
///
/// A parent exclusively owns its children; trees are never shared, only deep copied through a
/// [NodeCopier]. Every node can regenerate the exact text it stands for with [#format()].
public sealed interface SyntaxNodeBase
        permits SyntaxNode, ValueNode, PaddingNode, CommentNode, ListNode, GeometryTree,
        ClassifierNode, ParametersNode, ParticleNode, IsotopesNode {

    String name();

    /// The text of this subtree in its current state.
    String format();

    /// Every comment in this subtree, in order.
    List<CommentNode> comments();

    /// The leaves of this subtree: value, padding, comment and particle nodes.
    List<SyntaxNodeBase> flatten();

    /// Number of direct children; used to tell empty nodes from populated ones.
    int size();

    /// The `c` style comment lines at the end of this subtree, with the layout between them.
    /// Empty when there is none.
    List<PaddingNode.Fragment> trailingComment();

    void deleteTrailingComment();

    /// Moves comment lines that preceded this node into its leading padding.
    void grabBeginningComment(List<PaddingNode.Fragment> extra);

    /// Copies this node, resolving children through `copier`. Call [NodeCopier#copy] instead.
    SyntaxNodeBase copyWith(NodeCopier copier);

    default SyntaxNodeBase deepCopy() {
        return new NodeCopier().copy(this);
    }

    /// Breaks `$` comments that would swallow the content written after them.
    ///
    /// For example `imp:n=1 $ grave yard vol=1` would turn `vol=1` into comment text, so a newline
    /// and a continuation indent are appended to the comment.
    /// @param hasFollowingInput true when more content follows this tree on output
    default void checkForGraveyardComments(boolean hasFollowingInput) {
        final var flat = flatten();
        if (flat.isEmpty()) {
            return;
        }
        final int end = hasFollowingInput ? flat.size() + 1 : flat.size();
        SyntaxNodeBase first = flat.get(0);
        for (int i = 1; i < end; i++) {
            final SyntaxNodeBase second = i < flat.size() ? flat.get(i) : null;
            final PaddingNode padding;
            if (first instanceof ValueNode value) {
                padding = value.padding();
            } else if (first instanceof PaddingNode pad) {
                padding = pad;
            } else {
                padding = null;
            }
            if (padding != null && padding.size() > 0
                    && padding.hasGraveyardComment() && !(second instanceof PaddingNode)) {
                padding.append("\n");
                padding.append(" ".repeat(InputConstants.CONTINUE_INDENT));
            }
            first = second;
        }
    }
}
