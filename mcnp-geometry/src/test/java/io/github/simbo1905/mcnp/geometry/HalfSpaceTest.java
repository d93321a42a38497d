package io.github.simbo1905.mcnp.geometry;

import io.github.simbo1905.mcnp.input.Operator;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HalfSpaceTest extends GeometryTestBase {

    private static UnitHalfSpace plus(int number) {
        return UnitHalfSpace.surface(number, true);
    }

    private static UnitHalfSpace minus(int number) {
        return UnitHalfSpace.surface(number, false);
    }

    @Test
    void combiningBuildsNewParents() {
        final UnitHalfSpace a = plus(1);
        final UnitHalfSpace b = minus(2);
        final HalfSpace both = a.and(b);
        assertThat(both.operator()).isEqualTo(Operator.INTERSECTION);
        assertThat(both.left()).isSameAs(a);
        assertThat(both.right()).isSameAs(b);
        assertThat(both.toString()).isEqualTo("(+1 -2)");
        assertThat(a.or(plus(3)).toString()).isEqualTo("(+1:+3)");
        assertThat(both.complement().toString()).isEqualTo("#(+1 -2)");
        assertThat(UnitHalfSpace.cell(5).toString()).isEqualTo("#5");
    }

    @Test
    void shapesAreChecked() {
        assertThatThrownBy(() -> new HalfSpace(plus(1), Operator.UNION, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HalfSpace(plus(1), Operator.COMPLEMENT, plus(2)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HalfSpace(plus(1), Operator.SHIFT, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> UnitHalfSpace.surface(0, true)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void leavesHaveNoSides() {
        final UnitHalfSpace leaf = plus(1);
        assertThatThrownBy(() -> leaf.setLeft(plus(2))).isInstanceOf(UnsupportedOperationException.class);
        assertThatThrownBy(() -> leaf.complement().setRight(plus(2))).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void cellsAreAlwaysOnThePositiveSide() {
        final var cell = (UnitHalfSpace) UnitHalfSpace.cell(5).left();
        assertThat(cell.isCell()).isTrue();
        assertThat(cell.side()).isTrue();
        assertThatThrownBy(() -> cell.setSide(false)).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void onlyUnionAndIntersectionSwitch() {
        final HalfSpace both = plus(1).and(plus(2));
        both.setOperator(Operator.UNION);
        assertThat(both.operator()).isEqualTo(Operator.UNION);
        assertThatThrownBy(() -> both.setOperator(Operator.COMPLEMENT)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> plus(1).complement().setOperator(Operator.UNION))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void repeatedAndAssignGrowsLinearly() {
        final int n = 200;
        HalfSpace tree = plus(1);
        for (int i = 2; i <= n; i++) {
            tree = tree.andAssign(plus(i));
        }
        assertThat(tree.size()).isEqualTo(n);
        assertThat(tree.depth()).isLessThanOrEqualTo(n + 1);
        assertThat(tree.leaves()).extracting(UnitHalfSpace::divider)
                .containsExactlyElementsOf(java.util.stream.IntStream.rangeClosed(1, n).boxed().toList());
    }

    @Test
    void andAssignKeepsTheRootOfAnIntersection() {
        final HalfSpace root = plus(1).and(plus(2));
        assertThat(root.andAssign(plus(3))).isSameAs(root);
        assertThat(root.toString()).isEqualTo("(+1 (+2 +3))");
    }

    @Test
    void assignOfAnotherOperatorWrapsTheTree() {
        final HalfSpace root = plus(1).and(plus(2));
        final HalfSpace union = root.orAssign(plus(3));
        assertThat(union).isNotSameAs(root);
        assertThat(union.operator()).isEqualTo(Operator.UNION);
        assertThat(union.left()).isSameAs(root);
        assertThat(root.toString()).isEqualTo("(+1 +2)");
    }

    @Test
    void graftingDoesNotCrossAnotherOperator() {
        final HalfSpace root = plus(1).and(plus(2).or(plus(3)));
        root.andAssign(plus(4));
        assertThat(root.toString()).isEqualTo("(+1 ((+2:+3) +4))");
    }

    @Test
    void sameGeometryLooksThroughParentheses() {
        final HalfSpace a = plus(1).and(minus(2));
        final HalfSpace b = plus(1).and(minus(2)).group();
        assertThat(a.sameGeometry(b)).isTrue();
        assertThat(a.sameGeometry(plus(1).and(plus(2)))).isFalse();
        assertThat(a.sameGeometry(plus(1).or(minus(2)))).isFalse();
        assertThat(plus(3).sameGeometry(plus(3).group())).isTrue();
    }

    @Test
    void unitCannotBeComparedToATree() {
        assertThatThrownBy(() -> plus(1).sameGeometry(plus(1).and(plus(2))))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cellNumberReachesEveryNode() {
        final CellGeometry cell = cell("7 0 1 -2");
        assertThat(cell.geometry().cell()).hasValue(7);
        assertThat(cell.geometry().leaves()).allSatisfy(leaf -> assertThat(leaf.cell()).hasValue(7));
        cell.and(plus(3));
        assertThat(cell.geometry().leaves()).allSatisfy(leaf -> assertThat(leaf.cell()).hasValue(7));
        assertThat(plus(9).cell()).isEmpty();
    }
}
