package io.github.simbo1905.mcnp.geometry;

import io.github.simbo1905.mcnp.input.BlockType;
import io.github.simbo1905.mcnp.input.InputRecord;
import io.github.simbo1905.mcnp.input.Operator;
import io.github.simbo1905.mcnp.input.RecordParser;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CellGeometryTest extends GeometryTestBase {

    @Test
    void readsTheTreeOfACell() {
        final CellGeometry cell = cell("1 0 1 -2");
        assertThat(cell.cellNumber()).isEqualTo(1);
        final HalfSpace geometry = cell.geometry();
        assertThat(geometry.operator()).isEqualTo(Operator.INTERSECTION);
        final var left = (UnitHalfSpace) geometry.left();
        final var right = (UnitHalfSpace) geometry.right();
        assertThat(left.divider()).isEqualTo(1);
        assertThat(left.side()).isTrue();
        assertThat(right.divider()).isEqualTo(2);
        assertThat(right.side()).isFalse();
        assertThat(text(cell)).isEqualTo("1 0 1 -2");
    }

    @Test
    void singleSurfaceIsAUnit() {
        final CellGeometry cell = cell("4 0 -9 imp:n=1");
        assertThat(cell.geometry()).isInstanceOf(UnitHalfSpace.class);
        assertThat(text(cell)).isEqualTo("4 0 -9 imp:n=1");
    }

    @Test
    void complementedNumbersAreCells() {
        final CellGeometry cell = cell("3 0 -1 #2 #(4 5)");
        assertThat(cell.surfaces()).containsExactly(1, 4, 5);
        assertThat(cell.complements()).containsExactly(2);
        assertThat(text(cell)).isEqualTo("3 0 -1 #2 #(4 5)");
    }

    @Test
    void flippingASideRewritesOnlyThatLeaf() {
        final CellGeometry cell = cell("1 0 1 -2 imp:n=1 $ note");
        ((UnitHalfSpace) cell.geometry().right()).setSide(true);
        assertThat(text(cell)).isEqualTo("1 0 1  2 imp:n=1 $ note");
    }

    @Test
    void renumberingASurface() {
        final CellGeometry cell = cell("1 0 1 -2");
        ((UnitHalfSpace) cell.geometry().left()).setDivider(10);
        assertThat(cell.surfaces()).containsExactly(10, 2);
        assertThat(text(cell)).startsWith("1 0 10");
        assertThat(text(cell)).endsWith("-2");
    }

    @Test
    void unionUnderIntersectionGetsParentheses() {
        final CellGeometry cell = cell("5 0 -9");
        cell.setGeometry(UnitHalfSpace.surface(1, true).or(UnitHalfSpace.surface(2, true))
                .and(UnitHalfSpace.surface(3, false)));
        assertThat(text(cell)).isEqualTo("5 0 (1 : 2) -3");
    }

    @Test
    void intersectionNeedsNoParentheses() {
        final CellGeometry cell = cell("5 0 -9");
        cell.setGeometry(UnitHalfSpace.surface(1, true).and(UnitHalfSpace.surface(2, false)));
        assertThat(text(cell)).isEqualTo("5 0 1 -2");
    }

    @Test
    void complementOfATreeGetsParentheses() {
        final CellGeometry cell = cell("9 0 -9");
        cell.setGeometry(UnitHalfSpace.surface(1, false).and(UnitHalfSpace.surface(2, true)).complement()
                .and(UnitHalfSpace.cell(5)));
        assertThat(text(cell)).isEqualTo("9 0 #(-1 2) #5");
    }

    @Test
    void andKeepsTheExistingLayout() {
        final CellGeometry cell = cell("1 0 1 -2");
        cell.and(UnitHalfSpace.surface(3, true));
        assertThat(text(cell)).isEqualTo("1 0 1 -2 3");
    }

    @Test
    void orWrapsTheExistingGeometry() {
        final CellGeometry cell = cell("1 0 1 -2");
        cell.or(UnitHalfSpace.surface(3, true));
        assertThat(cell.geometry().operator()).isEqualTo(Operator.UNION);
        assertThat(text(cell)).isEqualTo("1 0 1 -2 : 3");
    }

    @Test
    void growingALoneSurface() {
        final CellGeometry cell = cell("1 0 1");
        for (int i = 2; i <= 5; i++) {
            cell.and(UnitHalfSpace.surface(i, true));
        }
        assertThat(text(cell)).isEqualTo("1 0 1 2 3 4 5");
    }

    @Test
    void andBeforeParametersKeepsThemApart() {
        final CellGeometry cell = cell("5 0 -9 imp:n=1");
        cell.and(UnitHalfSpace.surface(3, true));
        assertThat(text(cell)).isEqualTo("5 0 -9 3 imp:n=1");
        assertThat(cell(text(cell)).surfaces()).containsExactly(9, 3);
    }

    @Test
    void orBeforeParametersKeepsThemApart() {
        final CellGeometry cell = cell("5 0 -9 imp:n=1");
        cell.or(UnitHalfSpace.surface(3, true));
        assertThat(text(cell)).isEqualTo("5 0 -9 : 3 imp:n=1");
    }

    @Test
    void replacedGeometryBeforeParametersReadsBack() {
        final CellGeometry cell = cell("5 0 -9 imp:n=1");
        cell.setGeometry(UnitHalfSpace.surface(1, true).and(UnitHalfSpace.surface(2, false)));
        final String written = text(cell);
        assertThat(written).isEqualTo("5 0 1 -2 imp:n=1");
        final CellGeometry reread = cell(written);
        assertThat(reread.geometry().sameGeometry(cell.geometry())).isTrue();
    }

    @Test
    void newGroupAtTheEndTakesTheSeparator() {
        final CellGeometry cell = cell("1 0 1 -2 imp:n=1");
        cell.geometry().setRight(UnitHalfSpace.surface(5, true).or(UnitHalfSpace.surface(6, false)));
        assertThat(text(cell)).isEqualTo("1 0 1 (5 : -6) imp:n=1");
    }

    @Test
    void groupAtTheEndKeepsItsParenthesis() {
        final CellGeometry cell = cell("1 0 -1 (2 : 3) imp:n=1");
        cell.and(UnitHalfSpace.surface(4, false));
        assertThat(text(cell)).isEqualTo("1 0 -1 (2 : 3) -4 imp:n=1");
        assertThat(cell(text(cell)).surfaces()).containsExactly(1, 2, 3, 4);
    }

    @Test
    void switchingToUnionMarksTheMiddleSpace() {
        final CellGeometry cell = cell("1 0 1   -2");
        cell.geometry().setOperator(Operator.UNION);
        assertThat(text(cell)).isEqualTo("1 0 1 : -2");
    }

    @Test
    void switchingToIntersectionDropsTheColon() {
        final CellGeometry cell = cell("1 0 1 : -2");
        cell.geometry().setOperator(Operator.INTERSECTION);
        assertThat(text(cell)).matches("1 0 1 +-2").doesNotContain(":");
    }

    @Test
    void copiesAreIndependent() {
        final CellGeometry original = cell("1 0 1 -2");
        final CellGeometry copy = original.copy();
        assertThat(copy.record()).isNotSameAs(original.record());
        assertThat(copy.geometry().sameGeometry(original.geometry())).isTrue();

        ((UnitHalfSpace) copy.geometry().right()).setSide(true);
        assertThat(text(copy)).isEqualTo("1 0 1  2");
        assertThat(text(original)).isEqualTo("1 0 1 -2");
        assertThat(((UnitHalfSpace) original.geometry().right()).side()).isFalse();
    }

    @Test
    void onlyCellRecordsHaveGeometry() {
        final var surface = new RecordParser().parse(InputRecord.of(BlockType.SURFACE, "1 so 5"));
        assertThatThrownBy(() -> CellGeometry.of(surface)).isInstanceOf(IllegalArgumentException.class);
    }
}
