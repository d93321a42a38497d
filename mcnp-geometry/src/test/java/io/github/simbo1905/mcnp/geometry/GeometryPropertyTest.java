package io.github.simbo1905.mcnp.geometry;

import io.github.simbo1905.mcnp.input.Operator;
import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/// Geometry built in code, written out and read back selects the same points of space.
class GeometryPropertyTest extends GeometryTestBase {

    private static final int SURFACES = 5;

    record Step(int divider, boolean side, boolean union) {
    }

    @Provide
    Arbitrary<List<Step>> steps() {
        return Combinators.combine(
                        Arbitraries.integers().between(1, SURFACES),
                        Arbitraries.of(true, false),
                        Arbitraries.of(true, false))
                .as(Step::new)
                .list().ofMinSize(1).ofMaxSize(12);
    }

    @Property(tries = 200)
    void writtenGeometryReadsBackEquivalent(@ForAll("steps") List<Step> steps) {
        final CellGeometry cell = cell("1 0 1");
        for (Step step : steps) {
            final UnitHalfSpace leaf = UnitHalfSpace.surface(step.divider(), step.side());
            if (step.union()) {
                cell.or(leaf);
            } else {
                cell.and(leaf);
            }
        }
        final HalfSpace built = cell.geometry();
        final CellGeometry reread = cell(text(cell));

        assertThat(reread.geometry().size()).isEqualTo(steps.size() + 1);
        assertThat(reread.geometry().leaves()).extracting(UnitHalfSpace::toString)
                .containsExactlyElementsOf(built.leaves().stream().map(UnitHalfSpace::toString).toList());
        for (int point = 0; point < 1 << SURFACES; point++) {
            assertThat(inside(reread.geometry(), point)).isEqualTo(inside(built, point));
        }
    }

    @Property(tries = 100)
    void assignChainsStayShallow(@ForAll("steps") List<Step> steps) {
        HalfSpace tree = UnitHalfSpace.surface(1, true);
        for (Step step : steps) {
            final UnitHalfSpace leaf = UnitHalfSpace.surface(step.divider(), step.side());
            tree = step.union() ? tree.orAssign(leaf) : tree.andAssign(leaf);
        }
        assertThat(tree.size()).isEqualTo(steps.size() + 1);
        assertThat(tree.depth()).isLessThanOrEqualTo(steps.size() + 1);
    }

    /// Bit `n - 1` of `point` is set when the point lies on the positive side of surface `n`.
    private static boolean inside(HalfSpace tree, int point) {
        if (tree instanceof UnitHalfSpace unit) {
            return ((point >> (unit.divider() - 1) & 1) == 1) == unit.side();
        }
        final Operator operator = tree.operator();
        switch (operator) {
            case INTERSECTION:
                return inside(tree.left(), point) && inside(tree.right(), point);
            case UNION:
                return inside(tree.left(), point) || inside(tree.right(), point);
            case COMPLEMENT:
                return !inside(tree.left(), point);
            default:
                return inside(tree.left(), point);
        }
    }
}
