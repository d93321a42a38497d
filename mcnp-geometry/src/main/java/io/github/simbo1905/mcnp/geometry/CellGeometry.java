package io.github.simbo1905.mcnp.geometry;

import io.github.simbo1905.mcnp.input.GeometryTree;
import io.github.simbo1905.mcnp.input.McnpVersion;
import io.github.simbo1905.mcnp.input.NodeCopier;
import io.github.simbo1905.mcnp.input.ParsedRecord;
import io.github.simbo1905.mcnp.input.RecordKind;
import io.github.simbo1905.mcnp.input.SyntaxNode;
import io.github.simbo1905.mcnp.input.ValueNode;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// A cell record together with the half space tree of its geometry.
///
/// The tree is read from the record's `geometry` node. Changes to the tree reach the record's
/// syntax when [#synchronize()] runs, which [#format(McnpVersion)] does first.
public final class CellGeometry {

    private static final Logger LOG = Logger.getLogger(CellGeometry.class.getName());

    static final String GEOMETRY = "geometry";
    static final String CELL_NUMBER = "cell_num";

    private final ParsedRecord record;
    private HalfSpace geometry;

    private CellGeometry(ParsedRecord record, HalfSpace geometry) {
        this.record = record;
        this.geometry = geometry;
        geometry.setCell(cellNumber());
    }

    /// @throws IllegalArgumentException if the record is not a parsed cell, or its geometry names
    ///                                  something other than positive whole numbers
    public static CellGeometry of(ParsedRecord record) {
        Objects.requireNonNull(record, "record");
        if (record.kind() != RecordKind.CELL) {
            throw new IllegalArgumentException("Not a cell record: " + record.record().text());
        }
        final var geometry = HalfSpaceParser.parse(record.tree().get(GEOMETRY, GeometryTree.class));
        final var ret = new CellGeometry(record, geometry);
        LOG.fine(() -> "event=cell_geometry_read cell=" + ret.cellNumber() + " leaves=" + geometry.size());
        return ret;
    }

    public ParsedRecord record() {
        return record;
    }

    public int cellNumber() {
        return Math.toIntExact(record.tree().get(CELL_NUMBER, ValueNode.class).longValue());
    }

    public HalfSpace geometry() {
        return geometry;
    }

    /// Replaces the geometry. The old tree's syntax is kept, so nodes that carry over keep their
    /// layout.
    public void setGeometry(HalfSpace geometry) {
        this.geometry = Objects.requireNonNull(geometry, "geometry");
        geometry.setCell(cellNumber());
    }

    /// Intersects `other` into the geometry in place.
    public void and(HalfSpace other) {
        setGeometry(geometry.andAssign(other));
    }

    /// Unions `other` into the geometry in place.
    public void or(HalfSpace other) {
        setGeometry(geometry.orAssign(other));
    }

    /// The surface numbers the geometry uses, in order of first use.
    public List<Integer> surfaces() {
        return dividers(false);
    }

    /// The numbers of the cells the geometry complements, in order of first use.
    public List<Integer> complements() {
        return dividers(true);
    }

    private List<Integer> dividers(boolean cells) {
        return geometry.leaves().stream()
                .filter(leaf -> leaf.isCell() == cells)
                .map(UnitHalfSpace::divider)
                .distinct()
                .toList();
    }

    /// Writes the tree into the record's geometry node.
    public void synchronize() {
        final SyntaxNode tree = record.tree();
        final var current = tree.get(GEOMETRY, GeometryTree.class);
        final GeometryTree updated = GeometrySynchronizer.synchronize(geometry, current);
        if (updated != current) {
            tree.put(GEOMETRY, updated);
        }
    }

    public List<String> format(McnpVersion version) {
        synchronize();
        return record.format(version);
    }

    /// An independent copy: the record's syntax is copied and every node of the copied tree points
    /// into the copied syntax.
    public CellGeometry copy() {
        final var copier = new NodeCopier();
        final SyntaxNode tree = copier.copy(record.tree());
        final HalfSpace copied = geometry.copyWith(copier);
        LOG.fine(() -> "event=cell_geometry_copied cell=" + cellNumber() + " nodes=" + copier.size());
        return new CellGeometry(new ParsedRecord(record.record(), record.kind(), tree), copied);
    }

    @Override
    public String toString() {
        return "CellGeometry[cell=" + cellNumber() + ", geometry=" + geometry + "]";
    }
}
