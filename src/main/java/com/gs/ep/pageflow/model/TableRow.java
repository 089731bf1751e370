package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Table row with its row properties.
 */
public final class TableRow {

    private final ImmutableList<TableCell> cells;
    /** Row belongs to the header block repeated on continuation fragments */
    public final boolean repeatHeader;
    /** Row must not be divided across a page or column boundary */
    public final boolean cantSplit;
    /** Explicit row height from the document, null when the row is auto-sized */
    public final Double explicitHeight;

    public TableRow(Iterable<TableCell> cells, boolean repeatHeader, boolean cantSplit, Double explicitHeight) {
        this.cells = Lists.immutable.withAll(cells);
        this.repeatHeader = repeatHeader;
        this.cantSplit = cantSplit;
        this.explicitHeight = explicitHeight;
    }

    /**
     * Auto-sized, splittable row of {@code cellCount} plain cells.
     */
    public static TableRow plain(int cellCount) {
        return new TableRow(plainCells(cellCount), false, false, null);
    }

    public static TableRow header(int cellCount) {
        return new TableRow(plainCells(cellCount), true, false, null);
    }

    public static TableRow cantSplit(int cellCount) {
        return new TableRow(plainCells(cellCount), false, true, null);
    }

    public ImmutableList<TableCell> getCells() {
        return cells;
    }

    /**
     * Cell at {@code index}, or null when the row has fewer cells than its measure.
     */
    public TableCell cellAt(int index) {
        return index >= 0 && index < cells.size() ? cells.get(index) : null;
    }

    public boolean hasFiniteExplicitHeight() {
        return explicitHeight != null && Double.isFinite(explicitHeight);
    }

    private static MutableList<TableCell> plainCells(int cellCount) {
        MutableList<TableCell> cells = Lists.mutable.empty();
        for (int i = 0; i < cellCount; i++) {
            cells.add(TableCell.plain());
        }
        return cells;
    }
}
