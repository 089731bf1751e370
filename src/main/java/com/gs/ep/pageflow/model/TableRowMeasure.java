package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Measured table row: its rendered height and one measure per cell.
 */
public final class TableRowMeasure {

    public final double height;
    private final ImmutableList<CellMeasure> cells;

    public TableRowMeasure(double height, Iterable<CellMeasure> cells) {
        this.height = Double.isFinite(height) ? Math.max(0, height) : 0;
        this.cells = Lists.immutable.withAll(cells);
    }

    public ImmutableList<CellMeasure> getCells() {
        return cells;
    }
}
