package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.list.primitive.ImmutableIntList;
import org.eclipse.collections.impl.factory.primitive.IntLists;

/**
 * Slice of a single table row rendered in one fragment when the row is split mid-row.
 * Line indices are per cell; each cell advances independently, so neighbouring cells of the same
 * slice can cover different numbers of lines.
 */
public final class PartialRow {

    public final int rowIndex;
    /** First line rendered per cell (inclusive) */
    public final ImmutableIntList fromLineByCell;
    /** Line after the last rendered one per cell (exclusive) */
    public final ImmutableIntList toLineByCell;
    public final boolean firstPart;
    public final boolean lastPart;
    /** Whether any cell advanced at least one line */
    public final boolean madeProgress;
    /** Height of the slice including cell padding */
    public final double partialHeight;

    public PartialRow(int rowIndex, int[] fromLineByCell, int[] toLineByCell,
                      boolean firstPart, boolean lastPart, boolean madeProgress, double partialHeight) {
        this.rowIndex = rowIndex;
        this.fromLineByCell = IntLists.immutable.of(fromLineByCell.clone());
        this.toLineByCell = IntLists.immutable.of(toLineByCell.clone());
        this.firstPart = firstPart;
        this.lastPart = lastPart;
        this.madeProgress = madeProgress;
        this.partialHeight = partialHeight;
    }

    public int fromLine(int cellIndex) {
        return cellIndex < fromLineByCell.size() ? fromLineByCell.get(cellIndex) : 0;
    }

    public int toLine(int cellIndex) {
        return cellIndex < toLineByCell.size() ? toLineByCell.get(cellIndex) : 0;
    }

    @Override
    public String toString() {
        return "PartialRow{row=" + rowIndex + ", from=" + fromLineByCell + ", to=" + toLineByCell
                + ", first=" + firstPart + ", last=" + lastPart + ", height=" + partialHeight + "}";
    }
}
