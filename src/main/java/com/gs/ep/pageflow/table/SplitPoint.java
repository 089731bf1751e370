package com.gs.ep.pageflow.table;

import com.gs.ep.pageflow.model.PartialRow;

/**
 * Where the rows placed in the current column end.
 */
public final class SplitPoint {

    /** Row after the last included one */
    public final int endRow;
    /** Slice of row {@code endRow - 1} when the split falls inside that row, otherwise null */
    public final PartialRow partialRow;

    public SplitPoint(int endRow, PartialRow partialRow) {
        this.endRow = endRow;
        this.partialRow = partialRow;
    }

    public boolean isEmpty(int startRow) {
        return endRow == startRow && partialRow == null;
    }

    @Override
    public String toString() {
        return "SplitPoint{endRow=" + endRow + ", partialRow=" + partialRow + "}";
    }
}
