package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Rows {@code [fromRow, toRow)} of a table placed in one page column, optionally prefixed by
 * repeated header rows and optionally ending in (or consisting of) a partial row.
 */
public class TableFragment extends Fragment {

    private final int fromRow;
    private final int toRow;
    private final PartialRow partialRow;
    private final int repeatHeaderCount;
    private final boolean continuesFromPrev;
    private final boolean continuesOnNext;
    private ImmutableList<TableColumnBoundary> columnBoundaries = Lists.immutable.empty();

    public TableFragment(String blockId, int fromRow, int toRow, PartialRow partialRow, int repeatHeaderCount,
                         boolean continuesFromPrev, boolean continuesOnNext,
                         double x, double y, double width, double height) {
        super(blockId, BlockKind.TABLE, x, y, width, height);
        this.fromRow = fromRow;
        this.toRow = toRow;
        this.partialRow = partialRow;
        this.repeatHeaderCount = repeatHeaderCount;
        this.continuesFromPrev = continuesFromPrev;
        this.continuesOnNext = continuesOnNext;
    }

    public int getFromRow() {
        return fromRow;
    }

    public int getToRow() {
        return toRow;
    }

    /**
     * Partial row slice, or null when the fragment ends on a row boundary.
     */
    public PartialRow getPartialRow() {
        return partialRow;
    }

    public boolean hasPartialRow() {
        return partialRow != null;
    }

    public int getRepeatHeaderCount() {
        return repeatHeaderCount;
    }

    public boolean isContinuesFromPrev() {
        return continuesFromPrev;
    }

    public boolean isContinuesOnNext() {
        return continuesOnNext;
    }

    public ImmutableList<TableColumnBoundary> getColumnBoundaries() {
        return columnBoundaries;
    }

    public void setColumnBoundaries(ImmutableList<TableColumnBoundary> columnBoundaries) {
        this.columnBoundaries = columnBoundaries == null ? Lists.immutable.empty() : columnBoundaries;
    }

    @Override
    public String toString() {
        return "table:" + getBlockId() + "[" + fromRow + ", " + toRow + ")"
                + (partialRow != null ? " partial=" + partialRow : "")
                + " headers=" + repeatHeaderCount + " y=" + getY() + " h=" + getHeight();
    }
}
