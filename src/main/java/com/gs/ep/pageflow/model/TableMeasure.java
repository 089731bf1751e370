package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.primitive.ImmutableDoubleList;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.primitive.DoubleLists;

/**
 * Measured table: row measures, column widths and overall size.
 */
public final class TableMeasure implements BlockMeasure {

    private final ImmutableList<TableRowMeasure> rows;
    private final ImmutableDoubleList columnWidths;
    private final double totalWidth;
    private final double totalHeight;

    public TableMeasure(Iterable<TableRowMeasure> rows, double[] columnWidths, double totalWidth, double totalHeight) {
        this.rows = Lists.immutable.withAll(rows);
        this.columnWidths = DoubleLists.immutable.of(columnWidths == null ? new double[0] : columnWidths.clone());
        this.totalWidth = Double.isFinite(totalWidth) ? Math.max(0, totalWidth) : 0;
        this.totalHeight = Double.isFinite(totalHeight) ? Math.max(0, totalHeight) : 0;
    }

    /**
     * Measure whose total height is the sum of its rows and whose width is the sum of its columns.
     */
    public static TableMeasure of(Iterable<TableRowMeasure> rows, double... columnWidths) {
        ImmutableList<TableRowMeasure> rowList = Lists.immutable.withAll(rows);
        double height = rowList.sumOfDouble(row -> row.height);
        double width = 0;
        for (double columnWidth : columnWidths) {
            width += columnWidth;
        }
        return new TableMeasure(rowList, columnWidths, width, height);
    }

    public ImmutableList<TableRowMeasure> getRows() {
        return rows;
    }

    public ImmutableDoubleList getColumnWidths() {
        return columnWidths;
    }

    public double getTotalWidth() {
        return totalWidth;
    }

    public double getTotalHeight() {
        return totalHeight;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.TABLE;
    }

    @Override
    public double getHeight() {
        return totalHeight;
    }
}
