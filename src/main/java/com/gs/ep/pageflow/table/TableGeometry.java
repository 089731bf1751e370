package com.gs.ep.pageflow.table;

import com.gs.ep.pageflow.model.BorderCollapse;
import com.gs.ep.pageflow.model.CellMeasure;
import com.gs.ep.pageflow.model.DocRange;
import com.gs.ep.pageflow.model.LineMeasure;
import com.gs.ep.pageflow.model.PartialRow;
import com.gs.ep.pageflow.model.TableAttributes;
import com.gs.ep.pageflow.model.TableBlock;
import com.gs.ep.pageflow.model.TableCell;
import com.gs.ep.pageflow.model.TableColumnBoundary;
import com.gs.ep.pageflow.model.TableJustification;
import com.gs.ep.pageflow.model.TableMeasure;
import com.gs.ep.pageflow.model.TableRow;
import com.gs.ep.pageflow.model.TableRowMeasure;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.list.primitive.ImmutableDoubleList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Pure geometry helpers shared by the table layout strategies.
 */
public final class TableGeometry {

    private TableGeometry() {
    }

    /**
     * Table indent in pixels; missing or non-finite indents count as zero. Negative indents move the
     * table into the left margin.
     */
    public static double tableIndentWidth(TableAttributes attrs) {
        if (attrs == null || attrs.tableIndent == null || !Double.isFinite(attrs.tableIndent)) {
            return 0;
        }
        return attrs.tableIndent;
    }

    public static TableFrame applyTableIndent(double x, double width, double indent) {
        return new TableFrame(x + indent, Math.max(0, width - indent));
    }

    /**
     * Spacing between cells, only present with separate borders and a positive spacing value.
     */
    public static double cellSpacing(TableAttributes attrs) {
        if (attrs == null || attrs.borderCollapse != BorderCollapse.SEPARATE || attrs.cellSpacing == null) {
            return 0;
        }
        double spacing = attrs.cellSpacing;
        return Double.isFinite(spacing) && spacing > 0 ? spacing : 0;
    }

    /**
     * Places a table of {@code tableWidth} inside a column. Centered and right/end justified tables are
     * aligned within the column and ignore the indent; any other table is shifted by its indent.
     */
    public static TableFrame resolveFrame(double baseX, double columnWidth, double tableWidth, TableAttributes attrs) {
        double width = Math.min(columnWidth, tableWidth);
        TableJustification justification = attrs == null ? null : attrs.justification;
        if (justification == TableJustification.CENTER) {
            return new TableFrame(baseX + Math.max(0, (columnWidth - width) / 2), width);
        }
        if (justification == TableJustification.RIGHT || justification == TableJustification.END) {
            return new TableFrame(baseX + Math.max(0, columnWidth - width), width);
        }
        return applyTableIndent(baseX, width, tableIndentWidth(attrs));
    }

    /**
     * Width a table is laid out at: its measured width capped by the column, or the column width when
     * the measure has no width.
     */
    public static double baseWidth(double columnWidth, TableMeasure measure) {
        double measured = measure.getTotalWidth();
        return Math.min(columnWidth, measured > 0 ? measured : columnWidth);
    }

    /**
     * Minimum width a column may be resized to, clamped to {@code [floor, cap]}; missing or
     * non-positive widths give {@code floor}.
     */
    public static double columnMinWidth(int columnIndex, TableMeasure measure, double floor, double cap) {
        ImmutableDoubleList widths = measure.getColumnWidths();
        double measured = columnIndex < widths.size() ? widths.get(columnIndex) : 0;
        if (!(measured > 0)) {
            measured = floor;
        }
        return Math.max(floor, Math.min(measured, cap));
    }

    public static ImmutableList<TableColumnBoundary> columnBoundaries(TableMeasure measure, double floor, double cap) {
        MutableList<TableColumnBoundary> boundaries = Lists.mutable.empty();
        ImmutableDoubleList widths = measure.getColumnWidths();
        double x = 0;
        for (int i = 0; i < widths.size(); i++) {
            double width = widths.get(i);
            boundaries.add(new TableColumnBoundary(i, x, width, columnMinWidth(i, measure, floor, cap), true));
            x += width;
        }
        return boundaries.toImmutable();
    }

    /**
     * Number of contiguous header rows starting at row 0.
     */
    public static int countHeaderRows(TableBlock block) {
        int count = 0;
        for (TableRow row : block.getRows()) {
            if (!row.repeatHeader) {
                break;
            }
            count++;
        }
        return count;
    }

    /**
     * Sum of the heights of measured rows {@code [fromRow, toRow)}.
     */
    public static double sumRowHeights(TableMeasure measure, int fromRow, int toRow) {
        ImmutableList<TableRowMeasure> rows = measure.getRows();
        double total = 0;
        for (int i = Math.max(0, fromRow); i < toRow && i < rows.size(); i++) {
            total += rows.get(i).height;
        }
        return total;
    }

    /**
     * Height of a fragment made of whole rows: repeated headers plus body rows, plus the cell spacing
     * of every row and, for the first fragment of a table, the spacing above the first row.
     */
    public static double fragmentHeight(TableMeasure measure, int fromRow, int toRow, int repeatHeaderCount,
                                        double cellSpacing, boolean includeTopSpacing) {
        double height = 0;
        if (repeatHeaderCount > 0) {
            height += sumRowHeights(measure, 0, repeatHeaderCount);
        }
        height += sumRowHeights(measure, fromRow, toRow);
        if (cellSpacing > 0) {
            int totalRows = repeatHeaderCount + Math.max(0, toRow - fromRow);
            if (totalRows > 0) {
                height += cellSpacing * totalRows;
                if (includeTopSpacing) {
                    height += cellSpacing;
                }
            }
        }
        return height;
    }

    /**
     * Union of the document ranges of the content a fragment shows. Rows outside both the block and
     * the measure are skipped; for the partial row only the lines in the slice count.
     */
    public static DocRange fragmentRange(TableBlock block, TableMeasure measure, int fromRow, int toRow,
                                         PartialRow partialRow) {
        DocRange range = DocRange.EMPTY;
        ImmutableList<TableRow> rows = block.getRows();
        ImmutableList<TableRowMeasure> rowMeasures = measure.getRows();
        for (int rowIndex = Math.max(0, fromRow); rowIndex < toRow; rowIndex++) {
            if (rowIndex >= rows.size() || rowIndex >= rowMeasures.size()) {
                continue;
            }
            TableRow row = rows.get(rowIndex);
            ImmutableList<CellMeasure> cellMeasures = rowMeasures.get(rowIndex).getCells();
            boolean partial = partialRow != null && partialRow.rowIndex == rowIndex;
            int cellCount = Math.min(row.getCells().size(), cellMeasures.size());
            for (int cellIndex = 0; cellIndex < cellCount; cellIndex++) {
                CellMeasure cellMeasure = cellMeasures.get(cellIndex);
                int totalLines = cellMeasure.totalLines();
                int fromLine = 0;
                int toLine = totalLines;
                if (partial) {
                    if (cellIndex < partialRow.fromLineByCell.size()) {
                        fromLine = Math.max(0, partialRow.fromLine(cellIndex));
                    }
                    if (cellIndex < partialRow.toLineByCell.size()) {
                        toLine = partialRow.toLine(cellIndex);
                    }
                }
                fromLine = Math.max(0, Math.min(fromLine, totalLines));
                toLine = Math.max(fromLine, Math.min(toLine, totalLines));
                range = range.union(cellRange(row.cellAt(cellIndex), cellMeasure, fromLine, toLine));
            }
        }
        return range;
    }

    private static DocRange cellRange(TableCell cell, CellMeasure cellMeasure, int fromLine, int toLine) {
        ImmutableList<LineMeasure> lines = cellMeasure.getLines();
        boolean linesCarryRanges = lines.anySatisfy(line -> !line.range.isEmpty());
        if (!linesCarryRanges) {
            return cell == null ? DocRange.EMPTY : cell.range;
        }
        DocRange range = DocRange.EMPTY;
        for (int i = fromLine; i < toLine; i++) {
            range = range.union(lines.get(i).range);
        }
        return range;
    }
}
