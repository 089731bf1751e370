package com.gs.ep.pageflow.table;

import com.gs.ep.pageflow.LayoutException;
import com.gs.ep.pageflow.model.CellMeasure;
import com.gs.ep.pageflow.model.CellPadding;
import com.gs.ep.pageflow.model.LineMeasure;
import com.gs.ep.pageflow.model.PartialRow;
import com.gs.ep.pageflow.model.TableBlock;
import com.gs.ep.pageflow.model.TableCell;
import com.gs.ep.pageflow.model.TableMeasure;
import com.gs.ep.pageflow.model.TableRow;
import com.gs.ep.pageflow.model.TableRowMeasure;
import org.eclipse.collections.api.list.ImmutableList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * 表格行拆分器
 *
 * 负责两件事：
 * 1. 从某一行开始，计算当前栏能容纳到哪一行为止（按行边界或行内拆分）
 * 2. 对放不下的行按单元格逐个计算行内拆分位置
 *
 * 各单元格独立推进文本行，不做行数对齐：较高的单元格在同一片段中可以比相邻单元格多显示几行。
 */
public class TableRowSplitter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableRowSplitter.class);

    private static final double ROW_HEIGHT_EPSILON = 0.1;

    private final double minPartialRowHeight;
    private final CellPadding defaultPadding;

    public TableRowSplitter(double minPartialRowHeight, CellPadding defaultPadding) {
        this.minPartialRowHeight = minPartialRowHeight;
        this.defaultPadding = Objects.requireNonNull(defaultPadding, "defaultPadding");
    }

    /**
     * 计算行内拆分：每个单元格从自己的起始行开始，在扣除自身上下内边距后的可用高度内尽量多放文本行
     *
     * @param rowIndex        行号
     * @param row             表格行（用于读取单元格内边距），可以为 null
     * @param measure         表格测量结果
     * @param availableHeight 可用高度
     * @param fromLineByCell  每个单元格的起始行（续行时使用），首次拆分传 null
     * @return 行内拆分结果
     * @throws LayoutException 行号超出测量结果或起始行为负数时抛出
     */
    public PartialRow computePartialRow(int rowIndex, TableRow row, TableMeasure measure, double availableHeight,
                                        int[] fromLineByCell) {
        return computePartialRow(rowIndex, row, measure, availableHeight, fromLineByCell, false);
    }

    /**
     * 强制推进的行内拆分：在空栏顶部仍一行都放不下时使用，每个尚有剩余文本的单元格至少推进一行，
     * 保证分页循环一定能结束
     */
    public PartialRow forcePartialRow(int rowIndex, TableRow row, TableMeasure measure, double availableHeight,
                                      int[] fromLineByCell) {
        return computePartialRow(rowIndex, row, measure, availableHeight, fromLineByCell, true);
    }

    private PartialRow computePartialRow(int rowIndex, TableRow row, TableMeasure measure, double availableHeight,
                                         int[] fromLineByCell, boolean forceLine) {
        ImmutableList<TableRowMeasure> rows = measure.getRows();
        if (rowIndex < 0 || rowIndex >= rows.size()) {
            throw new LayoutException("Invalid rowIndex " + rowIndex + ": measure has " + rows.size() + " rows");
        }
        ImmutableList<CellMeasure> cells = rows.get(rowIndex).getCells();
        int cellCount = cells.size();
        double available = Double.isFinite(availableHeight) ? availableHeight : 0;

        int[] startLines = new int[cellCount];
        int[] toLines = new int[cellCount];
        double[] heights = new double[cellCount];
        double[] paddings = new double[cellCount];

        for (int cellIndex = 0; cellIndex < cellCount; cellIndex++) {
            int startLine = fromLineByCell != null && cellIndex < fromLineByCell.length ? fromLineByCell[cellIndex] : 0;
            if (startLine < 0) {
                throw new LayoutException("Invalid fromLine " + startLine + " for cell " + cellIndex
                        + " of row " + rowIndex + ": must be >= 0");
            }
            startLines[cellIndex] = startLine;
            paddings[cellIndex] = cellPadding(row, cellIndex).vertical();
            double availableForLines = Math.max(0, available - paddings[cellIndex]);

            ImmutableList<LineMeasure> lines = cells.get(cellIndex).getLines();
            double cumulative = 0;
            int cutLine = startLine;
            for (int i = startLine; i < lines.size(); i++) {
                double lineHeight = lines.get(i).lineHeight;
                if (cumulative + lineHeight > availableForLines) {
                    break;
                }
                cumulative += lineHeight;
                cutLine = i + 1;
            }
            if (forceLine && cutLine == startLine && startLine < lines.size()) {
                cumulative = lines.get(startLine).lineHeight;
                cutLine = startLine + 1;
            }
            toLines[cellIndex] = cutLine;
            heights[cellIndex] = cumulative;
        }

        double partialHeight = 0;
        double maxPadding = 0;
        boolean madeProgress = false;
        boolean firstPart = true;
        boolean allExhausted = true;
        for (int cellIndex = 0; cellIndex < cellCount; cellIndex++) {
            maxPadding = Math.max(maxPadding, paddings[cellIndex]);
            partialHeight = Math.max(partialHeight, heights[cellIndex] + paddings[cellIndex]);
            madeProgress |= toLines[cellIndex] > startLines[cellIndex];
            firstPart &= startLines[cellIndex] == 0;
            allExhausted &= toLines[cellIndex] >= cells.get(cellIndex).totalLines();
        }
        boolean lastPart = allExhausted || !madeProgress;
        if (partialHeight == 0 && firstPart) {
            partialHeight = maxPadding;
        }

        PartialRow partialRow = new PartialRow(rowIndex, startLines, toLines, firstPart, lastPart, madeProgress,
                partialHeight);
        if (LOGGER.isTraceEnabled()) {
            LOGGER.trace("Partial row {} in {}px{}: {}", rowIndex, available, forceLine ? " (forced)" : "", partialRow);
        }
        return partialRow;
    }

    /**
     * 计算从 startRow 开始在可用高度内的拆分点
     *
     * 规则：
     * - 整行放得下则继续累加
     * - 超过整栏高度的超高行无视 cantSplit，强制行内拆分
     * - cantSplit 行（或显式行高留有余量且不超过整栏高度的行）放不下时在其前面断开
     * - 其余行在剩余空间不少于最小拆分高度时尝试行内拆分，至少要推进一行文本
     *
     * 一行都放不下时返回 endRow == startRow 且不带拆分行，由调用方换栏或强制拆分
     *
     * @param block            表格
     * @param measure          表格测量结果
     * @param startRow         起始行（包含）
     * @param availableHeight  可用高度
     * @param fullColumnHeight 整栏高度，用于识别超高行；非正数表示未知
     * @param cellSpacing      单元格间距
     * @param isContinuation   是否为续表片段（续表不计顶部间距）
     * @return 拆分点
     */
    public SplitPoint findSplitPoint(TableBlock block, TableMeasure measure, int startRow, double availableHeight,
                                     double fullColumnHeight, double cellSpacing, boolean isContinuation) {
        ImmutableList<TableRow> rows = block.getRows();
        ImmutableList<TableRowMeasure> rowMeasures = measure.getRows();
        boolean knownColumnHeight = Double.isFinite(fullColumnHeight) && fullColumnHeight > 0;
        double accumulated = isContinuation ? 0 : cellSpacing;
        int lastFitRow = startRow;

        for (int i = startRow; i < rows.size(); i++) {
            TableRow row = rows.get(i);
            TableRowMeasure rowMeasure = i < rowMeasures.size() ? rowMeasures.get(i) : null;
            double rowHeight = rowMeasure == null ? 0 : rowMeasure.height;
            double rowHeightWithSpacing = rowHeight + cellSpacing;

            if (accumulated + rowHeightWithSpacing <= availableHeight) {
                accumulated += rowHeightWithSpacing;
                lastFitRow = i + 1;
                continue;
            }

            double remaining = availableHeight - accumulated;
            boolean overTall = knownColumnHeight && rowHeight > fullColumnHeight;
            if (overTall) {
                PartialRow partial = computePartialRow(i, row, measure, remaining, null);
                if (partial.madeProgress) {
                    LOGGER.debug("Row {} of table {} is taller than a column, splitting at {}", i, block.id, partial);
                    return new SplitPoint(i + 1, partial);
                }
                return new SplitPoint(lastFitRow, null);
            }

            boolean cantSplit = row.cantSplit
                    || (rowMeasure != null && hasExplicitRowHeightSlack(row, rowMeasure));
            if (cantSplit) {
                return new SplitPoint(lastFitRow, null);
            }

            if (remaining >= minPartialRowHeight && rowMeasure != null) {
                PartialRow partial = computePartialRow(i, row, measure, remaining, null);
                if (partial.madeProgress) {
                    return new SplitPoint(i + 1, partial);
                }
            }
            return new SplitPoint(lastFitRow, null);
        }
        return new SplitPoint(rows.size(), null);
    }

    /**
     * Whether the row's explicit height leaves room beyond its content, which makes it behave like
     * a row that cannot split.
     */
    public boolean hasExplicitRowHeightSlack(TableRow row, TableRowMeasure rowMeasure) {
        if (row == null || !row.hasFiniteExplicitHeight()) {
            return false;
        }
        return rowMeasure.height > rowContentHeight(row, rowMeasure) + ROW_HEIGHT_EPSILON;
    }

    /**
     * Natural height of a row: tallest cell's lines plus that cell's vertical padding.
     */
    public double rowContentHeight(TableRow row, TableRowMeasure rowMeasure) {
        double contentHeight = 0;
        ImmutableList<CellMeasure> cells = rowMeasure.getCells();
        for (int cellIndex = 0; cellIndex < cells.size(); cellIndex++) {
            double padding = cellPadding(row, cellIndex).vertical();
            contentHeight = Math.max(contentHeight, cells.get(cellIndex).linesHeight() + padding);
        }
        return contentHeight;
    }

    /**
     * Whether any cell of the partial row still has lines after the slice.
     */
    public static boolean hasRemainingLines(PartialRow partialRow, TableMeasure measure) {
        ImmutableList<CellMeasure> cells = measure.getRows().get(partialRow.rowIndex).getCells();
        for (int cellIndex = 0; cellIndex < cells.size(); cellIndex++) {
            if (partialRow.toLine(cellIndex) < cells.get(cellIndex).totalLines()) {
                return true;
            }
        }
        return false;
    }

    CellPadding cellPadding(TableRow row, int cellIndex) {
        TableCell cell = row == null ? null : row.cellAt(cellIndex);
        CellPadding padding = cell == null || cell.padding == null ? CellPadding.UNSPECIFIED : cell.padding;
        return padding.resolve(defaultPadding);
    }
}
