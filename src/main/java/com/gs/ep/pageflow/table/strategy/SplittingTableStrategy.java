package com.gs.ep.pageflow.table.strategy;

import com.gs.ep.pageflow.cursor.PageState;
import com.gs.ep.pageflow.model.PartialRow;
import com.gs.ep.pageflow.model.TableBlock;
import com.gs.ep.pageflow.model.TableFragment;
import com.gs.ep.pageflow.model.TableMeasure;
import com.gs.ep.pageflow.model.TableRow;
import com.gs.ep.pageflow.model.TableRowMeasure;
import com.gs.ep.pageflow.table.AbstractTableLayoutStrategy;
import com.gs.ep.pageflow.table.SplitPoint;
import com.gs.ep.pageflow.table.TableGeometry;
import com.gs.ep.pageflow.table.TableLayoutContext;
import com.gs.ep.pageflow.table.TableLayoutMode;
import com.gs.ep.pageflow.table.TableRowSplitter;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 按行拆分策略
 *
 * 适用于普通（非浮动）表格，主要特点：
 * - 表格放不下时在行边界处分页
 * - 可拆分的行放不下时在行内按文本行拆分，未完成的行在后续栏中继续
 * - cantSplit 行整行移到下一栏，只有超过整栏高度的行才强制拆分
 * - 续表片段在空间足够时重复表头
 * - 分隔边框模式下每行（含重复表头）计入单元格间距，首个片段额外计入顶部间距
 */
public class SplittingTableStrategy extends AbstractTableLayoutStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(SplittingTableStrategy.class);

    private final TableRowSplitter splitter;

    public SplittingTableStrategy(TableRowSplitter splitter, double minColumnWidth, double maxMinColumnWidth) {
        super(minColumnWidth, maxMinColumnWidth);
        this.splitter = splitter;
    }

    @Override
    public TableLayoutMode getMode() {
        return TableLayoutMode.SPLITTING;
    }

    @Override
    public ImmutableList<TableFragment> layout(TableLayoutContext context) {
        TableBlock block = context.block;
        TableMeasure measure = context.measure;
        MutableList<TableFragment> fragments = Lists.mutable.empty();

        int rowCount = block.rowCount();
        int headerCount = TableGeometry.countHeaderRows(block);
        double cellSpacing = TableGeometry.cellSpacing(block.attrs);
        double headerHeight = headerCount > 0
                ? TableGeometry.sumRowHeights(measure, 0, headerCount) + headerCount * cellSpacing
                : 0;

        // 1. 起始预检：当前栏已有内容时决定是否先换栏
        PageState state = preflight(context);

        // 2. 无行但有高度的占位表格
        if (rowCount == 0) {
            if (measure.getTotalHeight() > 0) {
                double height = Math.max(0, Math.min(measure.getTotalHeight(), state.getRemainingHeight()));
                fragments.add(placeFragment(context, state, 0, 0, null, 0, false, false, height));
            }
            return fragments.toImmutable();
        }

        // 3. 逐行排版，直到所有行（包括未完成的拆分行）处理完毕
        int currentRow = 0;
        boolean continuation = false;
        PartialRow pendingPartialRow = null;

        while (currentRow < rowCount || pendingPartialRow != null) {
            state = context.cursor.ensurePage();
            double available = state.getRemainingHeight();

            int repeatHeaderCount = 0;
            boolean firstFragment = currentRow == 0 && pendingPartialRow == null;
            int bodyRow = pendingPartialRow != null ? pendingPartialRow.rowIndex : currentRow;
            if (!firstFragment && headerCount > 0 && bodyRow >= headerCount && headerHeight <= available) {
                repeatHeaderCount = headerCount;
            }
            double repeatedHeaderHeight = repeatHeaderCount > 0 ? headerHeight : 0;
            double availableForBody = available - repeatedHeaderHeight;

            // 3a. 继续未完成的拆分行
            if (pendingPartialRow != null) {
                int rowIndex = pendingPartialRow.rowIndex;
                int[] fromLines = pendingPartialRow.toLineByCell.toArray();
                TableRow row = block.getRows().get(rowIndex);

                PartialRow partial = splitter.computePartialRow(rowIndex, row, measure, availableForBody, fromLines);
                if (!partial.madeProgress && state.isAtColumnTop() && repeatHeaderCount > 0) {
                    // 表头不应导致本可避免的强制拆分
                    PartialRow withoutHeaders = splitter.computePartialRow(rowIndex, row, measure, available, fromLines);
                    if (withoutHeaders.madeProgress) {
                        repeatHeaderCount = 0;
                        repeatedHeaderHeight = 0;
                        partial = withoutHeaders;
                    }
                }
                if (!partial.madeProgress && state.isAtColumnTop()) {
                    partial = splitter.forcePartialRow(rowIndex, row, measure, availableForBody, fromLines);
                }
                boolean remainingAfter = TableRowSplitter.hasRemainingLines(partial, measure);
                double height = partial.partialHeight + repeatedHeaderHeight
                        + (!remainingAfter ? cellSpacing : 0);

                if (partial.madeProgress && height > 0) {
                    fragments.add(placeFragment(context, state, rowIndex, rowIndex + 1, partial, repeatHeaderCount,
                            true, remainingAfter || rowIndex + 1 < rowCount, height));
                }

                if (!remainingAfter) {
                    currentRow = rowIndex + 1;
                    pendingPartialRow = null;
                } else if (!partial.madeProgress) {
                    LOGGER.trace("No room for row {} of table {} on page {}, advancing",
                            rowIndex, block.id, state.getPageNumber());
                    context.cursor.advanceColumn(state);
                } else {
                    pendingPartialRow = partial;
                }
                continuation = true;
                continue;
            }

            // 3b. 常规行处理
            int startRow = currentRow;
            SplitPoint split = splitter.findSplitPoint(block, measure, startRow, availableForBody,
                    state.getColumnHeight(), cellSpacing, continuation);

            if (split.isEmpty(startRow) && !state.isAtColumnTop()) {
                context.cursor.advanceColumn(state);
                continue;
            }

            if (split.isEmpty(startRow) && repeatHeaderCount > 0) {
                // 表头不应导致本可避免的强制拆分
                SplitPoint withoutHeaders = splitter.findSplitPoint(block, measure, startRow, available,
                        state.getColumnHeight(), cellSpacing, continuation);
                if (!withoutHeaders.isEmpty(startRow)) {
                    repeatHeaderCount = 0;
                    repeatedHeaderHeight = 0;
                    availableForBody = available;
                    split = withoutHeaders;
                }
            }

            if (split.isEmpty(startRow)) {
                // 空栏中仍放不下：强制行内拆分
                TableRow row = block.getRows().get(startRow);
                PartialRow forced = splitter.computePartialRow(startRow, row, measure, availableForBody, null);
                if (!forced.madeProgress) {
                    forced = splitter.forcePartialRow(startRow, row, measure, availableForBody, null);
                }
                double spacing = 0;
                if (cellSpacing > 0) {
                    spacing = (continuation ? 0 : cellSpacing) + (forced.lastPart ? cellSpacing : 0);
                }
                double height = forced.partialHeight + repeatedHeaderHeight + spacing;
                LOGGER.debug("Forcing split of row {} of table {} on page {}: {}",
                        startRow, block.id, state.getPageNumber(), forced);
                fragments.add(placeFragment(context, state, startRow, startRow + 1, forced, repeatHeaderCount,
                        continuation, !forced.lastPart || startRow + 1 < rowCount, height));
                if (forced.lastPart) {
                    currentRow = startRow + 1;
                    pendingPartialRow = null;
                } else {
                    pendingPartialRow = forced;
                }
                continuation = true;
                continue;
            }

            PartialRow partial = split.partialRow;
            int endRow = split.endRow;
            boolean includeTopSpacing = !continuation;
            double height;
            if (partial != null) {
                int fullBodyRows = Math.max(0, endRow - startRow - 1);
                double fullRowsHeight = TableGeometry.sumRowHeights(measure, startRow, Math.max(startRow, endRow - 1));
                double spacing = 0;
                if (cellSpacing > 0) {
                    spacing = (includeTopSpacing ? cellSpacing : 0)
                            + fullBodyRows * cellSpacing
                            + (partial.lastPart ? cellSpacing : 0);
                }
                height = repeatedHeaderHeight + fullRowsHeight + partial.partialHeight + spacing;
            } else {
                height = TableGeometry.fragmentHeight(measure, startRow, endRow, 0, cellSpacing, includeTopSpacing)
                        + repeatedHeaderHeight;
            }

            boolean continuesOnNext = endRow < rowCount || (partial != null && !partial.lastPart);
            fragments.add(placeFragment(context, state, startRow, endRow, partial, repeatHeaderCount,
                    continuation, continuesOnNext, height));

            if (partial != null && !partial.lastPart) {
                pendingPartialRow = partial;
                currentRow = partial.rowIndex;
            } else {
                currentRow = endRow;
                pendingPartialRow = null;
            }
            continuation = true;
        }

        LOGGER.debug("Table {} laid out in {} fragment(s)", block.id, fragments.size());
        return fragments.toImmutable();
    }

    /**
     * 起始预检
     *
     * 当前栏已有内容时：
     * - 首行不可拆分（cantSplit 或显式行高留有余量且不超过整栏）时要求整行放得下，否则换栏
     * - 首行可拆分时只要首行能放下至少一行文本就从当前位置开始，否则换栏
     * - 没有行测量结果时按首行高度（或表格总高度）判断
     */
    private PageState preflight(TableLayoutContext context) {
        TableBlock block = context.block;
        TableMeasure measure = context.measure;
        PageState state = context.cursor.ensurePage();
        if (state.isAtColumnTop()) {
            return state;
        }
        double available = state.getRemainingHeight();
        ImmutableList<TableRowMeasure> rowMeasures = measure.getRows();

        if (rowMeasures.notEmpty() && block.rowCount() > 0) {
            TableRow firstRow = block.getRows().get(0);
            TableRowMeasure firstMeasure = rowMeasures.get(0);
            boolean fitsColumn = firstMeasure.height <= state.getColumnHeight();
            boolean treatAsCantSplit = firstRow.cantSplit
                    || (splitter.hasExplicitRowHeightSlack(firstRow, firstMeasure) && fitsColumn);
            if (treatAsCantSplit) {
                if (firstMeasure.height > available) {
                    LOGGER.debug("First row of table {} does not fit, starting in next column", block.id);
                    return context.cursor.advanceColumn(state);
                }
            } else {
                // 首个片段计入顶部单元格间距
                double availableForRow = available - TableGeometry.cellSpacing(block.attrs);
                PartialRow partial = splitter.computePartialRow(0, firstRow, measure, availableForRow, null);
                if (!partial.madeProgress || partial.partialHeight <= 0) {
                    LOGGER.debug("No line of table {} fits, starting in next column", block.id);
                    return context.cursor.advanceColumn(state);
                }
            }
            return state;
        }

        double minRequired = rowMeasures.notEmpty()
                ? TableGeometry.sumRowHeights(measure, 0, 1)
                : measure.getTotalHeight();
        if (minRequired > available) {
            return context.cursor.advanceColumn(state);
        }
        return state;
    }
}
