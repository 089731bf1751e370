package com.gs.ep.pageflow.table;

import com.gs.ep.pageflow.cursor.PageState;
import com.gs.ep.pageflow.model.PartialRow;
import com.gs.ep.pageflow.model.TableColumnBoundary;
import com.gs.ep.pageflow.model.TableFragment;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * 表格排版策略的抽象基类
 *
 * 提供所有策略通用的片段构建方法：栏内定位（对齐方式与缩进）、列边界元数据、文档位置范围。
 * 子类只负责决定片段包含哪些行以及片段高度。
 */
public abstract class AbstractTableLayoutStrategy implements TableLayoutStrategy {

    private final double minColumnWidth;
    private final double maxMinColumnWidth;

    protected AbstractTableLayoutStrategy(double minColumnWidth, double maxMinColumnWidth) {
        this.minColumnWidth = minColumnWidth;
        this.maxMinColumnWidth = maxMinColumnWidth;
    }

    // ==================== 片段构建 ====================

    /**
     * 在当前游标位置放置一个表格片段，并将游标下移片段高度
     */
    protected TableFragment placeFragment(TableLayoutContext context, PageState state, int fromRow, int toRow,
                                          PartialRow partialRow, int repeatHeaderCount,
                                          boolean continuesFromPrev, boolean continuesOnNext, double height) {
        TableFrame frame = resolveFrame(context, state);
        TableFragment fragment = new TableFragment(context.block.id, fromRow, toRow, partialRow, repeatHeaderCount,
                continuesFromPrev, continuesOnNext, frame.x, state.getCursorY(), frame.width, height);
        fragment.setColumnBoundaries(columnBoundaries(context));
        fragment.setRange(TableGeometry.fragmentRange(context.block, context.measure, fromRow, toRow, partialRow));
        state.addFragment(fragment);
        state.advance(height);
        return fragment;
    }

    protected TableFrame resolveFrame(TableLayoutContext context, PageState state) {
        double baseX = context.cursor.columnX(state.getColumnIndex());
        double tableWidth = TableGeometry.baseWidth(context.columnWidth, context.measure);
        return TableGeometry.resolveFrame(baseX, context.columnWidth, tableWidth, context.block.attrs);
    }

    protected ImmutableList<TableColumnBoundary> columnBoundaries(TableLayoutContext context) {
        return TableGeometry.columnBoundaries(context.measure, minColumnWidth, maxMinColumnWidth);
    }
}
