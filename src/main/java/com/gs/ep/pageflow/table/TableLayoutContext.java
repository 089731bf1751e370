package com.gs.ep.pageflow.table;

import com.gs.ep.pageflow.cursor.PageCursor;
import com.gs.ep.pageflow.model.TableBlock;
import com.gs.ep.pageflow.model.TableMeasure;

import java.util.Objects;

/**
 * 表格排版上下文：待排版的表格、其测量结果、栏宽以及分页游标
 */
public final class TableLayoutContext {

    public final TableBlock block;
    public final TableMeasure measure;
    public final double columnWidth;
    public final PageCursor cursor;

    public TableLayoutContext(TableBlock block, TableMeasure measure, double columnWidth, PageCursor cursor) {
        this.block = Objects.requireNonNull(block, "block");
        this.measure = Objects.requireNonNull(measure, "measure");
        this.columnWidth = Double.isFinite(columnWidth) ? Math.max(0, columnWidth) : 0;
        this.cursor = Objects.requireNonNull(cursor, "cursor");
    }
}
