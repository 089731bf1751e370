package com.gs.ep.pageflow.table;

import com.gs.ep.pageflow.cursor.Paginator;
import com.gs.ep.pageflow.model.CellMeasure;
import com.gs.ep.pageflow.model.CellPadding;
import com.gs.ep.pageflow.model.ColumnLayout;
import com.gs.ep.pageflow.model.Margins;
import com.gs.ep.pageflow.model.PageSize;
import com.gs.ep.pageflow.model.TableBlock;
import com.gs.ep.pageflow.model.TableMeasure;
import com.gs.ep.pageflow.model.TableRow;
import com.gs.ep.pageflow.model.TableRowMeasure;
import com.gs.ep.pageflow.section.SectionStateMachine;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Arrays;

/**
 * Shared builders for table tests. Pages are 600x600 with 50px margins, so a single column is
 * 500px wide and 500px tall.
 */
final class TableFixtures {

    static final CellPadding PADDING = CellPadding.of(2, 2, 4, 4);
    static final double VERTICAL_PADDING = 4;
    static final double CONTENT_BOTTOM = 550;

    private TableFixtures() {
    }

    static TableRowSplitter splitter() {
        return new TableRowSplitter(20, PADDING);
    }

    static CellMeasure cell(int lineCount, double lineHeight) {
        double[] heights = new double[lineCount];
        Arrays.fill(heights, lineHeight);
        return CellMeasure.ofLines(heights);
    }

    /**
     * Row measure sized like the measuring pass does: tallest cell plus its vertical padding.
     */
    static TableRowMeasure rowMeasure(CellMeasure... cells) {
        double height = 0;
        for (CellMeasure cell : cells) {
            height = Math.max(height, cell.linesHeight() + VERTICAL_PADDING);
        }
        return new TableRowMeasure(height, Arrays.asList(cells));
    }

    /**
     * Single-cell row of {@code lineCount} lines.
     */
    static TableRowMeasure lines(int lineCount, double lineHeight) {
        return rowMeasure(cell(lineCount, lineHeight));
    }

    static TableMeasure measure(TableRowMeasure... rows) {
        return TableMeasure.of(Arrays.asList(rows), 300);
    }

    /**
     * {@code count} single-cell rows of one 96px line, i.e. 100px rows.
     */
    static TableMeasure uniformMeasure(int count) {
        MutableList<TableRowMeasure> rows = Lists.mutable.empty();
        for (int i = 0; i < count; i++) {
            rows.add(lines(1, 96));
        }
        return TableMeasure.of(rows, 300);
    }

    static TableBlock table(String id, int plainRows) {
        return table(id, 0, plainRows);
    }

    static TableBlock table(String id, int headerRows, int bodyRows) {
        MutableList<TableRow> rows = Lists.mutable.empty();
        for (int i = 0; i < headerRows; i++) {
            rows.add(TableRow.header(1));
        }
        for (int i = 0; i < bodyRows; i++) {
            rows.add(TableRow.plain(1));
        }
        return TableBlock.of(id, rows);
    }

    static Paginator paginator() {
        return paginator(ColumnLayout.SINGLE);
    }

    static Paginator paginator(ColumnLayout columns) {
        return new Paginator(SectionStateMachine.initialState(new PageSize(600, 600), Margins.uniform(50),
                columns, 0, 0));
    }

    static TableLayoutContext context(TableBlock block, TableMeasure measure, Paginator paginator) {
        return new TableLayoutContext(block, measure, paginator.getColumnWidth(), paginator);
    }
}
