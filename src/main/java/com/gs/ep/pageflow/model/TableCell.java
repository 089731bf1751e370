package com.gs.ep.pageflow.model;

/**
 * Table cell attributes relevant to pagination.
 */
public final class TableCell {

    public final CellPadding padding;
    public final DocRange range;

    public TableCell(CellPadding padding, DocRange range) {
        this.padding = padding == null ? CellPadding.UNSPECIFIED : padding;
        this.range = range == null ? DocRange.EMPTY : range;
    }

    public static TableCell plain() {
        return new TableCell(CellPadding.UNSPECIFIED, DocRange.EMPTY);
    }
}
