package com.gs.ep.pageflow.cursor;

/**
 * Capability of the page-building loop that the layout core writes against: the current column, a
 * way to move past it, and the x offset of each column.
 */
public interface PageCursor {

    /**
     * Returns the current page and column, creating the first page when none exists yet.
     */
    PageState ensurePage();

    /**
     * Moves to the next column, or to the first column of a new page when the current page has no
     * further column. The returned state is positioned at the top of that column.
     */
    PageState advanceColumn(PageState state);

    /**
     * X offset of the given column on the current page.
     */
    double columnX(int columnIndex);
}
