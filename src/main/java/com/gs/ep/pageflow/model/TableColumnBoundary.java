package com.gs.ep.pageflow.model;

/**
 * Column edge metadata attached to table fragments, used by interactive column resizing.
 * Coordinates are relative to the fragment.
 */
public final class TableColumnBoundary {

    public final int index;
    public final double x;
    public final double width;
    public final double minWidth;
    public final boolean resizable;

    public TableColumnBoundary(int index, double x, double width, double minWidth, boolean resizable) {
        this.index = index;
        this.x = x;
        this.width = width;
        this.minWidth = minWidth;
        this.resizable = resizable;
    }
}
