package com.gs.ep.pageflow.table;

/**
 * Horizontal placement of a table fragment inside its column.
 */
public final class TableFrame {

    public final double x;
    public final double width;

    public TableFrame(double x, double width) {
        this.x = x;
        this.width = width;
    }

    @Override
    public String toString() {
        return "TableFrame{x=" + x + ", width=" + width + "}";
    }
}
