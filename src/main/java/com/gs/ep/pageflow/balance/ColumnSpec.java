package com.gs.ep.pageflow.balance;

/**
 * Resolved column geometry used when moving already placed fragments.
 */
public final class ColumnSpec {

    public final int count;
    public final double gap;
    public final double width;

    public ColumnSpec(int count, double gap, double width) {
        this.count = count;
        this.gap = gap;
        this.width = width;
    }

    public double columnX(double leftMargin, int index) {
        return leftMargin + index * (width + gap);
    }
}
