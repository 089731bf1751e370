package com.gs.ep.pageflow.model;

import java.util.Objects;

/**
 * Column configuration of a section: number of columns and the gap between them.
 */
public final class ColumnLayout {

    /** Layout used whenever a section does not declare its columns */
    public static final ColumnLayout SINGLE = new ColumnLayout(1, 0);

    public final int count;
    public final double gap;

    public ColumnLayout(int count, double gap) {
        this.count = count;
        this.gap = gap;
    }

    /**
     * Column layout with out-of-range values clamped: a count below one becomes one and a negative
     * or non-finite gap becomes zero.
     */
    public static ColumnLayout sanitized(int count, double gap) {
        int safeCount = Math.max(1, count);
        double safeGap = Double.isFinite(gap) && gap > 0 ? gap : 0;
        return new ColumnLayout(safeCount, safeGap);
    }

    public boolean isMultiColumn() {
        return count > 1;
    }

    /**
     * Width of one column when {@code availableWidth} is shared by all columns and gaps.
     */
    public double columnWidth(double availableWidth) {
        double width = (availableWidth - gap * (count - 1)) / Math.max(1, count);
        return Math.max(0, width);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ColumnLayout)) {
            return false;
        }
        ColumnLayout other = (ColumnLayout) o;
        return count == other.count && Double.compare(gap, other.gap) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(count, gap);
    }

    @Override
    public String toString() {
        return "{count=" + count + ", gap=" + gap + "}";
    }
}
