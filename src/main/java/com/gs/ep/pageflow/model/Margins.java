package com.gs.ep.pageflow.model;

import java.util.Objects;

/**
 * Page margins in pixels.
 */
public final class Margins {

    public final double top;
    public final double bottom;
    public final double left;
    public final double right;

    public Margins(double top, double bottom, double left, double right) {
        this.top = top;
        this.bottom = bottom;
        this.left = left;
        this.right = right;
    }

    public static Margins uniform(double value) {
        return new Margins(value, value, value, value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Margins)) {
            return false;
        }
        Margins other = (Margins) o;
        return Double.compare(top, other.top) == 0
                && Double.compare(bottom, other.bottom) == 0
                && Double.compare(left, other.left) == 0
                && Double.compare(right, other.right) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(top, bottom, left, right);
    }

    @Override
    public String toString() {
        return "Margins{top=" + top + ", bottom=" + bottom + ", left=" + left + ", right=" + right + "}";
    }
}
