package com.gs.ep.pageflow.model;

import java.util.Objects;

/**
 * Page dimensions in pixels.
 */
public final class PageSize {

    /** US Letter at 96 dpi */
    public static final PageSize LETTER = new PageSize(816, 1056);

    public final double w;
    public final double h;

    public PageSize(double w, double h) {
        this.w = w;
        this.h = h;
    }

    public boolean isValid() {
        return Double.isFinite(w) && Double.isFinite(h) && w > 0 && h > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PageSize)) {
            return false;
        }
        PageSize other = (PageSize) o;
        return Double.compare(w, other.w) == 0 && Double.compare(h, other.h) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(w, h);
    }

    @Override
    public String toString() {
        return w + "x" + h;
    }
}
