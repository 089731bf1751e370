package com.gs.ep.pageflow.cursor;

import com.gs.ep.pageflow.model.Fragment;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;

import java.util.Objects;

/**
 * Cursor into one column of one page. The fragment list belongs to the page and is shared by all
 * columns of that page; it only grows.
 */
public class PageState {

    private static final double EPSILON = 0.01;

    private final int pageNumber;
    private final int columnIndex;
    private final double contentTop;
    private final double contentBottom;
    private final MutableList<Fragment> fragments;
    private double cursorY;

    public PageState(int pageNumber, int columnIndex, double contentTop, double contentBottom,
                     MutableList<Fragment> fragments) {
        this.pageNumber = pageNumber;
        this.columnIndex = columnIndex;
        this.contentTop = contentTop;
        this.contentBottom = contentBottom;
        this.fragments = Objects.requireNonNull(fragments, "fragments");
        this.cursorY = contentTop;
    }

    public int getPageNumber() {
        return pageNumber;
    }

    public int getColumnIndex() {
        return columnIndex;
    }

    public double getCursorY() {
        return cursorY;
    }

    /**
     * Moves the cursor down by {@code height}.
     */
    public void advance(double height) {
        cursorY += height;
    }

    public double getContentTop() {
        return contentTop;
    }

    /**
     * Lowest y usable by body content in this column.
     */
    public double getContentBottom() {
        return contentBottom;
    }

    public double getRemainingHeight() {
        return contentBottom - cursorY;
    }

    /**
     * Height of the whole column, from its top to the content bottom.
     */
    public double getColumnHeight() {
        return contentBottom - contentTop;
    }

    /**
     * Whether nothing has been placed in this column yet.
     */
    public boolean isAtColumnTop() {
        return cursorY <= contentTop + EPSILON;
    }

    public void addFragment(Fragment fragment) {
        fragments.add(Objects.requireNonNull(fragment, "fragment"));
    }

    public boolean hasFragments() {
        return fragments.notEmpty();
    }

    public ImmutableList<Fragment> getFragments() {
        return fragments.toImmutable();
    }

    @Override
    public String toString() {
        return "PageState{page=" + pageNumber + ", column=" + columnIndex + ", cursorY=" + cursorY
                + ", top=" + contentTop + ", bottom=" + contentBottom + ", fragments=" + fragments.size() + "}";
    }
}
