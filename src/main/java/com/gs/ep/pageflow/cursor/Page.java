package com.gs.ep.pageflow.cursor;

import com.gs.ep.pageflow.model.ColumnLayout;
import com.gs.ep.pageflow.model.Fragment;
import com.gs.ep.pageflow.model.Margins;
import com.gs.ep.pageflow.model.Orientation;
import com.gs.ep.pageflow.model.PageSize;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * A laid out page: the geometry it was created with and the fragments placed on it.
 */
public class Page {

    private final int number;
    private final PageSize size;
    private final Margins margins;
    private final ColumnLayout columns;
    private final Orientation orientation;
    private final MutableList<Fragment> fragments = Lists.mutable.empty();

    public Page(int number, PageSize size, Margins margins, ColumnLayout columns, Orientation orientation) {
        this.number = number;
        this.size = size;
        this.margins = margins;
        this.columns = columns;
        this.orientation = orientation;
    }

    public int getNumber() {
        return number;
    }

    public PageSize getSize() {
        return size;
    }

    public Margins getMargins() {
        return margins;
    }

    /**
     * Columns the page started with; a mid-page region may switch to another layout.
     */
    public ColumnLayout getColumns() {
        return columns;
    }

    public Orientation getOrientation() {
        return orientation;
    }

    public double getContentBottom() {
        return size.h - margins.bottom;
    }

    public boolean isBlank() {
        return fragments.isEmpty();
    }

    public ImmutableList<Fragment> getFragments() {
        return fragments.toImmutable();
    }

    MutableList<Fragment> fragmentList() {
        return fragments;
    }

    @Override
    public String toString() {
        return "Page{" + number + ", " + size + ", columns=" + columns + ", fragments=" + fragments.size() + "}";
    }
}
