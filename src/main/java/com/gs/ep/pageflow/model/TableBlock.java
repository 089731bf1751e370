package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

import java.util.Objects;

/**
 * Table block handed to the table fragmenter.
 */
public final class TableBlock {

    public final String id;
    private final ImmutableList<TableRow> rows;
    public final TableAttributes attrs;
    /** Anchored tables are positioned by the host's float placement, not by the flow */
    public final boolean anchored;
    public final DocRange range;

    public TableBlock(String id, Iterable<TableRow> rows, TableAttributes attrs, boolean anchored, DocRange range) {
        this.id = Objects.requireNonNull(id, "id");
        this.rows = Lists.immutable.withAll(rows);
        this.attrs = attrs == null ? TableAttributes.DEFAULT : attrs;
        this.anchored = anchored;
        this.range = range == null ? DocRange.EMPTY : range;
    }

    public static TableBlock of(String id, Iterable<TableRow> rows) {
        return new TableBlock(id, rows, TableAttributes.DEFAULT, false, DocRange.EMPTY);
    }

    public ImmutableList<TableRow> getRows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }
}
