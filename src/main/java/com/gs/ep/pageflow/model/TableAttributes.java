package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.impl.factory.Maps;

import java.util.Map;

/**
 * Table-level attributes consulted while placing table fragments.
 */
public final class TableAttributes {

    public static final TableAttributes DEFAULT = builder().build();

    public final BorderCollapse borderCollapse;
    /** Spacing between cells when borders are separate, may be null */
    public final Double cellSpacing;
    /** Offset of the table from the column's left edge, may be negative or null */
    public final Double tableIndent;
    public final TableJustification justification;
    /** Floating (positioned) table properties; a non-empty map makes the table monolithic */
    public final ImmutableMap<String, Object> floatingProperties;

    private TableAttributes(Builder builder) {
        this.borderCollapse = builder.borderCollapse;
        this.cellSpacing = builder.cellSpacing;
        this.tableIndent = builder.tableIndent;
        this.justification = builder.justification;
        this.floatingProperties = builder.floatingProperties;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isFloating() {
        return floatingProperties.notEmpty();
    }

    public static final class Builder {
        private BorderCollapse borderCollapse = BorderCollapse.COLLAPSE;
        private Double cellSpacing;
        private Double tableIndent;
        private TableJustification justification;
        private ImmutableMap<String, Object> floatingProperties = Maps.immutable.empty();

        public Builder borderCollapse(BorderCollapse borderCollapse) {
            this.borderCollapse = borderCollapse == null ? BorderCollapse.COLLAPSE : borderCollapse;
            return this;
        }

        public Builder cellSpacing(Double cellSpacing) {
            this.cellSpacing = cellSpacing;
            return this;
        }

        public Builder tableIndent(Double tableIndent) {
            this.tableIndent = tableIndent;
            return this;
        }

        public Builder justification(TableJustification justification) {
            this.justification = justification;
            return this;
        }

        public Builder floatingProperties(Map<String, Object> floatingProperties) {
            this.floatingProperties = floatingProperties == null
                    ? Maps.immutable.empty()
                    : Maps.immutable.ofMap(floatingProperties);
            return this;
        }

        public TableAttributes build() {
            return new TableAttributes(this);
        }
    }
}
