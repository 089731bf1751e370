package com.gs.ep.pageflow.section;

import com.gs.ep.pageflow.model.ColumnLayout;
import com.gs.ep.pageflow.model.Orientation;
import com.gs.ep.pageflow.model.PageSize;

/**
 * Section-break marker found in the block stream. Carries the geometry of the section that starts
 * after it.
 */
public final class SectionBreak {

    public final String id;
    /** Break type, null means continuous */
    public final SectionType type;
    public final SectionMargins margins;
    public final PageSize pageSize;
    public final Orientation orientation;
    /** Explicit column layout; null resets the section to a single column */
    public final ColumnLayout columns;
    public final boolean firstSection;
    public final boolean requirePageBoundary;
    /** Explicit column balancing flag, null when the document does not say */
    public final Boolean balanceColumns;

    private SectionBreak(Builder builder) {
        this.id = builder.id;
        this.type = builder.type;
        this.margins = builder.margins;
        this.pageSize = builder.pageSize;
        this.orientation = builder.orientation;
        this.columns = builder.columns;
        this.firstSection = builder.firstSection;
        this.requirePageBoundary = builder.requirePageBoundary;
        this.balanceColumns = builder.balanceColumns;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    public SectionType effectiveType() {
        return type == null ? SectionType.CONTINUOUS : type;
    }

    public static final class Builder {
        private final String id;
        private SectionType type;
        private SectionMargins margins = SectionMargins.NONE;
        private PageSize pageSize;
        private Orientation orientation;
        private ColumnLayout columns;
        private boolean firstSection;
        private boolean requirePageBoundary;
        private Boolean balanceColumns;

        private Builder(String id) {
            this.id = id;
        }

        public Builder type(SectionType type) {
            this.type = type;
            return this;
        }

        public Builder margins(SectionMargins margins) {
            this.margins = margins == null ? SectionMargins.NONE : margins;
            return this;
        }

        public Builder pageSize(PageSize pageSize) {
            this.pageSize = pageSize;
            return this;
        }

        public Builder orientation(Orientation orientation) {
            this.orientation = orientation;
            return this;
        }

        public Builder columns(ColumnLayout columns) {
            this.columns = columns;
            return this;
        }

        public Builder firstSection(boolean firstSection) {
            this.firstSection = firstSection;
            return this;
        }

        public Builder requirePageBoundary(boolean requirePageBoundary) {
            this.requirePageBoundary = requirePageBoundary;
            return this;
        }

        public Builder balanceColumns(Boolean balanceColumns) {
            this.balanceColumns = balanceColumns;
            return this;
        }

        public SectionBreak build() {
            return new SectionBreak(this);
        }
    }
}
