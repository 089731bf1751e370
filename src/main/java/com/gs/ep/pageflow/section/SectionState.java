package com.gs.ep.pageflow.section;

import com.gs.ep.pageflow.model.ColumnLayout;
import com.gs.ep.pageflow.model.Margins;
import com.gs.ep.pageflow.model.Orientation;
import com.gs.ep.pageflow.model.PageSize;

import java.util.Objects;

/**
 * Section geometry in effect for the current page ("active") and geometry scheduled for the next
 * page boundary ("pending"). A pending value of null means nothing is scheduled for that property.
 * <p>
 * Instances are immutable; every transition produces a new state via {@link #toBuilder()}.
 */
public final class SectionState {

    public final double activeTopMargin;
    public final double activeBottomMargin;
    public final double activeLeftMargin;
    public final double activeRightMargin;
    public final Double pendingTopMargin;
    public final Double pendingBottomMargin;
    public final Double pendingLeftMargin;
    public final Double pendingRightMargin;
    public final double activeHeaderDistance;
    public final double activeFooterDistance;
    public final Double pendingHeaderDistance;
    public final Double pendingFooterDistance;
    public final PageSize activePageSize;
    public final PageSize pendingPageSize;
    public final ColumnLayout activeColumns;
    public final ColumnLayout pendingColumns;
    /** Active orientation, null when the document never declared one */
    public final Orientation activeOrientation;
    public final Orientation pendingOrientation;
    public final boolean hasAnyPages;

    private SectionState(Builder builder) {
        this.activeTopMargin = builder.activeTopMargin;
        this.activeBottomMargin = builder.activeBottomMargin;
        this.activeLeftMargin = builder.activeLeftMargin;
        this.activeRightMargin = builder.activeRightMargin;
        this.pendingTopMargin = builder.pendingTopMargin;
        this.pendingBottomMargin = builder.pendingBottomMargin;
        this.pendingLeftMargin = builder.pendingLeftMargin;
        this.pendingRightMargin = builder.pendingRightMargin;
        this.activeHeaderDistance = builder.activeHeaderDistance;
        this.activeFooterDistance = builder.activeFooterDistance;
        this.pendingHeaderDistance = builder.pendingHeaderDistance;
        this.pendingFooterDistance = builder.pendingFooterDistance;
        this.activePageSize = Objects.requireNonNull(builder.activePageSize, "activePageSize");
        this.pendingPageSize = builder.pendingPageSize;
        this.activeColumns = Objects.requireNonNull(builder.activeColumns, "activeColumns");
        this.pendingColumns = builder.pendingColumns;
        this.activeOrientation = builder.activeOrientation;
        this.pendingOrientation = builder.pendingOrientation;
        this.hasAnyPages = builder.hasAnyPages;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder builder = new Builder();
        builder.activeTopMargin = activeTopMargin;
        builder.activeBottomMargin = activeBottomMargin;
        builder.activeLeftMargin = activeLeftMargin;
        builder.activeRightMargin = activeRightMargin;
        builder.pendingTopMargin = pendingTopMargin;
        builder.pendingBottomMargin = pendingBottomMargin;
        builder.pendingLeftMargin = pendingLeftMargin;
        builder.pendingRightMargin = pendingRightMargin;
        builder.activeHeaderDistance = activeHeaderDistance;
        builder.activeFooterDistance = activeFooterDistance;
        builder.pendingHeaderDistance = pendingHeaderDistance;
        builder.pendingFooterDistance = pendingFooterDistance;
        builder.activePageSize = activePageSize;
        builder.pendingPageSize = pendingPageSize;
        builder.activeColumns = activeColumns;
        builder.pendingColumns = pendingColumns;
        builder.activeOrientation = activeOrientation;
        builder.pendingOrientation = pendingOrientation;
        builder.hasAnyPages = hasAnyPages;
        return builder;
    }

    public Margins activeMargins() {
        return new Margins(activeTopMargin, activeBottomMargin, activeLeftMargin, activeRightMargin);
    }

    public boolean hasPending() {
        return pendingTopMargin != null || pendingBottomMargin != null
                || pendingLeftMargin != null || pendingRightMargin != null
                || pendingHeaderDistance != null || pendingFooterDistance != null
                || pendingPageSize != null || pendingColumns != null || pendingOrientation != null;
    }

    public SectionState withHasAnyPages(boolean value) {
        if (value == hasAnyPages) {
            return this;
        }
        return toBuilder().hasAnyPages(value).build();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SectionState)) {
            return false;
        }
        SectionState other = (SectionState) o;
        return Double.compare(activeTopMargin, other.activeTopMargin) == 0
                && Double.compare(activeBottomMargin, other.activeBottomMargin) == 0
                && Double.compare(activeLeftMargin, other.activeLeftMargin) == 0
                && Double.compare(activeRightMargin, other.activeRightMargin) == 0
                && Double.compare(activeHeaderDistance, other.activeHeaderDistance) == 0
                && Double.compare(activeFooterDistance, other.activeFooterDistance) == 0
                && Objects.equals(pendingTopMargin, other.pendingTopMargin)
                && Objects.equals(pendingBottomMargin, other.pendingBottomMargin)
                && Objects.equals(pendingLeftMargin, other.pendingLeftMargin)
                && Objects.equals(pendingRightMargin, other.pendingRightMargin)
                && Objects.equals(pendingHeaderDistance, other.pendingHeaderDistance)
                && Objects.equals(pendingFooterDistance, other.pendingFooterDistance)
                && activePageSize.equals(other.activePageSize)
                && Objects.equals(pendingPageSize, other.pendingPageSize)
                && activeColumns.equals(other.activeColumns)
                && Objects.equals(pendingColumns, other.pendingColumns)
                && activeOrientation == other.activeOrientation
                && pendingOrientation == other.pendingOrientation
                && hasAnyPages == other.hasAnyPages;
    }

    @Override
    public int hashCode() {
        return Objects.hash(activeTopMargin, activeBottomMargin, activeLeftMargin, activeRightMargin,
                pendingTopMargin, pendingBottomMargin, pendingLeftMargin, pendingRightMargin,
                activeHeaderDistance, activeFooterDistance, pendingHeaderDistance, pendingFooterDistance,
                activePageSize, pendingPageSize, activeColumns, pendingColumns,
                activeOrientation, pendingOrientation, hasAnyPages);
    }

    @Override
    public String toString() {
        return "SectionState{margins=" + activeMargins() + ", page=" + activePageSize
                + ", columns=" + activeColumns + ", pendingColumns=" + pendingColumns
                + ", pendingPage=" + pendingPageSize + ", hasAnyPages=" + hasAnyPages + "}";
    }

    public static final class Builder {
        private double activeTopMargin;
        private double activeBottomMargin;
        private double activeLeftMargin;
        private double activeRightMargin;
        private Double pendingTopMargin;
        private Double pendingBottomMargin;
        private Double pendingLeftMargin;
        private Double pendingRightMargin;
        private double activeHeaderDistance;
        private double activeFooterDistance;
        private Double pendingHeaderDistance;
        private Double pendingFooterDistance;
        private PageSize activePageSize = PageSize.LETTER;
        private PageSize pendingPageSize;
        private ColumnLayout activeColumns = ColumnLayout.SINGLE;
        private ColumnLayout pendingColumns;
        private Orientation activeOrientation;
        private Orientation pendingOrientation;
        private boolean hasAnyPages;

        private Builder() {
        }

        public Builder activeMargins(Margins margins) {
            this.activeTopMargin = margins.top;
            this.activeBottomMargin = margins.bottom;
            this.activeLeftMargin = margins.left;
            this.activeRightMargin = margins.right;
            return this;
        }

        public Builder activeTopMargin(double value) {
            this.activeTopMargin = value;
            return this;
        }

        public Builder activeBottomMargin(double value) {
            this.activeBottomMargin = value;
            return this;
        }

        public Builder activeLeftMargin(double value) {
            this.activeLeftMargin = value;
            return this;
        }

        public Builder activeRightMargin(double value) {
            this.activeRightMargin = value;
            return this;
        }

        public Builder pendingTopMargin(Double value) {
            this.pendingTopMargin = value;
            return this;
        }

        public Builder pendingBottomMargin(Double value) {
            this.pendingBottomMargin = value;
            return this;
        }

        public Builder pendingLeftMargin(Double value) {
            this.pendingLeftMargin = value;
            return this;
        }

        public Builder pendingRightMargin(Double value) {
            this.pendingRightMargin = value;
            return this;
        }

        public Builder activeHeaderDistance(double value) {
            this.activeHeaderDistance = value;
            return this;
        }

        public Builder activeFooterDistance(double value) {
            this.activeFooterDistance = value;
            return this;
        }

        public Builder pendingHeaderDistance(Double value) {
            this.pendingHeaderDistance = value;
            return this;
        }

        public Builder pendingFooterDistance(Double value) {
            this.pendingFooterDistance = value;
            return this;
        }

        public Builder activePageSize(PageSize value) {
            this.activePageSize = value;
            return this;
        }

        public Builder pendingPageSize(PageSize value) {
            this.pendingPageSize = value;
            return this;
        }

        public Builder activeColumns(ColumnLayout value) {
            this.activeColumns = value;
            return this;
        }

        public Builder pendingColumns(ColumnLayout value) {
            this.pendingColumns = value;
            return this;
        }

        public Builder activeOrientation(Orientation value) {
            this.activeOrientation = value;
            return this;
        }

        public Builder pendingOrientation(Orientation value) {
            this.pendingOrientation = value;
            return this;
        }

        public Builder hasAnyPages(boolean value) {
            this.hasAnyPages = value;
            return this;
        }

        public SectionState build() {
            return new SectionState(this);
        }
    }
}
