package com.gs.ep.pageflow.section;

/**
 * Margins declared on a section break. Every side is optional; absent sides keep the geometry that
 * is already scheduled.
 */
public final class SectionMargins {

    public static final SectionMargins NONE = builder().build();

    public final Double top;
    public final Double bottom;
    public final Double left;
    public final Double right;
    /** Distance from the page top to the header */
    public final Double header;
    /** Distance from the page bottom to the footer */
    public final Double footer;

    private SectionMargins(Builder builder) {
        this.top = builder.top;
        this.bottom = builder.bottom;
        this.left = builder.left;
        this.right = builder.right;
        this.header = builder.header;
        this.footer = builder.footer;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Double top;
        private Double bottom;
        private Double left;
        private Double right;
        private Double header;
        private Double footer;

        public Builder top(Double top) {
            this.top = top;
            return this;
        }

        public Builder bottom(Double bottom) {
            this.bottom = bottom;
            return this;
        }

        public Builder left(Double left) {
            this.left = left;
            return this;
        }

        public Builder right(Double right) {
            this.right = right;
            return this;
        }

        public Builder header(Double header) {
            this.header = header;
            return this;
        }

        public Builder footer(Double footer) {
            this.footer = footer;
            return this;
        }

        public SectionMargins build() {
            return new SectionMargins(this);
        }
    }
}
