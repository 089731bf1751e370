package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.list.primitive.ImmutableDoubleList;
import org.eclipse.collections.impl.factory.primitive.DoubleLists;

import java.util.Objects;

/**
 * A measured block of content as seen by the layout core. Beyond its height, line heights and break
 * constraints the block is opaque: text, styling and runs stay with the upstream measuring pass.
 */
public final class ContentBlock {

    public final String id;
    public final BlockKind kind;
    public final double measuredHeight;
    /** Individual line heights for paragraph blocks, empty for atomic blocks */
    public final ImmutableDoubleList lineHeights;
    /** Whether the block may be split across columns */
    public final boolean canBreak;
    /** Whether the block must stay in the same column as its successor */
    public final boolean keepWithNext;
    /** Whether the block must not be split */
    public final boolean keepTogether;
    /** Minimum lines left at the bottom of a column when the block is split */
    public final int orphanLines;
    /** Minimum lines carried to the top of the next column when the block is split */
    public final int widowLines;
    public final DocRange range;

    private ContentBlock(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id");
        this.kind = builder.kind;
        this.lineHeights = builder.lineHeights;
        this.measuredHeight = builder.measuredHeight != null
                ? Math.max(0, builder.measuredHeight)
                : builder.lineHeights.sum();
        this.canBreak = builder.canBreak;
        this.keepWithNext = builder.keepWithNext;
        this.keepTogether = builder.keepTogether;
        this.orphanLines = Math.max(0, builder.orphanLines);
        this.widowLines = Math.max(0, builder.widowLines);
        this.range = builder.range;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Breakable paragraph whose height is the sum of its lines.
     */
    public static ContentBlock paragraph(String id, double... lineHeights) {
        return builder(id).kind(BlockKind.PARAGRAPH).lineHeights(lineHeights).canBreak(true).build();
    }

    /**
     * Unbreakable block of a fixed height (image, drawing, table placeholder).
     */
    public static ContentBlock atomic(String id, BlockKind kind, double height) {
        return builder(id).kind(kind).measuredHeight(height).canBreak(false).build();
    }

    public int lineCount() {
        return lineHeights.size();
    }

    /**
     * Whether the block can be cut at a line boundary.
     */
    public boolean isSplittable() {
        return canBreak && !keepTogether && lineHeights.size() > 1;
    }

    @Override
    public String toString() {
        return kind + ":" + id + "(" + measuredHeight + ")";
    }

    public static final class Builder {
        private final String id;
        private BlockKind kind = BlockKind.PARAGRAPH;
        private Double measuredHeight;
        private ImmutableDoubleList lineHeights = DoubleLists.immutable.empty();
        private boolean canBreak;
        private boolean keepWithNext;
        private boolean keepTogether;
        private int orphanLines = 1;
        private int widowLines = 1;
        private DocRange range = DocRange.EMPTY;

        private Builder(String id) {
            this.id = id;
        }

        public Builder kind(BlockKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
            return this;
        }

        public Builder measuredHeight(double measuredHeight) {
            this.measuredHeight = Double.isFinite(measuredHeight) ? measuredHeight : 0;
            return this;
        }

        public Builder lineHeights(double... lineHeights) {
            this.lineHeights = DoubleLists.immutable.of(lineHeights == null ? new double[0] : lineHeights.clone());
            return this;
        }

        public Builder canBreak(boolean canBreak) {
            this.canBreak = canBreak;
            return this;
        }

        public Builder keepWithNext(boolean keepWithNext) {
            this.keepWithNext = keepWithNext;
            return this;
        }

        public Builder keepTogether(boolean keepTogether) {
            this.keepTogether = keepTogether;
            return this;
        }

        public Builder orphanLines(int orphanLines) {
            this.orphanLines = orphanLines;
            return this;
        }

        public Builder widowLines(int widowLines) {
            this.widowLines = widowLines;
            return this;
        }

        public Builder range(DocRange range) {
            this.range = range == null ? DocRange.EMPTY : range;
            return this;
        }

        public ContentBlock build() {
            return new ContentBlock(this);
        }
    }
}
