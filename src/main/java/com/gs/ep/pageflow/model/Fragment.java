package com.gs.ep.pageflow.model;

import java.util.Objects;

/**
 * Positioned, page-local slice of a content block. Position and width are mutable because column
 * rebalancing moves fragments after they have been placed.
 */
public abstract class Fragment {

    private final String blockId;
    private final BlockKind kind;
    private double x;
    private double y;
    private double width;
    private double height;
    private DocRange range = DocRange.EMPTY;

    protected Fragment(String blockId, BlockKind kind, double x, double y, double width, double height) {
        this.blockId = Objects.requireNonNull(blockId, "blockId");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public String getBlockId() {
        return blockId;
    }

    public BlockKind getKind() {
        return kind;
    }

    public double getX() {
        return x;
    }

    public void setX(double x) {
        this.x = x;
    }

    public double getY() {
        return y;
    }

    public void setY(double y) {
        this.y = y;
    }

    public double getWidth() {
        return width;
    }

    public void setWidth(double width) {
        this.width = width;
    }

    public double getHeight() {
        return height;
    }

    public void setHeight(double height) {
        this.height = height;
    }

    public double getBottom() {
        return y + height;
    }

    public DocRange getRange() {
        return range;
    }

    public void setRange(DocRange range) {
        this.range = range == null ? DocRange.EMPTY : range;
    }

    @Override
    public String toString() {
        return kind + ":" + blockId + "@(" + x + ", " + y + ") " + width + "x" + height;
    }
}
