package com.gs.ep.pageflow.model;

/**
 * Measure of a block that is laid out as a single unit (image, drawing).
 */
public final class AtomicMeasure implements BlockMeasure {

    private final BlockKind kind;
    private final double height;

    public AtomicMeasure(BlockKind kind, double height) {
        this.kind = kind;
        this.height = Double.isFinite(height) ? Math.max(0, height) : 0;
    }

    @Override
    public BlockKind getKind() {
        return kind;
    }

    @Override
    public double getHeight() {
        return height;
    }
}
