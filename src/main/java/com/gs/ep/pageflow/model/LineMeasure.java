package com.gs.ep.pageflow.model;

/**
 * One measured line of text.
 */
public final class LineMeasure {

    public final double lineHeight;
    public final DocRange range;

    public LineMeasure(double lineHeight, DocRange range) {
        this.lineHeight = Double.isFinite(lineHeight) && lineHeight > 0 ? lineHeight : 0;
        this.range = range == null ? DocRange.EMPTY : range;
    }

    public static LineMeasure of(double lineHeight) {
        return new LineMeasure(lineHeight, DocRange.EMPTY);
    }
}
