package com.gs.ep.pageflow.model;

/**
 * Inner padding of a table cell in pixels. Any side may be left unspecified, in which case the
 * configured default for that side applies.
 */
public final class CellPadding {

    public static final CellPadding UNSPECIFIED = new CellPadding(null, null, null, null);

    public final Double top;
    public final Double bottom;
    public final Double left;
    public final Double right;

    public CellPadding(Double top, Double bottom, Double left, Double right) {
        this.top = top;
        this.bottom = bottom;
        this.left = left;
        this.right = right;
    }

    public static CellPadding of(double top, double bottom, double left, double right) {
        return new CellPadding(top, bottom, left, right);
    }

    /**
     * Padding with every unspecified or invalid side taken from {@code defaults}.
     */
    public CellPadding resolve(CellPadding defaults) {
        return new CellPadding(
                pick(top, defaults.top),
                pick(bottom, defaults.bottom),
                pick(left, defaults.left),
                pick(right, defaults.right));
    }

    public double vertical() {
        return valueOf(top) + valueOf(bottom);
    }

    private static Double pick(Double value, Double fallback) {
        if (value != null && Double.isFinite(value) && value >= 0) {
            return value;
        }
        return fallback;
    }

    private static double valueOf(Double value) {
        return value == null ? 0 : value;
    }
}
