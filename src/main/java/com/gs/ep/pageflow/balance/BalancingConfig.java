package com.gs.ep.pageflow.balance;

import com.gs.ep.pageflow.config.LayoutConfig;

/**
 * Tuning of the column balancer.
 */
public final class BalancingConfig {

    public static final BalancingConfig DEFAULT = new BalancingConfig(true, 5, 10, 20);

    public final boolean enabled;
    /** Accepted height difference between the tallest and shortest non-empty column */
    public final double tolerance;
    /** Upper bound on balancing simulations */
    public final int maxIterations;
    /** Minimum content height per column */
    public final double minColumnHeight;

    public BalancingConfig(boolean enabled, double tolerance, int maxIterations, double minColumnHeight) {
        this.enabled = enabled;
        this.tolerance = Math.max(0, tolerance);
        this.maxIterations = Math.max(1, maxIterations);
        this.minColumnHeight = Math.max(0, minColumnHeight);
    }

    public static BalancingConfig fromLayoutConfig(LayoutConfig config) {
        return new BalancingConfig(config.isBalancingEnabled(), config.getBalancingTolerance(),
                config.getBalancingMaxIterations(), config.getMinColumnHeight());
    }

    public BalancingConfig withEnabled(boolean value) {
        return new BalancingConfig(value, tolerance, maxIterations, minColumnHeight);
    }

    @Override
    public String toString() {
        return "BalancingConfig{enabled=" + enabled + ", tolerance=" + tolerance
                + ", maxIterations=" + maxIterations + ", minColumnHeight=" + minColumnHeight + "}";
    }
}
