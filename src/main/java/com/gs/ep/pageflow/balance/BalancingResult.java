package com.gs.ep.pageflow.balance;

import org.eclipse.collections.api.list.primitive.ImmutableDoubleList;
import org.eclipse.collections.api.map.ImmutableMap;
import org.eclipse.collections.api.map.primitive.ImmutableObjectIntMap;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.primitive.DoubleLists;

/**
 * Column assignment produced by {@link ColumnBalancer#balance(BalancingContext)}.
 */
public final class BalancingResult {

    public final double targetColumnHeight;
    /** Column index per block id; a split block maps to the column holding its first part */
    public final ImmutableObjectIntMap<String> columnAssignments;
    /** Break points of blocks split across two columns, empty when nothing was split */
    public final ImmutableMap<String, BlockBreakPoint> blockBreakPoints;
    /** Whether the columns converged within tolerance */
    public final boolean success;
    public final int iterations;
    /** Content height per column as laid out by the chosen simulation; empty for trivial results */
    public final ImmutableDoubleList columnHeights;

    public BalancingResult(double targetColumnHeight, ImmutableObjectIntMap<String> columnAssignments,
                           ImmutableMap<String, BlockBreakPoint> blockBreakPoints, boolean success, int iterations,
                           ImmutableDoubleList columnHeights) {
        this.targetColumnHeight = targetColumnHeight;
        this.columnAssignments = columnAssignments;
        this.blockBreakPoints = blockBreakPoints == null ? Maps.immutable.empty() : blockBreakPoints;
        this.success = success;
        this.iterations = iterations;
        this.columnHeights = columnHeights == null ? DoubleLists.immutable.empty() : columnHeights;
    }

    /**
     * Column of the given block, or -1 when the block was not part of the run.
     */
    public int columnOf(String blockId) {
        return columnAssignments.getIfAbsent(blockId, -1);
    }

    public BlockBreakPoint breakPointOf(String blockId) {
        return blockBreakPoints.get(blockId);
    }

    public boolean hasBreakPoints() {
        return blockBreakPoints.notEmpty();
    }

    @Override
    public String toString() {
        return "BalancingResult{target=" + targetColumnHeight + ", success=" + success
                + ", iterations=" + iterations + ", heights=" + columnHeights
                + ", assignments=" + columnAssignments + ", breaks=" + blockBreakPoints.keysView() + "}";
    }
}
