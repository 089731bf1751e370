package com.gs.ep.pageflow.balance;

import com.gs.ep.pageflow.model.ContentBlock;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Columns and content handed to one pre-placement balancing run.
 */
public final class BalancingContext {

    public final int columnCount;
    public final double columnWidth;
    public final double columnGap;
    /** Height from the current cursor position down to the content bottom */
    public final double availableHeight;
    public final ImmutableList<ContentBlock> blocks;

    public BalancingContext(int columnCount, double columnWidth, double columnGap, double availableHeight,
                            Iterable<ContentBlock> blocks) {
        this.columnCount = columnCount;
        this.columnWidth = columnWidth;
        this.columnGap = columnGap;
        this.availableHeight = Double.isFinite(availableHeight) ? Math.max(0, availableHeight) : 0;
        this.blocks = Lists.immutable.withAll(blocks);
    }

    public double totalHeight() {
        return blocks.sumOfDouble(block -> block.measuredHeight);
    }
}
