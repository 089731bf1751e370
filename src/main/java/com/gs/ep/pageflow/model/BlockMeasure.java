package com.gs.ep.pageflow.model;

/**
 * Output of the upstream measuring pass for one block.
 */
public interface BlockMeasure {

    BlockKind getKind();

    /**
     * Total measured height of the block in pixels.
     */
    double getHeight();
}
