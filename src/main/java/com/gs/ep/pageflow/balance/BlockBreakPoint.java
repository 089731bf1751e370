package com.gs.ep.pageflow.balance;

/**
 * Line boundary at which a paragraph is cut to balance columns.
 */
public final class BlockBreakPoint {

    public final String blockId;
    /** Index of the last line kept in the first column */
    public final int breakAfterLine;
    public final double heightBeforeBreak;
    public final double heightAfterBreak;

    public BlockBreakPoint(String blockId, int breakAfterLine, double heightBeforeBreak, double heightAfterBreak) {
        this.blockId = blockId;
        this.breakAfterLine = breakAfterLine;
        this.heightBeforeBreak = heightBeforeBreak;
        this.heightAfterBreak = heightAfterBreak;
    }

    @Override
    public String toString() {
        return "BlockBreakPoint{" + blockId + " after line " + breakAfterLine
                + ", " + heightBeforeBreak + " | " + heightAfterBreak + "}";
    }
}
