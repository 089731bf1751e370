package com.gs.ep.pageflow.model;

/**
 * Lines {@code [fromLine, toLine)} of a paragraph placed in one column.
 */
public class ParagraphFragment extends Fragment {

    private final int fromLine;
    private final int toLine;

    public ParagraphFragment(String blockId, int fromLine, int toLine, double x, double y, double width, double height) {
        super(blockId, BlockKind.PARAGRAPH, x, y, width, height);
        this.fromLine = fromLine;
        this.toLine = toLine;
    }

    public int getFromLine() {
        return fromLine;
    }

    public int getToLine() {
        return toLine;
    }
}
