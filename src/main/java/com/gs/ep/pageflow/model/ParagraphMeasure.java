package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Measured paragraph: its lines in reading order.
 */
public final class ParagraphMeasure implements BlockMeasure {

    private final ImmutableList<LineMeasure> lines;

    public ParagraphMeasure(Iterable<LineMeasure> lines) {
        this.lines = Lists.immutable.withAll(lines);
    }

    public static ParagraphMeasure ofHeights(double... lineHeights) {
        MutableList<LineMeasure> lines = Lists.mutable.empty();
        for (double lineHeight : lineHeights) {
            lines.add(LineMeasure.of(lineHeight));
        }
        return new ParagraphMeasure(lines);
    }

    public ImmutableList<LineMeasure> getLines() {
        return lines;
    }

    /**
     * Height of lines {@code [fromLine, toLine)}; indices outside the paragraph contribute nothing.
     */
    public double heightOf(int fromLine, int toLine) {
        double sum = 0;
        for (int i = Math.max(0, fromLine); i < toLine && i < lines.size(); i++) {
            sum += lines.get(i).lineHeight;
        }
        return sum;
    }

    @Override
    public BlockKind getKind() {
        return BlockKind.PARAGRAPH;
    }

    @Override
    public double getHeight() {
        return heightOf(0, lines.size());
    }
}
