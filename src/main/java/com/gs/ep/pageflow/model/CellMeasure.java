package com.gs.ep.pageflow.model;

import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;

/**
 * Measured table cell. A cell may hold several paragraphs; for pagination they are read as one
 * continuous run of lines.
 */
public final class CellMeasure {

    private final ImmutableList<ParagraphMeasure> paragraphs;
    private final ImmutableList<LineMeasure> lines;

    public CellMeasure(Iterable<ParagraphMeasure> paragraphs) {
        this.paragraphs = Lists.immutable.withAll(paragraphs);
        MutableList<LineMeasure> all = Lists.mutable.empty();
        for (ParagraphMeasure paragraph : this.paragraphs) {
            all.addAllIterable(paragraph.getLines());
        }
        this.lines = all.toImmutable();
    }

    public static CellMeasure ofLines(double... lineHeights) {
        return new CellMeasure(Lists.immutable.of(ParagraphMeasure.ofHeights(lineHeights)));
    }

    public ImmutableList<ParagraphMeasure> getParagraphs() {
        return paragraphs;
    }

    public ImmutableList<LineMeasure> getLines() {
        return lines;
    }

    public int totalLines() {
        return lines.size();
    }

    public double linesHeight() {
        return lines.sumOfDouble(line -> line.lineHeight);
    }
}
