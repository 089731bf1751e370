package com.gs.ep.pageflow.model;

import java.util.Objects;

/**
 * Opaque span of document positions attached to blocks, lines and fragments. The layout core never
 * interprets the positions, it only copies them and widens them to cover merged content.
 * Start is inclusive, end is exclusive. Either bound may be absent.
 */
public final class DocRange {

    public static final DocRange EMPTY = new DocRange(null, null);

    public final Integer start;
    public final Integer end;

    public DocRange(Integer start, Integer end) {
        this.start = start;
        this.end = end;
    }

    public static DocRange of(int start, int end) {
        return new DocRange(start, end);
    }

    public boolean isEmpty() {
        return start == null && end == null;
    }

    /**
     * Smallest range covering both this range and {@code other}. Missing bounds on either side are
     * treated as unbounded contributions and simply skipped.
     */
    public DocRange union(DocRange other) {
        if (other == null || other.isEmpty()) {
            return this;
        }
        if (this.isEmpty()) {
            return other;
        }
        Integer mergedStart = start;
        if (other.start != null) {
            mergedStart = start == null ? other.start : Math.min(start, other.start);
        }
        Integer mergedEnd = end;
        if (other.end != null) {
            mergedEnd = end == null ? other.end : Math.max(end, other.end);
        }
        return new DocRange(mergedStart, mergedEnd);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DocRange)) {
            return false;
        }
        DocRange other = (DocRange) o;
        return Objects.equals(start, other.start) && Objects.equals(end, other.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
