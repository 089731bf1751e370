package com.gs.ep.pageflow.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DocRangeTest {

    @Test
    void union_shouldWidenToCoverBothRanges() {
        assertEquals(DocRange.of(3, 20), DocRange.of(10, 20).union(DocRange.of(3, 8)));
    }

    @Test
    void union_withEmpty_shouldReturnOtherSide() {
        DocRange range = DocRange.of(5, 9);

        assertSame(range, range.union(DocRange.EMPTY));
        assertSame(range, DocRange.EMPTY.union(range));
        assertSame(range, range.union(null));
    }

    @Test
    void union_missingBound_shouldBeSkipped() {
        DocRange merged = new DocRange(null, 12).union(new DocRange(4, null));

        assertEquals(DocRange.of(4, 12), merged);
        assertFalse(merged.isEmpty());
    }
}
