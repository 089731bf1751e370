package com.gs.ep.pageflow.model;

/**
 * Kind of a content block or of a fragment produced from one.
 */
public enum BlockKind {

    /**
     * Flowing text measured as a list of lines
     */
    PARAGRAPH("para"),

    /**
     * Table measured as rows of cells
     */
    TABLE("table"),

    /**
     * Inline or block image with a single measured height
     */
    IMAGE("image"),

    /**
     * Vector drawing or shape with a single measured height
     */
    DRAWING("drawing");

    private final String displayName;

    BlockKind(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
