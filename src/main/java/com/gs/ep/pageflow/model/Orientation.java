package com.gs.ep.pageflow.model;

/**
 * Page orientation of a section.
 */
public enum Orientation {

    PORTRAIT("portrait"),

    LANDSCAPE("landscape");

    private final String displayName;

    Orientation(String displayName) {
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
