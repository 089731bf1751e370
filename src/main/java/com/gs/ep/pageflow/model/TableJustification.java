package com.gs.ep.pageflow.model;

/**
 * Horizontal alignment of a table within its column.
 */
public enum TableJustification {

    LEFT,

    START,

    CENTER,

    RIGHT,

    END
}
