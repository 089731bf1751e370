package com.gs.ep.pageflow.model;

/**
 * Cell border model of a table.
 */
public enum BorderCollapse {

    /**
     * Adjacent cells share borders, cell spacing is ignored
     */
    COLLAPSE,

    /**
     * Each cell draws its own borders, separated by the table cell spacing
     */
    SEPARATE
}
