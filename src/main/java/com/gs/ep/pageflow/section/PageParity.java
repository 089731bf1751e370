package com.gs.ep.pageflow.section;

/**
 * Page number parity required by even/odd section breaks.
 */
public enum PageParity {

    EVEN,

    ODD;

    public boolean matches(int pageNumber) {
        boolean even = pageNumber % 2 == 0;
        return this == EVEN ? even : !even;
    }
}
