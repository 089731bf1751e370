package com.gs.ep.pageflow.section;

import java.util.Objects;

/**
 * What the page-building loop must do when it reaches a section break.
 */
public final class BreakDecision {

    public static final BreakDecision NONE = new BreakDecision(false, false, null);

    public final boolean forcePageBreak;
    public final boolean forceMidPageRegion;
    /** Parity the next page must have, or null */
    public final PageParity requiredParity;

    public BreakDecision(boolean forcePageBreak, boolean forceMidPageRegion, PageParity requiredParity) {
        this.forcePageBreak = forcePageBreak;
        this.forceMidPageRegion = forceMidPageRegion;
        this.requiredParity = requiredParity;
    }

    public static BreakDecision pageBreak() {
        return new BreakDecision(true, false, null);
    }

    public static BreakDecision pageBreak(PageParity parity) {
        return new BreakDecision(true, false, parity);
    }

    public static BreakDecision midPageRegion() {
        return new BreakDecision(false, true, null);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BreakDecision)) {
            return false;
        }
        BreakDecision other = (BreakDecision) o;
        return forcePageBreak == other.forcePageBreak
                && forceMidPageRegion == other.forceMidPageRegion
                && requiredParity == other.requiredParity;
    }

    @Override
    public int hashCode() {
        return Objects.hash(forcePageBreak, forceMidPageRegion, requiredParity);
    }

    @Override
    public String toString() {
        return "BreakDecision{pageBreak=" + forcePageBreak + ", midPageRegion=" + forceMidPageRegion
                + ", parity=" + requiredParity + "}";
    }
}
