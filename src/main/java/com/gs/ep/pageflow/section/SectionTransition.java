package com.gs.ep.pageflow.section;

/**
 * Result of scheduling a section break: the decision and the state to continue with.
 */
public final class SectionTransition {

    public final BreakDecision decision;
    public final SectionState state;

    public SectionTransition(BreakDecision decision, SectionState state) {
        this.decision = decision;
        this.state = state;
    }
}
