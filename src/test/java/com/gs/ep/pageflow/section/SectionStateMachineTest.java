package com.gs.ep.pageflow.section;

import com.gs.ep.pageflow.model.ColumnLayout;
import com.gs.ep.pageflow.model.Margins;
import com.gs.ep.pageflow.model.Orientation;
import com.gs.ep.pageflow.model.PageSize;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SectionStateMachineTest {

    private static final Margins BASE_MARGINS = Margins.uniform(72);
    private static final ColumnLayout TWO_COLUMNS = new ColumnLayout(2, 48);

    private static SectionState.Builder state() {
        return SectionState.builder()
                .activeMargins(BASE_MARGINS)
                .activeHeaderDistance(36)
                .activeFooterDistance(36)
                .activePageSize(PageSize.LETTER)
                .activeColumns(ColumnLayout.SINGLE)
                .hasAnyPages(true);
    }

    private static SectionBreak.Builder sectionBreak() {
        return SectionBreak.builder("test-section-break");
    }

    @Test
    void scheduleSectionBreak_continuousWithoutColumns_shouldScheduleSingleColumn() {
        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.CONTINUOUS).build(), state().build(), BASE_MARGINS);

        assertEquals(ColumnLayout.SINGLE, result.state.pendingColumns);
        assertFalse(result.decision.forceMidPageRegion);
        assertFalse(result.decision.forcePageBreak);
    }

    @Test
    void scheduleSectionBreak_nextPageAfterTwoColumns_shouldForcePageBreakAndResetColumns() {
        SectionState current = state().activeColumns(TWO_COLUMNS).build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.NEXT_PAGE).build(), current, BASE_MARGINS);

        assertTrue(result.decision.forcePageBreak);
        assertEquals(new ColumnLayout(1, 0), result.state.pendingColumns);
        assertEquals(TWO_COLUMNS, result.state.activeColumns, "active columns change only at a page boundary");
    }

    @Test
    void scheduleSectionBreak_continuousResetFromTwoColumns_shouldForceMidPageRegion() {
        SectionState current = state().activeColumns(TWO_COLUMNS).build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.CONTINUOUS).build(), current, BASE_MARGINS);

        assertTrue(result.decision.forceMidPageRegion);
        assertEquals(ColumnLayout.SINGLE, result.state.pendingColumns);
    }

    @Test
    void scheduleSectionBreak_explicitColumns_shouldBeUsedVerbatim() {
        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.CONTINUOUS).columns(new ColumnLayout(3, 24)).build(),
                state().build(), BASE_MARGINS);

        assertEquals(new ColumnLayout(3, 24), result.state.pendingColumns);
        assertTrue(result.decision.forceMidPageRegion);
    }

    @Test
    void scheduleSectionBreak_gapChangeOnly_shouldCountAsColumnChange() {
        SectionState current = state().activeColumns(TWO_COLUMNS).build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().columns(new ColumnLayout(2, 24)).build(), current, BASE_MARGINS);

        assertTrue(result.decision.forceMidPageRegion);
    }

    @Test
    void scheduleSectionBreak_unchangedColumns_shouldNotForceRegionButStillSchedule() {
        SectionState current = state().activeColumns(TWO_COLUMNS).build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().columns(new ColumnLayout(2, 48)).build(), current, BASE_MARGINS);

        assertEquals(BreakDecision.NONE, result.decision);
        assertEquals(TWO_COLUMNS, result.state.pendingColumns);
    }

    @Test
    void scheduleSectionBreak_evenAndOddPage_shouldRequireParity() {
        SectionTransition even = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.EVEN_PAGE).build(), state().build(), BASE_MARGINS);
        SectionTransition odd = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.ODD_PAGE).build(), state().build(), BASE_MARGINS);

        assertTrue(even.decision.forcePageBreak);
        assertEquals(PageParity.EVEN, even.decision.requiredParity);
        assertTrue(odd.decision.forcePageBreak);
        assertEquals(PageParity.ODD, odd.decision.requiredParity);
        assertEquals(ColumnLayout.SINGLE, odd.state.pendingColumns);
    }

    @Test
    void scheduleSectionBreak_requirePageBoundary_shouldOverrideContinuous() {
        SectionState current = state().activeColumns(TWO_COLUMNS).build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.CONTINUOUS).requirePageBoundary(true).build(), current, BASE_MARGINS);

        assertTrue(result.decision.forcePageBreak);
        assertFalse(result.decision.forceMidPageRegion);
        assertNull(result.decision.requiredParity);
    }

    @Test
    void scheduleSectionBreak_headerContent_shouldRaiseTopMargin() {
        SectionBreak marker = sectionBreak().type(SectionType.NEXT_PAGE)
                .margins(SectionMargins.builder().top(72.0).bottom(72.0).header(36.0).footer(36.0).build())
                .columns(TWO_COLUMNS)
                .build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(marker, state().build(), BASE_MARGINS, 48, 0);

        assertEquals(84.0, result.state.pendingTopMargin);
        assertEquals(36.0, result.state.pendingHeaderDistance);
        assertEquals(72.0, result.state.pendingBottomMargin, "no footer content keeps the bottom margin");
    }

    @Test
    void scheduleSectionBreak_footerContent_shouldRaiseBottomMargin() {
        SectionBreak marker = sectionBreak().type(SectionType.NEXT_PAGE)
                .margins(SectionMargins.builder().footer(30.0).build())
                .build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(marker, state().build(), BASE_MARGINS, 0, 60);

        assertEquals(90.0, result.state.pendingBottomMargin);
        assertEquals(30.0, result.state.pendingFooterDistance);
    }

    @Test
    void scheduleSectionBreak_noMargins_shouldCarryPendingValuesForward() {
        SectionState current = state().pendingTopMargin(100.0).pendingHeaderDistance(50.0).build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.NEXT_PAGE).build(), current, BASE_MARGINS);

        assertEquals(100.0, result.state.pendingTopMargin);
        assertEquals(50.0, result.state.pendingHeaderDistance);
        assertEquals(72.0, result.state.pendingLeftMargin);
        assertEquals(72.0, result.state.pendingRightMargin);
    }

    @Test
    void scheduleSectionBreak_negativeAndNonFiniteMargins_shouldBeSanitized() {
        SectionBreak marker = sectionBreak().type(SectionType.NEXT_PAGE)
                .margins(SectionMargins.builder().left(-10.0).right(Double.NaN).build())
                .pageSize(new PageSize(-1, 500))
                .build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(marker, state().build(), BASE_MARGINS);

        assertEquals(0.0, result.state.pendingLeftMargin);
        assertEquals(72.0, result.state.pendingRightMargin);
        assertNull(result.state.pendingPageSize);
    }

    @Test
    void scheduleSectionBreak_pageSizeAndOrientation_shouldBePending() {
        PageSize landscape = new PageSize(1056, 816);
        SectionBreak marker = sectionBreak().type(SectionType.NEXT_PAGE)
                .pageSize(landscape).orientation(Orientation.LANDSCAPE).build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(marker, state().build(), BASE_MARGINS);

        assertEquals(landscape, result.state.pendingPageSize);
        assertEquals(Orientation.LANDSCAPE, result.state.pendingOrientation);
        assertEquals(PageSize.LETTER, result.state.activePageSize);
    }

    @Test
    void scheduleSectionBreak_firstSection_shouldApplyDirectlyToActive() {
        SectionState initial = state().hasAnyPages(false).build();
        SectionBreak marker = sectionBreak().firstSection(true).type(SectionType.NEXT_PAGE)
                .columns(TWO_COLUMNS)
                .pageSize(new PageSize(600, 800))
                .margins(SectionMargins.builder().top(50.0).left(40.0).build())
                .build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(marker, initial, BASE_MARGINS);

        assertEquals(BreakDecision.NONE, result.decision);
        assertEquals(TWO_COLUMNS, result.state.activeColumns);
        assertNull(result.state.pendingColumns);
        assertEquals(new PageSize(600, 800), result.state.activePageSize);
        assertEquals(50.0, result.state.activeTopMargin);
        assertEquals(40.0, result.state.activeLeftMargin);
        assertEquals(72.0, result.state.activeRightMargin);
    }

    @Test
    void scheduleSectionBreak_firstSectionWithoutColumns_shouldResetToSingleColumn() {
        SectionState initial = state().hasAnyPages(false).activeColumns(TWO_COLUMNS).build();

        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().firstSection(true).build(), initial, BASE_MARGINS);

        assertEquals(ColumnLayout.SINGLE, result.state.activeColumns);
    }

    @Test
    void scheduleSectionBreak_firstSectionFlagAfterPages_shouldUsePendingStage() {
        SectionTransition result = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().firstSection(true).columns(TWO_COLUMNS).build(), state().build(), BASE_MARGINS);

        assertEquals(ColumnLayout.SINGLE, result.state.activeColumns);
        assertEquals(TWO_COLUMNS, result.state.pendingColumns);
        assertTrue(result.decision.forceMidPageRegion);
    }

    @Test
    void scheduleSectionBreak_shouldNotModifyInputState() {
        SectionState current = state().activeColumns(TWO_COLUMNS).build();
        SectionState copy = current.toBuilder().build();

        SectionStateMachine.scheduleSectionBreak(sectionBreak().type(SectionType.NEXT_PAGE).build(), current, BASE_MARGINS);

        assertEquals(copy, current);
    }

    @Test
    void applyPendingToActive_shouldMovePendingValuesAndClearThem() {
        SectionState pending = state()
                .pendingColumns(TWO_COLUMNS)
                .pendingTopMargin(100.0)
                .pendingPageSize(new PageSize(1056, 816))
                .pendingOrientation(Orientation.LANDSCAPE)
                .build();

        SectionState applied = SectionStateMachine.applyPendingToActive(pending);

        assertEquals(TWO_COLUMNS, applied.activeColumns);
        assertEquals(100.0, applied.activeTopMargin);
        assertEquals(new PageSize(1056, 816), applied.activePageSize);
        assertEquals(Orientation.LANDSCAPE, applied.activeOrientation);
        assertFalse(applied.hasPending());
        assertEquals(72.0, applied.activeBottomMargin);
    }

    @Test
    void applyPendingToActive_withoutPendingColumns_shouldKeepActiveColumns() {
        SectionState current = state().activeColumns(TWO_COLUMNS).build();

        SectionState applied = SectionStateMachine.applyPendingToActive(current);

        assertEquals(TWO_COLUMNS, applied.activeColumns);
    }

    @Test
    void applyPendingToActive_appliedTwice_shouldBeIdempotent() {
        SectionTransition scheduled = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.NEXT_PAGE).columns(TWO_COLUMNS)
                        .margins(SectionMargins.builder().top(90.0).build()).build(),
                state().build(), BASE_MARGINS);

        SectionState once = SectionStateMachine.applyPendingToActive(scheduled.state);
        SectionState twice = SectionStateMachine.applyPendingToActive(once);

        assertEquals(once, twice);
        assertEquals(90.0, twice.activeTopMargin);
    }

    @Test
    void applyPendingColumns_shouldOnlyActivateColumns() {
        SectionState current = state().pendingColumns(TWO_COLUMNS).pendingTopMargin(100.0).build();

        SectionState applied = SectionStateMachine.applyPendingColumns(current);

        assertEquals(TWO_COLUMNS, applied.activeColumns);
        assertNull(applied.pendingColumns);
        assertEquals(100.0, applied.pendingTopMargin);
        assertEquals(72.0, applied.activeTopMargin);
    }

    @Test
    void mixedColumnDocument_shouldSwitchSingleTwoSingle() {
        SectionState current = SectionStateMachine.initialState(PageSize.LETTER, BASE_MARGINS).withHasAnyPages(true);

        SectionTransition toTwo = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.CONTINUOUS).columns(TWO_COLUMNS).build(), current, BASE_MARGINS);
        assertTrue(toTwo.decision.forceMidPageRegion);
        current = SectionStateMachine.applyPendingColumns(toTwo.state);
        assertEquals(TWO_COLUMNS, current.activeColumns);

        SectionTransition toOne = SectionStateMachine.scheduleSectionBreak(
                sectionBreak().type(SectionType.CONTINUOUS).build(), current, BASE_MARGINS);
        assertTrue(toOne.decision.forceMidPageRegion);
        current = SectionStateMachine.applyPendingToActive(toOne.state);
        assertEquals(ColumnLayout.SINGLE, current.activeColumns);
    }

    @Test
    void sectionType_fromValue_shouldDefaultToContinuous() {
        assertEquals(SectionType.NEXT_PAGE, SectionType.fromValue("nextPage"));
        assertEquals(SectionType.ODD_PAGE, SectionType.fromValue(" oddpage "));
        assertEquals(SectionType.CONTINUOUS, SectionType.fromValue(null));
        assertEquals(SectionType.CONTINUOUS, SectionType.fromValue("bogus"));
    }
}
