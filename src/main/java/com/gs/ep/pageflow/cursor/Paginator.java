package com.gs.ep.pageflow.cursor;

import com.gs.ep.pageflow.balance.ColumnBalancer;
import com.gs.ep.pageflow.balance.ColumnSpec;
import com.gs.ep.pageflow.model.BlockMeasure;
import com.gs.ep.pageflow.model.ColumnLayout;
import com.gs.ep.pageflow.model.Fragment;
import com.gs.ep.pageflow.model.Margins;
import com.gs.ep.pageflow.section.BreakDecision;
import com.gs.ep.pageflow.section.SectionBreak;
import com.gs.ep.pageflow.section.SectionState;
import com.gs.ep.pageflow.section.SectionStateMachine;
import com.gs.ep.pageflow.section.SectionTransition;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * In-memory page builder implementing {@link PageCursor}.
 * <p>
 * Pages are created lazily with the active section geometry; pending geometry is applied at every
 * page boundary. Section breaks are enacted through {@link #applySectionBreak}, which turns the
 * break decision into new pages (with a blank filler page when the required parity is not met) or
 * into a new column region below the content already on the page.
 */
public class Paginator implements PageCursor {

    private static final Logger LOGGER = LoggerFactory.getLogger(Paginator.class);

    private final MutableList<Page> pages = Lists.mutable.empty();
    private SectionState sectionState;
    private Page currentPage;
    private PageState current;
    private double regionTop;

    public Paginator(SectionState initialState) {
        this.sectionState = Objects.requireNonNull(initialState, "initialState");
    }

    @Override
    public PageState ensurePage() {
        if (current == null) {
            startNewPage();
        }
        return current;
    }

    @Override
    public PageState advanceColumn(PageState state) {
        Objects.requireNonNull(state, "state");
        int nextColumn = state.getColumnIndex() + 1;
        if (current != null && state.getPageNumber() == currentPage.getNumber()
                && nextColumn < sectionState.activeColumns.count) {
            current = new PageState(currentPage.getNumber(), nextColumn, regionTop,
                    currentPage.getContentBottom(), currentPage.fragmentList());
            return current;
        }
        return startNewPage();
    }

    @Override
    public double columnX(int columnIndex) {
        ColumnLayout columns = sectionState.activeColumns;
        return sectionState.activeLeftMargin + columnIndex * (getColumnWidth() + columns.gap);
    }

    /**
     * Width of one column of the active layout.
     */
    public double getColumnWidth() {
        double available = sectionState.activePageSize.w - sectionState.activeLeftMargin - sectionState.activeRightMargin;
        return sectionState.activeColumns.columnWidth(available);
    }

    public ColumnSpec getColumnSpec() {
        ColumnLayout columns = sectionState.activeColumns;
        return new ColumnSpec(columns.count, columns.gap, getColumnWidth());
    }

    public SectionBreakResult applySectionBreak(SectionBreak marker, Margins baseMargins) {
        return applySectionBreak(marker, baseMargins, 0, 0);
    }

    /**
     * Schedules {@code marker} and enacts the resulting decision.
     * <p>
     * Hosts that balance columns at continuous breaks call {@link #rebalanceRegion} before this
     * method, while the region being closed is still current.
     */
    public SectionBreakResult applySectionBreak(SectionBreak marker, Margins baseMargins,
                                                double maxHeaderContentHeight, double maxFooterContentHeight) {
        SectionTransition transition = SectionStateMachine.scheduleSectionBreak(marker, sectionState, baseMargins,
                maxHeaderContentHeight, maxFooterContentHeight);
        sectionState = transition.state;
        BreakDecision decision = transition.decision;
        int fillerPages = 0;

        if (decision.forcePageBreak) {
            startNewPage();
            if (decision.requiredParity != null && !decision.requiredParity.matches(current.getPageNumber())) {
                LOGGER.debug("Page {} has wrong parity for {} section, inserting blank page",
                        current.getPageNumber(), decision.requiredParity);
                startNewPage();
                fillerPages++;
            }
        } else if (decision.forceMidPageRegion) {
            startColumnRegion();
        }
        return new SectionBreakResult(decision, fillerPages);
    }

    /**
     * Rebalances the fragments of the current column region over its columns.
     *
     * @param balancer balancer providing the minimum column height
     * @param measures block measures keyed by block id
     */
    public void rebalanceRegion(ColumnBalancer balancer, Map<String, ? extends BlockMeasure> measures) {
        if (currentPage == null) {
            return;
        }
        MutableList<Fragment> regionFragments = currentPage.fragmentList()
                .select(fragment -> fragment.getY() >= regionTop - 0.5);
        balancer.rebalancePositionedContent(regionFragments, getColumnSpec(), sectionState.activeLeftMargin,
                regionTop, measures);
    }

    public SectionState getSectionState() {
        return sectionState;
    }

    public ImmutableList<Page> getPages() {
        return pages.toImmutable();
    }

    public PageState getCurrentState() {
        return current;
    }

    private PageState startNewPage() {
        sectionState = SectionStateMachine.applyPendingToActive(sectionState).withHasAnyPages(true);
        Page page = new Page(pages.size() + 1, sectionState.activePageSize, sectionState.activeMargins(),
                sectionState.activeColumns, sectionState.activeOrientation);
        pages.add(page);
        currentPage = page;
        regionTop = sectionState.activeTopMargin;
        current = new PageState(page.getNumber(), 0, regionTop, page.getContentBottom(), page.fragmentList());
        LOGGER.debug("Started page {} with {}", page.getNumber(), sectionState);
        return current;
    }

    private void startColumnRegion() {
        sectionState = SectionStateMachine.applyPendingColumns(sectionState);
        if (current == null) {
            return;
        }
        double top = current.getCursorY();
        for (Fragment fragment : currentPage.fragmentList()) {
            top = Math.max(top, fragment.getBottom());
        }
        if (top >= currentPage.getContentBottom()) {
            startNewPage();
            return;
        }
        regionTop = top;
        current = new PageState(currentPage.getNumber(), 0, regionTop, currentPage.getContentBottom(),
                currentPage.fragmentList());
        LOGGER.debug("Started {} column region at y={} on page {}",
                sectionState.activeColumns.count, regionTop, currentPage.getNumber());
    }

    /**
     * What a section break did to the page flow.
     */
    public static final class SectionBreakResult {

        public final BreakDecision decision;
        /** Blank pages inserted to reach the required parity */
        public final int fillerPages;

        public SectionBreakResult(BreakDecision decision, int fillerPages) {
            this.decision = decision;
            this.fillerPages = fillerPages;
        }
    }
}
