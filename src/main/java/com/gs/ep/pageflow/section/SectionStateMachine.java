package com.gs.ep.pageflow.section;

import com.gs.ep.pageflow.model.ColumnLayout;
import com.gs.ep.pageflow.model.Margins;
import com.gs.ep.pageflow.model.PageSize;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Transitions of {@link SectionState} driven by section-break markers.
 * <p>
 * A break never changes the geometry of the page it occurs on: its margins, page size, orientation
 * and columns are scheduled as pending and become active at the next page boundary through
 * {@link #applyPendingToActive(SectionState)}. The only exception is the first section of a
 * document, whose geometry is written straight to the active side before any page exists.
 */
public final class SectionStateMachine {

    private static final Logger LOGGER = LoggerFactory.getLogger(SectionStateMachine.class);

    private SectionStateMachine() {
    }

    /**
     * Starting state of a document: single column, nothing pending, no page laid out yet.
     */
    public static SectionState initialState(PageSize pageSize, Margins margins) {
        return initialState(pageSize, margins, ColumnLayout.SINGLE, 0, 0);
    }

    public static SectionState initialState(PageSize pageSize, Margins margins, ColumnLayout columns,
                                            double headerDistance, double footerDistance) {
        Objects.requireNonNull(margins, "margins");
        PageSize size = pageSize != null && pageSize.isValid() ? pageSize : PageSize.LETTER;
        return SectionState.builder()
                .activeTopMargin(nonNegative(margins.top))
                .activeBottomMargin(nonNegative(margins.bottom))
                .activeLeftMargin(nonNegative(margins.left))
                .activeRightMargin(nonNegative(margins.right))
                .activeHeaderDistance(nonNegative(headerDistance))
                .activeFooterDistance(nonNegative(footerDistance))
                .activePageSize(size)
                .activeColumns(columnConfig(columns))
                .build();
    }

    public static SectionTransition scheduleSectionBreak(SectionBreak marker, SectionState state, Margins baseMargins) {
        return scheduleSectionBreak(marker, state, baseMargins, 0, 0);
    }

    /**
     * Schedules the geometry of the section that starts after {@code marker} and decides how the page
     * flow must react.
     *
     * @param marker                 section-break marker
     * @param state                  current section state
     * @param baseMargins            document margins used when the marker omits top or bottom
     * @param maxHeaderContentHeight tallest header variant; when positive the top margin is raised so
     *                               the body starts below the header
     * @param maxFooterContentHeight tallest footer variant, symmetric to the header
     * @return the decision together with the new state
     */
    public static SectionTransition scheduleSectionBreak(SectionBreak marker, SectionState state, Margins baseMargins,
                                                         double maxHeaderContentHeight, double maxFooterContentHeight) {
        Objects.requireNonNull(marker, "marker");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(baseMargins, "baseMargins");
        double headerContent = finiteOrZero(maxHeaderContentHeight);
        double footerContent = finiteOrZero(maxFooterContentHeight);

        SectionMargins margins = marker.margins == null ? SectionMargins.NONE : marker.margins;
        Double top = sanitizeLength(margins.top);
        Double bottom = sanitizeLength(margins.bottom);
        Double left = sanitizeLength(margins.left);
        Double right = sanitizeLength(margins.right);
        Double header = sanitizeLength(margins.header);
        Double footer = sanitizeLength(margins.footer);
        PageSize pageSize = marker.pageSize != null && marker.pageSize.isValid() ? marker.pageSize : null;
        if (marker.pageSize != null && pageSize == null) {
            LOGGER.warn("Ignoring invalid page size {} on section break {}", marker.pageSize, marker.id);
        }
        ColumnLayout columns = columnConfig(marker.columns);

        SectionState.Builder next = state.toBuilder();

        if (marker.firstSection && !state.hasAnyPages) {
            if (pageSize != null) {
                next.activePageSize(pageSize).pendingPageSize(null);
            }
            if (marker.orientation != null) {
                next.activeOrientation(marker.orientation).pendingOrientation(null);
            }
            double headerDistance = header != null ? header : state.activeHeaderDistance;
            double footerDistance = footer != null ? footer : state.activeFooterDistance;
            double sectionTop = top != null ? top : baseMargins.top;
            double sectionBottom = bottom != null ? bottom : baseMargins.bottom;
            if (header != null) {
                next.activeHeaderDistance(headerDistance).pendingHeaderDistance(headerDistance);
            }
            if (footer != null) {
                next.activeFooterDistance(footerDistance).pendingFooterDistance(footerDistance);
            }
            if (top != null || header != null) {
                double required = requiredMargin(headerDistance, sectionTop, headerContent);
                next.activeTopMargin(required).pendingTopMargin(required);
            }
            if (bottom != null || footer != null) {
                double required = requiredMargin(footerDistance, sectionBottom, footerContent);
                next.activeBottomMargin(required).pendingBottomMargin(required);
            }
            if (left != null) {
                next.activeLeftMargin(left).pendingLeftMargin(left);
            }
            if (right != null) {
                next.activeRightMargin(right).pendingRightMargin(right);
            }
            next.activeColumns(columns).pendingColumns(null);
            LOGGER.debug("First section {} applied directly, columns {}", marker.id, columns);
            return new SectionTransition(BreakDecision.NONE, next.build());
        }

        double carriedTop = state.pendingTopMargin != null ? state.pendingTopMargin : state.activeTopMargin;
        double carriedBottom = state.pendingBottomMargin != null ? state.pendingBottomMargin : state.activeBottomMargin;
        double carriedLeft = state.pendingLeftMargin != null ? state.pendingLeftMargin : state.activeLeftMargin;
        double carriedRight = state.pendingRightMargin != null ? state.pendingRightMargin : state.activeRightMargin;
        double carriedHeader = state.pendingHeaderDistance != null
                ? state.pendingHeaderDistance : state.activeHeaderDistance;
        double carriedFooter = state.pendingFooterDistance != null
                ? state.pendingFooterDistance : state.activeFooterDistance;

        if (header != null || top != null) {
            double headerDistance = header != null ? header : carriedHeader;
            double sectionTop = top != null ? top : baseMargins.top;
            next.pendingHeaderDistance(headerDistance)
                    .pendingTopMargin(requiredMargin(headerDistance, sectionTop, headerContent));
        } else {
            next.pendingTopMargin(carriedTop).pendingHeaderDistance(carriedHeader);
        }

        if (footer != null || bottom != null) {
            double footerDistance = footer != null ? footer : carriedFooter;
            double sectionBottom = bottom != null ? bottom : baseMargins.bottom;
            next.pendingFooterDistance(footerDistance)
                    .pendingBottomMargin(requiredMargin(footerDistance, sectionBottom, footerContent));
        } else {
            next.pendingBottomMargin(carriedBottom).pendingFooterDistance(carriedFooter);
        }

        next.pendingLeftMargin(left != null ? left : carriedLeft);
        next.pendingRightMargin(right != null ? right : carriedRight);

        if (pageSize != null) {
            next.pendingPageSize(pageSize);
        }
        if (marker.orientation != null) {
            next.pendingOrientation(marker.orientation);
        }

        // columns are always scheduled, a marker without columns schedules the single-column reset
        next.pendingColumns(columns);

        BreakDecision decision;
        if (marker.requirePageBoundary) {
            decision = BreakDecision.pageBreak();
        } else {
            switch (marker.effectiveType()) {
                case NEXT_PAGE:
                    decision = BreakDecision.pageBreak();
                    break;
                case EVEN_PAGE:
                    decision = BreakDecision.pageBreak(PageParity.EVEN);
                    break;
                case ODD_PAGE:
                    decision = BreakDecision.pageBreak(PageParity.ODD);
                    break;
                case CONTINUOUS:
                default:
                    decision = isColumnConfigChanging(marker.columns, state.activeColumns)
                            ? BreakDecision.midPageRegion()
                            : BreakDecision.NONE;
                    break;
            }
        }
        LOGGER.debug("Section break {} ({}): {}, pending columns {}",
                marker.id, marker.effectiveType(), decision, columns);
        return new SectionTransition(decision, next.build());
    }

    /**
     * Moves every scheduled value to the active side and clears the pending side. Applying it twice
     * gives the same state as applying it once.
     */
    public static SectionState applyPendingToActive(SectionState state) {
        Objects.requireNonNull(state, "state");
        if (!state.hasPending()) {
            return state;
        }
        SectionState.Builder next = state.toBuilder();
        if (state.pendingTopMargin != null) {
            next.activeTopMargin(state.pendingTopMargin);
        }
        if (state.pendingBottomMargin != null) {
            next.activeBottomMargin(state.pendingBottomMargin);
        }
        if (state.pendingLeftMargin != null) {
            next.activeLeftMargin(state.pendingLeftMargin);
        }
        if (state.pendingRightMargin != null) {
            next.activeRightMargin(state.pendingRightMargin);
        }
        if (state.pendingHeaderDistance != null) {
            next.activeHeaderDistance(state.pendingHeaderDistance);
        }
        if (state.pendingFooterDistance != null) {
            next.activeFooterDistance(state.pendingFooterDistance);
        }
        if (state.pendingPageSize != null) {
            next.activePageSize(state.pendingPageSize);
        }
        if (state.pendingColumns != null) {
            next.activeColumns(state.pendingColumns);
        }
        if (state.pendingOrientation != null) {
            next.activeOrientation(state.pendingOrientation);
        }
        return next.pendingTopMargin(null)
                .pendingBottomMargin(null)
                .pendingLeftMargin(null)
                .pendingRightMargin(null)
                .pendingHeaderDistance(null)
                .pendingFooterDistance(null)
                .pendingPageSize(null)
                .pendingColumns(null)
                .pendingOrientation(null)
                .build();
    }

    /**
     * Activates only the pending column layout, as needed when a continuous break opens a new column
     * region in the middle of a page. Other pending values wait for the next page boundary.
     */
    public static SectionState applyPendingColumns(SectionState state) {
        Objects.requireNonNull(state, "state");
        if (state.pendingColumns == null) {
            return state;
        }
        return state.toBuilder()
                .activeColumns(state.pendingColumns)
                .pendingColumns(null)
                .build();
    }

    /**
     * Whether the marker's columns differ from the active layout. Absent columns mean a reset to
     * one column, which is a change only when the active layout has several columns.
     */
    static boolean isColumnConfigChanging(ColumnLayout markerColumns, ColumnLayout activeColumns) {
        if (markerColumns != null) {
            return !columnConfig(markerColumns).equals(activeColumns);
        }
        return activeColumns.count > 1;
    }

    static ColumnLayout columnConfig(ColumnLayout columns) {
        if (columns == null) {
            return ColumnLayout.SINGLE;
        }
        return ColumnLayout.sanitized(columns.count, columns.gap);
    }

    private static double requiredMargin(double distance, double base, double contentHeight) {
        if (contentHeight > 0) {
            return Math.max(base, distance + contentHeight);
        }
        return base;
    }

    private static Double sanitizeLength(Double value) {
        if (value == null) {
            return null;
        }
        if (!Double.isFinite(value)) {
            LOGGER.warn("Ignoring non-finite section length {}", value);
            return null;
        }
        return Math.max(0, value);
    }

    private static double nonNegative(double value) {
        return Double.isFinite(value) ? Math.max(0, value) : 0;
    }

    private static double finiteOrZero(double value) {
        return Double.isFinite(value) ? value : 0;
    }
}
