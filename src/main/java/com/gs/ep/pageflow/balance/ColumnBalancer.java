package com.gs.ep.pageflow.balance;

import com.gs.ep.pageflow.model.BlockMeasure;
import com.gs.ep.pageflow.model.ContentBlock;
import com.gs.ep.pageflow.model.Fragment;
import com.gs.ep.pageflow.model.ParagraphFragment;
import com.gs.ep.pageflow.model.ParagraphMeasure;
import com.gs.ep.pageflow.section.SectionType;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.api.list.MutableList;
import org.eclipse.collections.api.map.MutableMap;
import org.eclipse.collections.api.map.primitive.MutableObjectIntMap;
import org.eclipse.collections.api.map.sorted.MutableSortedMap;
import org.eclipse.collections.impl.factory.Lists;
import org.eclipse.collections.impl.factory.Maps;
import org.eclipse.collections.impl.factory.SortedMaps;
import org.eclipse.collections.impl.factory.primitive.DoubleLists;
import org.eclipse.collections.impl.factory.primitive.ObjectIntMaps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Distributes content over the columns of a section so that the columns end at about the same
 * height.
 * <p>
 * {@link #balance(BalancingContext)} works on measured blocks before placement and searches a
 * target column height with a bounded number of greedy simulations.
 * {@link #rebalancePositionedContent} works on fragments that were already placed on a page and
 * moves them, row by row, into balanced columns.
 */
public class ColumnBalancer {

    private static final Logger LOGGER = LoggerFactory.getLogger(ColumnBalancer.class);

    private final BalancingConfig config;

    public ColumnBalancer() {
        this(BalancingConfig.DEFAULT);
    }

    public ColumnBalancer(BalancingConfig config) {
        this.config = Objects.requireNonNull(config, "config");
    }

    // ==================== 排版前平衡 ====================

    public BalancingResult balance(BalancingContext context) {
        return balance(context, config);
    }

    /**
     * Computes a balanced column assignment for the blocks of {@code context}.
     */
    public BalancingResult balance(BalancingContext context, BalancingConfig config) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(config, "config");
        ImmutableList<ContentBlock> blocks = context.blocks;

        if (!config.enabled || context.columnCount <= 1) {
            return singleColumnResult(context);
        }
        if (blocks.isEmpty()) {
            return new BalancingResult(0, ObjectIntMaps.immutable.empty(), null, true, 0, null);
        }
        if (blocks.size() == 1 && !blocks.getFirst().isSplittable()) {
            return singleColumnResult(context);
        }

        double totalHeight = context.totalHeight();
        if (totalHeight < config.minColumnHeight * context.columnCount) {
            return singleColumnResult(context);
        }

        double targetHeight = Math.ceil(totalHeight / context.columnCount);
        targetHeight = Math.max(targetHeight, config.minColumnHeight);
        targetHeight = Math.min(targetHeight, context.availableHeight);

        Simulation best = null;
        double bestScore = Double.POSITIVE_INFINITY;

        for (int i = 0; i < config.maxIterations; i++) {
            Simulation simulation = simulate(context, targetHeight);
            double score = balanceScore(simulation.columnHeights, config.tolerance);
            if (score < bestScore) {
                bestScore = score;
                best = simulation;
            }
            if (isBalanced(simulation.columnHeights, config.tolerance)) {
                LOGGER.debug("Balanced {} blocks into {} columns at target {} after {} iteration(s)",
                        blocks.size(), context.columnCount, targetHeight, i + 1);
                return simulation.toResult(targetHeight, true, i + 1);
            }
            targetHeight = adjustTargetHeight(simulation, targetHeight, context, config);
        }

        if (best != null) {
            LOGGER.debug("Column balancing did not converge within {} iterations, best heights {}",
                    config.maxIterations, DoubleLists.immutable.of(best.columnHeights));
            return best.toResult(targetHeight, false, config.maxIterations);
        }
        return sequentialResult(context);
    }

    /**
     * Whether balancing would be pointless for {@code context}: disabled, single column, no content,
     * a lone block that cannot be split, or too little content to spread.
     */
    public boolean shouldSkipBalancing(BalancingContext context) {
        return shouldSkipBalancing(context, config);
    }

    public boolean shouldSkipBalancing(BalancingContext context, BalancingConfig config) {
        if (!config.enabled || context.columnCount <= 1 || context.blocks.isEmpty()) {
            return true;
        }
        if (context.blocks.size() == 1 && !context.blocks.getFirst().canBreak) {
            return true;
        }
        double totalHeight = context.totalHeight();
        if (totalHeight < config.minColumnHeight) {
            return true;
        }
        return totalHeight / context.columnCount < config.minColumnHeight;
    }

    /**
     * Whether a section's columns are balanced. An explicit flag wins; otherwise continuous sections
     * and the last section of the document are balanced.
     */
    public static boolean shouldBalanceColumns(SectionType sectionType, Boolean balanceColumns, boolean isLastSection) {
        if (balanceColumns != null) {
            return balanceColumns;
        }
        return sectionType == SectionType.CONTINUOUS || isLastSection;
    }

    private Simulation simulate(BalancingContext context, double targetHeight) {
        ImmutableList<ContentBlock> blocks = context.blocks;
        Simulation simulation = new Simulation(context.columnCount);
        double[] heights = simulation.columnHeights;
        int column = 0;

        for (int i = 0; i < blocks.size(); i++) {
            ContentBlock block = blocks.get(i);
            ContentBlock nextBlock = i + 1 < blocks.size() ? blocks.get(i + 1) : null;
            boolean wouldExceed = heights[column] + block.measuredHeight > targetHeight;

            if (wouldExceed && column < context.columnCount - 1) {
                if (block.keepWithNext && nextBlock != null
                        && heights[column] + block.measuredHeight + nextBlock.measuredHeight <= targetHeight) {
                    simulation.assign(block.id, column, block.measuredHeight);
                    continue;
                }

                if (block.isSplittable()) {
                    int breakAfterLine = paragraphBreakPoint(block, targetHeight - heights[column]);
                    if (breakAfterLine >= 0 && breakAfterLine < block.lineCount() - 1) {
                        double before = heightOfLines(block, breakAfterLine + 1);
                        double after = block.measuredHeight - before;
                        simulation.breakPoints.put(block.id, new BlockBreakPoint(block.id, breakAfterLine, before, after));
                        simulation.assign(block.id, column, before);
                        column++;
                        heights[column] += after;
                        continue;
                    }
                }
                column++;
            }
            simulation.assign(block.id, column, block.measuredHeight);
        }
        return simulation;
    }

    /**
     * Index of the last line that stays in the current column, or -1 when the paragraph cannot be
     * cut without violating orphan or widow control.
     */
    static int paragraphBreakPoint(ContentBlock block, double availableHeight) {
        int lineCount = block.lineCount();
        if (lineCount == 0) {
            return -1;
        }
        double heightSoFar = 0;
        for (int i = 0; i < lineCount; i++) {
            heightSoFar += block.lineHeights.get(i);
            if (heightSoFar > availableHeight) {
                int linesBefore = i;
                int linesAfter = lineCount - i;
                if (linesAfter < block.widowLines) {
                    int adjusted = Math.max(0, i - (block.widowLines - linesAfter));
                    if (adjusted < block.orphanLines) {
                        return -1;
                    }
                    return adjusted - 1;
                }
                if (linesBefore < block.orphanLines) {
                    return -1;
                }
                return i - 1;
            }
        }
        return lineCount - 1;
    }

    private static double heightOfLines(ContentBlock block, int lineCount) {
        double sum = 0;
        for (int i = 0; i < lineCount; i++) {
            sum += block.lineHeights.get(i);
        }
        return sum;
    }

    static boolean isBalanced(double[] columnHeights, double tolerance) {
        if (columnHeights.length <= 1) {
            return true;
        }
        double max = Double.NEGATIVE_INFINITY;
        double min = Double.POSITIVE_INFINITY;
        int nonEmpty = 0;
        for (double height : columnHeights) {
            if (height > 0) {
                nonEmpty++;
                max = Math.max(max, height);
                min = Math.min(min, height);
            }
        }
        return nonEmpty <= 1 || max - min <= tolerance;
    }

    /**
     * Variance of the non-empty column heights plus a penalty per empty column. Lower is better.
     */
    static double balanceScore(double[] columnHeights, double tolerance) {
        if (columnHeights.length <= 1) {
            return 0;
        }
        double sum = 0;
        int nonEmpty = 0;
        for (double height : columnHeights) {
            if (height > 0) {
                sum += height;
                nonEmpty++;
            }
        }
        if (nonEmpty <= 1) {
            return 0;
        }
        double mean = sum / nonEmpty;
        double variance = 0;
        for (double height : columnHeights) {
            if (height > 0) {
                variance += (height - mean) * (height - mean);
            }
        }
        double emptyPenalty = (columnHeights.length - nonEmpty) * tolerance * 10;
        return variance + emptyPenalty;
    }

    private static double adjustTargetHeight(Simulation simulation, double currentTarget,
                                             BalancingContext context, BalancingConfig config) {
        double[] heights = simulation.columnHeights;
        double max = 0;
        double min = Double.POSITIVE_INFINITY;
        for (double height : heights) {
            max = Math.max(max, height);
            if (height > 0) {
                min = Math.min(min, height);
            }
        }
        if (min == Double.POSITIVE_INFINITY) {
            min = 0;
        }
        double last = heights[heights.length - 1];

        // last column carries the overflow
        if (last > max * 0.9 && last > currentTarget) {
            return Math.min(currentTarget + (max - currentTarget) / 2, context.availableHeight);
        }
        if (heights[0] > currentTarget && last < currentTarget * 0.5) {
            return Math.max(currentTarget - (currentTarget - min) / 2, config.minColumnHeight);
        }
        double diff = max - min;
        if (max > currentTarget) {
            return Math.min(currentTarget + diff / 4, context.availableHeight);
        }
        return Math.max(currentTarget - diff / 4, config.minColumnHeight);
    }

    private static BalancingResult singleColumnResult(BalancingContext context) {
        MutableObjectIntMap<String> assignments = ObjectIntMaps.mutable.empty();
        for (ContentBlock block : context.blocks) {
            assignments.put(block.id, 0);
        }
        return new BalancingResult(context.availableHeight, assignments.toImmutable(), null, true, 0,
                DoubleLists.immutable.of(context.totalHeight()));
    }

    private static BalancingResult sequentialResult(BalancingContext context) {
        MutableObjectIntMap<String> assignments = ObjectIntMaps.mutable.empty();
        double[] heights = new double[context.columnCount];
        int column = 0;
        for (ContentBlock block : context.blocks) {
            if (heights[column] + block.measuredHeight > context.availableHeight && column < context.columnCount - 1) {
                column++;
            }
            assignments.put(block.id, column);
            heights[column] += block.measuredHeight;
        }
        double max = 0;
        for (double height : heights) {
            max = Math.max(max, height);
        }
        return new BalancingResult(max, assignments.toImmutable(), null, false, 0, DoubleLists.immutable.of(heights));
    }

    // ==================== 排版后平衡 ====================

    /**
     * Moves already placed fragments into balanced columns. Fragments sharing a (rounded) y position
     * form one row and move together. A new column starts as soon as the running column height plus
     * the next row reaches the target height, provided a later column exists.
     * <p>
     * Fragments are updated in place: x becomes the column offset, y the top margin plus the height
     * already stacked in that column, and width the column width.
     *
     * @param fragments  fragments of one page region
     * @param columns    column geometry of the region
     * @param leftMargin x of the first column
     * @param topMargin  y where content starts in each column
     * @param measures   block measures keyed by block id, used to size paragraph fragments
     */
    public void rebalancePositionedContent(List<? extends Fragment> fragments, ColumnSpec columns,
                                           double leftMargin, double topMargin, Map<String, ? extends BlockMeasure> measures) {
        if (columns == null || columns.count <= 1 || fragments == null || fragments.isEmpty()) {
            return;
        }

        MutableSortedMap<Long, MutableList<Fragment>> rows = SortedMaps.mutable.empty();
        MutableMap<Fragment, Double> heights = Maps.mutable.empty();
        for (Fragment fragment : fragments) {
            rows.getIfAbsentPut(Math.round(fragment.getY()), Lists.mutable::empty).add(fragment);
            heights.put(fragment, fragmentHeight(fragment, measures));
        }

        double totalHeight = 0;
        for (MutableList<Fragment> row : rows.valuesView()) {
            totalHeight += rowHeight(row, heights);
        }
        double targetHeight = totalHeight / columns.count;
        if (targetHeight < config.minColumnHeight) {
            LOGGER.debug("Skipping column rebalance, target {} below minimum {}", targetHeight, config.minColumnHeight);
            return;
        }

        int column = 0;
        double columnHeight = 0;
        double y = topMargin;
        for (MutableList<Fragment> row : rows.valuesView()) {
            double rowHeight = rowHeight(row, heights);
            if (columnHeight > 0 && columnHeight + rowHeight >= targetHeight && column < columns.count - 1) {
                column++;
                columnHeight = 0;
                y = topMargin;
            }
            double x = columns.columnX(leftMargin, column);
            for (Fragment fragment : row) {
                fragment.setX(x);
                fragment.setY(y);
                fragment.setWidth(columns.width);
            }
            columnHeight += rowHeight;
            y += rowHeight;
        }
        LOGGER.debug("Rebalanced {} rows over {} columns, target {}", rows.size(), column + 1, targetHeight);
    }

    private static double rowHeight(MutableList<Fragment> row, MutableMap<Fragment, Double> heights) {
        double max = 0;
        for (Fragment fragment : row) {
            max = Math.max(max, heights.get(fragment));
        }
        return max;
    }

    /**
     * Height of a fragment for rebalancing: paragraph fragments sum their lines from the paragraph
     * measure; other fragments use their own height, falling back to the measure.
     */
    static double fragmentHeight(Fragment fragment, Map<String, ? extends BlockMeasure> measures) {
        BlockMeasure measure = measures == null ? null : measures.get(fragment.getBlockId());
        if (fragment instanceof ParagraphFragment) {
            if (!(measure instanceof ParagraphMeasure)) {
                return 0;
            }
            ParagraphFragment paragraph = (ParagraphFragment) fragment;
            return ((ParagraphMeasure) measure).heightOf(paragraph.getFromLine(), paragraph.getToLine());
        }
        if (fragment.getHeight() > 0) {
            return fragment.getHeight();
        }
        return measure != null ? measure.getHeight() : 0;
    }

    private static final class Simulation {
        private final double[] columnHeights;
        private final MutableObjectIntMap<String> assignments = ObjectIntMaps.mutable.empty();
        private final MutableMap<String, BlockBreakPoint> breakPoints = Maps.mutable.empty();

        private Simulation(int columnCount) {
            this.columnHeights = new double[columnCount];
        }

        private void assign(String blockId, int column, double height) {
            assignments.put(blockId, column);
            columnHeights[column] += height;
        }

        private BalancingResult toResult(double targetHeight, boolean success, int iterations) {
            return new BalancingResult(targetHeight, assignments.toImmutable(), breakPoints.toImmutable(),
                    success, iterations, DoubleLists.immutable.of(columnHeights.clone()));
        }
    }
}
