package com.gs.ep.pageflow.balance;

import com.gs.ep.pageflow.model.AtomicFragment;
import com.gs.ep.pageflow.model.BlockKind;
import com.gs.ep.pageflow.model.BlockMeasure;
import com.gs.ep.pageflow.model.ContentBlock;
import com.gs.ep.pageflow.model.Fragment;
import com.gs.ep.pageflow.model.ParagraphFragment;
import com.gs.ep.pageflow.model.ParagraphMeasure;
import com.gs.ep.pageflow.section.SectionType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class ColumnBalancerTest {

    private final ColumnBalancer balancer = new ColumnBalancer();

    private static ContentBlock block(String id, double height) {
        return ContentBlock.atomic(id, BlockKind.PARAGRAPH, height);
    }

    private static BalancingContext context(int columns, double availableHeight, ContentBlock... blocks) {
        return new BalancingContext(columns, 288, 48, availableHeight, Arrays.asList(blocks));
    }

    private static double sum(BalancingResult result) {
        return result.columnHeights.sum();
    }

    // ==================== balance ====================

    @Test
    void balance_equalBlocksInTwoColumns_shouldSplitEvenly() {
        BalancingResult result = balancer.balance(context(2, 1000,
                block("b1", 100), block("b2", 100), block("b3", 100), block("b4", 100)));

        assertTrue(result.success);
        assertEquals(1, result.iterations);
        assertEquals(200, result.targetColumnHeight);
        assertEquals(0, result.columnOf("b1"));
        assertEquals(0, result.columnOf("b2"));
        assertEquals(1, result.columnOf("b3"));
        assertEquals(1, result.columnOf("b4"));
        assertEquals(400, sum(result), 0.001);
    }

    @Test
    void balance_paragraphAcrossColumns_shouldRecordBreakPoint() {
        ContentBlock paragraph = ContentBlock.paragraph("p", 10, 10, 10, 10, 10, 10, 10, 10, 10, 10);
        BalancingResult result = balancer.balance(context(2, 1000, block("a", 100), paragraph, block("c", 100)));

        assertTrue(result.success);
        assertTrue(result.hasBreakPoints());
        BlockBreakPoint breakPoint = result.breakPointOf("p");
        assertNotNull(breakPoint);
        assertEquals(4, breakPoint.breakAfterLine);
        assertEquals(50, breakPoint.heightBeforeBreak, 0.001);
        assertEquals(50, breakPoint.heightAfterBreak, 0.001);
        assertEquals(0, result.columnOf("p"));
        assertEquals(1, result.columnOf("c"));
        assertEquals(150, result.columnHeights.get(0), 0.001);
        assertEquals(150, result.columnHeights.get(1), 0.001);
    }

    @Test
    void balance_keepTogetherParagraph_shouldNeverBeSplit() {
        ContentBlock paragraph = ContentBlock.builder("p")
                .lineHeights(10, 10, 10, 10, 10, 10, 10, 10, 10, 10)
                .canBreak(true)
                .keepTogether(true)
                .build();

        BalancingResult result = balancer.balance(context(2, 1000, block("a", 100), paragraph, block("c", 100)));

        assertFalse(result.hasBreakPoints());
        assertNull(result.breakPointOf("p"));
        assertEquals(1, result.columnOf("p"));
        assertEquals(300, sum(result), 0.001);
    }

    @Test
    void balance_notConverging_shouldReturnBestWithinIterationLimit() {
        ContentBlock paragraph = ContentBlock.builder("p")
                .lineHeights(10, 10, 10, 10, 10, 10, 10, 10, 10, 10)
                .canBreak(true)
                .keepTogether(true)
                .build();
        BalancingConfig config = new BalancingConfig(true, 5, 3, 20);

        BalancingResult result = balancer.balance(context(2, 1000, block("a", 100), paragraph, block("c", 100)), config);

        assertFalse(result.success);
        assertEquals(3, result.iterations);
        assertEquals(3, result.columnAssignments.size());
    }

    @Test
    void balance_manyBlocksInThreeColumns_shouldRespectIterationLimitAndConserveHeight() {
        List<ContentBlock> blocks = new ArrayList<>();
        double total = 0;
        for (int i = 0; i < 20; i++) {
            double height = 10 + (i % 5) * 10;
            blocks.add(block("b" + i, height));
            total += height;
        }
        BalancingConfig config = new BalancingConfig(true, 5, 5, 20);

        BalancingResult result = balancer.balance(new BalancingContext(3, 200, 24, 1000, blocks), config);

        assertTrue(result.iterations <= 5);
        assertEquals(20, result.columnAssignments.size());
        assertEquals(total, sum(result), 0.001);
    }

    @Test
    void balance_keepWithNextBlock_shouldStillAssignBothBlocks() {
        ContentBlock keep = ContentBlock.builder("b2").measuredHeight(100).keepWithNext(true).build();

        BalancingResult result = balancer.balance(context(2, 1000, block("b1", 100), keep, block("b3", 100), block("b4", 100)));

        assertTrue(result.columnOf("b2") >= 0);
        assertTrue(result.columnOf("b3") >= result.columnOf("b2"));
    }

    @Test
    void balance_loneUnsplittableBlock_shouldReturnSingleColumn() {
        BalancingResult result = balancer.balance(context(2, 1000, block("only", 300)));

        assertTrue(result.success);
        assertEquals(0, result.iterations);
        assertEquals(0, result.columnOf("only"));
    }

    @Test
    void balance_disabled_shouldReturnSingleColumn() {
        BalancingResult result = balancer.balance(context(2, 1000, block("b1", 100), block("b2", 100)),
                BalancingConfig.DEFAULT.withEnabled(false));

        assertEquals(0, result.columnOf("b1"));
        assertEquals(0, result.columnOf("b2"));
        assertEquals(1000, result.targetColumnHeight);
    }

    @Test
    void balance_noContent_shouldSucceedWithoutAssignments() {
        BalancingResult result = balancer.balance(context(2, 1000));

        assertTrue(result.success);
        assertTrue(result.columnAssignments.isEmpty());
        assertEquals(0, result.iterations);
        assertFalse(result.hasBreakPoints());
    }

    @Test
    void balance_contentBelowMinimumHeight_shouldReturnSingleColumn() {
        BalancingResult result = balancer.balance(context(2, 1000, block("b1", 10), block("b2", 10)));

        assertEquals(0, result.columnOf("b1"));
        assertEquals(0, result.columnOf("b2"));
        assertEquals(-1, result.columnOf("missing"));
    }

    @Test
    void balance_blockTallerThanColumn_shouldStillAssignEveryBlock() {
        ContentBlock tall = ContentBlock.builder("b1").measuredHeight(800).keepTogether(true).build();

        BalancingResult result = balancer.balance(context(2, 500, tall, block("b2", 100)));

        assertEquals(2, result.columnAssignments.size());
    }

    // ==================== paragraphBreakPoint ====================

    @Test
    void paragraphBreakPoint_shouldCutBeforeOverflowingLine() {
        assertEquals(1, ColumnBalancer.paragraphBreakPoint(ContentBlock.paragraph("p", 20, 20, 20, 20, 20), 50));
    }

    @Test
    void paragraphBreakPoint_whenEverythingFits_shouldReturnLastLine() {
        assertEquals(4, ColumnBalancer.paragraphBreakPoint(ContentBlock.paragraph("p", 20, 20, 20, 20, 20), 500));
    }

    @Test
    void paragraphBreakPoint_withWidowControl_shouldMoveCutEarlier() {
        ContentBlock block = ContentBlock.builder("p").lineHeights(20, 20, 20, 20, 20).canBreak(true)
                .widowLines(4).build();

        assertEquals(0, ColumnBalancer.paragraphBreakPoint(block, 50));
    }

    @Test
    void paragraphBreakPoint_withOrphanControl_shouldRejectCut() {
        ContentBlock block = ContentBlock.builder("p").lineHeights(20, 20, 20, 20, 20).canBreak(true)
                .orphanLines(3).build();

        assertEquals(-1, ColumnBalancer.paragraphBreakPoint(block, 50));
    }

    @Test
    void isBalanced_shouldIgnoreEmptyColumns() {
        assertTrue(ColumnBalancer.isBalanced(new double[]{100, 103}, 5));
        assertFalse(ColumnBalancer.isBalanced(new double[]{100, 110}, 5));
        assertTrue(ColumnBalancer.isBalanced(new double[]{100, 0}, 5));
    }

    @Test
    void balanceScore_shouldPenalizeEmptyColumns() {
        assertEquals(0, ColumnBalancer.balanceScore(new double[]{100, 100}, 5), 0.001);
        assertEquals(50, ColumnBalancer.balanceScore(new double[]{100, 110}, 5), 0.001);
        assertTrue(ColumnBalancer.balanceScore(new double[]{100, 100, 0}, 5) > 0);
    }

    // ==================== shouldBalanceColumns / shouldSkipBalancing ====================

    @Test
    void shouldBalanceColumns_shouldPreferExplicitFlag() {
        assertTrue(ColumnBalancer.shouldBalanceColumns(SectionType.CONTINUOUS, null, false));
        assertTrue(ColumnBalancer.shouldBalanceColumns(SectionType.NEXT_PAGE, null, true));
        assertFalse(ColumnBalancer.shouldBalanceColumns(SectionType.NEXT_PAGE, null, false));
        assertTrue(ColumnBalancer.shouldBalanceColumns(SectionType.NEXT_PAGE, true, false));
        assertFalse(ColumnBalancer.shouldBalanceColumns(SectionType.CONTINUOUS, false, true));
    }

    @Test
    void shouldSkipBalancing_shouldDetectTrivialContexts() {
        assertTrue(balancer.shouldSkipBalancing(context(2, 1000, block("b1", 100)),
                BalancingConfig.DEFAULT.withEnabled(false)));
        assertTrue(balancer.shouldSkipBalancing(context(1, 1000, block("b1", 100), block("b2", 100))));
        assertTrue(balancer.shouldSkipBalancing(context(2, 1000)));
        assertTrue(balancer.shouldSkipBalancing(context(2, 1000, block("b1", 100))));
        assertTrue(balancer.shouldSkipBalancing(context(2, 1000, block("b1", 10), block("b2", 10))));
        assertFalse(balancer.shouldSkipBalancing(context(2, 1000, block("b1", 100), block("b2", 100))));
        assertFalse(balancer.shouldSkipBalancing(context(2, 1000, ContentBlock.paragraph("p", 20, 20, 20))));
    }

    // ==================== rebalancePositionedContent ====================

    private static List<Fragment> paragraphs(int count, Map<String, BlockMeasure> measures) {
        List<Fragment> fragments = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            String id = "block-" + (i + 1);
            fragments.add(new ParagraphFragment(id, 0, 1, 96, 96 + i * 20, 624, 0));
            measures.put(id, ParagraphMeasure.ofHeights(20));
        }
        return fragments;
    }

    private static final ColumnSpec TWO_COLUMNS = new ColumnSpec(2, 48, 288);

    @Test
    void rebalancePositionedContent_shouldSwitchColumnWhenTargetReached() {
        Map<String, BlockMeasure> measures = new HashMap<>();
        List<Fragment> fragments = paragraphs(4, measures);

        balancer.rebalancePositionedContent(fragments, TWO_COLUMNS, 96, 96, measures);

        assertEquals(96, fragments.get(0).getX());
        assertEquals(432, fragments.get(1).getX());
        assertEquals(432, fragments.get(2).getX());
        assertEquals(432, fragments.get(3).getX());
        for (Fragment fragment : fragments) {
            assertEquals(288, fragment.getWidth());
        }
    }

    @Test
    void rebalancePositionedContent_shouldRestartYAtTopMarginInEachColumn() {
        Map<String, BlockMeasure> measures = new HashMap<>();
        List<Fragment> fragments = paragraphs(6, measures);

        balancer.rebalancePositionedContent(fragments, TWO_COLUMNS, 96, 96, measures);

        assertEquals(96, fragments.get(0).getY());
        assertEquals(116, fragments.get(1).getY());
        assertEquals(96, fragments.get(0).getX());
        assertEquals(96, fragments.get(1).getX());
        assertEquals(432, fragments.get(2).getX());
        assertEquals(96, fragments.get(2).getY());
        assertEquals(116, fragments.get(3).getY());
        assertEquals(156, fragments.get(5).getY());
    }

    @Test
    void rebalancePositionedContent_fragmentsOnSameRow_shouldMoveTogether() {
        Map<String, BlockMeasure> measures = new HashMap<>();
        List<Fragment> fragments = new ArrayList<>();
        fragments.add(new AtomicFragment("img-1", BlockKind.IMAGE, 96, 96, 100, 40));
        fragments.add(new AtomicFragment("img-2", BlockKind.IMAGE, 300, 96.3, 100, 30));
        fragments.add(new AtomicFragment("img-3", BlockKind.IMAGE, 96, 136, 100, 40));

        balancer.rebalancePositionedContent(fragments, TWO_COLUMNS, 96, 96, measures);

        assertEquals(fragments.get(0).getX(), fragments.get(1).getX());
        assertEquals(fragments.get(0).getY(), fragments.get(1).getY());
        assertEquals(432, fragments.get(2).getX());
        assertEquals(96, fragments.get(2).getY());
    }

    @Test
    void rebalancePositionedContent_singleColumn_shouldLeaveFragmentsAlone() {
        Map<String, BlockMeasure> measures = new HashMap<>();
        List<Fragment> fragments = paragraphs(4, measures);

        balancer.rebalancePositionedContent(fragments, new ColumnSpec(1, 0, 624), 96, 96, measures);

        assertEquals(96, fragments.get(3).getX());
        assertEquals(156, fragments.get(3).getY());
        assertEquals(624, fragments.get(3).getWidth());
    }

    @Test
    void rebalancePositionedContent_targetBelowMinimum_shouldLeaveFragmentsAlone() {
        Map<String, BlockMeasure> measures = new HashMap<>();
        List<Fragment> fragments = paragraphs(1, measures);

        balancer.rebalancePositionedContent(fragments, TWO_COLUMNS, 96, 96, measures);

        assertEquals(624, fragments.get(0).getWidth());
    }

    @Test
    void fragmentHeight_shouldFallBackToMeasureForAtomicFragments() {
        Map<String, BlockMeasure> measures = new HashMap<>();
        measures.put("p", ParagraphMeasure.ofHeights(10, 20, 30));

        assertEquals(50, ColumnBalancer.fragmentHeight(new ParagraphFragment("p", 1, 3, 0, 0, 100, 0), measures), 0.001);
        assertEquals(0, ColumnBalancer.fragmentHeight(new ParagraphFragment("missing", 0, 1, 0, 0, 100, 0), measures), 0.001);
        assertEquals(40, ColumnBalancer.fragmentHeight(new AtomicFragment("img", BlockKind.IMAGE, 0, 0, 10, 40), measures), 0.001);
    }
}
