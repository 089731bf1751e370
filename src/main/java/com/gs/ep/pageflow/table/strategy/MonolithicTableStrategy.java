package com.gs.ep.pageflow.table.strategy;

import com.gs.ep.pageflow.cursor.PageState;
import com.gs.ep.pageflow.model.TableFragment;
import com.gs.ep.pageflow.table.AbstractTableLayoutStrategy;
import com.gs.ep.pageflow.table.TableLayoutContext;
import com.gs.ep.pageflow.table.TableLayoutMode;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 整体放置策略
 *
 * 适用于浮动表格：表格作为一个片段放置，从不按行拆分。
 * 只有在当前栏已有内容且剩余空间放不下整张表时才换栏，片段高度不超过剩余空间。
 */
public class MonolithicTableStrategy extends AbstractTableLayoutStrategy {

    private static final Logger LOGGER = LoggerFactory.getLogger(MonolithicTableStrategy.class);

    public MonolithicTableStrategy(double minColumnWidth, double maxMinColumnWidth) {
        super(minColumnWidth, maxMinColumnWidth);
    }

    @Override
    public TableLayoutMode getMode() {
        return TableLayoutMode.MONOLITHIC;
    }

    @Override
    public ImmutableList<TableFragment> layout(TableLayoutContext context) {
        double totalHeight = context.measure.getTotalHeight();
        PageState state = context.cursor.ensurePage();
        if (state.getCursorY() + totalHeight > state.getContentBottom() && !state.isAtColumnTop()) {
            state = context.cursor.advanceColumn(state);
        }
        state = context.cursor.ensurePage();
        double height = Math.max(0, Math.min(totalHeight, state.getRemainingHeight()));

        TableFragment fragment = placeFragment(context, state, 0, context.block.rowCount(), null, 0,
                false, false, height);
        LOGGER.debug("Placed floating table {} as one fragment on page {}", context.block.id, state.getPageNumber());
        return Lists.immutable.of(fragment);
    }
}
