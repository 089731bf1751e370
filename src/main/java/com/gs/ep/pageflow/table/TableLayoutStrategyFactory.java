package com.gs.ep.pageflow.table;

import com.gs.ep.pageflow.config.LayoutConfig;
import com.gs.ep.pageflow.model.TableBlock;
import com.gs.ep.pageflow.table.strategy.MonolithicTableStrategy;
import com.gs.ep.pageflow.table.strategy.SplittingTableStrategy;

/**
 * 表格排版策略工厂
 *
 * 负责：
 * 1. 检测表格的排版模式
 * 2. 根据模式返回合适的排版策略
 *
 * 策略实例按配置创建一次后复用（策略类无状态）。
 */
public class TableLayoutStrategyFactory {

    private final SplittingTableStrategy splittingStrategy;
    private final MonolithicTableStrategy monolithicStrategy;

    public TableLayoutStrategyFactory(LayoutConfig config) {
        this(config, new TableRowSplitter(config.getMinPartialRowHeight(), config.getDefaultCellPadding()));
    }

    public TableLayoutStrategyFactory(LayoutConfig config, TableRowSplitter splitter) {
        double minWidth = config.getMinTableColumnWidth();
        double maxMinWidth = config.getMaxMinTableColumnWidth();
        this.splittingStrategy = new SplittingTableStrategy(splitter, minWidth, maxMinWidth);
        this.monolithicStrategy = new MonolithicTableStrategy(minWidth, maxMinWidth);
    }

    /**
     * 根据表格属性自动检测模式并返回策略
     */
    public TableLayoutStrategy createStrategy(TableBlock block) {
        return getStrategy(detectMode(block));
    }

    /**
     * 根据排版模式获取对应的策略实例
     */
    public TableLayoutStrategy getStrategy(TableLayoutMode mode) {
        switch (mode) {
            case MONOLITHIC:
                return monolithicStrategy;
            case SPLITTING:
            default:
                return splittingStrategy;
        }
    }

    /**
     * 检测表格的排版模式：带浮动属性的表格整体放置，其余按行拆分
     */
    public TableLayoutMode detectMode(TableBlock block) {
        return block.attrs.isFloating() ? TableLayoutMode.MONOLITHIC : TableLayoutMode.SPLITTING;
    }
}
