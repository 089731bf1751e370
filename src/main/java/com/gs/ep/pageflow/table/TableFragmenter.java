package com.gs.ep.pageflow.table;

import com.gs.ep.pageflow.config.LayoutConfig;
import com.gs.ep.pageflow.model.TableBlock;
import com.gs.ep.pageflow.model.TableFragment;
import com.gs.ep.pageflow.model.TableMeasure;
import org.eclipse.collections.api.list.ImmutableList;
import org.eclipse.collections.impl.factory.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Entry point for laying out table blocks.
 * <p>
 * Anchored tables are left to the host's float placement and later positioned through
 * {@link #layoutAnchoredTable}. Floating tables are placed whole; every other table is split
 * over as many columns and pages as it needs.
 */
public class TableFragmenter {

    private static final Logger LOGGER = LoggerFactory.getLogger(TableFragmenter.class);

    private final LayoutConfig config;
    private final TableLayoutStrategyFactory strategyFactory;

    public TableFragmenter() {
        this(LayoutConfig.defaults());
    }

    public TableFragmenter(LayoutConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        this.strategyFactory = new TableLayoutStrategyFactory(config);
    }

    /**
     * Lays out {@code context.block} through {@code context.cursor}. The fragments are appended to the
     * pages they land on and also returned in order. Anchored tables produce no fragment here.
     */
    public ImmutableList<TableFragment> layoutTable(TableLayoutContext context) {
        Objects.requireNonNull(context, "context");
        if (context.block.anchored) {
            LOGGER.debug("Skipping anchored table {}", context.block.id);
            return Lists.immutable.empty();
        }
        TableLayoutStrategy strategy = strategyFactory.createStrategy(context.block);
        LOGGER.debug("Laying out table {} ({} rows) with {} strategy",
                context.block.id, context.block.rowCount(), strategy.getMode());
        return strategy.layout(context);
    }

    /**
     * Single fragment for an anchored table at the position chosen by the host's float placement.
     */
    public TableFragment layoutAnchoredTable(TableBlock block, TableMeasure measure, double x, double y) {
        Objects.requireNonNull(block, "block");
        Objects.requireNonNull(measure, "measure");
        TableFragment fragment = new TableFragment(block.id, 0, block.rowCount(), null, 0, false, false,
                x, y, measure.getTotalWidth(), measure.getTotalHeight());
        fragment.setColumnBoundaries(TableGeometry.columnBoundaries(measure,
                config.getMinTableColumnWidth(), config.getMaxMinTableColumnWidth()));
        fragment.setRange(TableGeometry.fragmentRange(block, measure, 0, block.rowCount(), null));
        return fragment;
    }
}
