package com.gs.ep.pageflow.table;

import com.gs.ep.pageflow.model.TableFragment;
import org.eclipse.collections.api.list.ImmutableList;

/**
 * 表格排版策略接口
 *
 * 不同类型的表格（普通表格、浮动表格）有不同的分页方式。
 * 策略模式允许在运行时根据表格属性选择合适的处理方式。
 */
public interface TableLayoutStrategy {

    /**
     * 获取该策略对应的排版模式
     */
    TableLayoutMode getMode();

    /**
     * 将表格排入分页游标，生成的片段同时追加到各自所在页面
     *
     * @param context 表格排版上下文
     * @return 按顺序生成的表格片段
     */
    ImmutableList<TableFragment> layout(TableLayoutContext context);
}
