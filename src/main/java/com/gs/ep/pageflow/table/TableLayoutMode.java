package com.gs.ep.pageflow.table;

/**
 * 表格排版模式枚举
 * 用于标识表格在分页时采用的处理方式，以便选择合适的排版策略
 */
public enum TableLayoutMode {

    /**
     * 拆分模式：按行分页，必要时在行内按文本行拆分，续表重复表头
     */
    SPLITTING("按行拆分"),

    /**
     * 整体模式：浮动表格作为一个整体放置，从不拆分
     */
    MONOLITHIC("整体放置");

    private final String displayName;

    TableLayoutMode(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
