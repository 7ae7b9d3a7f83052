package com.verolang.compiler.ast.query;

/**
 * ORDER BY 列 [ASC|DESC]
 */
public final class OrderBy {
    private final String column;
    private final boolean descending;

    public OrderBy(String column, boolean descending) {
        this.column = column;
        this.descending = descending;
    }

    public String getColumnName() {
        return column;
    }

    public boolean isDescending() {
        return descending;
    }
}
