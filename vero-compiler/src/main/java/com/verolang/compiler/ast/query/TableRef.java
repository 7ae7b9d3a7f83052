package com.verolang.compiler.ast.query;

/**
 * 数据表引用：Table 或 Project.Table
 */
public final class TableRef {
    private final String project;
    private final String table;

    public TableRef(String project, String table) {
        this.project = project;
        this.table = table;
    }

    /** 跨项目引用时的项目名，可能为 null */
    public String getProject() {
        return project;
    }

    public String getTable() {
        return table;
    }

    public String getQualifiedName() {
        return project != null ? project + "." + table : table;
    }

    @Override
    public String toString() {
        return getQualifiedName();
    }
}
