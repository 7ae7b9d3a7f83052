package com.verolang.compiler.ast.query;

/**
 * ROW 语句选取哪一行
 */
public enum RowPosition {
    FIRST, LAST, RANDOM
}
