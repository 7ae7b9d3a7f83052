package com.verolang.compiler.ast;

/**
 * 比较运算符
 */
public enum ComparisonOperator {
    EQ("==="),
    NE("!=="),
    GT(">"),
    LT("<"),
    GE(">="),
    LE("<=");

    private final String tsOperator;

    ComparisonOperator(String tsOperator) {
        this.tsOperator = tsOperator;
    }

    /** 生成 TypeScript 时使用的运算符 */
    public String getTsOperator() {
        return tsOperator;
    }
}
