package com.verolang.compiler.ast;

/**
 * Vero 变量类型
 */
public enum VariableType {
    TEXT("string"),
    NUMBER("number"),
    FLAG("boolean"),
    LIST("string[]");

    private final String tsType;

    VariableType(String tsType) {
        this.tsType = tsType;
    }

    /** 对应的 TypeScript 类型 */
    public String getTsType() {
        return tsType;
    }
}
