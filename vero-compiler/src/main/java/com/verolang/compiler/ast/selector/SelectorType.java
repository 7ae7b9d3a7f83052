package com.verolang.compiler.ast.selector;

/**
 * 选择器基础类型
 */
public enum SelectorType {
    CSS, ROLE, TEXT, TESTID, LABEL, PLACEHOLDER
}
