package com.verolang.compiler.ast;

/**
 * 元素状态（VERIFY t IS ... / IF t IS ...）
 */
public enum ElementState {
    VISIBLE, HIDDEN, ENABLED, DISABLED, CHECKED, FOCUSED, EMPTY
}
