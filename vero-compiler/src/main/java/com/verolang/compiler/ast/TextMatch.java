package com.verolang.compiler.ast;

/**
 * URL / 标题的匹配方式
 */
public enum TextMatch {
    CONTAINS, IS, MATCHES
}
