package com.verolang.compiler.ast;

/**
 * 视觉对比预设
 */
public enum VisualPreset {
    STRICT, BALANCED, RELAXED
}
