package com.verolang.compiler.analysis;

/**
 * 符号类型
 */
public enum SymbolKind {
    VARIABLE,           // TEXT/NUMBER/FLAG/LIST 局部变量
    PARAMETER,          // 动作参数
    LOOP_VARIABLE,      // FOR EACH 循环变量
    DATA                // ROW/ROWS/COUNT/LOAD 查询结果
}
