package com.verolang.debug;

/**
 * 调试执行状态
 */
public enum DebugState {
    /** 正常执行，只在断点处暂停 */
    RUNNING,
    /** 在语句边界等待命令 */
    PAUSED,
    /** 执行一条语句后暂停 */
    STEPPING,
    /** 已终止，不再执行任何语句 */
    STOPPED
}
