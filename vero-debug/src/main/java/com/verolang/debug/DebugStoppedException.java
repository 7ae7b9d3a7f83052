package com.verolang.debug;

/**
 * 调试会话被 stop 命令终止后，执行线程在下一个语句边界收到此异常
 */
public class DebugStoppedException extends RuntimeException {

    public DebugStoppedException(int line) {
        super("Debug session stopped before line " + line);
    }
}
