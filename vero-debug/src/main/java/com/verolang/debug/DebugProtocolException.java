package com.verolang.debug;

/**
 * 调试通道上收到无法解析的消息
 */
public class DebugProtocolException extends RuntimeException {

    public DebugProtocolException(String message) {
        super(message);
    }

    public DebugProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
