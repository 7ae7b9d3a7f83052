package com.verolang.compiler.codegen;

/**
 * 代码生成配置
 */
public class TranspileOptions {
    private boolean debugMode = false;
    private boolean captureEvidence = true;
    private String baseUrl;
    private String pageObjectDir = "pages";
    private String pageActionsDir = "pageActions";
    private String runtimeDir = "runtime";
    private int indentSize = 2;
    private long debugPollIntervalMs = 50;

    public TranspileOptions() {
    }

    /** 为每条语句插入调试钩子 */
    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    /** 每个场景末尾追加证据截图步骤 */
    public boolean isCaptureEvidence() {
        return captureEvidence;
    }

    public void setCaptureEvidence(boolean captureEvidence) {
        this.captureEvidence = captureEvidence;
    }

    /** 非 null 时，OPEN 的相对路径以此为前缀 */
    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }

    public String getPageObjectDir() {
        return pageObjectDir;
    }

    public void setPageObjectDir(String pageObjectDir) {
        this.pageObjectDir = pageObjectDir;
    }

    public String getPageActionsDir() {
        return pageActionsDir;
    }

    public void setPageActionsDir(String pageActionsDir) {
        this.pageActionsDir = pageActionsDir;
    }

    public String getRuntimeDir() {
        return runtimeDir;
    }

    public void setRuntimeDir(String runtimeDir) {
        this.runtimeDir = runtimeDir;
    }

    /** 暂停时轮询调试命令文件的间隔 */
    public long getDebugPollIntervalMs() {
        return debugPollIntervalMs;
    }

    public void setDebugPollIntervalMs(long debugPollIntervalMs) {
        this.debugPollIntervalMs = debugPollIntervalMs;
    }

    public int getIndentSize() {
        return indentSize;
    }

    public void setIndentSize(int indentSize) {
        this.indentSize = indentSize;
    }

    /**
     * 获取单层缩进字符串
     */
    public String getIndentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentSize; i++) {
            sb.append(' ');
        }
        return sb.toString();
    }
}
