package com.verolang.compiler.codegen;

/**
 * 输出缓冲区，跟踪缩进层级
 */
public class CodeWriter {
    private final StringBuilder output = new StringBuilder();
    private final String indentUnit;
    private int indentLevel = 0;
    private boolean atLineStart = true;

    public CodeWriter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    public String getIndentUnit() {
        return indentUnit;
    }

    public CodeWriter indent() {
        indentLevel++;
        return this;
    }

    public CodeWriter dedent() {
        if (indentLevel > 0) {
            indentLevel--;
        }
        return this;
    }

    /**
     * 追加文本（自动处理行首缩进）
     */
    public CodeWriter append(String text) {
        if (text == null || text.isEmpty()) return this;
        if (atLineStart) {
            output.append(indentString());
            atLineStart = false;
        }
        output.append(text);
        return this;
    }

    /**
     * 追加一整行
     */
    public CodeWriter line(String text) {
        append(text);
        return newLine();
    }

    /**
     * 逐行追加多行文本，每行套用当前缩进
     */
    public CodeWriter lines(String text) {
        String[] parts = text.split("\n", -1);
        int count = parts.length;
        if (count > 0 && parts[count - 1].isEmpty()) {
            count--;
        }
        for (int i = 0; i < count; i++) {
            if (parts[i].isEmpty()) {
                newLine();
            } else {
                line(parts[i]);
            }
        }
        return this;
    }

    public CodeWriter newLine() {
        output.append("\n");
        atLineStart = true;
        return this;
    }

    /**
     * 追加空行（不产生连续空行）
     */
    public CodeWriter blankLine() {
        int length = output.length();
        if (length == 0 || (length >= 2 && output.charAt(length - 1) == '\n' && output.charAt(length - 2) == '\n')) {
            return this;
        }
        if (output.charAt(length - 1) != '\n') {
            output.append("\n");
        }
        output.append("\n");
        atLineStart = true;
        return this;
    }

    public boolean isEmpty() {
        return output.length() == 0;
    }

    public String getOutput() {
        return output.toString();
    }

    private String indentString() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indentLevel; i++) {
            sb.append(indentUnit);
        }
        return sb.toString();
    }
}
