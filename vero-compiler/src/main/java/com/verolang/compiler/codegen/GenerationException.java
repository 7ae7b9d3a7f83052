package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.SourceLocation;

/**
 * 代码生成错误（如重载元数冲突、PERFORM 元数无匹配）
 */
public class GenerationException extends RuntimeException {
    private final int line;
    private final int column;

    public GenerationException(String message, SourceLocation location) {
        super(message);
        this.line = location.getLine();
        this.column = location.getColumn();
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " at line " + line + ", column " + column;
    }
}
