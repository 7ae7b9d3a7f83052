package com.verolang.compiler.selection;

import com.verolang.compiler.ast.decl.Program;

/**
 * 筛选结果：裁剪后的程序与统计信息
 */
public final class SelectionResult {
    private final Program program;
    private final SelectionDiagnostics diagnostics;

    public SelectionResult(Program program, SelectionDiagnostics diagnostics) {
        this.program = program;
        this.diagnostics = diagnostics;
    }

    public Program getProgram() {
        return program;
    }

    public SelectionDiagnostics getDiagnostics() {
        return diagnostics;
    }
}
