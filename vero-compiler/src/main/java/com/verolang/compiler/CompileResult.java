package com.verolang.compiler;

import com.verolang.compiler.analysis.SemanticDiagnostic;
import com.verolang.compiler.analysis.ValidationResult;
import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.codegen.TranspileResult;
import com.verolang.compiler.lexer.LexError;
import com.verolang.compiler.parser.ParseError;
import com.verolang.compiler.selection.SelectionDiagnostics;

import java.util.ArrayList;
import java.util.List;

/**
 * 完整编译流程的结果
 */
public final class CompileResult {
    private final List<LexError> lexErrors;
    private final List<ParseError> parseErrors;
    private final ValidationResult validation;
    private final Program program;
    private final SelectionDiagnostics selection;
    private final TranspileResult output;

    CompileResult(List<LexError> lexErrors, List<ParseError> parseErrors, ValidationResult validation,
                  Program program, SelectionDiagnostics selection, TranspileResult output) {
        this.lexErrors = lexErrors;
        this.parseErrors = parseErrors;
        this.validation = validation;
        this.program = program;
        this.selection = selection;
        this.output = output;
    }

    public List<LexError> getLexErrors() {
        return lexErrors;
    }

    public List<ParseError> getParseErrors() {
        return parseErrors;
    }

    public ValidationResult getValidation() {
        return validation;
    }

    /** 经过场景筛选后的 AST */
    public Program getProgram() {
        return program;
    }

    public SelectionDiagnostics getSelection() {
        return selection;
    }

    public TranspileResult getOutput() {
        return output;
    }

    public boolean hasErrors() {
        return !lexErrors.isEmpty() || !parseErrors.isEmpty() || validation.hasErrors();
    }

    /**
     * 所有错误（不含警告），按阶段排列
     */
    public List<String> getErrorMessages() {
        return VeroCompiler.describeErrors(lexErrors, parseErrors, validation);
    }

    public List<SemanticDiagnostic> getWarnings() {
        return new ArrayList<SemanticDiagnostic>(validation.getWarnings());
    }
}
