package com.verolang.compiler.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 校验结果
 */
public final class ValidationResult {
    private final List<SemanticDiagnostic> diagnostics;

    public ValidationResult(List<SemanticDiagnostic> diagnostics) {
        this.diagnostics = Collections.unmodifiableList(new ArrayList<SemanticDiagnostic>(diagnostics));
    }

    public List<SemanticDiagnostic> getDiagnostics() {
        return diagnostics;
    }

    public List<SemanticDiagnostic> getErrors() {
        return filter(SemanticDiagnostic.Severity.ERROR);
    }

    public List<SemanticDiagnostic> getWarnings() {
        return filter(SemanticDiagnostic.Severity.WARNING);
    }

    public boolean hasErrors() {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.isError()) return true;
        }
        return false;
    }

    /** 是否存在指定代码的诊断 */
    public boolean hasCode(String code) {
        for (SemanticDiagnostic d : diagnostics) {
            if (d.getCode().equals(code)) return true;
        }
        return false;
    }

    private List<SemanticDiagnostic> filter(SemanticDiagnostic.Severity severity) {
        List<SemanticDiagnostic> result = new ArrayList<SemanticDiagnostic>();
        for (SemanticDiagnostic d : diagnostics) {
            if (d.getSeverity() == severity) result.add(d);
        }
        return result;
    }
}
