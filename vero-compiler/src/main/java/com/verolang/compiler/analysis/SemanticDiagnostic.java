package com.verolang.compiler.analysis;

import com.verolang.compiler.ast.SourceLocation;

/**
 * 语义诊断条目
 */
public final class SemanticDiagnostic {

    public enum Severity {
        ERROR, WARNING
    }

    private final Severity severity;
    private final String code;
    private final String message;
    private final SourceLocation location;

    public SemanticDiagnostic(Severity severity, String code, String message, SourceLocation location) {
        this.severity = severity;
        this.code = code;
        this.message = message;
        this.location = location != null ? location : SourceLocation.UNKNOWN;
    }

    public Severity getSeverity() { return severity; }
    public String getCode() { return code; }
    public String getMessage() { return message; }
    public SourceLocation getLocation() { return location; }
    public int getLine() { return location.getLine(); }
    public int getColumn() { return location.getColumn(); }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + code + " at " + location + ": " + message;
    }
}
