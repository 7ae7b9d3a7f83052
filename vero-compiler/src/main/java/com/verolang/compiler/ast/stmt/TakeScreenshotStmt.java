package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * TAKE SCREENSHOT [t] [AS "file"]
 */
public class TakeScreenshotStmt extends Statement {
    private final Target target;
    private final String fileName;

    public TakeScreenshotStmt(SourceLocation location, Target target, String fileName) {
        super(location);
        this.target = target;
        this.fileName = fileName;
    }

    public Target getTarget() {
        return target;
    }

    public String getFileName() {
        return fileName;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitTakeScreenshot(this, context);
    }
}
