package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * VERIFY SCREENSHOT [AS "n"] [opts] / VERIFY t MATCHES SCREENSHOT [AS "n"] [opts]
 */
public class VerifyScreenshotStmt extends Statement {
    private final Target target;
    private final String name;
    private final ScreenshotSettings settings;

    public VerifyScreenshotStmt(SourceLocation location, Target target, String name, ScreenshotSettings settings) {
        super(location);
        this.target = target;
        this.name = name;
        this.settings = settings;
    }

    public Target getTarget() {
        return target;
    }

    public String getName() {
        return name;
    }

    public ScreenshotSettings getSettings() {
        return settings;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVerifyScreenshot(this, context);
    }
}
