package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * SWITCH TO MAIN FRAME
 */
public class SwitchToMainFrameStmt extends Statement {
    public SwitchToMainFrameStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchToMainFrame(this, context);
    }
}
