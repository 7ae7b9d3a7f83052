package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * WAIT FOR NAVIGATION
 */
public class WaitForNavigationStmt extends Statement {
    public WaitForNavigationStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitWaitForNavigation(this, context);
    }
}
