package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * CLOSE TAB
 */
public class CloseTabStmt extends Statement {
    public CloseTabStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitCloseTab(this, context);
    }
}
