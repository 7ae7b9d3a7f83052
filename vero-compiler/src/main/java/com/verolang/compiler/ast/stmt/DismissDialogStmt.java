package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * DISMISS DIALOG
 */
public class DismissDialogStmt extends Statement {
    public DismissDialogStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitDismissDialog(this, context);
    }
}
