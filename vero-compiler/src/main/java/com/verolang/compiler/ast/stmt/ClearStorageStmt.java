package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * CLEAR STORAGE
 */
public class ClearStorageStmt extends Statement {
    public ClearStorageStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitClearStorage(this, context);
    }
}
