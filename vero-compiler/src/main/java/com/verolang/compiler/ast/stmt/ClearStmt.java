package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * CLEAR t
 */
public class ClearStmt extends Statement {
    private final Target target;

    public ClearStmt(SourceLocation location, Target target) {
        super(location);
        this.target = target;
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitClear(this, context);
    }
}
