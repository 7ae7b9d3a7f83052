package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * WAIT FOR t
 */
public class WaitForElementStmt extends Statement {
    private final Target target;

    public WaitForElementStmt(SourceLocation location, Target target) {
        super(location);
        this.target = target;
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitWaitForElement(this, context);
    }
}
