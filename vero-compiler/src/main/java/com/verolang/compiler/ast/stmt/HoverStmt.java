package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * HOVER t
 */
public class HoverStmt extends Statement {
    private final Target target;

    public HoverStmt(SourceLocation location, Target target) {
        super(location);
        this.target = target;
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitHover(this, context);
    }
}
