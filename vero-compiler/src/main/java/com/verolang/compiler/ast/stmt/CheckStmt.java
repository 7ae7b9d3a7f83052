package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * CHECK t / UNCHECK t
 */
public class CheckStmt extends Statement {
    private final Target target;
    private final boolean checked;

    public CheckStmt(SourceLocation location, Target target, boolean checked) {
        super(location);
        this.target = target;
        this.checked = checked;
    }

    public Target getTarget() {
        return target;
    }

    public boolean isChecked() {
        return checked;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitCheck(this, context);
    }
}
