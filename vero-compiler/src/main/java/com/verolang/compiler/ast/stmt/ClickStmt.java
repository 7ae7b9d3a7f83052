package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * CLICK / RIGHT CLICK / DOUBLE CLICK / FORCE CLICK t
 */
public class ClickStmt extends Statement {

    public enum ClickType { NORMAL, RIGHT, DOUBLE, FORCE }

    private final Target target;
    private final ClickType clickType;

    public ClickStmt(SourceLocation location, Target target, ClickType clickType) {
        super(location);
        this.target = target;
        this.clickType = clickType;
    }

    public Target getTarget() {
        return target;
    }

    public ClickType getClickType() {
        return clickType;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitClick(this, context);
    }
}
