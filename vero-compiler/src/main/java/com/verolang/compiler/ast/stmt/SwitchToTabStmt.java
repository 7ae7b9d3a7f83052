package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * SWITCH TO TAB e（从 1 开始）
 */
public class SwitchToTabStmt extends Statement {
    private final Expression index;

    public SwitchToTabStmt(SourceLocation location, Expression index) {
        super(location);
        this.index = index;
    }

    public Expression getIndex() {
        return index;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchToTab(this, context);
    }
}
