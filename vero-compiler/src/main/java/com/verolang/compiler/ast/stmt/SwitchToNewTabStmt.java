package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * SWITCH TO NEW TAB [e]
 */
public class SwitchToNewTabStmt extends Statement {
    private final Expression url;

    public SwitchToNewTabStmt(SourceLocation location, Expression url) {
        super(location);
        this.url = url;
    }

    public Expression getUrl() {
        return url;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchToNewTab(this, context);
    }
}
