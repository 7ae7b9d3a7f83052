package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.TextMatch;
import com.verolang.compiler.ast.expr.Expression;

/**
 * WAIT FOR URL CONTAINS|IS e
 */
public class WaitForUrlStmt extends Statement {
    private final TextMatch match;
    private final Expression value;

    public WaitForUrlStmt(SourceLocation location, TextMatch match, Expression value) {
        super(location);
        this.match = match;
        this.value = value;
    }

    public TextMatch getMatch() {
        return match;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitWaitForUrl(this, context);
    }
}
