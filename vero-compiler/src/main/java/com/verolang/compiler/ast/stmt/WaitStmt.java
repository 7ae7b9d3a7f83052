package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * WAIT n [SECONDS|MILLISECONDS]
 */
public class WaitStmt extends Statement {
    private final Expression duration;
    private final boolean milliseconds;

    public WaitStmt(SourceLocation location, Expression duration, boolean milliseconds) {
        super(location);
        this.duration = duration;
        this.milliseconds = milliseconds;
    }

    public Expression getDuration() {
        return duration;
    }

    public boolean isMilliseconds() {
        return milliseconds;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitWait(this, context);
    }
}
