package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * WAIT FOR NETWORK IDLE
 */
public class WaitForNetworkIdleStmt extends Statement {
    public WaitForNetworkIdleStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitWaitForNetworkIdle(this, context);
    }
}
