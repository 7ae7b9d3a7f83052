package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * PRESS e
 */
public class PressStmt extends Statement {
    private final Expression key;

    public PressStmt(SourceLocation location, Expression key) {
        super(location);
        this.key = key;
    }

    public Expression getKey() {
        return key;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitPress(this, context);
    }
}
