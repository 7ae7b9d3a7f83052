package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * LOG e
 */
public class LogStmt extends Statement {
    private final Expression message;

    public LogStmt(SourceLocation location, Expression message) {
        super(location);
        this.message = message;
    }

    public Expression getMessage() {
        return message;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitLog(this, context);
    }
}
