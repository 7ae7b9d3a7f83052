package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * OPEN e
 */
public class OpenStmt extends Statement {
    private final Expression url;

    public OpenStmt(SourceLocation location, Expression url) {
        super(location);
        this.url = url;
    }

    public Expression getUrl() {
        return url;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitOpen(this, context);
    }
}
