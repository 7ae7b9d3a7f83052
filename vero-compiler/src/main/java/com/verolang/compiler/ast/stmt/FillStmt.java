package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * FILL t WITH e
 */
public class FillStmt extends Statement {
    private final Target target;
    private final Expression value;

    public FillStmt(SourceLocation location, Target target, Expression value) {
        super(location);
        this.target = target;
        this.value = value;
    }

    public Target getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitFill(this, context);
    }
}
