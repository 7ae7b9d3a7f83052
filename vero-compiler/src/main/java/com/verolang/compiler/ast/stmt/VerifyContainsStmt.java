package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * VERIFY t [NOT] CONTAINS e
 */
public class VerifyContainsStmt extends Statement {
    private final Target target;
    private final Expression value;
    private final boolean negated;

    public VerifyContainsStmt(SourceLocation location, Target target, Expression value, boolean negated) {
        super(location);
        this.target = target;
        this.value = value;
        this.negated = negated;
    }

    public Target getTarget() {
        return target;
    }

    public Expression getValue() {
        return value;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVerifyContains(this, context);
    }
}
