package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * VERIFY t HAS ATTRIBUTE e = e
 */
public class VerifyAttributeStmt extends Statement {
    private final Target target;
    private final Expression attribute;
    private final Expression value;

    public VerifyAttributeStmt(SourceLocation location, Target target, Expression attribute, Expression value) {
        super(location);
        this.target = target;
        this.attribute = attribute;
        this.value = value;
    }

    public Target getTarget() {
        return target;
    }

    public Expression getAttribute() {
        return attribute;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVerifyAttribute(this, context);
    }
}
