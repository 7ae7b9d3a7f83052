package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * VERIFY t HAS COUNT|VALUE|TEXT|CLASS e
 */
public class VerifyPropertyStmt extends Statement {

    public enum Property { COUNT, VALUE, TEXT, CLASS }

    private final Target target;
    private final Property property;
    private final Expression value;

    public VerifyPropertyStmt(SourceLocation location, Target target, Property property, Expression value) {
        super(location);
        this.target = target;
        this.property = property;
        this.value = value;
    }

    public Target getTarget() {
        return target;
    }

    public Property getProperty() {
        return property;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVerifyProperty(this, context);
    }
}
