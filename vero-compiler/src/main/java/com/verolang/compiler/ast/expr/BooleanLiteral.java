package com.verolang.compiler.ast.expr;

import com.verolang.compiler.ast.SourceLocation;

/**
 * 布尔字面量
 */
public class BooleanLiteral extends Expression {
    private final boolean value;

    public BooleanLiteral(SourceLocation location, boolean value) {
        super(location);
        this.value = value;
    }

    public boolean getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitBoolean(this);
    }
}
