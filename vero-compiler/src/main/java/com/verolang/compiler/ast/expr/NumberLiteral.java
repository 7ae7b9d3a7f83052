package com.verolang.compiler.ast.expr;

import com.verolang.compiler.ast.SourceLocation;

/**
 * 数字字面量
 */
public class NumberLiteral extends Expression {
    private final double value;

    public NumberLiteral(SourceLocation location, double value) {
        super(location);
        this.value = value;
    }

    public double getValue() {
        return value;
    }

    public boolean isInteger() {
        return value == Math.rint(value) && !Double.isInfinite(value);
    }

    /** 整数不带小数点输出 */
    public String format() {
        if (isInteger()) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitNumber(this);
    }
}
