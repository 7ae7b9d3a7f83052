package com.verolang.compiler.ast.expr;

import com.verolang.compiler.ast.SourceLocation;

/**
 * 字符串字面量（值中可以包含 {{name}} 占位符）
 */
public class StringLiteral extends Expression {
    private final String value;

    public StringLiteral(SourceLocation location, String value) {
        super(location);
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitString(this);
    }
}
