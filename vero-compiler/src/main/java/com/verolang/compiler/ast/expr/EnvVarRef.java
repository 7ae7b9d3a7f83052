package com.verolang.compiler.ast.expr;

import com.verolang.compiler.ast.SourceLocation;

/**
 * 环境变量引用 {{name}}
 */
public class EnvVarRef extends Expression {
    private final String name;

    public EnvVarRef(SourceLocation location, String name) {
        super(location);
        this.name = name;
    }

    public String getName() {
        return name;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitEnvVar(this);
    }
}
