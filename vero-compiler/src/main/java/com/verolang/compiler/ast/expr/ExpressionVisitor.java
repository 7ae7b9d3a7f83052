package com.verolang.compiler.ast.expr;

/**
 * 表达式访问者
 */
public interface ExpressionVisitor<R> {
    R visitString(StringLiteral expr);
    R visitNumber(NumberLiteral expr);
    R visitBoolean(BooleanLiteral expr);
    R visitList(ListLiteral expr);
    R visitVariable(VariableRef expr);
    R visitEnvVar(EnvVarRef expr);
}
