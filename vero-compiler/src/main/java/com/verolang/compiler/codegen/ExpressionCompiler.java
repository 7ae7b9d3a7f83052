package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.expr.BooleanLiteral;
import com.verolang.compiler.ast.expr.EnvVarRef;
import com.verolang.compiler.ast.expr.Expression;
import com.verolang.compiler.ast.expr.ExpressionVisitor;
import com.verolang.compiler.ast.expr.ListLiteral;
import com.verolang.compiler.ast.expr.NumberLiteral;
import com.verolang.compiler.ast.expr.StringLiteral;
import com.verolang.compiler.ast.expr.VariableRef;

/**
 * 表达式 → TypeScript 表达式
 */
final class ExpressionCompiler implements ExpressionVisitor<String> {

    private final GenContext ctx;

    ExpressionCompiler(GenContext ctx) {
        this.ctx = ctx;
    }

    static String compile(GenContext ctx, Expression expression) {
        return expression.accept(new ExpressionCompiler(ctx));
    }

    /**
     * 需要字符串参数的位置（fill、selectOption 等）
     */
    static String compileText(GenContext ctx, Expression expression) {
        String code = compile(ctx, expression);
        if (expression instanceof StringLiteral || expression instanceof EnvVarRef) {
            return code;
        }
        return "String(" + code + ")";
    }

    @Override
    public String visitString(StringLiteral expr) {
        if (TsSyntax.hasPlaceholders(expr.getValue())) {
            ctx.unit.usesEnv = true;
            return TsSyntax.stringWithPlaceholders(expr.getValue());
        }
        return TsSyntax.quote(expr.getValue());
    }

    @Override
    public String visitNumber(NumberLiteral expr) {
        return expr.format();
    }

    @Override
    public String visitBoolean(BooleanLiteral expr) {
        return String.valueOf(expr.getValue());
    }

    @Override
    public String visitList(ListLiteral expr) {
        StringBuilder sb = new StringBuilder("[");
        for (int i = 0; i < expr.getElements().size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(expr.getElements().get(i).accept(this));
        }
        return sb.append(']').toString();
    }

    @Override
    public String visitVariable(VariableRef expr) {
        return NameResolver.variable(ctx, expr);
    }

    @Override
    public String visitEnvVar(EnvVarRef expr) {
        ctx.unit.usesEnv = true;
        return TsSyntax.envLookup(expr.getName());
    }
}
