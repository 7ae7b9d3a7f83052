package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * RETURN [VISIBLE|TEXT|VALUE OF t | e]
 */
public class ReturnStmt extends Statement {

    public enum ReturnKind { NONE, EXPRESSION, VISIBLE, TEXT, VALUE }

    private final ReturnKind kind;
    private final Expression value;
    private final Target target;

    public ReturnStmt(SourceLocation location, ReturnKind kind, Expression value, Target target) {
        super(location);
        this.kind = kind;
        this.value = value;
        this.target = target;
    }

    public ReturnKind getKind() {
        return kind;
    }

    public Expression getValue() {
        return value;
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitReturn(this, context);
    }
}
