package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * SET COOKIE e TO e
 */
public class SetCookieStmt extends Statement {
    private final Expression name;
    private final Expression value;

    public SetCookieStmt(SourceLocation location, Expression name, Expression value) {
        super(location);
        this.name = name;
        this.value = value;
    }

    public Expression getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitSetCookie(this, context);
    }
}
