package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.TextMatch;
import com.verolang.compiler.ast.expr.Expression;

/**
 * VERIFY TITLE CONTAINS|IS e
 */
public class VerifyTitleStmt extends Statement {
    private final TextMatch match;
    private final Expression value;

    public VerifyTitleStmt(SourceLocation location, TextMatch match, Expression value) {
        super(location);
        this.match = match;
        this.value = value;
    }

    public TextMatch getMatch() {
        return match;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVerifyTitle(this, context);
    }
}
