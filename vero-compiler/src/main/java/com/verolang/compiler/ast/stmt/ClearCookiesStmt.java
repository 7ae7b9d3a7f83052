package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * CLEAR COOKIES
 */
public class ClearCookiesStmt extends Statement {
    public ClearCookiesStmt(SourceLocation location) {
        super(location);
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitClearCookies(this, context);
    }
}
