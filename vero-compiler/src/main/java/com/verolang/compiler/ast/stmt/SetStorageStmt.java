package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * SET STORAGE e TO e
 */
public class SetStorageStmt extends Statement {
    private final Expression key;
    private final Expression value;

    public SetStorageStmt(SourceLocation location, Expression key, Expression value) {
        super(location);
        this.key = key;
        this.value = value;
    }

    public Expression getKey() {
        return key;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitSetStorage(this, context);
    }
}
