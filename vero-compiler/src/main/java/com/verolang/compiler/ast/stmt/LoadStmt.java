package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.query.QueryCondition;

/**
 * LOAD var FROM "table" [WHERE cond]
 */
public class LoadStmt extends Statement {
    private final String variable;
    private final String table;
    private final QueryCondition where;

    public LoadStmt(SourceLocation location, String variable, String table, QueryCondition where) {
        super(location);
        this.variable = variable;
        this.table = table;
        this.where = where;
    }

    public String getVariable() {
        return variable;
    }

    public String getTable() {
        return table;
    }

    public QueryCondition getWhere() {
        return where;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitLoad(this, context);
    }
}
