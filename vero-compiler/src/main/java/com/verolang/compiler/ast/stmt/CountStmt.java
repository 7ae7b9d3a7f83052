package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.query.QueryCondition;
import com.verolang.compiler.ast.query.TableRef;

/**
 * COUNT var = Table [WHERE ...] / NUMBER var = COUNT Table
 */
public class CountStmt extends Statement {
    private final String variable;
    private final TableRef table;
    private final QueryCondition where;

    public CountStmt(SourceLocation location, String variable, TableRef table, QueryCondition where) {
        super(location);
        this.variable = variable;
        this.table = table;
        this.where = where;
    }

    public String getVariable() {
        return variable;
    }

    public TableRef getTable() {
        return table;
    }

    public QueryCondition getWhere() {
        return where;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitCount(this, context);
    }
}
