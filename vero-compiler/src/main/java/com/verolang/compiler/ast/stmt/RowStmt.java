package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.query.OrderBy;
import com.verolang.compiler.ast.query.QueryCondition;
import com.verolang.compiler.ast.query.RowPosition;
import com.verolang.compiler.ast.query.TableRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ROW var = [FIRST|LAST|RANDOM] Table [WHERE ...] [ORDER BY ...]
 */
public class RowStmt extends Statement {
    private final String variable;
    private final RowPosition position;
    private final TableRef table;
    private final QueryCondition where;
    private final List<OrderBy> orderBy;

    public RowStmt(SourceLocation location, String variable, RowPosition position, TableRef table, QueryCondition where, List<OrderBy> orderBy) {
        super(location);
        this.variable = variable;
        this.position = position;
        this.table = table;
        this.where = where;
        this.orderBy = orderBy == null ? Collections.<OrderBy>emptyList()
                : Collections.unmodifiableList(new ArrayList<OrderBy>(orderBy));
    }

    public String getVariable() {
        return variable;
    }

    public RowPosition getPosition() {
        return position;
    }

    public TableRef getTable() {
        return table;
    }

    public QueryCondition getWhere() {
        return where;
    }

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitRow(this, context);
    }
}
