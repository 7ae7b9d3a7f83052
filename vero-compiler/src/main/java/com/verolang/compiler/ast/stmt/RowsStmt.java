package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.query.OrderBy;
import com.verolang.compiler.ast.query.QueryCondition;
import com.verolang.compiler.ast.query.TableRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * ROWS var = Table [WHERE ...] [ORDER BY ...] [LIMIT n] [OFFSET n]
 */
public class RowsStmt extends Statement {
    private final String variable;
    private final TableRef table;
    private final QueryCondition where;
    private final List<OrderBy> orderBy;
    private final Integer limit;
    private final Integer offset;

    public RowsStmt(SourceLocation location, String variable, TableRef table, QueryCondition where, List<OrderBy> orderBy, Integer limit, Integer offset) {
        super(location);
        this.variable = variable;
        this.table = table;
        this.where = where;
        this.orderBy = orderBy == null ? Collections.<OrderBy>emptyList()
                : Collections.unmodifiableList(new ArrayList<OrderBy>(orderBy));
        this.limit = limit;
        this.offset = offset;
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

    public List<OrderBy> getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitRows(this, context);
    }
}
