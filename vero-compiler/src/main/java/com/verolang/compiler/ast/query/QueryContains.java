package com.verolang.compiler.ast.query;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * column CONTAINS value
 */
public class QueryContains extends QueryCondition {
    private final String column;
    private final Expression value;

    public QueryContains(SourceLocation location, String column, Expression value) {
        super(location);
        this.column = column;
        this.value = value;
    }

    public String getColumnName() { return column; }
    public Expression getValue() { return value; }
}
