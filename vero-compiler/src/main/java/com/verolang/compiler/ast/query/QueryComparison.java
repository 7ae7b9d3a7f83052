package com.verolang.compiler.ast.query;

import com.verolang.compiler.ast.ComparisonOperator;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * column op value
 */
public class QueryComparison extends QueryCondition {
    private final String column;
    private final ComparisonOperator operator;
    private final Expression value;

    public QueryComparison(SourceLocation location, String column, ComparisonOperator operator, Expression value) {
        super(location);
        this.column = column;
        this.operator = operator;
        this.value = value;
    }

    public String getColumnName() { return column; }
    public ComparisonOperator getOperator() { return operator; }
    public Expression getValue() { return value; }
}
