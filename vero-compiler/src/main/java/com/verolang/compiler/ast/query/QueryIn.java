package com.verolang.compiler.ast.query;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * column IN [a, b]
 */
public class QueryIn extends QueryCondition {
    private final String column;
    private final List<Expression> values;

    public QueryIn(SourceLocation location, String column, List<Expression> values) {
        super(location);
        this.column = column;
        this.values = Collections.unmodifiableList(new ArrayList<Expression>(values));
    }

    public String getColumnName() { return column; }
    public List<Expression> getValues() { return values; }
}
