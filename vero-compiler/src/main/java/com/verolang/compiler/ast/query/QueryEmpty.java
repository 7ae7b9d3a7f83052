package com.verolang.compiler.ast.query;

import com.verolang.compiler.ast.SourceLocation;

/**
 * column IS [NOT] EMPTY
 */
public class QueryEmpty extends QueryCondition {
    private final String column;
    private final boolean negated;

    public QueryEmpty(SourceLocation location, String column, boolean negated) {
        super(location);
        this.column = column;
        this.negated = negated;
    }

    public String getColumnName() { return column; }
    public boolean isNegated() { return negated; }
}
