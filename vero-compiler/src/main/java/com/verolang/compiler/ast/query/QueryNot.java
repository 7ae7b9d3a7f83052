package com.verolang.compiler.ast.query;

import com.verolang.compiler.ast.SourceLocation;

/**
 * NOT cond
 */
public class QueryNot extends QueryCondition {
    private final QueryCondition operand;

    public QueryNot(SourceLocation location, QueryCondition operand) {
        super(location);
        this.operand = operand;
    }

    public QueryCondition getOperand() { return operand; }
}
