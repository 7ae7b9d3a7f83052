package com.verolang.compiler.ast.cond;

import com.verolang.compiler.ast.ComparisonOperator;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * e op e
 */
public class ComparisonCondition extends Condition {
    private final Expression left;
    private final ComparisonOperator operator;
    private final Expression right;

    public ComparisonCondition(SourceLocation location, Expression left,
                               ComparisonOperator operator, Expression right) {
        super(location);
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public Expression getLeft() { return left; }
    public ComparisonOperator getOperator() { return operator; }
    public Expression getRight() { return right; }
}
