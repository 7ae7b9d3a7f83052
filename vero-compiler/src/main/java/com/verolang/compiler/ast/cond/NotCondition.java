package com.verolang.compiler.ast.cond;

import com.verolang.compiler.ast.SourceLocation;

/**
 * NOT cond
 */
public class NotCondition extends Condition {
    private final Condition operand;

    public NotCondition(SourceLocation location, Condition operand) {
        super(location);
        this.operand = operand;
    }

    public Condition getOperand() { return operand; }
}
