package com.verolang.compiler.ast.cond;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * e CONTAINS e
 */
public class ContainsCondition extends Condition {
    private final Expression subject;
    private final Expression value;

    public ContainsCondition(SourceLocation location, Expression subject, Expression value) {
        super(location);
        this.subject = subject;
        this.value = value;
    }

    public Expression getSubject() { return subject; }
    public Expression getValue() { return value; }
}
