package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * REPEAT e TIMES { }
 */
public class RepeatStmt extends Statement {
    private final Expression times;
    private final List<Statement> body;

    public RepeatStmt(SourceLocation location, Expression times, List<Statement> body) {
        super(location);
        this.times = times;
        this.body = body == null ? Collections.<Statement>emptyList()
                : Collections.unmodifiableList(new ArrayList<Statement>(body));
    }

    public Expression getTimes() {
        return times;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitRepeat(this, context);
    }
}
