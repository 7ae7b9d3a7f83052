package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * SELECT e FROM t
 */
public class SelectStmt extends Statement {
    private final Expression option;
    private final Target target;

    public SelectStmt(SourceLocation location, Expression option, Target target) {
        super(location);
        this.option = option;
        this.target = target;
    }

    public Expression getOption() {
        return option;
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitSelect(this, context);
    }
}
