package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;
import com.verolang.compiler.ast.expr.VariableRef;

/**
 * VERIFY var EQUALS e
 */
public class VerifyEqualsStmt extends Statement {
    private final VariableRef variable;
    private final Expression expected;

    public VerifyEqualsStmt(SourceLocation location, VariableRef variable, Expression expected) {
        super(location);
        this.variable = variable;
        this.expected = expected;
    }

    public VariableRef getVariable() {
        return variable;
    }

    public Expression getExpected() {
        return expected;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVerifyEquals(this, context);
    }
}
