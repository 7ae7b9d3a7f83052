package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.VariableRef;

/**
 * VERIFY var IS [NOT] TRUE|FALSE
 */
public class VerifyFlagStmt extends Statement {
    private final VariableRef variable;
    private final boolean expected;

    public VerifyFlagStmt(SourceLocation location, VariableRef variable, boolean expected) {
        super(location);
        this.variable = variable;
        this.expected = expected;
    }

    public VariableRef getVariable() {
        return variable;
    }

    public boolean isExpected() {
        return expected;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVerifyFlag(this, context);
    }
}
