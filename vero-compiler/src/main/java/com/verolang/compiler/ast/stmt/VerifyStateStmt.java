package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.ElementState;
import com.verolang.compiler.ast.SourceLocation;

/**
 * VERIFY t IS [NOT] state
 */
public class VerifyStateStmt extends Statement {
    private final Target target;
    private final ElementState state;
    private final boolean negated;

    public VerifyStateStmt(SourceLocation location, Target target, ElementState state, boolean negated) {
        super(location);
        this.target = target;
        this.state = state;
        this.negated = negated;
    }

    public Target getTarget() {
        return target;
    }

    public ElementState getState() {
        return state;
    }

    public boolean isNegated() {
        return negated;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVerifyState(this, context);
    }
}
