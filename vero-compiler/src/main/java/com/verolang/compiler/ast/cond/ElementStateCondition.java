package com.verolang.compiler.ast.cond;

import com.verolang.compiler.ast.ElementState;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.stmt.Target;

/**
 * t IS [NOT] state
 */
public class ElementStateCondition extends Condition {
    private final Target target;
    private final ElementState state;
    private final boolean negated;

    public ElementStateCondition(SourceLocation location, Target target, ElementState state, boolean negated) {
        super(location);
        this.target = target;
        this.state = state;
        this.negated = negated;
    }

    public Target getTarget() { return target; }
    public ElementState getState() { return state; }
    public boolean isNegated() { return negated; }
}
