package com.verolang.compiler.ast.cond;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.VariableRef;

/**
 * 单独的变量作为条件
 */
public class TruthCondition extends Condition {
    private final VariableRef variable;

    public TruthCondition(SourceLocation location, VariableRef variable) {
        super(location);
        this.variable = variable;
    }

    public VariableRef getVariable() { return variable; }
}
