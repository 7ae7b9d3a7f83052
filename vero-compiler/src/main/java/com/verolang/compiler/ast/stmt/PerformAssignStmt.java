package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.VariableType;

/**
 * TYPE name = PERFORM ...
 */
public class PerformAssignStmt extends Statement {
    private final VariableType varType;
    private final String name;
    private final PerformStmt call;

    public PerformAssignStmt(SourceLocation location, VariableType varType, String name, PerformStmt call) {
        super(location);
        this.varType = varType;
        this.name = name;
        this.call = call;
    }

    public VariableType getVarType() {
        return varType;
    }

    public String getName() {
        return name;
    }

    public PerformStmt getCall() {
        return call;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitPerformAssign(this, context);
    }
}
