package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.VariableType;
import com.verolang.compiler.ast.expr.Expression;

/**
 * TYPE name = e
 */
public class VariableDeclStmt extends Statement {
    private final VariableType varType;
    private final String name;
    private final Expression value;

    public VariableDeclStmt(SourceLocation location, VariableType varType, String name, Expression value) {
        super(location);
        this.varType = varType;
        this.name = name;
        this.value = value;
    }

    public VariableType getVarType() {
        return varType;
    }

    public String getName() {
        return name;
    }

    public Expression getValue() {
        return value;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitVariableDecl(this, context);
    }
}
