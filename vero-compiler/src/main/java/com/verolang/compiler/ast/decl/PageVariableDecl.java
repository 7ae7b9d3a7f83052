package com.verolang.compiler.ast.decl;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.VariableType;
import com.verolang.compiler.ast.expr.Expression;

/**
 * 页面变量：TEXT|NUMBER|FLAG|LIST name = literal
 */
public class PageVariableDecl extends AstNode {
    private final VariableType varType;
    private final String name;
    private final Expression value;

    public PageVariableDecl(SourceLocation location, VariableType varType, String name, Expression value) {
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
}
