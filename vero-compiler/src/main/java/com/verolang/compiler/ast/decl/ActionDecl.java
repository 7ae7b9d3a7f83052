package com.verolang.compiler.ast.decl;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.VariableType;
import com.verolang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PageActions 中的动作定义：name [WITH p1, p2] [RETURNS type] { ... }
 */
public class ActionDecl extends AstNode {
    private final String name;
    private final List<String> parameters;
    private final VariableType returnType;
    private final List<Statement> statements;

    public ActionDecl(SourceLocation location, String name, List<String> parameters,
                      VariableType returnType, List<Statement> statements) {
        super(location);
        this.name = name;
        this.parameters = Collections.unmodifiableList(new ArrayList<String>(parameters));
        this.returnType = returnType;
        this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
    }

    public String getName() {
        return name;
    }

    public List<String> getParameters() {
        return parameters;
    }

    public int getArity() {
        return parameters.size();
    }

    /** 返回类型，未声明时为 null */
    public VariableType getReturnType() {
        return returnType;
    }

    public List<Statement> getStatements() {
        return statements;
    }
}
