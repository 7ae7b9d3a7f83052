package com.verolang.compiler.ast.decl;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PAGE 声明：字段（定位器）和页面变量
 */
public class PageDecl extends AstNode {
    private final String name;
    private final List<FieldDecl> fields;
    private final List<PageVariableDecl> variables;

    public PageDecl(SourceLocation location, String name, List<FieldDecl> fields, List<PageVariableDecl> variables) {
        super(location);
        this.name = name;
        this.fields = Collections.unmodifiableList(new ArrayList<FieldDecl>(fields));
        this.variables = Collections.unmodifiableList(new ArrayList<PageVariableDecl>(variables));
    }

    public String getName() {
        return name;
    }

    public List<FieldDecl> getFields() {
        return fields;
    }

    public List<PageVariableDecl> getVariables() {
        return variables;
    }

    public FieldDecl findField(String fieldName) {
        for (FieldDecl field : fields) {
            if (field.getName().equals(fieldName)) return field;
        }
        return null;
    }

    public PageVariableDecl findVariable(String variableName) {
        for (PageVariableDecl variable : variables) {
            if (variable.getName().equals(variableName)) return variable;
        }
        return null;
    }

    /** 字段或页面变量中是否存在该成员 */
    public boolean hasMember(String memberName) {
        return findField(memberName) != null || findVariable(memberName) != null;
    }
}
