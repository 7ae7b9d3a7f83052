package com.verolang.compiler.ast.expr;

import com.verolang.compiler.ast.SourceLocation;

/**
 * 变量引用：name 或 Page.name
 */
public class VariableRef extends Expression {
    private final String pageName;
    private final String name;

    public VariableRef(SourceLocation location, String pageName, String name) {
        super(location);
        this.pageName = pageName;
        this.name = name;
    }

    /** 限定的页面名，可能为 null */
    public String getPageName() {
        return pageName;
    }

    public String getName() {
        return name;
    }

    public boolean isQualified() {
        return pageName != null;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitVariable(this);
    }

    @Override
    public String toString() {
        return pageName != null ? pageName + "." + name : name;
    }
}
