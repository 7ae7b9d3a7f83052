package com.verolang.compiler.ast.expr;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

/**
 * 表达式基类
 */
public abstract class Expression extends AstNode {

    protected Expression(SourceLocation location) {
        super(location);
    }

    public abstract <R> R accept(ExpressionVisitor<R> visitor);
}
