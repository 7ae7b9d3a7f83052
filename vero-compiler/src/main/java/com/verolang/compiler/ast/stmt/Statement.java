package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

/**
 * 语句基类（封闭集合，所有子类都在本包中）
 */
public abstract class Statement extends AstNode {

    protected Statement(SourceLocation location) {
        super(location);
    }

    public abstract <R, C> R accept(StatementVisitor<R, C> visitor, C context);
}
