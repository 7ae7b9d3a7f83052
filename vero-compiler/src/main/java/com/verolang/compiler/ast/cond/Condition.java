package com.verolang.compiler.ast.cond;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

/**
 * IF 条件基类
 */
public abstract class Condition extends AstNode {

    protected Condition(SourceLocation location) {
        super(location);
    }
}
