package com.verolang.compiler.ast.query;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

/**
 * WHERE 子句的数据条件
 */
public abstract class QueryCondition extends AstNode {

    protected QueryCondition(SourceLocation location) {
        super(location);
    }
}
