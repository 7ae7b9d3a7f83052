package com.verolang.compiler.ast.query;

import com.verolang.compiler.ast.SourceLocation;

/**
 * cond AND cond / cond OR cond
 */
public class QueryLogical extends QueryCondition {

    public enum Kind { AND, OR }

    private final Kind kind;
    private final QueryCondition left;
    private final QueryCondition right;

    public QueryLogical(SourceLocation location, Kind kind, QueryCondition left, QueryCondition right) {
        super(location);
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    public Kind getKind() { return kind; }
    public QueryCondition getLeft() { return left; }
    public QueryCondition getRight() { return right; }
}
