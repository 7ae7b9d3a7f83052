package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * DRAG t TO t
 */
public class DragStmt extends Statement {
    private final Target source;
    private final Target destination;

    public DragStmt(SourceLocation location, Target source, Target destination) {
        super(location);
        this.source = source;
        this.destination = destination;
    }

    public Target getSource() {
        return source;
    }

    public Target getDestination() {
        return destination;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitDrag(this, context);
    }
}
