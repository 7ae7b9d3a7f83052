package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

/**
 * SCROLL UP / SCROLL DOWN / SCROLL TO t
 */
public class ScrollStmt extends Statement {

    public enum Direction { UP, DOWN, TO }

    private final Direction direction;
    private final Target target;

    public ScrollStmt(SourceLocation location, Direction direction, Target target) {
        super(location);
        this.direction = direction;
        this.target = target;
    }

    public Direction getDirection() {
        return direction;
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitScroll(this, context);
    }
}
