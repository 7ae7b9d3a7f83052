package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.selector.Selector;

/**
 * SWITCH TO FRAME selector
 */
public class SwitchToFrameStmt extends Statement {
    private final Selector selector;

    public SwitchToFrameStmt(SourceLocation location, Selector selector) {
        super(location);
        this.selector = selector;
    }

    public Selector getSelector() {
        return selector;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitSwitchToFrame(this, context);
    }
}
