package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * ACCEPT DIALOG [WITH e]
 */
public class AcceptDialogStmt extends Statement {
    private final Expression promptText;

    public AcceptDialogStmt(SourceLocation location, Expression promptText) {
        super(location);
        this.promptText = promptText;
    }

    public Expression getPromptText() {
        return promptText;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitAcceptDialog(this, context);
    }
}
