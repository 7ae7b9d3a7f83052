package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * PERFORM [Block.]action [WITH e[, e]*]
 */
public class PerformStmt extends Statement {
    private final String blockName;
    private final String actionName;
    private final List<Expression> arguments;

    public PerformStmt(SourceLocation location, String blockName, String actionName, List<Expression> arguments) {
        super(location);
        this.blockName = blockName;
        this.actionName = actionName;
        this.arguments = arguments == null ? Collections.<Expression>emptyList()
                : Collections.unmodifiableList(new ArrayList<Expression>(arguments));
    }

    public String getBlockName() {
        return blockName;
    }

    public String getActionName() {
        return actionName;
    }

    public List<Expression> getArguments() {
        return arguments;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitPerform(this, context);
    }
}
