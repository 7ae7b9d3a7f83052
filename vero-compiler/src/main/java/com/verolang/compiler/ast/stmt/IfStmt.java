package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.cond.Condition;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * IF cond { } [ELSE { }]，ELSE IF 表示为 else 分支中的单个 IfStmt
 */
public class IfStmt extends Statement {
    private final Condition condition;
    private final List<Statement> thenBranch;
    private final List<Statement> elseBranch;

    public IfStmt(SourceLocation location, Condition condition, List<Statement> thenBranch, List<Statement> elseBranch) {
        super(location);
        this.condition = condition;
        this.thenBranch = thenBranch == null ? Collections.<Statement>emptyList()
                : Collections.unmodifiableList(new ArrayList<Statement>(thenBranch));
        this.elseBranch = elseBranch == null ? Collections.<Statement>emptyList()
                : Collections.unmodifiableList(new ArrayList<Statement>(elseBranch));
    }

    public Condition getCondition() {
        return condition;
    }

    public List<Statement> getThenBranch() {
        return thenBranch;
    }

    public List<Statement> getElseBranch() {
        return elseBranch;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitIf(this, context);
    }
}
