package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * TRY { } CATCH { }
 */
public class TryCatchStmt extends Statement {
    private final List<Statement> tryBody;
    private final List<Statement> catchBody;

    public TryCatchStmt(SourceLocation location, List<Statement> tryBody, List<Statement> catchBody) {
        super(location);
        this.tryBody = tryBody == null ? Collections.<Statement>emptyList()
                : Collections.unmodifiableList(new ArrayList<Statement>(tryBody));
        this.catchBody = catchBody == null ? Collections.<Statement>emptyList()
                : Collections.unmodifiableList(new ArrayList<Statement>(catchBody));
    }

    public List<Statement> getTryBody() {
        return tryBody;
    }

    public List<Statement> getCatchBody() {
        return catchBody;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitTryCatch(this, context);
    }
}
