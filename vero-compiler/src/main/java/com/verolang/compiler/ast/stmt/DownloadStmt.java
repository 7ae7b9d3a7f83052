package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

/**
 * DOWNLOAD FROM t [AS e]
 */
public class DownloadStmt extends Statement {
    private final Target target;
    private final Expression saveAs;

    public DownloadStmt(SourceLocation location, Target target, Expression saveAs) {
        super(location);
        this.target = target;
        this.saveAs = saveAs;
    }

    public Target getTarget() {
        return target;
    }

    public Expression getSaveAs() {
        return saveAs;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitDownload(this, context);
    }
}
