package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * UPLOAD e[, e]* TO t
 */
public class UploadStmt extends Statement {
    private final List<Expression> files;
    private final Target target;

    public UploadStmt(SourceLocation location, List<Expression> files, Target target) {
        super(location);
        this.files = files == null ? Collections.<Expression>emptyList()
                : Collections.unmodifiableList(new ArrayList<Expression>(files));
        this.target = target;
    }

    public List<Expression> getFiles() {
        return files;
    }

    public Target getTarget() {
        return target;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitUpload(this, context);
    }
}
