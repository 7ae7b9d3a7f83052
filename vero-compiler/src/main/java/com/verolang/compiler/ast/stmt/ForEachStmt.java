package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.expr.VariableRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FOR EACH item IN list { }
 */
public class ForEachStmt extends Statement {
    private final String itemName;
    private final VariableRef collection;
    private final List<Statement> body;

    public ForEachStmt(SourceLocation location, String itemName, VariableRef collection, List<Statement> body) {
        super(location);
        this.itemName = itemName;
        this.collection = collection;
        this.body = body == null ? Collections.<Statement>emptyList()
                : Collections.unmodifiableList(new ArrayList<Statement>(body));
    }

    public String getItemName() {
        return itemName;
    }

    public VariableRef getCollection() {
        return collection;
    }

    public List<Statement> getBody() {
        return body;
    }

    @Override
    public <R, C> R accept(StatementVisitor<R, C> visitor, C context) {
        return visitor.visitForEach(this, context);
    }
}
