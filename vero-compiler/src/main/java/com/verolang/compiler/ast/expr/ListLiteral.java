package com.verolang.compiler.ast.expr;

import com.verolang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 列表字面量 [a, b, c]
 */
public class ListLiteral extends Expression {
    private final List<Expression> elements;

    public ListLiteral(SourceLocation location, List<Expression> elements) {
        super(location);
        this.elements = Collections.unmodifiableList(new ArrayList<Expression>(elements));
    }

    public List<Expression> getElements() {
        return elements;
    }

    @Override
    public <R> R accept(ExpressionVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
