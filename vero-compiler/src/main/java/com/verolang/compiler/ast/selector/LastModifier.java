package com.verolang.compiler.ast.selector;

import com.verolang.compiler.ast.SourceLocation;

/**
 * LAST
 */
public class LastModifier extends SelectorModifier {

    public LastModifier(SourceLocation location) {
        super(location);
    }

    @Override
    public <R> R accept(ModifierVisitor<R> visitor) {
        return visitor.visitLast(this);
    }
}
