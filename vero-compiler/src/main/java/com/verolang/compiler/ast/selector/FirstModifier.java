package com.verolang.compiler.ast.selector;

import com.verolang.compiler.ast.SourceLocation;

/**
 * FIRST
 */
public class FirstModifier extends SelectorModifier {

    public FirstModifier(SourceLocation location) {
        super(location);
    }

    @Override
    public <R> R accept(ModifierVisitor<R> visitor) {
        return visitor.visitFirst(this);
    }
}
