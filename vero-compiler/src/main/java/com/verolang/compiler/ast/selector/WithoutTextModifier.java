package com.verolang.compiler.ast.selector;

import com.verolang.compiler.ast.SourceLocation;

/**
 * WITHOUT TEXT "t"
 */
public class WithoutTextModifier extends SelectorModifier {
    private final String text;

    public WithoutTextModifier(SourceLocation location, String text) {
        super(location);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(ModifierVisitor<R> visitor) {
        return visitor.visitWithoutText(this);
    }
}
