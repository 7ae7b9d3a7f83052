package com.verolang.compiler.ast.selector;

import com.verolang.compiler.ast.SourceLocation;

/**
 * WITH TEXT "t"
 */
public class WithTextModifier extends SelectorModifier {
    private final String text;

    public WithTextModifier(SourceLocation location, String text) {
        super(location);
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public <R> R accept(ModifierVisitor<R> visitor) {
        return visitor.visitWithText(this);
    }
}
