package com.verolang.compiler.ast.selector;

import com.verolang.compiler.ast.SourceLocation;

/**
 * NTH n（从 0 开始）
 */
public class NthModifier extends SelectorModifier {
    private final int index;

    public NthModifier(SourceLocation location, int index) {
        super(location);
        this.index = index;
    }

    public int getIndex() {
        return index;
    }

    @Override
    public <R> R accept(ModifierVisitor<R> visitor) {
        return visitor.visitNth(this);
    }
}
