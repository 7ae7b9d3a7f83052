package com.verolang.compiler.ast.selector;

import com.verolang.compiler.ast.SourceLocation;

/**
 * HAS &lt;selector&gt;，内层选择器不允许再带修饰符
 */
public class HasModifier extends SelectorModifier {
    private final Selector selector;

    public HasModifier(SourceLocation location, Selector selector) {
        super(location);
        this.selector = selector;
    }

    public Selector getSelector() {
        return selector;
    }

    @Override
    public <R> R accept(ModifierVisitor<R> visitor) {
        return visitor.visitHas(this);
    }
}
