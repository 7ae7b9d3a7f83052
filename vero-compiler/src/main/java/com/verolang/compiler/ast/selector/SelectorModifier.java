package com.verolang.compiler.ast.selector;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

/**
 * 选择器修饰符（封闭集合：first / last / nth / withText / withoutText / has / hasNot）
 */
public abstract class SelectorModifier extends AstNode {

    protected SelectorModifier(SourceLocation location) {
        super(location);
    }

    public abstract <R> R accept(ModifierVisitor<R> visitor);
}
