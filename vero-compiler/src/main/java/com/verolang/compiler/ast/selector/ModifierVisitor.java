package com.verolang.compiler.ast.selector;

/**
 * 选择器修饰符访问者
 */
public interface ModifierVisitor<R> {
    R visitFirst(FirstModifier modifier);
    R visitLast(LastModifier modifier);
    R visitNth(NthModifier modifier);
    R visitWithText(WithTextModifier modifier);
    R visitWithoutText(WithoutTextModifier modifier);
    R visitHas(HasModifier modifier);
    R visitHasNot(HasNotModifier modifier);
}
