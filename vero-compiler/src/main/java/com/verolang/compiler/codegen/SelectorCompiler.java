package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.selector.FirstModifier;
import com.verolang.compiler.ast.selector.HasModifier;
import com.verolang.compiler.ast.selector.HasNotModifier;
import com.verolang.compiler.ast.selector.LastModifier;
import com.verolang.compiler.ast.selector.ModifierVisitor;
import com.verolang.compiler.ast.selector.NthModifier;
import com.verolang.compiler.ast.selector.Selector;
import com.verolang.compiler.ast.selector.SelectorModifier;
import com.verolang.compiler.ast.selector.WithTextModifier;
import com.verolang.compiler.ast.selector.WithoutTextModifier;

/**
 * 选择器 → Playwright Locator 表达式
 * <p>
 * 基础定位器之后按解析顺序追加修饰符链。
 */
public final class SelectorCompiler {

    private final String pageRef;

    /**
     * @param pageRef 定位器的接收者，如 {@code page} 或 {@code this.page}
     */
    public SelectorCompiler(String pageRef) {
        this.pageRef = pageRef;
    }

    public static String compile(Selector selector, String pageRef) {
        return new SelectorCompiler(pageRef).compile(selector);
    }

    public String compile(Selector selector) {
        StringBuilder sb = new StringBuilder(base(selector));
        ModifierChain chain = new ModifierChain();
        for (SelectorModifier modifier : selector.getModifiers()) {
            sb.append(modifier.accept(chain));
        }
        return sb.toString();
    }

    private String base(Selector selector) {
        String value = TsSyntax.quote(selector.getValue());
        switch (selector.getSelectorType()) {
            case CSS:
                return pageRef + ".locator(" + value + ")";
            case ROLE:
                if (selector.getNameParam() != null) {
                    return pageRef + ".getByRole(" + value + ", { name: "
                            + TsSyntax.quote(selector.getNameParam()) + ", exact: true })";
                }
                return pageRef + ".getByRole(" + value + ")";
            case TEXT:
                return pageRef + ".getByText(" + value + ")";
            case TESTID:
                return pageRef + ".getByTestId(" + value + ")";
            case LABEL:
                return pageRef + ".getByLabel(" + value + ")";
            case PLACEHOLDER:
                return pageRef + ".getByPlaceholder(" + value + ")";
            default:
                throw new IllegalStateException("Unknown selector type: " + selector.getSelectorType());
        }
    }

    private final class ModifierChain implements ModifierVisitor<String> {
        @Override
        public String visitFirst(FirstModifier modifier) {
            return ".first()";
        }

        @Override
        public String visitLast(LastModifier modifier) {
            return ".last()";
        }

        @Override
        public String visitNth(NthModifier modifier) {
            return ".nth(" + modifier.getIndex() + ")";
        }

        @Override
        public String visitWithText(WithTextModifier modifier) {
            return ".filter({ hasText: " + TsSyntax.quote(modifier.getText()) + " })";
        }

        @Override
        public String visitWithoutText(WithoutTextModifier modifier) {
            return ".filter({ hasNotText: " + TsSyntax.quote(modifier.getText()) + " })";
        }

        @Override
        public String visitHas(HasModifier modifier) {
            return ".filter({ has: " + compile(modifier.getSelector()) + " })";
        }

        @Override
        public String visitHasNot(HasNotModifier modifier) {
            return ".filter({ hasNot: " + compile(modifier.getSelector()) + " })";
        }
    }
}
