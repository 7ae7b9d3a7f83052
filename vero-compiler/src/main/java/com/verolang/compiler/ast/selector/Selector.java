package com.verolang.compiler.ast.selector;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 元素选择器：基础定位 + 可选的可访问名称 + 有序修饰符链
 * <p>
 * 修饰符按书写顺序保存，生成代码时按同一顺序链接。
 */
public class Selector extends AstNode {
    private final SelectorType selectorType;
    private final String value;
    private final String nameParam;
    private final List<SelectorModifier> modifiers;

    public Selector(SourceLocation location, SelectorType selectorType, String value,
                    String nameParam, List<SelectorModifier> modifiers) {
        super(location);
        this.selectorType = selectorType;
        this.value = value;
        this.nameParam = nameParam;
        this.modifiers = modifiers == null
                ? Collections.<SelectorModifier>emptyList()
                : Collections.unmodifiableList(new ArrayList<SelectorModifier>(modifiers));
    }

    public SelectorType getSelectorType() {
        return selectorType;
    }

    public String getValue() {
        return value;
    }

    /** ROLE 选择器的可访问名称，可能为 null */
    public String getNameParam() {
        return nameParam;
    }

    public List<SelectorModifier> getModifiers() {
        return modifiers;
    }

    public boolean hasModifiers() {
        return !modifiers.isEmpty();
    }
}
