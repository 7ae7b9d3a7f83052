package com.verolang.compiler.ast.stmt;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.selector.Selector;

/**
 * 动作作用的对象：Page.field、裸字段名或内联选择器，三者取其一
 */
public class Target extends AstNode {
    private final String pageName;
    private final String fieldName;
    private final Selector selector;

    private Target(SourceLocation location, String pageName, String fieldName, Selector selector) {
        super(location);
        this.pageName = pageName;
        this.fieldName = fieldName;
        this.selector = selector;
    }

    public static Target pageField(SourceLocation location, String pageName, String fieldName) {
        return new Target(location, pageName, fieldName, null);
    }

    public static Target field(SourceLocation location, String fieldName) {
        return new Target(location, null, fieldName, null);
    }

    public static Target selector(Selector selector) {
        return new Target(selector.getLocation(), null, null, selector);
    }

    public String getPageName() {
        return pageName;
    }

    public String getFieldName() {
        return fieldName;
    }

    public Selector getSelector() {
        return selector;
    }

    public boolean isSelector() {
        return selector != null;
    }

    public boolean isPageField() {
        return pageName != null;
    }

    /** 裸名称：PageActions 中指 FOR 页面的字段，场景中指保存选择器的变量 */
    public boolean isBareName() {
        return selector == null && pageName == null;
    }

    /** 便于阅读的描述（用于步骤标题和调试事件） */
    public String describe() {
        if (selector != null) {
            return selector.getSelectorType().name().toLowerCase() + " \"" + selector.getValue() + "\"";
        }
        return pageName != null ? pageName + "." + fieldName : fieldName;
    }
}
