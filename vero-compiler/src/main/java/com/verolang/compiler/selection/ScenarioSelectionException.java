package com.verolang.compiler.selection;

/**
 * 场景筛选失败（标签表达式非法、正则非法、无场景匹配）
 */
public class ScenarioSelectionException extends RuntimeException {

    public static final String CODE = "VERO-SELECTION";

    private final int index;

    public ScenarioSelectionException(String message) {
        this(message, -1);
    }

    public ScenarioSelectionException(String message, int index) {
        super(message);
        this.index = index;
    }

    public String getCode() {
        return CODE;
    }

    /** 标签表达式出错处的字符下标；与标签表达式无关时为 -1 */
    public int getIndex() {
        return index;
    }
}
