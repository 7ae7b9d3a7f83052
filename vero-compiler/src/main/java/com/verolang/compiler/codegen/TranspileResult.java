package com.verolang.compiler.codegen;

import java.util.Collections;
import java.util.Map;

/**
 * 生成结果：名称到 TypeScript 源码的有序映射
 */
public final class TranspileResult {
    private final Map<String, String> pages;
    private final Map<String, String> pageActions;
    private final Map<String, String> tests;

    public TranspileResult(Map<String, String> pages, Map<String, String> pageActions, Map<String, String> tests) {
        this.pages = Collections.unmodifiableMap(pages);
        this.pageActions = Collections.unmodifiableMap(pageActions);
        this.tests = Collections.unmodifiableMap(tests);
    }

    /** 页面名 → 页面对象类 */
    public Map<String, String> getPages() {
        return pages;
    }

    /** PageActions 名 → 动作类 */
    public Map<String, String> getPageActions() {
        return pageActions;
    }

    /** Feature 名 → spec 文件 */
    public Map<String, String> getTests() {
        return tests;
    }
}
