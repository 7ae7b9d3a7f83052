package com.verolang.compiler.selection;

import java.util.Collections;
import java.util.List;

/**
 * 筛选统计
 */
public final class SelectionDiagnostics {
    private final int totalScenarios;
    private final int selectedScenarios;
    private final int selectedFeatures;
    private final boolean hasFilters;
    private final List<String> scenarioNames;
    private final List<String> namePatterns;
    private final String tagExpression;

    public SelectionDiagnostics(int totalScenarios, int selectedScenarios, int selectedFeatures,
                                boolean hasFilters, List<String> scenarioNames,
                                List<String> namePatterns, String tagExpression) {
        this.totalScenarios = totalScenarios;
        this.selectedScenarios = selectedScenarios;
        this.selectedFeatures = selectedFeatures;
        this.hasFilters = hasFilters;
        this.scenarioNames = Collections.unmodifiableList(scenarioNames);
        this.namePatterns = Collections.unmodifiableList(namePatterns);
        this.tagExpression = tagExpression;
    }

    public int getTotalScenarios() { return totalScenarios; }
    public int getSelectedScenarios() { return selectedScenarios; }
    public int getSelectedFeatures() { return selectedFeatures; }
    public boolean hasFilters() { return hasFilters; }

    /** 规范化（去空白、小写）后的场景名 */
    public List<String> getScenarioNames() { return scenarioNames; }
    public List<String> getNamePatterns() { return namePatterns; }
    /** 未设置标签表达式时为 null */
    public String getTagExpression() { return tagExpression; }

    @Override
    public String toString() {
        return "selected " + selectedScenarios + "/" + totalScenarios + " scenario(s) in "
                + selectedFeatures + " feature(s)" + (hasFilters ? "" : " (no filters)");
    }
}
