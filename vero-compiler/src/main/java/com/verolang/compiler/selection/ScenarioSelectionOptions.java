package com.verolang.compiler.selection;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 场景筛选条件：三类条件之间是 AND，同类的多个值之间是 OR
 */
public class ScenarioSelectionOptions {

    private List<String> scenarioNames = new ArrayList<String>();
    private List<String> namePatterns = new ArrayList<String>();
    private String tagExpression;

    public static ScenarioSelectionOptions none() {
        return new ScenarioSelectionOptions();
    }

    public static ScenarioSelectionOptions byTags(String tagExpression) {
        ScenarioSelectionOptions options = new ScenarioSelectionOptions();
        options.setTagExpression(tagExpression);
        return options;
    }

    public static ScenarioSelectionOptions byNames(String... names) {
        ScenarioSelectionOptions options = new ScenarioSelectionOptions();
        options.setScenarioNames(Arrays.asList(names));
        return options;
    }

    public List<String> getScenarioNames() {
        return scenarioNames;
    }

    public void setScenarioNames(List<String> scenarioNames) {
        this.scenarioNames = scenarioNames != null ? new ArrayList<String>(scenarioNames) : new ArrayList<String>();
    }

    public List<String> getNamePatterns() {
        return namePatterns;
    }

    public void setNamePatterns(List<String> namePatterns) {
        this.namePatterns = namePatterns != null ? new ArrayList<String>(namePatterns) : new ArrayList<String>();
    }

    public String getTagExpression() {
        return tagExpression;
    }

    public void setTagExpression(String tagExpression) {
        this.tagExpression = tagExpression;
    }
}
