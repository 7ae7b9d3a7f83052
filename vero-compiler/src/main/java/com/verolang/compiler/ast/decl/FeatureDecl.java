package com.verolang.compiler.ast.decl;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * FEATURE 声明
 */
public class FeatureDecl extends AstNode {
    private final String name;
    private final List<String> uses;
    private final List<HookDecl> hooks;
    private final List<ScenarioDecl> scenarios;

    public FeatureDecl(SourceLocation location, String name, List<String> uses,
                       List<HookDecl> hooks, List<ScenarioDecl> scenarios) {
        super(location);
        this.name = name;
        this.uses = Collections.unmodifiableList(new ArrayList<String>(uses));
        this.hooks = Collections.unmodifiableList(new ArrayList<HookDecl>(hooks));
        this.scenarios = Collections.unmodifiableList(new ArrayList<ScenarioDecl>(scenarios));
    }

    public String getName() {
        return name;
    }

    public List<String> getUses() {
        return uses;
    }

    public List<HookDecl> getHooks() {
        return hooks;
    }

    public List<ScenarioDecl> getScenarios() {
        return scenarios;
    }

    public FeatureDecl withScenarios(List<ScenarioDecl> newScenarios) {
        return new FeatureDecl(location, name, uses, hooks, newScenarios);
    }
}
