package com.verolang.compiler.ast.decl;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * PAGEACTIONS name FOR Page { ... }
 */
public class PageActionsDecl extends AstNode {
    private final String name;
    private final String forPage;
    private final List<ActionDecl> actions;

    public PageActionsDecl(SourceLocation location, String name, String forPage, List<ActionDecl> actions) {
        super(location);
        this.name = name;
        this.forPage = forPage;
        this.actions = Collections.unmodifiableList(new ArrayList<ActionDecl>(actions));
    }

    public String getName() {
        return name;
    }

    public String getForPage() {
        return forPage;
    }

    public List<ActionDecl> getActions() {
        return actions;
    }

    /**
     * 按名称分组的动作重载（保持首次出现顺序）
     */
    public Map<String, List<ActionDecl>> getOverloads() {
        Map<String, List<ActionDecl>> groups = new LinkedHashMap<String, List<ActionDecl>>();
        for (ActionDecl action : actions) {
            List<ActionDecl> group = groups.get(action.getName());
            if (group == null) {
                group = new ArrayList<ActionDecl>();
                groups.put(action.getName(), group);
            }
            group.add(action);
        }
        return groups;
    }

    public List<ActionDecl> findOverloads(String actionName) {
        List<ActionDecl> result = new ArrayList<ActionDecl>();
        for (ActionDecl action : actions) {
            if (action.getName().equals(actionName)) result.add(action);
        }
        return result;
    }
}
