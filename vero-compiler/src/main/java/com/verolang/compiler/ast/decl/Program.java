package com.verolang.compiler.ast.decl;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 程序（编译单元）根节点
 */
public class Program extends AstNode {
    private final List<PageDecl> pages;
    private final List<PageActionsDecl> pageActions;
    private final List<FeatureDecl> features;

    public Program(SourceLocation location, List<PageDecl> pages,
                   List<PageActionsDecl> pageActions, List<FeatureDecl> features) {
        super(location);
        this.pages = Collections.unmodifiableList(new ArrayList<PageDecl>(pages));
        this.pageActions = Collections.unmodifiableList(new ArrayList<PageActionsDecl>(pageActions));
        this.features = Collections.unmodifiableList(new ArrayList<FeatureDecl>(features));
    }

    public List<PageDecl> getPages() {
        return pages;
    }

    public List<PageActionsDecl> getPageActions() {
        return pageActions;
    }

    public List<FeatureDecl> getFeatures() {
        return features;
    }

    /** 返回替换了 feature 列表的新程序，页面与 PageActions 保持不变 */
    public Program withFeatures(List<FeatureDecl> newFeatures) {
        return new Program(location, pages, pageActions, newFeatures);
    }

    public PageDecl findPage(String name) {
        for (PageDecl page : pages) {
            if (page.getName().equals(name)) return page;
        }
        return null;
    }

    public PageActionsDecl findPageActions(String name) {
        for (PageActionsDecl block : pageActions) {
            if (block.getName().equals(name)) return block;
        }
        return null;
    }

    public int getScenarioCount() {
        int count = 0;
        for (FeatureDecl feature : features) {
            count += feature.getScenarios().size();
        }
        return count;
    }
}
