package com.verolang.compiler.ast.decl;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SCENARIO 声明；标签保留原始大小写，不带 @
 */
public class ScenarioDecl extends AstNode {
    private final String name;
    private final List<String> tags;
    private final List<Statement> statements;

    public ScenarioDecl(SourceLocation location, String name, List<String> tags, List<Statement> statements) {
        super(location);
        this.name = name;
        this.tags = Collections.unmodifiableList(new ArrayList<String>(tags));
        this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
    }

    public String getName() {
        return name;
    }

    public List<String> getTags() {
        return tags;
    }

    public List<Statement> getStatements() {
        return statements;
    }
}
