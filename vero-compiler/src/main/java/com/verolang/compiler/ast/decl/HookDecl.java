package com.verolang.compiler.ast.decl;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * BEFORE ALL / BEFORE EACH / AFTER ALL / AFTER EACH
 */
public class HookDecl extends AstNode {

    public enum HookType {
        BEFORE_ALL("beforeAll"),
        BEFORE_EACH("beforeEach"),
        AFTER_ALL("afterAll"),
        AFTER_EACH("afterEach");

        private final String playwrightName;

        HookType(String playwrightName) {
            this.playwrightName = playwrightName;
        }

        public String getPlaywrightName() {
            return playwrightName;
        }
    }

    private final HookType hookType;
    private final List<Statement> statements;

    public HookDecl(SourceLocation location, HookType hookType, List<Statement> statements) {
        super(location);
        this.hookType = hookType;
        this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
    }

    public HookType getHookType() {
        return hookType;
    }

    public List<Statement> getStatements() {
        return statements;
    }
}
