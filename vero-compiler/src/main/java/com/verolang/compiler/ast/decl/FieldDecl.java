package com.verolang.compiler.ast.decl;

import com.verolang.compiler.ast.AstNode;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.selector.Selector;

/**
 * FIELD name = selector
 */
public class FieldDecl extends AstNode {
    private final String name;
    private final Selector selector;

    public FieldDecl(SourceLocation location, String name, Selector selector) {
        super(location);
        this.name = name;
        this.selector = selector;
    }

    public String getName() {
        return name;
    }

    public Selector getSelector() {
        return selector;
    }
}
