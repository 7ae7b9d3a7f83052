package com.verolang.compiler.analysis;

import com.verolang.compiler.ast.SourceLocation;

/**
 * 作用域中的符号
 */
public final class Symbol {
    private final String name;
    private final SymbolKind kind;
    private final SourceLocation location;

    public Symbol(String name, SymbolKind kind, SourceLocation location) {
        this.name = name;
        this.kind = kind;
        this.location = location;
    }

    public String getName() { return name; }
    public SymbolKind getKind() { return kind; }
    public SourceLocation getLocation() { return location; }
}
