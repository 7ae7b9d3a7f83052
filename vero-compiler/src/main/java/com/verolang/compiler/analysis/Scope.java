package com.verolang.compiler.analysis;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 作用域
 */
public final class Scope {

    public enum ScopeType {
        FEATURE,    // feature 级（钩子共享）
        SCENARIO,   // scenario body
        ACTION,     // PageActions 动作 body
        BLOCK       // IF/REPEAT/FOR EACH/TRY 块
    }

    private final ScopeType type;
    private final Scope parent;
    private final Map<String, Symbol> symbols = new LinkedHashMap<String, Symbol>();

    public Scope(ScopeType type, Scope parent) {
        this.type = type;
        this.parent = parent;
    }

    public ScopeType getType() { return type; }
    public Scope getParent() { return parent; }

    public Scope child(ScopeType childType) {
        return new Scope(childType, this);
    }

    /** 注册符号到当前作用域 */
    public void define(Symbol symbol) {
        symbols.put(symbol.getName(), symbol);
    }

    /** 从当前作用域向上查找 */
    public Symbol resolve(String name) {
        Symbol s = symbols.get(name);
        if (s != null) return s;
        if (parent != null) return parent.resolve(name);
        return null;
    }

    /** 仅查找当前作用域 */
    public Symbol resolveLocal(String name) {
        return symbols.get(name);
    }
}
