package com.verolang.compiler.lexer;

import java.util.List;

/**
 * 词法分析结果：token 列表（以 EOF 结尾）和收集到的错误
 */
public final class LexResult {
    private final List<Token> tokens;
    private final List<LexError> errors;

    public LexResult(List<Token> tokens, List<LexError> errors) {
        this.tokens = tokens;
        this.errors = errors;
    }

    public List<Token> getTokens() {
        return tokens;
    }

    public List<LexError> getErrors() {
        return errors;
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
