package com.verolang.compiler.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Vero 词法分析器
 * <p>
 * 关键词大小写不敏感；非关键词的标识符保留原始大小写。
 * 词法错误被收集而不抛出，扫描总会以 EOF 结束。
 */
public class Lexer {
    private final String source;
    private final List<Token> tokens = new ArrayList<Token>();
    private final List<LexError> errors = new ArrayList<LexError>();

    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    // 关键词映射表（键为大写）
    private static final Map<String, TokenType> KEYWORDS;

    static {
        Map<String, TokenType> map = new HashMap<String, TokenType>();
        for (TokenType type : TokenType.values()) {
            if (type.isKeyword()) {
                map.put(type.name().substring(3), type);
            }
        }
        KEYWORDS = Collections.unmodifiableMap(map);
    }

    /** 获取所有关键词集合（大写） */
    public static Set<String> getKeywords() {
        return KEYWORDS.keySet();
    }

    public Lexer(String source) {
        this.source = source != null ? source : "";
    }

    /**
     * 执行词法分析
     */
    public LexResult tokenize() {
        while (!isAtEnd()) {
            skipWhitespace();
            if (isAtEnd()) break;
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }

        tokens.add(new Token(TokenType.EOF, "", null, line, column, current));
        return new LexResult(tokens, errors);
    }

    private void skipWhitespace() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\r' || c == '\t' || c == '\n') {
                advance();
            } else {
                break;
            }
        }
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            // 单字符 Token
            case '(': addToken(TokenType.LPAREN); break;
            case ')': addToken(TokenType.RPAREN); break;
            case '}': addToken(TokenType.RBRACE); break;
            case '[': addToken(TokenType.LBRACKET); break;
            case ']': addToken(TokenType.RBRACKET); break;
            case ',': addToken(TokenType.COMMA); break;
            case '.': addToken(TokenType.DOT); break;

            case '{':
                if (peek() == '{') {
                    advance();
                    envVar();
                } else {
                    addToken(TokenType.LBRACE);
                }
                break;

            case '@':
                if (isTagChar(peek())) {
                    tag();
                } else {
                    addToken(TokenType.AT);
                }
                break;

            case '=':
                addToken(match('=') ? TokenType.EQ_EQ : TokenType.EQ);
                break;

            case '!':
                if (match('=')) {
                    addToken(TokenType.NE);
                } else {
                    error("Unexpected character: '!'");
                }
                break;

            case '<':
                addToken(match('=') ? TokenType.LE : TokenType.LT);
                break;

            case '>':
                addToken(match('=') ? TokenType.GE : TokenType.GT);
                break;

            case '#':
                comment();
                break;

            case '"':
            case '\'':
                string(c);
                break;

            case '-':
                if (isDigit(peek())) {
                    number();
                } else {
                    error("Unexpected character: '-'");
                }
                break;

            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    error("Unexpected character: '" + c + "'");
                }
                break;
        }
    }

    // === 辅助方法 ===

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        advance();
        return true;
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
               (c >= 'A' && c <= 'Z') ||
               c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }

    private boolean isTagChar(char c) {
        return isAlphaNumeric(c) || c == '-';
    }

    // === Token 构建 ===

    private void addToken(TokenType type) {
        addToken(type, null);
    }

    private void addToken(TokenType type, Object literal) {
        String lexeme = source.substring(start, current);
        tokens.add(new Token(type, lexeme, literal, startLine, startColumn, start));
    }

    // === 复杂 Token 扫描 ===

    private void comment() {
        while (peek() != '\n' && !isAtEnd()) advance();
        addToken(TokenType.COMMENT, source.substring(start + 1, current).trim());
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            if (peek() == '\n') {
                // 不消费换行，下一行照常扫描
                error("Unterminated string");
                return;
            }
            if (peek() == '\\') {
                advance();
                if (isAtEnd()) break;
                value.append(escapeChar(advance()));
            } else {
                value.append(advance());
            }
        }

        if (isAtEnd()) {
            error("Unterminated string");
            return;
        }

        advance(); // 闭合引号
        addToken(TokenType.STRING_LITERAL, value.toString());
    }

    private char escapeChar(char c) {
        switch (c) {
            case 'n': return '\n';
            case 't': return '\t';
            case '\\': return '\\';
            case '"': return '"';
            case '\'': return '\'';
            default: return c;
        }
    }

    private void number() {
        while (isDigit(peek())) advance();

        // 小数部分（. 后必须跟数字）
        if (peek() == '.' && isDigit(peekNext())) {
            advance();
            while (isDigit(peek())) advance();
        }

        String text = source.substring(start, current);
        addToken(TokenType.NUMBER_LITERAL, Double.valueOf(text));
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();

        String text = source.substring(start, current);
        TokenType type = KEYWORDS.get(text.toUpperCase(Locale.ROOT));
        if (type == null) type = TokenType.IDENTIFIER;
        addToken(type);
    }

    private void tag() {
        while (isTagChar(peek())) advance();
        addToken(TokenType.TAG, source.substring(start + 1, current));
    }

    private void envVar() {
        while (!isAtEnd() && peek() != '\n' && !(peek() == '}' && peekNext() == '}')) {
            advance();
        }
        if (peek() != '}') {
            error("Unterminated environment variable reference");
            return;
        }
        advance();
        advance();
        String name = source.substring(start + 2, current - 2).trim();
        if (name.isEmpty()) {
            error("Empty environment variable reference");
            return;
        }
        addToken(TokenType.ENV_VAR, name);
    }

    private void error(String message) {
        errors.add(new LexError(message, startLine, startColumn));
    }

    /**
     * 便捷方法：对源码执行词法分析
     */
    public static LexResult tokenize(String source) {
        return new Lexer(source).tokenize();
    }
}
