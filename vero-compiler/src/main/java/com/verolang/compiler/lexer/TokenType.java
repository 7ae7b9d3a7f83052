package com.verolang.compiler.lexer;

/**
 * Vero 词法单元类型
 */
public enum TokenType {
    // === 字面量 ===
    STRING_LITERAL,
    NUMBER_LITERAL,
    ENV_VAR,                // {{name}}
    TAG,                    // @smoke

    // === 标识符 ===
    IDENTIFIER,

    // === 关键词 - 结构 ===
    KW_PAGE, KW_PAGEACTIONS, KW_FEATURE, KW_SCENARIO, KW_FIELD, KW_USE, KW_FOR,
    KW_BEFORE, KW_AFTER, KW_ALL, KW_EACH, KW_RETURNS, KW_RETURN,

    // === 关键词 - 变量类型 ===
    KW_TEXT, KW_NUMBER, KW_FLAG, KW_LIST,

    // === 关键词 - 选择器 ===
    KW_CSS, KW_ROLE, KW_TESTID, KW_LABEL, KW_PLACEHOLDER, KW_NAME,
    KW_FIRST, KW_LAST, KW_NTH, KW_WITH, KW_WITHOUT, KW_HAS,

    // === 关键词 - 动作 ===
    KW_CLICK, KW_RIGHT, KW_DOUBLE, KW_FORCE, KW_DRAG, KW_FILL, KW_CLEAR,
    KW_SELECT, KW_CHECK, KW_UNCHECK, KW_HOVER, KW_PRESS, KW_SCROLL, KW_UP, KW_DOWN,
    KW_UPLOAD, KW_DOWNLOAD, KW_OPEN, KW_REFRESH, KW_WAIT, KW_SECONDS, KW_MILLISECONDS,
    KW_NAVIGATION, KW_NETWORK, KW_IDLE, KW_URL, KW_TITLE,
    KW_SWITCH, KW_NEW, KW_TAB, KW_FRAME, KW_MAIN, KW_CLOSE,
    KW_ACCEPT, KW_DISMISS, KW_DIALOG, KW_SET, KW_COOKIE, KW_COOKIES, KW_STORAGE,
    KW_LOG, KW_TAKE, KW_SCREENSHOT, KW_AS, KW_PERFORM, KW_TO, KW_FROM, KW_OF,

    // === 关键词 - 断言 ===
    KW_VERIFY, KW_IS, KW_NOT, KW_VISIBLE, KW_HIDDEN, KW_ENABLED, KW_DISABLED,
    KW_CHECKED, KW_FOCUSED, KW_EMPTY, KW_CONTAINS, KW_COUNT, KW_VALUE, KW_CLASS,
    KW_ATTRIBUTE, KW_MATCHES, KW_EQUALS, KW_TRUE, KW_FALSE,
    KW_STRICT, KW_BALANCED, KW_RELAXED, KW_THRESHOLD, KW_MAX_DIFF_PIXELS, KW_MAX_DIFF_RATIO,

    // === 关键词 - 控制流 ===
    KW_IF, KW_ELSE, KW_REPEAT, KW_TIMES, KW_IN, KW_TRY, KW_CATCH,

    // === 关键词 - 数据查询 ===
    KW_LOAD, KW_WHERE, KW_ROW, KW_ROWS, KW_RANDOM, KW_ORDER, KW_BY, KW_ASC, KW_DESC,
    KW_LIMIT, KW_OFFSET, KW_AND, KW_OR,

    // === 运算符 ===
    EQ,                     // =
    EQ_EQ,                  // ==
    NE,                     // !=
    LT,                     // <
    GT,                     // >
    LE,                     // <=
    GE,                     // >=

    // === 分隔符 ===
    LPAREN, RPAREN,         // ( )
    LBRACE, RBRACE,         // { }
    LBRACKET, RBRACKET,     // [ ]
    COMMA,                  // ,
    DOT,                    // .
    AT,                     // @

    // === 特殊 ===
    COMMENT,                // # ...
    EOF;

    /**
     * 是否为关键词
     */
    public boolean isKeyword() {
        return name().startsWith("KW_");
    }

    /**
     * 是否为比较运算符
     */
    public boolean isComparison() {
        switch (this) {
            case EQ:
            case EQ_EQ:
            case NE:
            case LT:
            case GT:
            case LE:
            case GE:
                return true;
            default:
                return false;
        }
    }
}
