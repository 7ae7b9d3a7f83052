package com.verolang.compiler.lexer;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lexer 单元测试
 */
class LexerTest {

    /** 扫描源码，返回非 EOF 的 token 列表 */
    private List<Token> tokens(String source) {
        return Lexer.tokenize(source).getTokens().stream()
                .filter(t -> t.getType() != TokenType.EOF)
                .collect(Collectors.toList());
    }

    private List<TokenType> types(String source) {
        return tokens(source).stream().map(Token::getType).collect(Collectors.toList());
    }

    private void assertSingleToken(String source, TokenType expectedType, Object expectedLiteral) {
        List<Token> toks = tokens(source);
        assertEquals(1, toks.size(), "Expected single token from: " + source);
        assertEquals(expectedType, toks.get(0).getType());
        assertEquals(expectedLiteral, toks.get(0).getLiteral());
    }

    // ================================================================
    // 关键词与标识符
    // ================================================================

    @Nested
    @DisplayName("关键词与标识符")
    class KeywordTests {

        @Test
        @DisplayName("关键词大小写不敏感")
        void testKeywordCaseInsensitive() {
            assertEquals(TokenType.KW_CLICK, types("CLICK").get(0));
            assertEquals(TokenType.KW_CLICK, types("click").get(0));
            assertEquals(TokenType.KW_CLICK, types("Click").get(0));
            assertEquals(TokenType.KW_PAGEACTIONS, types("PageActions").get(0));
        }

        @Test
        @DisplayName("标识符保留原始大小写")
        void testIdentifierKeepsCase() {
            List<Token> toks = tokens("LoginPage.submitBtn");
            assertEquals(3, toks.size());
            assertEquals(TokenType.IDENTIFIER, toks.get(0).getType());
            assertEquals("LoginPage", toks.get(0).getLexeme());
            assertEquals(TokenType.DOT, toks.get(1).getType());
            assertEquals("submitBtn", toks.get(2).getLexeme());
        }

        @Test
        @DisplayName("视觉断言参数关键词")
        void testScreenshotKeywords() {
            assertEquals(TokenType.KW_MAX_DIFF_PIXELS, types("MAX_DIFF_PIXELS").get(0));
            assertEquals(TokenType.KW_MAX_DIFF_RATIO, types("max_diff_ratio").get(0));
        }
    }

    // ================================================================
    // 字面量
    // ================================================================

    @Nested
    @DisplayName("字面量")
    class LiteralTests {

        @Test
        @DisplayName("双引号与单引号字符串")
        void testStrings() {
            assertSingleToken("\"hello\"", TokenType.STRING_LITERAL, "hello");
            assertSingleToken("'world'", TokenType.STRING_LITERAL, "world");
        }

        @Test
        @DisplayName("字符串转义")
        void testStringEscapes() {
            assertSingleToken("\"a\\\"b\\n\"", TokenType.STRING_LITERAL, "a\"b\n");
        }

        @Test
        @DisplayName("整数、小数与负数")
        void testNumbers() {
            assertSingleToken("42", TokenType.NUMBER_LITERAL, 42.0);
            assertSingleToken("1.5", TokenType.NUMBER_LITERAL, 1.5);
            assertSingleToken("-3", TokenType.NUMBER_LITERAL, -3.0);
        }

        @Test
        @DisplayName("环境变量引用")
        void testEnvVar() {
            assertSingleToken("{{ baseUrl }}", TokenType.ENV_VAR, "baseUrl");
        }

        @Test
        @DisplayName("标签")
        void testTag() {
            assertSingleToken("@smoke-test", TokenType.TAG, "smoke-test");
        }

        @Test
        @DisplayName("注释保留为 COMMENT token")
        void testComment() {
            assertSingleToken("# a comment", TokenType.COMMENT, "a comment");
        }
    }

    // ================================================================
    // 运算符
    // ================================================================

    @Nested
    @DisplayName("运算符")
    class OperatorTests {

        @Test
        @DisplayName("比较运算符")
        void testComparisons() {
            assertEquals(List.of(TokenType.EQ, TokenType.EQ_EQ, TokenType.NE, TokenType.LT,
                            TokenType.LE, TokenType.GT, TokenType.GE),
                    types("= == != < <= > >="));
        }

        @Test
        @DisplayName("单个花括号与双花括号区分")
        void testBraces() {
            assertEquals(List.of(TokenType.LBRACE, TokenType.RBRACE), types("{ }"));
        }
    }

    // ================================================================
    // 位置与错误
    // ================================================================

    @Nested
    @DisplayName("位置与错误")
    class PositionAndErrorTests {

        @Test
        @DisplayName("行列号从 1 开始")
        void testPositions() {
            List<Token> toks = tokens("PAGE Login {\n  FIELD btn = \"#go\"\n}");
            Token field = toks.get(3);
            assertEquals(TokenType.KW_FIELD, field.getType());
            assertEquals(2, field.getLine());
            assertEquals(3, field.getColumn());
        }

        @Test
        @DisplayName("未闭合字符串被收集且扫描继续")
        void testUnterminatedString() {
            LexResult result = Lexer.tokenize("LOG \"oops\nCLICK btn");
            assertTrue(result.hasErrors());
            assertEquals("Unterminated string", result.getErrors().get(0).getMessage());
            assertEquals(1, result.getErrors().get(0).getLine());
            assertTrue(result.getTokens().stream().anyMatch(t -> t.is(TokenType.KW_CLICK)));
        }

        @Test
        @DisplayName("每个非法字符都产生一条错误")
        void testMultipleErrors() {
            LexResult result = Lexer.tokenize("CLICK $ btn ; x");
            assertEquals(2, result.getErrors().size());
            assertEquals(TokenType.EOF, result.getTokens().get(result.getTokens().size() - 1).getType());
        }

        @Test
        @DisplayName("空环境变量引用")
        void testEmptyEnvVar() {
            LexResult result = Lexer.tokenize("{{ }}");
            assertEquals(1, result.getErrors().size());
            assertEquals("Empty environment variable reference", result.getErrors().get(0).getMessage());
        }
    }
}
