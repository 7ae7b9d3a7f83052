package com.verolang.compiler.selection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 标签表达式解析与求值测试
 */
class TagExpressionTest {

    private static Set<String> tags(String... values) {
        return new HashSet<String>(Arrays.asList(values));
    }

    @Nested
    @DisplayName("求值")
    class EvaluationTests {

        @Test
        @DisplayName("单个标签，@ 可省略且大小写不敏感")
        void testSingleTag() {
            assertTrue(TagExpression.parse("@Smoke").evaluate(tags("smoke")));
            assertTrue(TagExpression.parse("smoke").evaluate(tags("smoke")));
            assertFalse(TagExpression.parse("@smoke").evaluate(tags("regression")));
        }

        @Test
        @DisplayName("NOT 优先于 AND，AND 优先于 OR")
        void testPrecedence() {
            TagExpression expr = TagExpression.parse("@a or @b and not @c");
            assertEquals("(@a or (@b and not @c))", expr.toString());
            assertTrue(expr.evaluate(tags("a", "c")));
            assertTrue(expr.evaluate(tags("b")));
            assertFalse(expr.evaluate(tags("b", "c")));
        }

        @Test
        @DisplayName("括号改变优先级")
        void testParentheses() {
            TagExpression expr = TagExpression.parse("(@a OR @b) AND NOT @wip");
            assertTrue(expr.evaluate(tags("b")));
            assertFalse(expr.evaluate(tags("a", "wip")));
            assertFalse(expr.evaluate(tags("wip")));
        }

        @Test
        @DisplayName("标签可包含连字符和下划线")
        void testTagCharacters() {
            assertTrue(TagExpression.parse("@smoke-test and @p_1").evaluate(tags("smoke-test", "p_1")));
        }

        @Test
        @DisplayName("规范化去掉前导 @ 并转小写")
        void testNormalize() {
            assertEquals("smoke", TagExpression.normalizeTag("  @@Smoke "));
        }
    }

    @Nested
    @DisplayName("错误")
    class ErrorTests {

        @Test
        @DisplayName("缺少右操作数时报告表达式末尾位置")
        void testDanglingOperator() {
            ScenarioSelectionException e = assertThrows(ScenarioSelectionException.class,
                    () -> TagExpression.parse("@a and"));
            assertEquals(6, e.getIndex());
            assertEquals(ScenarioSelectionException.CODE, e.getCode());
        }

        @Test
        @DisplayName("未闭合的括号")
        void testUnclosedGroup() {
            ScenarioSelectionException e = assertThrows(ScenarioSelectionException.class,
                    () -> TagExpression.parse("(@a or @b"));
            assertTrue(e.getMessage().contains("')'"));
            assertEquals(9, e.getIndex());
        }

        @Test
        @DisplayName("非法字符")
        void testUnexpectedCharacter() {
            ScenarioSelectionException e = assertThrows(ScenarioSelectionException.class,
                    () -> TagExpression.parse("@a & @b"));
            assertEquals(3, e.getIndex());
        }

        @Test
        @DisplayName("@ 后没有标签名")
        void testEmptyTag() {
            ScenarioSelectionException e = assertThrows(ScenarioSelectionException.class,
                    () -> TagExpression.parse("@a or @"));
            assertEquals(6, e.getIndex());
        }

        @Test
        @DisplayName("多余的尾部内容")
        void testTrailingContent() {
            assertThrows(ScenarioSelectionException.class, () -> TagExpression.parse("@a @b"));
        }
    }
}
