package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.ast.selector.Selector;
import com.verolang.compiler.lexer.Lexer;
import com.verolang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * SelectorCompiler 测试
 */
class SelectorCompilerTest {

    private static Selector field(String selectorSource) {
        Program program = Parser.parse(Lexer.tokenize("PAGE P { FIELD f = " + selectorSource + " }")
                .getTokens()).getProgram();
        return program.getPages().get(0).getFields().get(0).getSelector();
    }

    private static String compile(String selectorSource) {
        return SelectorCompiler.compile(field(selectorSource), "page");
    }

    @Test
    @DisplayName("修饰符按书写顺序追加")
    void testModifierChain() {
        assertEquals("page.locator('.item').filter({ hasText: 'Active' }).first()",
                compile("css \".item\" WITH TEXT \"Active\" FIRST"));
        assertEquals("page.locator('.item').first().filter({ hasText: 'Active' })",
                compile("css \".item\" FIRST WITH TEXT \"Active\""));
    }

    @Test
    @DisplayName("role 带可访问名称时精确匹配")
    void testRoleWithName() {
        assertEquals("page.getByRole('heading', { name: 'Title', exact: true })",
                compile("role \"heading\" name \"Title\""));
        assertEquals("page.getByRole('button')", compile("role \"button\""));
    }

    @Test
    @DisplayName("各类基础定位器")
    void testBaseLocators() {
        assertEquals("page.locator('#email')", compile("\"#email\""));
        assertEquals("page.getByText('Sign in')", compile("text \"Sign in\""));
        assertEquals("page.getByTestId('submit')", compile("testid \"submit\""));
        assertEquals("page.getByLabel('Email')", compile("label \"Email\""));
        assertEquals("page.getByPlaceholder('you@example.com')", compile("placeholder \"you@example.com\""));
    }

    @Test
    @DisplayName("HAS / HAS NOT / WITHOUT TEXT / NTH / LAST")
    void testFilters() {
        assertEquals("page.locator('.card').filter({ has: page.locator('.title') })",
                compile("css \".card\" HAS css \".title\""));
        assertEquals("page.locator('.card').filter({ hasNot: page.getByText('Sold out') })",
                compile("css \".card\" HAS NOT text \"Sold out\""));
        assertEquals("page.locator('li').filter({ hasNotText: 'Draft' }).nth(2)",
                compile("css \"li\" WITHOUT TEXT \"Draft\" NTH 2"));
        assertEquals("page.locator('li').last()", compile("css \"li\" LAST"));
    }

    @Test
    @DisplayName("接收者可替换，引号被转义")
    void testReceiverAndEscaping() {
        assertEquals("this.page.locator('a[title=\\'x\\']')",
                new SelectorCompiler("this.page").compile(field("css \"a[title='x']\"")));
    }
}
