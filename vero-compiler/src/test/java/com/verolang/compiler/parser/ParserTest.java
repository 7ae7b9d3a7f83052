package com.verolang.compiler.parser;

import com.verolang.compiler.ast.ElementState;
import com.verolang.compiler.ast.TextMatch;
import com.verolang.compiler.ast.VariableType;
import com.verolang.compiler.ast.decl.ActionDecl;
import com.verolang.compiler.ast.decl.FeatureDecl;
import com.verolang.compiler.ast.decl.HookDecl;
import com.verolang.compiler.ast.decl.PageActionsDecl;
import com.verolang.compiler.ast.decl.PageDecl;
import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.ast.decl.ScenarioDecl;
import com.verolang.compiler.ast.expr.EnvVarRef;
import com.verolang.compiler.ast.query.QueryComparison;
import com.verolang.compiler.ast.query.QueryLogical;
import com.verolang.compiler.ast.query.RowPosition;
import com.verolang.compiler.ast.selector.HasModifier;
import com.verolang.compiler.ast.selector.NthModifier;
import com.verolang.compiler.ast.selector.Selector;
import com.verolang.compiler.ast.selector.SelectorType;
import com.verolang.compiler.ast.selector.WithTextModifier;
import com.verolang.compiler.ast.selector.FirstModifier;
import com.verolang.compiler.ast.stmt.*;
import com.verolang.compiler.lexer.Lexer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Parser 单元测试
 */
class ParserTest {

    private ParseResult parseResult(String source) {
        return Parser.parse(Lexer.tokenize(source).getTokens());
    }

    /** 解析并断言无错误 */
    private Program parse(String source) {
        ParseResult result = parseResult(source);
        assertTrue(result.getErrors().isEmpty(), "Unexpected parse errors: " + result.getErrors());
        return result.getProgram();
    }

    /** 解析单个场景中的语句 */
    private List<Statement> statements(String body) {
        Program program = parse("FEATURE F {\n SCENARIO S {\n" + body + "\n }\n}");
        return program.getFeatures().get(0).getScenarios().get(0).getStatements();
    }

    private Statement statement(String body) {
        List<Statement> list = statements(body);
        assertEquals(1, list.size());
        return list.get(0);
    }

    private Selector fieldSelector(String field) {
        Program program = parse("PAGE TestPage { " + field + " }");
        return program.getPages().get(0).getFields().get(0).getSelector();
    }

    // ================================================================
    // 声明
    // ================================================================

    @Nested
    @DisplayName("顶层声明")
    class DeclarationTests {

        @Test
        @DisplayName("PAGE 字段与变量")
        void testPage() {
            Program program = parse("PAGE LoginPage {\n"
                    + "  FIELD emailInput = testid \"email\"\n"
                    + "  FIELD submitBtn = role \"button\" name \"Sign in\"\n"
                    + "  TEXT greeting = \"Welcome\"\n"
                    + "}");
            PageDecl page = program.findPage("LoginPage");
            assertNotNull(page);
            assertEquals(2, page.getFields().size());
            assertEquals(SelectorType.TESTID, page.findField("emailInput").getSelector().getSelectorType());
            Selector submit = page.findField("submitBtn").getSelector();
            assertEquals(SelectorType.ROLE, submit.getSelectorType());
            assertEquals("button", submit.getValue());
            assertEquals("Sign in", submit.getNameParam());
            assertEquals(VariableType.TEXT, page.findVariable("greeting").getVarType());
        }

        @Test
        @DisplayName("PAGEACTIONS 重载、参数与返回类型")
        void testPageActions() {
            Program program = parse("PAGE LoginPage { FIELD btn = \"#go\" }\n"
                    + "PAGEACTIONS LoginActions FOR LoginPage {\n"
                    + "  login { CLICK btn }\n"
                    + "  login WITH user, pass { FILL btn WITH user }\n"
                    + "  isReady RETURNS FLAG { RETURN VISIBLE OF btn }\n"
                    + "}");
            PageActionsDecl block = program.findPageActions("LoginActions");
            assertEquals("LoginPage", block.getForPage());
            assertEquals(2, block.findOverloads("login").size());
            ActionDecl withArgs = block.findOverloads("login").get(1);
            assertEquals(List.of("user", "pass"), withArgs.getParameters());
            ActionDecl ready = block.findOverloads("isReady").get(0);
            assertEquals(VariableType.FLAG, ready.getReturnType());
            ReturnStmt ret = (ReturnStmt) ready.getStatements().get(0);
            assertEquals(ReturnStmt.ReturnKind.VISIBLE, ret.getKind());
        }

        @Test
        @DisplayName("FEATURE 的 USE、钩子与带标签的场景")
        void testFeature() {
            Program program = parse("FEATURE \"Checkout flow\" {\n"
                    + "  USE CartPage, CartActions\n"
                    + "  BEFORE EACH { REFRESH }\n"
                    + "  AFTER ALL { LOG \"done\" }\n"
                    + "  SCENARIO PayWithCard @smoke @regression { REFRESH }\n"
                    + "}");
            FeatureDecl feature = program.getFeatures().get(0);
            assertEquals("Checkout flow", feature.getName());
            assertEquals(List.of("CartPage", "CartActions"), feature.getUses());
            assertEquals(HookDecl.HookType.BEFORE_EACH, feature.getHooks().get(0).getHookType());
            assertEquals(HookDecl.HookType.AFTER_ALL, feature.getHooks().get(1).getHookType());
            ScenarioDecl scenario = feature.getScenarios().get(0);
            assertEquals("PayWithCard", scenario.getName());
            assertEquals(List.of("smoke", "regression"), scenario.getTags());
        }
    }

    // ================================================================
    // 选择器
    // ================================================================

    @Nested
    @DisplayName("选择器与修饰符")
    class SelectorTests {

        @Test
        @DisplayName("裸字符串按 CSS 或文本推断")
        void testBareStringDetection() {
            assertEquals(SelectorType.CSS, fieldSelector("FIELD a = \"#login\"").getSelectorType());
            assertEquals(SelectorType.CSS, fieldSelector("FIELD a = \"div > span\"").getSelectorType());
            assertEquals(SelectorType.CSS, fieldSelector("FIELD a = \"input[name=q]\"").getSelectorType());
            assertEquals(SelectorType.TEXT, fieldSelector("FIELD a = \"Sign in\"").getSelectorType());
        }

        @Test
        @DisplayName("修饰符按书写顺序保存")
        void testModifierOrder() {
            Selector sel = fieldSelector("FIELD radio = css \".radio\" WITH TEXT \"Person\" FIRST");
            assertEquals(2, sel.getModifiers().size());
            assertTrue(sel.getModifiers().get(0) instanceof WithTextModifier);
            assertEquals("Person", ((WithTextModifier) sel.getModifiers().get(0)).getText());
            assertTrue(sel.getModifiers().get(1) instanceof FirstModifier);
        }

        @Test
        @DisplayName("NTH 与 HAS 子选择器")
        void testNthAndHas() {
            Selector nth = fieldSelector("FIELD item = css \".item\" NTH 2");
            assertEquals(2, ((NthModifier) nth.getModifiers().get(0)).getIndex());

            Selector has = fieldSelector("FIELD card = css \".card\" HAS role \"heading\" name \"Product 2\"");
            Selector nested = ((HasModifier) has.getModifiers().get(0)).getSelector();
            assertEquals(SelectorType.ROLE, nested.getSelectorType());
            assertEquals("Product 2", nested.getNameParam());
        }

        @Test
        @DisplayName("无修饰符时列表为空")
        void testNoModifiers() {
            assertFalse(fieldSelector("FIELD btn = css \".btn\"").hasModifiers());
        }

        @Test
        @DisplayName("VERIFY 中的 HAS TEXT 是断言而不是修饰符")
        void testHasTextInVerify() {
            Statement stmt = statement("VERIFY css \".title\" HAS TEXT \"Hello\"");
            assertTrue(stmt instanceof VerifyPropertyStmt);
            VerifyPropertyStmt verify = (VerifyPropertyStmt) stmt;
            assertEquals(VerifyPropertyStmt.Property.TEXT, verify.getProperty());
            assertFalse(verify.getTarget().getSelector().hasModifiers());
        }
    }

    // ================================================================
    // 语句
    // ================================================================

    @Nested
    @DisplayName("语句")
    class StatementTests {

        @Test
        @DisplayName("点击变体")
        void testClickVariants() {
            List<Statement> list = statements("CLICK P.a\nRIGHT CLICK P.a\nDOUBLE CLICK P.a\nFORCE CLICK P.a");
            assertEquals(ClickStmt.ClickType.NORMAL, ((ClickStmt) list.get(0)).getClickType());
            assertEquals(ClickStmt.ClickType.RIGHT, ((ClickStmt) list.get(1)).getClickType());
            assertEquals(ClickStmt.ClickType.DOUBLE, ((ClickStmt) list.get(2)).getClickType());
            assertEquals(ClickStmt.ClickType.FORCE, ((ClickStmt) list.get(3)).getClickType());
        }

        @Test
        @DisplayName("FILL 使用环境变量")
        void testFillWithEnv() {
            FillStmt fill = (FillStmt) statement("FILL LoginPage.email WITH {{userEmail}}");
            assertEquals("LoginPage", fill.getTarget().getPageName());
            assertEquals("email", fill.getTarget().getFieldName());
            assertTrue(fill.getValue() instanceof EnvVarRef);
        }

        @Test
        @DisplayName("WAIT 的各种形式")
        void testWait() {
            List<Statement> list = statements("WAIT 2 SECONDS\nWAIT 300 MILLISECONDS\nWAIT\n"
                    + "WAIT FOR NAVIGATION\nWAIT FOR URL CONTAINS \"/home\"\nWAIT FOR P.spinner");
            assertFalse(((WaitStmt) list.get(0)).isMilliseconds());
            assertTrue(((WaitStmt) list.get(1)).isMilliseconds());
            assertTrue(list.get(2) instanceof WaitForNetworkIdleStmt);
            assertTrue(list.get(3) instanceof WaitForNavigationStmt);
            assertEquals(TextMatch.CONTAINS, ((WaitForUrlStmt) list.get(4)).getMatch());
            assertTrue(list.get(5) instanceof WaitForElementStmt);
        }

        @Test
        @DisplayName("VERIFY 状态、否定与 URL")
        void testVerify() {
            List<Statement> list = statements("VERIFY P.banner IS NOT VISIBLE\n"
                    + "VERIFY URL MATCHES \"/orders/\\\\d+\"\n"
                    + "VERIFY P.list NOT CONTAINS \"Expired\"");
            VerifyStateStmt state = (VerifyStateStmt) list.get(0);
            assertEquals(ElementState.VISIBLE, state.getState());
            assertTrue(state.isNegated());
            assertEquals(TextMatch.MATCHES, ((VerifyUrlStmt) list.get(1)).getMatch());
            assertTrue(((VerifyContainsStmt) list.get(2)).isNegated());
        }

        @Test
        @DisplayName("视觉断言的预设与覆盖参数")
        void testVerifyScreenshot() {
            VerifyScreenshotStmt stmt = (VerifyScreenshotStmt) statement(
                    "VERIFY P.chart MATCHES SCREENSHOT AS \"chart\" WITH STRICT THRESHOLD 0.3");
            assertEquals("chart", stmt.getName());
            assertNotNull(stmt.getTarget());
            assertEquals(0.3, stmt.getSettings().getThreshold(), 1e-9);
            assertNotNull(stmt.getSettings().getPreset());
        }

        @Test
        @DisplayName("IF / ELSE IF / ELSE 链")
        void testIfChain() {
            IfStmt stmt = (IfStmt) statement("IF P.a IS VISIBLE { CLICK P.a } ELSE IF total > 2 { REFRESH } ELSE { LOG \"x\" }");
            assertEquals(1, stmt.getThenBranch().size());
            assertEquals(1, stmt.getElseBranch().size());
            IfStmt nested = (IfStmt) stmt.getElseBranch().get(0);
            assertEquals(1, nested.getElseBranch().size());
        }

        @Test
        @DisplayName("PERFORM 限定调用与赋值")
        void testPerform() {
            List<Statement> list = statements("PERFORM LoginActions.login WITH \"a\", \"b\"\n"
                    + "FLAG ok = PERFORM LoginActions.isReady");
            PerformStmt perform = (PerformStmt) list.get(0);
            assertEquals("LoginActions", perform.getBlockName());
            assertEquals("login", perform.getActionName());
            assertEquals(2, perform.getArguments().size());
            PerformAssignStmt assign = (PerformAssignStmt) list.get(1);
            assertEquals("ok", assign.getName());
            assertEquals(VariableType.FLAG, assign.getVarType());
        }

        @Test
        @DisplayName("数据查询：ROW / ROWS / COUNT")
        void testDataQueries() {
            List<Statement> list = statements(
                    "ROW user = FIRST Users WHERE role = \"admin\" AND active = true\n"
                    + "ROWS orders = Shop.Orders ORDER BY total DESC LIMIT 5 OFFSET 10\n"
                    + "NUMBER total = COUNT Users WHERE age >= 18");
            RowStmt row = (RowStmt) list.get(0);
            assertEquals(RowPosition.FIRST, row.getPosition());
            assertEquals("Users", row.getTable().getQualifiedName());
            assertEquals(QueryLogical.Kind.AND, ((QueryLogical) row.getWhere()).getKind());

            RowsStmt rows = (RowsStmt) list.get(1);
            assertEquals("Shop.Orders", rows.getTable().getQualifiedName());
            assertTrue(rows.getOrderBy().get(0).isDescending());
            assertEquals(Integer.valueOf(5), rows.getLimit());
            assertEquals(Integer.valueOf(10), rows.getOffset());

            CountStmt count = (CountStmt) list.get(2);
            assertEquals("total", count.getVariable());
            assertEquals("age", ((QueryComparison) count.getWhere()).getColumnName());
        }

        @Test
        @DisplayName("标签与窗口切换")
        void testSwitch() {
            List<Statement> list = statements("SWITCH TO NEW TAB \"https://example.com\"\n"
                    + "SWITCH TO TAB 2\nSWITCH TO FRAME \"#payment\"\nSWITCH TO MAIN FRAME\nCLOSE TAB");
            assertNotNull(((SwitchToNewTabStmt) list.get(0)).getUrl());
            assertTrue(list.get(1) instanceof SwitchToTabStmt);
            assertTrue(list.get(2) instanceof SwitchToFrameStmt);
            assertTrue(list.get(3) instanceof SwitchToMainFrameStmt);
            assertTrue(list.get(4) instanceof CloseTabStmt);
        }

        @Test
        @DisplayName("TAKE SCREENSHOT 后的裸字符串是文件名")
        void testTakeScreenshotFileName() {
            TakeScreenshotStmt stmt = (TakeScreenshotStmt) statement("TAKE SCREENSHOT \"after-login\"");
            assertNull(stmt.getTarget());
            assertEquals("after-login", stmt.getFileName());
        }
    }

    // ================================================================
    // 错误恢复
    // ================================================================

    @Nested
    @DisplayName("错误恢复")
    class RecoveryTests {

        @Test
        @DisplayName("缺少右花括号时保留已解析内容并继续解析下一个声明")
        void testMissingBrace() {
            ParseResult result = parseResult("PAGE LoginPage {\n"
                    + "  FIELD submitBtn = \"#submit\"\n"
                    + "\n"
                    + "FEATURE Login {\n"
                    + "  USE LoginPage\n"
                    + "  SCENARIO Submit { CLICK LoginPage.submitBtn }\n"
                    + "}");
            assertEquals(1, result.getErrors().size());
            assertTrue(result.getErrors().get(0).getMessage().startsWith("Expected '}' to close PAGE 'LoginPage'"));
            Program program = result.getProgram();
            assertNotNull(program.findPage("LoginPage").findField("submitBtn"));
            assertEquals(1, program.getFeatures().size());
            assertEquals(1, program.getFeatures().get(0).getScenarios().get(0).getStatements().size());
        }

        @Test
        @DisplayName("坏语句只影响自身，后续语句照常解析")
        void testStatementRecovery() {
            ParseResult result = parseResult("FEATURE F {\n"
                    + "  SCENARIO S {\n"
                    + "    CLICK\n"
                    + "    FILL P.a WITH \"x\"\n"
                    + "  }\n"
                    + "}");
            assertEquals(1, result.getErrors().size());
            assertEquals(4, result.getErrors().get(0).getLine());
            List<Statement> body = result.getProgram().getFeatures().get(0).getScenarios().get(0).getStatements();
            assertEquals(1, body.size());
            assertTrue(body.get(0) instanceof FillStmt);
        }

        @Test
        @DisplayName("多个独立错误全部报告")
        void testMultipleErrors() {
            ParseResult result = parseResult("PAGE A { FIELD = \"#x\" }\n"
                    + "BOGUS\n"
                    + "PAGE B { FIELD ok = \"#y\" }");
            assertEquals(2, result.getErrors().size());
            assertNotNull(result.getProgram().findPage("B"));
        }
    }
}
