package com.verolang.compiler.analysis;

import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.cond.Condition;
import com.verolang.compiler.ast.decl.FeatureDecl;
import com.verolang.compiler.ast.decl.HookDecl;
import com.verolang.compiler.ast.decl.PageActionsDecl;
import com.verolang.compiler.ast.decl.PageDecl;
import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.ast.decl.ScenarioDecl;
import com.verolang.compiler.ast.query.QueryCondition;
import com.verolang.compiler.ast.query.TableRef;
import com.verolang.compiler.ast.stmt.CountStmt;
import com.verolang.compiler.ast.stmt.IfStmt;
import com.verolang.compiler.ast.stmt.Statement;
import com.verolang.compiler.lexer.Lexer;
import com.verolang.compiler.parser.ParseResult;
import com.verolang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

/**
 * VeroValidator 单元测试
 */
class VeroValidatorTest {

    private static final SourceLocation LOC = new SourceLocation(1, 1);

    private static final String LOGIN_PAGE = "PAGE LoginPage {\n"
            + "  FIELD emailInput = \"#email\"\n"
            + "  FIELD submitBtn = role \"button\" name \"Sign in\"\n"
            + "  TEXT greeting = \"Welcome\"\n"
            + "}\n";

    private static final String LOGIN_ACTIONS = "PAGEACTIONS LoginActions FOR LoginPage {\n"
            + "  login { CLICK submitBtn }\n"
            + "  login WITH user, pass { FILL emailInput WITH user }\n"
            + "}\n";

    private ValidationResult validate(String source) {
        ParseResult parsed = Parser.parse(Lexer.tokenize(source).getTokens());
        assertTrue(parsed.getErrors().isEmpty(), "Unexpected parse errors: " + parsed.getErrors());
        return VeroValidator.validate(parsed.getProgram());
    }

    /** 在使用 LoginPage 与 LoginActions 的场景中校验语句 */
    private ValidationResult validateScenario(String body) {
        return validate(LOGIN_PAGE + LOGIN_ACTIONS
                + "FEATURE Login {\n  USE LoginPage, LoginActions\n  SCENARIO Check {\n" + body + "\n  }\n}");
    }

    // ================================================================
    // 声明
    // ================================================================

    @Nested
    @DisplayName("声明检查")
    class DeclarationTests {

        @Test
        @DisplayName("合法程序没有错误")
        void testCleanProgram() {
            ValidationResult result = validateScenario("FILL LoginPage.emailInput WITH \"a@b.c\"\n"
                    + "PERFORM LoginActions.login WITH \"a\", \"b\"\n"
                    + "VERIFY LoginPage.greeting EQUALS \"Welcome\"");
            assertFalse(result.hasErrors(), "Unexpected: " + result.getDiagnostics());
        }

        @Test
        @DisplayName("重复页面与重复成员")
        void testDuplicates() {
            ValidationResult result = validate("PAGE A { FIELD x = \"#x\"\n FIELD x = \"#y\" }\nPAGE A { }");
            assertTrue(result.hasCode(DiagnosticCodes.DUPLICATE_PAGE));
            assertTrue(result.hasCode(DiagnosticCodes.DUPLICATE_MEMBER));
        }

        @Test
        @DisplayName("同一参数个数的重载只能有一个")
        void testDuplicateOverload() {
            ValidationResult result = validate(LOGIN_PAGE + "PAGEACTIONS LoginActions FOR LoginPage {\n"
                    + "  login WITH a { CLICK submitBtn }\n"
                    + "  login WITH b { CLICK submitBtn }\n"
                    + "}");
            assertTrue(result.hasCode(DiagnosticCodes.DUPLICATE_OVERLOAD));
        }

        @Test
        @DisplayName("FOR 引用未定义页面")
        void testUndefinedForPage() {
            ValidationResult result = validate("PAGEACTIONS Ghost FOR Nowhere { go { REFRESH } }");
            assertTrue(result.hasCode(DiagnosticCodes.UNDEFINED_FOR_PAGE));
        }

        @Test
        @DisplayName("命名约定只产生警告")
        void testNamingConvention() {
            ValidationResult result = validate("PAGE loginPage { FIELD SubmitBtn = \"#go\" }");
            assertFalse(result.hasErrors());
            assertEquals(2, result.getWarnings().size());
            assertTrue(result.hasCode(DiagnosticCodes.NAMING_CONVENTION));
        }

        @Test
        @DisplayName("重复场景名是警告")
        void testDuplicateScenario() {
            ValidationResult result = validate("FEATURE F {\n SCENARIO A { REFRESH }\n SCENARIO A { REFRESH }\n}");
            assertFalse(result.hasErrors());
            assertTrue(result.hasCode(DiagnosticCodes.DUPLICATE_SCENARIO));
        }
    }

    // ================================================================
    // 选择器
    // ================================================================

    @Nested
    @DisplayName("选择器检查")
    class SelectorTests {

        @Test
        @DisplayName("NTH 0 合法，负数非法")
        void testNthIndex() {
            assertFalse(validate("PAGE P { FIELD a = css \".a\" NTH 0 }").hasErrors());
            ValidationResult result = validate("PAGE P { FIELD a = css \".a\" NTH -1 }");
            assertTrue(result.hasCode(DiagnosticCodes.INVALID_MODIFIER));
            assertTrue(result.getErrors().get(0).getMessage().contains("NTH"));
        }

        @Test
        @DisplayName("WITH TEXT 不能为空")
        void testEmptyWithText() {
            ValidationResult result = validate("PAGE P { FIELD a = css \".a\" WITH TEXT \"\" }");
            assertTrue(result.getErrors().get(0).getMessage().contains("WITH TEXT"));
        }

        @Test
        @DisplayName("空选择器值")
        void testEmptySelector() {
            assertTrue(validate("PAGE P { FIELD a = css \"\" }").hasCode(DiagnosticCodes.INVALID_SELECTOR));
        }

        @Test
        @DisplayName("HAS 子选择器合法")
        void testValidHas() {
            assertFalse(validate("PAGE P { FIELD card = css \".card\" HAS css \".title\" }").hasErrors());
        }

        @Test
        @DisplayName("NAME 只对 role 选择器有意义")
        void testNameOnNonRole() {
            ValidationResult result = validate("PAGE P { FIELD a = css \".a\" name \"x\" }");
            assertFalse(result.hasErrors());
            assertTrue(result.hasCode(DiagnosticCodes.NAME_ON_NON_ROLE));
        }
    }

    // ================================================================
    // 引用
    // ================================================================

    @Nested
    @DisplayName("引用检查")
    class ReferenceTests {

        @Test
        @DisplayName("未在 USE 中列出的页面")
        void testPageNotInUse() {
            ValidationResult result = validate(LOGIN_PAGE
                    + "FEATURE F {\n SCENARIO S { CLICK LoginPage.submitBtn }\n}");
            assertTrue(result.hasCode(DiagnosticCodes.PAGE_NOT_IN_USE));
        }

        @Test
        @DisplayName("未定义的页面与字段")
        void testUndefinedPageAndField() {
            ValidationResult result = validateScenario("CLICK Missing.btn\nCLICK LoginPage.nope");
            assertTrue(result.hasCode(DiagnosticCodes.UNDEFINED_PAGE));
            assertTrue(result.hasCode(DiagnosticCodes.UNDEFINED_FIELD));
            assertEquals(2, result.getErrors().size());
        }

        @Test
        @DisplayName("未定义的动作与参数个数不匹配")
        void testPerformChecks() {
            ValidationResult result = validateScenario("PERFORM LoginActions.logout\n"
                    + "PERFORM LoginActions.login WITH \"only-one\"");
            assertTrue(result.hasCode(DiagnosticCodes.UNDEFINED_ACTION));
            assertTrue(result.hasCode(DiagnosticCodes.ARITY_MISMATCH));
        }

        @Test
        @DisplayName("未限定的 PERFORM 在 USE 的 PageActions 中查找")
        void testUnqualifiedPerform() {
            assertFalse(validateScenario("PERFORM login").hasErrors());
            assertTrue(validateScenario("PERFORM unknownAction").hasCode(DiagnosticCodes.UNDEFINED_ACTION));
        }

        @Test
        @DisplayName("PageActions 中裸名称解析为 FOR 页面的字段")
        void testBareNameInActions() {
            ValidationResult ok = validate(LOGIN_PAGE + LOGIN_ACTIONS);
            assertFalse(ok.hasErrors(), "Unexpected: " + ok.getDiagnostics());
            ValidationResult bad = validate(LOGIN_PAGE
                    + "PAGEACTIONS LoginActions FOR LoginPage { go { CLICK missingBtn } }");
            assertTrue(bad.hasCode(DiagnosticCodes.UNDEFINED_FIELD));
        }

        @Test
        @DisplayName("局部变量与数据行列访问")
        void testLocalsAndRows() {
            ValidationResult result = validateScenario("ROW user = FIRST Users\n"
                    + "FILL LoginPage.emailInput WITH user.email\n"
                    + "TEXT greetingCopy = \"hi\"\n"
                    + "LOG greetingCopy");
            assertFalse(result.hasErrors(), "Unexpected: " + result.getDiagnostics());
            assertTrue(result.getWarnings().isEmpty());
        }

        @Test
        @DisplayName("未声明的变量产生警告")
        void testPossiblyUndefined() {
            ValidationResult result = validateScenario("LOG mystery");
            assertFalse(result.hasErrors());
            assertTrue(result.hasCode(DiagnosticCodes.POSSIBLY_UNDEFINED));
        }

        @Test
        @DisplayName("FOR EACH 的集合未定义时警告，循环变量在循环体内可见")
        void testForEach() {
            ValidationResult result = validateScenario("FOR EACH item IN things { LOG item }");
            assertTrue(result.hasCode(DiagnosticCodes.UNDEFINED_COLLECTION));
            assertFalse(result.hasCode(DiagnosticCodes.POSSIBLY_UNDEFINED));
        }

        @Test
        @DisplayName("块内变量在块外不可见")
        void testBlockScope() {
            ValidationResult result = validateScenario("IF LoginPage.submitBtn IS VISIBLE { TEXT inner = \"x\" }\nLOG inner");
            assertTrue(result.hasCode(DiagnosticCodes.POSSIBLY_UNDEFINED));
        }

        @Test
        @DisplayName("诊断携带行号")
        void testDiagnosticLocation() {
            ValidationResult result = validate(LOGIN_PAGE
                    + "FEATURE F {\n USE LoginPage\n SCENARIO S {\n  CLICK LoginPage.ghost\n }\n}");
            SemanticDiagnostic error = result.getErrors().get(0);
            assertEquals(DiagnosticCodes.UNDEFINED_FIELD, error.getCode());
            assertEquals(9, error.getLine());
        }
    }

    // ================================================================
    // 条件分派
    // ================================================================

    @Nested
    @DisplayName("条件分派")
    class ConditionDispatchTests {

        private Program scenario(Statement statement) {
            ScenarioDecl scenario = new ScenarioDecl(LOC, "Check", Collections.<String>emptyList(),
                    Collections.singletonList(statement));
            FeatureDecl feature = new FeatureDecl(LOC, "Login", Collections.<String>emptyList(),
                    Collections.<HookDecl>emptyList(), Collections.singletonList(scenario));
            return new Program(LOC, Collections.<PageDecl>emptyList(), Collections.<PageActionsDecl>emptyList(),
                    Collections.singletonList(feature));
        }

        @Test
        @DisplayName("WHERE 中的 IS EMPTY 与逻辑组合都能校验")
        void testKnownQueryConditions() {
            ValidationResult result = validateScenario(
                    "NUMBER total = COUNT Users WHERE email IS NOT EMPTY AND NOT (age < 18 OR name CONTAINS \"x\")");
            assertFalse(result.hasErrors(), result.getDiagnostics().toString());
        }

        @Test
        @DisplayName("未知的 IF 条件类型不会被静默跳过")
        void testUnknownCondition() {
            Condition unknown = new Condition(LOC) { };
            IfStmt stmt = new IfStmt(LOC, unknown, Collections.<Statement>emptyList(), null);
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> VeroValidator.validate(scenario(stmt)));
            assertTrue(e.getMessage().startsWith("Unknown condition"));
        }

        @Test
        @DisplayName("未知的 WHERE 条件类型不会被静默跳过")
        void testUnknownQueryCondition() {
            QueryCondition unknown = new QueryCondition(LOC) { };
            CountStmt stmt = new CountStmt(LOC, "total", new TableRef(null, "Users"), unknown);
            IllegalStateException e = assertThrows(IllegalStateException.class,
                    () -> VeroValidator.validate(scenario(stmt)));
            assertTrue(e.getMessage().startsWith("Unknown query condition"));
        }
    }
}
