package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.lexer.Lexer;
import com.verolang.compiler.parser.ParseResult;
import com.verolang.compiler.parser.Parser;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Transpiler 端到端生成测试
 */
class TranspilerTest {

    private static final String PAGES = "PAGE LoginPage {\n"
            + "  FIELD emailInput = \"#email\"\n"
            + "  FIELD submitBtn = role \"button\" name \"Sign in\"\n"
            + "}\n"
            + "PAGEACTIONS LoginActions FOR LoginPage {\n"
            + "  login { CLICK submitBtn }\n"
            + "  login WITH user, pass, remember {\n"
            + "    FILL emailInput WITH user\n"
            + "    CLICK submitBtn\n"
            + "  }\n"
            + "}\n";

    private static Program parse(String source) {
        ParseResult result = Parser.parse(Lexer.tokenize(source).getTokens());
        assertTrue(result.getErrors().isEmpty(), "Unexpected parse errors: " + result.getErrors());
        return result.getProgram();
    }

    private static String feature(String header, String body) {
        return PAGES + "FEATURE Login {\n  USE LoginPage, LoginActions\n  SCENARIO " + header + " {\n"
                + body + "\n  }\n}\n";
    }

    private static TranspileResult transpile(String source) {
        return new Transpiler().transpile(parse(source));
    }

    private static TranspileResult transpile(String source, TranspileOptions options) {
        return Transpiler.transpile(parse(source), options);
    }

    // ================================================================
    // 页面对象
    // ================================================================

    @Nested
    @DisplayName("页面对象")
    class PageTests {

        @Test
        @DisplayName("字段生成 readonly Locator 并在构造器中赋值")
        void testPageClass() {
            String expected = "import { Page, Locator } from '@playwright/test';\n"
                    + "\n"
                    + "export class LoginPage {\n"
                    + "  readonly page: Page;\n"
                    + "  readonly emailInput: Locator;\n"
                    + "  readonly submitBtn: Locator;\n"
                    + "\n"
                    + "  constructor(page: Page) {\n"
                    + "    this.page = page;\n"
                    + "    this.emailInput = page.locator('#email');\n"
                    + "    this.submitBtn = page.getByRole('button', { name: 'Sign in', exact: true });\n"
                    + "  }\n"
                    + "}\n";
            assertEquals(expected, transpile(PAGES).getPages().get("LoginPage"));
        }

        @Test
        @DisplayName("页面变量含环境变量时声明 __env__")
        void testPageVariableWithEnv() {
            String code = transpile("PAGE Home {\n  TEXT greeting = \"Hi {{user}}\"\n}").getPages().get("Home");
            assertTrue(code.contains("greeting: string;"));
            assertTrue(code.contains(TsSyntax.ENV_DECLARATION));
            assertTrue(code.contains("this.greeting = `Hi ${__env__['user']}`;"), code);
        }
    }

    // ================================================================
    // PageActions
    // ================================================================

    @Nested
    @DisplayName("PageActions")
    class ActionsTests {

        @Test
        @DisplayName("重载生成按参数个数分派的单一方法")
        void testDispatcher() {
            String code = transpile(PAGES).getPageActions().get("LoginActions");
            assertTrue(code.startsWith("import { Page, expect } from '@playwright/test';\n"
                    + "import { LoginPage } from '../pages/LoginPage';\n"), code);
            String expected = "  async login(...args: any[]): Promise<any> {\n"
                    + "    switch (args.length) {\n"
                    + "      case 0: {\n"
                    + "        await this.loginPage.submitBtn.click();\n"
                    + "        return;\n"
                    + "      }\n"
                    + "      case 3: {\n"
                    + "        const [user, pass, remember] = args;\n"
                    + "        await this.loginPage.emailInput.fill(String(user));\n"
                    + "        await this.loginPage.submitBtn.click();\n"
                    + "        return;\n"
                    + "      }\n"
                    + "      default:\n"
                    + "        throw new Error(`LoginActions.login does not accept ${args.length} argument(s)`);\n"
                    + "    }\n"
                    + "  }\n"
                    + "}\n";
            assertTrue(code.endsWith(expected), code);
        }

        @Test
        @DisplayName("单一定义生成普通方法，带返回类型")
        void testPlainMethod() {
            String code = transpile(PAGES + "PAGEACTIONS Probe FOR LoginPage {\n"
                    + "  isReady RETURNS FLAG { RETURN VISIBLE OF submitBtn }\n"
                    + "}").getPageActions().get("Probe");
            assertTrue(code.contains("  async isReady(): Promise<boolean> {\n"
                    + "    return await this.loginPage.submitBtn.isVisible();\n"
                    + "  }\n"), code);
        }

        @Test
        @DisplayName("调用其他 PageActions 时导入并实例化")
        void testCrossBlockPerform() {
            String code = transpile(PAGES + "PAGEACTIONS Checkout FOR LoginPage {\n"
                    + "  pay { PERFORM LoginActions.login }\n"
                    + "}").getPageActions().get("Checkout");
            assertTrue(code.contains("import { LoginActions } from './LoginActions';"));
            assertTrue(code.contains("await new LoginActions(this.page).login();"));
        }

        @Test
        @DisplayName("同一参数个数的重复重载无法生成")
        void testDuplicateArity() {
            GenerationException e = assertThrows(GenerationException.class, () -> transpile(PAGES
                    + "PAGEACTIONS Twice FOR LoginPage {\n  go WITH a { REFRESH }\n  go WITH b { REFRESH }\n}"));
            assertTrue(e.getMessage().startsWith("Duplicate overload 'Twice.go' with 1 parameter(s)"));
        }
    }

    // ================================================================
    // Feature
    // ================================================================

    @Nested
    @DisplayName("Feature")
    class FeatureTests {

        @Test
        @DisplayName("场景包装 test.step，页面对象在 beforeEach 中实例化")
        void testScenario() {
            String code = transpile(feature("SignIn @smoke",
                    "PERFORM LoginActions.login WITH \"a\", \"b\", TRUE\nVERIFY LoginPage.submitBtn IS HIDDEN"))
                    .getTests().get("Login");
            assertTrue(code.startsWith("import { test, expect } from '@playwright/test';\n"
                    + "import { LoginPage } from '../pages/LoginPage';\n"
                    + "import { LoginActions } from '../pageActions/LoginActions';\n"
                    + "\n"
                    + "test.describe('Login', () => {\n"
                    + "  let loginPage: LoginPage;\n"
                    + "  let loginActions: LoginActions;\n"
                    + "\n"
                    + "  test.beforeEach(async ({ page }) => {\n"
                    + "    loginPage = new LoginPage(page);\n"
                    + "    loginActions = new LoginActions(page);\n"
                    + "  });\n"), code);
            assertTrue(code.contains("  test('SignIn', { tag: ['@smoke'] }, async ({ page }, testInfo) => {\n"
                    + "    await test.step('Perform LoginActions.login', async () => { "
                    + "await loginActions.login('a', 'b', true); });\n"
                    + "    await test.step('Verify LoginPage.submitBtn is hidden', async () => { "
                    + "await expect(loginPage.submitBtn).toBeHidden(); });\n"), code);
            assertTrue(code.endsWith("  });\n});\n"));
        }

        @Test
        @DisplayName("参数个数不匹配的 PERFORM 无法生成")
        void testArityMismatch() {
            GenerationException e = assertThrows(GenerationException.class,
                    () -> transpile(feature("Bad", "PERFORM LoginActions.login WITH \"x\"")));
            assertTrue(e.getMessage().startsWith(
                    "No overload of 'LoginActions.login' takes 1 argument(s); declared arities: [0, 3]"));
            assertEquals(15, e.getLine());
        }

        @Test
        @DisplayName("特殊标签映射为 only/fixme/skip/slow")
        void testTagModifiers() {
            String code = transpile(feature("Later @skip @slow", "REFRESH")).getTests().get("Login");
            assertTrue(code.contains("test.skip('Later', { tag: ['@skip', '@slow'] }, async ({ page }, testInfo) => {\n"
                    + "    test.slow();\n"), code);

            String focused = transpile(feature("Now @skip @only", "REFRESH")).getTests().get("Login");
            assertTrue(focused.contains("test.only('Now'"));
        }

        @Test
        @DisplayName("证据截图可关闭")
        void testEvidence() {
            assertTrue(transpile(feature("S", "REFRESH")).getTests().get("Login")
                    .contains("await test.step('Capture Evidence Screenshot', async () => {"));
            TranspileOptions options = new TranspileOptions();
            options.setCaptureEvidence(false);
            assertFalse(transpile(feature("S", "REFRESH"), options).getTests().get("Login")
                    .contains("Capture Evidence Screenshot"));
        }

        @Test
        @DisplayName("baseUrl 只作用于以 / 开头的字面量")
        void testBaseUrl() {
            TranspileOptions options = new TranspileOptions();
            options.setBaseUrl("https://app.test/");
            String code = transpile(feature("S", "OPEN \"/login\"\nOPEN \"https://other.test\""), options)
                    .getTests().get("Login");
            assertTrue(code.contains("await page.goto('https://app.test/login');"), code);
            assertTrue(code.contains("await page.goto('https://other.test');"), code);
        }

        @Test
        @DisplayName("等待秒数换算为毫秒，变量在运行期换算")
        void testWait() {
            String code = transpile(feature("S", "NUMBER pause = 3\nWAIT 2 SECONDS\nWAIT pause SECONDS"))
                    .getTests().get("Login");
            assertTrue(code.contains("    const pause: number = 3;\n"), code);
            assertTrue(code.contains("await page.waitForTimeout(2000);"));
            assertTrue(code.contains("await page.waitForTimeout(Number(pause) * 1000);"));
        }

        @Test
        @DisplayName("未知的 USE 条目")
        void testUnknownUse() {
            assertThrows(GenerationException.class,
                    () -> transpile("FEATURE F {\n  USE Ghost\n  SCENARIO S { REFRESH }\n}"));
        }

        @Test
        @DisplayName("相同输入生成逐字节相同的输出")
        void testDeterministic() {
            String source = feature("SignIn @smoke @auth", "PERFORM LoginActions.login\nROW u = Users");
            TranspileResult first = transpile(source);
            TranspileResult second = transpile(source);
            assertEquals(first.getPages(), second.getPages());
            assertEquals(first.getPageActions(), second.getPageActions());
            assertEquals(first.getTests(), second.getTests());
        }
    }

    // ================================================================
    // 数据查询
    // ================================================================

    @Nested
    @DisplayName("数据查询")
    class DataTests {

        @Test
        @DisplayName("ROW 带条件时使用 find，并导入运行时")
        void testRowFind() {
            String code = transpile(feature("S", "ROW admin = Users WHERE status = \"active\""))
                    .getTests().get("Login");
            assertTrue(code.contains("import { Data, veroData } from '../runtime/veroData';"));
            assertTrue(code.contains(TsSyntax.ENV_DECLARATION));
            assertTrue(code.contains("    await veroData.ensureTable('Users');\n"
                    + "    const admin = veroData.resolveReferences(Data.Users.find((row) => "
                    + "String(row['status']) === String('active')), __env__);\n"), code);
        }

        @Test
        @DisplayName("ROWS 排序后分页")
        void testRowsSortAndLimit() {
            String code = transpile(feature("S", "ROWS recent = Orders ORDER BY created DESC LIMIT 5 OFFSET 10"))
                    .getTests().get("Login");
            assertTrue(code.contains("const recent = [...Data.Orders].sort((a, b) => "
                    + "String(b['created'] ?? '').localeCompare(String(a['created'] ?? ''), undefined, "
                    + "{ numeric: true })).slice(10, 15).map((row) => veroData.resolveReferences(row, __env__));"),
                    code);
        }

        @Test
        @DisplayName("同一表只确保加载一次；COUNT 生成数量")
        void testCountAndEnsureOnce() {
            String code = transpile(feature("S", "ROW newest = LAST Orders\nNUMBER total = COUNT Orders"))
                    .getTests().get("Login");
            assertEquals(code.indexOf("ensureTable('Orders')"), code.lastIndexOf("ensureTable('Orders')"));
            assertTrue(code.contains("const newest = veroData.resolveReferences([...Data.Orders].slice(-1)[0], __env__);"),
                    code);
            assertTrue(code.contains("const total: number = Data.Orders.length;"));
        }
    }

    // ================================================================
    // 视觉断言
    // ================================================================

    @Nested
    @DisplayName("视觉断言")
    class VisualTests {

        private String code(String body) {
            return transpile(feature("S", body)).getTests().get("Login");
        }

        @Test
        @DisplayName("无名称的截图断言比较整个页面")
        void testUnnamed() {
            String code = code("VERIFY SCREENSHOT");
            assertTrue(code.contains("await expect(page).toHaveScreenshot(); });"), code);
        }

        @Test
        @DisplayName("命名截图限定到目标并补全 .png 后缀")
        void testNamedPreset() {
            String code = code("VERIFY LoginPage.emailInput MATCHES SCREENSHOT AS \"chart\" WITH STRICT THRESHOLD 0.3");
            assertTrue(code.contains("await expect(loginPage.emailInput).toHaveScreenshot('chart.png', "
                    + "{ threshold: 0.3, maxDiffPixels: 0, maxDiffPixelRatio: 0 }); });"), code);
        }

        @Test
        @DisplayName("显式数值覆盖预设默认值")
        void testOverrideWins() {
            String code = code("VERIFY SCREENSHOT AS \"home\" WITH RELAXED MAX_DIFF_PIXELS 5");
            assertTrue(code.contains("toHaveScreenshot('home.png', "
                    + "{ threshold: 0.3, maxDiffPixels: 5, maxDiffPixelRatio: 0.05 });"), code);
        }

        @Test
        @DisplayName("已有 .png 后缀的名称保持不变")
        void testPngKept() {
            String code = code("VERIFY SCREENSHOT AS \"home.png\"");
            assertTrue(code.contains("toHaveScreenshot('home.png');"), code);
            assertFalse(code.contains("home.png.png"));
        }
    }

    // ================================================================
    // 调试插桩
    // ================================================================

    @Nested
    @DisplayName("调试插桩")
    class DebugTests {

        @Test
        @DisplayName("场景语句前后插入钩子，PageActions 不插桩")
        void testInstrumentation() {
            TranspileOptions options = new TranspileOptions();
            options.setDebugMode(true);
            options.setDebugPollIntervalMs(25);
            TranspileResult result = transpile(feature("S", "CLICK LoginPage.submitBtn"), options);
            String code = result.getTests().get("Login");

            assertTrue(code.contains("import * as fs from 'fs';"));
            assertTrue(code.contains("const __debug__ = {"));
            assertTrue(code.contains("setTimeout(resolve, 25)"));
            assertTrue(code.contains("await __debug__.beforeStep(15, 'click', 'LoginPage.submitBtn');"), code);
            assertTrue(code.contains("await __debug__.afterStep(15, 'click', false, Date.now() - __t"));
            assertFalse(result.getPageActions().get("LoginActions").contains("__debug__"));
        }

        @Test
        @DisplayName("命令文件只消费到最后一个换行，未写完的行留到下次")
        void testCommandFileReadsCompleteLines() {
            TranspileOptions options = new TranspileOptions();
            options.setDebugMode(true);
            String code = transpile(feature("S", "CLICK LoginPage.submitBtn"), options).getTests().get("Login");

            assertTrue(code.contains("    const end = content.lastIndexOf('\\n') + 1;\n"
                    + "    if (end <= this.commandOffset) return;\n"
                    + "    const fresh = content.slice(this.commandOffset, end);\n"
                    + "    this.commandOffset = end;\n"), code);
            assertTrue(code.contains("if (content.length < this.commandOffset) this.commandOffset = 0;"));
            assertFalse(code.contains("this.commandOffset = content.length;"));
        }

        @Test
        @DisplayName("声明变量的语句不放入 try 块，并上报变量值")
        void testVariableReporting() {
            TranspileOptions options = new TranspileOptions();
            options.setDebugMode(true);
            String code = transpile(feature("S", "TEXT who = \"admin\""), options).getTests().get("Login");
            assertTrue(code.contains("    const who: string = 'admin';\n"), code);
            assertTrue(code.contains("__debug__.variable('who', who);"));
        }
    }
}
