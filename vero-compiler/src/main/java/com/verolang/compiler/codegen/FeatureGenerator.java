package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.decl.FeatureDecl;
import com.verolang.compiler.ast.decl.HookDecl;
import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.ast.decl.ScenarioDecl;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * FEATURE → Playwright spec 文件
 */
final class FeatureGenerator {

    private final Program program;
    private final TranspileOptions options;

    FeatureGenerator(Program program, TranspileOptions options) {
        this.program = program;
        this.options = options;
    }

    String generate(FeatureDecl feature) {
        UnitState unit = UnitState.forFeature(program, options, feature);
        List<String> pages = new ArrayList<String>();
        List<String> blocks = new ArrayList<String>();
        for (String used : feature.getUses()) {
            if (program.findPage(used) != null) {
                pages.add(used);
            } else if (program.findPageActions(used) != null) {
                blocks.add(used);
            } else {
                throw new GenerationException("Feature '" + feature.getName()
                        + "' uses unknown page or PageActions '" + used + "'", feature.getLocation());
            }
        }

        CodeWriter body = new CodeWriter(options.getIndentString());
        body.indent();
        emitDeclarations(body, pages, blocks);

        boolean hasBeforeEach = false;
        for (HookDecl hook : feature.getHooks()) {
            if (hook.getHookType() == HookDecl.HookType.BEFORE_EACH) {
                hasBeforeEach = true;
            }
            emitHook(unit, body, hook, pages, blocks);
            body.blankLine();
        }
        if (!hasBeforeEach && !feature.getUses().isEmpty()) {
            body.line("test.beforeEach(async ({ page }) => {");
            body.indent();
            emitInstantiation(body, pages, blocks, "");
            body.dedent();
            body.line("});");
            body.blankLine();
        }

        for (ScenarioDecl scenario : feature.getScenarios()) {
            emitScenario(unit, body, scenario);
            body.blankLine();
        }
        body.dedent();

        CodeWriter out = new CodeWriter(options.getIndentString());
        out.line("import { test, expect } from '@playwright/test';");
        for (String page : pages) {
            out.line("import { " + page + " } from '../" + options.getPageObjectDir() + "/" + page + "';");
        }
        for (String block : blocks) {
            out.line("import { " + block + " } from '../" + options.getPageActionsDir() + "/" + block + "';");
        }
        if (unit.usesData) {
            out.line("import { Data, veroData } from '../" + options.getRuntimeDir() + "/veroData';");
        }
        if (options.isDebugMode()) {
            out.line(DebugInstrumentation.IMPORT);
        }
        out.blankLine();
        if (unit.usesEnv) {
            out.line(TsSyntax.ENV_DECLARATION);
            out.blankLine();
        }
        if (options.isDebugMode()) {
            out.lines(DebugInstrumentation.helperSource(options.getDebugPollIntervalMs()));
            out.blankLine();
        }

        out.line("test.describe(" + TsSyntax.quote(feature.getName()) + ", () => {");
        String code = body.getOutput();
        // 去掉最后一个场景后的空行
        while (code.endsWith("\n\n")) {
            code = code.substring(0, code.length() - 1);
        }
        out.lines(code);
        out.line("});");
        return out.getOutput();
    }

    // ============ 页面对象 ============

    private static void emitDeclarations(CodeWriter w, List<String> pages, List<String> blocks) {
        for (String page : pages) {
            w.line("let " + TsSyntax.camelCase(page) + ": " + page + ";");
        }
        for (String block : blocks) {
            w.line("let " + TsSyntax.camelCase(block) + ": " + block + ";");
        }
        if (!pages.isEmpty() || !blocks.isEmpty()) {
            w.blankLine();
        }
    }

    private static void emitInstantiation(CodeWriter w, List<String> pages, List<String> blocks, String keyword) {
        for (String page : pages) {
            w.line(keyword + TsSyntax.camelCase(page) + " = new " + page + "(page);");
        }
        for (String block : blocks) {
            w.line(keyword + TsSyntax.camelCase(block) + " = new " + block + "(page);");
        }
    }

    // ============ 钩子 ============

    private void emitHook(UnitState unit, CodeWriter w, HookDecl hook, List<String> pages, List<String> blocks) {
        String name = "test." + hook.getHookType().getPlaywrightName();
        boolean perWorker = hook.getHookType() == HookDecl.HookType.BEFORE_ALL
                || hook.getHookType() == HookDecl.HookType.AFTER_ALL;
        GenContext ctx = new GenContext(unit, GenContext.BodyKind.HOOK, w);

        if (!perWorker) {
            w.line(name + "(async ({ page }, testInfo) => {");
            w.indent();
            if (hook.getHookType() == HookDecl.HookType.BEFORE_EACH) {
                emitInstantiation(w, pages, blocks, "");
            }
            StatementGenerator.INSTANCE.emitBody(hook.getStatements(), ctx, true);
            w.dedent();
            w.line("});");
            return;
        }

        // beforeAll/afterAll 没有 page fixture，自建页面
        w.line(name + "(async ({ browser }, testInfo) => {");
        w.indent();
        w.line("let page = await browser.newPage();");
        emitInstantiation(w, pages, blocks, "const ");
        w.line("try {");
        w.indent();
        StatementGenerator.INSTANCE.emitBody(hook.getStatements(), ctx, true);
        w.dedent();
        w.line("} finally {");
        w.indent();
        w.line("await page.close();");
        w.dedent();
        w.line("}");
        w.dedent();
        w.line("});");
    }

    // ============ 场景 ============

    private void emitScenario(UnitState unit, CodeWriter w, ScenarioDecl scenario) {
        boolean only = false;
        boolean fixme = false;
        boolean skip = false;
        boolean slow = false;
        StringBuilder tags = new StringBuilder();
        for (String tag : scenario.getTags()) {
            String normalized = tag.toLowerCase(Locale.ROOT);
            if ("only".equals(normalized)) only = true;
            else if ("fixme".equals(normalized)) fixme = true;
            else if ("skip".equals(normalized)) skip = true;
            else if ("slow".equals(normalized)) slow = true;
            if (tags.length() > 0) tags.append(", ");
            tags.append(TsSyntax.quote("@" + tag));
        }
        String modifier = only ? ".only" : fixme ? ".fixme" : skip ? ".skip" : "";

        String details = tags.length() > 0 ? "{ tag: [" + tags + "] }, " : "";
        w.line("test" + modifier + "(" + TsSyntax.quote(scenario.getName()) + ", " + details
                + "async ({ page }, testInfo) => {");
        w.indent();
        if (slow) {
            w.line("test.slow();");
        }
        GenContext ctx = new GenContext(unit, GenContext.BodyKind.SCENARIO, w);
        StatementGenerator.INSTANCE.emitBody(scenario.getStatements(), ctx, true);
        if (options.isCaptureEvidence()) {
            emitEvidence(w);
        }
        w.dedent();
        w.line("});");
    }

    private static void emitEvidence(CodeWriter w) {
        w.line("// evidence");
        w.line("await test.step('Capture Evidence Screenshot', async () => {");
        w.indent();
        w.line("const screenshotPath = testInfo.outputPath('evidence-screenshot.png');");
        w.line("await page.screenshot({ path: screenshotPath, fullPage: false });");
        w.line("await testInfo.attach('evidence-screenshot', { path: screenshotPath, contentType: 'image/png' });");
        w.dedent();
        w.line("});");
    }
}
