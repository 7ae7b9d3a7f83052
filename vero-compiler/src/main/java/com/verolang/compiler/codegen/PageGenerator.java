package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.decl.FieldDecl;
import com.verolang.compiler.ast.decl.PageDecl;
import com.verolang.compiler.ast.decl.PageVariableDecl;
import com.verolang.compiler.ast.decl.Program;

/**
 * PAGE → 页面对象类
 */
final class PageGenerator {

    private final Program program;
    private final TranspileOptions options;

    PageGenerator(Program program, TranspileOptions options) {
        this.program = program;
        this.options = options;
    }

    String generate(PageDecl page) {
        UnitState unit = UnitState.forPage(program, options);
        CodeWriter body = new CodeWriter(options.getIndentString());
        GenContext ctx = new GenContext(unit, GenContext.BodyKind.ACTION, body);

        // 构造器先生成，才能知道是否需要环境变量表
        body.indent();
        body.line("readonly page: Page;");
        for (FieldDecl field : page.getFields()) {
            body.line("readonly " + field.getName() + ": Locator;");
        }
        for (PageVariableDecl variable : page.getVariables()) {
            body.line(variable.getName() + ": " + variable.getVarType().getTsType() + ";");
        }
        body.blankLine();
        body.line("constructor(page: Page) {");
        body.indent();
        body.line("this.page = page;");
        for (FieldDecl field : page.getFields()) {
            body.line("this." + field.getName() + " = " + SelectorCompiler.compile(field.getSelector(), "page") + ";");
        }
        for (PageVariableDecl variable : page.getVariables()) {
            body.line("this." + variable.getName() + " = " + ExpressionCompiler.compile(ctx, variable.getValue()) + ";");
        }
        body.dedent();
        body.line("}");
        body.dedent();

        CodeWriter out = new CodeWriter(options.getIndentString());
        out.line("import { Page, Locator } from '@playwright/test';");
        out.blankLine();
        if (unit.usesEnv) {
            out.line(TsSyntax.ENV_DECLARATION);
            out.blankLine();
        }
        out.line("export class " + page.getName() + " {");
        out.lines(body.getOutput());
        out.line("}");
        return out.getOutput();
    }
}
