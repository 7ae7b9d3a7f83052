package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.decl.ActionDecl;
import com.verolang.compiler.ast.decl.PageActionsDecl;
import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.ast.stmt.ReturnStmt;
import com.verolang.compiler.ast.stmt.Statement;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * PAGEACTIONS → 动作类
 * <p>
 * 同名动作只有一个定义时生成普通方法；有多个重载时生成按参数个数分派的单一方法。
 */
final class PageActionsGenerator {

    private final Program program;
    private final TranspileOptions options;

    PageActionsGenerator(Program program, TranspileOptions options) {
        this.program = program;
        this.options = options;
    }

    String generate(PageActionsDecl block) {
        UnitState unit = UnitState.forPageActions(program, options, block);
        CodeWriter methods = new CodeWriter(options.getIndentString());
        methods.indent();

        // 方法先生成，依赖收集完成后再写头部
        for (Map.Entry<String, List<ActionDecl>> entry : block.getOverloads().entrySet()) {
            methods.blankLine();
            List<ActionDecl> overloads = entry.getValue();
            if (overloads.size() == 1) {
                emitMethod(unit, methods, overloads.get(0));
            } else {
                emitDispatcher(unit, methods, block, entry.getKey(), overloads);
            }
        }
        methods.dedent();

        CodeWriter out = new CodeWriter(options.getIndentString());
        out.line("import { Page, expect } from '@playwright/test';");
        for (String page : unit.referencedPages) {
            out.line("import { " + page + " } from '../" + options.getPageObjectDir() + "/" + page + "';");
        }
        for (String other : unit.referencedBlocks) {
            out.line("import { " + other + " } from './" + other + "';");
        }
        if (unit.usesData) {
            out.line("import { Data, veroData } from '../" + options.getRuntimeDir() + "/veroData';");
        }
        out.blankLine();
        if (unit.usesEnv) {
            out.line(TsSyntax.ENV_DECLARATION);
            out.blankLine();
        }

        out.line("export class " + block.getName() + " {");
        out.indent();
        out.line("page: Page;");
        for (String page : unit.referencedPages) {
            out.line("readonly " + TsSyntax.camelCase(page) + ": " + page + ";");
        }
        out.blankLine();
        out.line("constructor(page: Page) {");
        out.indent();
        out.line("this.page = page;");
        for (String page : unit.referencedPages) {
            out.line("this." + TsSyntax.camelCase(page) + " = new " + page + "(page);");
        }
        out.dedent();
        out.line("}");
        out.dedent();
        if (!methods.isEmpty()) {
            out.blankLine();
            out.lines(methods.getOutput());
        }
        out.line("}");
        return out.getOutput();
    }

    private void emitMethod(UnitState unit, CodeWriter w, ActionDecl action) {
        StringBuilder params = new StringBuilder();
        for (String param : action.getParameters()) {
            if (params.length() > 0) params.append(", ");
            params.append(param).append(": any");
        }
        String returnType = action.getReturnType() != null ? action.getReturnType().getTsType() : "void";
        w.line("async " + action.getName() + "(" + params + "): Promise<" + returnType + "> {");
        w.indent();
        emitActionBody(unit, w, action);
        w.dedent();
        w.line("}");
    }

    private void emitDispatcher(UnitState unit, CodeWriter w, PageActionsDecl block,
                                String name, List<ActionDecl> overloads) {
        Map<Integer, ActionDecl> byArity = new HashMap<Integer, ActionDecl>();
        List<ActionDecl> ordered = new ArrayList<ActionDecl>();
        for (ActionDecl action : overloads) {
            ActionDecl previous = byArity.put(action.getArity(), action);
            if (previous != null) {
                throw new GenerationException("Duplicate overload '" + block.getName() + "." + name
                        + "' with " + action.getArity() + " parameter(s)", action.getLocation());
            }
            ordered.add(action);
        }

        w.line("async " + name + "(...args: any[]): Promise<any> {");
        w.indent();
        w.line("switch (args.length) {");
        w.indent();
        for (ActionDecl action : ordered) {
            w.line("case " + action.getArity() + ": {");
            w.indent();
            if (!action.getParameters().isEmpty()) {
                w.line("const [" + String.join(", ", action.getParameters()) + "] = args;");
            }
            emitActionBody(unit, w, action);
            List<Statement> statements = action.getStatements();
            if (statements.isEmpty() || !(statements.get(statements.size() - 1) instanceof ReturnStmt)) {
                w.line("return;");
            }
            w.dedent();
            w.line("}");
        }
        w.line("default:");
        w.indent();
        w.line("throw new Error(`" + block.getName() + "." + name
                + " does not accept ${args.length} argument(s)`);");
        w.dedent();
        w.dedent();
        w.line("}");
        w.dedent();
        w.line("}");
    }

    private void emitActionBody(UnitState unit, CodeWriter w, ActionDecl action) {
        GenContext ctx = new GenContext(unit, GenContext.BodyKind.ACTION, w);
        ctx.locals.addAll(action.getParameters());
        StatementGenerator.INSTANCE.emitBody(action.getStatements(), ctx, false);
    }
}
