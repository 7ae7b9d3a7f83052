package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.decl.PageDecl;
import com.verolang.compiler.ast.expr.VariableRef;
import com.verolang.compiler.ast.stmt.Target;

/**
 * 名称解析：Page.field、裸名称和变量引用在不同单元中的 TypeScript 写法
 */
final class NameResolver {

    private NameResolver() {
    }

    /**
     * 页面对象的引用：feature 中是 describe 级变量，PageActions 中是实例字段
     */
    static String pageVar(GenContext ctx, String pageName) {
        if (ctx.unit.isActions()) {
            ctx.unit.referencedPages.add(pageName);
            return "this." + TsSyntax.camelCase(pageName);
        }
        return TsSyntax.camelCase(pageName);
    }

    static String target(GenContext ctx, Target target) {
        if (target.isSelector()) {
            return SelectorCompiler.compile(target.getSelector(), ctx.locatorRoot());
        }
        if (target.isPageField()) {
            return pageVar(ctx, target.getPageName()) + "." + target.getFieldName();
        }
        String name = target.getFieldName();
        if (ctx.locals.contains(name)) {
            // 变量中保存的是选择器字符串
            return ctx.locatorRoot() + ".locator(" + name + ")";
        }
        if (ctx.unit.isActions()) {
            return pageVar(ctx, ctx.unit.block.getForPage()) + "." + name;
        }
        return ctx.locatorRoot() + ".locator(" + name + ")";
    }

    static String variable(GenContext ctx, VariableRef ref) {
        if (ref.isQualified()) {
            if (ctx.locals.contains(ref.getPageName())) {
                // 数据行的列
                return ref.getPageName() + "[" + TsSyntax.quote(ref.getName()) + "]";
            }
            return pageVar(ctx, ref.getPageName()) + "." + ref.getName();
        }
        String name = ref.getName();
        if (!ctx.locals.contains(name) && ctx.unit.isActions()) {
            PageDecl forPage = ctx.unit.program.findPage(ctx.unit.block.getForPage());
            if (forPage != null && forPage.hasMember(name)) {
                return pageVar(ctx, forPage.getName()) + "." + name;
            }
        }
        return name;
    }
}
