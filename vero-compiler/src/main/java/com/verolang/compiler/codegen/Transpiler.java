package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.decl.FeatureDecl;
import com.verolang.compiler.ast.decl.PageActionsDecl;
import com.verolang.compiler.ast.decl.PageDecl;
import com.verolang.compiler.ast.decl.Program;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Logger;

/**
 * 代码生成入口：Program → Playwright TypeScript
 * <p>
 * 输出映射按声明顺序排列；相同的 AST 与选项总是生成逐字节相同的源码。
 */
public final class Transpiler {

    private static final Logger LOG = Logger.getLogger(Transpiler.class.getName());

    private final TranspileOptions options;

    public Transpiler() {
        this(new TranspileOptions());
    }

    public Transpiler(TranspileOptions options) {
        this.options = options != null ? options : new TranspileOptions();
    }

    public static TranspileResult transpile(Program program, TranspileOptions options) {
        return new Transpiler(options).transpile(program);
    }

    /**
     * @throws GenerationException 无法生成的单元（未知动作、参数个数不匹配、重复重载等）
     */
    public TranspileResult transpile(Program program) {
        Map<String, String> pages = new LinkedHashMap<String, String>();
        Map<String, String> pageActions = new LinkedHashMap<String, String>();
        Map<String, String> tests = new LinkedHashMap<String, String>();

        PageGenerator pageGenerator = new PageGenerator(program, options);
        for (PageDecl page : program.getPages()) {
            pages.put(page.getName(), pageGenerator.generate(page));
        }

        PageActionsGenerator actionsGenerator = new PageActionsGenerator(program, options);
        for (PageActionsDecl block : program.getPageActions()) {
            pageActions.put(block.getName(), actionsGenerator.generate(block));
        }

        FeatureGenerator featureGenerator = new FeatureGenerator(program, options);
        for (FeatureDecl feature : program.getFeatures()) {
            tests.put(feature.getName(), featureGenerator.generate(feature));
        }

        LOG.fine("Generated " + pages.size() + " page(s), " + pageActions.size()
                + " PageActions, " + tests.size() + " feature(s)");
        return new TranspileResult(pages, pageActions, tests);
    }
}
