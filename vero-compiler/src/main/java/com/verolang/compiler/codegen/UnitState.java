package com.verolang.compiler.codegen;

import com.verolang.compiler.ast.decl.FeatureDecl;
import com.verolang.compiler.ast.decl.PageActionsDecl;
import com.verolang.compiler.ast.decl.Program;

import java.util.Set;
import java.util.TreeSet;

/**
 * 单个输出文件的生成状态：所属声明与生成过程中收集的依赖
 */
final class UnitState {
    final Program program;
    final TranspileOptions options;
    /** feature 单元时非 null */
    final FeatureDecl feature;
    /** PageActions 单元时非 null */
    final PageActionsDecl block;

    boolean usesEnv;
    boolean usesData;
    /** PageActions 单元引用到的页面（生成为实例字段） */
    final Set<String> referencedPages = new TreeSet<String>();
    /** PageActions 单元引用到的其他 PageActions */
    final Set<String> referencedBlocks = new TreeSet<String>();

    private int tempCounter = 0;

    private UnitState(Program program, TranspileOptions options, FeatureDecl feature, PageActionsDecl block) {
        this.program = program;
        this.options = options;
        this.feature = feature;
        this.block = block;
    }

    static UnitState forFeature(Program program, TranspileOptions options, FeatureDecl feature) {
        return new UnitState(program, options, feature, null);
    }

    /** 页面对象单元：只用于编译字段与变量初值 */
    static UnitState forPage(Program program, TranspileOptions options) {
        return new UnitState(program, options, null, null);
    }

    static UnitState forPageActions(Program program, TranspileOptions options, PageActionsDecl block) {
        UnitState state = new UnitState(program, options, null, block);
        state.referencedPages.add(block.getForPage());
        return state;
    }

    boolean isActions() {
        return block != null;
    }

    /** 单元内唯一的临时变量名 */
    String temp(String prefix) {
        return "__" + prefix + (++tempCounter);
    }
}
