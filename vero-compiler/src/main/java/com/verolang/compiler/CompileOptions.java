package com.verolang.compiler;

import com.verolang.compiler.codegen.TranspileOptions;
import com.verolang.compiler.selection.ScenarioSelectionOptions;

/**
 * 完整编译流程的选项
 */
public class CompileOptions {
    private boolean strict = false;
    private ScenarioSelectionOptions selection = ScenarioSelectionOptions.none();
    private TranspileOptions transpile = new TranspileOptions();

    public CompileOptions() {
    }

    public static CompileOptions defaults() {
        return new CompileOptions();
    }

    /** 为 true 时，任何词法/语法/语义错误都会中止编译 */
    public boolean isStrict() {
        return strict;
    }

    public CompileOptions setStrict(boolean strict) {
        this.strict = strict;
        return this;
    }

    public ScenarioSelectionOptions getSelection() {
        return selection;
    }

    public CompileOptions setSelection(ScenarioSelectionOptions selection) {
        this.selection = selection != null ? selection : ScenarioSelectionOptions.none();
        return this;
    }

    public TranspileOptions getTranspile() {
        return transpile;
    }

    public CompileOptions setTranspile(TranspileOptions transpile) {
        this.transpile = transpile != null ? transpile : new TranspileOptions();
        return this;
    }
}
