package com.verolang.compiler.codegen;

import java.util.HashSet;
import java.util.Set;

/**
 * 语句体的生成上下文
 * <p>
 * 局部变量与已加载数据表按块作用域复制：子块可见外层，外层不可见子块。
 */
final class GenContext {

    enum BodyKind {
        SCENARIO, HOOK, ACTION
    }

    final UnitState unit;
    final BodyKind kind;
    final CodeWriter writer;
    final Set<String> locals;
    final Set<String> ensuredTables;
    /** SWITCH TO FRAME 之后内联选择器的接收者，主框架时为 null */
    String frameRef;

    GenContext(UnitState unit, BodyKind kind, CodeWriter writer) {
        this(unit, kind, writer, new HashSet<String>(), new HashSet<String>(), null);
    }

    private GenContext(UnitState unit, BodyKind kind, CodeWriter writer,
                       Set<String> locals, Set<String> ensuredTables, String frameRef) {
        this.unit = unit;
        this.kind = kind;
        this.writer = writer;
        this.locals = locals;
        this.ensuredTables = ensuredTables;
        this.frameRef = frameRef;
    }

    /** 嵌套块 */
    GenContext child() {
        return new GenContext(unit, kind, writer,
                new HashSet<String>(locals), new HashSet<String>(ensuredTables), frameRef);
    }

    /** 同一作用域，输出到另一个缓冲区 */
    GenContext withWriter(CodeWriter other) {
        GenContext ctx = new GenContext(unit, kind, other, locals, ensuredTables, frameRef);
        return ctx;
    }

    String pageRef() {
        return unit.isActions() ? "this.page" : "page";
    }

    /** 内联选择器的接收者 */
    String locatorRoot() {
        return frameRef != null ? frameRef : pageRef();
    }

    boolean hasTestInfo() {
        return kind != BodyKind.ACTION;
    }

    boolean isInstrumented() {
        return unit.options.isDebugMode() && kind != BodyKind.ACTION;
    }

    CodeWriter newBuffer() {
        return new CodeWriter(writer.getIndentUnit());
    }
}
