package com.verolang.compiler;

import com.verolang.compiler.analysis.DiagnosticCodes;
import com.verolang.compiler.selection.ScenarioSelectionException;
import com.verolang.compiler.selection.ScenarioSelectionOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * VeroCompiler 全流程测试
 */
class VeroCompilerTest {

    private static final String SOURCE = "PAGE HomePage {\n"
            + "  FIELD banner = \".banner\"\n"
            + "}\n"
            + "FEATURE Home {\n"
            + "  USE HomePage\n"
            + "  SCENARIO ShowsBanner @smoke {\n"
            + "    OPEN \"/\"\n"
            + "    VERIFY HomePage.banner IS VISIBLE\n"
            + "  }\n"
            + "  SCENARIO Slow @wip {\n"
            + "    REFRESH\n"
            + "  }\n"
            + "}\n";

    @Test
    @DisplayName("合法源码生成全部文件")
    void testCompile() {
        CompileResult result = VeroCompiler.compile(SOURCE, CompileOptions.defaults());
        assertFalse(result.hasErrors());
        assertTrue(result.getErrorMessages().isEmpty());
        assertTrue(result.getOutput().getPages().containsKey("HomePage"));
        assertTrue(result.getOutput().getTests().get("Home").contains("test('ShowsBanner'"));
        assertEquals(2, result.getSelection().getSelectedScenarios());
    }

    @Test
    @DisplayName("场景筛选在生成之前应用")
    void testSelection() {
        CompileResult result = VeroCompiler.compile(SOURCE,
                new CompileOptions().setSelection(ScenarioSelectionOptions.byTags("not @wip")));
        String code = result.getOutput().getTests().get("Home");
        assertTrue(code.contains("ShowsBanner"));
        assertFalse(code.contains("'Slow'"));
        assertEquals(1, result.getSelection().getSelectedScenarios());
    }

    @Test
    @DisplayName("没有场景匹配时抛出筛选异常")
    void testEmptySelection() {
        assertThrows(ScenarioSelectionException.class, () -> VeroCompiler.compile(SOURCE,
                new CompileOptions().setSelection(ScenarioSelectionOptions.byNames("Missing"))));
    }

    @Test
    @DisplayName("严格模式下任何错误都终止编译")
    void testStrictMode() {
        String broken = SOURCE.replace("USE HomePage", "USE HomePage\n  SCENARIO Extra { CLICK HomePage.ghost }");
        CompilationException e = assertThrows(CompilationException.class,
                () -> VeroCompiler.compile(broken, new CompileOptions().setStrict(true)));
        assertEquals(1, e.getErrors().size());
        assertTrue(e.getErrors().get(0).contains(DiagnosticCodes.UNDEFINED_FIELD));
        assertTrue(e.getMessage().startsWith("Compilation failed with 1 error(s)"));
    }

    @Test
    @DisplayName("非严格模式报告错误但仍然生成")
    void testLenientMode() {
        String broken = SOURCE.replace("USE HomePage", "USE HomePage\n  SCENARIO Extra { CLICK HomePage.ghost }");
        CompileResult result = VeroCompiler.compile(broken, null);
        assertTrue(result.hasErrors());
        assertEquals(1, result.getErrorMessages().size());
        assertNotNull(result.getOutput().getTests().get("Home"));
    }

    @Test
    @DisplayName("词法与语法错误一并收集")
    void testFrontEndErrors() {
        CompilationException e = assertThrows(CompilationException.class,
                () -> VeroCompiler.compile("PAGE Broken {\n  FIELD a = \"#a\n}", new CompileOptions().setStrict(true)));
        assertFalse(e.getErrors().isEmpty());
    }

    @Test
    @DisplayName("警告不算错误")
    void testWarningsOnly() {
        CompileResult result = VeroCompiler.compile(SOURCE.replace("HomePage", "homePage"), null);
        assertFalse(result.hasErrors());
        assertFalse(result.getWarnings().isEmpty());
    }
}
