package com.verolang.compiler;

import com.verolang.compiler.analysis.SemanticDiagnostic;
import com.verolang.compiler.analysis.ValidationResult;
import com.verolang.compiler.analysis.VeroValidator;
import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.codegen.TranspileOptions;
import com.verolang.compiler.codegen.TranspileResult;
import com.verolang.compiler.codegen.Transpiler;
import com.verolang.compiler.lexer.LexError;
import com.verolang.compiler.lexer.LexResult;
import com.verolang.compiler.lexer.Lexer;
import com.verolang.compiler.lexer.Token;
import com.verolang.compiler.parser.ParseError;
import com.verolang.compiler.parser.ParseResult;
import com.verolang.compiler.parser.Parser;
import com.verolang.compiler.selection.ScenarioSelectionOptions;
import com.verolang.compiler.selection.ScenarioSelector;
import com.verolang.compiler.selection.SelectionResult;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Vero 编译器便捷 API
 *
 * <p>分阶段调用：</p>
 * <pre>
 * LexResult lex = VeroCompiler.tokenize(source);
 * ParseResult parsed = VeroCompiler.parse(lex.getTokens());
 * ValidationResult diagnostics = VeroCompiler.validate(parsed.getProgram());
 * SelectionResult selected = VeroCompiler.applyScenarioSelection(parsed.getProgram(), ScenarioSelectionOptions.byTags("@smoke"));
 * TranspileResult output = VeroCompiler.transpile(selected.getProgram(), new TranspileOptions());
 * </pre>
 *
 * <p>一次完成：</p>
 * <pre>
 * CompileResult result = VeroCompiler.compile(source, CompileOptions.defaults().setStrict(true));
 * </pre>
 *
 * 所有阶段都是无状态的纯函数，可并发调用。
 */
public final class VeroCompiler {

    private static final Logger LOG = Logger.getLogger(VeroCompiler.class.getName());

    private VeroCompiler() {
    }

    public static LexResult tokenize(String source) {
        return Lexer.tokenize(source);
    }

    public static ParseResult parse(List<Token> tokens) {
        return Parser.parse(tokens);
    }

    public static ValidationResult validate(Program program) {
        return VeroValidator.validate(program);
    }

    /**
     * @throws com.verolang.compiler.selection.ScenarioSelectionException 筛选条件非法或没有匹配的场景
     */
    public static SelectionResult applyScenarioSelection(Program program, ScenarioSelectionOptions options) {
        return ScenarioSelector.apply(program, options);
    }

    /**
     * @throws com.verolang.compiler.codegen.GenerationException 无法生成的单元
     */
    public static TranspileResult transpile(Program program, TranspileOptions options) {
        return Transpiler.transpile(program, options);
    }

    /**
     * 依次执行词法、语法、语义检查、场景筛选与代码生成
     *
     * @throws CompilationException 严格模式下存在任何错误
     */
    public static CompileResult compile(String source, CompileOptions options) {
        CompileOptions opts = options != null ? options : CompileOptions.defaults();

        LexResult lex = tokenize(source);
        ParseResult parsed = parse(lex.getTokens());
        ValidationResult validation = validate(parsed.getProgram());
        LOG.fine("Front end finished: " + lex.getErrors().size() + " lex, "
                + parsed.getErrors().size() + " parse, " + validation.getErrors().size() + " semantic error(s)");

        if (opts.isStrict()) {
            List<String> errors = describeErrors(lex.getErrors(), parsed.getErrors(), validation);
            if (!errors.isEmpty()) {
                throw new CompilationException(errors);
            }
        }

        SelectionResult selected = applyScenarioSelection(parsed.getProgram(), opts.getSelection());
        TranspileResult output = transpile(selected.getProgram(), opts.getTranspile());
        return new CompileResult(lex.getErrors(), parsed.getErrors(), validation,
                selected.getProgram(), selected.getDiagnostics(), output);
    }

    static List<String> describeErrors(List<LexError> lexErrors, List<ParseError> parseErrors,
                                       ValidationResult validation) {
        List<String> errors = new ArrayList<String>();
        for (LexError error : lexErrors) {
            errors.add(error.toString());
        }
        for (ParseError error : parseErrors) {
            errors.add(error.toString());
        }
        for (SemanticDiagnostic diagnostic : validation.getErrors()) {
            errors.add(diagnostic.toString());
        }
        return errors;
    }
}
