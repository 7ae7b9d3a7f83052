package com.verolang.cli;

import com.verolang.compiler.VeroCompiler;
import com.verolang.compiler.analysis.SemanticDiagnostic;
import com.verolang.compiler.analysis.ValidationResult;
import com.verolang.compiler.ast.SourceLocation;
import com.verolang.compiler.ast.decl.FeatureDecl;
import com.verolang.compiler.ast.decl.PageActionsDecl;
import com.verolang.compiler.ast.decl.PageDecl;
import com.verolang.compiler.ast.decl.Program;
import com.verolang.compiler.codegen.GenerationException;
import com.verolang.compiler.codegen.TranspileOptions;
import com.verolang.compiler.codegen.TranspileResult;
import com.verolang.compiler.lexer.LexError;
import com.verolang.compiler.lexer.LexResult;
import com.verolang.compiler.parser.ParseError;
import com.verolang.compiler.parser.ParseResult;
import com.verolang.compiler.selection.ScenarioSelectionException;
import com.verolang.compiler.selection.ScenarioSelectionOptions;
import com.verolang.compiler.selection.SelectionResult;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * 编译与检查执行器
 *
 * <p>多个 .vero 文件各自词法/语法分析后合并为一个 Program，再统一校验、筛选和生成。</p>
 */
public class CompileRunner {

    private static final Logger LOG = Logger.getLogger(CompileRunner.class.getName());

    static final String SOURCE_EXTENSION = ".vero";

    private final CliConfig config;
    private final PrintWriter out;
    private final PrintWriter err;

    public CompileRunner(CliConfig config, PrintWriter out, PrintWriter err) {
        this.config = config;
        this.out = out;
        this.err = err;
    }

    /**
     * 编译并写出 TypeScript 文件
     *
     * @return 进程退出码
     */
    public int compile(List<String> inputs, boolean strict, ScenarioSelectionOptions selection,
                       TranspileOptions options) {
        SourceSet sources;
        try {
            sources = load(inputs);
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }
        ValidationResult validation = VeroCompiler.validate(sources.program);
        int errorCount = report(sources, validation);
        if (strict && errorCount > 0) {
            err.println("Compilation failed with " + errorCount + " error(s)");
            return 1;
        }

        try {
            SelectionResult selected = VeroCompiler.applyScenarioSelection(sources.program, selection);
            if (selected.getDiagnostics().hasFilters()) {
                out.println(selected.getDiagnostics());
            }
            TranspileResult result = VeroCompiler.transpile(selected.getProgram(), options);
            Path outputDir = Paths.get(config.getOutputDir());
            int written = writeAll(outputDir, options, result);
            out.println("编译成功！共写出 " + written + " 个文件到 " + outputDir);
            return 0;
        } catch (ScenarioSelectionException | GenerationException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            err.println("错误: 无法写出文件 - " + e.getMessage());
            return 1;
        }
    }

    /**
     * 只做词法、语法与语义检查
     *
     * @return 存在错误时为 1
     */
    public int check(List<String> inputs) {
        SourceSet sources;
        try {
            sources = load(inputs);
        } catch (IOException e) {
            err.println("错误: " + e.getMessage());
            return 1;
        }
        ValidationResult validation = VeroCompiler.validate(sources.program);
        int errorCount = report(sources, validation);
        int warningCount = validation.getWarnings().size();
        out.println(sources.files.size() + " file(s) checked: " + errorCount + " error(s), "
                + warningCount + " warning(s)");
        return errorCount > 0 ? 1 : 0;
    }

    // ============ 源文件收集 ============

    /**
     * 展开目录并按路径排序，保证输出稳定
     */
    static List<Path> collectSources(List<String> inputs) throws IOException {
        List<Path> files = new ArrayList<>();
        for (String input : inputs) {
            Path path = Paths.get(input);
            if (Files.isDirectory(path)) {
                try (Stream<Path> walk = Files.walk(path)) {
                    files.addAll(walk.filter(Files::isRegularFile)
                            .filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
                            .sorted()
                            .collect(Collectors.toList()));
                }
            } else if (Files.isRegularFile(path)) {
                files.add(path);
            } else {
                throw new IOException("文件不存在 - " + input);
            }
        }
        if (files.isEmpty()) {
            throw new IOException("没有找到 " + SOURCE_EXTENSION + " 文件");
        }
        return files;
    }

    SourceSet load(List<String> inputs) throws IOException {
        List<Path> files = collectSources(inputs);
        List<PageDecl> pages = new ArrayList<>();
        List<PageActionsDecl> pageActions = new ArrayList<>();
        List<FeatureDecl> features = new ArrayList<>();
        List<String> frontEndErrors = new ArrayList<>();

        for (Path file : files) {
            String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
            LexResult lex = VeroCompiler.tokenize(source);
            ParseResult parsed = VeroCompiler.parse(lex.getTokens());
            for (LexError error : lex.getErrors()) {
                frontEndErrors.add(file + ":" + error.getLine() + ":" + error.getColumn() + ": " + error.getMessage());
            }
            for (ParseError error : parsed.getErrors()) {
                frontEndErrors.add(file + ":" + error.getLine() + ":" + error.getColumn() + ": " + error.getMessage());
            }
            Program program = parsed.getProgram();
            pages.addAll(program.getPages());
            pageActions.addAll(program.getPageActions());
            features.addAll(program.getFeatures());
            LOG.fine("Parsed " + file + ": " + program.getPages().size() + " page(s), "
                    + program.getPageActions().size() + " page actions, "
                    + program.getFeatures().size() + " feature(s)");
        }

        Program merged = new Program(new SourceLocation(1, 1), pages, pageActions, features);
        return new SourceSet(files, merged, frontEndErrors);
    }

    private int report(SourceSet sources, ValidationResult validation) {
        for (String error : sources.frontEndErrors) {
            err.println(error);
        }
        for (SemanticDiagnostic diagnostic : validation.getDiagnostics()) {
            (diagnostic.isError() ? err : out).println(diagnostic);
        }
        return sources.frontEndErrors.size() + validation.getErrors().size();
    }

    // ============ 输出 ============

    private int writeAll(Path outputDir, TranspileOptions options, TranspileResult result) throws IOException {
        int count = 0;
        count += writeUnits(outputDir.resolve(options.getPageObjectDir()), result.getPages(), ".ts");
        count += writeUnits(outputDir.resolve(options.getPageActionsDir()), result.getPageActions(), ".ts");
        count += writeUnits(outputDir.resolve("tests"), result.getTests(), ".spec.ts");
        return count;
    }

    private int writeUnits(Path dir, Map<String, String> units, String suffix) throws IOException {
        if (units.isEmpty()) {
            return 0;
        }
        Files.createDirectories(dir);
        for (Map.Entry<String, String> unit : units.entrySet()) {
            Path target = dir.resolve(fileNameFor(unit.getKey()) + suffix);
            Files.write(target, unit.getValue().getBytes(StandardCharsets.UTF_8));
            LOG.fine("Wrote " + target);
        }
        return units.size();
    }

    static String fileNameFor(String unitName) {
        String cleaned = unitName.replaceAll("[^A-Za-z0-9_-]+", "_");
        return cleaned.isEmpty() ? "unnamed" : cleaned;
    }

    /**
     * 合并后的程序及各文件的前端错误
     */
    static final class SourceSet {
        final List<Path> files;
        final Program program;
        final List<String> frontEndErrors;

        SourceSet(List<Path> files, Program program, List<String> frontEndErrors) {
            this.files = files;
            this.program = program;
            this.frontEndErrors = frontEndErrors;
        }
    }
}
