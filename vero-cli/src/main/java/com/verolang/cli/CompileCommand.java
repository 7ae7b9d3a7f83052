package com.verolang.cli;

import com.verolang.compiler.codegen.TranspileOptions;
import com.verolang.compiler.selection.ScenarioSelectionOptions;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli compile 子命令：生成 Playwright TypeScript
 */
@Command(name = "compile", description = "编译 .vero 文件为 Playwright TypeScript")
public class CompileCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", description = ".vero 文件或目录")
    List<String> inputs;

    @Option(names = {"-o", "--output"}, description = "输出目录（默认读取 vero.properties 的 output.dir）")
    String outputDir;

    @Option(names = "--tags", description = "标签表达式，如 \"@smoke and not @wip\"")
    String tags;

    @Option(names = "--scenario", description = "按场景名筛选（可重复）")
    List<String> scenarios = new ArrayList<>();

    @Option(names = "--grep", description = "按场景名正则筛选（可重复，不区分大小写）")
    List<String> patterns = new ArrayList<>();

    @Option(names = "--debug", description = "插入调试钩子")
    boolean debug;

    @Option(names = "--strict", description = "存在任何错误时不生成代码")
    boolean strict;

    @Option(names = "--no-evidence", description = "不在场景末尾截取证据截图")
    boolean noEvidence;

    @Option(names = "--base-url", description = "OPEN 相对路径时使用的基础 URL")
    String baseUrl;

    @Override
    public Integer call() throws IOException {
        CliConfig config = CliConfig.load(Paths.get("").toAbsolutePath());
        if (outputDir != null) {
            config.setOutputDir(outputDir);
        }
        if (baseUrl != null) {
            config.setBaseUrl(baseUrl);
        }
        if (noEvidence) {
            config.setEvidenceScreenshots(false);
        }

        ScenarioSelectionOptions selection = ScenarioSelectionOptions.none();
        selection.setTagExpression(tags);
        selection.setScenarioNames(scenarios);
        selection.setNamePatterns(patterns);

        return new CompileRunner(config, spec.commandLine().getOut(), spec.commandLine().getErr())
                .compile(inputs, strict, selection, transpileOptions(config, debug));
    }

    static TranspileOptions transpileOptions(CliConfig config, boolean debug) {
        TranspileOptions options = new TranspileOptions();
        options.setDebugMode(debug);
        options.setCaptureEvidence(config.isEvidenceScreenshots());
        options.setBaseUrl(config.getBaseUrl());
        options.setDebugPollIntervalMs(config.getDebugPollIntervalMs());
        return options;
    }
}
