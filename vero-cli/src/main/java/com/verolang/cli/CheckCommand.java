package com.verolang.cli;

import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli check 子命令：只报告诊断，不生成代码
 */
@Command(name = "check", description = "检查 .vero 文件（词法、语法、语义）")
public class CheckCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", description = ".vero 文件或目录")
    List<String> inputs;

    @Override
    public Integer call() {
        return new CompileRunner(CliConfig.defaults(), spec.commandLine().getOut(), spec.commandLine().getErr())
                .check(inputs);
    }
}
