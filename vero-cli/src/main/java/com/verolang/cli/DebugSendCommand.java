package com.verolang.cli;

import com.verolang.debug.CommandFilePoller;
import com.verolang.debug.DebugCommand;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.ParameterException;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * picocli debug-send 子命令：向调试命令文件追加一条命令
 */
@Command(name = "debug-send", description = "向调试命令文件追加命令（resume, step, stop, set-breakpoints）")
public class DebugSendCommand implements Callable<Integer> {

    @Spec
    CommandSpec spec;

    @Parameters(index = "0", description = "调试命令文件")
    Path commandFile;

    @Parameters(index = "1", description = "命令：resume, step, stop, set-breakpoints")
    String command;

    @Parameters(index = "2..*", arity = "0..*", description = "断点行号（仅 set-breakpoints）")
    List<Integer> lines = new ArrayList<>();

    @Override
    public Integer call() throws IOException {
        DebugCommand debugCommand = toCommand();
        CommandFilePoller.append(commandFile, debugCommand);
        spec.commandLine().getOut().println("已发送: " + debugCommand.toJson());
        return 0;
    }

    DebugCommand toCommand() {
        DebugCommand.Type type = DebugCommand.Type.fromWireName(command);
        if (type == null) {
            throw new ParameterException(spec.commandLine(),
                    "Unknown debug command '" + command + "' (expected resume, step, stop, set-breakpoints)");
        }
        if (type != DebugCommand.Type.SET_BREAKPOINTS && !lines.isEmpty()) {
            throw new ParameterException(spec.commandLine(), "'" + command + "' takes no line numbers");
        }
        switch (type) {
            case RESUME:
                return DebugCommand.resume();
            case STEP:
                return DebugCommand.step();
            case STOP:
                return DebugCommand.stop();
            default:
                return DebugCommand.setBreakpoints(lines);
        }
    }
}
