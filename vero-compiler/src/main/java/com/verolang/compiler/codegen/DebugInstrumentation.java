package com.verolang.compiler.codegen;

/**
 * 调试插桩：注入到 spec 文件的 __debug__ 运行时与每条语句前后的钩子调用
 * <p>
 * 命令来源有两个：父进程消息（process.send 通道）与 VERO_DEBUG_COMMAND_FILE 指向的命令文件。
 * 两者进入同一个 handle，共享同一份暂停/单步/断点状态。
 */
final class DebugInstrumentation {

    static final String IMPORT = "import * as fs from 'fs';";

    private DebugInstrumentation() {
    }

    /**
     * __debug__ 运行时源码
     */
    static String helperSource(long pollIntervalMs) {
        return "// step debugger runtime\n"
                + "const __debug__ = {\n"
                + "  breakpoints: new Set<number>(),\n"
                + "  stepping: false,\n"
                + "  paused: false,\n"
                + "  commandFile: process.env.VERO_DEBUG_COMMAND_FILE,\n"
                + "  commandOffset: 0,\n"
                + "\n"
                + "  emit(event: Record<string, unknown>): void {\n"
                + "    if (process.send) {\n"
                + "      process.send(event);\n"
                + "    }\n"
                + "  },\n"
                + "\n"
                + "  handle(msg: any): void {\n"
                + "    if (!msg || typeof msg.type !== 'string') return;\n"
                + "    switch (msg.type) {\n"
                + "      case 'resume':\n"
                + "        this.paused = false;\n"
                + "        this.stepping = false;\n"
                + "        break;\n"
                + "      case 'step':\n"
                + "        this.paused = false;\n"
                + "        this.stepping = true;\n"
                + "        break;\n"
                + "      case 'set-breakpoints':\n"
                + "        this.breakpoints = new Set<number>(msg.lines ?? msg.breakpoints ?? []);\n"
                + "        break;\n"
                + "      case 'stop':\n"
                + "        process.exit(0);\n"
                + "    }\n"
                + "  },\n"
                + "\n"
                + "  pollCommands(): void {\n"
                + "    if (!this.commandFile || !fs.existsSync(this.commandFile)) return;\n"
                + "    const content = fs.readFileSync(this.commandFile, 'utf-8');\n"
                + "    if (content.length < this.commandOffset) this.commandOffset = 0;\n"
                + "    const end = content.lastIndexOf('\\n') + 1;\n"
                + "    if (end <= this.commandOffset) return;\n"
                + "    const fresh = content.slice(this.commandOffset, end);\n"
                + "    this.commandOffset = end;\n"
                + "    for (const line of fresh.split('\\n')) {\n"
                + "      if (!line.trim()) continue;\n"
                + "      try {\n"
                + "        this.handle(JSON.parse(line));\n"
                + "      } catch (e) {\n"
                + "        console.warn('[vero-debug] ignored malformed command: ' + line);\n"
                + "      }\n"
                + "    }\n"
                + "  },\n"
                + "\n"
                + "  async beforeStep(line: number, action: string, target?: string): Promise<void> {\n"
                + "    this.pollCommands();\n"
                + "    this.emit({ type: 'step:before', line, action, target });\n"
                + "    if (this.stepping || this.breakpoints.has(line)) {\n"
                + "      this.stepping = false;\n"
                + "      this.paused = true;\n"
                + "      this.emit({ type: 'execution:paused', line });\n"
                + "      while (this.paused) {\n"
                + "        await new Promise((resolve) => setTimeout(resolve, " + pollIntervalMs + "));\n"
                + "        this.pollCommands();\n"
                + "      }\n"
                + "    }\n"
                + "  },\n"
                + "\n"
                + "  async afterStep(line: number, action: string, success: boolean, duration: number): Promise<void> {\n"
                + "    this.emit({ type: 'step:after', line, action, success, duration });\n"
                + "  },\n"
                + "\n"
                + "  variable(name: string, value: unknown): void {\n"
                + "    this.emit({ type: 'variable', name, value });\n"
                + "  },\n"
                + "};\n"
                + "\n"
                + "if (process.send) {\n"
                + "  process.on('message', (msg: any) => __debug__.handle(msg));\n"
                + "}\n";
    }

    static String beforeStep(int line, StepDescriber.StepInfo info) {
        return "await __debug__.beforeStep(" + line + ", " + TsSyntax.quote(info.action) + ", "
                + (info.target != null ? TsSyntax.quote(info.target) : "undefined") + ");";
    }

    static String afterStep(int line, StepDescriber.StepInfo info, boolean success, String startVar) {
        return "await __debug__.afterStep(" + line + ", " + TsSyntax.quote(info.action) + ", "
                + success + ", Date.now() - " + startVar + ");";
    }

    static String variable(String name) {
        return "__debug__.variable(" + TsSyntax.quote(name) + ", " + name + ");";
    }
}
