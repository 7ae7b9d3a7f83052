package com.verolang.cli;

import com.verolang.compiler.analysis.DiagnosticCodes;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Vero CLI 测试")
class MainTest {

    private static final String PAGE = "PAGE HomePage {\n"
            + "  FIELD banner = \".banner\"\n"
            + "}\n";

    private static final String FEATURE = "FEATURE Home {\n"
            + "  USE HomePage\n"
            + "  SCENARIO ShowsBanner @smoke {\n"
            + "    OPEN \"/\"\n"
            + "    VERIFY HomePage.banner IS VISIBLE\n"
            + "  }\n"
            + "  SCENARIO Slow @wip {\n"
            + "    REFRESH\n"
            + "  }\n"
            + "}\n";

    @TempDir
    Path tempDir;

    private StringWriter out;
    private StringWriter err;
    private CommandLine cmd;

    @BeforeEach
    void setUp() {
        out = new StringWriter();
        err = new StringWriter();
        cmd = new CommandLine(new Main());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
    }

    private Path write(String name, String content) throws IOException {
        Path file = tempDir.resolve("src").resolve(name);
        Files.createDirectories(file.getParent());
        Files.write(file, content.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    private String read(Path file) throws IOException {
        return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("compile")
    class CompileTests {

        @Test
        @DisplayName("目录中的多个文件合并后生成")
        void compilesDirectory() throws IOException {
            write("pages.vero", PAGE);
            write("home.vero", FEATURE);
            Path output = tempDir.resolve("out");

            int code = cmd.execute("compile", tempDir.resolve("src").toString(), "-o", output.toString());

            assertThat(code).isZero();
            assertThat(output.resolve("pages/HomePage.ts")).exists();
            assertThat(read(output.resolve("tests/Home.spec.ts")))
                    .contains("test('ShowsBanner'")
                    .contains("test('Slow'");
            assertThat(out.toString()).contains("共写出 2 个文件");
        }

        @Test
        @DisplayName("标签筛选并打印筛选结果")
        void compilesWithTags() throws IOException {
            write("pages.vero", PAGE);
            write("home.vero", FEATURE);
            Path output = tempDir.resolve("out");

            int code = cmd.execute("compile", tempDir.resolve("src").toString(), "-o", output.toString(),
                    "--tags", "not @wip", "--no-evidence");

            assertThat(code).isZero();
            String spec = read(output.resolve("tests/Home.spec.ts"));
            assertThat(spec).contains("ShowsBanner").doesNotContain("'Slow'");
            assertThat(out.toString()).contains("selected 1/2");
        }

        @Test
        @DisplayName("没有匹配的场景时退出码为 1")
        void emptySelectionFails() throws IOException {
            write("all.vero", PAGE + FEATURE);

            int code = cmd.execute("compile", tempDir.resolve("src").toString(),
                    "-o", tempDir.resolve("out").toString(), "--scenario", "Missing");

            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).contains("No scenarios matched");
            assertThat(tempDir.resolve("out")).doesNotExist();
        }

        @Test
        @DisplayName("严格模式下语义错误阻止生成")
        void strictModeStops() throws IOException {
            write("all.vero", PAGE + FEATURE.replace("REFRESH", "CLICK HomePage.ghost"));

            int code = cmd.execute("compile", tempDir.resolve("src").toString(),
                    "-o", tempDir.resolve("out").toString(), "--strict");

            assertThat(code).isEqualTo(1);
            assertThat(err.toString())
                    .contains(DiagnosticCodes.UNDEFINED_FIELD)
                    .contains("Compilation failed with 1 error(s)");
            assertThat(tempDir.resolve("out")).doesNotExist();
        }

        @Test
        @DisplayName("输入不存在时报错")
        void missingInput() {
            int code = cmd.execute("compile", tempDir.resolve("nope.vero").toString());

            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).contains("nope.vero");
        }
    }

    @Nested
    @DisplayName("check")
    class CheckTests {

        @Test
        @DisplayName("合法源码退出码为 0")
        void cleanSource() throws IOException {
            Path file = write("all.vero", PAGE + FEATURE);

            assertThat(cmd.execute("check", file.toString())).isZero();
            assertThat(out.toString()).contains("1 file(s) checked: 0 error(s)");
        }

        @Test
        @DisplayName("语法错误带文件名和位置")
        void parseErrorNamesFile() throws IOException {
            write("good.vero", PAGE);
            Path broken = write("broken.vero", "PAGE Broken {\n  FIELD x = \n");

            int code = cmd.execute("check", tempDir.resolve("src").toString());

            assertThat(code).isEqualTo(1);
            assertThat(err.toString()).contains(broken.toString() + ":");
        }
    }

    @Nested
    @DisplayName("debug-send")
    class DebugSendTests {

        @Test
        @DisplayName("追加 JSON 命令行")
        void appendsCommands() throws IOException {
            Path commands = tempDir.resolve("debug-commands.jsonl");

            assertThat(cmd.execute("debug-send", commands.toString(), "set-breakpoints", "4", "9")).isZero();
            assertThat(cmd.execute("debug-send", commands.toString(), "resume")).isZero();

            List<String> lines = Files.readAllLines(commands, StandardCharsets.UTF_8);
            assertThat(lines).containsExactly(
                    "{\"type\":\"set-breakpoints\",\"lines\":[4,9]}",
                    "{\"type\":\"resume\"}");
        }

        @Test
        @DisplayName("未知命令是用法错误")
        void unknownCommand() {
            Path commands = tempDir.resolve("debug-commands.jsonl");

            int code = cmd.execute("debug-send", commands.toString(), "pause");

            assertThat(code).isEqualTo(CommandLine.ExitCode.USAGE);
            assertThat(err.toString()).contains("Unknown debug command 'pause'");
            assertThat(commands).doesNotExist();
        }
    }
}
