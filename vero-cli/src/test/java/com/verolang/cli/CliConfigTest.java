package com.verolang.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("CliConfig 测试")
class CliConfigTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("没有配置文件时使用内置默认值")
    void defaults() throws IOException {
        CliConfig config = CliConfig.load(tempDir);

        assertThat(config.getOutputDir()).isEqualTo("generated");
        assertThat(config.isEvidenceScreenshots()).isTrue();
        assertThat(config.getDebugPollIntervalMs()).isEqualTo(50);
        assertThat(config.getBaseUrl()).isNull();
    }

    @Test
    @DisplayName("目录中的 vero.properties 覆盖默认值")
    void overrides() throws IOException {
        Files.write(tempDir.resolve(CliConfig.FILE_NAME), ("output.dir = e2e/generated\n"
                + "evidence.screenshots=false\n"
                + "debug.poll.interval.ms=200\n"
                + "base.url=https://staging.example.com\n").getBytes(StandardCharsets.UTF_8));

        CliConfig config = CliConfig.load(tempDir);

        assertThat(config.getOutputDir()).isEqualTo("e2e/generated");
        assertThat(config.isEvidenceScreenshots()).isFalse();
        assertThat(config.getDebugPollIntervalMs()).isEqualTo(200);
        assertThat(config.getBaseUrl()).isEqualTo("https://staging.example.com");
        assertThat(CompileCommand.transpileOptions(config, true).getDebugPollIntervalMs()).isEqualTo(200);
    }

    @Test
    @DisplayName("非法轮询间隔")
    void invalidInterval() throws IOException {
        Files.write(tempDir.resolve(CliConfig.FILE_NAME),
                "debug.poll.interval.ms=soon\n".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> CliConfig.load(tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("debug.poll.interval.ms");
    }

    @Test
    @DisplayName("单元名转为安全的文件名")
    void fileNames() {
        assertThat(CompileRunner.fileNameFor("Home")).isEqualTo("Home");
        assertThat(CompileRunner.fileNameFor("Reset password")).isEqualTo("Reset_password");
    }
}
