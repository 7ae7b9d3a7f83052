package com.verolang.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * CLI 默认配置
 *
 * <p>先读取类路径中的 {@code vero.properties}，再用工作目录中的同名文件覆盖；
 * 命令行选项优先于两者。</p>
 */
public class CliConfig {

    private static final Logger LOG = Logger.getLogger(CliConfig.class.getName());

    public static final String FILE_NAME = "vero.properties";

    private String outputDir = "generated";
    private boolean evidenceScreenshots = true;
    private long debugPollIntervalMs = 50;
    private String baseUrl;

    public static CliConfig defaults() {
        CliConfig config = new CliConfig();
        try (InputStream in = CliConfig.class.getResourceAsStream("/" + FILE_NAME)) {
            if (in != null) {
                Properties props = new Properties();
                props.load(in);
                config.apply(props);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Cannot read bundled " + FILE_NAME, e);
        }
        return config;
    }

    /**
     * 读取目录中的 vero.properties（不存在时只用默认值）
     *
     * @throws IOException 文件存在但无法读取
     */
    public static CliConfig load(Path directory) throws IOException {
        CliConfig config = defaults();
        Path file = directory.resolve(FILE_NAME);
        if (Files.isRegularFile(file)) {
            Properties props = new Properties();
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                props.load(reader);
            }
            config.apply(props);
            LOG.fine("Loaded " + file);
        }
        return config;
    }

    void apply(Properties props) {
        String output = props.getProperty("output.dir");
        if (output != null && !output.trim().isEmpty()) {
            outputDir = output.trim();
        }
        String evidence = props.getProperty("evidence.screenshots");
        if (evidence != null) {
            evidenceScreenshots = Boolean.parseBoolean(evidence.trim());
        }
        String interval = props.getProperty("debug.poll.interval.ms");
        if (interval != null) {
            try {
                debugPollIntervalMs = Long.parseLong(interval.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("debug.poll.interval.ms must be a number, got '" + interval + "'", e);
            }
            if (debugPollIntervalMs <= 0) {
                throw new IllegalArgumentException("debug.poll.interval.ms must be positive");
            }
        }
        String url = props.getProperty("base.url");
        if (url != null && !url.trim().isEmpty()) {
            baseUrl = url.trim();
        }
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public boolean isEvidenceScreenshots() {
        return evidenceScreenshots;
    }

    public void setEvidenceScreenshots(boolean evidenceScreenshots) {
        this.evidenceScreenshots = evidenceScreenshots;
    }

    public long getDebugPollIntervalMs() {
        return debugPollIntervalMs;
    }

    public void setDebugPollIntervalMs(long debugPollIntervalMs) {
        this.debugPollIntervalMs = debugPollIntervalMs;
    }

    /** 可选，OPEN 相对路径时使用 */
    public String getBaseUrl() {
        return baseUrl;
    }

    public void setBaseUrl(String baseUrl) {
        this.baseUrl = baseUrl;
    }
}
