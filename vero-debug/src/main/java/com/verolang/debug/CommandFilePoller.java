package com.verolang.debug;

import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 命令文件通道
 *
 * <p>定时读取命令文件中新追加的行（每行一条 JSON 命令），交给 {@link DebugSession} 处理。
 * 文件不存在时静默跳过，非法行记录警告后忽略。</p>
 */
public class CommandFilePoller implements Closeable {

    private static final Logger LOG = Logger.getLogger(CommandFilePoller.class.getName());

    public static final long DEFAULT_INTERVAL_MS = 50;

    private final Path commandFile;
    private final DebugSession session;
    private final long intervalMs;

    /** 已消费的字符数 */
    private int offset = 0;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "vero-debug-poller");
        t.setDaemon(true);
        return t;
    });

    public CommandFilePoller(Path commandFile, DebugSession session) {
        this(commandFile, session, DEFAULT_INTERVAL_MS);
    }

    public CommandFilePoller(Path commandFile, DebugSession session, long intervalMs) {
        this.commandFile = commandFile;
        this.session = session;
        this.intervalMs = intervalMs;
    }

    public void start() {
        scheduler.scheduleWithFixedDelay(this::poll, 0, intervalMs, TimeUnit.MILLISECONDS);
        LOG.fine("Polling " + commandFile + " every " + intervalMs + " ms");
    }

    /**
     * 读取并处理自上次以来追加的命令
     *
     * @return 本次处理的命令数
     */
    public synchronized int poll() {
        if (!Files.exists(commandFile)) {
            return 0;
        }
        String content;
        try {
            content = new String(Files.readAllBytes(commandFile), StandardCharsets.UTF_8);
        } catch (IOException e) {
            LOG.log(Level.WARNING, "Cannot read debug command file " + commandFile, e);
            return 0;
        }
        if (content.length() < offset) {
            // 文件被截断，从头读
            offset = 0;
        }
        int end = content.lastIndexOf('\n') + 1;
        if (end <= offset) {
            return 0;
        }
        String fresh = content.substring(offset, end);
        offset = end;

        int handled = 0;
        for (String line : fresh.split("\n")) {
            if (line.trim().isEmpty()) continue;
            try {
                session.handle(DebugCommand.parse(line.trim()));
                handled++;
            } catch (DebugProtocolException e) {
                LOG.log(Level.WARNING, "Ignored malformed debug command: " + line, e);
            }
        }
        return handled;
    }

    /**
     * 向命令文件追加一条命令
     */
    public static void append(Path commandFile, DebugCommand command) throws IOException {
        Path parent = commandFile.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(commandFile, (command.toJson() + "\n").getBytes(StandardCharsets.UTF_8),
                StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

    @Override
    public void close() {
        scheduler.shutdownNow();
    }
}
