package com.verolang.debug;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 父进程消息通道：逐行读取 JSON 命令，直到流结束
 */
public class MessageChannelListener implements Closeable {

    private static final Logger LOG = Logger.getLogger(MessageChannelListener.class.getName());

    private final BufferedReader reader;
    private final DebugSession session;
    private volatile Thread thread;

    public MessageChannelListener(InputStream input, DebugSession session) {
        this.reader = new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8));
        this.session = session;
    }

    /**
     * 在守护线程上监听
     */
    public void start() {
        Thread t = new Thread(() -> {
            try {
                listen();
            } catch (IOException e) {
                LOG.log(Level.WARNING, "Debug message channel closed with error", e);
            }
        }, "vero-debug-messages");
        t.setDaemon(true);
        thread = t;
        t.start();
    }

    /**
     * 阻塞读取直到流结束
     *
     * @return 处理的命令数
     */
    public int listen() throws IOException {
        int handled = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.trim().isEmpty()) continue;
            try {
                session.handle(DebugCommand.parse(line.trim()));
                handled++;
            } catch (DebugProtocolException e) {
                LOG.log(Level.WARNING, "Ignored malformed debug message: " + line, e);
            }
        }
        LOG.fine("Debug message channel reached end of stream");
        return handled;
    }

    @Override
    public void close() throws IOException {
        reader.close();
        Thread t = thread;
        if (t != null) {
            t.interrupt();
        }
    }
}
