package com.verolang.debug;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.function.Consumer;

/**
 * 把事件逐行写成 JSON
 */
public class JsonLineEventSink implements Consumer<DebugEvent> {

    private final OutputStream output;

    public JsonLineEventSink(OutputStream output) {
        this.output = output;
    }

    @Override
    public synchronized void accept(DebugEvent event) {
        try {
            output.write((event.toJson() + "\n").getBytes(StandardCharsets.UTF_8));
            output.flush();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
