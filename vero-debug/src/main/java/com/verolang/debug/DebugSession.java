package com.verolang.debug;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * 被调试进程一侧的调试会话
 *
 * <p>执行线程在每条语句前后调用 {@link #beforeStep}/{@link #afterStep}；
 * 命令通道调用 {@link #handle}。stop 命令触发终止器（默认结束进程）。</p>
 */
public class DebugSession {

    private static final Logger LOG = Logger.getLogger(DebugSession.class.getName());

    private final DebugStateMachine stateMachine;
    private final Consumer<DebugEvent> eventSink;
    private final Runnable terminator;
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    public DebugSession(Consumer<DebugEvent> eventSink) {
        this(new DebugStateMachine(), eventSink, () -> System.exit(0));
    }

    public DebugSession(DebugStateMachine stateMachine, Consumer<DebugEvent> eventSink, Runnable terminator) {
        this.stateMachine = stateMachine;
        this.eventSink = eventSink;
        this.terminator = terminator;
    }

    public DebugStateMachine getStateMachine() {
        return stateMachine;
    }

    /**
     * 处理一条来自任一通道的命令
     */
    public void handle(DebugCommand command) {
        DebugState state = stateMachine.apply(command);
        if (state == DebugState.STOPPED) {
            terminate();
        }
    }

    /**
     * 语句执行前：发出 step:before，必要时阻塞直到被释放
     *
     * @throws DebugStoppedException 会话已经或在等待期间被 stop
     */
    public void beforeStep(int line, String action, String target) throws InterruptedException {
        if (stateMachine.getState() == DebugState.STOPPED) {
            throw new DebugStoppedException(line);
        }
        emit(DebugEvent.stepBefore(line, action, target));
        if (stateMachine.enterStatement(line)) {
            emit(DebugEvent.paused(line));
            LOG.fine("Paused at line " + line);
            if (stateMachine.awaitRelease() == DebugState.STOPPED) {
                throw new DebugStoppedException(line);
            }
        }
    }

    public void afterStep(int line, String action, boolean success, long durationMs) {
        emit(DebugEvent.stepAfter(line, action, success, durationMs));
    }

    public void variable(String name, Object value) {
        emit(DebugEvent.variable(name, value));
    }

    private void emit(DebugEvent event) {
        try {
            eventSink.accept(event);
        } catch (RuntimeException e) {
            LOG.log(Level.WARNING, "Failed to deliver debug event " + event.getType(), e);
        }
    }

    private void terminate() {
        if (terminated.compareAndSet(false, true)) {
            LOG.info("Debug session stopped");
            terminator.run();
        }
    }
}
