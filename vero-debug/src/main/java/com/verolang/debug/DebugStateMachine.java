package com.verolang.debug;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/**
 * 暂停/单步/断点状态机
 *
 * <p>命令线程调用 {@link #apply}，执行线程在每条语句之前调用 {@link #enterStatement}
 * 和 {@link #awaitRelease}。所有状态由对象监视器保护，两个命令通道共享同一实例。</p>
 */
public final class DebugStateMachine {

    private static final Logger LOG = Logger.getLogger(DebugStateMachine.class.getName());

    private final Set<Integer> breakpoints = new TreeSet<>();
    private DebugState state = DebugState.RUNNING;
    private int pausedLine = -1;

    public DebugStateMachine() {
    }

    public DebugStateMachine(Collection<Integer> initialBreakpoints) {
        breakpoints.addAll(initialBreakpoints);
    }

    public synchronized DebugState getState() {
        return state;
    }

    public synchronized Set<Integer> getBreakpoints() {
        return Collections.unmodifiableSet(new TreeSet<>(breakpoints));
    }

    /** 当前暂停所在行；未暂停时为 -1 */
    public synchronized int getPausedLine() {
        return state == DebugState.PAUSED ? pausedLine : -1;
    }

    /**
     * 应用一条命令并唤醒等待中的执行线程
     *
     * @return 应用后的状态
     */
    public synchronized DebugState apply(DebugCommand command) {
        if (state == DebugState.STOPPED) {
            return state;
        }
        switch (command.getType()) {
            case RESUME:
                state = DebugState.RUNNING;
                break;
            case STEP:
                state = DebugState.STEPPING;
                break;
            case STOP:
                state = DebugState.STOPPED;
                break;
            case SET_BREAKPOINTS:
                breakpoints.clear();
                breakpoints.addAll(command.getLines());
                break;
            default:
                throw new IllegalStateException("Unknown command: " + command.getType());
        }
        LOG.fine("Applied " + command.getType() + " -> " + state);
        notifyAll();
        return state;
    }

    /**
     * 语句边界：单步模式或命中断点时进入暂停
     *
     * @return 是否需要暂停
     */
    public synchronized boolean enterStatement(int line) {
        if (state == DebugState.STOPPED) {
            return false;
        }
        if (state == DebugState.STEPPING || breakpoints.contains(line)) {
            state = DebugState.PAUSED;
            pausedLine = line;
            return true;
        }
        return false;
    }

    /**
     * 阻塞直到收到 resume、step 或 stop
     *
     * @return 释放后的状态；STOPPED 表示不应再执行
     */
    public synchronized DebugState awaitRelease() throws InterruptedException {
        while (state == DebugState.PAUSED) {
            wait();
        }
        return state;
    }

    /**
     * 带超时的等待，超时后仍处于暂停则返回 PAUSED
     */
    public synchronized DebugState awaitRelease(long timeoutMs) throws InterruptedException {
        long deadline = System.currentTimeMillis() + timeoutMs;
        while (state == DebugState.PAUSED) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                break;
            }
            wait(remaining);
        }
        return state;
    }
}
