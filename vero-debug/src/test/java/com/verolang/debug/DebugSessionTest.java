package com.verolang.debug;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.*;

@DisplayName("DebugSession 测试")
class DebugSessionTest {

    private final List<DebugEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicInteger terminations = new AtomicInteger();
    private DebugStateMachine machine;
    private DebugSession session;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        machine = new DebugStateMachine();
        session = new DebugSession(machine, events::add, terminations::incrementAndGet);
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    /**
     * 在执行线程上依次"执行"给定行号的语句
     */
    private Future<List<Integer>> runLines(int... lines) {
        return executor.submit(() -> {
            List<Integer> executed = new ArrayList<>();
            for (int line : lines) {
                session.beforeStep(line, "click", "Page.button");
                executed.add(line);
                session.afterStep(line, "click", true, 1);
            }
            return executed;
        });
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            if (System.currentTimeMillis() > deadline) {
                fail("Condition not reached within 5s");
            }
            Thread.sleep(5);
        }
    }

    private List<String> eventTypes() {
        List<String> types = new ArrayList<>();
        for (DebugEvent event : events) {
            types.add(event.getType() + "@" + event.getLine());
        }
        return types;
    }

    // ============ 暂停与恢复 ============

    @Nested
    @DisplayName("暂停与恢复")
    class PauseAndResume {

        @Test
        @DisplayName("没有断点时不暂停")
        void testNoBreakpoints() throws Exception {
            assertThat(runLines(1, 2, 3).get(5, TimeUnit.SECONDS)).containsExactly(1, 2, 3);
            assertThat(eventTypes()).containsExactly(
                    "step:before@1", "step:after@1", "step:before@2", "step:after@2",
                    "step:before@3", "step:after@3");
        }

        @Test
        @DisplayName("断点处暂停，resume 后继续")
        void testBreakpointThenResume() throws Exception {
            session.handle(DebugCommand.setBreakpoints(Collections.singletonList(2)));
            Future<List<Integer>> run = runLines(1, 2, 3);

            waitUntil(() -> machine.getPausedLine() == 2);
            assertThat(run.isDone()).isFalse();
            assertThat(eventTypes()).endsWith("step:before@2", "execution:paused@2");

            session.handle(DebugCommand.resume());
            assertThat(run.get(5, TimeUnit.SECONDS)).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("step 只放行一条语句")
        void testStep() throws Exception {
            session.handle(DebugCommand.setBreakpoints(Collections.singletonList(1)));
            Future<List<Integer>> run = runLines(1, 2, 3);

            waitUntil(() -> machine.getPausedLine() == 1);
            session.handle(DebugCommand.step());
            waitUntil(() -> machine.getPausedLine() == 2);
            assertThat(eventTypes()).contains("step:after@1").doesNotContain("step:after@2");

            session.handle(DebugCommand.resume());
            assertThat(run.get(5, TimeUnit.SECONDS)).containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("stop 调用终止器且不再执行后续语句")
        void testStop() throws Exception {
            session.handle(DebugCommand.setBreakpoints(Collections.singletonList(2)));
            Future<List<Integer>> run = runLines(1, 2, 3);

            waitUntil(() -> machine.getPausedLine() == 2);
            session.handle(DebugCommand.stop());
            session.handle(DebugCommand.stop());

            assertThatThrownBy(() -> run.get(5, TimeUnit.SECONDS))
                    .hasCauseInstanceOf(DebugStoppedException.class);
            assertThat(terminations.get()).isEqualTo(1);
            assertThat(eventTypes()).doesNotContain("step:before@3");
        }

        @Test
        @DisplayName("variable 事件")
        void testVariable() {
            session.variable("user", Arrays.asList("a", "b"));
            assertThat(events).hasSize(1);
            assertThat(events.get(0).getPayload().get("value").getAsJsonArray().size()).isEqualTo(2);
        }

        @Test
        @DisplayName("事件投递失败不影响执行")
        void testSinkFailure() throws Exception {
            DebugSession failing = new DebugSession(machine, event -> {
                throw new IllegalStateException("closed");
            }, terminations::incrementAndGet);
            failing.beforeStep(1, "click", null);
            failing.afterStep(1, "click", true, 0);
            assertThat(machine.getState()).isEqualTo(DebugState.RUNNING);
        }
    }

    // ============ 命令通道 ============

    @Nested
    @DisplayName("命令通道")
    class Channels {

        @TempDir
        Path tempDir;

        @Test
        @DisplayName("命令文件只处理新追加的完整行")
        void testCommandFile() throws Exception {
            Path file = tempDir.resolve("commands.jsonl");
            CommandFilePoller poller = new CommandFilePoller(file, session);
            assertThat(poller.poll()).isZero();

            CommandFilePoller.append(file, DebugCommand.setBreakpoints(Arrays.asList(4, 6)));
            assertThat(poller.poll()).isEqualTo(1);
            assertThat(machine.getBreakpoints()).containsExactly(4, 6);
            assertThat(poller.poll()).isZero();

            Files.write(file, "{\"type\":\"step\"}".getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.APPEND);
            assertThat(poller.poll()).isZero();
            Files.write(file, "\nnonsense\n".getBytes(StandardCharsets.UTF_8),
                    StandardOpenOption.APPEND);
            assertThat(poller.poll()).isEqualTo(1);
            assertThat(machine.getState()).isEqualTo(DebugState.STEPPING);
        }

        @Test
        @DisplayName("消息通道逐行处理并跳过非法行")
        void testMessageChannel() throws Exception {
            String input = "{\"type\":\"set-breakpoints\",\"breakpoints\":[9]}\n\n{oops\n{\"type\":\"step\"}\n";
            MessageChannelListener listener = new MessageChannelListener(
                    new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), session);
            assertThat(listener.listen()).isEqualTo(2);
            assertThat(machine.getBreakpoints()).containsExactly(9);
            assertThat(machine.getState()).isEqualTo(DebugState.STEPPING);
        }

        @Test
        @DisplayName("两个通道驱动同一个状态机")
        void testBothChannels() throws Exception {
            Path file = tempDir.resolve("commands.jsonl");
            try (CommandFilePoller poller = new CommandFilePoller(file, session, 10)) {
                poller.start();
                session.handle(DebugCommand.setBreakpoints(Collections.singletonList(1)));
                Future<List<Integer>> run = runLines(1, 2);

                waitUntil(() -> machine.getPausedLine() == 1);
                MessageChannelListener listener = new MessageChannelListener(new ByteArrayInputStream(
                        "{\"type\":\"step\"}\n".getBytes(StandardCharsets.UTF_8)), session);
                listener.listen();
                waitUntil(() -> machine.getPausedLine() == 2);

                CommandFilePoller.append(file, DebugCommand.resume());
                assertThat(run.get(5, TimeUnit.SECONDS)).containsExactly(1, 2);
            }
        }

        @Test
        @DisplayName("事件写成 JSON 行")
        void testJsonLineSink() {
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            JsonLineEventSink sink = new JsonLineEventSink(out);
            sink.accept(DebugEvent.paused(3));
            sink.accept(DebugEvent.stepAfter(3, "fill", true, 7));
            String[] lines = out.toString(StandardCharsets.UTF_8).split("\n");
            assertThat(lines).hasSize(2);
            assertThat(DebugEvent.parse(lines[0]).getType()).isEqualTo(DebugEvent.PAUSED);
        }
    }
}
