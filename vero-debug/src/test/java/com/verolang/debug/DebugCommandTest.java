package com.verolang.debug;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

@DisplayName("调试协议测试")
class DebugCommandTest {

    @Nested
    @DisplayName("命令解析")
    class CommandParsing {

        @Test
        @DisplayName("解析简单命令")
        void testSimpleCommands() {
            assertThat(DebugCommand.parse("{\"type\":\"resume\"}").getType()).isEqualTo(DebugCommand.Type.RESUME);
            assertThat(DebugCommand.parse("{\"type\":\"step\"}").getType()).isEqualTo(DebugCommand.Type.STEP);
            assertThat(DebugCommand.parse("{\"type\":\"stop\"}").getType()).isEqualTo(DebugCommand.Type.STOP);
        }

        @Test
        @DisplayName("set-breakpoints 接受 lines 与 breakpoints 两种字段")
        void testBreakpointAlias() {
            assertThat(DebugCommand.parse("{\"type\":\"set-breakpoints\",\"lines\":[3,7]}").getLines())
                    .containsExactly(3, 7);
            assertThat(DebugCommand.parse("{\"type\":\"set-breakpoints\",\"breakpoints\":[12]}").getLines())
                    .containsExactly(12);
            assertThat(DebugCommand.parse("{\"type\":\"set-breakpoints\"}").getLines()).isEmpty();
        }

        @Test
        @DisplayName("序列化后可以再解析")
        void testToJson() {
            DebugCommand command = DebugCommand.setBreakpoints(Arrays.asList(4, 9));
            assertThat(command.toJson()).isEqualTo("{\"type\":\"set-breakpoints\",\"lines\":[4,9]}");
            assertThat(DebugCommand.resume().toJson()).isEqualTo("{\"type\":\"resume\"}");
        }

        @Test
        @DisplayName("非法命令")
        void testMalformed() {
            assertThatThrownBy(() -> DebugCommand.parse("not json {"))
                    .isInstanceOf(DebugProtocolException.class);
            assertThatThrownBy(() -> DebugCommand.parse("[1,2]"))
                    .isInstanceOf(DebugProtocolException.class);
            assertThatThrownBy(() -> DebugCommand.parse("{\"lines\":[1]}"))
                    .hasMessageContaining("no 'type'");
            assertThatThrownBy(() -> DebugCommand.parse("{\"type\":\"pause\"}"))
                    .hasMessageContaining("Unknown debug command type 'pause'");
            assertThatThrownBy(() -> DebugCommand.parse("{\"type\":\"set-breakpoints\",\"lines\":[\"x\"]}"))
                    .isInstanceOf(DebugProtocolException.class);
        }
    }

    @Nested
    @DisplayName("事件")
    class Events {

        @Test
        @DisplayName("step 事件字段")
        void testStepEvents() {
            assertThat(DebugEvent.stepBefore(5, "click", "LoginPage.submitBtn").toJson())
                    .isEqualTo("{\"type\":\"step:before\",\"line\":5,\"action\":\"click\",\"target\":\"LoginPage.submitBtn\"}");
            DebugEvent after = DebugEvent.stepAfter(5, "click", false, 42);
            assertThat(after.getPayload().get("success").getAsBoolean()).isFalse();
            assertThat(after.getPayload().get("duration").getAsLong()).isEqualTo(42);
        }

        @Test
        @DisplayName("variable 事件保留空值")
        void testVariableEvent() {
            assertThat(DebugEvent.variable("user", null).toJson())
                    .isEqualTo("{\"type\":\"variable\",\"name\":\"user\",\"value\":null}");
            assertThat(DebugEvent.variable("total", 3).getPayload().get("value").getAsInt()).isEqualTo(3);
        }

        @Test
        @DisplayName("解析事件")
        void testParse() {
            DebugEvent event = DebugEvent.parse("{\"type\":\"execution:paused\",\"line\":8}");
            assertThat(event.getType()).isEqualTo(DebugEvent.PAUSED);
            assertThat(event.getLine()).isEqualTo(8);
            assertThatThrownBy(() -> DebugEvent.parse("{}")).isInstanceOf(DebugProtocolException.class);
        }
    }
}
