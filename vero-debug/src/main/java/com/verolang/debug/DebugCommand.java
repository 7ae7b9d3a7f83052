package com.verolang.debug;

import com.google.gson.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 调试器发往被调试进程的命令
 *
 * <p>线上格式：{@code {"type": "resume" | "step" | "stop" | "set-breakpoints", "lines": [..]}}，
 * {@code breakpoints} 作为 {@code lines} 的别名被接受。</p>
 */
public final class DebugCommand {

    public enum Type {
        RESUME("resume"),
        STEP("step"),
        STOP("stop"),
        SET_BREAKPOINTS("set-breakpoints");

        private final String wireName;

        Type(String wireName) {
            this.wireName = wireName;
        }

        public String getWireName() {
            return wireName;
        }

        public static Type fromWireName(String name) {
            for (Type type : values()) {
                if (type.wireName.equals(name)) {
                    return type;
                }
            }
            return null;
        }
    }

    private static final Gson GSON = new Gson();

    private final Type type;
    private final List<Integer> lines;

    private DebugCommand(Type type, List<Integer> lines) {
        this.type = type;
        this.lines = Collections.unmodifiableList(new ArrayList<>(lines));
    }

    public static DebugCommand resume() {
        return new DebugCommand(Type.RESUME, Collections.emptyList());
    }

    public static DebugCommand step() {
        return new DebugCommand(Type.STEP, Collections.emptyList());
    }

    public static DebugCommand stop() {
        return new DebugCommand(Type.STOP, Collections.emptyList());
    }

    public static DebugCommand setBreakpoints(List<Integer> lines) {
        return new DebugCommand(Type.SET_BREAKPOINTS, lines);
    }

    public Type getType() {
        return type;
    }

    /** 断点行号，仅 set-breakpoints 有值 */
    public List<Integer> getLines() {
        return lines;
    }

    /**
     * 解析一行 JSON 命令
     *
     * @throws DebugProtocolException JSON 非法、缺少 type 或 type 未知
     */
    public static DebugCommand parse(String json) {
        JsonObject object;
        try {
            JsonElement element = JsonParser.parseString(json);
            if (!element.isJsonObject()) {
                throw new DebugProtocolException("Debug command must be a JSON object: " + json);
            }
            object = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new DebugProtocolException("Malformed debug command: " + json, e);
        }

        JsonElement typeElement = object.get("type");
        if (typeElement == null || !typeElement.isJsonPrimitive()) {
            throw new DebugProtocolException("Debug command has no 'type': " + json);
        }
        Type type = Type.fromWireName(typeElement.getAsString());
        if (type == null) {
            throw new DebugProtocolException("Unknown debug command type '" + typeElement.getAsString() + "'");
        }

        List<Integer> lines = new ArrayList<>();
        if (type == Type.SET_BREAKPOINTS) {
            JsonElement array = object.has("lines") ? object.get("lines") : object.get("breakpoints");
            if (array != null && !array.isJsonNull()) {
                if (!array.isJsonArray()) {
                    throw new DebugProtocolException("'lines' must be an array: " + json);
                }
                for (JsonElement line : array.getAsJsonArray()) {
                    try {
                        lines.add(line.getAsInt());
                    } catch (RuntimeException e) {
                        throw new DebugProtocolException("Breakpoint line is not a number: " + line, e);
                    }
                }
            }
        }
        return new DebugCommand(type, lines);
    }

    public String toJson() {
        JsonObject object = new JsonObject();
        object.addProperty("type", type.getWireName());
        if (type == Type.SET_BREAKPOINTS) {
            JsonArray array = new JsonArray();
            for (Integer line : lines) {
                array.add(line);
            }
            object.add("lines", array);
        }
        return GSON.toJson(object);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
