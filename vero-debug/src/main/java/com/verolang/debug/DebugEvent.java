package com.verolang.debug;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

/**
 * 被调试进程发出的事件：step:before、step:after、execution:paused、variable
 */
public final class DebugEvent {

    public static final String STEP_BEFORE = "step:before";
    public static final String STEP_AFTER = "step:after";
    public static final String PAUSED = "execution:paused";
    public static final String VARIABLE = "variable";

    private static final Gson GSON = new GsonBuilder().serializeNulls().create();

    private final JsonObject payload;

    private DebugEvent(JsonObject payload) {
        this.payload = payload;
    }

    private static JsonObject typed(String type) {
        JsonObject object = new JsonObject();
        object.addProperty("type", type);
        return object;
    }

    public static DebugEvent stepBefore(int line, String action, String target) {
        JsonObject object = typed(STEP_BEFORE);
        object.addProperty("line", line);
        object.addProperty("action", action);
        if (target != null) {
            object.addProperty("target", target);
        }
        return new DebugEvent(object);
    }

    public static DebugEvent stepAfter(int line, String action, boolean success, long durationMs) {
        JsonObject object = typed(STEP_AFTER);
        object.addProperty("line", line);
        object.addProperty("action", action);
        object.addProperty("success", success);
        object.addProperty("duration", durationMs);
        return new DebugEvent(object);
    }

    public static DebugEvent paused(int line) {
        JsonObject object = typed(PAUSED);
        object.addProperty("line", line);
        return new DebugEvent(object);
    }

    public static DebugEvent variable(String name, Object value) {
        JsonObject object = typed(VARIABLE);
        object.addProperty("name", name);
        object.add("value", value != null ? GSON.toJsonTree(value) : JsonNull.INSTANCE);
        return new DebugEvent(object);
    }

    /**
     * 解析一行事件 JSON
     *
     * @throws DebugProtocolException JSON 非法或缺少 type
     */
    public static DebugEvent parse(String json) {
        JsonElement element;
        try {
            element = JsonParser.parseString(json);
        } catch (JsonParseException e) {
            throw new DebugProtocolException("Malformed debug event: " + json, e);
        }
        if (!element.isJsonObject() || !element.getAsJsonObject().has("type")) {
            throw new DebugProtocolException("Debug event must be an object with 'type': " + json);
        }
        return new DebugEvent(element.getAsJsonObject());
    }

    public String getType() {
        return payload.get("type").getAsString();
    }

    /** 行号；没有行号的事件返回 -1 */
    public int getLine() {
        return payload.has("line") ? payload.get("line").getAsInt() : -1;
    }

    public JsonObject getPayload() {
        return payload.deepCopy();
    }

    public String toJson() {
        return GSON.toJson(payload);
    }

    @Override
    public String toString() {
        return toJson();
    }
}
