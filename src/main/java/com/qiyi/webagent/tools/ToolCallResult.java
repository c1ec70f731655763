package com.qiyi.webagent.tools;

import com.alibaba.fastjson2.JSONObject;

import java.util.LinkedHashMap;

/**
 * 工具调用的统一信封：{@code {ok, tool, session_id?, data|error, meta:{ts, duration_ms}}}。
 */
public final class ToolCallResult {
    private final boolean ok;
    private final String tool;
    private final String sessionId;
    private final JSONObject data;
    private final ToolError error;
    private final String ts;
    private final long durationMs;

    private ToolCallResult(boolean ok, String tool, String sessionId, JSONObject data, ToolError error,
                           String ts, long durationMs) {
        this.ok = ok;
        this.tool = tool;
        this.sessionId = sessionId;
        this.data = data;
        this.error = error;
        this.ts = ts;
        this.durationMs = Math.max(0L, durationMs);
    }

    public static ToolCallResult success(String tool, String sessionId, JSONObject data, String ts, long durationMs) {
        return new ToolCallResult(true, tool, sessionId, data == null ? new JSONObject() : data, null, ts, durationMs);
    }

    public static ToolCallResult failure(String tool, String sessionId, ToolError error, String ts, long durationMs) {
        return new ToolCallResult(false, tool, sessionId, null,
                error == null ? ToolError.of(ToolErrorCode.INTERNAL_ERROR, null) : error, ts, durationMs);
    }

    public boolean isOk() {
        return ok;
    }

    public String getTool() {
        return tool;
    }

    public String getSessionId() {
        return sessionId;
    }

    public JSONObject getData() {
        return data;
    }

    public ToolError getError() {
        return error;
    }

    public String getTs() {
        return ts;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject(new LinkedHashMap<>());
        obj.put("ok", ok);
        obj.put("tool", tool);
        if (sessionId != null) {
            obj.put("session_id", sessionId);
        }
        if (ok) {
            obj.put("data", data);
        } else {
            obj.put("error", error.toJson());
        }
        JSONObject meta = new JSONObject();
        meta.put("ts", ts);
        meta.put("duration_ms", durationMs);
        obj.put("meta", meta);
        return obj;
    }

    @Override
    public String toString() {
        return toJson().toJSONString();
    }
}
