package com.qiyi.webagent.tools;

import com.alibaba.fastjson2.JSONObject;

/**
 * 单次工具执行的结果：成功（data）或失败（error）二选一。
 *
 * <p>工具通过返回值表达已分类的失败，而不是把异常抛给调用方。</p>
 */
public final class ToolOutcome {
    private final String sessionId;
    private final JSONObject data;
    private final ToolError error;

    private ToolOutcome(String sessionId, JSONObject data, ToolError error) {
        this.sessionId = sessionId;
        this.data = data;
        this.error = error;
    }

    public static ToolOutcome ok(String sessionId, JSONObject data) {
        return new ToolOutcome(sessionId, data == null ? new JSONObject() : data, null);
    }

    public static ToolOutcome fail(String sessionId, ToolError error) {
        return new ToolOutcome(sessionId, null,
                error == null ? ToolError.of(ToolErrorCode.INTERNAL_ERROR, null) : error);
    }

    public boolean isOk() {
        return error == null;
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
}
