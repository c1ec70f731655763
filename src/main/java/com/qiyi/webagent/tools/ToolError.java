package com.qiyi.webagent.tools;

import com.alibaba.fastjson2.JSONObject;

/**
 * 统一错误载荷 {@code {code, message, details?}}。
 */
public final class ToolError {
    private static final String DEFAULT_MESSAGE = "Internal error";

    private final ToolErrorCode code;
    private final String message;
    private final JSONObject details;

    public ToolError(ToolErrorCode code, String message, JSONObject details) {
        this.code = code == null ? ToolErrorCode.INTERNAL_ERROR : code;
        this.message = message == null || message.trim().isEmpty() ? DEFAULT_MESSAGE : message;
        this.details = details == null || details.isEmpty() ? null : details;
    }

    public static ToolError of(ToolErrorCode code, String message) {
        return new ToolError(code, message, null);
    }

    /**
     * 任意异常转为错误载荷：{@link ToolException} 保留其错误码与 details，其余归为 INTERNAL_ERROR。
     */
    public static ToolError from(Throwable t) {
        if (t instanceof ToolException) {
            return ((ToolException) t).toError();
        }
        return new ToolError(ToolErrorCode.INTERNAL_ERROR, t == null ? null : t.getMessage(), null);
    }

    public ToolErrorCode getCode() {
        return code;
    }

    public String getMessage() {
        return message;
    }

    public JSONObject getDetails() {
        return details;
    }

    public JSONObject toJson() {
        JSONObject obj = new JSONObject();
        obj.put("code", code.name());
        obj.put("message", message);
        if (details != null) {
            obj.put("details", details);
        }
        return obj;
    }

    @Override
    public String toString() {
        return code.name() + ": " + message;
    }
}
