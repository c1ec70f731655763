package com.qiyi.webagent.tools;

import com.alibaba.fastjson2.JSONObject;

/**
 * 工具内部用于提前终止的已分类失败；在工具边界（{@link com.qiyi.webagent.tools.web.AbstractWebTool}
 * 与 {@link ToolExecutionService}）被转换为 {@link ToolOutcome} / {@link ToolCallResult}，不会继续向外抛出。
 */
public class ToolException extends RuntimeException {
    private final ToolErrorCode code;
    private final JSONObject details;

    public ToolException(ToolErrorCode code, String message) {
        this(code, message, null, null);
    }

    public ToolException(ToolErrorCode code, String message, Throwable cause) {
        this(code, message, null, cause);
    }

    public ToolException(ToolErrorCode code, String message, JSONObject details, Throwable cause) {
        super(message, cause);
        this.code = code == null ? ToolErrorCode.INTERNAL_ERROR : code;
        this.details = details;
    }

    public ToolErrorCode getCode() {
        return code;
    }

    public JSONObject getDetails() {
        return details;
    }

    public ToolError toError() {
        return new ToolError(code, getMessage(), details);
    }

    @Override
    public String toString() {
        return code.name() + ": " + getMessage();
    }
}
