package com.qiyi.webagent.tools;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

/**
 * 工具入参读取与校验。读取过程中收集全部违规项，最后一次性转为 INTERNAL_ERROR
 * （{@code details.validation_errors}），而不是遇到第一个问题就抛出。
 */
public final class ToolArguments {
    public static final String INVALID_ARGUMENTS_MESSAGE = "Invalid arguments supplied to tool.";

    private final JSONObject raw;
    private final JSONArray violations = new JSONArray();

    public ToolArguments(JSONObject raw) {
        this.raw = raw == null ? new JSONObject() : raw;
    }

    public String requireString(String name) {
        Object v = raw.get(name);
        if (v == null) {
            violation(name, "Field required");
            return null;
        }
        if (!(v instanceof String)) {
            violation(name, "Input should be a valid string");
            return null;
        }
        return (String) v;
    }

    public String optionalString(String name) {
        Object v = raw.get(name);
        if (v == null) {
            return null;
        }
        if (!(v instanceof String)) {
            violation(name, "Input should be a valid string");
            return null;
        }
        String s = (String) v;
        return s.isEmpty() ? null : s;
    }

    public String optionalEnum(String name, String defaultValue, String... allowed) {
        String v = optionalString(name);
        if (v == null) {
            return defaultValue;
        }
        for (String a : allowed) {
            if (a.equals(v)) {
                return v;
            }
        }
        violation(name, "Input should be one of " + String.join(", ", allowed));
        return defaultValue;
    }

    public boolean hasViolations() {
        return !violations.isEmpty();
    }

    public ToolError toError() {
        JSONObject details = new JSONObject();
        details.put("validation_errors", violations);
        return new ToolError(ToolErrorCode.INTERNAL_ERROR, INVALID_ARGUMENTS_MESSAGE, details);
    }

    private void violation(String field, String message) {
        JSONObject v = new JSONObject();
        v.put("field", field);
        v.put("message", message);
        violations.add(v);
    }
}
