package com.qiyi.webagent.server;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONException;
import com.alibaba.fastjson2.JSONObject;

/**
 * 单行 JSON 请求：{@code {id?, method, params?}}。
 */
public final class McpRequest {
    public static final String INVALID_PAYLOAD = "Invalid request payload";

    private final Object id;
    private final String method;
    private final JSONObject params;

    public McpRequest(Object id, String method, JSONObject params) {
        this.id = id;
        this.method = method;
        this.params = params == null ? new JSONObject() : params;
    }

    /**
     * 解析并校验一行请求。id 只允许字符串、数字或 null；method 必须是字符串；params 若存在必须是对象。
     */
    public static McpRequest parse(String line) throws InvalidRequestException {
        Object parsed;
        try {
            parsed = JSON.parse(line);
        } catch (JSONException e) {
            throw new InvalidRequestException(INVALID_PAYLOAD, details("$", "Invalid JSON: " + e.getMessage()));
        }
        if (!(parsed instanceof JSONObject)) {
            throw new InvalidRequestException(INVALID_PAYLOAD, details("$", "Input should be an object"));
        }

        JSONObject obj = (JSONObject) parsed;
        JSONArray problems = new JSONArray();

        Object id = obj.get("id");
        if (id != null && !(id instanceof String) && !(id instanceof Number)) {
            problems.add(problem("id", "Input should be a valid string or integer"));
        }

        Object method = obj.get("method");
        if (method == null) {
            problems.add(problem("method", "Field required"));
        } else if (!(method instanceof String)) {
            problems.add(problem("method", "Input should be a valid string"));
        }

        Object params = obj.get("params");
        if (params != null && !(params instanceof JSONObject)) {
            problems.add(problem("params", "Input should be a valid dictionary"));
        }

        if (!problems.isEmpty()) {
            throw new InvalidRequestException(INVALID_PAYLOAD, problems);
        }
        return new McpRequest(id, (String) method, (JSONObject) params);
    }

    static JSONObject problem(String field, String message) {
        JSONObject p = new JSONObject();
        p.put("field", field);
        p.put("message", message);
        return p;
    }

    private static JSONArray details(String field, String message) {
        JSONArray arr = new JSONArray();
        arr.add(problem(field, message));
        return arr;
    }

    public Object getId() {
        return id;
    }

    public String getMethod() {
        return method;
    }

    public JSONObject getParams() {
        return params;
    }
}
