package com.qiyi.webagent.server;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.alibaba.fastjson2.JSONWriter;

import java.util.LinkedHashMap;

/**
 * 单行 JSON 响应：{@code {id, result}} 或 {@code {id, error}}。id 为 null 时也输出。
 */
public final class McpResponse {
    private final Object id;
    private final JSONObject result;
    private final JSONObject error;

    private McpResponse(Object id, JSONObject result, JSONObject error) {
        this.id = id;
        this.result = result;
        this.error = error;
    }

    public static McpResponse result(Object id, JSONObject result) {
        return new McpResponse(id, result, null);
    }

    public static McpResponse error(Object id, JSONObject error) {
        return new McpResponse(id, null, error);
    }

    public JSONObject toJsonObject() {
        JSONObject obj = new JSONObject(new LinkedHashMap<>());
        obj.put("id", id);
        if (result != null) {
            obj.put("result", result);
        }
        if (error != null) {
            obj.put("error", error);
        }
        return obj;
    }

    public String toJson() {
        return JSON.toJSONString(toJsonObject(), JSONWriter.Feature.WriteMapNullValue);
    }
}
