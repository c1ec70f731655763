package com.qiyi.webagent.server;

import com.alibaba.fastjson2.JSONArray;

/**
 * 请求行或 tools/call 参数不合法。details 为 {@code [{field, message}]}。
 */
public class InvalidRequestException extends Exception {
    private final JSONArray details;

    public InvalidRequestException(String message, JSONArray details) {
        super(message);
        this.details = details == null ? new JSONArray() : details;
    }

    public JSONArray getDetails() {
        return details;
    }
}
