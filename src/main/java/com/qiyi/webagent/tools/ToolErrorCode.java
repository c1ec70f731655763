package com.qiyi.webagent.tools;

/**
 * 对外暴露的稳定错误码。客户端依赖这些字符串，新增可以，改名不行。
 */
public enum ToolErrorCode {
    INVALID_URL,
    NAVIGATION_TIMEOUT,
    NETWORK_ERROR,
    ELEMENT_NOT_FOUND,
    ELEMENT_NOT_VISIBLE,
    ELEMENT_NOT_EDITABLE,
    ELEMENT_NOT_CLICKABLE,
    INTERNAL_ERROR;

    /**
     * 宽松解析：未知或空值一律归为 {@link #INTERNAL_ERROR}。
     */
    public static ToolErrorCode fromString(String raw) {
        if (raw == null) return INTERNAL_ERROR;
        String v = raw.trim();
        for (ToolErrorCode code : values()) {
            if (code.name().equalsIgnoreCase(v)) {
                return code;
            }
        }
        return INTERNAL_ERROR;
    }
}
