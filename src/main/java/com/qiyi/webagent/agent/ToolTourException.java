package com.qiyi.webagent.agent;

/**
 * 工具导览中某一步工具调用失败。
 */
public class ToolTourException extends RuntimeException {
    private final String tool;
    private final String code;

    public ToolTourException(String tool, String code, String message) {
        super(tool + " failed (" + code + "): " + message);
        this.tool = tool;
        this.code = code;
    }

    public String getTool() {
        return tool;
    }

    public String getCode() {
        return code;
    }
}
