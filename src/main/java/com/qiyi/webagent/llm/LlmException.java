package com.qiyi.webagent.llm;

/**
 * 补全服务不可用（缺少 API Key、HTTP 错误、网络异常）。对一次抓取任务而言是致命错误。
 */
public class LlmException extends RuntimeException {

    public LlmException(String message) {
        super(message);
    }

    public LlmException(String message, Throwable cause) {
        super(message, cause);
    }
}
