package com.qiyi.webagent.browser;

/**
 * 会话边界：把会话 ID 解析为页面句柄，并负责浏览器生命周期。
 */
public interface BrowserSessionManager {

    /**
     * 已知 ID 返回原会话；否则新建隔离的 context + page，ID 为传入值或新生成的值。
     */
    BrowserSession resolve(String sessionId);

    int sessionCount();

    /**
     * 释放全部会话与浏览器。幂等，可重复调用。
     */
    void shutdown();
}
