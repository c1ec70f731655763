package com.qiyi.webagent.browser;

import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;

/**
 * 会话 = 会话 ID + 独立的 BrowserContext/Page。同一 ID 在进程生命周期内始终对应同一个 Page。
 */
public final class BrowserSession {
    private final String id;
    private final BrowserContext context;
    private final Page page;

    public BrowserSession(String id, BrowserContext context, Page page) {
        this.id = id;
        this.context = context;
        this.page = page;
    }

    public String getId() {
        return id;
    }

    public BrowserContext getContext() {
        return context;
    }

    public Page getPage() {
        return page;
    }
}
