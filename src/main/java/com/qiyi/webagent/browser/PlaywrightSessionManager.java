package com.qiyi.webagent.browser;

import com.microsoft.playwright.Browser;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.BrowserType;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.Playwright;
import com.qiyi.webagent.config.AppConfig;
import com.qiyi.webagent.util.AppLog;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * 基于 Playwright 的会话管理。
 *
 * <p>Chromium 在首次 resolve 时启动一次，每个会话使用独立的 BrowserContext（cookie/存储互不影响）。
 * 由入口显式构造并注入到工具与编排器中，不是进程级单例。</p>
 */
public class PlaywrightSessionManager implements BrowserSessionManager {
    private static final String SESSION_PREFIX = "sess_";

    private final boolean headless;
    private final int navigationTimeoutMs;
    private final Map<String, BrowserSession> sessions = new LinkedHashMap<>();

    private Playwright playwright;
    private Browser browser;
    private boolean closed = false;

    public PlaywrightSessionManager(boolean headless, int navigationTimeoutMs) {
        this.headless = headless;
        this.navigationTimeoutMs = navigationTimeoutMs;
    }

    public static PlaywrightSessionManager fromConfig(AppConfig cfg) {
        return new PlaywrightSessionManager(cfg.isBrowserHeadless(), cfg.getBrowserNavigationTimeoutMs());
    }

    @Override
    public synchronized BrowserSession resolve(String sessionId) {
        if (closed) {
            throw new IllegalStateException("Session manager has been shut down");
        }
        if (sessionId != null && !sessionId.isEmpty()) {
            BrowserSession existing = sessions.get(sessionId);
            if (existing != null) {
                return existing;
            }
        }

        if (browser == null) {
            AppLog.info("[session] launching chromium, headless=" + headless);
            browser = launchBrowser();
        }
        BrowserContext context = browser.newContext();
        Page page;
        try {
            page = context.newPage();
            page.setDefaultNavigationTimeout(navigationTimeoutMs);
        } catch (RuntimeException e) {
            closeQuietly(context);
            throw e;
        }

        String id = sessionId == null || sessionId.isEmpty() ? mintSessionId() : sessionId;
        BrowserSession session = new BrowserSession(id, context, page);
        sessions.put(id, session);
        AppLog.info("[session] created: id=" + id + ", total=" + sessions.size());
        return session;
    }

    @Override
    public synchronized int sessionCount() {
        return sessions.size();
    }

    @Override
    public synchronized void shutdown() {
        if (closed) {
            return;
        }
        closed = true;
        int count = sessions.size();
        // 逐个移除后再关闭，单个会话关闭失败不影响其余会话
        Iterator<Map.Entry<String, BrowserSession>> it = sessions.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, BrowserSession> e = it.next();
            it.remove();
            closeSession(e.getKey(), e.getValue());
        }
        if (browser != null) {
            try {
                browser.close();
            } catch (Exception e) {
                AppLog.warn("[session] close browser failed: " + e.getMessage());
            }
            browser = null;
        }
        if (playwright != null) {
            try {
                playwright.close();
            } catch (Exception e) {
                AppLog.warn("[session] close playwright failed: " + e.getMessage());
            }
            playwright = null;
        }
        AppLog.info("[session] shutdown done, closedSessions=" + count);
    }

    /**
     * 启动浏览器。测试可覆盖以避免真实进程。
     */
    protected Browser launchBrowser() {
        // 启动失败时保留 driver，下次 resolve 复用
        if (playwright == null) {
            playwright = createPlaywright();
        }
        return playwright.chromium().launch(new BrowserType.LaunchOptions().setHeadless(headless));
    }

    protected Playwright createPlaywright() {
        return Playwright.create();
    }

    protected String mintSessionId() {
        return SESSION_PREFIX + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
    }

    private static void closeQuietly(BrowserContext context) {
        try {
            context.close();
        } catch (Exception e) {
            AppLog.warn("[session] close orphan context failed: " + e.getMessage());
        }
    }

    private static void closeSession(String id, BrowserSession session) {
        try {
            session.getPage().close();
        } catch (Exception e) {
            AppLog.warn("[session] close page failed: id=" + id + ", err=" + e.getMessage());
        }
        try {
            session.getContext().close();
        } catch (Exception e) {
            AppLog.warn("[session] close context failed: id=" + id + ", err=" + e.getMessage());
        }
    }
}
