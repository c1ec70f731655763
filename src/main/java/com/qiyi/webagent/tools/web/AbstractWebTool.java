package com.qiyi.webagent.tools.web;

import com.alibaba.fastjson2.JSONObject;
import com.microsoft.playwright.Page;
import com.qiyi.webagent.browser.BrowserSession;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.tools.Tool;
import com.qiyi.webagent.tools.ToolArguments;
import com.qiyi.webagent.tools.ToolException;
import com.qiyi.webagent.tools.ToolOutcome;

/**
 * 浏览器类工具的公共骨架：校验入参 → 解析会话 → 在会话页面上执行。
 *
 * @param <P> 解析后的入参类型
 */
public abstract class AbstractWebTool<P> implements Tool {
    protected final BrowserSessionManager sessionManager;

    protected AbstractWebTool(BrowserSessionManager sessionManager) {
        this.sessionManager = sessionManager;
    }

    @Override
    public final ToolOutcome execute(JSONObject arguments) {
        ToolArguments args = new ToolArguments(arguments);
        String requestedSession = args.optionalString(ARG_SESSION_ID);
        P input = parseArguments(args);
        if (args.hasViolations()) {
            return ToolOutcome.fail(requestedSession, args.toError());
        }

        BrowserSession session = sessionManager.resolve(requestedSession);
        try {
            return ToolOutcome.ok(session.getId(), run(session.getPage(), input));
        } catch (ToolException e) {
            return ToolOutcome.fail(session.getId(), e.toError());
        }
    }

    /**
     * 读取工具自身的入参；问题记录到 args 中即可，不要抛出。
     */
    protected abstract P parseArguments(ToolArguments args);

    /**
     * 在会话页面上执行。已分类失败抛 {@link ToolException}；其他异常交由执行服务兜底。
     */
    protected abstract JSONObject run(Page page, P input);
}
