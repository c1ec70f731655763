package com.qiyi.webagent.tools.web;

import com.alibaba.fastjson2.JSONObject;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.Response;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitUntilState;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.tools.Tool;
import com.qiyi.webagent.tools.ToolArguments;
import com.qiyi.webagent.tools.ToolErrorCode;
import com.qiyi.webagent.tools.ToolException;

import java.net.URI;

@Tool.Info(
        name = "navigate",
        description = "Navigate the page to the provided URL."
)
public class NavigateTool extends AbstractWebTool<String> {
    private final int timeoutMs;

    public NavigateTool(BrowserSessionManager sessionManager, int timeoutMs) {
        super(sessionManager);
        this.timeoutMs = timeoutMs;
    }

    @Override
    public JSONObject getInputSchema() {
        return InputSchema.builder()
                .required("url", "Destination URL (http or https).")
                .build();
    }

    @Override
    protected String parseArguments(ToolArguments args) {
        return args.requireString("url");
    }

    @Override
    protected JSONObject run(Page page, String url) {
        String scheme = schemeOf(url);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            throw new ToolException(ToolErrorCode.INVALID_URL,
                    "Only http(s) URLs are supported (got " + scheme + ").");
        }

        Response response;
        try {
            response = page.navigate(url, new Page.NavigateOptions()
                    .setWaitUntil(WaitUntilState.NETWORKIDLE)
                    .setTimeout(timeoutMs));
        } catch (TimeoutError e) {
            throw new ToolException(ToolErrorCode.NAVIGATION_TIMEOUT, "Navigation to " + url + " timed out.", e);
        } catch (PlaywrightException e) {
            throw new ToolException(ToolErrorCode.NETWORK_ERROR,
                    "Navigation failed for " + url + ": " + e.getMessage(), e);
        }

        JSONObject out = new JSONObject();
        out.put("current_url", page.url());
        out.put("status", response == null ? null : response.status());
        out.put("title", page.title());
        return out;
    }

    static String schemeOf(String url) {
        try {
            String scheme = URI.create(url.trim()).getScheme();
            return scheme == null ? "" : scheme.toLowerCase();
        } catch (IllegalArgumentException e) {
            return "";
        }
    }
}
