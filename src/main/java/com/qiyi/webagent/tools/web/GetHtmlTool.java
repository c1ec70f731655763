package com.qiyi.webagent.tools.web;

import com.alibaba.fastjson2.JSONObject;
import com.microsoft.playwright.Page;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.tools.Tool;
import com.qiyi.webagent.tools.ToolArguments;

@Tool.Info(
        name = "get_html",
        description = "Return the HTML content after scripts have executed."
)
public class GetHtmlTool extends AbstractWebTool<Void> {

    public GetHtmlTool(BrowserSessionManager sessionManager) {
        super(sessionManager);
    }

    @Override
    protected Void parseArguments(ToolArguments args) {
        return null;
    }

    @Override
    protected JSONObject run(Page page, Void input) {
        JSONObject out = new JSONObject();
        out.put("html", page.content());
        return out;
    }
}
