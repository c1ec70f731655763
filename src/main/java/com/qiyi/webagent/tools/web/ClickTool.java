package com.qiyi.webagent.tools.web;

import com.alibaba.fastjson2.JSONObject;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.microsoft.playwright.options.WaitForSelectorState;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.tools.Tool;
import com.qiyi.webagent.tools.ToolArguments;
import com.qiyi.webagent.tools.ToolErrorCode;
import com.qiyi.webagent.tools.ToolException;
import com.qiyi.webagent.util.AppLog;

@Tool.Info(
        name = "click",
        description = "Click a visible, enabled element identified by CSS selector."
)
public class ClickTool extends AbstractWebTool<String> {
    static final int SCROLL_TIMEOUT_MS = 2_000;
    static final int VISIBLE_TIMEOUT_MS = 5_000;

    public ClickTool(BrowserSessionManager sessionManager) {
        super(sessionManager);
    }

    @Override
    public JSONObject getInputSchema() {
        return InputSchema.builder()
                .required("selector", "CSS selector targeting the element to click.")
                .build();
    }

    @Override
    protected String parseArguments(ToolArguments args) {
        return args.requireString("selector");
    }

    @Override
    protected JSONObject run(Page page, String selector) {
        Locator element = page.locator(selector);
        if (element.count() == 0) {
            throw new ToolException(ToolErrorCode.ELEMENT_NOT_FOUND, "No element matches selector '" + selector + "'.");
        }

        Locator target = element.first();
        try {
            target.scrollIntoViewIfNeeded(new Locator.ScrollIntoViewIfNeededOptions().setTimeout(SCROLL_TIMEOUT_MS));
        } catch (PlaywrightException e) {
            // 滚动失败不影响后续可见性判断
            AppLog.debug("[tool] click scrollIntoView skipped: selector=" + selector + ", err=" + e.getMessage());
        }

        try {
            target.waitFor(new Locator.WaitForOptions()
                    .setState(WaitForSelectorState.VISIBLE)
                    .setTimeout(VISIBLE_TIMEOUT_MS));
        } catch (TimeoutError e) {
            throw new ToolException(ToolErrorCode.ELEMENT_NOT_VISIBLE, "Element '" + selector + "' never became visible.", e);
        }

        if (!target.isEnabled()) {
            throw new ToolException(ToolErrorCode.ELEMENT_NOT_CLICKABLE, "Element '" + selector + "' is disabled.");
        }

        try {
            target.click();
        } catch (TimeoutError e) {
            throw new ToolException(ToolErrorCode.ELEMENT_NOT_CLICKABLE, "Element '" + selector + "' was not clickable.", e);
        } catch (PlaywrightException e) {
            throw new ToolException(ToolErrorCode.INTERNAL_ERROR, "Clicking '" + selector + "' failed: " + e.getMessage(), e);
        }

        JSONObject out = new JSONObject();
        out.put("clicked", true);
        return out;
    }
}
