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

@Tool.Info(
        name = "fill",
        description = "Fill a text input or textarea using a CSS selector."
)
public class FillTool extends AbstractWebTool<FillTool.Input> {
    static final int VISIBLE_TIMEOUT_MS = 5_000;

    static final class Input {
        final String selector;
        final String value;

        Input(String selector, String value) {
            this.selector = selector;
            this.value = value;
        }
    }

    public FillTool(BrowserSessionManager sessionManager) {
        super(sessionManager);
    }

    @Override
    public JSONObject getInputSchema() {
        return InputSchema.builder()
                .required("selector", "CSS selector targeting the field to fill.")
                .required("value", "Value to type into the element.")
                .build();
    }

    @Override
    protected Input parseArguments(ToolArguments args) {
        return new Input(args.requireString("selector"), args.requireString("value"));
    }

    @Override
    protected JSONObject run(Page page, Input input) {
        Locator element = page.locator(input.selector);
        if (element.count() == 0) {
            throw new ToolException(ToolErrorCode.ELEMENT_NOT_FOUND,
                    "No element matches selector '" + input.selector + "'.");
        }

        Locator target = element.first();
        try {
            target.waitFor(new Locator.WaitForOptions()
                    .setState(WaitForSelectorState.VISIBLE)
                    .setTimeout(VISIBLE_TIMEOUT_MS));
        } catch (TimeoutError e) {
            throw new ToolException(ToolErrorCode.ELEMENT_NOT_VISIBLE,
                    "Element '" + input.selector + "' never became visible.", e);
        }

        if (!target.isEditable()) {
            throw new ToolException(ToolErrorCode.ELEMENT_NOT_EDITABLE,
                    "Element '" + input.selector + "' is not editable.");
        }

        try {
            target.fill(input.value);
        } catch (PlaywrightException e) {
            throw new ToolException(ToolErrorCode.INTERNAL_ERROR,
                    "Filling '" + input.selector + "' failed: " + e.getMessage(), e);
        }

        JSONObject out = new JSONObject();
        out.put("filled", true);
        return out;
    }
}
