package com.qiyi.webagent.tools.web;

import com.alibaba.fastjson2.JSONObject;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.tools.Tool;
import com.qiyi.webagent.tools.ToolArguments;
import com.qiyi.webagent.tools.ToolErrorCode;
import com.qiyi.webagent.tools.ToolException;

import java.util.Base64;

@Tool.Info(
        name = "screenshot",
        description = "Capture a PNG screenshot of the current page."
)
public class ScreenshotTool extends AbstractWebTool<String> {
    public static final String MODE_VIEWPORT = "viewport";
    public static final String MODE_FULLPAGE = "fullpage";

    public ScreenshotTool(BrowserSessionManager sessionManager) {
        super(sessionManager);
    }

    @Override
    public JSONObject getInputSchema() {
        return InputSchema.builder()
                .optionalEnum("mode", "Screenshot mode: 'viewport' or 'fullpage'.", MODE_VIEWPORT, MODE_VIEWPORT, MODE_FULLPAGE)
                .build();
    }

    @Override
    protected String parseArguments(ToolArguments args) {
        return args.optionalEnum("mode", MODE_VIEWPORT, MODE_VIEWPORT, MODE_FULLPAGE);
    }

    @Override
    protected JSONObject run(Page page, String mode) {
        byte[] image;
        try {
            image = page.screenshot(new Page.ScreenshotOptions().setFullPage(MODE_FULLPAGE.equals(mode)));
        } catch (PlaywrightException e) {
            throw new ToolException(ToolErrorCode.INTERNAL_ERROR, "Screenshot failed: " + e.getMessage(), e);
        }

        JSONObject out = new JSONObject();
        out.put("current_url", page.url());
        out.put("mode", mode);
        out.put("image_b64", Base64.getEncoder().encodeToString(image));
        return out;
    }
}
