package com.qiyi.webagent.tools.web;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.tools.Tool;
import com.qiyi.webagent.tools.ToolArguments;

import java.net.URI;
import java.util.Locale;

@Tool.Info(
        name = "extract_links",
        description = "Return anchors on the page with text, URL, and external flag."
)
public class ExtractLinksTool extends AbstractWebTool<String> {
    static final String HREF_EXPRESSION = "a => a.href";

    public ExtractLinksTool(BrowserSessionManager sessionManager) {
        super(sessionManager);
    }

    @Override
    public JSONObject getInputSchema() {
        return InputSchema.builder()
                .optional("filter_contains", "Only keep links containing this text (case-insensitive).")
                .build();
    }

    @Override
    protected String parseArguments(ToolArguments args) {
        return args.optionalString("filter_contains");
    }

    @Override
    protected JSONObject run(Page page, String filter) {
        String currentUrl = page.url();
        String currentHost = hostOf(currentUrl);
        String needle = filter == null ? null : filter.toLowerCase(Locale.ROOT);

        JSONArray links = new JSONArray();
        Locator anchors = page.locator("a");
        int count = anchors.count();
        for (int i = 0; i < count; i++) {
            Locator anchor = anchors.nth(i);
            String href = safeTrim(anchor.getAttribute("href"));
            if (href.isEmpty()) continue;

            String absolute = absoluteHref(anchor, href);
            String label = safeTrim(anchor.innerText());
            String host = hostOf(absolute);
            boolean external = !host.isEmpty() && !host.equals(currentHost);

            if (needle != null && !(label + " " + absolute).toLowerCase(Locale.ROOT).contains(needle)) {
                continue;
            }

            JSONObject link = new JSONObject();
            link.put("text", label);
            link.put("url", absolute);
            link.put("is_external", external);
            links.add(link);
        }

        JSONObject out = new JSONObject();
        out.put("links", links);
        return out;
    }

    /**
     * 由浏览器按文档 base URL 解析出的绝对地址（{@code HTMLAnchorElement.href}）；取不到时退回原始属性值。
     */
    static String absoluteHref(Locator anchor, String rawHref) {
        Object resolved = anchor.evaluate(HREF_EXPRESSION);
        if (resolved instanceof String && !((String) resolved).isEmpty()) {
            return (String) resolved;
        }
        return rawHref;
    }

    static String hostOf(String url) {
        try {
            String authority = URI.create(url).getRawAuthority();
            return authority == null ? "" : authority;
        } catch (IllegalArgumentException e) {
            return "";
        }
    }

    private static String safeTrim(String s) {
        return s == null ? "" : s.trim();
    }
}
