package com.qiyi.webagent.tools.web;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.qiyi.webagent.browser.BrowserSession;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.tools.ToolOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

public class ExtractLinksToolTest {

    @Mock
    private BrowserSessionManager sessionManager;

    @Mock
    private BrowserContext context;

    @Mock
    private Page page;

    @Mock
    private Locator anchors;

    private ExtractLinksTool tool;

    @BeforeEach
    public void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(sessionManager.resolve(any())).thenReturn(new BrowserSession("sess_000000000004", context, page));
        when(page.url()).thenReturn("https://example.com/docs/");
        when(page.locator("a")).thenReturn(anchors);

        Locator internal = anchor("guide.html", "https://example.com/docs/guide.html", " Guide ");
        Locator external = anchor("https://www.iana.org/domains/example", "https://www.iana.org/domains/example",
                "More information...");
        Locator empty = anchor("", "https://example.com/docs/", "nothing");
        Locator noHref = anchor(null, "", "no href");
        when(anchors.count()).thenReturn(4);
        when(anchors.nth(0)).thenReturn(internal);
        when(anchors.nth(1)).thenReturn(external);
        when(anchors.nth(2)).thenReturn(empty);
        when(anchors.nth(3)).thenReturn(noHref);

        tool = new ExtractLinksTool(sessionManager);
    }

    private static Locator anchor(String href, String resolved, String text) {
        Locator a = mock(Locator.class);
        when(a.getAttribute("href")).thenReturn(href);
        when(a.evaluate(ExtractLinksTool.HREF_EXPRESSION)).thenReturn(resolved);
        when(a.innerText()).thenReturn(text);
        return a;
    }

    @Test
    public void shouldResolveRelativeLinksAndFlagExternalOnes() {
        ToolOutcome outcome = tool.execute(new JSONObject());

        assertTrue(outcome.isOk());
        JSONArray links = outcome.getData().getJSONArray("links");
        assertEquals(2, links.size());

        JSONObject first = links.getJSONObject(0);
        assertEquals("Guide", first.getString("text"));
        assertEquals("https://example.com/docs/guide.html", first.getString("url"));
        assertFalse(first.getBooleanValue("is_external"));

        JSONObject second = links.getJSONObject(1);
        assertEquals("https://www.iana.org/domains/example", second.getString("url"));
        assertTrue(second.getBooleanValue("is_external"));
    }

    @Test
    public void filterShouldMatchTextOrUrlCaseInsensitively() {
        JSONObject args = new JSONObject();
        args.put("filter_contains", "IANA");

        JSONArray links = tool.execute(args).getData().getJSONArray("links");

        assertEquals(1, links.size());
        assertEquals("More information...", links.getJSONObject(0).getString("text"));
    }

    @Test
    public void queryOnlyAndUnencodedHrefsShouldUseTheBrowserResolvedUrl() {
        when(page.url()).thenReturn("https://shop.example.com/list/page");
        Locator nextPage = anchor("?page=2", "https://shop.example.com/list/page?page=2", "Next");
        Locator file = anchor("my file.pdf", "https://shop.example.com/list/my%20file.pdf", "Download");
        when(anchors.count()).thenReturn(2);
        when(anchors.nth(0)).thenReturn(nextPage);
        when(anchors.nth(1)).thenReturn(file);

        JSONArray links = tool.execute(new JSONObject()).getData().getJSONArray("links");

        assertEquals("https://shop.example.com/list/page?page=2", links.getJSONObject(0).getString("url"));
        assertEquals("https://shop.example.com/list/my%20file.pdf", links.getJSONObject(1).getString("url"));
        assertFalse(links.getJSONObject(0).getBooleanValue("is_external"));
        assertFalse(links.getJSONObject(1).getBooleanValue("is_external"));
    }

    @Test
    public void rawHrefShouldBeKeptWhenTheBrowserGivesNothing() {
        Locator a = anchor("javascript:void(0)", null, "noop");

        assertEquals("javascript:void(0)", ExtractLinksTool.absoluteHref(a, "javascript:void(0)"));
        assertEquals("", ExtractLinksTool.hostOf("mailto:someone@example.com"));
    }
}
