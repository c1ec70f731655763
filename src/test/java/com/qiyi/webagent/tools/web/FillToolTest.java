package com.qiyi.webagent.tools.web;

import com.alibaba.fastjson2.JSONObject;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Locator;
import com.microsoft.playwright.Page;
import com.microsoft.playwright.PlaywrightException;
import com.microsoft.playwright.TimeoutError;
import com.qiyi.webagent.browser.BrowserSession;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.tools.ToolErrorCode;
import com.qiyi.webagent.tools.ToolOutcome;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class FillToolTest {

    @Mock
    private BrowserSessionManager sessionManager;

    @Mock
    private BrowserContext context;

    @Mock
    private Page page;

    @Mock
    private Locator locator;

    private FillTool tool;

    @BeforeEach
    public void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(sessionManager.resolve(any())).thenReturn(new BrowserSession("sess_000000000002", context, page));
        when(page.locator(anyString())).thenReturn(locator);
        when(locator.first()).thenReturn(locator);
        when(locator.count()).thenReturn(1);
        when(locator.isEditable()).thenReturn(true);
        tool = new FillTool(sessionManager);
    }

    private static JSONObject args(String selector, String value) {
        JSONObject args = new JSONObject();
        args.put("selector", selector);
        args.put("value", value);
        return args;
    }

    @Test
    public void editableFieldShouldBeFilled() {
        ToolOutcome outcome = tool.execute(args("#q", "playwright"));

        assertTrue(outcome.isOk());
        assertTrue(outcome.getData().getBooleanValue("filled"));
        verify(locator).fill("playwright");
    }

    @Test
    public void missingElementShouldReportNotFound() {
        when(locator.count()).thenReturn(0);

        ToolOutcome outcome = tool.execute(args("#nope", "x"));

        assertEquals(ToolErrorCode.ELEMENT_NOT_FOUND, outcome.getError().getCode());
        verify(locator, never()).fill(anyString());
    }

    @Test
    public void hiddenElementShouldReportNotVisible() {
        doThrow(new TimeoutError("Timeout 5000ms exceeded")).when(locator).waitFor(any());

        assertEquals(ToolErrorCode.ELEMENT_NOT_VISIBLE, tool.execute(args("#q", "x")).getError().getCode());
    }

    @Test
    public void readOnlyElementShouldReportNotEditable() {
        when(locator.isEditable()).thenReturn(false);

        ToolOutcome outcome = tool.execute(args("#ro", "x"));

        assertEquals(ToolErrorCode.ELEMENT_NOT_EDITABLE, outcome.getError().getCode());
        assertEquals("Element '#ro' is not editable.", outcome.getError().getMessage());
    }

    @Test
    public void playwrightFailureWhileFillingShouldBeInternalError() {
        doThrow(new PlaywrightException("Element is not an <input>")).when(locator).fill(anyString());

        ToolOutcome outcome = tool.execute(args("div", "x"));

        assertEquals(ToolErrorCode.INTERNAL_ERROR, outcome.getError().getCode());
        assertTrue(outcome.getError().getMessage().startsWith("Filling 'div' failed: "));
    }
}
