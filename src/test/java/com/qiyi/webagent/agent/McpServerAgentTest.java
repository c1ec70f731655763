package com.qiyi.webagent.agent;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONObject;
import com.microsoft.playwright.BrowserContext;
import com.microsoft.playwright.Page;
import com.qiyi.webagent.browser.BrowserSession;
import com.qiyi.webagent.browser.BrowserSessionManager;
import com.qiyi.webagent.config.AppConfig;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class McpServerAgentTest {

    @Test
    public void shouldAnswerEachLineAndReleaseSessionsOnStop() {
        BrowserSessionManager sessionManager = mock(BrowserSessionManager.class);
        when(sessionManager.resolve(any())).thenReturn(
                new BrowserSession("sess_00000000beef", mock(BrowserContext.class), mock(Page.class)));
        String input = "{\"id\":1,\"method\":\"initialize\"}\n"
                + "{\"id\":2,\"method\":\"tools/call\",\"params\":{\"name\":\"navigate\",\"arguments\":{\"url\":\"ftp://x\"}}}\n";
        ByteArrayOutputStream out = new ByteArrayOutputStream();

        McpServerAgent agent = new McpServerAgent(sessionManager, new AppConfig(new Properties()),
                new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)), out);
        agent.start();
        assertTrue(agent.isRunning());
        agent.stop();
        agent.stop();

        String[] lines = new String(out.toByteArray(), StandardCharsets.UTF_8).split("\n");
        assertEquals(2, lines.length);
        JSONObject init = JSON.parseObject(lines[0]);
        assertEquals(6, init.getJSONObject("result").getJSONArray("tools").size());

        JSONObject call = JSON.parseObject(lines[1]).getJSONObject("result");
        assertFalse(call.getBooleanValue("ok"));
        assertEquals("INVALID_URL", call.getJSONObject("error").getString("code"));
        assertFalse(call.containsKey("session_id"));

        assertFalse(agent.isRunning());
        verify(sessionManager, times(1)).shutdown();
    }
}
