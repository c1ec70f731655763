package com.qiyi.webagent.server;

import com.alibaba.fastjson2.JSON;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.qiyi.webagent.tools.Tool;
import com.qiyi.webagent.tools.ToolExecutionService;
import com.qiyi.webagent.tools.ToolOutcome;
import com.qiyi.webagent.tools.ToolRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.io.StringWriter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RequestDispatcherTest {

    @Tool.Info(name = "ping", description = "reply with pong")
    static class PingTool implements Tool {
        @Override
        public ToolOutcome execute(JSONObject arguments) {
            JSONObject data = new JSONObject();
            data.put("reply", "pong");
            return ToolOutcome.ok("sess_ping00000000", data);
        }
    }

    @Tool.Info(name = "pong", description = "second tool")
    static class PongTool implements Tool {
        @Override
        public ToolOutcome execute(JSONObject arguments) {
            return ToolOutcome.ok(null, new JSONObject());
        }
    }

    private RequestDispatcher dispatcher;

    @BeforeEach
    public void setUp() {
        ToolRegistry registry = new ToolRegistry();
        registry.register(new PingTool());
        registry.register(new PongTool());
        dispatcher = new RequestDispatcher(new ToolExecutionService(registry));
    }

    private static JSONObject parse(McpResponse response) {
        return JSON.parseObject(response.toJson());
    }

    @Test
    public void initializeShouldDescribeServerAndListToolNamesInOrder() {
        JSONObject out = parse(dispatcher.dispatch("{\"id\":1,\"method\":\"initialize\"}"));

        assertEquals(1, out.getIntValue("id"));
        JSONObject result = out.getJSONObject("result");
        assertEquals("mcp-web-automation", result.getString("name"));
        assertEquals("0.1.0", result.getString("version"));
        assertEquals("stdio", result.getString("mcp_protocol"));
        assertEquals("ping", result.getJSONArray("tools").getString(0));
        assertEquals("pong", result.getJSONArray("tools").getString(1));
    }

    @Test
    public void toolsListShouldReturnDescriptors() {
        JSONObject out = parse(dispatcher.dispatch("{\"id\":\"a\",\"method\":\"tools/list\"}"));

        JSONArray tools = out.getJSONObject("result").getJSONArray("tools");
        assertEquals(2, tools.size());
        assertEquals("reply with pong", tools.getJSONObject(0).getString("description"));
        assertTrue(tools.getJSONObject(0).containsKey("input_schema"));
    }

    @Test
    public void toolsCallShouldReturnTheEnvelope() {
        JSONObject out = parse(dispatcher.dispatch(
                "{\"id\":7,\"method\":\"tools/call\",\"params\":{\"name\":\"ping\",\"arguments\":{}}}"));

        JSONObject result = out.getJSONObject("result");
        assertTrue(result.getBooleanValue("ok"));
        assertEquals("ping", result.getString("tool"));
        assertEquals("sess_ping00000000", result.getString("session_id"));
        assertEquals("pong", result.getJSONObject("data").getString("reply"));
        assertTrue(result.getJSONObject("meta").containsKey("ts"));
    }

    @Test
    public void unknownToolShouldBeAResultNotAProtocolError() {
        JSONObject out = parse(dispatcher.dispatch(
                "{\"id\":8,\"method\":\"tools/call\",\"params\":{\"name\":\"nope\"}}"));

        JSONObject result = out.getJSONObject("result");
        assertFalse(result.getBooleanValue("ok"));
        assertEquals("Unknown tool: nope", result.getJSONObject("error").getString("message"));
    }

    @Test
    public void badCallParamsShouldKeepRequestId() {
        JSONObject out = parse(dispatcher.dispatch(
                "{\"id\":9,\"method\":\"tools/call\",\"params\":{\"arguments\":[]}}"));

        assertEquals(9, out.getIntValue("id"));
        JSONObject error = out.getJSONObject("error");
        assertEquals("INTERNAL_ERROR", error.getString("code"));
        assertEquals("Invalid parameters", error.getString("message"));
        assertEquals(2, error.getJSONArray("details").size());
    }

    @Test
    public void unknownMethodShouldBeAnError() {
        JSONObject out = parse(dispatcher.dispatch("{\"id\":3,\"method\":\"resources/list\"}"));

        assertEquals("Unknown method: resources/list", out.getJSONObject("error").getString("message"));
        assertFalse(out.containsKey("result"));
    }

    @Test
    public void malformedPayloadsShouldAnswerWithNullId() {
        String[] bad = {
                "not json",
                "[1,2,3]",
                "{\"id\":1}",
                "{\"id\":{\"x\":1},\"method\":\"initialize\"}",
                "{\"id\":1,\"method\":\"initialize\",\"params\":\"x\"}"
        };
        for (String line : bad) {
            McpResponse response = dispatcher.dispatch(line);
            String json = response.toJson();
            assertTrue(json.contains("\"id\":null"), json);
            JSONObject error = JSON.parseObject(json).getJSONObject("error");
            assertEquals("Invalid request payload", error.getString("message"));
            assertFalse(error.getJSONArray("details").isEmpty());
        }
    }

    @Test
    public void blankLineShouldProduceNoResponse() {
        assertNull(dispatcher.dispatch("   "));
    }

    @Test
    public void serveShouldKeepGoingAfterAMalformedLine() throws Exception {
        String input = "garbage\n"
                + "\n"
                + "{\"id\":2,\"method\":\"initialize\"}\n";
        StringWriter out = new StringWriter();

        dispatcher.serve(new StringReader(input), out);

        String[] lines = out.toString().split("\n");
        assertEquals(2, lines.length);
        JSONObject first = JSON.parseObject(lines[0]);
        assertTrue(first.containsKey("id"));
        assertNull(first.get("id"));
        assertEquals("INTERNAL_ERROR", first.getJSONObject("error").getString("code"));

        JSONObject second = JSON.parseObject(lines[1]);
        assertEquals(2, second.getIntValue("id"));
        assertEquals("mcp-web-automation", second.getJSONObject("result").getString("name"));
    }
}
