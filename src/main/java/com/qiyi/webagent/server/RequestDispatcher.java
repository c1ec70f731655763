package com.qiyi.webagent.server;

import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;
import com.qiyi.webagent.tools.ToolCallResult;
import com.qiyi.webagent.tools.ToolError;
import com.qiyi.webagent.tools.ToolErrorCode;
import com.qiyi.webagent.tools.ToolExecutionService;
import com.qiyi.webagent.tools.ToolRegistry;
import com.qiyi.webagent.util.AppLog;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.LinkedHashMap;

/**
 * 行分隔 JSON 协议分发器：每读入一行请求，恰好写出一行响应。
 *
 * <p>支持的方法：</p>
 * <ul>
 *     <li>{@code initialize}：服务信息 + 工具名列表</li>
 *     <li>{@code tools/list}：工具描述列表</li>
 *     <li>{@code tools/call}：执行工具，result 为统一信封</li>
 * </ul>
 *
 * <p>非法请求行返回 {@code id:null} 的错误响应，循环继续；读到输入结束时返回。</p>
 */
public class RequestDispatcher {
    public static final String SERVER_NAME = "mcp-web-automation";
    public static final String SERVER_VERSION = "0.1.0";
    public static final String PROTOCOL = "stdio";

    public static final String METHOD_INITIALIZE = "initialize";
    public static final String METHOD_TOOLS_LIST = "tools/list";
    public static final String METHOD_TOOLS_CALL = "tools/call";

    private final ToolExecutionService executionService;

    public RequestDispatcher(ToolExecutionService executionService) {
        this.executionService = executionService;
    }

    public void serve(Reader in, Writer out) throws IOException {
        BufferedReader reader = in instanceof BufferedReader ? (BufferedReader) in : new BufferedReader(in);
        String raw;
        int handled = 0;
        while ((raw = reader.readLine()) != null) {
            McpResponse response = dispatch(raw);
            if (response == null) continue;
            out.write(response.toJson());
            out.write("\n");
            out.flush();
            handled++;
        }
        AppLog.info("[mcp] input closed, handled=" + handled);
    }

    /**
     * 处理一行原始输入；空行返回 null（不响应）。
     */
    public McpResponse dispatch(String rawLine) {
        String line = rawLine == null ? "" : rawLine.trim();
        if (line.isEmpty()) {
            return null;
        }

        McpRequest request;
        try {
            request = McpRequest.parse(line);
        } catch (InvalidRequestException e) {
            AppLog.warn("[mcp] invalid_request: details=" + e.getDetails());
            return McpResponse.error(null, errorPayload(e.getMessage(), e.getDetails()));
        }

        try {
            return handle(request);
        } catch (InvalidRequestException e) {
            return McpResponse.error(request.getId(), errorPayload(e.getMessage(), e.getDetails()));
        } catch (Exception | LinkageError e) {
            AppLog.error("[mcp] request_failure: method=" + request.getMethod(), e);
            return McpResponse.error(request.getId(), ToolError.from(e).toJson());
        }
    }

    public McpResponse handle(McpRequest request) throws InvalidRequestException {
        String method = request.getMethod();
        AppLog.debug("[mcp] request: id=" + request.getId() + ", method=" + method);
        ToolRegistry registry = executionService.getRegistry();

        if (METHOD_INITIALIZE.equals(method)) {
            JSONObject result = new JSONObject();
            result.put("name", SERVER_NAME);
            result.put("version", SERVER_VERSION);
            result.put("mcp_protocol", PROTOCOL);
            result.put("tools", new JSONArray(registry.names()));
            return McpResponse.result(request.getId(), result);
        }

        if (METHOD_TOOLS_LIST.equals(method)) {
            JSONObject result = new JSONObject();
            result.put("tools", registry.descriptors());
            return McpResponse.result(request.getId(), result);
        }

        if (METHOD_TOOLS_CALL.equals(method)) {
            JSONObject params = request.getParams();
            JSONArray problems = new JSONArray();
            Object name = params.get("name");
            if (name == null) {
                problems.add(McpRequest.problem("name", "Field required"));
            } else if (!(name instanceof String)) {
                problems.add(McpRequest.problem("name", "Input should be a valid string"));
            }
            Object arguments = params.get("arguments");
            if (arguments != null && !(arguments instanceof JSONObject)) {
                problems.add(McpRequest.problem("arguments", "Input should be a valid dictionary"));
            }
            if (!problems.isEmpty()) {
                throw new InvalidRequestException("Invalid parameters", problems);
            }

            ToolCallResult result = executionService.call((String) name, (JSONObject) arguments);
            return McpResponse.result(request.getId(), result.toJson());
        }

        JSONObject error = ToolError.of(ToolErrorCode.INTERNAL_ERROR, "Unknown method: " + method).toJson();
        return McpResponse.error(request.getId(), error);
    }

    private static JSONObject errorPayload(String message, JSONArray details) {
        JSONObject error = new JSONObject(new LinkedHashMap<>());
        error.put("code", ToolErrorCode.INTERNAL_ERROR.name());
        error.put("message", message);
        error.put("details", details);
        return error;
    }
}
